package waterquality.domain.reaction;

import lombok.EqualsAndHashCode;

/**
 * Ecuación de equilibrio: 0 = expresión.
 */
@EqualsAndHashCode(callSuper = true)
public final class EquilibriumDynamics extends ReactionDynamics {

    public EquilibriumDynamics(String species, LocationType location, String expression, String note) {
        super(species, location, expression, note);
    }

    @Override
    public DynamicsType getDynamics() {
        return DynamicsType.EQUIL;
    }
}
