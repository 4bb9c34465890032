package waterquality.domain.reaction;

import lombok.EqualsAndHashCode;

/**
 * La expresión es la tasa de cambio de la concentración: dC/dt = expresión.
 */
@EqualsAndHashCode(callSuper = true)
public final class RateDynamics extends ReactionDynamics {

    public RateDynamics(String species, LocationType location, String expression, String note) {
        super(species, location, expression, note);
    }

    @Override
    public DynamicsType getDynamics() {
        return DynamicsType.RATE;
    }
}
