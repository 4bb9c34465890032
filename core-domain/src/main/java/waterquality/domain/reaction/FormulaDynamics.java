package waterquality.domain.reaction;

import lombok.EqualsAndHashCode;

/**
 * La concentración es una función directa del resto de especies: C = expresión.
 */
@EqualsAndHashCode(callSuper = true)
public final class FormulaDynamics extends ReactionDynamics {

    public FormulaDynamics(String species, LocationType location, String expression, String note) {
        super(species, location, expression, note);
    }

    @Override
    public DynamicsType getDynamics() {
        return DynamicsType.FORMULA;
    }
}
