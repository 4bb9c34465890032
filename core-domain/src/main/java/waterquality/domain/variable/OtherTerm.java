package waterquality.domain.variable;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Término con nombre: un alias de una subexpresión que se sustituye dentro de otras
 * expresiones (los TERMS de EPANET-MSX).
 */
@Getter
@EqualsAndHashCode(callSuper = true, onlyExplicitlyIncluded = true)
public final class OtherTerm extends ReactionVariable {

    @EqualsAndHashCode.Include
    private String expression;

    public OtherTerm(String name, String expression, String note) {
        super(name, note);
        this.expression = expression;
    }

    public OtherTerm(String name, String expression) {
        this(name, expression, null);
    }

    /**
     * Cambia la expresión y avisa al modelo, que invalida las reacciones compiladas.
     */
    public void setExpression(String expression) {
        this.expression = expression;
        notifyOwner();
    }

    @Override
    public VariableType getVarType() {
        return VariableType.TERM;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> rep = new LinkedHashMap<>();
        rep.put("name", getName());
        rep.put("expression", expression);
        rep.put("note", getNote());
        return rep;
    }
}
