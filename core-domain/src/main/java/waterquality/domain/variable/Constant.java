package waterquality.domain.variable;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coeficiente constante usado en las expresiones de reacción.
 */
@Getter
@Setter
@EqualsAndHashCode(callSuper = true, onlyExplicitlyIncluded = true)
public final class Constant extends ReactionVariable {

    @EqualsAndHashCode.Include
    private double globalValue;

    @EqualsAndHashCode.Include
    private String units;

    public Constant(String name, double globalValue, String note, String units) {
        super(name, note);
        this.globalValue = globalValue;
        this.units = units;
    }

    public Constant(String name, double globalValue) {
        this(name, globalValue, null, null);
    }

    @Override
    public VariableType getVarType() {
        return VariableType.CONSTANT;
    }

    public double getValue() {
        return globalValue;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> rep = new LinkedHashMap<>();
        rep.put("name", getName());
        rep.put("global_value", globalValue);
        rep.put("units", units);
        rep.put("note", getNote());
        return rep;
    }
}
