package waterquality.domain.variable;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable hidráulica o nombre de función reservado. El modelo las crea al construirse
 * para ocupar su nombre; no se escriben nunca a un fichero MSX.
 */
@Getter
@EqualsAndHashCode(callSuper = true, onlyExplicitlyIncluded = true)
public final class InternalVariable extends ReactionVariable {

    public static final String DEFAULT_NOTE = "internal variable - not output to MSX";

    private final String units;

    public InternalVariable(String name, String note, String units) {
        super(name, note, false);
        this.units = units;
    }

    public InternalVariable(String name, String note) {
        this(name, note, null);
    }

    @Override
    public VariableType getVarType() {
        return VariableType.RESERVED;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> rep = new LinkedHashMap<>();
        rep.put("name", getName());
        rep.put("units", units);
        rep.put("note", getNote());
        return rep;
    }
}
