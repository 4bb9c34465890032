package waterquality.domain.variable;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import waterquality.domain.exception.InvalidArgumentException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coeficiente con un valor global y valores particulares para tuberías o depósitos
 * concretos.
 */
@Getter
@EqualsAndHashCode(callSuper = true, onlyExplicitlyIncluded = true)
public final class Parameter extends ReactionVariable {

    @Setter
    @EqualsAndHashCode.Include
    private double globalValue;

    @Setter
    @EqualsAndHashCode.Include
    private String units;

    /** Valores por nombre de tubería, solo donde difieren del global. Mutable. */
    @EqualsAndHashCode.Include
    private final Map<String, Double> pipeValues;

    /** Valores por nombre de depósito, solo donde difieren del global. Mutable. */
    @EqualsAndHashCode.Include
    private final Map<String, Double> tankValues;

    @Builder
    public Parameter(String name, double globalValue, String note, String units,
                     Map<String, Double> pipeValues, Map<String, Double> tankValues) {
        super(name, note);
        this.globalValue = globalValue;
        this.units = units;
        this.pipeValues = pipeValues != null ? new LinkedHashMap<>(pipeValues) : new LinkedHashMap<>();
        this.tankValues = tankValues != null ? new LinkedHashMap<>(tankValues) : new LinkedHashMap<>();
    }

    @Override
    public VariableType getVarType() {
        return VariableType.PARAMETER;
    }

    public double getValue() {
        return globalValue;
    }

    /**
     * Valor en una tubería o en un depósito. Si el elemento no tiene un valor propio
     * (o no se indica ninguno) se devuelve el valor global.
     *
     * @param pipe nombre de la tubería, o {@code null}.
     * @param tank nombre del depósito, o {@code null}.
     * @throws InvalidArgumentException si se indican tubería y depósito a la vez.
     */
    public double getValue(String pipe, String tank) {
        if (pipe != null && tank != null) {
            throw new InvalidArgumentException(
                    "No se puede pedir el valor de una tubería y un depósito a la vez; uno de los dos debe ser nulo");
        }
        if (pipe != null) {
            return pipeValues.getOrDefault(pipe, globalValue);
        }
        if (tank != null) {
            return tankValues.getOrDefault(tank, globalValue);
        }
        return globalValue;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> rep = new LinkedHashMap<>();
        rep.put("name", getName());
        rep.put("global_value", globalValue);
        rep.put("units", units);
        rep.put("note", getNote());
        rep.put("pipe_values", new LinkedHashMap<>(pipeValues));
        rep.put("tank_values", new LinkedHashMap<>(tankValues));
        return rep;
    }
}
