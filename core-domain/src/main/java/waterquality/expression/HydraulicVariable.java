package waterquality.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Variables hidráulicas que el motor hidráulico proporciona en cada paso de tiempo y que
 * están disponibles en cualquier expresión. Sus símbolos son nombres reservados.
 */
@Getter
@RequiredArgsConstructor
public enum HydraulicVariable {

    DIAMETER("D", "pipe diameter (feet or meters)"),
    ROUGHNESS("Kc", "pipe roughness coefficient (unitless for Hazen-Williams or Chezy-Manning head loss formulas, "
            + "millifeet or millimeters for Darcy-Weisbach head loss formula)"),
    FLOW("Q", "pipe flow rate (flow units)"),
    VELOCITY("U", "pipe flow velocity (ft/sec or m/sec)"),
    REYNOLDS("Re", "flow Reynolds number"),
    SHEAR_VELOCITY("Us", "pipe shear velocity (ft/sec or m/sec)"),
    FRICTION_FACTOR("Ff", "Darcy-Weisbach friction factor"),
    AREA_PER_VOLUME("Av", "Surface area per unit volume (area units/L)"),
    LENGTH("Len", "Pipe length (feet or meters)");

    private final String symbol;
    private final String note;

    private static final Map<String, HydraulicVariable> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(HydraulicVariable::getSymbol, Function.identity()));

    /**
     * Búsqueda exacta (sensible a mayúsculas) por símbolo.
     *
     * @return la variable, o {@code null} si el símbolo no es hidráulico.
     */
    public static HydraulicVariable fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }
}
