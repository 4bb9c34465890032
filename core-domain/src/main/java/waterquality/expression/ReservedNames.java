package waterquality.expression;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Nombres que no pueden usarse para variables de usuario:
 * <ul>
 * <li>Los símbolos de {@link HydraulicVariable} (tal cual se escriben).</li>
 * <li>Los nombres de {@link MathFunction}, en cualquier capitalización.</li>
 * <li>Los cinco nombres internos del álgebra simbólica, tal cual: Mul, Add, Pow, Integer, Float.</li>
 * </ul>
 * Los símbolos hidráulicos se comparan con su grafía exacta, igual que en la tabla de
 * símbolos de EPANET-MSX: {@code d} o {@code LEN} son nombres de usuario válidos.
 */
public final class ReservedNames {

    public static final Set<String> ALGEBRA_NAMES = Set.of("Mul", "Add", "Pow", "Integer", "Float");

    /**
     * Forma enumerable de los nombres reservados (funciones en sus tres grafías registradas).
     */
    public static final Set<String> ALL = buildAll();

    private ReservedNames() {
    }

    public static boolean isReserved(String name) {
        if (name == null) {
            return false;
        }
        return HydraulicVariable.fromSymbol(name) != null
                || MathFunction.fromName(name) != null
                || ALGEBRA_NAMES.contains(name);
    }

    private static Set<String> buildAll() {
        Set<String> names = new LinkedHashSet<>();
        Arrays.stream(HydraulicVariable.values()).map(HydraulicVariable::getSymbol).forEach(names::add);
        names.addAll(Arrays.stream(MathFunction.values())
                .flatMap(f -> Arrays.stream(f.spellings()))
                .collect(Collectors.toCollection(LinkedHashSet::new)));
        names.addAll(ALGEBRA_NAMES);
        return Set.copyOf(names);
    }
}
