package waterquality.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Funciones matemáticas de una variable reconocidas en las expresiones MSX.
 * Los nombres no distinguen mayúsculas: "log", "LOG" y "Log" son la misma función.
 */
@Getter
@RequiredArgsConstructor
public enum MathFunction {

    ABS("abs", "absolute value"),
    SGN("sgn", "sign"),
    SQRT("sqrt", "square root"),
    STEP("step", "step function: 0 for x <= 0, 1 otherwise"),
    LOG("log", "natural logarithm"),
    EXP("exp", "e raised to a power"),
    SIN("sin", "sine"),
    COS("cos", "cosine"),
    TAN("tan", "tangent"),
    COT("cot", "cotangent"),
    ASIN("asin", "arcsine"),
    ACOS("acos", "arccosine"),
    ATAN("atan", "arctangent"),
    ACOT("acot", "arccotangent"),
    SINH("sinh", "hyperbolic sine"),
    COSH("cosh", "hyperbolic cosine"),
    TANH("tanh", "hyperbolic tangent"),
    COTH("coth", "hyperbolic cotangent"),
    LOG10("log10", "base-10 logarithm");

    private final String symbol;
    private final String note;

    private static final Map<String, MathFunction> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MathFunction::getSymbol, Function.identity()));

    /**
     * @return la función con ese nombre (sin distinguir mayúsculas), o {@code null}.
     */
    public static MathFunction fromName(String name) {
        return name == null ? null : BY_SYMBOL.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Las tres grafías registradas para la función: minúsculas, MAYÚSCULAS y Capitalizada.
     */
    public String[] spellings() {
        return new String[]{
                symbol,
                symbol.toUpperCase(Locale.ROOT),
                symbol.substring(0, 1).toUpperCase(Locale.ROOT) + symbol.substring(1)
        };
    }
}
