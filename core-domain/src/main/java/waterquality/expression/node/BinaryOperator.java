package waterquality.expression.node;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.function.DoubleBinaryOperator;

/**
 * Operadores binarios del lenguaje de expresiones. {@code ^} es exponenciación
 * (nunca XOR) y asocia por la derecha.
 */
@Getter
@RequiredArgsConstructor
public enum BinaryOperator {

    ADD("+", Precedence.ADDITIVE, false, Double::sum),
    SUBTRACT("-", Precedence.ADDITIVE, false, (a, b) -> a - b),
    MULTIPLY("*", Precedence.MULTIPLICATIVE, false, (a, b) -> a * b),
    DIVIDE("/", Precedence.MULTIPLICATIVE, false, (a, b) -> a / b),
    POWER("^", Precedence.POWER, true, Math::pow);

    private final String symbol;
    private final int precedence;
    private final boolean rightAssociative;
    private final DoubleBinaryOperator operation;

    public double apply(double left, double right) {
        return operation.applyAsDouble(left, right);
    }
}
