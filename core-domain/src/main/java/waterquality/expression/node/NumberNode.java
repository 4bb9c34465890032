package waterquality.expression.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import waterquality.expression.MathFunction;

import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class NumberNode extends ExpressionNode {

    private final double value;

    public NumberNode(double value) {
        this.value = value;
    }

    @Override
    public int precedence() {
        // Los negativos se tratan como un "-x" a efectos de paréntesis
        return value < 0 ? Precedence.UNARY : Precedence.ATOM;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public ExpressionNode substitute(Map<String, ExpressionNode> replacements) {
        return this;
    }

    @Override
    public ExpressionNode fold(Map<MathFunction, DoubleUnaryOperator> functions) {
        return this;
    }

    @Override
    protected void renderTo(StringBuilder out) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            out.append((long) value);
        } else {
            out.append(value);
        }
    }

    @Override
    protected void collectSymbols(Set<String> names) {
    }
}
