package waterquality.expression.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import waterquality.expression.MathFunction;

import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class NegateNode extends ExpressionNode {

    private final ExpressionNode operand;

    public NegateNode(ExpressionNode operand) {
        this.operand = operand;
    }

    @Override
    public int precedence() {
        return Precedence.UNARY;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNegate(this);
    }

    @Override
    public ExpressionNode substitute(Map<String, ExpressionNode> replacements) {
        ExpressionNode replaced = operand.substitute(replacements);
        return replaced == operand ? this : new NegateNode(replaced);
    }

    @Override
    public ExpressionNode fold(Map<MathFunction, DoubleUnaryOperator> functions) {
        ExpressionNode folded = operand.fold(functions);
        if (folded instanceof NumberNode number) {
            return new NumberNode(-number.getValue());
        }
        if (folded instanceof NegateNode inner) {
            return inner.getOperand();
        }
        return folded == operand ? this : new NegateNode(folded);
    }

    @Override
    protected void renderTo(StringBuilder out) {
        out.append('-');
        // "-(a+b)" y "-(-a)": el operando necesita paréntesis si no es más fuerte que el signo
        if (operand.precedence() <= Precedence.UNARY) {
            out.append('(');
            operand.renderTo(out);
            out.append(')');
        } else {
            operand.renderTo(out);
        }
    }

    @Override
    protected void collectSymbols(Set<String> names) {
        operand.collectSymbols(names);
    }
}
