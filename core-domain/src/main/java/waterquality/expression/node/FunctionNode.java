package waterquality.expression.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import waterquality.expression.MathFunction;

import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class FunctionNode extends ExpressionNode {

    private final MathFunction function;
    private final ExpressionNode argument;

    public FunctionNode(MathFunction function, ExpressionNode argument) {
        this.function = function;
        this.argument = argument;
    }

    @Override
    public int precedence() {
        return Precedence.ATOM;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public ExpressionNode substitute(Map<String, ExpressionNode> replacements) {
        ExpressionNode replaced = argument.substitute(replacements);
        return replaced == argument ? this : new FunctionNode(function, replaced);
    }

    @Override
    public ExpressionNode fold(Map<MathFunction, DoubleUnaryOperator> functions) {
        ExpressionNode folded = argument.fold(functions);
        if (functions != null && folded instanceof NumberNode number) {
            return new NumberNode(functions.get(function).applyAsDouble(number.getValue()));
        }
        return folded == argument ? this : new FunctionNode(function, folded);
    }

    @Override
    protected void renderTo(StringBuilder out) {
        out.append(function.getSymbol()).append('(');
        argument.renderTo(out);
        out.append(')');
    }

    @Override
    protected void collectSymbols(Set<String> names) {
        argument.collectSymbols(names);
    }
}
