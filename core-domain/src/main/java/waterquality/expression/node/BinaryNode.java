package waterquality.expression.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import waterquality.expression.MathFunction;

import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class BinaryNode extends ExpressionNode {

    private final BinaryOperator operator;
    private final ExpressionNode left;
    private final ExpressionNode right;

    public BinaryNode(BinaryOperator operator, ExpressionNode left, ExpressionNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public int precedence() {
        return operator.getPrecedence();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public ExpressionNode substitute(Map<String, ExpressionNode> replacements) {
        ExpressionNode l = left.substitute(replacements);
        ExpressionNode r = right.substitute(replacements);
        return (l == left && r == right) ? this : new BinaryNode(operator, l, r);
    }

    @Override
    public ExpressionNode fold(Map<MathFunction, DoubleUnaryOperator> functions) {
        ExpressionNode l = left.fold(functions);
        ExpressionNode r = right.fold(functions);
        if (l instanceof NumberNode a && r instanceof NumberNode b) {
            return new NumberNode(operator.apply(a.getValue(), b.getValue()));
        }
        return (l == left && r == right) ? this : new BinaryNode(operator, l, r);
    }

    @Override
    protected void renderTo(StringBuilder out) {
        int p = precedence();
        // El lado "no asociativo" necesita paréntesis también con igual precedencia: a-(b-c), (a^b)^c
        if (operator.isRightAssociative()) {
            renderChild(out, left, p + 1);
        } else {
            renderChild(out, left, p);
        }
        out.append(' ').append(operator.getSymbol()).append(' ');
        if (operator.isRightAssociative()) {
            renderChild(out, right, p);
        } else {
            renderChild(out, right, p + 1);
        }
    }

    @Override
    protected void collectSymbols(Set<String> names) {
        left.collectSymbols(names);
        right.collectSymbols(names);
    }
}
