package waterquality.expression.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import waterquality.expression.MathFunction;

import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/**
 * Referencia a una variable por nombre. La posición en el texto original sirve
 * solo para los mensajes de error y no forma parte de la igualdad.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class SymbolNode extends ExpressionNode {

    private final String name;

    @EqualsAndHashCode.Exclude
    private final int position;

    public SymbolNode(String name, int position) {
        this.name = name;
        this.position = position;
    }

    public SymbolNode(String name) {
        this(name, -1);
    }

    @Override
    public int precedence() {
        return Precedence.ATOM;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    public ExpressionNode substitute(Map<String, ExpressionNode> replacements) {
        ExpressionNode replacement = replacements.get(name);
        return replacement != null ? replacement : this;
    }

    @Override
    public ExpressionNode fold(Map<MathFunction, DoubleUnaryOperator> functions) {
        return this;
    }

    @Override
    protected void renderTo(StringBuilder out) {
        out.append(name);
    }

    @Override
    protected void collectSymbols(Set<String> names) {
        names.add(name);
    }
}
