package waterquality.expression.node;

import waterquality.expression.MathFunction;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/**
 * Nodo del árbol sintáctico de una expresión MSX.
 * <p>
 * Los nodos son inmutables: {@link #substitute(Map)} y {@link #fold()} devuelven árboles nuevos
 * (compartiendo los subárboles que no cambian).
 */
public abstract class ExpressionNode {

    /**
     * Precedencia usada al renderizar: un hijo con precedencia menor que la del padre
     * se encierra entre paréntesis.
     */
    public abstract int precedence();

    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * Sustituye símbolos por subárboles. Los símbolos que no estén en el mapa se conservan.
     */
    public abstract ExpressionNode substitute(Map<String, ExpressionNode> replacements);

    /**
     * Plegado de constantes: toda operación cuyos operandos sean literales se evalúa.
     * Las llamadas a función se pliegan con {@code functions}; si es {@code null} se conservan.
     */
    public abstract ExpressionNode fold(Map<MathFunction, DoubleUnaryOperator> functions);

    public ExpressionNode fold() {
        return fold(null);
    }

    /**
     * Vuelve a escribir el árbol en sintaxis infija MSX ({@code ^} para potencias).
     */
    public String render() {
        StringBuilder out = new StringBuilder();
        renderTo(out);
        return out.toString();
    }

    protected abstract void renderTo(StringBuilder out);

    /**
     * Símbolos libres del árbol, en orden de aparición.
     */
    public Set<String> freeSymbols() {
        Set<String> names = new LinkedHashSet<>();
        collectSymbols(names);
        return names;
    }

    protected abstract void collectSymbols(Set<String> names);

    protected static void renderChild(StringBuilder out, ExpressionNode child, int parentPrecedence) {
        if (child.precedence() < parentPrecedence) {
            out.append('(');
            child.renderTo(out);
            out.append(')');
        } else {
            child.renderTo(out);
        }
    }

    @Override
    public String toString() {
        return render();
    }
}
