package waterquality.expression;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import waterquality.expression.backend.ExpressionBackend;
import waterquality.expression.node.ExpressionNode;

import java.util.Map;
import java.util.Set;

/**
 * Expresión ya analizada y enlazada por un {@link ExpressionBackend}.
 * <p>
 * Guarda el texto original, el árbol (con los términos ya expandidos si procede) y el
 * evaluador que el backend ha preparado para ese árbol.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class CompiledExpression {

    /**
     * Evaluador preparado por el backend. Recibe los valores de los símbolos libres.
     */
    @FunctionalInterface
    public interface Evaluator {
        double evaluate(Map<String, Double> bindings);
    }

    private final String source;

    @EqualsAndHashCode.Include
    private final ExpressionNode tree;

    private final Set<String> freeSymbols;

    @EqualsAndHashCode.Include
    private final String backendName;

    @Getter(AccessLevel.NONE)
    private final Evaluator evaluator;

    public CompiledExpression(String source, ExpressionNode tree, String backendName, Evaluator evaluator) {
        this.source = source;
        this.tree = tree;
        this.freeSymbols = tree.freeSymbols();
        this.backendName = backendName;
        this.evaluator = evaluator;
    }

    /**
     * @throws waterquality.domain.exception.ExpressionCompileException si falta el valor de algún símbolo libre.
     */
    public double evaluate(Map<String, Double> bindings) {
        return evaluator.evaluate(bindings);
    }

    public String render() {
        return tree.render();
    }

    @Override
    public String toString() {
        return render();
    }
}
