package waterquality.expression;

import waterquality.domain.exception.ExpressionCompileException;
import waterquality.expression.node.ExpressionNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Sustituye las referencias a términos (TERMS de MSX) por su expresión, recursivamente.
 * <p>
 * Un término que se referencia a sí mismo, directa o indirectamente, es un error de
 * compilación. Cada término se analiza y expande una sola vez por llamada.
 */
public final class TermExpander {

    private final Function<String, String> termLookup;
    private final Map<String, ExpressionNode> expanded = new HashMap<>();
    private final Deque<String> inProgress = new ArrayDeque<>();

    /**
     * @param termLookup devuelve la expresión del término con ese nombre, o {@code null} si el nombre no es un término.
     */
    public TermExpander(Function<String, String> termLookup) {
        this.termLookup = termLookup;
    }

    public ExpressionNode expand(ExpressionNode tree, String source) {
        Map<String, ExpressionNode> replacements = new HashMap<>();
        for (String symbol : tree.freeSymbols()) {
            String termExpression = termLookup.apply(symbol);
            if (termExpression != null) {
                replacements.put(symbol, expandTerm(symbol, termExpression, source));
            }
        }
        return replacements.isEmpty() ? tree : tree.substitute(replacements);
    }

    private ExpressionNode expandTerm(String name, String termExpression, String source) {
        ExpressionNode done = expanded.get(name);
        if (done != null) {
            return done;
        }
        if (inProgress.contains(name)) {
            throw new ExpressionCompileException(
                    "Definición circular del término '" + name + "' (" + String.join(" -> ", inProgress) + " -> " + name + ")",
                    source);
        }
        inProgress.addLast(name);
        ExpressionNode result = expand(ExpressionParser.parse(termExpression), source);
        inProgress.removeLast();
        expanded.put(name, result);
        return result;
    }
}
