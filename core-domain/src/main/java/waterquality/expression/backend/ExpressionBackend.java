package waterquality.expression.backend;

import waterquality.expression.CompiledExpression;
import waterquality.expression.ExpressionParser;
import waterquality.expression.SymbolTable;
import waterquality.expression.node.ExpressionNode;

import java.util.Map;

/**
 * Capacidad de compilar y evaluar expresiones MSX.
 * <p>
 * Hay dos implementaciones: {@link SymbolicExpressionBackend} (apoyado en commons-math3,
 * admite manipulación simbólica) y {@link NumericExpressionBackend} (solo {@link Math},
 * usado en modo degradado). Se eligen con {@link ExpressionBackends}.
 */
public interface ExpressionBackend {

    String getName();

    /**
     * @return {@code true} si el backend admite manipulación simbólica ({@link #simplify}).
     */
    boolean isSymbolic();

    /**
     * Analiza el texto y enlaza sus símbolos contra la tabla.
     *
     * @throws waterquality.domain.exception.ExpressionCompileException si la expresión está mal
     *                                                                  formada o usa símbolos no declarados.
     */
    default CompiledExpression parse(String expression, SymbolTable symbols) {
        return compile(ExpressionParser.parse(expression), expression, symbols);
    }

    /**
     * Enlaza un árbol ya construido (p.ej. tras expandir términos).
     */
    CompiledExpression compile(ExpressionNode tree, String source, SymbolTable symbols);

    default double evaluate(CompiledExpression expression, Map<String, Double> bindings) {
        return expression.evaluate(bindings);
    }

    /**
     * Plegado de constantes sobre la expresión compilada.
     *
     * @throws UnsupportedOperationException si el backend no es simbólico.
     */
    CompiledExpression simplify(CompiledExpression expression);
}
