package waterquality.expression.backend;

import waterquality.domain.exception.ExpressionCompileException;
import waterquality.expression.CompiledExpression;
import waterquality.expression.ReservedNames;
import waterquality.expression.SymbolTable;
import waterquality.expression.node.BinaryNode;
import waterquality.expression.node.ExpressionNode;
import waterquality.expression.node.FunctionNode;
import waterquality.expression.node.NegateNode;
import waterquality.expression.node.NodeVisitor;
import waterquality.expression.node.NumberNode;
import waterquality.expression.node.SymbolNode;

import java.util.Map;
import java.util.Objects;

/**
 * Parte común de los backends: validación de símbolos contra la tabla y lectura de valores.
 */
abstract class AbstractExpressionBackend implements ExpressionBackend {

    @Override
    public CompiledExpression compile(ExpressionNode tree, String source, SymbolTable symbols) {
        Objects.requireNonNull(tree, "El árbol de la expresión no puede ser nulo.");
        Objects.requireNonNull(symbols, "La tabla de símbolos no puede ser nula.");
        checkSymbols(tree, source, symbols);
        return new CompiledExpression(source, tree, getName(), createEvaluator(tree, source));
    }

    protected abstract CompiledExpression.Evaluator createEvaluator(ExpressionNode tree, String source);

    protected static double lookup(Map<String, Double> bindings, String name, String source) {
        Double value = bindings == null ? null : bindings.get(name);
        if (value == null) {
            throw new ExpressionCompileException("El símbolo '" + name + "' no tiene valor", source);
        }
        return value;
    }

    private static void checkSymbols(ExpressionNode tree, String source, SymbolTable symbols) {
        tree.accept(new SymbolWalker() {
            @Override
            public Void visitSymbol(SymbolNode node) {
                String name = node.getName();
                if (ReservedNames.ALGEBRA_NAMES.contains(name)) {
                    throw new ExpressionCompileException("'" + name + "' es un nombre reservado", source, node.getPosition());
                }
                if (symbols.isStrict() && !symbols.isDeclared(name)) {
                    throw new ExpressionCompileException("Símbolo desconocido '" + name + "'", source, node.getPosition());
                }
                return null;
            }
        });
    }

    /**
     * Recorrido completo que solo actúa en los símbolos.
     */
    private abstract static class SymbolWalker implements NodeVisitor<Void> {

        @Override
        public Void visitNumber(NumberNode node) {
            return null;
        }

        @Override
        public Void visitNegate(NegateNode node) {
            return node.getOperand().accept(this);
        }

        @Override
        public Void visitBinary(BinaryNode node) {
            node.getLeft().accept(this);
            return node.getRight().accept(this);
        }

        @Override
        public Void visitFunction(FunctionNode node) {
            return node.getArgument().accept(this);
        }
    }
}
