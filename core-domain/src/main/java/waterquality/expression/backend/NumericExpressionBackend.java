package waterquality.expression.backend;

import waterquality.expression.CompiledExpression;
import waterquality.expression.MathFunction;
import waterquality.expression.node.BinaryNode;
import waterquality.expression.node.BinaryOperator;
import waterquality.expression.node.ExpressionNode;
import waterquality.expression.node.FunctionNode;
import waterquality.expression.node.NegateNode;
import waterquality.expression.node.NodeVisitor;
import waterquality.expression.node.NumberNode;
import waterquality.expression.node.SymbolNode;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Backend de respaldo: compila el árbol a una cadena de cierres sobre {@link Math}.
 * Solo evalúa; no ofrece manipulación simbólica.
 */
public final class NumericExpressionBackend extends AbstractExpressionBackend {

    public static final String NAME = "numeric";

    private static final Map<MathFunction, DoubleUnaryOperator> FUNCTIONS = buildFunctions();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isSymbolic() {
        return false;
    }

    @Override
    public CompiledExpression simplify(CompiledExpression expression) {
        throw new UnsupportedOperationException(
                "El backend numérico no admite manipulación simbólica (modo degradado).");
    }

    @Override
    protected CompiledExpression.Evaluator createEvaluator(ExpressionNode tree, String source) {
        return tree.accept(new NodeVisitor<CompiledExpression.Evaluator>() {
            @Override
            public CompiledExpression.Evaluator visitNumber(NumberNode node) {
                double value = node.getValue();
                return bindings -> value;
            }

            @Override
            public CompiledExpression.Evaluator visitSymbol(SymbolNode node) {
                String name = node.getName();
                return bindings -> lookup(bindings, name, source);
            }

            @Override
            public CompiledExpression.Evaluator visitNegate(NegateNode node) {
                CompiledExpression.Evaluator operand = node.getOperand().accept(this);
                return bindings -> -operand.evaluate(bindings);
            }

            @Override
            public CompiledExpression.Evaluator visitBinary(BinaryNode node) {
                CompiledExpression.Evaluator left = node.getLeft().accept(this);
                CompiledExpression.Evaluator right = node.getRight().accept(this);
                BinaryOperator op = node.getOperator();
                return bindings -> op.apply(left.evaluate(bindings), right.evaluate(bindings));
            }

            @Override
            public CompiledExpression.Evaluator visitFunction(FunctionNode node) {
                CompiledExpression.Evaluator argument = node.getArgument().accept(this);
                DoubleUnaryOperator f = FUNCTIONS.get(node.getFunction());
                return bindings -> f.applyAsDouble(argument.evaluate(bindings));
            }
        });
    }

    private static Map<MathFunction, DoubleUnaryOperator> buildFunctions() {
        Map<MathFunction, DoubleUnaryOperator> table = new EnumMap<>(MathFunction.class);
        table.put(MathFunction.ABS, Math::abs);
        table.put(MathFunction.SGN, Math::signum);
        table.put(MathFunction.SQRT, Math::sqrt);
        table.put(MathFunction.STEP, x -> x <= 0 ? 0.0 : 1.0);
        table.put(MathFunction.LOG, Math::log);
        table.put(MathFunction.EXP, Math::exp);
        table.put(MathFunction.SIN, Math::sin);
        table.put(MathFunction.COS, Math::cos);
        table.put(MathFunction.TAN, Math::tan);
        table.put(MathFunction.COT, x -> 1.0 / Math.tan(x));
        table.put(MathFunction.ASIN, Math::asin);
        table.put(MathFunction.ACOS, Math::acos);
        table.put(MathFunction.ATAN, Math::atan);
        table.put(MathFunction.ACOT, x -> Math.atan(1.0 / x));
        table.put(MathFunction.SINH, Math::sinh);
        table.put(MathFunction.COSH, Math::cosh);
        table.put(MathFunction.TANH, Math::tanh);
        table.put(MathFunction.COTH, x -> 1.0 / Math.tanh(x));
        // log10 directo, no log(x)/log(10)
        table.put(MathFunction.LOG10, Math::log10);
        return table;
    }
}
