package waterquality.expression.backend;

import org.apache.commons.math3.analysis.BivariateFunction;
import org.apache.commons.math3.analysis.FunctionUtils;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.function.Abs;
import org.apache.commons.math3.analysis.function.Acos;
import org.apache.commons.math3.analysis.function.Add;
import org.apache.commons.math3.analysis.function.Asin;
import org.apache.commons.math3.analysis.function.Atan;
import org.apache.commons.math3.analysis.function.Cos;
import org.apache.commons.math3.analysis.function.Cosh;
import org.apache.commons.math3.analysis.function.Divide;
import org.apache.commons.math3.analysis.function.Exp;
import org.apache.commons.math3.analysis.function.Inverse;
import org.apache.commons.math3.analysis.function.Log;
import org.apache.commons.math3.analysis.function.Log10;
import org.apache.commons.math3.analysis.function.Multiply;
import org.apache.commons.math3.analysis.function.Pow;
import org.apache.commons.math3.analysis.function.Signum;
import org.apache.commons.math3.analysis.function.Sin;
import org.apache.commons.math3.analysis.function.Sinh;
import org.apache.commons.math3.analysis.function.Sqrt;
import org.apache.commons.math3.analysis.function.StepFunction;
import org.apache.commons.math3.analysis.function.Subtract;
import org.apache.commons.math3.analysis.function.Tan;
import org.apache.commons.math3.analysis.function.Tanh;
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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Backend completo: conserva el árbol, lo evalúa con las funciones de
 * {@code org.apache.commons.math3.analysis.function} y permite simplificarlo.
 * <p>
 * El plegado de constantes es del propio árbol ({@link ExpressionNode#fold(Map)}); commons-math3
 * aporta las implementaciones de las funciones (sobre {@code FastMath}, incluidas cot, acot y coth
 * por composición) que se usan tanto al evaluar como al plegar, de modo que un árbol simplificado
 * da exactamente los mismos valores que el original.
 * <p>
 * Solo debe instanciarse si commons-math3 está en el classpath (ver {@link ExpressionBackends}).
 */
public final class SymbolicExpressionBackend extends AbstractExpressionBackend {

    public static final String NAME = "symbolic";

    private final Map<MathFunction, UnivariateFunction> functions = buildFunctions();
    private final Map<BinaryOperator, BivariateFunction> operators = buildOperators();
    private final Map<MathFunction, DoubleUnaryOperator> table = asTable(functions);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isSymbolic() {
        return true;
    }

    @Override
    public CompiledExpression simplify(CompiledExpression expression) {
        ExpressionNode folded = expression.getTree().fold(table);
        return new CompiledExpression(expression.getSource(), folded, NAME,
                createEvaluator(folded, expression.getSource()));
    }

    @Override
    protected CompiledExpression.Evaluator createEvaluator(ExpressionNode tree, String source) {
        return bindings -> tree.accept(new TreeEvaluator(bindings, source));
    }

    /**
     * Evaluación directa sobre el árbol.
     */
    private final class TreeEvaluator implements NodeVisitor<Double> {

        private final Map<String, Double> bindings;
        private final String source;

        private TreeEvaluator(Map<String, Double> bindings, String source) {
            this.bindings = bindings;
            this.source = source;
        }

        @Override
        public Double visitNumber(NumberNode node) {
            return node.getValue();
        }

        @Override
        public Double visitSymbol(SymbolNode node) {
            return lookup(bindings, node.getName(), source);
        }

        @Override
        public Double visitNegate(NegateNode node) {
            return -node.getOperand().accept(this);
        }

        @Override
        public Double visitBinary(BinaryNode node) {
            double left = node.getLeft().accept(this);
            double right = node.getRight().accept(this);
            return operators.get(node.getOperator()).value(left, right);
        }

        @Override
        public Double visitFunction(FunctionNode node) {
            return functions.get(node.getFunction()).value(node.getArgument().accept(this));
        }
    }

    private static Map<MathFunction, UnivariateFunction> buildFunctions() {
        // Tipado explícito: compose() tiene sobrecargas para funciones derivables
        UnivariateFunction inverse = new Inverse();
        UnivariateFunction tan = new Tan();
        UnivariateFunction atan = new Atan();
        UnivariateFunction tanh = new Tanh();
        Map<MathFunction, UnivariateFunction> f = new EnumMap<>(MathFunction.class);
        f.put(MathFunction.ABS, new Abs());
        f.put(MathFunction.SGN, new Signum());
        f.put(MathFunction.SQRT, new Sqrt());
        // 0 para x <= 0, 1 para x > 0
        f.put(MathFunction.STEP, new StepFunction(new double[]{0.0, Double.MIN_VALUE}, new double[]{0.0, 1.0}));
        f.put(MathFunction.LOG, new Log());
        f.put(MathFunction.EXP, new Exp());
        f.put(MathFunction.SIN, new Sin());
        f.put(MathFunction.COS, new Cos());
        f.put(MathFunction.TAN, tan);
        f.put(MathFunction.COT, FunctionUtils.compose(inverse, tan));
        f.put(MathFunction.ASIN, new Asin());
        f.put(MathFunction.ACOS, new Acos());
        f.put(MathFunction.ATAN, atan);
        f.put(MathFunction.ACOT, FunctionUtils.compose(atan, inverse));
        f.put(MathFunction.SINH, new Sinh());
        f.put(MathFunction.COSH, new Cosh());
        f.put(MathFunction.TANH, tanh);
        f.put(MathFunction.COTH, FunctionUtils.compose(inverse, tanh));
        f.put(MathFunction.LOG10, new Log10());
        return Collections.unmodifiableMap(f);
    }

    private static Map<BinaryOperator, BivariateFunction> buildOperators() {
        Map<BinaryOperator, BivariateFunction> ops = new EnumMap<>(BinaryOperator.class);
        ops.put(BinaryOperator.ADD, new Add());
        ops.put(BinaryOperator.SUBTRACT, new Subtract());
        ops.put(BinaryOperator.MULTIPLY, new Multiply());
        ops.put(BinaryOperator.DIVIDE, new Divide());
        ops.put(BinaryOperator.POWER, new Pow());
        return Collections.unmodifiableMap(ops);
    }

    private static Map<MathFunction, DoubleUnaryOperator> asTable(Map<MathFunction, UnivariateFunction> functions) {
        Map<MathFunction, DoubleUnaryOperator> t = new EnumMap<>(MathFunction.class);
        functions.forEach((fn, impl) -> t.put(fn, impl::value));
        return Collections.unmodifiableMap(t);
    }
}
