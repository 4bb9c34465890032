package waterquality.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import waterquality.domain.exception.ExpressionCompileException;
import waterquality.expression.node.BinaryNode;
import waterquality.expression.node.BinaryOperator;
import waterquality.expression.node.ExpressionNode;
import waterquality.expression.node.FunctionNode;
import waterquality.expression.node.NegateNode;
import waterquality.expression.node.NumberNode;
import waterquality.expression.node.SymbolNode;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionParserTest {

    @Test
    @DisplayName("'^' es exponenciación y asocia por la derecha")
    void caret_shouldBeRightAssociativePower() {
        ExpressionNode tree = ExpressionParser.parse("a^b^c");

        assertThat(tree).isEqualTo(new BinaryNode(BinaryOperator.POWER, new SymbolNode("a"),
                new BinaryNode(BinaryOperator.POWER, new SymbolNode("b"), new SymbolNode("c"))));
        assertThat(ExpressionParser.parse("a**2")).isEqualTo(ExpressionParser.parse("a^2"));
    }

    @Test
    @DisplayName("El menos unario liga menos que la potencia: -B^2 = -(B^2)")
    void unaryMinus_shouldBindLooserThanPower() {
        ExpressionNode tree = ExpressionParser.parse("-B^2");

        assertThat(tree).isEqualTo(new NegateNode(
                new BinaryNode(BinaryOperator.POWER, new SymbolNode("B"), new NumberNode(2))));
    }

    @Test
    @DisplayName("Las funciones se reconocen sin distinguir mayúsculas")
    void functions_shouldBeCaseInsensitive() {
        assertThat(ExpressionParser.parse("LOG(x)")).isEqualTo(new FunctionNode(MathFunction.LOG, new SymbolNode("x")));
        assertThat(ExpressionParser.parse("Exp(x)")).isEqualTo(ExpressionParser.parse("exp(x)"));
    }

    @Test
    @DisplayName("Los literales admiten exponente y punto inicial")
    void numberLiterals_shouldSupportExponentsAndLeadingDot() {
        assertThat(ExpressionParser.parse("1.5e-3")).isEqualTo(new NumberNode(1.5e-3));
        assertThat(ExpressionParser.parse(".25")).isEqualTo(new NumberNode(0.25));
        assertThat(ExpressionParser.parse("2E+2")).isEqualTo(new NumberNode(200));
    }

    @Test
    @DisplayName("Los símbolos libres se recogen en orden de aparición")
    void freeSymbols_shouldFollowAppearanceOrder() {
        assertThat(ExpressionParser.parse("-k*A*B^2 + k*Kc").freeSymbols()).containsExactly("k", "A", "B", "Kc");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "-k*A*B^2|-k * A * B ^ 2",
            "(a+b)*c|(a + b) * c",
            "a-(b-c)|a - (b - c)",
            "(a^b)^c|(a ^ b) ^ c",
            "-(a+b)|-(a + b)",
            "sqrt(x)/2|sqrt(x) / 2"
    })
    @DisplayName("El render vuelve a la sintaxis MSX con los paréntesis justos")
    void render_shouldProduceMinimalParentheses(String source, String rendered) {
        ExpressionNode tree = ExpressionParser.parse(source);

        assertThat(tree.render()).isEqualTo(rendered);
        assertThat(ExpressionParser.parse(tree.render())).isEqualTo(tree);
    }

    @ParameterizedTest
    @ValueSource(strings = {"2x", "k A", "(a+b", "a+b)", "a+", "*a", "a & b", "foo(x)", "log", "", "   ", "a % b", "2(x)"})
    @DisplayName("Expresiones mal formadas fallan con error de compilación")
    void malformed_shouldFail(String source) {
        assertThatThrownBy(() -> ExpressionParser.parse(source)).isInstanceOf(ExpressionCompileException.class);
    }

    @Test
    @DisplayName("El error indica la posición del problema")
    void error_shouldReportPosition() {
        assertThatThrownBy(() -> ExpressionParser.parse("a + b $ c"))
                .isInstanceOfSatisfying(ExpressionCompileException.class, e -> {
                    assertThat(e.getPosition()).isEqualTo(6);
                    assertThat(e.getExpression()).isEqualTo("a + b $ c");
                });
    }

    @Test
    @DisplayName("La multiplicación implícita se rechaza")
    void implicitMultiplication_shouldBeRejected() {
        assertThatThrownBy(() -> ExpressionParser.parse("2k"))
                .isInstanceOf(ExpressionCompileException.class)
                .hasMessageContaining("implícita");
    }

    @Test
    @DisplayName("La sustitución y el plegado devuelven árboles nuevos")
    void substituteAndFold_shouldReturnNewTrees() {
        ExpressionNode tree = ExpressionParser.parse("k*(2+3)");

        ExpressionNode substituted = tree.substitute(Map.of("k", new NumberNode(4)));

        assertThat(tree.freeSymbols()).containsExactly("k");
        assertThat(substituted.fold()).isEqualTo(new NumberNode(20));
        assertThat(tree.fold().render()).isEqualTo("k * 5");
    }
}
