package waterquality.expression;

import waterquality.domain.exception.ExpressionCompileException;
import waterquality.expression.node.BinaryNode;
import waterquality.expression.node.BinaryOperator;
import waterquality.expression.node.ExpressionNode;
import waterquality.expression.node.FunctionNode;
import waterquality.expression.node.NegateNode;
import waterquality.expression.node.NumberNode;
import waterquality.expression.node.SymbolNode;

import java.util.List;

/**
 * Parser descendente recursivo del lenguaje de expresiones MSX.
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := unary (('*' | '/') unary)*
 * unary   := ('+' | '-') unary | power
 * power   := primary ('^' unary)?
 * primary := NUMBER | IDENT | FUNC '(' expr ')' | '(' expr ')'
 * </pre>
 * La multiplicación implícita ({@code 2x}, {@code k A}) no está permitida: dos operandos
 * seguidos son un error de sintaxis.
 */
public final class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = new ExpressionTokenizer(source).tokenize();
    }

    /**
     * Analiza el texto y devuelve el árbol. No resuelve símbolos: eso es trabajo del backend
     * con su {@link SymbolTable}.
     *
     * @throws ExpressionCompileException si la expresión está vacía o mal formada.
     */
    public static ExpressionNode parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionCompileException("La expresión está vacía", String.valueOf(expression));
        }
        ExpressionParser parser = new ExpressionParser(expression);
        ExpressionNode tree = parser.expression();
        Token trailing = parser.peek();
        if (trailing.kind() != Token.Kind.END) {
            if (trailing.kind() == Token.Kind.RIGHT_PAREN) {
                throw parser.error("Paréntesis de cierre sin pareja", trailing);
            }
            throw parser.error("Multiplicación implícita no permitida antes de '" + trailing.text() + "'", trailing);
        }
        return tree;
    }

    private ExpressionNode expression() {
        ExpressionNode left = term();
        while (true) {
            Token t = peek();
            if (t.is(Token.Kind.OPERATOR, "+")) {
                index++;
                left = new BinaryNode(BinaryOperator.ADD, left, term());
            } else if (t.is(Token.Kind.OPERATOR, "-")) {
                index++;
                left = new BinaryNode(BinaryOperator.SUBTRACT, left, term());
            } else {
                return left;
            }
        }
    }

    private ExpressionNode term() {
        ExpressionNode left = unary();
        while (true) {
            Token t = peek();
            if (t.is(Token.Kind.OPERATOR, "*")) {
                index++;
                left = new BinaryNode(BinaryOperator.MULTIPLY, left, unary());
            } else if (t.is(Token.Kind.OPERATOR, "/")) {
                index++;
                left = new BinaryNode(BinaryOperator.DIVIDE, left, unary());
            } else {
                return left;
            }
        }
    }

    private ExpressionNode unary() {
        Token t = peek();
        if (t.is(Token.Kind.OPERATOR, "-")) {
            index++;
            return new NegateNode(unary());
        }
        if (t.is(Token.Kind.OPERATOR, "+")) {
            index++;
            return unary();
        }
        return power();
    }

    private ExpressionNode power() {
        ExpressionNode base = primary();
        if (peek().is(Token.Kind.OPERATOR, "^")) {
            index++;
            // Asociativa por la derecha: a^b^c = a^(b^c); admite exponente con signo (a^-1)
            return new BinaryNode(BinaryOperator.POWER, base, unary());
        }
        return base;
    }

    private ExpressionNode primary() {
        Token t = next();
        switch (t.kind()) {
            case NUMBER -> {
                return new NumberNode(Double.parseDouble(t.text()));
            }
            case IDENTIFIER -> {
                return identifier(t);
            }
            case LEFT_PAREN -> {
                ExpressionNode inner = expression();
                expect(Token.Kind.RIGHT_PAREN, "Falta el paréntesis de cierre");
                return inner;
            }
            case END -> throw error("Fin inesperado de la expresión", t);
            default -> throw error("Operando esperado en lugar de '" + t.text() + "'", t);
        }
    }

    private ExpressionNode identifier(Token t) {
        MathFunction function = MathFunction.fromName(t.text());
        boolean call = peek().kind() == Token.Kind.LEFT_PAREN;
        if (function != null) {
            if (!call) {
                throw error("La función '" + t.text() + "' debe llamarse con argumento", t);
            }
            index++;
            ExpressionNode argument = expression();
            expect(Token.Kind.RIGHT_PAREN, "Falta el paréntesis de cierre de '" + t.text() + "('");
            return new FunctionNode(function, argument);
        }
        if (call) {
            throw error("Función desconocida '" + t.text() + "'", t);
        }
        return new SymbolNode(t.text(), t.position());
    }

    private void expect(Token.Kind kind, String message) {
        Token t = next();
        if (t.kind() != kind) {
            throw error(message, t);
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.kind() != Token.Kind.END) {
            index++;
        }
        return t;
    }

    private ExpressionCompileException error(String message, Token at) {
        return new ExpressionCompileException(message, source, at.position());
    }
}
