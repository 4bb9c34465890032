package waterquality.expression;

import waterquality.domain.exception.ExpressionCompileException;

import java.util.ArrayList;
import java.util.List;

/**
 * Analizador léxico de expresiones MSX.
 * <p>
 * Reconoce literales numéricos (con exponente y punto inicial: {@code .5}, {@code 1.2e-3}),
 * identificadores ({@code [A-Za-z_][A-Za-z0-9_]*}), los operadores {@code + - * / ^} y
 * {@code **} (sinónimo de {@code ^}) y paréntesis. Cualquier otro carácter es un error.
 */
final class ExpressionTokenizer {

    private final String source;
    private int pos;

    ExpressionTokenizer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Kind.END, "", pos));
                return tokens;
            }
            char c = source.charAt(pos);
            if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                tokens.add(readNumber());
            } else if (Character.isLetter(c) || c == '_') {
                tokens.add(readIdentifier());
            } else if (c == '(') {
                tokens.add(new Token(Token.Kind.LEFT_PAREN, "(", pos++));
            } else if (c == ')') {
                tokens.add(new Token(Token.Kind.RIGHT_PAREN, ")", pos++));
            } else if (c == '*' && pos + 1 < source.length() && source.charAt(pos + 1) == '*') {
                tokens.add(new Token(Token.Kind.OPERATOR, "^", pos));
                pos += 2;
            } else if ("+-*/^".indexOf(c) >= 0) {
                tokens.add(new Token(Token.Kind.OPERATOR, String.valueOf(c), pos++));
            } else {
                throw new ExpressionCompileException("Carácter u operador no reconocido '" + c + "'", source, pos);
            }
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private Token readNumber() {
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                // "2e" o "2ex": la 'e' no es un exponente; el parser lo rechazará como multiplicación implícita
                pos = mark;
            }
        }
        return new Token(Token.Kind.NUMBER, source.substring(start, pos), start);
    }

    private Token readIdentifier() {
        int start = pos;
        while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        return new Token(Token.Kind.IDENTIFIER, source.substring(start, pos), start);
    }
}
