package waterquality.domain.exception;

import lombok.Getter;

/**
 * Error al analizar o enlazar una expresión matemática.
 * <p>
 * {@code position} es el índice (base 0) del carácter problemático dentro de la
 * expresión, o -1 si el error no está asociado a una posición (p.ej. un símbolo
 * sin valor durante la evaluación).
 */
@Getter
public class ExpressionCompileException extends RuntimeException {

    private final String expression;
    private final int position;

    public ExpressionCompileException(String message, String expression, int position) {
        super(position >= 0
                ? String.format("%s (posición %d en \"%s\")", message, position, expression)
                : String.format("%s (en \"%s\")", message, expression));
        this.expression = expression;
        this.position = position;
    }

    public ExpressionCompileException(String message, String expression) {
        this(message, expression, -1);
    }
}
