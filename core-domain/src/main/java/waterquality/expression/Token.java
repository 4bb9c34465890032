package waterquality.expression;

/**
 * Unidad léxica con su posición (base 0) en el texto fuente.
 */
record Token(Kind kind, String text, int position) {

    enum Kind {
        NUMBER,
        IDENTIFIER,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        END
    }

    boolean is(Kind k, String t) {
        return kind == k && text.equals(t);
    }
}
