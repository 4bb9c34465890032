package waterquality.expression.node;

/**
 * Niveles de precedencia de render. Mayor valor = enlaza más fuerte.
 */
final class Precedence {

    static final int ADDITIVE = 1;
    static final int MULTIPLICATIVE = 2;
    static final int UNARY = 3;
    static final int POWER = 4;
    static final int ATOM = 5;

    private Precedence() {
    }
}
