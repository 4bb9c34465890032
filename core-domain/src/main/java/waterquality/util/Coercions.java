package waterquality.util;

import waterquality.domain.exception.InvalidArgumentException;

/**
 * Conversión de valores sueltos (típicamente leídos de un diccionario o de un fichero)
 * a tipos numéricos.
 */
public final class Coercions {

    private Coercions() {
    }

    public static double toDouble(Object value, String field) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.strip());
            } catch (NumberFormatException e) {
                throw new InvalidArgumentException(field + " debe ser numérico, se recibió '" + text + "'", e);
            }
        }
        throw new InvalidArgumentException(field + " debe ser numérico, se recibió " + value);
    }

    /**
     * Igual que {@link #toDouble(Object, String)} pero admite {@code null}.
     */
    public static Double toNullableDouble(Object value, String field) {
        return value == null ? null : toDouble(value, field);
    }

    /**
     * Conversión a entero truncando la parte decimal, como hace {@code int()}.
     */
    public static int toInt(Object value, String field) {
        if (value instanceof Integer integer) {
            return integer;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.strip());
            } catch (NumberFormatException e) {
                throw new InvalidArgumentException(field + " debe ser un entero, se recibió '" + text + "'", e);
            }
        }
        throw new InvalidArgumentException(field + " debe ser un entero, se recibió " + value);
    }
}
