package waterquality.domain.exception;

/**
 * Argumento mal formado: tolerancias desemparejadas o no positivas, petición ambigua
 * de tubería y depósito a la vez, tipos no soportados o valores no numéricos.
 */
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
