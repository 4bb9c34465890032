package waterquality.domain.exception;

import java.util.NoSuchElementException;

/**
 * Referencia a un nombre que no está registrado en el modelo.
 */
public class UnknownReferenceException extends NoSuchElementException {

    public UnknownReferenceException(String message) {
        super(message);
    }
}
