package waterquality.domain.exception;

import lombok.Getter;

/**
 * El nombre coincide con una palabra reservada: variable hidráulica, función
 * matemática (en cualquier capitalización) o nombre interno del álgebra.
 */
@Getter
public class InvalidNameException extends IllegalArgumentException {

    private final String variableName;

    public InvalidNameException(String variableName) {
        super("El nombre '" + variableName + "' es una palabra reservada y no puede usarse como variable.");
        this.variableName = variableName;
    }
}
