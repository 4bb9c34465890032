package waterquality.domain.exception;

import lombok.Getter;
import waterquality.registry.KeyExistsException;

/**
 * El nombre de la variable ya está ocupado en el espacio de nombres del modelo
 * (especies, constantes, parámetros, términos o variables internas).
 */
@Getter
public class NameCollisionException extends KeyExistsException {

    private final String variableName;

    public NameCollisionException(String variableName) {
        super("La variable '" + variableName + "' ya existe en este modelo.");
        this.variableName = variableName;
    }
}
