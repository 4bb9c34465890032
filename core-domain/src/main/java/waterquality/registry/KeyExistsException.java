package waterquality.registry;

/**
 * Se lanza cuando se intenta insertar una clave que ya existe en algún punto
 * del espacio de nombres plano de un {@link DisjointMapping}.
 */
public class KeyExistsException extends RuntimeException {

    public KeyExistsException(String message) {
        super(message);
    }
}
