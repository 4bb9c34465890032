package waterquality.util;

import java.util.Set;

/**
 * Enumerado que puede resolverse de forma tolerante con {@link EnumResolver}:
 * por su código entero, por su nombre o por cualquiera de sus alias.
 */
public interface ResolvableEnum {

    /**
     * Código entero del miembro (equivalente al valor del toolkit).
     */
    int getValue();

    /**
     * Nombres alternativos, en mayúsculas (p.ej. "P" para PIPE).
     */
    default Set<String> getAliases() {
        return Set.of();
    }
}
