package waterquality.util;

import waterquality.domain.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * Resolución tolerante de enumerados a partir de enteros, otros enumerados o texto.
 * <p>
 * Para texto: pasa a mayúsculas, recorta espacios, cambia '-' y ' ' por '_' y, si se
 * indica, elimina un prefijo (p.ej. "MSX_"). Después busca por nombre o alias. Con
 * {@code abbrev} activo, si falla la búsqueda completa se reintenta solo con el primer
 * carácter, de modo que "pipe", "PIPE", "p" y "Pipe" resuelven al mismo miembro.
 */
public final class EnumResolver {

    private EnumResolver() {
    }

    /**
     * @param enumType  clase del enumerado destino.
     * @param value     entero, enumerado o cadena. {@code null} devuelve {@code null}.
     * @param prefix    prefijo a eliminar de las cadenas, o {@code null}.
     * @param abbrev    si se permite reintentar con la primera letra.
     * @return el miembro resuelto.
     * @throws IllegalArgumentException  si ningún miembro coincide.
     * @throws InvalidArgumentException  si el tipo de {@code value} no está soportado.
     */
    public static <E extends Enum<E> & ResolvableEnum> E resolve(Class<E> enumType, Object value,
                                                                 String prefix, boolean abbrev) {
        if (value == null) {
            return null;
        }
        if (enumType.isInstance(value)) {
            return enumType.cast(value);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long code = ((Number) value).longValue();
            for (E member : enumType.getEnumConstants()) {
                if (member.getValue() == code) {
                    return member;
                }
            }
            throw new IllegalArgumentException(String.format("%d no es un valor válido de %s", code, enumType.getSimpleName()));
        }

        String name;
        if (value instanceof String text) {
            name = normalize(text, prefix);
        } else if (value instanceof Enum<?> other) {
            name = normalize(other.name(), prefix);
        } else {
            throw new InvalidArgumentException("Tipo no válido para " + enumType.getSimpleName() + ": "
                    + value.getClass().getSimpleName());
        }

        E found = lookup(enumType, name);
        if (found != null) {
            return found;
        }
        if (abbrev && !name.isEmpty()) {
            found = lookup(enumType, name.substring(0, 1));
            if (found != null) {
                return found;
            }
        }
        throw new IllegalArgumentException(String.format("'%s' no es un valor válido de %s", value, enumType.getSimpleName()));
    }

    static String normalize(String raw, String prefix) {
        String name = raw.toUpperCase(Locale.ROOT).strip().replace('-', '_').replace(' ', '_');
        if (prefix != null && !prefix.isEmpty() && name.startsWith(prefix)) {
            name = name.substring(prefix.length());
        }
        return name;
    }

    private static <E extends Enum<E> & ResolvableEnum> E lookup(Class<E> enumType, String name) {
        for (E member : enumType.getEnumConstants()) {
            if (member.name().equals(name) || member.getAliases().contains(name)) {
                return member;
            }
        }
        return null;
    }
}
