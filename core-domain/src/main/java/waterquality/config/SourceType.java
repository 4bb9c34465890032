package waterquality.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import waterquality.util.EnumResolver;
import waterquality.util.ResolvableEnum;

import java.util.Set;

/**
 * Tipo de inyección de una fuente de calidad en un nudo.
 */
@Getter
@RequiredArgsConstructor
public enum SourceType implements ResolvableEnum {

    NOSOURCE(-1, Set.of("NONE")),
    CONCEN(0, Set.of("CONCENTRATION")),
    MASS(1, Set.of()),
    SETPOINT(2, Set.of()),
    FLOWPACED(3, Set.of());

    private final int value;
    private final Set<String> aliases;

    public static SourceType get(Object value) {
        return EnumResolver.resolve(SourceType.class, value, "MSX_", false);
    }
}
