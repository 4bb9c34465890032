package waterquality.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import waterquality.util.EnumResolver;
import waterquality.util.ResolvableEnum;

import java.util.Set;

/**
 * Unidades de tiempo de las reacciones de tipo tasa.
 */
@Getter
@RequiredArgsConstructor
public enum RateUnitsType implements ResolvableEnum {

    SEC(0, Set.of("SECONDS")),
    MIN(1, Set.of("MINUTES")),
    HR(2, Set.of("HOURS")),
    DAY(3, Set.of("DAYS"));

    private final int value;
    private final Set<String> aliases;

    public static RateUnitsType get(Object value) {
        return EnumResolver.resolve(RateUnitsType.class, value, "MSX_", false);
    }
}
