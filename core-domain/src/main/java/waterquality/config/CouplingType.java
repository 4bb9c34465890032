package waterquality.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import waterquality.util.EnumResolver;
import waterquality.util.ResolvableEnum;

import java.util.Set;

/**
 * Acoplamiento entre hidráulica y calidad.
 */
@Getter
@RequiredArgsConstructor
public enum CouplingType implements ResolvableEnum {

    NONE(0, Set.of("NO_COUPLING")),
    FULL(1, Set.of("FULL_COUPLING"));

    private final int value;
    private final Set<String> aliases;

    public static CouplingType get(Object value) {
        return EnumResolver.resolve(CouplingType.class, value, "MSX_", false);
    }
}
