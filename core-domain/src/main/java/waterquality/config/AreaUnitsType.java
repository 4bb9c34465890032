package waterquality.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import waterquality.util.EnumResolver;
import waterquality.util.ResolvableEnum;

import java.util.Set;

/**
 * Unidades de superficie para las concentraciones de pared.
 */
@Getter
@RequiredArgsConstructor
public enum AreaUnitsType implements ResolvableEnum {

    FT2(0, Set.of()),
    M2(1, Set.of()),
    CM2(2, Set.of());

    private final int value;
    private final Set<String> aliases;

    public static AreaUnitsType get(Object value) {
        return EnumResolver.resolve(AreaUnitsType.class, value, "MSX_", false);
    }
}
