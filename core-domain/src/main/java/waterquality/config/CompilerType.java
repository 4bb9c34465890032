package waterquality.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import waterquality.util.EnumResolver;
import waterquality.util.ResolvableEnum;

import java.util.Set;

/**
 * Compilador que EPANET-MSX usa para las ecuaciones (NONE = interpretadas).
 */
@Getter
@RequiredArgsConstructor
public enum CompilerType implements ResolvableEnum {

    NONE(0, Set.of()),
    VC(1, Set.of()),
    GC(2, Set.of());

    private final int value;
    private final Set<String> aliases;

    public static CompilerType get(Object value) {
        return EnumResolver.resolve(CompilerType.class, value, "MSX_", false);
    }
}
