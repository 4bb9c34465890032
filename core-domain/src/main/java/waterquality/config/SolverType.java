package waterquality.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import waterquality.util.EnumResolver;
import waterquality.util.ResolvableEnum;

import java.util.Set;

/**
 * Integrador numérico de EPANET-MSX.
 */
@Getter
@RequiredArgsConstructor
public enum SolverType implements ResolvableEnum {

    EUL(0, Set.of()),
    RK5(1, Set.of()),
    ROS2(2, Set.of());

    private final int value;
    private final Set<String> aliases;

    public static SolverType get(Object value) {
        return EnumResolver.resolve(SolverType.class, value, "MSX_", false);
    }
}
