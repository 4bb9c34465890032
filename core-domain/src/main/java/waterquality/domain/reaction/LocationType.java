package waterquality.domain.reaction;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import waterquality.util.EnumResolver;
import waterquality.util.ResolvableEnum;

import java.util.Set;

/**
 * Elemento de la red donde ocurre la reacción.
 */
@Getter
@RequiredArgsConstructor
public enum LocationType implements ResolvableEnum {

    PIPE(1, Set.of("P")),
    TANK(2, Set.of("T"));

    private final int value;
    private final Set<String> aliases;

    public static LocationType get(Object value) {
        return EnumResolver.resolve(LocationType.class, value, null, true);
    }
}
