package waterquality.domain.variable;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import waterquality.util.EnumResolver;
import waterquality.util.ResolvableEnum;

import java.util.Set;

/**
 * Tipo de especie. Los códigos no coinciden con los del toolkit MSX (BULK=0, WALL=1).
 */
@Getter
@RequiredArgsConstructor
public enum SpeciesType implements ResolvableEnum {

    /** Disuelta o en suspensión en el agua. */
    BULK(1, Set.of("B")),
    /** Adherida a la pared de la tubería. */
    WALL(2, Set.of("W"));

    private final int value;
    private final Set<String> aliases;

    public static SpeciesType get(Object value) {
        return EnumResolver.resolve(SpeciesType.class, value, null, true);
    }
}
