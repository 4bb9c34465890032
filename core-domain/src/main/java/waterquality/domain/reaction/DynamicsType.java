package waterquality.domain.reaction;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import waterquality.util.EnumResolver;
import waterquality.util.ResolvableEnum;

import java.util.Set;

/**
 * Interpretación de la expresión de una reacción.
 */
@Getter
@RequiredArgsConstructor
public enum DynamicsType implements ResolvableEnum {

    /** La expresión se iguala a cero (equilibrio). */
    EQUIL(1, Set.of("E")),
    /** La expresión es la tasa de cambio dC/dt de la especie. */
    RATE(2, Set.of("R")),
    /** La concentración de la especie es directamente la expresión. */
    FORMULA(3, Set.of("F"));

    private final int value;
    private final Set<String> aliases;

    public static DynamicsType get(Object value) {
        return EnumResolver.resolve(DynamicsType.class, value, null, true);
    }
}
