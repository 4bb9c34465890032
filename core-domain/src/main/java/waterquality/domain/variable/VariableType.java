package waterquality.domain.variable;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import waterquality.util.EnumResolver;
import waterquality.util.ResolvableEnum;

import java.util.Set;

/**
 * Tipo de variable de reacción. Acepta como alias la primera letra y las formas cortas
 * SPEC, PARAM, CONST y RES.
 */
@Getter
@RequiredArgsConstructor
public enum VariableType implements ResolvableEnum {

    /** Especie química o biológica. */
    SPECIES(3, Set.of("S", "SPEC")),
    /** Término con nombre (subexpresión) para usar en otras expresiones. */
    TERM(4, Set.of("T")),
    /** Coeficiente con valor global y valores particulares por tubería o depósito. */
    PARAMETER(5, Set.of("P", "PARAM")),
    /** Coeficiente constante. */
    CONSTANT(6, Set.of("C", "CONST")),
    /** Variable hidráulica o palabra reservada. */
    RESERVED(9, Set.of("R", "RES"));

    private final int value;
    private final Set<String> aliases;

    public static VariableType get(Object value) {
        return EnumResolver.resolve(VariableType.class, value, null, true);
    }
}
