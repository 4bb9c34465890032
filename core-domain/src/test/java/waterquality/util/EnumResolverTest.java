package waterquality.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import waterquality.config.CouplingType;
import waterquality.config.SolverType;
import waterquality.config.SourceType;
import waterquality.domain.exception.InvalidArgumentException;
import waterquality.domain.reaction.DynamicsType;
import waterquality.domain.reaction.LocationType;
import waterquality.domain.variable.VariableType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnumResolverTest {

    @ParameterizedTest
    @ValueSource(strings = {"pipe", "PIPE", "p", "Pipe", "  pipe  ", "P"})
    @DisplayName("Las distintas grafías de 'pipe' resuelven a PIPE")
    void lenientStrings_shouldResolveToSameMember(String raw) {
        assertThat(LocationType.get(raw)).isEqualTo(LocationType.PIPE);
    }

    @Test
    @DisplayName("Con abreviatura, si el nombre completo falla se usa la primera letra")
    void abbreviation_shouldFallBackToFirstCharacter() {
        assertThat(DynamicsType.get("equilibrium")).isEqualTo(DynamicsType.EQUIL);
        assertThat(DynamicsType.get("Rate")).isEqualTo(DynamicsType.RATE);
        assertThat(VariableType.get("const")).isEqualTo(VariableType.CONSTANT);
        assertThat(VariableType.get("param")).isEqualTo(VariableType.PARAMETER);
        assertThat(VariableType.get("species")).isEqualTo(VariableType.SPECIES);
    }

    @Test
    @DisplayName("Los enteros resuelven por código")
    void integers_shouldResolveByValue() {
        assertThat(VariableType.get(6)).isEqualTo(VariableType.CONSTANT);
        assertThat(LocationType.get(2)).isEqualTo(LocationType.TANK);
        assertThat(SourceType.get(-1)).isEqualTo(SourceType.NOSOURCE);
        assertThatThrownBy(() -> VariableType.get(42)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("El prefijo MSX_ se elimina y los alias se reconocen")
    void prefix_shouldBeStripped() {
        assertThat(SolverType.get("MSX_RK5")).isEqualTo(SolverType.RK5);
        assertThat(SolverType.get("ros2")).isEqualTo(SolverType.ROS2);
        assertThat(CouplingType.get("full-coupling")).isEqualTo(CouplingType.FULL);
        assertThat(SourceType.get("msx setpoint")).isEqualTo(SourceType.SETPOINT);
    }

    @Test
    @DisplayName("Sin abreviatura habilitada no se reintenta con la primera letra")
    void withoutAbbrev_shouldNotUseFirstCharacter() {
        assertThatThrownBy(() -> SolverType.get("R")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Casos límite: null, instancia, otro enum y tipo no soportado")
    void edgeCases() {
        assertThat(LocationType.get(null)).isNull();
        assertThat(LocationType.get(LocationType.TANK)).isSameAs(LocationType.TANK);
        // un enum de otro tipo se resuelve por su nombre
        assertThat(VariableType.get(DynamicsType.RATE)).isEqualTo(VariableType.RESERVED);
        assertThatThrownBy(() -> LocationType.get("xyz")).isInstanceOf(IllegalArgumentException.class)
                .isNotInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> LocationType.get(1.5)).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("La normalización sustituye guiones y espacios por guiones bajos")
    void normalize_shouldReplaceSeparators() {
        assertThat(EnumResolver.normalize(" full-coupling ", null)).isEqualTo("FULL_COUPLING");
        assertThat(EnumResolver.normalize("msx_rk5", "MSX_")).isEqualTo("RK5");
    }
}
