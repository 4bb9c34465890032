package waterquality.domain.variable;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import waterquality.domain.exception.InvalidArgumentException;
import waterquality.domain.exception.InvalidNameException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ReactionVariableTest {

    @ParameterizedTest
    @ValueSource(strings = {"D", "Kc", "Len", "log", "LOG", "Log", "lOg", "Sqrt", "log10", "Mul", "Add", "Pow", "Integer", "Float"})
    @DisplayName("Las palabras reservadas no se aceptan como nombre")
    void reservedNames_shouldBeRejected(String name) {
        assertThatThrownBy(() -> new Constant(name, 1.0))
                .isInstanceOf(InvalidNameException.class)
                .hasMessageContaining(name);
    }

    @Test
    @DisplayName("Las variables hidráulicas solo se reservan con su grafía exacta")
    void hydraulicNames_areCaseSensitive() {
        assertThat(new Constant("d", 1.0).getName()).isEqualTo("d");
        assertThat(new Constant("LEN", 1.0).getName()).isEqualTo("LEN");
    }

    @Test
    @DisplayName("Las tolerancias de una especie van por pares y deben ser positivas")
    void speciesTolerances_shouldBePairedAndPositive() {
        Species species = Species.builder().speciesType(SpeciesType.BULK).name("Cl").units("MG").build();
        assertThat(species.getTolerances()).isEmpty();

        species.setTolerances(0.01, 0.001);
        assertThat(species.getTolerances()).contains(new Tolerances(0.01, 0.001));

        assertThatThrownBy(() -> species.setTolerances(0.01, null)).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> species.setTolerances(0.0, 0.1)).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> species.setTolerances(0.1, -1.0)).isInstanceOf(InvalidArgumentException.class);

        species.clearTolerances();
        assertThat(species.getTolerances()).isEmpty();
    }

    @Test
    @DisplayName("Fijar las dos tolerancias a null las borra")
    void speciesTolerances_setToNull_shouldClear() {
        Species species = Species.builder().speciesType(SpeciesType.BULK).name("Cl").units("MG")
                .atol(1e-4).rtol(1e-3).build();
        assertThat(species.getTolerances()).contains(new Tolerances(1e-4, 1e-3));

        species.setTolerances(null, null);

        assertThat(species.getTolerances()).isEmpty();
        assertThat(species.toDict()).doesNotContainKeys("atol", "rtol");
    }

    @Test
    @DisplayName("Construir una especie con una sola tolerancia falla")
    void speciesBuilder_withSingleTolerance_shouldFail() {
        assertThatThrownBy(() -> Species.builder().speciesType(SpeciesType.WALL).name("X").atol(1e-3).build())
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> Species.builder().name("X").build())
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("Un parámetro devuelve el valor propio del elemento o el global")
    void parameterValue_shouldUseOverrideOrGlobal() {
        Parameter k = Parameter.builder()
                .name("k")
                .globalValue(2.0)
                .pipeValues(Map.of("P1", 5.0))
                .tankValues(Map.of("T1", 7.0))
                .build();

        assertEquals(5.0, k.getValue("P1", null));
        assertEquals(2.0, k.getValue("P2", null));
        assertEquals(7.0, k.getValue(null, "T1"));
        assertEquals(2.0, k.getValue(null, null));
        assertThatThrownBy(() -> k.getValue("P1", "T1")).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("La igualdad es estructural e ignora la nota")
    void equality_shouldIgnoreNote() {
        Constant a = new Constant("k", 0.5, "una nota", "1/min");
        Constant b = new Constant("k", 0.5, "otra nota", "1/min");
        Constant c = new Constant("k", 0.6, "una nota", "1/min");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        // mismo nombre, tipo distinto
        assertNotEquals(new Constant("k", 0.5), Parameter.builder().name("k").globalValue(0.5).build());
    }

    @Test
    @DisplayName("toDict de una especie omite tolerancias ausentes y difusividad nula")
    void speciesToDict_shouldOmitUnsetFields() {
        Species species = Species.builder().speciesType(SpeciesType.WALL).name("X").units("UG").note("n").build();

        Map<String, Object> dict = species.toDict();

        assertThat(dict).containsEntry("species_type", "wall")
                .containsEntry("units", "UG")
                .containsEntry("note", "n")
                .doesNotContainKeys("atol", "rtol", "diffusivity");
        assertThat(species.getVarType()).isEqualTo(VariableType.SPECIES);
        assertThat(species.isWall()).isTrue();
    }

    @Test
    @DisplayName("Las variables internas pueden usar nombres reservados")
    void internalVariable_shouldSkipReservedCheck() {
        InternalVariable d = new InternalVariable("D", "diameter");

        assertThat(d.getVarType()).isEqualTo(VariableType.RESERVED);
        assertThat(d.toDict()).containsEntry("name", "D");
    }

    @Test
    @DisplayName("El propietario se guarda como referencia débil y recibe los cambios de un término")
    void owner_shouldBeNotifiedOnTermChange() {
        OtherTerm term = new OtherTerm("T1", "k*A");
        int[] calls = {0};
        VariableOwner owner = v -> calls[0]++;

        term.attachTo(owner);
        term.setExpression("2*k*A");

        assertThat(term.getOwner()).containsSame(owner);
        assertThat(calls[0]).isEqualTo(1);
        term.attachTo(null);
        assertThat(term.getOwner()).isEmpty();
    }
}
