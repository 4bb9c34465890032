package waterquality.domain.reaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import waterquality.domain.exception.InvalidArgumentException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReactionDynamicsTest {

    @Test
    @DisplayName("of() crea la variante correspondiente a cada tipo de dinámica")
    void of_shouldDispatchOnDynamicsType() {
        assertThat(ReactionDynamics.of(DynamicsType.RATE, "A", LocationType.PIPE, "-k*A", null))
                .isInstanceOf(RateDynamics.class);
        assertThat(ReactionDynamics.of(DynamicsType.EQUIL, "A", LocationType.TANK, "A-B", null))
                .isInstanceOf(EquilibriumDynamics.class);
        assertThat(ReactionDynamics.of(DynamicsType.FORMULA, "A", LocationType.PIPE, "2*B", null).getDynamics())
                .isEqualTo(DynamicsType.FORMULA);
    }

    @Test
    @DisplayName("La igualdad depende de la dinámica pero no de la nota")
    void equality_shouldDependOnDynamicsNotNote() {
        ReactionDynamics rate = new RateDynamics("A", LocationType.PIPE, "-k*A", "nota");
        ReactionDynamics sameRate = new RateDynamics("A", LocationType.PIPE, "-k*A", null);
        ReactionDynamics formula = new FormulaDynamics("A", LocationType.PIPE, "-k*A", "nota");

        assertThat(rate).isEqualTo(sameRate).hasSameHashCodeAs(sameRate);
        assertThat(rate).isNotEqualTo(formula);
    }

    @Test
    @DisplayName("toDict usa nombres en minúsculas y toString la forma especie->UBICACIÓN")
    void toDict_shouldUseLowercaseTags() {
        ReactionDynamics reaction = new EquilibriumDynamics("HOCL", LocationType.TANK, "HOCL - Cl", null);

        assertThat(reaction.toDict())
                .containsEntry("species", "HOCL")
                .containsEntry("location", "tank")
                .containsEntry("dynamics", "equil")
                .containsEntry("expression", "HOCL - Cl")
                .containsKey("note");
        assertThat(reaction).hasToString("HOCL->TANK");
    }

    @Test
    @DisplayName("Argumentos obligatorios ausentes producen errores")
    void missingArguments_shouldFail() {
        assertThatThrownBy(() -> ReactionDynamics.of(null, "A", LocationType.PIPE, "1", null))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> new RateDynamics("A", null, "1", null))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> new RateDynamics("A", LocationType.PIPE, null, null))
                .isInstanceOf(NullPointerException.class);
    }
}
