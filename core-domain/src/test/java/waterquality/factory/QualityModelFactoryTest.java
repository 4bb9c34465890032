package waterquality.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import waterquality.config.ExpressionConfig;
import waterquality.config.SolverType;
import waterquality.domain.exception.InvalidArgumentException;
import waterquality.domain.exception.NameCollisionException;
import waterquality.domain.exception.UnknownReferenceException;
import waterquality.domain.variable.Species;
import waterquality.model.MultispeciesQualityModel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QualityModelFactoryTest {

    private static final ExpressionConfig CONFIG = ExpressionConfig.defaults();

    /**
     * Modelo de decaimiento de cloro con una especie de pared, al estilo del ejemplo de EPANET-MSX.
     */
    private static MultispeciesQualityModel chlorineModel() {
        MultispeciesQualityModel model = new MultispeciesQualityModel(CONFIG);
        model.setName("cloro");
        model.setTitle("Decaimiento de cloro en dos fases");
        model.getReferences().add("Rossman (2012)");
        model.setOptions(Map.of("solver", "ROS2", "timestep", 300, "area_units", "FT2"));
        model.addBulkSpecies("CL2", "MG", 0.01, 0.001, "cloro libre");
        model.addWallSpecies("NH2CL", "MG");
        model.addConstant("Kb", 0.3, null, "1/day");
        model.addParameter("Kw", 1.0, "pared", "ft/day", Map.of("P1", 0.5), Map.of("T1", 0.0));
        model.addOtherTerm("Kf", "1.5826e-4 * Re^0.88 / D");
        model.addPipeReaction("CL2", "RATE", "-Kb*CL2 - (4/D)*Kw*Kf/(Kw+Kf)*CL2");
        model.addTankReaction("CL2", "RATE", "-Kb*CL2");
        model.addPipeReaction("NH2CL", "FORMULA", "0.5*CL2");
        model.getNetworkData().addPattern("PAT1", List.of(1.0, 1.2, 0.8));
        model.getNetworkData().getInitialQuality("CL2").setGlobalValue(1.0);
        model.getNetworkData().getInitialQuality("CL2").getNodeValues().put("N1", 0.8);
        model.getNetworkData().addSource("CL2", "N1", "SETPOINT", 1.2, "PAT1");
        return model;
    }

    @Test
    @DisplayName("fromDict(toDict()) reconstruye un modelo igual")
    void fromDict_shouldRebuildEqualModel() {
        MultispeciesQualityModel original = chlorineModel();

        MultispeciesQualityModel rebuilt = QualityModelFactory.fromDict(original.toDict(), CONFIG);

        assertThat(rebuilt).isEqualTo(original);
        assertThat(rebuilt.variableNames()).containsExactlyElementsOf(original.variableNames());
        assertThat(rebuilt.getOptions().getSolver()).isEqualTo(SolverType.ROS2);
        assertThat(((Species) rebuilt.getVariable("CL2")).getTolerances()).isPresent();
        assertThat(rebuilt.getNetworkData().getSources("CL2")).containsKey("N1");
        assertThat(rebuilt.compileReaction("CL2", "PIPE").render())
                .isEqualTo(original.compileReaction("CL2", "PIPE").render());
    }

    @Test
    @DisplayName("La difusividad se conserva en el diccionario, también cuando vale 0")
    void fromDict_shouldPreserveDiffusivity() {
        MultispeciesQualityModel original = new MultispeciesQualityModel(CONFIG);
        original.addBulkSpecies("A", "MG").setDiffusivity(0.0);
        original.addBulkSpecies("B", "MG").setDiffusivity(1.2e-9);
        original.addWallSpecies("C", "MG");

        Map<String, Object> dict = original.toDict();
        MultispeciesQualityModel rebuilt = QualityModelFactory.fromDict(dict, CONFIG);

        assertThat(rebuilt).isEqualTo(original);
        assertThat(((Species) rebuilt.getVariable("A")).getDiffusivity()).isEqualTo(0.0);
        assertThat(((Species) rebuilt.getVariable("B")).getDiffusivity()).isEqualTo(1.2e-9);
        assertThat(((Species) rebuilt.getVariable("C")).getDiffusivity()).isNull();
    }

    @Test
    @DisplayName("Un modelo vacío también se reconstruye")
    void fromDict_shouldHandleEmptyModel() {
        MultispeciesQualityModel empty = new MultispeciesQualityModel(CONFIG);

        assertThat(QualityModelFactory.fromDict(empty.toDict(), CONFIG)).isEqualTo(empty);
        assertThat(QualityModelFactory.fromDict(Map.of(), CONFIG)).isEqualTo(empty);
    }

    @Test
    @DisplayName("appendFromDict añade sobre un modelo existente y respeta las colisiones")
    void appendFromDict_shouldAddToExistingModel() {
        MultispeciesQualityModel model = new MultispeciesQualityModel(CONFIG);
        model.addConstant("k", 1.0);
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("constants", Map.of("k2", Map.of("global_value", 2.0)));

        QualityModelFactory.appendFromDict(model, extra);

        assertThat(model.constantNames()).containsExactly("k", "k2");
        assertThatThrownBy(() -> QualityModelFactory.appendFromDict(model, extra))
                .isInstanceOf(NameCollisionException.class);
    }

    @Test
    @DisplayName("Secciones mal formadas o referencias rotas se rechazan")
    void fromDict_shouldRejectMalformedInput() {
        assertThatThrownBy(() -> QualityModelFactory.fromDict(Map.of("species", List.of("A")), CONFIG))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> QualityModelFactory.fromDict(Map.of("constants", Map.of("k", 1.0)), CONFIG))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> QualityModelFactory.appendFromDict(new MultispeciesQualityModel(CONFIG), null))
                .isInstanceOf(InvalidArgumentException.class);

        Map<String, Object> reactionWithoutSpecies = Map.of("pipe_reactions",
                Map.of("X", Map.of("species", "X", "location", "pipe", "dynamics", "rate", "expression", "-1")));
        assertThatThrownBy(() -> QualityModelFactory.fromDict(reactionWithoutSpecies, CONFIG))
                .isInstanceOf(UnknownReferenceException.class);
    }
}
