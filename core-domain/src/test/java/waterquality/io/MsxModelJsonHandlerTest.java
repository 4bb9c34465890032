package waterquality.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import waterquality.config.ExpressionConfig;
import waterquality.model.MultispeciesQualityModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MsxModelJsonHandlerTest {

    @TempDir
    Path tempDir;

    private MsxModelJsonHandler handler;
    private MultispeciesQualityModel model;

    @BeforeEach
    void setUp() {
        handler = new MsxModelJsonHandler(ExpressionConfig.defaults());
        model = new MultispeciesQualityModel(ExpressionConfig.defaults());
        model.setName("arsenico");
        model.setDescription("Oxidación de arsénico con cloramina");
        model.getReferences().add(Map.of("author", "Gu, B.", "year", 1994));
        model.setOptions(Map.of("rate_units", "HR", "rtol", 0.001, "atol", 0.0001));
        model.addBulkSpecies("AS3", "UG", 0.001, 0.0001, null);
        model.addBulkSpecies("AS5", "UG");
        model.addWallSpecies("AS5s", "UG");
        model.addConstant("Ka", 10.0, null, "1/(mg*hr)");
        model.addParameter("Kb", 0.1, null, null, Map.of("P1", 0.2), null);
        model.addOtherTerm("Ks", "Kb*AS5");
        model.addPipeReaction("AS3", "RATE", "-Ka*AS3");
        model.addPipeReaction("AS5", "RATE", "Ka*AS3 - Av*Ks");
        model.addTankReaction("AS3", "RATE", "-Ka*AS3");
        model.addPipeReaction("AS5s", "EQUIL", "Ks*AS5 - AS5s");
        model.getNetworkData().addPattern("P", List.of(1, 2));
        model.getNetworkData().addSource("AS3", "N1", "CONCEN", 10.0, "P");
    }

    @Test
    @DisplayName("Un modelo escrito a disco se lee igual")
    void writeAndRead_shouldPreserveModel() throws IOException {
        Path file = tempDir.resolve("modelos").resolve("arsenico.json");

        handler.writeToFile(model, file.toString());
        MultispeciesQualityModel loaded = handler.readFromFile(file.toString());

        assertThat(Files.exists(file)).isTrue();
        assertThat(loaded).isEqualTo(model);
        assertThat(loaded.getReaction("AS5s", "PIPE").getExpression()).isEqualTo("Ks*AS5 - AS5s");
    }

    @Test
    @DisplayName("El JSON usa las claves del diccionario del modelo")
    void toJson_shouldUseDictKeys() throws IOException {
        String json = handler.toJson(model);

        assertThat(json).contains("\"pipe_reactions\"", "\"network_data\"", "\"species_type\" : \"bulk\"");
        assertThat(handler.fromJson(json)).isEqualTo(model);
    }

    @Test
    @DisplayName("Leer un archivo inexistente lanza IOException")
    void readFromFile_shouldFailWhenMissing() {
        String missing = tempDir.resolve("no-existe.json").toString();

        assertThatThrownBy(() -> handler.readFromFile(missing))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no existe");
    }

    @Test
    @DisplayName("Un archivo que no es JSON válido lanza IOException")
    void readFromFile_shouldFailOnInvalidJson() throws IOException {
        Path file = tempDir.resolve("roto.json");
        Files.writeString(file, "{ esto no es json");

        assertThatThrownBy(() -> handler.readFromFile(file.toString())).isInstanceOf(IOException.class);
    }
}
