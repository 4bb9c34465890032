package waterquality.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import waterquality.config.ExpressionConfig;
import waterquality.factory.QualityModelFactory;
import waterquality.model.MultispeciesQualityModel;
import waterquality.util.JsonMapping;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persistencia de modelos multiespecie como JSON.
 * <p>
 * Escribe {@link MultispeciesQualityModel#toDict()} con indentación y lo vuelve a leer a
 * través de {@link QualityModelFactory}. Los errores de validación del contenido (nombres
 * repetidos, especies inexistentes...) se propagan con sus propias excepciones; los de
 * lectura y formato como {@link IOException}.
 */
@Slf4j
public class MsxModelJsonHandler {

    private static final TypeReference<LinkedHashMap<String, Object>> DICT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = JsonMapping.mapper();
    private final ExpressionConfig expressionConfig;

    public MsxModelJsonHandler() {
        this(ExpressionConfig.fromSystemProperties());
    }

    public MsxModelJsonHandler(ExpressionConfig expressionConfig) {
        this.expressionConfig = expressionConfig;
    }

    /**
     * Serializa el modelo en la ruta indicada. Si el archivo ya existe, se sobrescribe.
     *
     * @throws IOException si falla la escritura.
     */
    public void writeToFile(MultispeciesQualityModel model, String filePath) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Guardando modelo '{}' en {}", model.getName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), model.toDict());
            log.debug("Escritura del modelo completada.");
        } catch (IOException e) {
            log.error("Error al escribir el modelo en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee un modelo guardado con {@link #writeToFile}.
     *
     * @throws IOException si el archivo no existe o no es JSON válido.
     */
    public MultispeciesQualityModel readFromFile(String filePath) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Leyendo modelo desde {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        Map<String, Object> dict;
        try {
            dict = objectMapper.readValue(path.toFile(), DICT);
        } catch (IOException e) {
            log.error("Error al leer o parsear el modelo desde {}", path.toAbsolutePath(), e);
            throw e;
        }
        return QualityModelFactory.fromDict(dict, expressionConfig);
    }

    public String toJson(MultispeciesQualityModel model) throws IOException {
        return objectMapper.writeValueAsString(model.toDict());
    }

    public MultispeciesQualityModel fromJson(String json) throws IOException {
        return QualityModelFactory.fromDict(objectMapper.readValue(json, DICT), expressionConfig);
    }
}
