package waterquality.factory;

import lombok.extern.slf4j.Slf4j;
import waterquality.config.ExpressionConfig;
import waterquality.domain.exception.InvalidArgumentException;
import waterquality.domain.variable.VariableType;
import waterquality.model.MultispeciesQualityModel;

import java.util.List;
import java.util.Map;

/**
 * Fábrica que reconstruye un {@link MultispeciesQualityModel} a partir de su representación
 * como datos planos ({@link MultispeciesQualityModel#toDict()}).
 * <p>
 * El orden de carga respeta las dependencias: metadatos y opciones, después especies,
 * constantes, parámetros y términos, después reacciones (que exigen la especie) y por
 * último los datos de red (que exigen la especie registrada).
 * Se cumple {@code fromDict(m.toDict()).equals(m)}.
 */
@Slf4j
public class QualityModelFactory {

    private QualityModelFactory() {
    }

    public static MultispeciesQualityModel fromDict(Map<String, ?> dict) {
        return fromDict(dict, ExpressionConfig.fromSystemProperties());
    }

    public static MultispeciesQualityModel fromDict(Map<String, ?> dict, ExpressionConfig expressionConfig) {
        MultispeciesQualityModel model = new MultispeciesQualityModel(expressionConfig);
        appendFromDict(model, dict);
        return model;
    }

    /**
     * Añade al modelo el contenido del mapa. Los metadatos y las opciones presentes en el
     * mapa sustituyen a los del modelo.
     *
     * @throws InvalidArgumentException si alguna sección no tiene la forma esperada.
     */
    public static void appendFromDict(MultispeciesQualityModel model, Map<String, ?> dict) {
        if (dict == null) {
            throw new InvalidArgumentException("El diccionario del modelo no puede ser nulo.");
        }
        if (dict.containsKey("name")) {
            model.setName(stringOrNull(dict.get("name")));
        }
        if (dict.containsKey("title")) {
            model.setTitle(stringOrNull(dict.get("title")));
        }
        if (dict.containsKey("description")) {
            model.setDescription(stringOrNull(dict.get("description")));
        }
        if (dict.get("references") instanceof List<?> references) {
            model.getReferences().addAll(references);
        }
        if (dict.get("options") != null) {
            model.setOptions(dict.get("options"));
        }

        loadGroup(model, dict, "species", VariableType.SPECIES);
        loadGroup(model, dict, "constants", VariableType.CONSTANT);
        loadGroup(model, dict, "parameters", VariableType.PARAMETER);
        loadGroup(model, dict, "terms", VariableType.TERM);

        loadReactions(model, dict, "pipe_reactions");
        loadReactions(model, dict, "tank_reactions");

        if (dict.get("network_data") instanceof Map<?, ?> networkData) {
            model.loadNetworkData(networkData);
        }
        log.debug("Modelo '{}' cargado desde diccionario: {} variables", model.getName(), model.variableNames().size());
    }

    private static void loadGroup(MultispeciesQualityModel model, Map<String, ?> dict, String key, VariableType type) {
        for (Map.Entry<String, Map<String, Object>> entry : section(dict, key).entrySet()) {
            model.addVariable(type, entry.getKey(), entry.getValue());
        }
    }

    private static void loadReactions(MultispeciesQualityModel model, Map<String, ?> dict, String key) {
        for (Map<String, Object> reaction : section(dict, key).values()) {
            Object expression = reaction.get("expression");
            model.addReaction(reaction.get("location"), reaction.get("species"), reaction.get("dynamics"),
                    expression == null ? null : String.valueOf(expression), stringOrNull(reaction.get("note")));
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> section(Map<String, ?> dict, String key) {
        Object value = dict.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidArgumentException("La sección '" + key + "' debe ser un mapa");
        }
        for (Object item : map.values()) {
            if (!(item instanceof Map)) {
                throw new InvalidArgumentException("Cada entrada de '" + key + "' debe ser un mapa");
            }
        }
        return (Map<String, Map<String, Object>>) map;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
