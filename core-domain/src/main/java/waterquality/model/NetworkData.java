package waterquality.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import waterquality.config.SourceType;
import waterquality.domain.exception.UnknownReferenceException;
import waterquality.util.Coercions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Datos de la red asociados a las especies: calidad inicial, fuentes y patrones.
 * <p>
 * El modelo crea las entradas de una especie al darla de alta y las borra al eliminarla;
 * consultar una especie sin entrada falla con {@link UnknownReferenceException}.
 */
@ToString
@EqualsAndHashCode
public class NetworkData {

    private final Map<String, InitialQuality> initialQuality = new LinkedHashMap<>();
    private final Map<String, Map<String, QualitySource>> sources = new LinkedHashMap<>();
    private final Map<String, List<Double>> patterns = new LinkedHashMap<>();

    void registerSpecies(String species) {
        initialQuality.put(species, new InitialQuality());
        sources.put(species, new LinkedHashMap<>());
    }

    void purgeSpecies(String species) {
        initialQuality.remove(species);
        sources.remove(species);
    }

    public boolean hasSpecies(String species) {
        return initialQuality.containsKey(species);
    }

    public InitialQuality getInitialQuality(String species) {
        InitialQuality quality = initialQuality.get(species);
        if (quality == null) {
            throw new UnknownReferenceException("No hay datos de red para la especie '" + species + "'");
        }
        return quality;
    }

    /**
     * Fuentes de la especie, por nombre de nudo. Vista no modificable.
     */
    public Map<String, QualitySource> getSources(String species) {
        return Collections.unmodifiableMap(sourcesOf(species));
    }

    public QualitySource addSource(String species, String node, Object type, double strength, String pattern) {
        if (pattern != null && !patterns.containsKey(pattern)) {
            throw new UnknownReferenceException("El patrón '" + pattern + "' no existe");
        }
        QualitySource source = new QualitySource(SourceType.get(type), strength, pattern);
        sourcesOf(species).put(node, source);
        return source;
    }

    public void removeSource(String species, String node) {
        sourcesOf(species).remove(node);
    }

    public void addPattern(String name, List<? extends Number> multipliers) {
        List<Double> values = new ArrayList<>();
        multipliers.forEach(m -> values.add(m.doubleValue()));
        patterns.put(name, values);
    }

    public List<Double> getPattern(String name) {
        List<Double> pattern = patterns.get(name);
        if (pattern == null) {
            throw new UnknownReferenceException("El patrón '" + name + "' no existe");
        }
        return Collections.unmodifiableList(pattern);
    }

    public Map<String, Object> toDict() {
        Map<String, Object> quality = new LinkedHashMap<>();
        initialQuality.forEach((k, v) -> quality.put(k, v.toDict()));
        Map<String, Object> injections = new LinkedHashMap<>();
        sources.forEach((species, byNode) -> {
            Map<String, Object> nodes = new LinkedHashMap<>();
            byNode.forEach((node, source) -> nodes.put(node, source.toDict()));
            injections.put(species, nodes);
        });
        Map<String, Object> rep = new LinkedHashMap<>();
        rep.put("initial_quality", quality);
        rep.put("sources", injections);
        rep.put("patterns", new LinkedHashMap<>(patterns));
        return rep;
    }

    /**
     * Carga los datos de un mapa de {@link #toDict()}. Solo se aceptan especies ya registradas.
     */
    void loadDict(Map<?, ?> dict) {
        if (dict.get("patterns") instanceof Map<?, ?> loaded) {
            loaded.forEach((name, values) -> {
                List<Double> multipliers = new ArrayList<>();
                if (values instanceof List<?> list) {
                    list.forEach(v -> multipliers.add(Coercions.toDouble(v, "patterns")));
                }
                patterns.put(String.valueOf(name), multipliers);
            });
        }
        if (dict.get("initial_quality") instanceof Map<?, ?> loaded) {
            loaded.forEach((species, value) -> {
                String name = String.valueOf(species);
                if (!hasSpecies(name)) {
                    throw new UnknownReferenceException("No hay datos de red para la especie '" + name + "'");
                }
                if (value instanceof Map<?, ?> entry) {
                    initialQuality.put(name, InitialQuality.fromDict(entry));
                }
            });
        }
        if (dict.get("sources") instanceof Map<?, ?> loaded) {
            loaded.forEach((species, byNode) -> {
                Map<String, QualitySource> target = sourcesOf(String.valueOf(species));
                if (byNode instanceof Map<?, ?> nodes) {
                    nodes.forEach((node, source) -> {
                        if (source instanceof Map<?, ?> entry) {
                            target.put(String.valueOf(node), QualitySource.fromDict(entry));
                        }
                    });
                }
            });
        }
    }

    private Map<String, QualitySource> sourcesOf(String species) {
        Map<String, QualitySource> bySpecies = sources.get(species);
        if (bySpecies == null) {
            throw new UnknownReferenceException("No hay datos de red para la especie '" + species + "'");
        }
        return bySpecies;
    }
}
