package waterquality.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import waterquality.util.Coercions;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calidad inicial de una especie: un valor global opcional y valores propios por nudo o por línea.
 */
@Getter
@ToString
@EqualsAndHashCode
public class InitialQuality {

    @Setter
    private Double globalValue;
    private final Map<String, Double> nodeValues = new LinkedHashMap<>();
    private final Map<String, Double> linkValues = new LinkedHashMap<>();

    public Map<String, Object> toDict() {
        Map<String, Object> rep = new LinkedHashMap<>();
        rep.put("global", globalValue);
        rep.put("nodes", new LinkedHashMap<>(nodeValues));
        rep.put("links", new LinkedHashMap<>(linkValues));
        return rep;
    }

    static InitialQuality fromDict(Map<?, ?> dict) {
        InitialQuality quality = new InitialQuality();
        quality.setGlobalValue(Coercions.toNullableDouble(dict.get("global"), "global"));
        copyValues(dict.get("nodes"), quality.nodeValues, "nodes");
        copyValues(dict.get("links"), quality.linkValues, "links");
        return quality;
    }

    private static void copyValues(Object source, Map<String, Double> target, String field) {
        if (source instanceof Map<?, ?> values) {
            values.forEach((k, v) -> target.put(String.valueOf(k), Coercions.toDouble(v, field)));
        }
    }
}
