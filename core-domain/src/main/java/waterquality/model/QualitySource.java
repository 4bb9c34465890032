package waterquality.model;

import waterquality.config.SourceType;
import waterquality.util.Coercions;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inyección de una especie en un nudo.
 *
 * @param type     tipo de fuente.
 * @param strength intensidad base (concentración o caudal másico según el tipo).
 * @param pattern  patrón temporal que multiplica la intensidad, o {@code null}.
 */
public record QualitySource(SourceType type, double strength, String pattern) {

    public QualitySource {
        Objects.requireNonNull(type, "El tipo de fuente no puede ser nulo.");
    }

    public Map<String, Object> toDict() {
        Map<String, Object> rep = new LinkedHashMap<>();
        rep.put("type", type.name());
        rep.put("strength", strength);
        rep.put("pattern", pattern);
        return rep;
    }

    static QualitySource fromDict(Map<?, ?> dict) {
        Object pattern = dict.get("pattern");
        return new QualitySource(
                SourceType.get(dict.get("type")),
                Coercions.toDouble(dict.get("strength"), "strength"),
                pattern == null ? null : String.valueOf(pattern));
    }
}
