package waterquality.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import waterquality.domain.exception.InvalidArgumentException;
import waterquality.util.Coercions;
import waterquality.util.JsonMapping;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Opciones de la sección [REPORT] de EPANET-MSX.
 * <p>
 * {@code nodes} y {@code links} admiten {@code null} (sin salida), {@code "ALL"} o una lista de nombres.
 */
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor
@JsonPropertyOrder({"pagesize", "report_filename", "species", "species_precision", "nodes", "links"})
public class MsxReportOptions {

    public static final String ALL = "ALL";

    @JsonProperty("pagesize")
    private Integer pagesize;

    @JsonProperty("report_filename")
    private String reportFilename;

    /**
     * Salida por especie activada o no. Por defecto ninguna especie se reporta.
     */
    @JsonProperty("species")
    private Map<String, Boolean> species = new LinkedHashMap<>();

    /**
     * Decimales con los que se escribe cada especie.
     */
    @JsonProperty("species_precision")
    private Map<String, Integer> speciesPrecision = new LinkedHashMap<>();

    @JsonProperty("nodes")
    private Object nodes;

    @JsonProperty("links")
    private Object links;

    public void setPagesize(Object pagesize) {
        this.pagesize = pagesize == null ? null : Coercions.toInt(pagesize, "pagesize");
    }

    public void setReportFilename(String reportFilename) {
        this.reportFilename = reportFilename;
    }

    public void setSpecies(Map<String, Boolean> species) {
        this.species = species == null ? new LinkedHashMap<>() : new LinkedHashMap<>(species);
    }

    public void setSpeciesPrecision(Map<String, Integer> speciesPrecision) {
        this.speciesPrecision = speciesPrecision == null ? new LinkedHashMap<>() : new LinkedHashMap<>(speciesPrecision);
    }

    public void setNodes(Object nodes) {
        this.nodes = selection(nodes, "nodes");
    }

    public void setLinks(Object links) {
        this.links = selection(links, "links");
    }

    public Map<String, Object> toDict() {
        return JsonMapping.toDict(this);
    }

    /**
     * Acepta una instancia, un mapa con las claves de {@link #toDict()} o {@code null} (opciones por defecto).
     *
     * @throws InvalidArgumentException si el valor no es convertible.
     */
    public static MsxReportOptions factory(Object value) {
        if (value == null) {
            return new MsxReportOptions();
        }
        if (value instanceof MsxReportOptions options) {
            return options;
        }
        if (value instanceof Map<?, ?> map) {
            try {
                return JsonMapping.mapper().convertValue(map, MsxReportOptions.class);
            } catch (IllegalArgumentException e) {
                throw new InvalidArgumentException("Opciones de informe no válidas: " + e.getMessage(), e);
            }
        }
        throw new InvalidArgumentException("report debe ser MsxReportOptions o un mapa, se recibió " + value.getClass().getSimpleName());
    }

    private static Object selection(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text && text.strip().toUpperCase(Locale.ROOT).equals(ALL)) {
            return ALL;
        }
        if (value instanceof Collection<?> names) {
            return names.stream().map(String::valueOf).toList();
        }
        if (value instanceof String text) {
            return List.of(text);
        }
        throw new InvalidArgumentException(field + " debe ser \"ALL\" o una lista de nombres");
    }
}
