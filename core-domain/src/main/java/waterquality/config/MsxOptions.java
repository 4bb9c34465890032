package waterquality.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import waterquality.domain.exception.InvalidArgumentException;
import waterquality.util.Coercions;
import waterquality.util.JsonMapping;

import java.util.Map;

/**
 * Opciones del solver de calidad multiespecie (sección [OPTIONS] de EPANET-MSX).
 * <p>
 * Los setters validan y convierten al asignar: {@code timestep} se trunca a entero y se
 * lleva a un mínimo de 1; las tolerancias se convierten a double; los valores categóricos
 * admiten el enum, su nombre (con o sin prefijo {@code MSX_}) o su código entero.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"timestep", "area_units", "rate_units", "solver", "coupling", "atol", "rtol",
        "compiler", "segments", "peclet", "report"})
public class MsxOptions {

    public static final int DEFAULT_TIMESTEP = 360;
    public static final double DEFAULT_TOLERANCE = 1.0e-4;
    public static final int DEFAULT_SEGMENTS = 5000;
    public static final int DEFAULT_PECLET = 1000;

    /**
     * Paso de tiempo de calidad, en segundos.
     */
    @JsonProperty("timestep")
    private int timestep = DEFAULT_TIMESTEP;

    @JsonProperty("area_units")
    private AreaUnitsType areaUnits = AreaUnitsType.M2;

    @JsonProperty("rate_units")
    private RateUnitsType rateUnits = RateUnitsType.MIN;

    @JsonProperty("solver")
    private SolverType solver = SolverType.RK5;

    @JsonProperty("coupling")
    private CouplingType coupling = CouplingType.NONE;

    @JsonProperty("atol")
    private double atol = DEFAULT_TOLERANCE;

    @JsonProperty("rtol")
    private double rtol = DEFAULT_TOLERANCE;

    @JsonProperty("compiler")
    private CompilerType compiler = CompilerType.NONE;

    /**
     * Máximo de segmentos por tubería (MSX 2.0+).
     */
    @JsonProperty("segments")
    private int segments = DEFAULT_SEGMENTS;

    /**
     * Umbral de Péclet para aplicar dispersión (MSX 2.0+).
     */
    @JsonProperty("peclet")
    private int peclet = DEFAULT_PECLET;

    @JsonProperty("report")
    private MsxReportOptions report = new MsxReportOptions();

    public void setTimestep(Object timestep) {
        this.timestep = Math.max(1, Coercions.toInt(timestep, "timestep"));
    }

    public void setAreaUnits(Object areaUnits) {
        this.areaUnits = AreaUnitsType.get(required(areaUnits, "area_units"));
    }

    public void setRateUnits(Object rateUnits) {
        this.rateUnits = RateUnitsType.get(required(rateUnits, "rate_units"));
    }

    public void setSolver(Object solver) {
        this.solver = SolverType.get(required(solver, "solver"));
    }

    public void setCoupling(Object coupling) {
        this.coupling = CouplingType.get(required(coupling, "coupling"));
    }

    public void setAtol(Object atol) {
        this.atol = Coercions.toDouble(atol, "atol");
    }

    public void setRtol(Object rtol) {
        this.rtol = Coercions.toDouble(rtol, "rtol");
    }

    public void setCompiler(Object compiler) {
        this.compiler = CompilerType.get(required(compiler, "compiler"));
    }

    public void setSegments(Object segments) {
        this.segments = Coercions.toInt(segments, "segments");
    }

    public void setPeclet(Object peclet) {
        this.peclet = Coercions.toInt(peclet, "peclet");
    }

    public void setReport(Object report) {
        this.report = MsxReportOptions.factory(report);
    }

    public Map<String, Object> toDict() {
        return JsonMapping.toDict(this);
    }

    /**
     * Reconstruye las opciones desde un mapa; las claves ausentes toman su valor por defecto.
     *
     * @throws InvalidArgumentException si hay claves desconocidas o valores no convertibles.
     */
    public static MsxOptions fromDict(Map<String, ?> dict) {
        if (dict == null) {
            return new MsxOptions();
        }
        try {
            return JsonMapping.mapper().convertValue(dict, MsxOptions.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Opciones no válidas: " + e.getMessage(), e);
        }
    }

    /**
     * Acepta una instancia, un mapa o {@code null} (opciones por defecto).
     */
    public static MsxOptions factory(Object value) {
        if (value == null) {
            return new MsxOptions();
        }
        if (value instanceof MsxOptions options) {
            return options;
        }
        if (value instanceof Map<?, ?> map) {
            @SuppressWarnings("unchecked")
            Map<String, ?> dict = (Map<String, ?>) map;
            return fromDict(dict);
        }
        throw new InvalidArgumentException("options debe ser MsxOptions o un mapa, se recibió " + value.getClass().getSimpleName());
    }

    private static Object required(Object value, String field) {
        if (value == null) {
            throw new InvalidArgumentException(field + " no puede ser nulo");
        }
        return value;
    }
}
