package waterquality.domain.variable;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import waterquality.domain.exception.InvalidArgumentException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Especie química o biológica transportada por la red.
 * <p>
 * Las tolerancias del integrador son opcionales: o se definen las dos (ambas &gt; 0)
 * o ninguna, en cuyo caso se usan las globales de las opciones.
 */
@Getter
@EqualsAndHashCode(callSuper = true, onlyExplicitlyIncluded = true)
public final class Species extends ReactionVariable {

    @EqualsAndHashCode.Include
    private final SpeciesType speciesType;

    @Setter
    @EqualsAndHashCode.Include
    private String units;

    @Setter
    @EqualsAndHashCode.Include
    private Double diffusivity;

    @EqualsAndHashCode.Include
    private Double atol;

    @EqualsAndHashCode.Include
    private Double rtol;

    /**
     * @param speciesType BULK o WALL (no nulo).
     * @param name        nombre de la especie, no puede ser una palabra reservada.
     * @param units       unidades de concentración.
     * @param atol        tolerancia absoluta, o {@code null}.
     * @param rtol        tolerancia relativa, o {@code null}.
     * @param note        comentario libre.
     * @param diffusivity difusividad molecular, o {@code null}.
     */
    @Builder
    public Species(SpeciesType speciesType, String name, String units, Double atol, Double rtol,
                   String note, Double diffusivity) {
        super(name, note);
        if (speciesType == null) {
            throw new InvalidArgumentException("El tipo de especie no puede ser nulo.");
        }
        this.speciesType = speciesType;
        this.units = units;
        this.diffusivity = diffusivity;
        setTolerances(atol, rtol);
    }

    @Override
    public VariableType getVarType() {
        return VariableType.SPECIES;
    }

    public boolean isBulk() {
        return speciesType == SpeciesType.BULK;
    }

    public boolean isWall() {
        return speciesType == SpeciesType.WALL;
    }

    /**
     * @return las tolerancias propias, o vacío si se usan las globales.
     */
    public Optional<Tolerances> getTolerances() {
        if (atol != null && rtol != null) {
            return Optional.of(new Tolerances(atol, rtol));
        }
        return Optional.empty();
    }

    /**
     * Fija las tolerancias propias de la especie. Dos {@code null} las borran.
     *
     * @throws InvalidArgumentException si solo se da una de las dos, o si alguna es &lt;= 0.
     */
    public void setTolerances(Double absolute, Double relative) {
        if (absolute == null && relative == null) {
            clearTolerances();
            return;
        }
        if (absolute == null || relative == null) {
            throw new InvalidArgumentException(String.format(
                    "atol y rtol deben definirse juntas, se recibió %s y %s", absolute, relative));
        }
        if (absolute <= 0) {
            throw new InvalidArgumentException("La tolerancia absoluta debe ser mayor que 0");
        }
        if (relative <= 0) {
            throw new InvalidArgumentException("La tolerancia relativa debe ser mayor que 0");
        }
        this.atol = absolute;
        this.rtol = relative;
    }

    public void clearTolerances() {
        this.atol = null;
        this.rtol = null;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> rep = new LinkedHashMap<>();
        rep.put("name", getName());
        rep.put("species_type", speciesType.name().toLowerCase(Locale.ROOT));
        rep.put("units", units);
        getTolerances().ifPresent(t -> {
            rep.put("atol", t.absolute());
            rep.put("rtol", t.relative());
        });
        if (diffusivity != null) {
            rep.put("diffusivity", diffusivity);
        }
        rep.put("note", getNote());
        return rep;
    }
}
