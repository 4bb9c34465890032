package waterquality.domain.reaction;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import waterquality.domain.exception.InvalidArgumentException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Dinámica de reacción de una especie en un tipo de elemento (tubería o depósito).
 * <p>
 * Las tres variantes ({@link RateDynamics}, {@link EquilibriumDynamics},
 * {@link FormulaDynamics}) guardan los mismos datos y solo cambian en cómo se
 * interpreta la expresión; el tipo de dinámica lo fija la clase concreta.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public abstract class ReactionDynamics {

    @EqualsAndHashCode.Include
    private final String species;

    @EqualsAndHashCode.Include
    private final LocationType location;

    @Setter
    @EqualsAndHashCode.Include
    private String expression;

    @Setter
    private String note;

    protected ReactionDynamics(String species, LocationType location, String expression, String note) {
        if (species == null) {
            throw new InvalidArgumentException("El nombre de la especie no puede ser nulo.");
        }
        if (location == null) {
            throw new InvalidArgumentException("La ubicación de la reacción no puede ser nula.");
        }
        this.species = species;
        this.location = location;
        this.expression = Objects.requireNonNull(expression, "La expresión no puede ser nula.");
        this.note = note;
    }

    /**
     * Crea la variante concreta correspondiente al tipo de dinámica.
     */
    public static ReactionDynamics of(DynamicsType dynamics, String species, LocationType location,
                                      String expression, String note) {
        if (dynamics == null) {
            throw new InvalidArgumentException("El tipo de dinámica no puede ser nulo.");
        }
        return switch (dynamics) {
            case RATE -> new RateDynamics(species, location, expression, note);
            case EQUIL -> new EquilibriumDynamics(species, location, expression, note);
            case FORMULA -> new FormulaDynamics(species, location, expression, note);
        };
    }

    public abstract DynamicsType getDynamics();

    public Map<String, Object> toDict() {
        Map<String, Object> rep = new LinkedHashMap<>();
        rep.put("species", species);
        rep.put("location", location.name().toLowerCase(Locale.ROOT));
        rep.put("dynamics", getDynamics().name().toLowerCase(Locale.ROOT));
        rep.put("expression", expression);
        rep.put("note", note);
        return rep;
    }

    @Override
    public String toString() {
        return species + "->" + location.name();
    }
}
