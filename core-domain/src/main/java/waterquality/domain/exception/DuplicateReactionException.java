package waterquality.domain.exception;

import lombok.Getter;
import waterquality.domain.reaction.LocationType;

/**
 * Ya existe una reacción para el par (especie, ubicación). Hay que eliminarla antes
 * de definir otra.
 */
@Getter
public class DuplicateReactionException extends IllegalStateException {

    private final String species;
    private final LocationType location;

    public DuplicateReactionException(String species, LocationType location) {
        super(String.format("La especie '%s' ya tiene definida una reacción en %s.", species, location));
        this.species = species;
        this.location = location;
    }
}
