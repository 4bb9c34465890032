package waterquality.domain.variable;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import waterquality.domain.exception.InvalidNameException;
import waterquality.expression.ReservedNames;

import java.lang.ref.WeakReference;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Variable de un modelo de calidad multiespecie.
 * <p>
 * Subclases concretas: {@link Species}, {@link Constant}, {@link Parameter},
 * {@link OtherTerm} e {@link InternalVariable}. El tipo concreto se expone como
 * etiqueta mediante {@link #getVarType()}.
 * <p>
 * La igualdad es estructural (mismo tipo concreto, mismo nombre y mismos campos de
 * definición); la nota y el modelo propietario no intervienen.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public abstract class ReactionVariable {

    @EqualsAndHashCode.Include
    private final String name;

    @Setter
    private String note;

    @Getter(AccessLevel.NONE)
    private WeakReference<VariableOwner> owner;

    protected ReactionVariable(String name, String note) {
        this(name, note, true);
    }

    ReactionVariable(String name, String note, boolean checkReserved) {
        Objects.requireNonNull(name, "El nombre de la variable no puede ser nulo.");
        if (checkReserved && ReservedNames.isReserved(name)) {
            throw new InvalidNameException(name);
        }
        this.name = name;
        this.note = note;
    }

    public abstract VariableType getVarType();

    /**
     * Representación como mapa plano, suficiente para reconstruir el objeto.
     */
    public abstract Map<String, Object> toDict();

    /**
     * Enlaza la variable con el modelo que la contiene. Uso interno del modelo.
     */
    public void attachTo(VariableOwner newOwner) {
        this.owner = newOwner == null ? null : new WeakReference<>(newOwner);
    }

    public Optional<VariableOwner> getOwner() {
        return owner == null ? Optional.empty() : Optional.ofNullable(owner.get());
    }

    protected void notifyOwner() {
        getOwner().ifPresent(o -> o.variableChanged(this));
    }

    @Override
    public String toString() {
        return name;
    }
}
