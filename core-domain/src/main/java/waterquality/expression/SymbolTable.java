package waterquality.expression;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Nombres que una expresión puede referenciar.
 * <p>
 * Las variables hidráulicas están siempre disponibles. En modo estricto cualquier otro
 * símbolo debe estar declarado; en modo permisivo los símbolos desconocidos se aceptan
 * como símbolos libres declarados implícitamente (su valor se exigirá al evaluar).
 */
public final class SymbolTable {

    private final Set<String> names;
    private final boolean strict;

    private SymbolTable(Collection<String> declared, boolean strict) {
        Set<String> all = new LinkedHashSet<>();
        Arrays.stream(HydraulicVariable.values()).map(HydraulicVariable::getSymbol).forEach(all::add);
        all.addAll(declared);
        this.names = Collections.unmodifiableSet(all);
        this.strict = strict;
    }

    public static SymbolTable strict(Collection<String> declared) {
        return new SymbolTable(declared, true);
    }

    public static SymbolTable lenient(Collection<String> declared) {
        return new SymbolTable(declared, false);
    }

    public static SymbolTable lenient() {
        return lenient(Set.of());
    }

    public boolean isStrict() {
        return strict;
    }

    public boolean isDeclared(String name) {
        return names.contains(name);
    }

    public Set<String> getNames() {
        return names;
    }
}
