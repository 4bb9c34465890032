package waterquality.expression.backend;

import lombok.extern.slf4j.Slf4j;
import waterquality.config.ExpressionConfig;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Selección del backend de expresiones.
 * <p>
 * Si commons-math3 no está en el classpath se usa {@link NumericExpressionBackend} y se
 * emite un único aviso (modo degradado: evaluación numérica sin manipulación simbólica).
 */
@Slf4j
public final class ExpressionBackends {

    static final String SYMBOLIC_PROBE_CLASS = "org.apache.commons.math3.analysis.function.Log10";

    private static final AtomicBoolean DEGRADED_NOTICE_EMITTED = new AtomicBoolean(false);

    private ExpressionBackends() {
    }

    public static ExpressionBackend select(ExpressionConfig config) {
        return select(config, isSymbolicAvailable());
    }

    public static ExpressionBackend defaultBackend() {
        return select(ExpressionConfig.defaults());
    }

    static ExpressionBackend select(ExpressionConfig config, boolean symbolicAvailable) {
        switch (config.getBackend()) {
            case NUMERIC -> {
                return new NumericExpressionBackend();
            }
            case SYMBOLIC, AUTO -> {
                if (symbolicAvailable) {
                    return new SymbolicExpressionBackend();
                }
                if (DEGRADED_NOTICE_EMITTED.compareAndSet(false, true)) {
                    log.warn("commons-math3 no está disponible: se usa el backend numérico. "
                            + "Las expresiones se pueden evaluar pero no simplificar.");
                }
                return new NumericExpressionBackend();
            }
            default -> throw new IllegalArgumentException("Modo de backend no soportado: " + config.getBackend());
        }
    }

    public static boolean isSymbolicAvailable() {
        try {
            Class.forName(SYMBOLIC_PROBE_CLASS, false, ExpressionBackends.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            log.debug("Clase de sondeo {} no encontrada", SYMBOLIC_PROBE_CLASS);
            return false;
        }
    }
}
