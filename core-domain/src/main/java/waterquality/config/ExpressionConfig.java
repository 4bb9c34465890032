package waterquality.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Locale;

/**
 * Configuración del compilador de expresiones.
 */
@Value
@Builder
@With
public class ExpressionConfig {

    public static final String BACKEND_PROPERTY = "waterquality.expression.backend";
    public static final String CACHE_PROPERTY = "waterquality.expression.cache";

    /**
     * Backend con el que se analizan y evalúan las expresiones.
     * Por defecto: AUTO (simbólico si commons-math3 está en el classpath).
     */
    @Builder.Default
    BackendMode backend = BackendMode.AUTO;

    /**
     * Cachea la expresión compilada de cada reacción hasta que cambie el conjunto de variables.
     */
    @Builder.Default
    boolean cacheEnabled = true;

    public static ExpressionConfig defaults() {
        return ExpressionConfig.builder().build();
    }

    /**
     * Lee {@value #BACKEND_PROPERTY} y {@value #CACHE_PROPERTY}; lo que no esté definido toma el valor por defecto.
     *
     * @throws IllegalArgumentException si el backend indicado no existe.
     */
    public static ExpressionConfig fromSystemProperties() {
        ExpressionConfigBuilder builder = ExpressionConfig.builder();
        String backend = System.getProperty(BACKEND_PROPERTY);
        if (backend != null && !backend.isBlank()) {
            builder.backend(BackendMode.valueOf(backend.trim().toUpperCase(Locale.ROOT)));
        }
        String cache = System.getProperty(CACHE_PROPERTY);
        if (cache != null && !cache.isBlank()) {
            builder.cacheEnabled(Boolean.parseBoolean(cache.trim()));
        }
        return builder.build();
    }

    public enum BackendMode {
        /**
         * Simbólico si está disponible; si no, numérico (modo degradado).
         */
        AUTO,
        /**
         * Pide el simbólico. Si falta la dependencia se degrada igualmente al numérico.
         */
        SYMBOLIC,
        /**
         * Solo evaluación numérica, sin manipulación simbólica.
         */
        NUMERIC
    }
}
