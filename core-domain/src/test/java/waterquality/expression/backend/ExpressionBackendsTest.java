package waterquality.expression.backend;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import waterquality.config.ExpressionConfig;

import static org.assertj.core.api.Assertions.assertThat;

class ExpressionBackendsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(ExpressionConfig.BACKEND_PROPERTY);
        System.clearProperty(ExpressionConfig.CACHE_PROPERTY);
    }

    @Test
    @DisplayName("Con commons-math3 en el classpath AUTO elige el backend simbólico")
    void auto_shouldPickSymbolicWhenAvailable() {
        assertThat(ExpressionBackends.isSymbolicAvailable()).isTrue();
        assertThat(ExpressionBackends.defaultBackend()).isInstanceOf(SymbolicExpressionBackend.class);
    }

    @Test
    @DisplayName("Sin la dependencia simbólica se degrada al backend numérico")
    void missingSymbolicDependency_shouldFallBackToNumeric() {
        ExpressionConfig symbolic = ExpressionConfig.builder().backend(ExpressionConfig.BackendMode.SYMBOLIC).build();

        assertThat(ExpressionBackends.select(symbolic, false)).isInstanceOf(NumericExpressionBackend.class);
        assertThat(ExpressionBackends.select(ExpressionConfig.defaults(), false)).isInstanceOf(NumericExpressionBackend.class);
    }

    @Test
    @DisplayName("NUMERIC fuerza el backend numérico aunque el simbólico esté disponible")
    void numericMode_shouldAlwaysBeNumeric() {
        ExpressionConfig numeric = ExpressionConfig.builder().backend(ExpressionConfig.BackendMode.NUMERIC).build();

        assertThat(ExpressionBackends.select(numeric)).isInstanceOf(NumericExpressionBackend.class);
    }

    @Test
    @DisplayName("La configuración se puede leer de las propiedades del sistema")
    void config_shouldBeReadFromSystemProperties() {
        System.setProperty(ExpressionConfig.BACKEND_PROPERTY, "numeric");
        System.setProperty(ExpressionConfig.CACHE_PROPERTY, "false");

        ExpressionConfig config = ExpressionConfig.fromSystemProperties();

        assertThat(config.getBackend()).isEqualTo(ExpressionConfig.BackendMode.NUMERIC);
        assertThat(config.isCacheEnabled()).isFalse();
        assertThat(ExpressionConfig.defaults().isCacheEnabled()).isTrue();
    }
}
