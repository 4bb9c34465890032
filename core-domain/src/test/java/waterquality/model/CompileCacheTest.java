package waterquality.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import waterquality.config.ExpressionConfig;
import waterquality.domain.reaction.ReactionDynamics;
import waterquality.domain.variable.OtherTerm;
import waterquality.expression.CompiledExpression;
import waterquality.expression.SymbolTable;
import waterquality.expression.node.ExpressionNode;
import waterquality.expression.backend.ExpressionBackend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompileCacheTest {

    @Mock
    private ExpressionBackend backend;

    @BeforeEach
    void stubBackend() {
        when(backend.compile(any(ExpressionNode.class), anyString(), any(SymbolTable.class)))
                .thenAnswer(invocation -> new CompiledExpression(invocation.getArgument(1),
                        invocation.getArgument(0), "mock", bindings -> 0.0));
    }

    private MultispeciesQualityModel newModel(boolean cacheEnabled) {
        MultispeciesQualityModel model = new MultispeciesQualityModel(
                ExpressionConfig.defaults().withCacheEnabled(cacheEnabled), backend);
        model.addBulkSpecies("A", "MG");
        model.addConstant("k", 0.1);
        model.addOtherTerm("T1", "k*A");
        return model;
    }

    @Test
    @DisplayName("La misma reacción se compila una sola vez mientras el modelo no cambie")
    void compileReaction_shouldReuseCachedExpression() {
        MultispeciesQualityModel model = newModel(true);
        model.addPipeReaction("A", "RATE", "-T1");

        CompiledExpression first = model.compileReaction("A", "PIPE");
        CompiledExpression second = model.compileReaction("A", "PIPE");

        assertThat(second).isSameAs(first);
        verify(backend, times(1)).compile(any(ExpressionNode.class), anyString(), any(SymbolTable.class));
    }

    @Test
    @DisplayName("Añadir una variable invalida la caché")
    void addVariable_shouldInvalidateCache() {
        MultispeciesQualityModel model = newModel(true);
        model.addPipeReaction("A", "RATE", "-T1");
        model.compileReaction("A", "PIPE");

        model.addConstant("k2", 0.2);
        model.compileReaction("A", "PIPE");

        verify(backend, times(2)).compile(any(ExpressionNode.class), anyString(), any(SymbolTable.class));
    }

    @Test
    @DisplayName("Editar un término o la expresión de la reacción invalida la caché")
    void expressionEdits_shouldInvalidateCache() {
        MultispeciesQualityModel model = newModel(true);
        ReactionDynamics reaction = model.addPipeReaction("A", "RATE", "-T1");
        model.compileReaction(reaction);

        ((OtherTerm) model.getVariable("T1")).setExpression("k*A*A");
        model.compileReaction(reaction);

        reaction.setExpression("-k*A");
        CompiledExpression recompiled = model.compileReaction(reaction);

        assertThat(recompiled.getSource()).isEqualTo("-k*A");
        verify(backend, times(3)).compile(any(ExpressionNode.class), anyString(), any(SymbolTable.class));
    }

    @Test
    @DisplayName("Con la caché desactivada se compila siempre")
    void disabledCache_shouldAlwaysCompile() {
        MultispeciesQualityModel model = newModel(false);
        model.addPipeReaction("A", "RATE", "-T1");

        model.compileReaction("A", "PIPE");
        model.compileReaction("A", "PIPE");

        verify(backend, times(2)).compile(any(ExpressionNode.class), anyString(), any(SymbolTable.class));
    }
}
