package waterquality.physics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import waterquality.domain.exception.InvalidArgumentException;
import waterquality.domain.reaction.LocationType;
import waterquality.domain.reaction.ReactionDynamics;
import waterquality.domain.variable.Constant;
import waterquality.domain.variable.Parameter;
import waterquality.domain.variable.ReactionVariable;
import waterquality.domain.variable.VariableType;
import waterquality.model.MultispeciesQualityModel;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Evalúa el lado derecho de las reacciones de un elemento de la red en un instante.
 * <p>
 * Es el punto de entrega al integrador externo: por cada paso, el integrador pasa el
 * estado hidráulico del elemento y las concentraciones actuales, y recibe el valor de
 * cada expresión (tasa, residuo de equilibrio o fórmula según la dinámica).
 * <p>
 * Los parámetros toman el valor propio de la tubería o del depósito si lo tienen; si no,
 * el global. Las constantes usan siempre su valor global.
 */
@Slf4j
@RequiredArgsConstructor
public class ReactionRateEvaluator {

    private final MultispeciesQualityModel model;

    /**
     * Evalúa todas las reacciones definidas para {@code location}.
     *
     * @param location       PIPE o TANK.
     * @param elementName    nombre de la tubería o del depósito (para los valores propios de los parámetros).
     * @param hydraulics     estado hidráulico del elemento.
     * @param concentrations concentración actual de cada especie.
     * @return valor de cada reacción, por nombre de especie, en el orden en que se definieron.
     * @throws waterquality.domain.exception.ExpressionCompileException si alguna expresión no compila o falta
     *                                                                  la concentración de una especie usada.
     */
    public Map<String, Double> evaluate(LocationType location, String elementName, HydraulicState hydraulics,
                                        Map<String, Double> concentrations) {
        Map<String, Double> bindings = bindings(location, elementName, hydraulics, concentrations);
        Map<String, Double> results = new LinkedHashMap<>();
        for (ReactionDynamics reaction : model.reactions(location)) {
            results.put(reaction.getSpecies(), model.compileReaction(reaction).evaluate(bindings));
        }
        log.trace("Evaluadas {} reacciones en {} '{}'", results.size(), location, elementName);
        return results;
    }

    /**
     * Evalúa una única reacción.
     */
    public double evaluate(ReactionDynamics reaction, String elementName, HydraulicState hydraulics,
                           Map<String, Double> concentrations) {
        Objects.requireNonNull(reaction, "La reacción no puede ser nula.");
        return model.compileReaction(reaction)
                .evaluate(bindings(reaction.getLocation(), elementName, hydraulics, concentrations));
    }

    /**
     * Valores de todos los símbolos que puede usar una expresión en ese elemento.
     */
    public Map<String, Double> bindings(LocationType location, String elementName, HydraulicState hydraulics,
                                        Map<String, Double> concentrations) {
        if (location == null) {
            throw new InvalidArgumentException("La ubicación no puede ser nula.");
        }
        Objects.requireNonNull(hydraulics, "El estado hidráulico no puede ser nulo.");
        Map<String, Double> bindings = new HashMap<>(hydraulics.toBindings());
        for (ReactionVariable variable : model.variables(VariableType.CONSTANT)) {
            bindings.put(variable.getName(), ((Constant) variable).getValue());
        }
        for (ReactionVariable variable : model.variables(VariableType.PARAMETER)) {
            Parameter parameter = (Parameter) variable;
            double value = location == LocationType.PIPE
                    ? parameter.getValue(elementName, null)
                    : parameter.getValue(null, elementName);
            bindings.put(parameter.getName(), value);
        }
        if (concentrations != null) {
            Set<String> species = Set.copyOf(model.speciesNames());
            concentrations.forEach((name, value) -> {
                if (!species.contains(name)) {
                    throw new InvalidArgumentException("'" + name + "' no es una especie del modelo");
                }
                bindings.put(name, value);
            });
        }
        return bindings;
    }
}
