package waterquality.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import waterquality.config.ExpressionConfig;
import waterquality.config.MsxOptions;
import waterquality.domain.exception.DuplicateReactionException;
import waterquality.domain.exception.InvalidArgumentException;
import waterquality.domain.exception.InvalidNameException;
import waterquality.domain.exception.NameCollisionException;
import waterquality.domain.exception.UnknownReferenceException;
import waterquality.domain.reaction.DynamicsType;
import waterquality.domain.reaction.LocationType;
import waterquality.domain.reaction.ReactionDynamics;
import waterquality.domain.variable.Constant;
import waterquality.domain.variable.InternalVariable;
import waterquality.domain.variable.OtherTerm;
import waterquality.domain.variable.Parameter;
import waterquality.domain.variable.ReactionVariable;
import waterquality.domain.variable.Species;
import waterquality.domain.variable.SpeciesType;
import waterquality.domain.variable.VariableOwner;
import waterquality.domain.variable.VariableType;
import waterquality.expression.CompiledExpression;
import waterquality.expression.ExpressionParser;
import waterquality.expression.HydraulicVariable;
import waterquality.expression.MathFunction;
import waterquality.expression.ReservedNames;
import waterquality.expression.SymbolTable;
import waterquality.expression.TermExpander;
import waterquality.expression.backend.ExpressionBackend;
import waterquality.expression.backend.ExpressionBackends;
import waterquality.expression.node.ExpressionNode;
import waterquality.registry.DisjointMapping;
import waterquality.util.Coercions;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Modelo de reacciones de calidad multiespecie para EPANET-MSX.
 * <p>
 * Es el único propietario de las variables y reacciones. Todas las variables comparten
 * un espacio de nombres plano (no puede haber una especie y una constante con el mismo
 * nombre) pero se recorren por grupos: especies, constantes, parámetros y términos.
 * Las variables hidráulicas y los nombres de función se registran al crear el modelo
 * como variables internas.
 * <p>
 * Cada especie tiene como mucho una reacción en tuberías y una en depósitos. Las
 * expresiones se compilan bajo demanda con el backend configurado; el resultado se
 * cachea por reacción mientras no cambie el conjunto de variables.
 * <p>
 * No es thread-safe: debe construirse desde un único hilo.
 */
@Slf4j
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MultispeciesQualityModel implements VariableOwner {

    public static final String SPECIES_GROUP = "species";
    public static final String CONSTANTS_GROUP = "constants";
    public static final String PARAMETERS_GROUP = "parameters";
    public static final String TERMS_GROUP = "terms";

    /**
     * Valor de ubicación que, al borrar reacciones, abarca tuberías y depósitos.
     */
    public static final String ALL_LOCATIONS = "all";

    /**
     * Título de una línea del modelo.
     */
    @Getter
    @Setter
    @EqualsAndHashCode.Include
    private String name;

    /**
     * Línea de título del fichero MSX.
     */
    @Getter
    @Setter
    @EqualsAndHashCode.Include
    private String title;

    @Getter
    @Setter
    @EqualsAndHashCode.Include
    private String description;

    /**
     * Referencias bibliográficas: cadenas o mapas con los campos de la cita. Lista mutable.
     */
    @Getter
    @EqualsAndHashCode.Include
    private final List<Object> references = new ArrayList<>();

    @Getter
    @EqualsAndHashCode.Include
    private MsxOptions options = new MsxOptions();

    @Getter
    @EqualsAndHashCode.Include
    private final NetworkData networkData = new NetworkData();

    @Getter
    private final ExpressionConfig expressionConfig;

    @Getter
    private final ExpressionBackend backend;

    private final DisjointMapping<String, ReactionVariable> registry = new DisjointMapping<>();

    @EqualsAndHashCode.Include
    private final Map<String, ReactionVariable> species;
    @EqualsAndHashCode.Include
    private final Map<String, ReactionVariable> constants;
    @EqualsAndHashCode.Include
    private final Map<String, ReactionVariable> parameters;
    @EqualsAndHashCode.Include
    private final Map<String, ReactionVariable> terms;

    @EqualsAndHashCode.Include
    private final Map<String, ReactionDynamics> pipeReactions = new LinkedHashMap<>();
    @EqualsAndHashCode.Include
    private final Map<String, ReactionDynamics> tankReactions = new LinkedHashMap<>();

    private final Map<String, CacheEntry> compiled = new HashMap<>();

    /**
     * Contador de cambios del conjunto de variables. Invalida las expresiones compiladas.
     */
    @Getter
    private long revision;

    private record CacheEntry(long revision, String source, CompiledExpression expression) {
    }

    /**
     * Modelo con la configuración de expresiones leída de las propiedades del sistema.
     */
    public MultispeciesQualityModel() {
        this(ExpressionConfig.fromSystemProperties());
    }

    public MultispeciesQualityModel(ExpressionConfig expressionConfig) {
        this(expressionConfig, ExpressionBackends.select(expressionConfig));
    }

    public MultispeciesQualityModel(ExpressionConfig expressionConfig, ExpressionBackend backend) {
        this.expressionConfig = Objects.requireNonNull(expressionConfig, "La configuración de expresiones no puede ser nula.");
        this.backend = Objects.requireNonNull(backend, "El backend de expresiones no puede ser nulo.");
        this.species = registry.addDisjointGroup(SPECIES_GROUP);
        this.constants = registry.addDisjointGroup(CONSTANTS_GROUP);
        this.parameters = registry.addDisjointGroup(PARAMETERS_GROUP);
        this.terms = registry.addDisjointGroup(TERMS_GROUP);

        for (HydraulicVariable h : HydraulicVariable.values()) {
            seedInternal(new InternalVariable(h.getSymbol(), h.getNote()));
        }
        for (MathFunction f : MathFunction.values()) {
            for (String spelling : f.spellings()) {
                seedInternal(new InternalVariable(spelling, "MSX function"));
            }
        }
        log.debug("Modelo creado con backend de expresiones '{}'", backend.getName());
    }

    private void seedInternal(InternalVariable variable) {
        registry.addItemToGroup(null, variable.getName(), variable);
        variable.attachTo(this);
    }

    // ------------------------------------------------------------------
    // Variables
    // ------------------------------------------------------------------

    public boolean hasVariable(String name) {
        return registry.containsKey(name);
    }

    /**
     * @throws UnknownReferenceException si no hay ninguna variable con ese nombre.
     */
    public ReactionVariable getVariable(String name) {
        ReactionVariable variable = registry.get(name);
        if (variable == null) {
            throw new UnknownReferenceException("La variable '" + name + "' no existe en el modelo");
        }
        return variable;
    }

    /**
     * Todas las variables de usuario, en orden: especies, constantes, parámetros y términos.
     */
    public Iterable<ReactionVariable> variables() {
        return variables(null);
    }

    /**
     * Variables de un tipo. El tipo admite todo lo que acepta {@link VariableType#get(Object)};
     * {@code null} equivale a {@link #variables()} y {@code RESERVED} recorre las variables internas.
     * El iterable se puede recorrer tantas veces como se quiera y refleja el estado actual del modelo.
     */
    public Iterable<ReactionVariable> variables(Object varType) {
        VariableType type = resolveTag(varType, "tipo de variable", VariableType::get);
        return () -> streamVariables(type).iterator();
    }

    private Stream<ReactionVariable> streamVariables(VariableType type) {
        if (type == null) {
            return Stream.of(species, constants, parameters, terms).flatMap(group -> group.values().stream());
        }
        return switch (type) {
            case SPECIES -> species.values().stream();
            case CONSTANT -> constants.values().stream();
            case PARAMETER -> parameters.values().stream();
            case TERM -> terms.values().stream();
            case RESERVED -> registry.values().stream().filter(v -> v.getVarType() == VariableType.RESERVED);
        };
    }

    public List<String> variableNames() {
        return streamVariables(null).map(ReactionVariable::getName).toList();
    }

    public List<String> speciesNames() {
        return List.copyOf(species.keySet());
    }

    public List<String> constantNames() {
        return List.copyOf(constants.keySet());
    }

    public List<String> parameterNames() {
        return List.copyOf(parameters.keySet());
    }

    public List<String> termNames() {
        return List.copyOf(terms.keySet());
    }

    /**
     * Registra una variable ya construida.
     *
     * @throws NameCollisionException   si el nombre ya está en uso.
     * @throws InvalidArgumentException si la variable es interna o pertenece a otro modelo.
     */
    public <T extends ReactionVariable> T addVariable(T variable) {
        if (variable == null) {
            throw new InvalidArgumentException("La variable no puede ser nula.");
        }
        if (variable.getVarType() == VariableType.RESERVED) {
            throw new InvalidArgumentException("No se pueden añadir variables internas: '" + variable.getName() + "'");
        }
        if (variable.getOwner().filter(o -> o != this).isPresent()) {
            throw new InvalidArgumentException("La variable '" + variable.getName() + "' ya pertenece a otro modelo");
        }
        if (registry.containsKey(variable.getName())) {
            throw new NameCollisionException(variable.getName());
        }
        registry.addItemToGroup(groupOf(variable.getVarType()), variable.getName(), variable);
        variable.attachTo(this);
        if (variable.getVarType() == VariableType.SPECIES) {
            networkData.registerSpecies(variable.getName());
        }
        bumpRevision();
        log.debug("Variable {} '{}' añadida", variable.getVarType(), variable.getName());
        return variable;
    }

    /**
     * Crea y registra una variable a partir de un mapa de propiedades con las mismas claves
     * que produce {@link ReactionVariable#toDict()} (la clave {@code name} es opcional).
     *
     * @throws InvalidArgumentException si el tipo no es válido, es RESERVED, o hay propiedades desconocidas.
     */
    public ReactionVariable addVariable(Object varType, String name, Map<String, ?> properties) {
        VariableType type = resolveTag(varType, "tipo de variable", VariableType::get);
        if (type == null) {
            throw new InvalidArgumentException("Para crear una variable hay que indicar su tipo.");
        }
        Map<String, ?> props = properties == null ? Map.of() : properties;
        Object declaredName = props.get("name");
        if (declaredName != null && !declaredName.equals(name)) {
            throw new InvalidArgumentException(String.format(
                    "El nombre '%s' no coincide con el de las propiedades '%s'", name, declaredName));
        }
        return switch (type) {
            case SPECIES -> {
                checkKeys(props, "name", "species_type", "units", "atol", "rtol", "note", "diffusivity");
                Species created = addSpecies(props.get("species_type"), name, stringOrNull(props.get("units")),
                        Coercions.toNullableDouble(props.get("atol"), "atol"),
                        Coercions.toNullableDouble(props.get("rtol"), "rtol"),
                        stringOrNull(props.get("note")));
                created.setDiffusivity(Coercions.toNullableDouble(props.get("diffusivity"), "diffusivity"));
                yield created;
            }
            case CONSTANT -> {
                checkKeys(props, "name", "global_value", "units", "note");
                yield addConstant(name, Coercions.toDouble(props.get("global_value"), "global_value"),
                        stringOrNull(props.get("note")), stringOrNull(props.get("units")));
            }
            case PARAMETER -> {
                checkKeys(props, "name", "global_value", "units", "note", "pipe_values", "tank_values");
                yield addParameter(name, Coercions.toDouble(props.get("global_value"), "global_value"),
                        stringOrNull(props.get("note")), stringOrNull(props.get("units")),
                        valueMap(props.get("pipe_values"), "pipe_values"),
                        valueMap(props.get("tank_values"), "tank_values"));
            }
            case TERM -> {
                checkKeys(props, "name", "expression", "note");
                Object expression = props.get("expression");
                if (expression == null) {
                    throw new InvalidArgumentException("Un término necesita 'expression'");
                }
                yield addOtherTerm(name, String.valueOf(expression), stringOrNull(props.get("note")));
            }
            case RESERVED -> throw new InvalidArgumentException("No se pueden crear variables internas con este método.");
        };
    }

    public Species addSpecies(Object speciesType, String name, String units) {
        return addSpecies(speciesType, name, units, null, null, null);
    }

    /**
     * @param speciesType BULK o WALL, en cualquier forma que acepte {@link SpeciesType#get(Object)}.
     * @throws InvalidArgumentException si el tipo falta o las tolerancias no vienen por pares.
     */
    public Species addSpecies(Object speciesType, String name, String units, Double atol, Double rtol, String note) {
        checkNewName(name);
        SpeciesType type = resolveTag(speciesType, "tipo de especie", SpeciesType::get);
        if (type == null) {
            throw new InvalidArgumentException("El tipo de especie es obligatorio (BULK o WALL).");
        }
        return addVariable(Species.builder()
                .speciesType(type)
                .name(name)
                .units(units)
                .atol(atol)
                .rtol(rtol)
                .note(note)
                .build());
    }

    public Species addBulkSpecies(String name, String units) {
        return addSpecies(SpeciesType.BULK, name, units);
    }

    public Species addBulkSpecies(String name, String units, Double atol, Double rtol, String note) {
        return addSpecies(SpeciesType.BULK, name, units, atol, rtol, note);
    }

    public Species addWallSpecies(String name, String units) {
        return addSpecies(SpeciesType.WALL, name, units);
    }

    public Species addWallSpecies(String name, String units, Double atol, Double rtol, String note) {
        return addSpecies(SpeciesType.WALL, name, units, atol, rtol, note);
    }

    public Constant addConstant(String name, double globalValue) {
        return addConstant(name, globalValue, null, null);
    }

    public Constant addConstant(String name, double globalValue, String note, String units) {
        checkNewName(name);
        return addVariable(new Constant(name, globalValue, note, units));
    }

    public Parameter addParameter(String name, double globalValue) {
        return addParameter(name, globalValue, null, null, null, null);
    }

    public Parameter addParameter(String name, double globalValue, String note, String units,
                                  Map<String, Double> pipeValues, Map<String, Double> tankValues) {
        checkNewName(name);
        return addVariable(Parameter.builder()
                .name(name)
                .globalValue(globalValue)
                .note(note)
                .units(units)
                .pipeValues(pipeValues)
                .tankValues(tankValues)
                .build());
    }

    /**
     * Añade una constante o un parámetro según {@code coefficientType}.
     *
     * @throws InvalidArgumentException si el tipo no es CONSTANT ni PARAMETER.
     */
    public ReactionVariable addCoefficient(Object coefficientType, String name, double globalValue, String note, String units) {
        VariableType type = resolveTag(coefficientType, "tipo de coeficiente", VariableType::get);
        if (type == VariableType.CONSTANT) {
            return addConstant(name, globalValue, note, units);
        }
        if (type == VariableType.PARAMETER) {
            return addParameter(name, globalValue, note, units, null, null);
        }
        throw new InvalidArgumentException("El tipo de coeficiente debe ser CONSTANT o PARAMETER, se recibió " + type);
    }

    public OtherTerm addOtherTerm(String name, String expression) {
        return addOtherTerm(name, expression, null);
    }

    public OtherTerm addOtherTerm(String name, String expression, String note) {
        checkNewName(name);
        return addVariable(new OtherTerm(name, expression, note));
    }

    /**
     * Elimina una variable de usuario. Si es una especie, se borran también su calidad inicial
     * y sus fuentes. Las reacciones y expresiones que la mencionen NO se tocan.
     *
     * @throws UnknownReferenceException si no existe.
     * @throws InvalidArgumentException  si es una variable interna.
     */
    public void removeVariable(String name) {
        ReactionVariable variable = getVariable(name);
        if (variable.getVarType() == VariableType.RESERVED) {
            throw new InvalidArgumentException("No se puede eliminar la variable interna '" + name + "'");
        }
        if (variable.getVarType() == VariableType.SPECIES) {
            networkData.purgeSpecies(name);
        }
        registry.remove(name);
        variable.attachTo(null);
        bumpRevision();
        log.debug("Variable {} '{}' eliminada", variable.getVarType(), name);
    }

    @Override
    public void variableChanged(ReactionVariable variable) {
        if (registry.get(variable.getName()) == variable) {
            log.debug("La variable '{}' ha cambiado; se invalidan las expresiones compiladas", variable.getName());
            bumpRevision();
        }
    }

    // ------------------------------------------------------------------
    // Reacciones
    // ------------------------------------------------------------------

    /**
     * Reacciones del modelo: primero las de tuberías y después las de depósitos.
     */
    public Iterable<ReactionDynamics> reactions() {
        return reactions(null);
    }

    /**
     * @param location ubicación en cualquier forma aceptada por {@link LocationType#get(Object)}, o {@code null} para todas.
     */
    public Iterable<ReactionDynamics> reactions(Object location) {
        LocationType type = resolveTag(location, "ubicación", LocationType::get);
        return () -> {
            if (type == null) {
                return Stream.concat(pipeReactions.values().stream(), tankReactions.values().stream()).iterator();
            }
            return reactionsAt(type).values().iterator();
        };
    }

    /**
     * @param species especie (objeto o nombre) que debe existir en el modelo.
     * @throws UnknownReferenceException  si la especie no existe.
     * @throws DuplicateReactionException si la especie ya tiene reacción en esa ubicación.
     */
    public ReactionDynamics addReaction(Object location, Object species, Object dynamics, String expression, String note) {
        LocationType type = requireLocation(location);
        String speciesName = speciesName(species);
        if (!this.species.containsKey(speciesName)) {
            throw new UnknownReferenceException(String.format(
                    "La especie '%s' no existe en el modelo; no se puede añadir la reacción", speciesName));
        }
        Map<String, ReactionDynamics> target = reactionsAt(type);
        if (target.containsKey(speciesName)) {
            throw new DuplicateReactionException(speciesName, type);
        }
        DynamicsType dynamicsType = resolveTag(dynamics, "tipo de dinámica", DynamicsType::get);
        ReactionDynamics reaction = ReactionDynamics.of(dynamicsType, speciesName, type, expression, note);
        target.put(speciesName, reaction);
        log.debug("Reacción {} añadida: {}", dynamicsType, reaction);
        return reaction;
    }

    public ReactionDynamics addReaction(Object location, Object species, Object dynamics, String expression) {
        return addReaction(location, species, dynamics, expression, null);
    }

    public ReactionDynamics addPipeReaction(Object species, Object dynamics, String expression, String note) {
        return addReaction(LocationType.PIPE, species, dynamics, expression, note);
    }

    public ReactionDynamics addPipeReaction(Object species, Object dynamics, String expression) {
        return addPipeReaction(species, dynamics, expression, null);
    }

    public ReactionDynamics addTankReaction(Object species, Object dynamics, String expression, String note) {
        return addReaction(LocationType.TANK, species, dynamics, expression, note);
    }

    public ReactionDynamics addTankReaction(Object species, Object dynamics, String expression) {
        return addTankReaction(species, dynamics, expression, null);
    }

    /**
     * Elimina la reacción de una especie. Si no existe no hace nada.
     *
     * @param location ubicación, o {@value #ALL_LOCATIONS} para ambas.
     * @throws InvalidArgumentException si la ubicación es nula.
     */
    public void removeReaction(Object species, Object location) {
        if (location == null) {
            throw new InvalidArgumentException(
                    "La ubicación no puede ser nula al eliminar una reacción; use \"" + ALL_LOCATIONS + "\" para ambas.");
        }
        String speciesName = speciesName(species);
        if (location instanceof String text && text.strip().equalsIgnoreCase(ALL_LOCATIONS)) {
            removeReactionAt(speciesName, LocationType.PIPE);
            removeReactionAt(speciesName, LocationType.TANK);
            return;
        }
        removeReactionAt(speciesName, resolveTag(location, "ubicación", LocationType::get));
    }

    private void removeReactionAt(String speciesName, LocationType location) {
        if (reactionsAt(location).remove(speciesName) != null) {
            compiled.remove(cacheKey(speciesName, location));
            log.debug("Reacción eliminada: {}->{}", speciesName, location);
        }
    }

    /**
     * @return la reacción, o {@code null} si la especie no tiene reacción en esa ubicación.
     * @throws InvalidArgumentException si la especie o la ubicación son nulas.
     */
    public ReactionDynamics getReaction(Object species, Object location) {
        if (species == null) {
            throw new InvalidArgumentException("La especie no puede ser nula.");
        }
        return reactionsAt(requireLocation(location)).get(speciesName(species));
    }

    // ------------------------------------------------------------------
    // Compilación
    // ------------------------------------------------------------------

    /**
     * Tabla estricta con las variables de usuario (más las hidráulicas, siempre presentes).
     */
    public SymbolTable symbolTable() {
        return SymbolTable.strict(variableNames());
    }

    /**
     * Compila una expresión contra las variables actuales del modelo. Los términos que aparezcan
     * se sustituyen por su expresión (recursivamente).
     *
     * @throws waterquality.domain.exception.ExpressionCompileException si la expresión no es válida,
     *                                                                  usa símbolos desconocidos o tiene términos circulares.
     */
    public CompiledExpression compileExpression(String expression) {
        ExpressionNode tree = ExpressionParser.parse(expression);
        ExpressionNode expanded = new TermExpander(this::termExpression).expand(tree, expression);
        return backend.compile(expanded, expression, symbolTable());
    }

    /**
     * Compila la expresión de una reacción. Con la caché activa el resultado se reutiliza hasta
     * que cambie el conjunto de variables o la propia expresión.
     *
     * @throws UnknownReferenceException si la reacción no existe.
     */
    public CompiledExpression compileReaction(Object species, Object location) {
        ReactionDynamics reaction = getReaction(species, location);
        if (reaction == null) {
            throw new UnknownReferenceException("No hay reacción para " + speciesName(species) + " en " + location);
        }
        return compileReaction(reaction);
    }

    public CompiledExpression compileReaction(ReactionDynamics reaction) {
        String key = cacheKey(reaction.getSpecies(), reaction.getLocation());
        if (expressionConfig.isCacheEnabled()) {
            CacheEntry cached = compiled.get(key);
            if (cached != null && cached.revision() == revision && cached.source().equals(reaction.getExpression())) {
                return cached.expression();
            }
        }
        CompiledExpression result = compileExpression(reaction.getExpression());
        if (expressionConfig.isCacheEnabled()) {
            compiled.put(key, new CacheEntry(revision, reaction.getExpression(), result));
        }
        return result;
    }

    private String termExpression(String symbol) {
        return terms.get(symbol) instanceof OtherTerm term ? term.getExpression() : null;
    }

    private void bumpRevision() {
        revision++;
        compiled.clear();
    }

    private static String cacheKey(String species, LocationType location) {
        return location.name() + ":" + species;
    }

    // ------------------------------------------------------------------
    // Opciones y serialización
    // ------------------------------------------------------------------

    /**
     * @param value {@link MsxOptions} o un mapa con sus claves.
     * @throws InvalidArgumentException si el valor es nulo o no convertible.
     */
    public void setOptions(Object value) {
        if (value == null) {
            throw new InvalidArgumentException("Las opciones no pueden ser nulas.");
        }
        this.options = MsxOptions.factory(value);
    }

    /**
     * Representación del modelo como datos planos (mapas, listas, cadenas y números).
     * La reconstruye {@link waterquality.factory.QualityModelFactory#fromDict(Map)}.
     */
    public Map<String, Object> toDict() {
        Map<String, Object> rep = new LinkedHashMap<>();
        rep.put("name", name);
        rep.put("title", title);
        rep.put("description", description);
        rep.put("references", new ArrayList<>(references));
        rep.put("options", options.toDict());
        rep.put("species", groupDict(species));
        rep.put("constants", groupDict(constants));
        rep.put("parameters", groupDict(parameters));
        rep.put("terms", groupDict(terms));
        rep.put("pipe_reactions", reactionDict(pipeReactions));
        rep.put("tank_reactions", reactionDict(tankReactions));
        rep.put("network_data", networkData.toDict());
        return rep;
    }

    /**
     * Carga calidad inicial, fuentes y patrones. Las especies deben estar ya registradas.
     */
    public void loadNetworkData(Map<?, ?> dict) {
        if (dict != null) {
            networkData.loadDict(dict);
        }
    }

    @Override
    public String toString() {
        return "MultispeciesQualityModel(" + (name != null ? name : "") + ")";
    }

    private static Map<String, Object> groupDict(Map<String, ReactionVariable> group) {
        Map<String, Object> rep = new LinkedHashMap<>();
        group.forEach((k, v) -> rep.put(k, v.toDict()));
        return rep;
    }

    private static Map<String, Object> reactionDict(Map<String, ReactionDynamics> reactions) {
        Map<String, Object> rep = new LinkedHashMap<>();
        reactions.forEach((k, v) -> rep.put(k, v.toDict()));
        return rep;
    }

    // ------------------------------------------------------------------
    // Auxiliares
    // ------------------------------------------------------------------

    private void checkNewName(String name) {
        if (name == null) {
            throw new InvalidArgumentException("El nombre de la variable no puede ser nulo.");
        }
        if (ReservedNames.isReserved(name)) {
            throw new InvalidNameException(name);
        }
        if (registry.containsKey(name)) {
            throw new NameCollisionException(name);
        }
    }

    private static String groupOf(VariableType type) {
        return switch (type) {
            case SPECIES -> SPECIES_GROUP;
            case CONSTANT -> CONSTANTS_GROUP;
            case PARAMETER -> PARAMETERS_GROUP;
            case TERM -> TERMS_GROUP;
            case RESERVED -> null;
        };
    }

    private Map<String, ReactionDynamics> reactionsAt(LocationType location) {
        return switch (location) {
            case PIPE -> pipeReactions;
            case TANK -> tankReactions;
        };
    }

    private static LocationType requireLocation(Object location) {
        LocationType type = resolveTag(location, "ubicación", LocationType::get);
        if (type == null) {
            throw new InvalidArgumentException("La ubicación de la reacción no puede ser nula.");
        }
        return type;
    }

    /**
     * Resuelve una etiqueta de tipo; cualquier valor no reconocido se informa como {@link InvalidArgumentException}.
     */
    private static <E> E resolveTag(Object raw, String what, Function<Object, E> resolver) {
        try {
            return resolver.apply(raw);
        } catch (InvalidArgumentException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Valor no válido para " + what + ": " + raw, e);
        }
    }

    private static String speciesName(Object species) {
        if (species == null) {
            throw new InvalidArgumentException("La especie no puede ser nula.");
        }
        return species instanceof Species s ? s.getName() : String.valueOf(species);
    }

    private static void checkKeys(Map<String, ?> props, String... allowed) {
        Set<String> known = Set.of(allowed);
        for (String key : props.keySet()) {
            if (!known.contains(key)) {
                throw new InvalidArgumentException("Propiedad desconocida '" + key + "'");
            }
        }
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Map<String, Double> valueMap(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidArgumentException(field + " debe ser un mapa nombre -> valor");
        }
        Map<String, Double> values = new LinkedHashMap<>();
        map.forEach((k, v) -> values.put(String.valueOf(k), Coercions.toDouble(v, field)));
        return values;
    }
}
