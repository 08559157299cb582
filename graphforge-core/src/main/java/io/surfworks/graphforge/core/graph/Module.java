package io.surfworks.graphforge.core.graph;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import io.surfworks.graphforge.core.tensor.Tensor;
import io.surfworks.graphforge.core.types.ElemKind;
import io.surfworks.graphforge.core.types.TypeArena;
import io.surfworks.graphforge.core.types.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Top-level owner of a computation: its types, its variables and its
 * functions.
 *
 * <p>Variables live here rather than in a function so several functions (for
 * example a training graph and its inference clone) can share the same
 * weights.
 *
 * <p>A module is not thread-safe. All construction, erasure, cloning and
 * verification must happen on one thread or be serialized by the caller.
 *
 * <p>Example:
 * <pre>{@code
 * Module module = new Module();
 * Function f = module.createFunction("main");
 * Variable input = module.createVariable(ElemKind.FLOAT, List.of(1, 32, 32, 3), "input",
 *         Visibility.PUBLIC, TrainKind.NONE);
 * Node conv = f.builder().createConv("conv", input.output(), 16, 5, 1, 0);
 * f.builder().createSave("out", conv.output());
 * f.verify();
 * }</pre>
 */
public final class Module {

    private static final Logger LOG = Logger.getLogger(Module.class.getName());

    /** Seed of the initializer PRNG when none is given. */
    public static final long DEFAULT_SEED = 2017L;

    /** Delimiter between a name and the suffix {@link #uniqueName} appends. */
    public static final String NAME_DELIMITER = "__";

    private final TypeArena types = new TypeArena();
    private final List<Variable> variables = new ArrayList<>();
    private final Map<Integer, Variable> variablesById = new HashMap<>();
    private final List<Function> functions = new ArrayList<>();
    private final Random random;
    private long uniqueIdx;
    private int nextId;

    public Module() {
        this(DEFAULT_SEED);
    }

    /**
     * @param seed seed for the generator behind {@link TrainKind#XAVIER}
     *             initialization
     */
    public Module(long seed) {
        this.random = new Random(seed);
    }

    // ==================== Types ====================

    public TypeArena types() {
        return types;
    }

    public TypeRef uniqueType(ElemKind elemKind, List<Integer> dims) {
        return types.uniqueType(elemKind, dims);
    }

    public TypeRef uniqueType(ElemKind elemKind, List<Integer> dims, float scale, int offset) {
        return types.uniqueType(elemKind, dims, scale, offset);
    }

    public TypeRef uniqueTypeWithNewShape(TypeRef ref, List<Integer> dims) {
        return types.uniqueTypeWithNewShape(ref, dims);
    }

    public TypeRef voidType() {
        return types.voidType();
    }

    // ==================== Functions ====================

    /**
     * Creates an empty function owned by this module.
     *
     * @throws GraphBuildException if a function with this name already exists
     */
    public Function createFunction(String name) {
        Objects.requireNonNull(name, "name");
        if (hasFunction(name)) {
            throw new GraphBuildException("A function with name '%s' already exists", name);
        }
        Function function = new Function(this, name);
        functions.add(function);
        LOG.fine(() -> "Created function '" + name + "'");
        return function;
    }

    public Optional<Function> getFunction(String name) {
        for (Function function : functions) {
            if (function.name().equals(name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    public boolean hasFunction(String name) {
        return getFunction(name).isPresent();
    }

    /**
     * Removes a function and all of its nodes. The module's variables are
     * left in place.
     */
    public void eraseFunction(Function function) {
        if (!functions.remove(function)) {
            throw new GraphBuildException("Function '%s' is not owned by this module", function.name());
        }
        function.clear();
        LOG.fine(() -> "Erased function '" + function.name() + "'");
    }

    public List<Function> functions() {
        return Collections.unmodifiableList(functions);
    }

    // ==================== Variables ====================

    /**
     * Creates a variable of the given type and initializes its payload.
     *
     * @param type       tensor type, uniqued into this module's arena
     * @param name       name prefix; the stored name is made unique
     * @param visibility public or private
     * @param train      initialization policy
     * @param value      fan-in for {@link TrainKind#XAVIER}, fill value for
     *                   {@link TrainKind#BROADCAST}
     * @throws GraphBuildException if XAVIER is requested for a non-float type
     *                             or with a non-positive fan-in
     */
    public Variable createVariable(TypeRef type, String name, Visibility visibility,
                                   TrainKind train, float value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visibility, "visibility");
        Objects.requireNonNull(train, "train");
        TypeRef ref = types.adopt(type);
        if (train == TrainKind.XAVIER) {
            if (!ref.elemKind().isFloating()) {
                throw new GraphBuildException("Xavier initialization of '%s' needs a float type, got %s", name, ref);
            }
            if (!(value > 0.0f)) {
                throw new GraphBuildException("Xavier initialization of '%s' needs a positive fan-in, got %s",
                        name, value);
            }
        }

        Tensor payload = Tensor.zeros(ref.type());
        switch (train) {
            case NONE -> { }
            case XAVIER -> payload.initXavier(value, random);
            case BROADCAST -> payload.broadcast(value);
        }

        Variable variable = new Variable(allocateId(), uniqueName(name), ref, visibility, train, value, payload);
        variables.add(variable);
        variablesById.put(variable.id(), variable);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Created variable '" + variable.name() + "' : " + ref + " (" + visibility + ", " + train + ")");
        }
        return variable;
    }

    public Variable createVariable(TypeRef type, String name, Visibility visibility, TrainKind train) {
        return createVariable(type, name, visibility, train, 0.0f);
    }

    public Variable createVariable(ElemKind elemKind, List<Integer> dims, String name,
                                   Visibility visibility, TrainKind train, float value) {
        return createVariable(uniqueType(elemKind, dims), name, visibility, train, value);
    }

    public Variable createVariable(ElemKind elemKind, List<Integer> dims, String name,
                                   Visibility visibility, TrainKind train) {
        return createVariable(elemKind, dims, name, visibility, train, 0.0f);
    }

    public Variable createVariable(ElemKind elemKind, List<Integer> dims, float scale, int offset,
                                   String name, Visibility visibility, TrainKind train, float value) {
        return createVariable(uniqueType(elemKind, dims, scale, offset), name, visibility, train, value);
    }

    public Optional<Variable> getVariableByName(String name) {
        for (Variable variable : variables) {
            if (variable.name().equals(name)) {
                return Optional.of(variable);
            }
        }
        return Optional.empty();
    }

    public Optional<Variable> variable(int id) {
        return Optional.ofNullable(variablesById.get(id));
    }

    /**
     * Removes a variable from the module. Variables this module does not
     * own, including already erased ones, are ignored.
     *
     * <p>This does not look for nodes that still read or write the variable.
     * Callers must rewire or erase them first; a leftover reference is
     * reported by {@link Function#verify()}.
     */
    public void eraseVariable(Variable variable) {
        // Ids are only unique per module; a variable of another module may share one.
        if (variablesById.get(variable.id()) != variable) {
            return;
        }
        variablesById.remove(variable.id());
        variables.remove(variable);
        LOG.fine(() -> "Erased variable '" + variable.name() + "'");
    }

    public List<Variable> variables() {
        return Collections.unmodifiableList(variables);
    }

    // ==================== Names and ids ====================

    /**
     * Forms a unique name from {@code name}: everything from the first
     * {@code "__"} on is dropped, then {@code "__N"} is appended where N is
     * this module's counter.
     *
     * <p>Callers must not use {@code "__"} inside their own names. Generated
     * name parts belong before the delimiter, never after it.
     */
    public String uniqueName(String name) {
        int delimPos = name.indexOf(NAME_DELIMITER);
        String base = delimPos >= 0 ? name.substring(0, delimPos) : name;
        return base + NAME_DELIMITER + uniqueIdx++;
    }

    int allocateId() {
        return nextId++;
    }

    // ==================== Whole-module operations ====================

    /**
     * Verifies every function of the module.
     *
     * @throws GraphVerificationException on the first violation found
     */
    public void verify() {
        for (Function function : functions) {
            function.verify();
        }
    }

    /**
     * Erases all functions, then all variables.
     */
    public void clear() {
        for (Function function : new ArrayList<>(functions)) {
            eraseFunction(function);
        }
        for (Variable variable : new ArrayList<>(variables)) {
            eraseVariable(variable);
        }
    }

    /**
     * JSON description of the module: its variables and function names.
     */
    public String dump() {
        JsonObject obj = new JsonObject();
        JsonArray vars = new JsonArray();
        for (Variable variable : variables) {
            vars.add(variable.toJson());
        }
        obj.add("variables", vars);
        JsonArray funcs = new JsonArray();
        for (Function function : functions) {
            JsonObject f = new JsonObject();
            f.addProperty("name", function.name());
            f.addProperty("nodeCount", function.nodes().size());
            funcs.add(f);
        }
        obj.add("functions", funcs);
        return GraphJson.render(obj);
    }

    @Override
    public String toString() {
        return String.format("Module[functions=%d, variables=%d, types=%d]",
                functions.size(), variables.size(), types.size());
    }
}
