package io.surfworks.graphforge.core.graph;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import io.surfworks.graphforge.core.types.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One operator instance in a {@link Function}.
 *
 * <p>Kind, parameters and result types are fixed at construction. The name and
 * the input edges can change: functions rename nodes when they are added, and
 * graph rewrites and cloning redirect inputs through {@link #setNthInput}.
 */
public final class Node implements ValueProducer {

    private final int id;
    private String name;
    private final NodeKind kind;
    private final List<NodeValue> inputs;
    private final List<TypeRef> results;
    private final NodeParams params;

    Node(int id, String name, NodeKind kind, List<NodeValue> inputs,
         List<TypeRef> results, NodeParams params) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.inputs = new ArrayList<>(inputs);
        this.results = List.copyOf(results);
        this.params = Objects.requireNonNull(params, "params");
        for (NodeValue input : this.inputs) {
            Objects.requireNonNull(input, "input of " + name);
        }
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public NodeKind kind() {
        return kind;
    }

    public NodeParams params() {
        return params;
    }

    /**
     * Returns the parameters cast to the record type of this node's kind.
     *
     * @throws IllegalStateException if the parameters are of another type
     */
    public <P extends NodeParams> P params(Class<P> type) {
        if (!type.isInstance(params)) {
            throw new IllegalStateException(
                    kind.displayName() + " node '" + name + "' has " + params.getClass().getSimpleName()
                            + " parameters, not " + type.getSimpleName());
        }
        return type.cast(params);
    }

    public int numInputs() {
        return inputs.size();
    }

    public NodeValue nthInput(int idx) {
        return inputs.get(idx);
    }

    public void setNthInput(int idx, NodeValue value) {
        inputs.set(idx, Objects.requireNonNull(value, "value"));
    }

    public String inputName(int idx) {
        return kind.inputName(idx);
    }

    public List<NodeValue> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    @Override
    public int numResults() {
        return results.size();
    }

    @Override
    public TypeRef resultType(int resNo) {
        return results.get(resNo);
    }

    public String resultName(int resNo) {
        return kind.resultName(resNo);
    }

    public List<TypeRef> results() {
        return results;
    }

    /**
     * Copy with a new id and the same name, kind, parameters, result types and
     * (not yet rewired) inputs.
     */
    Node shallowCopy(int newId) {
        return new Node(newId, name, kind, inputs, results, params);
    }

    @Override
    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("id", id);
        obj.addProperty("name", name);
        obj.addProperty("kind", kind.displayName());

        JsonArray ins = new JsonArray();
        for (int i = 0; i < inputs.size(); i++) {
            NodeValue in = inputs.get(i);
            JsonObject edge = new JsonObject();
            edge.addProperty("slot", inputName(i));
            edge.addProperty("producer", in.producerId());
            edge.addProperty("resNo", in.resNo());
            edge.add("type", GraphJson.type(in.type()));
            ins.add(edge);
        }
        obj.add("inputs", ins);

        JsonArray outs = new JsonArray();
        for (int i = 0; i < results.size(); i++) {
            JsonObject res = new JsonObject();
            res.addProperty("slot", resultName(i));
            res.add("type", GraphJson.type(results.get(i)));
            outs.add(res);
        }
        obj.add("results", outs);
        obj.add("params", GraphJson.params(params));
        return obj;
    }

    @Override
    public String toString() {
        return kind.displayName() + "[" + name + "]";
    }
}
