package io.surfworks.graphforge.core.graph;

import com.google.gson.JsonObject;

import io.surfworks.graphforge.core.tensor.Tensor;
import io.surfworks.graphforge.core.types.TypeRef;

import java.util.Objects;

/**
 * A module-owned persistent tensor that any function of the module may read
 * or write.
 *
 * <p>The payload is shared: every function referencing the variable sees the
 * same {@link Tensor}.
 */
public final class Variable implements ValueProducer {

    private final int id;
    private String name;
    private final TypeRef type;
    private final Visibility visibility;
    private final TrainKind trainKind;
    private final float initValue;
    private final Tensor payload;

    Variable(int id, String name, TypeRef type, Visibility visibility,
             TrainKind trainKind, float initValue, Tensor payload) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.trainKind = Objects.requireNonNull(trainKind, "trainKind");
        this.initValue = initValue;
        this.payload = Objects.requireNonNull(payload, "payload");
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

    public TypeRef type() {
        return type;
    }

    public Visibility visibility() {
        return visibility;
    }

    public TrainKind trainKind() {
        return trainKind;
    }

    /**
     * Fan-in for {@link TrainKind#XAVIER}, fill value for
     * {@link TrainKind#BROADCAST}, unused otherwise.
     */
    public float initValue() {
        return initValue;
    }

    public Tensor payload() {
        return payload;
    }

    @Override
    public int numResults() {
        return 1;
    }

    @Override
    public TypeRef resultType(int resNo) {
        if (resNo != 0) {
            throw new IndexOutOfBoundsException("Variable '" + name + "' has a single result, asked for " + resNo);
        }
        return type;
    }

    @Override
    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("id", id);
        obj.addProperty("name", name);
        obj.addProperty("kind", "Variable");
        obj.add("type", GraphJson.type(type));
        obj.addProperty("visibility", visibility.name());
        obj.addProperty("train", trainKind.name());
        obj.addProperty("initValue", initValue);
        return obj;
    }

    @Override
    public String toString() {
        return "Variable[" + name + " : " + type + "]";
    }
}
