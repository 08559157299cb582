package io.surfworks.graphforge.core.graph;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import io.surfworks.graphforge.core.types.TypeRef;

import java.util.List;

/**
 * JSON rendering shared by {@link Node}, {@link Variable}, {@link Function}
 * and {@link Module} debug descriptions.
 */
final class GraphJson {

    static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();

    private GraphJson() {}

    static JsonObject type(TypeRef ref) {
        JsonObject obj = new JsonObject();
        obj.addProperty("elemKind", ref.elemKind().name());
        obj.add("dims", dims(ref.dims()));
        if (ref.isQuantized()) {
            obj.addProperty("scale", ref.type().scale());
            obj.addProperty("offset", ref.type().offset());
        }
        return obj;
    }

    static JsonArray dims(List<Integer> dims) {
        JsonArray arr = new JsonArray();
        for (int d : dims) {
            arr.add(d);
        }
        return arr;
    }

    static JsonElement params(NodeParams params) {
        return GSON.toJsonTree(params);
    }

    static String render(JsonElement element) {
        return GSON.toJson(element);
    }
}
