package io.surfworks.graphforge.core.graph;

import com.google.gson.JsonObject;

import io.surfworks.graphforge.core.types.TypeRef;

/**
 * Anything a {@link NodeValue} can point at: a function-owned {@link Node} or
 * a module-owned {@link Variable}.
 */
public sealed interface ValueProducer permits Node, Variable {

    /**
     * Identifier unique within the owning module.
     */
    int id();

    String name();

    int numResults();

    TypeRef resultType(int resNo);

    default NodeValue output(int resNo) {
        if (resNo < 0 || resNo >= numResults()) {
            throw new IndexOutOfBoundsException(
                    "Result " + resNo + " out of range for '" + name() + "' with " + numResults() + " results");
        }
        return new NodeValue(id(), resNo, resultType(resNo));
    }

    default NodeValue output() {
        return output(0);
    }

    /**
     * Debug description used in diagnostics and dumps.
     */
    JsonObject toJson();
}
