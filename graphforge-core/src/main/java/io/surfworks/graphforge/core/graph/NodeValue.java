package io.surfworks.graphforge.core.graph;

import io.surfworks.graphforge.core.types.ElemKind;
import io.surfworks.graphforge.core.types.TypeRef;

import java.util.List;
import java.util.Objects;

/**
 * One result of one producer, as seen from a consuming node's input slot.
 *
 * <p>The producer is referenced by its module-unique id, not by object, so an
 * edge to an erased producer simply fails to resolve (see
 * {@link Function#producerOf(NodeValue)}).
 *
 * @param producerId id of the producing {@link Node} or {@link Variable}
 * @param resNo      result slot of the producer
 * @param type       type of that result
 */
public record NodeValue(int producerId, int resNo, TypeRef type) {

    public NodeValue {
        Objects.requireNonNull(type, "type");
        if (resNo < 0) {
            throw new IllegalArgumentException("Negative result number " + resNo);
        }
    }

    public List<Integer> dims() {
        return type.dims();
    }

    public ElemKind elemKind() {
        return type.elemKind();
    }

    /**
     * True when both values name the same producer result, regardless of
     * the cached type.
     */
    public boolean sameEndpoint(NodeValue other) {
        return producerId == other.producerId && resNo == other.resNo;
    }

    @Override
    public String toString() {
        return "#" + producerId + ":" + resNo + " : " + type;
    }
}
