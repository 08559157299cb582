package io.surfworks.graphforge.core.types;

import java.util.List;
import java.util.Objects;

/**
 * Structural description of a tensor: element kind, dimensions and, for
 * quantized kinds, the scale and offset.
 *
 * <p>Types are plain values. Graph code never compares them directly; it
 * asks a {@link TypeArena} for the canonical {@link TypeRef} and compares
 * handles by identity.
 *
 * @param elemKind element kind
 * @param dims     dimension sizes, outermost first
 * @param scale    quantization scale (1.0 for non-quantized kinds)
 * @param offset   quantization zero offset (0 for non-quantized kinds)
 */
public record Type(ElemKind elemKind, List<Integer> dims, float scale, int offset) {

    /**
     * The canonical empty type: a float tensor with no dimensions.
     */
    public static final Type VOID = new Type(ElemKind.FLOAT, List.of());

    public Type {
        Objects.requireNonNull(elemKind, "elemKind");
        dims = List.copyOf(dims);
        for (int d : dims) {
            if (d < 0) {
                throw new IllegalArgumentException("Negative dimension " + d + " in " + dims);
            }
        }
        if (!elemKind.isQuantized() && (scale != 1.0f || offset != 0)) {
            throw new IllegalArgumentException(
                    elemKind + " is not quantized but has scale " + scale + " and offset " + offset);
        }
        if (elemKind.isQuantized() && !(scale > 0.0f)) {
            throw new IllegalArgumentException("Quantization scale must be positive, got " + scale);
        }
    }

    public Type(ElemKind elemKind, List<Integer> dims) {
        this(elemKind, dims, 1.0f, 0);
    }

    public static Type of(ElemKind elemKind, int... dims) {
        return new Type(elemKind, toList(dims));
    }

    public static Type quantized(ElemKind elemKind, float scale, int offset, int... dims) {
        return new Type(elemKind, toList(dims), scale, offset);
    }

    public int rank() {
        return dims.size();
    }

    public int dim(int i) {
        return dims.get(i);
    }

    public boolean isQuantized() {
        return elemKind.isQuantized();
    }

    /**
     * Number of elements. A rank-0 type holds a single element.
     */
    public long size() {
        long count = 1;
        for (int d : dims) {
            count *= d;
        }
        return count;
    }

    public long byteSize() {
        return size() * elemKind.byteSize();
    }

    /**
     * Same element kind and quantization parameters, different dimensions.
     */
    public Type withDims(List<Integer> newDims) {
        return new Type(elemKind, newDims, scale, offset);
    }

    static List<Integer> toList(int... dims) {
        Integer[] boxed = new Integer[dims.length];
        for (int i = 0; i < dims.length; i++) {
            boxed[i] = dims[i];
        }
        return List.of(boxed);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(elemKind.shortName()).append('<');
        for (int i = 0; i < dims.size(); i++) {
            if (i > 0) sb.append(" x ");
            sb.append(dims.get(i));
        }
        sb.append('>');
        if (isQuantized()) {
            sb.append("[S:").append(scale).append(" O:").append(offset).append(']');
        }
        return sb.toString();
    }
}
