package io.surfworks.graphforge.core.graph;

import io.surfworks.graphforge.core.types.TypeRef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Output-shape formulas used by {@link NodeBuilder} and re-checked by
 * {@link GraphVerifier}.
 *
 * <p>These helpers assume their preconditions hold; callers validate first.
 * Image tensors are laid out NHWC.
 */
public final class ShapeInference {

    private ShapeInference() {}

    /**
     * Size of one spatial output dimension of a convolution or pooling window:
     * {@code floor((dim + 2 * pad - kernel) / stride) + 1}.
     */
    public static int windowOutputSize(int dim, int kernel, int stride, int pad) {
        long size = ((long) dim + 2L * pad - kernel) / stride + 1;
        return toDim(size, "window output");
    }

    /**
     * NHWC output dims of a windowed operator producing {@code channels}
     * channels.
     */
    public static List<Integer> windowOutputDims(List<Integer> nhwc, int kernel, int stride, int pad, int channels) {
        return List.of(
                nhwc.get(0),
                windowOutputSize(nhwc.get(1), kernel, stride, pad),
                windowOutputSize(nhwc.get(2), kernel, stride, pad),
                channels);
    }

    /**
     * Splits dims into the leading dimension and the product of the rest.
     * A rank-1 shape flattens to {@code [dims[0], 1]}.
     *
     * @throws GraphBuildException if the trailing product does not fit a dimension
     */
    public static int[] flattenCdr(List<Integer> dims) {
        return new int[]{dims.get(0), toDim(trailingSize(dims), "flattened size of " + dims)};
    }

    /**
     * Product of every dimension after the first, saturating at
     * {@link Long#MAX_VALUE}. 1 for rank 0 and rank 1.
     */
    public static long trailingSize(List<Integer> dims) {
        if (dims.subList(Math.min(1, dims.size()), dims.size()).contains(0)) {
            return 0;
        }
        long rest = 1;
        for (int i = 1; i < dims.size(); i++) {
            int d = dims.get(i);
            rest = rest > Long.MAX_VALUE / d ? Long.MAX_VALUE : rest * d;
        }
        return rest;
    }

    /**
     * True when both types have the same element kind and rank and agree on
     * every dimension except {@code dim}.
     */
    public static boolean sameShapeExceptDim(TypeRef a, TypeRef b, int dim) {
        if (a.elemKind() != b.elemKind()) {
            return false;
        }
        List<Integer> da = a.dims();
        List<Integer> db = b.dims();
        if (da.size() != db.size()) {
            return false;
        }
        for (int i = 0; i < da.size(); i++) {
            if (i != dim && !da.get(i).equals(db.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Dims of input 0 with the concat axis replaced by the sum over all inputs.
     */
    public static List<Integer> concatDims(List<TypeRef> inputs, int dimension) {
        List<Integer> shape = new ArrayList<>(inputs.get(0).dims());
        long total = 0;
        for (TypeRef in : inputs) {
            total += in.dims().get(dimension);
        }
        shape.set(dimension, toDim(total, "concatenated axis " + dimension));
        return shape;
    }

    public static List<Integer> sliceDims(List<Integer> begin, List<Integer> end) {
        List<Integer> shape = new ArrayList<>(begin.size());
        for (int i = 0; i < begin.size(); i++) {
            shape.add(end.get(i) - begin.get(i));
        }
        return shape;
    }

    public static boolean isPermutation(List<Integer> shuffle, int rank) {
        if (shuffle.size() != rank) {
            return false;
        }
        Set<Integer> seen = new HashSet<>();
        for (int axis : shuffle) {
            if (axis < 0 || axis >= rank || !seen.add(axis)) {
                return false;
            }
        }
        return true;
    }

    public static List<Integer> transposeDims(List<Integer> dims, List<Integer> shuffle) {
        List<Integer> shape = new ArrayList<>(dims.size());
        for (int axis : shuffle) {
            shape.add(dims.get(axis));
        }
        return shape;
    }

    /**
     * {@code indices.dims ++ data.dims[1:]}.
     */
    public static List<Integer> gatherDims(List<Integer> dataDims, List<Integer> indicesDims) {
        List<Integer> shape = new ArrayList<>(indicesDims);
        shape.addAll(dataDims.subList(1, dataDims.size()));
        return shape;
    }

    /**
     * Input dims with the last dimension replaced by {@code k}.
     */
    public static List<Integer> topKDims(List<Integer> dims, int k) {
        List<Integer> shape = new ArrayList<>(dims);
        shape.set(shape.size() - 1, k);
        return shape;
    }

    /**
     * True when every dim of {@code input}, aligned at {@code axis} of
     * {@code shape}, is 1 or equal to the target dim.
     */
    public static boolean isBroadcastable(List<Integer> input, List<Integer> shape, int axis) {
        if (axis < 0 || axis + input.size() > shape.size()) {
            return false;
        }
        for (int i = 0; i < input.size(); i++) {
            int in = input.get(i);
            if (in != 1 && in != shape.get(axis + i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws GraphBuildException if {@code size} does not fit a dimension
     */
    private static int toDim(long size, String what) {
        if (size > Integer.MAX_VALUE) {
            throw new GraphBuildException("%s %d does not fit in a dimension", what, size);
        }
        return (int) size;
    }
}
