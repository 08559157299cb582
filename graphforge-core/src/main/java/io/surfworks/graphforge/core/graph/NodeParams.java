package io.surfworks.graphforge.core.graph;

import java.util.List;

/**
 * Immutable operator-specific parameters of a {@link Node}.
 */
public sealed interface NodeParams {

    /**
     * Operators without parameters.
     */
    record None() implements NodeParams {
        public static final None INSTANCE = new None();
    }

    record Convolution(int kernel, int stride, int pad, int depth) implements NodeParams {}

    record Pool(int kernel, int stride, int pad) implements NodeParams {}

    record Reshape(List<Integer> dims) implements NodeParams {
        public Reshape {
            dims = List.copyOf(dims);
        }
    }

    record Transpose(List<Integer> shuffle) implements NodeParams {
        public Transpose {
            shuffle = List.copyOf(shuffle);
        }
    }

    /**
     * @param shape target shape
     * @param axis  target axis the input's first dimension is aligned with
     */
    record Broadcast(List<Integer> shape, int axis) implements NodeParams {
        public Broadcast {
            shape = List.copyOf(shape);
        }
    }

    record Concat(int dimension) implements NodeParams {}

    record Slice(List<Integer> start) implements NodeParams {
        public Slice {
            start = List.copyOf(start);
        }
    }

    record BatchNormalization(int channelIdx, float epsilon, float momentum) implements NodeParams {}

    record LocalResponseNormalization(int halfWindowSize, float alpha, float beta, float k) implements NodeParams {}

    record Pow(float exponent) implements NodeParams {}

    record Splat(float value) implements NodeParams {}

    record TopK(int k) implements NodeParams {}

    /**
     * @param profiledNodeName name of the node whose output is being profiled
     */
    record QuantizationProfile(String profiledNodeName) implements NodeParams {}
}
