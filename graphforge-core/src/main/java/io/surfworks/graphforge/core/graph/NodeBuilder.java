package io.surfworks.graphforge.core.graph;

import io.surfworks.graphforge.core.types.ElemKind;
import io.surfworks.graphforge.core.types.Type;
import io.surfworks.graphforge.core.types.TypeRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates nodes in one {@link Function}, one method per operator kind.
 *
 * <p>Each method checks its preconditions, infers the result types, allocates
 * any auxiliary variables in the parent module and appends the node. A
 * violated precondition throws {@link GraphBuildException} before the module
 * or function is touched. Inputs are never modified.
 */
public final class NodeBuilder {

    static final float DEFAULT_BIAS = 0.1f;
    static final int PROFILE_HISTOGRAM_BUCKETS = 2000;

    private final Function function;
    private final Module module;

    NodeBuilder(Function function) {
        this.function = function;
        this.module = function.parent();
    }

    // ==================== Convolution and pooling ====================

    /**
     * Convolution with freshly allocated filter {@code [depth, kernel, kernel, C]}
     * (Xavier, fan-in {@code kernel * kernel * C}) and bias {@code [depth]}
     * (broadcast 0.1).
     */
    public Node createConv(String name, NodeValue input, int depth, int kernel, int stride, int pad) {
        List<Integer> idim = requireWindowInput("Convolution", name, input, kernel, stride, pad);
        require(depth > 0, "Convolution '%s' needs a positive depth, got %d", name, depth);
        int channels = idim.get(3);
        require(channels > 0, "Convolution '%s' input has no channels", name);

        List<Integer> outDims = ShapeInference.windowOutputDims(idim, kernel, stride, pad, depth);
        Variable filter = module.createVariable(ElemKind.FLOAT, List.of(depth, kernel, kernel, channels), "filter",
                Visibility.PRIVATE, TrainKind.XAVIER, kernel * kernel * channels);
        Variable bias = module.createVariable(ElemKind.FLOAT, List.of(depth), "bias",
                Visibility.PRIVATE, TrainKind.BROADCAST, DEFAULT_BIAS);
        TypeRef outTy = module.uniqueType(ElemKind.FLOAT, outDims);
        return add(name, NodeKind.CONVOLUTION, List.of(input, filter.output(), bias.output()),
                List.of(outTy), new NodeParams.Convolution(kernel, stride, pad, depth));
    }

    /**
     * Convolution over caller-supplied filter and bias with an explicit result
     * type, typically a quantized one.
     */
    public Node createConv(String name, NodeValue input, NodeValue filter, NodeValue bias, TypeRef outTy,
                           int depth, int kernel, int stride, int pad) {
        List<Integer> idim = requireWindowInput("Convolution", name, input, kernel, stride, pad);
        require(filter.dims().equals(List.of(depth, kernel, kernel, idim.get(3))),
                "Convolution '%s' has invalid filter dims %s, expected [%d, %d, %d, %d]",
                name, filter.dims(), depth, kernel, kernel, idim.get(3));
        require(bias.type().size() == depth,
                "Convolution '%s' has invalid bias size %d, expected %d", name, bias.type().size(), depth);
        List<Integer> expected = ShapeInference.windowOutputDims(idim, kernel, stride, pad, depth);
        require(outTy.dims().equals(expected),
                "Convolution '%s' result dims %s don't match computed %s", name, outTy.dims(), expected);
        return add(name, NodeKind.CONVOLUTION, List.of(input, filter, bias),
                List.of(module.types().adopt(outTy)), new NodeParams.Convolution(kernel, stride, pad, depth));
    }

    public Node createPoolMax(String name, NodeValue input, int kernel, int stride, int pad) {
        return createPool(NodeKind.POOL_MAX, name, input, kernel, stride, pad);
    }

    public Node createPoolAvg(String name, NodeValue input, int kernel, int stride, int pad) {
        return createPool(NodeKind.POOL_AVG, name, input, kernel, stride, pad);
    }

    private Node createPool(NodeKind kind, String name, NodeValue input, int kernel, int stride, int pad) {
        List<Integer> idim = requireWindowInput(kind.displayName(), name, input, kernel, stride, pad);
        TypeRef outTy = module.uniqueTypeWithNewShape(input.type(),
                ShapeInference.windowOutputDims(idim, kernel, stride, pad, idim.get(3)));
        return add(name, kind, List.of(input), List.of(outTy), new NodeParams.Pool(kernel, stride, pad));
    }

    // ==================== Fully connected ====================

    /**
     * Fully connected layer with freshly allocated weights
     * {@code [flattened, outDepth]} (Xavier) and bias {@code [outDepth]}
     * (broadcast 0.1). The input is flattened to {@code [N, rest]}.
     */
    public Node createFullyConnected(String name, NodeValue input, int outDepth) {
        requireRankAtLeast("FullyConnected", name, input, 1);
        require(outDepth > 0, "FullyConnected '%s' needs a positive output depth, got %d", name, outDepth);
        require(input.elemKind().isFloating(),
                "FullyConnected '%s' can only allocate weights for float input, got %s", name, input.type());
        int[] idim = ShapeInference.flattenCdr(input.dims());
        require(idim[1] > 0, "FullyConnected '%s' input %s has no features", name, input.type());

        Variable weights = module.createVariable(ElemKind.FLOAT, List.of(idim[1], outDepth), "weights",
                Visibility.PRIVATE, TrainKind.XAVIER, idim[1]);
        Variable bias = module.createVariable(ElemKind.FLOAT, List.of(outDepth), "bias",
                Visibility.PRIVATE, TrainKind.BROADCAST, DEFAULT_BIAS);
        TypeRef outTy = module.uniqueType(ElemKind.FLOAT, List.of(idim[0], outDepth));
        return add(name, NodeKind.FULLY_CONNECTED, List.of(input, weights.output(), bias.output()),
                List.of(outTy), NodeParams.None.INSTANCE);
    }

    /**
     * Fully connected layer over existing weights and bias; the result keeps
     * the input's element kind.
     */
    public Node createFullyConnected(String name, NodeValue input, NodeValue weights, NodeValue bias) {
        requireFullyConnectedOperands(name, input, weights, bias);
        TypeRef outTy = module.uniqueTypeWithNewShape(input.type(),
                List.of(input.dims().get(0), bias.dims().get(0)));
        return add(name, NodeKind.FULLY_CONNECTED, List.of(input, weights, bias),
                List.of(outTy), NodeParams.None.INSTANCE);
    }

    public Node createFullyConnected(String name, NodeValue input, NodeValue weights, NodeValue bias,
                                     TypeRef outTy) {
        requireFullyConnectedOperands(name, input, weights, bias);
        require(outTy.dims().equals(List.of(input.dims().get(0), bias.dims().get(0))),
                "FullyConnected '%s' result dims %s must be [%d, %d]",
                name, outTy.dims(), input.dims().get(0), bias.dims().get(0));
        return add(name, NodeKind.FULLY_CONNECTED, List.of(input, weights, bias),
                List.of(module.types().adopt(outTy)), NodeParams.None.INSTANCE);
    }

    private void requireFullyConnectedOperands(String name, NodeValue input, NodeValue weights, NodeValue bias) {
        requireRankAtLeast("FullyConnected", name, input, 1);
        require(weights.dims().size() == 2, "FullyConnected '%s' weights must be rank 2, got %s", name, weights.type());
        require(bias.dims().size() == 1, "FullyConnected '%s' bias must be rank 1, got %s", name, bias.type());
        int[] idim = ShapeInference.flattenCdr(input.dims());
        require(weights.dims().get(0) == idim[1],
                "FullyConnected '%s' weight rows %d don't match flattened input size %d",
                name, weights.dims().get(0), idim[1]);
        require(weights.dims().get(1).equals(bias.dims().get(0)),
                "FullyConnected '%s' weight columns %d don't match bias size %d",
                name, weights.dims().get(1), bias.dims().get(0));
    }

    // ==================== Activations and losses ====================

    public Node createRelu(String name, NodeValue input) {
        return add(name, NodeKind.RELU, List.of(input), List.of(input.type()), NodeParams.None.INSTANCE);
    }

    public Node createSigmoid(String name, NodeValue input) {
        return add(name, NodeKind.SIGMOID, List.of(input), List.of(input.type()), NodeParams.None.INSTANCE);
    }

    public Node createTanh(String name, NodeValue input) {
        return add(name, NodeKind.TANH, List.of(input), List.of(input.type()), NodeParams.None.INSTANCE);
    }

    /**
     * @param selected index of the expected class for each batch row
     */
    public Node createSoftMax(String name, NodeValue input, NodeValue selected) {
        requireRank("SoftMax", name, input, 2);
        require(selected.dims().size() >= 1 && selected.dims().get(0).equals(input.dims().get(0)),
                "SoftMax '%s' selected %s doesn't match batch of %s", name, selected.type(), input.type());
        return add(name, NodeKind.SOFT_MAX, List.of(input, selected), List.of(input.type()), NodeParams.None.INSTANCE);
    }

    public Node createCrossEntropyLoss(String name, NodeValue input, NodeValue labels) {
        requireRank("CrossEntropyLoss", name, input, 2);
        require(labels.dims().size() >= 1 && labels.dims().get(0).equals(input.dims().get(0)),
                "CrossEntropyLoss '%s' labels %s don't match batch of %s", name, labels.type(), input.type());
        TypeRef outTy = module.uniqueTypeWithNewShape(input.type(), List.of(1));
        return add(name, NodeKind.CROSS_ENTROPY_LOSS, List.of(input, labels), List.of(outTy), NodeParams.None.INSTANCE);
    }

    public Node createRegression(String name, NodeValue input, NodeValue expected) {
        requireSameDims("Regression", name, input, expected);
        return add(name, NodeKind.REGRESSION, List.of(input, expected), List.of(input.type()), NodeParams.None.INSTANCE);
    }

    // ==================== Shape manipulation ====================

    public Node createReshape(String name, NodeValue input, List<Integer> shape) {
        Type reshaped = input.type().type().withDims(shape);
        require(reshaped.size() == input.type().size(),
                "Reshape '%s' changes element count: %s to %s", name, input.type(), reshaped);
        TypeRef outTy = module.types().uniqueType(reshaped);
        return add(name, NodeKind.RESHAPE, List.of(input), List.of(outTy), new NodeParams.Reshape(shape));
    }

    public Node createTranspose(String name, NodeValue input, List<Integer> shuffle) {
        require(ShapeInference.isPermutation(shuffle, input.dims().size()),
                "Transpose '%s' shuffle %s is not a permutation of %d axes", name, shuffle, input.dims().size());
        TypeRef outTy = module.uniqueTypeWithNewShape(input.type(),
                ShapeInference.transposeDims(input.dims(), shuffle));
        return add(name, NodeKind.TRANSPOSE, List.of(input), List.of(outTy), new NodeParams.Transpose(shuffle));
    }

    /**
     * Broadcasts {@code input} to {@code shape}, aligning the input's first
     * dimension with {@code axis}.
     */
    public Node createBroadcast(String name, NodeValue input, List<Integer> shape, int axis) {
        require(ShapeInference.isBroadcastable(input.dims(), shape, axis),
                "Broadcast '%s' cannot broadcast %s to %s at axis %d", name, input.type(), shape, axis);
        TypeRef outTy = module.uniqueTypeWithNewShape(input.type(), shape);
        return add(name, NodeKind.BROADCAST, List.of(input), List.of(outTy), new NodeParams.Broadcast(shape, axis));
    }

    /**
     * Concatenates along {@code dimension}; all inputs must agree on element
     * kind and on every other dimension.
     */
    public Node createConcat(String name, List<NodeValue> inputs, int dimension) {
        requireConcatInputs(name, inputs, dimension);
        List<TypeRef> types = new ArrayList<>(inputs.size());
        for (NodeValue in : inputs) {
            types.add(in.type());
        }
        TypeRef outTy = module.uniqueTypeWithNewShape(inputs.get(0).type(),
                ShapeInference.concatDims(types, dimension));
        return add(name, NodeKind.CONCAT, inputs, List.of(outTy), new NodeParams.Concat(dimension));
    }

    public Node createConcat(String name, List<NodeValue> inputs, int dimension, TypeRef outTy) {
        requireConcatInputs(name, inputs, dimension);
        List<TypeRef> types = new ArrayList<>(inputs.size());
        for (NodeValue in : inputs) {
            types.add(in.type());
        }
        List<Integer> expected = ShapeInference.concatDims(types, dimension);
        require(outTy.dims().equals(expected),
                "Concat '%s' result dims %s don't match computed %s", name, outTy.dims(), expected);
        return add(name, NodeKind.CONCAT, inputs, List.of(module.types().adopt(outTy)),
                new NodeParams.Concat(dimension));
    }

    private void requireConcatInputs(String name, List<NodeValue> inputs, int dimension) {
        require(!inputs.isEmpty(), "Concat '%s' needs at least one input", name);
        TypeRef first = inputs.get(0).type();
        require(dimension >= 0 && dimension < first.dims().size(),
                "Concat '%s' axis %d out of range for %s", name, dimension, first);
        for (int i = 1; i < inputs.size(); i++) {
            require(ShapeInference.sameShapeExceptDim(inputs.get(i).type(), first, dimension),
                    "Concat '%s' input %d of type %s doesn't match %s outside axis %d",
                    name, i, inputs.get(i).type(), first, dimension);
        }
    }

    /**
     * Extracts {@code [begin, end)} on every axis.
     */
    public Node createSlice(String name, NodeValue input, List<Integer> begin, List<Integer> end) {
        List<Integer> dims = input.dims();
        require(begin.size() == end.size(), "Slice '%s' begin %s and end %s differ in rank", name, begin, end);
        require(begin.size() == dims.size(), "Slice '%s' begin %s doesn't match input rank of %s",
                name, begin, input.type());
        for (int i = 0; i < dims.size(); i++) {
            int b = begin.get(i);
            int e = end.get(i);
            require(b >= 0 && b < e && e <= dims.get(i),
                    "Slice '%s' has illegal bounds [%d, %d) on axis %d of size %d", name, b, e, i, dims.get(i));
        }
        TypeRef outTy = module.uniqueTypeWithNewShape(input.type(), ShapeInference.sliceDims(begin, end));
        return add(name, NodeKind.SLICE, List.of(input), List.of(outTy), new NodeParams.Slice(begin));
    }

    // ==================== Normalization ====================

    /**
     * Batch normalization with freshly allocated per-channel beta (0), gamma
     * (1), mean and variance variables.
     */
    public Node createBatchNormalization(String name, NodeValue input, int channelIdx,
                                         float epsilon, float momentum) {
        require(channelIdx >= 0 && channelIdx < input.dims().size(),
                "BatchNormalization '%s' channel axis %d out of range for %s", name, channelIdx, input.type());
        int channels = input.dims().get(channelIdx);
        List<Integer> perChannel = List.of(channels);

        Variable beta = module.createVariable(ElemKind.FLOAT, perChannel, "beta",
                Visibility.PRIVATE, TrainKind.BROADCAST, 0.0f);
        Variable gamma = module.createVariable(ElemKind.FLOAT, perChannel, "gamma",
                Visibility.PRIVATE, TrainKind.BROADCAST, 1.0f);
        Variable mean = module.createVariable(ElemKind.FLOAT, perChannel, "mean",
                Visibility.PRIVATE, TrainKind.NONE);
        Variable variance = module.createVariable(ElemKind.FLOAT, perChannel, "variance",
                Visibility.PRIVATE, TrainKind.NONE);

        return createBatchNormalization(name, input, beta.output(), gamma.output(), mean.output(),
                variance.output(), channelIdx, epsilon, momentum);
    }

    public Node createBatchNormalization(String name, NodeValue input, NodeValue beta, NodeValue gamma,
                                         NodeValue mean, NodeValue variance, int channelIdx,
                                         float epsilon, float momentum) {
        require(channelIdx >= 0 && channelIdx < input.dims().size(),
                "BatchNormalization '%s' channel axis %d out of range for %s", name, channelIdx, input.type());
        int channels = input.dims().get(channelIdx);
        for (NodeValue param : List.of(beta, gamma, mean, variance)) {
            require(param.type().size() == channels,
                    "BatchNormalization '%s' parameter %s doesn't have %d channels", name, param.type(), channels);
        }
        return add(name, NodeKind.BATCH_NORMALIZATION, List.of(input, gamma, beta, mean, variance),
                List.of(input.type()), new NodeParams.BatchNormalization(channelIdx, epsilon, momentum));
    }

    /**
     * Local response normalization across channels. Allocates a private
     * {@code scale} scratch variable shaped like the input.
     */
    public Node createLocalResponseNormalization(String name, NodeValue input, int halfWindowSize,
                                                 float alpha, float beta, float k) {
        requireRank("LocalResponseNormalization", name, input, 4);
        require(halfWindowSize >= 0, "LocalResponseNormalization '%s' needs a non-negative window, got %d",
                name, halfWindowSize);
        Variable scale = module.createVariable(input.type(), "scale", Visibility.PRIVATE, TrainKind.NONE);
        return add(name, NodeKind.LOCAL_RESPONSE_NORMALIZATION, List.of(input, scale.output()),
                List.of(input.type()), new NodeParams.LocalResponseNormalization(halfWindowSize, alpha, beta, k));
    }

    // ==================== Elementwise arithmetic ====================

    public Node createAdd(String name, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.ADD, name, lhs.type(), lhs, rhs);
    }

    public Node createAdd(String name, TypeRef outTy, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.ADD, name, outTy, lhs, rhs);
    }

    public Node createMul(String name, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.MUL, name, lhs.type(), lhs, rhs);
    }

    public Node createMul(String name, TypeRef outTy, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.MUL, name, outTy, lhs, rhs);
    }

    public Node createSub(String name, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.SUB, name, lhs.type(), lhs, rhs);
    }

    public Node createSub(String name, TypeRef outTy, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.SUB, name, outTy, lhs, rhs);
    }

    public Node createDiv(String name, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.DIV, name, lhs.type(), lhs, rhs);
    }

    public Node createDiv(String name, TypeRef outTy, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.DIV, name, outTy, lhs, rhs);
    }

    public Node createMax(String name, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.MAX, name, lhs.type(), lhs, rhs);
    }

    public Node createMax(String name, TypeRef outTy, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.MAX, name, outTy, lhs, rhs);
    }

    public Node createMin(String name, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.MIN, name, lhs.type(), lhs, rhs);
    }

    public Node createMin(String name, TypeRef outTy, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.MIN, name, outTy, lhs, rhs);
    }

    public Node createCmpLTE(String name, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.CMP_LTE, name, lhs.type(), lhs, rhs);
    }

    public Node createCmpLTE(String name, TypeRef outTy, NodeValue lhs, NodeValue rhs) {
        return createArithmetic(NodeKind.CMP_LTE, name, outTy, lhs, rhs);
    }

    private Node createArithmetic(NodeKind kind, String name, TypeRef outTy, NodeValue lhs, NodeValue rhs) {
        requireSameDims(kind.displayName(), name, lhs, rhs);
        require(outTy.dims().equals(lhs.dims()),
                "%s '%s' result dims %s don't match operand dims %s", kind.displayName(), name, outTy.dims(), lhs.dims());
        return add(name, kind, List.of(lhs, rhs), List.of(module.types().adopt(outTy)), NodeParams.None.INSTANCE);
    }

    public Node createPow(String name, NodeValue base, float exponent) {
        return add(name, NodeKind.POW, List.of(base), List.of(base.type()), new NodeParams.Pow(exponent));
    }

    public Node createSelect(String name, NodeValue cond, NodeValue lhs, NodeValue rhs) {
        requireSameDims("Select", name, lhs, rhs);
        requireSameDims("Select", name, cond, rhs);
        return add(name, NodeKind.SELECT, List.of(cond, lhs, rhs), List.of(lhs.type()), NodeParams.None.INSTANCE);
    }

    /**
     * A tensor of type {@code type} with every element set to {@code value}.
     */
    public Node createSplat(String name, TypeRef type, float value) {
        return add(name, NodeKind.SPLAT, List.of(), List.of(module.types().adopt(type)), new NodeParams.Splat(value));
    }

    // ==================== Matrix and batch ====================

    /**
     * {@code [M, K] x [K, N] -> [M, N]}.
     */
    public Node createMatMul(String name, NodeValue lhs, NodeValue rhs) {
        requireMatMulOperands(name, lhs, rhs);
        TypeRef outTy = module.uniqueTypeWithNewShape(lhs.type(), List.of(lhs.dims().get(0), rhs.dims().get(1)));
        return add(name, NodeKind.MATMUL, List.of(lhs, rhs), List.of(outTy), NodeParams.None.INSTANCE);
    }

    /**
     * Matrix multiply with an explicit result type, e.g. different
     * quantization parameters than the operands.
     */
    public Node createMatMul(String name, TypeRef outTy, NodeValue lhs, NodeValue rhs) {
        requireMatMulOperands(name, lhs, rhs);
        List<Integer> expected = List.of(lhs.dims().get(0), rhs.dims().get(1));
        require(outTy.dims().equals(expected),
                "MatMul '%s' result dims %s don't match computed %s", name, outTy.dims(), expected);
        return add(name, NodeKind.MATMUL, List.of(lhs, rhs), List.of(module.types().adopt(outTy)),
                NodeParams.None.INSTANCE);
    }

    private void requireMatMulOperands(String name, NodeValue lhs, NodeValue rhs) {
        require(lhs.elemKind() == rhs.elemKind(),
                "MatMul '%s' operand element kinds differ: %s vs %s", name, lhs.elemKind(), rhs.elemKind());
        requireRank("MatMul", name, lhs, 2);
        requireRank("MatMul", name, rhs, 2);
        require(lhs.dims().get(1).equals(rhs.dims().get(0)),
                "MatMul '%s' inner dimensions differ: %s x %s", name, lhs.type(), rhs.type());
    }

    /**
     * Sums a batch over its leading dimension.
     */
    public Node createBatchedReduceAdd(String name, NodeValue batch) {
        requireRankAtLeast("BatchedReduceAdd", name, batch, 1);
        List<Integer> dims = batch.dims();
        TypeRef outTy = module.uniqueTypeWithNewShape(batch.type(), dims.subList(1, dims.size()));
        return add(name, NodeKind.BATCHED_REDUCE_ADD, List.of(batch), List.of(outTy), NodeParams.None.INSTANCE);
    }

    /**
     * Adds {@code slice} to every entry of {@code batch} along its leading
     * dimension.
     */
    public Node createBatchedAdd(String name, NodeValue batch, NodeValue slice) {
        return createBatchedAdd(name, batch.type(), batch, slice);
    }

    public Node createBatchedAdd(String name, TypeRef outTy, NodeValue batch, NodeValue slice) {
        requireRankAtLeast("BatchedAdd", name, batch, 1);
        List<Integer> dims = batch.dims();
        require(dims.subList(1, dims.size()).equals(slice.dims()),
                "BatchedAdd '%s' slice %s doesn't match batch entries of %s", name, slice.type(), batch.type());
        require(outTy.dims().equals(dims),
                "BatchedAdd '%s' result dims %s don't match batch dims %s", name, outTy.dims(), dims);
        return add(name, NodeKind.BATCHED_ADD, List.of(batch, slice), List.of(module.types().adopt(outTy)),
                NodeParams.None.INSTANCE);
    }

    // ==================== Outputs and profiling ====================

    /**
     * Saves {@code input} into a new public variable called {@code name}. The
     * node itself is named {@code _save_<name>}.
     */
    public Node createSave(String name, NodeValue input) {
        Variable dest = module.createVariable(input.type(), name, Visibility.PUBLIC, TrainKind.NONE);
        return add("_save_" + name, NodeKind.SAVE, List.of(input, dest.output()), List.of(),
                NodeParams.None.INSTANCE);
    }

    public Node createSave(String name, NodeValue input, Variable output) {
        require(input.dims().equals(output.type().dims()) && input.elemKind() == output.type().elemKind(),
                "Save '%s' input %s doesn't fit variable '%s' of type %s", name, input.type(), output.name(),
                output.type());
        return add(name, NodeKind.SAVE, List.of(input, output.output()), List.of(), NodeParams.None.INSTANCE);
    }

    /**
     * Records the value range of {@code input} into a histogram variable for
     * later quantization.
     */
    public Node createQuantizationProfile(String name, NodeValue input) {
        ValueProducer profiled = function.producerOf(input).orElseThrow(() -> new GraphBuildException(
                "QuantizationProfile '%s' input %s is not part of function '%s'", name, input, function.name()));
        Variable histogram = module.createVariable(ElemKind.FLOAT, List.of(PROFILE_HISTOGRAM_BUCKETS), "histogram",
                Visibility.PRIVATE, TrainKind.NONE);
        // Min seen so far at index 0, max at index 1.
        Variable computationInfo = module.createVariable(ElemKind.FLOAT, List.of(2), "computationInfo",
                Visibility.PRIVATE, TrainKind.NONE);
        return add(name, NodeKind.QUANTIZATION_PROFILE,
                List.of(input, histogram.output(), computationInfo.output()), List.of(),
                new NodeParams.QuantizationProfile(profiled.name()));
    }

    // ==================== Selection and indexing ====================

    /**
     * The {@code k} largest entries along the last dimension, as a values
     * result and an index result of the same shape.
     */
    public Node createTopK(String name, NodeValue input, int k) {
        requireRankAtLeast("TopK", name, input, 1);
        List<Integer> dims = input.dims();
        int last = dims.get(dims.size() - 1);
        require(k > 0 && k <= last, "TopK '%s' k=%d out of range for last dimension %d", name, k, last);
        List<Integer> outDims = ShapeInference.topKDims(dims, k);
        TypeRef values = module.uniqueTypeWithNewShape(input.type(), outDims);
        TypeRef indices = module.uniqueType(ElemKind.INDEX, outDims);
        return add(name, NodeKind.TOP_K, List.of(input), List.of(values, indices), new NodeParams.TopK(k));
    }

    /**
     * Gathers slices of {@code data} along its first dimension;
     * the result dims are {@code indices.dims ++ data.dims[1:]}.
     */
    public Node createGather(String name, NodeValue data, NodeValue indices) {
        requireRankAtLeast("Gather", name, data, 1);
        require(indices.elemKind() == ElemKind.INDEX,
                "Gather '%s' indices must have index element kind, got %s", name, indices.type());
        TypeRef outTy = module.uniqueTypeWithNewShape(data.type(),
                ShapeInference.gatherDims(data.dims(), indices.dims()));
        return add(name, NodeKind.GATHER, List.of(data, indices), List.of(outTy), NodeParams.None.INSTANCE);
    }

    // ==================== Quantization ====================

    public Node createQuantize(String name, NodeValue input, TypeRef outTy) {
        require(input.elemKind().isFloating(), "Quantize '%s' input must be float, got %s", name, input.type());
        require(outTy.isQuantized(), "Quantize '%s' output must be quantized, got %s", name, outTy);
        require(input.dims().equals(outTy.dims()),
                "Quantize '%s' changes dimensions: %s to %s", name, input.type(), outTy);
        return add(name, NodeKind.QUANTIZE, List.of(input), List.of(module.types().adopt(outTy)),
                NodeParams.None.INSTANCE);
    }

    public Node createDequantize(String name, NodeValue input) {
        require(input.type().isQuantized(), "Dequantize '%s' input must be quantized, got %s", name, input.type());
        TypeRef outTy = module.uniqueType(ElemKind.FLOAT, input.dims());
        return add(name, NodeKind.DEQUANTIZE, List.of(input), List.of(outTy), NodeParams.None.INSTANCE);
    }

    public Node createRescaleQuantized(String name, NodeValue input, TypeRef outTy) {
        require(input.type().isQuantized(), "RescaleQuantized '%s' input must be quantized, got %s",
                name, input.type());
        require(outTy.isQuantized(), "RescaleQuantized '%s' output must be quantized, got %s", name, outTy);
        require(input.dims().equals(outTy.dims()),
                "RescaleQuantized '%s' changes dimensions: %s to %s", name, input.type(), outTy);
        return add(name, NodeKind.RESCALE_QUANTIZED, List.of(input), List.of(module.types().adopt(outTy)),
                NodeParams.None.INSTANCE);
    }

    // ==================== Helpers ====================

    private Node add(String name, NodeKind kind, List<NodeValue> inputs, List<TypeRef> results, NodeParams params) {
        Objects.requireNonNull(name, "name");
        Node node = new Node(module.allocateId(), name, kind, inputs, results, params);
        return function.addNode(node);
    }

    private List<Integer> requireWindowInput(String kind, String name, NodeValue input,
                                             int kernel, int stride, int pad) {
        requireRank(kind, name, input, 4);
        require(kernel > 0 && stride > 0 && pad >= 0,
                "%s '%s' has invalid kernel %d, stride %d, pad %d", kind, name, kernel, stride, pad);
        List<Integer> idim = input.dims();
        require(idim.get(1) >= kernel && idim.get(2) >= kernel,
                "%s '%s' input %s is too small for kernel %d", kind, name, input.type(), kernel);
        return idim;
    }

    private static void requireRank(String kind, String name, NodeValue value, int rank) {
        require(value.dims().size() == rank,
                "%s '%s' operand must be rank %d, got %s", kind, name, rank, value.type());
    }

    private static void requireRankAtLeast(String kind, String name, NodeValue value, int rank) {
        require(value.dims().size() >= rank,
                "%s '%s' operand must be at least rank %d, got %s", kind, name, rank, value.type());
    }

    private static void requireSameDims(String kind, String name, NodeValue a, NodeValue b) {
        require(a.dims().equals(b.dims()),
                "%s '%s' operand shapes differ: %s vs %s", kind, name, a.type(), b.type());
    }

    private static void require(boolean condition, String format, Object... args) {
        if (!condition) {
            throw new GraphBuildException(format, args);
        }
    }
}
