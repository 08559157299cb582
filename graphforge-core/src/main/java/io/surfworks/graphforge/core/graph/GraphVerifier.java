package io.surfworks.graphforge.core.graph;

import io.surfworks.graphforge.core.types.ElemKind;
import io.surfworks.graphforge.core.types.TypeRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Structural checks over a {@link Function} and its module's variables.
 *
 * <p>Rules run in order and verification stops at the first violation:
 * <ol>
 *   <li>variable names are unique within the module</li>
 *   <li>node names are unique, and do not clash with variable names</li>
 *   <li>every input edge resolves to a node of the function or a variable of
 *       the module, with a valid result number and matching type</li>
 *   <li>every node is locally well formed for its kind</li>
 * </ol>
 */
public final class GraphVerifier {

    private static final Logger LOG = Logger.getLogger(GraphVerifier.class.getName());

    public enum Rule {
        UNIQUE_VARIABLE_NAMES,
        UNIQUE_NODE_NAMES,
        RESOLVED_EDGES,
        WELL_FORMED_NODES
    }

    private final Function function;

    private GraphVerifier(Function function) {
        this.function = function;
    }

    /**
     * @throws GraphVerificationException describing the first violation
     */
    public static void verify(Function function) {
        GraphVerifier verifier = new GraphVerifier(function);
        verifier.checkNames();
        verifier.checkEdges();
        verifier.checkNodes();
    }

    private void checkNames() {
        Map<String, ValueProducer> nameToEntity = new HashMap<>();

        for (Variable variable : function.parent().variables()) {
            ValueProducer previous = nameToEntity.putIfAbsent(variable.name(), variable);
            if (previous != null) {
                fail(Rule.UNIQUE_VARIABLE_NAMES, List.of(variable.name()),
                        "The variable with name '" + variable.name() + "' conflicts with a previous definition:"
                                + "\nCurrent definition: " + GraphJson.render(variable.toJson())
                                + "\nPrevious definition: " + GraphJson.render(previous.toJson()));
            }
        }

        for (Node node : function.nodes()) {
            ValueProducer previous = nameToEntity.putIfAbsent(node.name(), node);
            if (previous != null) {
                fail(Rule.UNIQUE_NODE_NAMES, List.of(node.name()),
                        "The node with name '" + node.name() + "' conflicts with a previous definition:"
                                + "\nCurrent definition: " + GraphJson.render(node.toJson())
                                + "\nPrevious definition: " + GraphJson.render(previous.toJson()));
            }
        }
    }

    private void checkEdges() {
        for (Node node : function.nodes()) {
            for (int i = 0; i < node.numInputs(); i++) {
                NodeValue input = node.nthInput(i);
                Optional<ValueProducer> producer = function.producerOf(input);
                if (producer.isEmpty()) {
                    fail(Rule.RESOLVED_EDGES, List.of(node.name()),
                            "Input '" + node.inputName(i) + "' of '" + node.name() + "' references #"
                                    + input.producerId() + ", which is not part of function '" + function.name()
                                    + "' or its module");
                }
                ValueProducer p = producer.get();
                if (input.resNo() >= p.numResults()) {
                    fail(Rule.RESOLVED_EDGES, List.of(node.name(), p.name()),
                            "Input '" + node.inputName(i) + "' of '" + node.name() + "' reads result "
                                    + input.resNo() + " of '" + p.name() + "', which has " + p.numResults());
                }
                if (p.resultType(input.resNo()) != input.type()) {
                    fail(Rule.RESOLVED_EDGES, List.of(node.name(), p.name()),
                            "Input '" + node.inputName(i) + "' of '" + node.name() + "' expects " + input.type()
                                    + " but '" + p.name() + "' produces " + p.resultType(input.resNo()));
                }
            }
        }
    }

    private void checkNodes() {
        for (Node node : function.nodes()) {
            String problem = checkSlots(node);
            if (problem == null) {
                try {
                    problem = checkNode(node);
                } catch (GraphBuildException e) {
                    // Shapes whose inferred dims overflow.
                    problem = e.getMessage();
                }
            }
            if (problem != null) {
                fail(Rule.WELL_FORMED_NODES, List.of(node.name()),
                        node.kind().displayName() + " '" + node.name() + "': " + problem);
            }
        }
    }

    private static String checkSlots(Node node) {
        NodeKind kind = node.kind();
        if (kind.isVariadic()) {
            if (node.numInputs() == 0) {
                return "expects at least one input";
            }
        } else if (node.numInputs() != kind.inputNames().size()) {
            return "has " + node.numInputs() + " inputs but declares " + kind.inputNames().size();
        }
        if (node.numResults() != kind.resultNames().size()) {
            return "has " + node.numResults() + " results but declares " + kind.resultNames().size();
        }
        return null;
    }

    /**
     * Kind-specific checks. Returns a description of the problem, or null.
     */
    private static String checkNode(Node node) {
        return switch (node.kind()) {
            case CONVOLUTION -> checkConvolution(node);
            case POOL_MAX, POOL_AVG -> checkPool(node);
            case FULLY_CONNECTED -> checkFullyConnected(node);
            case RELU, SIGMOID, TANH, POW, SOFT_MAX -> sameDims(in(node, 0), out(node, 0), "result");
            case CROSS_ENTROPY_LOSS -> out(node, 0).dims().equals(List.of(1)) ? null : "result must be [1]";
            case REGRESSION -> sameDims(in(node, 0), in(node, 1), "expected");
            case RESHAPE -> in(node, 0).size() == out(node, 0).size() ? null : "reshape changes element count";
            case TRANSPOSE -> checkTranspose(node);
            case BROADCAST -> checkBroadcast(node);
            case CONCAT -> checkConcat(node);
            case SLICE -> checkSlice(node);
            case BATCH_NORMALIZATION -> checkBatchNormalization(node);
            case LOCAL_RESPONSE_NORMALIZATION -> first(
                    sameDims(in(node, 0), out(node, 0), "result"),
                    sameDims(in(node, 0), in(node, 1), "scale"));
            case ADD, MUL, SUB, DIV, MAX, MIN, CMP_LTE -> first(
                    sameDims(in(node, 0), in(node, 1), "RHS"),
                    sameDims(in(node, 0), out(node, 0), "result"));
            case SELECT -> first(
                    sameDims(in(node, 1), in(node, 2), "RHS"),
                    sameDims(in(node, 0), in(node, 2), "condition"));
            case SPLAT -> null;
            case MATMUL -> checkMatMul(node);
            case BATCHED_REDUCE_ADD -> checkBatchedReduceAdd(node);
            case BATCHED_ADD -> checkBatchedAdd(node);
            case SAVE -> first(
                    sameDims(in(node, 0), in(node, 1), "destination"),
                    in(node, 0).elemKind() == in(node, 1).elemKind() ? null : "destination element kind differs");
            case QUANTIZATION_PROFILE -> in(node, 2).size() == 2 ? null : "computation info must hold 2 values";
            case TOP_K -> checkTopK(node);
            case GATHER -> checkGather(node);
            case QUANTIZE -> checkQuantization(node, false, true);
            case DEQUANTIZE -> checkQuantization(node, true, false);
            case RESCALE_QUANTIZED -> checkQuantization(node, true, true);
        };
    }

    private static String checkConvolution(Node node) {
        NodeParams.Convolution p = node.params(NodeParams.Convolution.class);
        TypeRef input = in(node, 0);
        if (input.dims().size() != 4) {
            return "input must be NHWC, got " + input;
        }
        List<Integer> filterDims = List.of(p.depth(), p.kernel(), p.kernel(), input.dims().get(3));
        if (!in(node, 1).dims().equals(filterDims)) {
            return "invalid filter dims " + in(node, 1).dims() + ", expected " + filterDims;
        }
        if (in(node, 2).size() != p.depth()) {
            return "invalid bias size " + in(node, 2).size() + ", expected " + p.depth();
        }
        List<Integer> expected = ShapeInference.windowOutputDims(input.dims(), p.kernel(), p.stride(), p.pad(),
                p.depth());
        return out(node, 0).dims().equals(expected) ? null : "result " + out(node, 0) + " doesn't match " + expected;
    }

    private static String checkPool(Node node) {
        NodeParams.Pool p = node.params(NodeParams.Pool.class);
        TypeRef input = in(node, 0);
        if (input.dims().size() != 4) {
            return "input must be NHWC, got " + input;
        }
        List<Integer> expected = ShapeInference.windowOutputDims(input.dims(), p.kernel(), p.stride(), p.pad(),
                input.dims().get(3));
        if (input.elemKind() != out(node, 0).elemKind()) {
            return "pooling changes element kind";
        }
        return out(node, 0).dims().equals(expected) ? null : "result " + out(node, 0) + " doesn't match " + expected;
    }

    private static String checkFullyConnected(Node node) {
        TypeRef input = in(node, 0);
        TypeRef weights = in(node, 1);
        TypeRef bias = in(node, 2);
        if (weights.dims().size() != 2 || bias.dims().size() != 1) {
            return "weights must be rank 2 and bias rank 1";
        }
        if (input.dims().isEmpty() || weights.dims().get(0) != ShapeInference.trailingSize(input.dims())) {
            return "weight rows " + weights.dims().get(0) + " don't match flattened " + input;
        }
        if (!weights.dims().get(1).equals(bias.dims().get(0))) {
            return "weights " + weights + " don't match bias " + bias;
        }
        List<Integer> expected = List.of(input.dims().get(0), bias.dims().get(0));
        return out(node, 0).dims().equals(expected) ? null : "result " + out(node, 0) + " doesn't match " + expected;
    }

    private static String checkTranspose(Node node) {
        List<Integer> shuffle = node.params(NodeParams.Transpose.class).shuffle();
        TypeRef input = in(node, 0);
        if (!ShapeInference.isPermutation(shuffle, input.dims().size())) {
            return "shuffle " + shuffle + " is not a permutation";
        }
        List<Integer> expected = ShapeInference.transposeDims(input.dims(), shuffle);
        return out(node, 0).dims().equals(expected) ? null : "result " + out(node, 0) + " doesn't match " + expected;
    }

    private static String checkBroadcast(Node node) {
        NodeParams.Broadcast p = node.params(NodeParams.Broadcast.class);
        if (!ShapeInference.isBroadcastable(in(node, 0).dims(), p.shape(), p.axis())) {
            return "cannot broadcast " + in(node, 0) + " to " + p.shape() + " at axis " + p.axis();
        }
        return out(node, 0).dims().equals(p.shape()) ? null : "result " + out(node, 0) + " isn't " + p.shape();
    }

    private static String checkConcat(Node node) {
        int dimension = node.params(NodeParams.Concat.class).dimension();
        List<TypeRef> inputs = new ArrayList<>();
        for (NodeValue value : node.inputs()) {
            inputs.add(value.type());
        }
        if (dimension < 0 || dimension >= inputs.get(0).dims().size()) {
            return "axis " + dimension + " out of range";
        }
        for (int i = 1; i < inputs.size(); i++) {
            if (!ShapeInference.sameShapeExceptDim(inputs.get(i), inputs.get(0), dimension)) {
                return "input " + i + " " + inputs.get(i) + " doesn't match " + inputs.get(0);
            }
        }
        List<Integer> expected = ShapeInference.concatDims(inputs, dimension);
        return out(node, 0).dims().equals(expected) ? null : "result " + out(node, 0) + " doesn't match " + expected;
    }

    private static String checkSlice(Node node) {
        List<Integer> start = node.params(NodeParams.Slice.class).start();
        List<Integer> inDims = in(node, 0).dims();
        List<Integer> outDims = out(node, 0).dims();
        if (start.size() != inDims.size() || outDims.size() != inDims.size()) {
            return "rank mismatch between input, result and start " + start;
        }
        for (int i = 0; i < inDims.size(); i++) {
            if (start.get(i) < 0 || outDims.get(i) <= 0 || start.get(i) + outDims.get(i) > inDims.get(i)) {
                return "slice at " + start + " of size " + outDims + " exceeds " + inDims;
            }
        }
        return null;
    }

    private static String checkBatchNormalization(Node node) {
        int channelIdx = node.params(NodeParams.BatchNormalization.class).channelIdx();
        TypeRef input = in(node, 0);
        if (channelIdx < 0 || channelIdx >= input.dims().size()) {
            return "channel axis " + channelIdx + " out of range for " + input;
        }
        int channels = input.dims().get(channelIdx);
        for (int i = 1; i < node.numInputs(); i++) {
            if (in(node, i).size() != channels) {
                return node.inputName(i) + " " + in(node, i) + " doesn't have " + channels + " channels";
            }
        }
        return sameDims(input, out(node, 0), "result");
    }

    private static String checkMatMul(Node node) {
        TypeRef lhs = in(node, 0);
        TypeRef rhs = in(node, 1);
        if (lhs.elemKind() != rhs.elemKind()) {
            return "operand element kinds differ: " + lhs + " vs " + rhs;
        }
        if (lhs.dims().size() != 2 || rhs.dims().size() != 2 || !lhs.dims().get(1).equals(rhs.dims().get(0))) {
            return "cannot multiply " + lhs + " by " + rhs;
        }
        List<Integer> expected = List.of(lhs.dims().get(0), rhs.dims().get(1));
        return out(node, 0).dims().equals(expected) ? null : "result " + out(node, 0) + " doesn't match " + expected;
    }

    private static String checkBatchedReduceAdd(Node node) {
        List<Integer> dims = in(node, 0).dims();
        if (dims.isEmpty()) {
            return "batch must have a leading dimension";
        }
        return out(node, 0).dims().equals(dims.subList(1, dims.size())) ? null : "result must drop the batch dimension";
    }

    private static String checkBatchedAdd(Node node) {
        List<Integer> dims = in(node, 0).dims();
        if (dims.isEmpty() || !dims.subList(1, dims.size()).equals(in(node, 1).dims())) {
            return "slice " + in(node, 1) + " doesn't match batch entries of " + in(node, 0);
        }
        return sameDims(in(node, 0), out(node, 0), "result");
    }

    private static String checkTopK(Node node) {
        int k = node.params(NodeParams.TopK.class).k();
        List<Integer> dims = in(node, 0).dims();
        if (dims.isEmpty() || k > dims.get(dims.size() - 1)) {
            return "k=" + k + " exceeds last dimension of " + in(node, 0);
        }
        List<Integer> expected = ShapeInference.topKDims(dims, k);
        if (!out(node, 0).dims().equals(expected) || !out(node, 1).dims().equals(expected)) {
            return "values and indices must both be " + expected;
        }
        return out(node, 1).elemKind() == ElemKind.INDEX ? null : "indices must have index element kind";
    }

    private static String checkGather(Node node) {
        List<Integer> data = in(node, 0).dims();
        if (data.isEmpty()) {
            return "data must have at least one dimension";
        }
        if (in(node, 1).elemKind() != ElemKind.INDEX) {
            return "indices must have index element kind, got " + in(node, 1);
        }
        List<Integer> expected = ShapeInference.gatherDims(data, in(node, 1).dims());
        return out(node, 0).dims().equals(expected) ? null : "result " + out(node, 0) + " doesn't match " + expected;
    }

    private static String checkQuantization(Node node, boolean quantizedIn, boolean quantizedOut) {
        TypeRef input = in(node, 0);
        TypeRef result = out(node, 0);
        if (input.isQuantized() != quantizedIn || (!quantizedIn && !input.elemKind().isFloating())) {
            return "unexpected input element kind " + input.elemKind();
        }
        if (result.isQuantized() != quantizedOut || (!quantizedOut && !result.elemKind().isFloating())) {
            return "unexpected result element kind " + result.elemKind();
        }
        return sameDims(input, result, "result");
    }

    private static TypeRef in(Node node, int idx) {
        return node.nthInput(idx).type();
    }

    private static TypeRef out(Node node, int idx) {
        return node.resultType(idx);
    }

    private static String sameDims(TypeRef a, TypeRef b, String what) {
        return a.dims().equals(b.dims()) ? null : what + " " + b + " doesn't match " + a;
    }

    private static String first(String... problems) {
        for (String problem : problems) {
            if (problem != null) {
                return problem;
            }
        }
        return null;
    }

    private void fail(Rule rule, List<String> offenders, String message) {
        LOG.severe(() -> "Verification of '" + function.name() + "' failed: " + message
                + "\n" + function.dump());
        throw new GraphVerificationException(rule, offenders, message);
    }
}
