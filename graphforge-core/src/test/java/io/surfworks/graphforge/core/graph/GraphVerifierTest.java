package io.surfworks.graphforge.core.graph;

import io.surfworks.graphforge.core.types.ElemKind;
import io.surfworks.graphforge.core.types.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphVerifierTest {

    private Module module;
    private Function function;
    private NodeBuilder builder;
    private Variable input;

    @BeforeEach
    void setUp() {
        module = new Module();
        function = module.createFunction("main");
        builder = function.builder();
        input = module.createVariable(ElemKind.FLOAT, List.of(1, 8, 8, 3), "input", Visibility.PUBLIC, TrainKind.NONE);
    }

    private GraphVerificationException assertViolation(GraphVerifier.Rule rule) {
        GraphVerificationException e = assertThrows(GraphVerificationException.class, function::verify);
        assertEquals(rule, e.rule(), e.getMessage());
        assertTrue(e.getMessage().startsWith("[" + rule + "]"));
        return e;
    }

    private Node rawNode(String name, NodeKind kind, List<NodeValue> inputs, List<TypeRef> results,
                         NodeParams params) {
        return function.addNode(new Node(module.allocateId(), name, kind, inputs, results, params));
    }

    @Nested
    @DisplayName("Well-formed Graphs")
    class WellFormedGraphs {

        @Test
        void emptyFunctionVerifies() {
            assertDoesNotThrow(function::verify);
        }

        @Test
        void convolutionalNetworkVerifies() {
            Node conv = builder.createConv("conv", input.output(), 4, 3, 1, 1);
            Node bn = builder.createBatchNormalization("bn", conv.output(), 3, 1e-5f, 0.9f);
            Node relu = builder.createRelu("relu", bn.output());
            Node lrn = builder.createLocalResponseNormalization("lrn", relu.output(), 2, 1e-4f, 0.75f, 2.0f);
            Node pool = builder.createPoolAvg("pool", lrn.output(), 2, 2, 0);
            Node reshape = builder.createReshape("flat", pool.output(), List.of(1, 64));
            Node fc = builder.createFullyConnected("fc", reshape.output(), 10);
            Node topK = builder.createTopK("topk", fc.output(), 3);
            builder.createSave("values", topK.output(0));
            builder.createSave("indices", topK.output(1));
            assertDoesNotThrow(function::verify);
        }

        @Test
        void tensorAlgebraVerifies() {
            Variable a = module.createVariable(ElemKind.FLOAT, List.of(2, 5), "a", Visibility.PUBLIC, TrainKind.NONE);
            Variable b = module.createVariable(ElemKind.FLOAT, List.of(5, 7), "b", Visibility.PUBLIC, TrainKind.NONE);
            Node mm = builder.createMatMul("mm", a.output(), b.output());
            Node t = builder.createTranspose("t", mm.output(), List.of(1, 0));
            Node slice = builder.createSlice("slice", t.output(), List.of(1, 0), List.of(4, 2));
            Node concat = builder.createConcat("concat", List.of(slice.output(), slice.output()), 0);
            Node splat = builder.createSplat("one", concat.resultType(0), 1.0f);
            Node add = builder.createAdd("add", concat.output(), splat.output());
            Node cmp = builder.createCmpLTE("cmp", add.output(), splat.output());
            Node sel = builder.createSelect("sel", cmp.output(), add.output(), splat.output());
            Node pow = builder.createPow("pow", sel.output(), 2.0f);
            Node sum = builder.createBatchedReduceAdd("sum", pow.output());
            Node bcast = builder.createBroadcast("bcast", sum.output(), List.of(6, 2), 1);
            Node badd = builder.createBatchedAdd("badd", bcast.output(), sum.output());
            builder.createSave("out", badd.output());
            assertDoesNotThrow(function::verify);
        }

        @Test
        void quantizedPipelineVerifies() {
            Variable x = module.createVariable(ElemKind.FLOAT, List.of(4, 4), "x", Visibility.PUBLIC, TrainKind.NONE);
            TypeRef q = module.uniqueType(ElemKind.INT8_QUANTIZED, List.of(4, 4), 0.1f, 0);
            TypeRef q32 = module.uniqueType(ElemKind.INT32_QUANTIZED, List.of(4, 4), 0.01f, 0);
            Node profile = builder.createQuantizationProfile("profile", builder.createRelu("r", x.output()).output());
            Node quant = builder.createQuantize("quant", x.output(), q);
            Node mm = builder.createMatMul("mm", q32, quant.output(), quant.output());
            Node rescale = builder.createRescaleQuantized("rescale", mm.output(), q);
            Node deq = builder.createDequantize("deq", rescale.output());
            Variable idx = module.createVariable(ElemKind.INDEX, List.of(2), "idx", Visibility.PUBLIC, TrainKind.NONE);
            Node gather = builder.createGather("gather", deq.output(), idx.output());
            builder.createSave("out", gather.output());
            assertEquals(0, profile.numResults());
            assertDoesNotThrow(function::verify);
        }
    }

    @Nested
    @DisplayName("Names")
    class Names {

        @Test
        void duplicateVariableNames() {
            Variable other = module.createVariable(ElemKind.FLOAT, List.of(2), "other", Visibility.PUBLIC,
                    TrainKind.NONE);
            other.setName(input.name());
            GraphVerificationException e = assertViolation(GraphVerifier.Rule.UNIQUE_VARIABLE_NAMES);
            assertEquals(List.of(input.name()), e.offenders());
        }

        @Test
        void duplicateNodeNames() {
            Node a = builder.createRelu("a", input.output());
            Node b = builder.createRelu("b", a.output());
            b.setName(a.name());
            GraphVerificationException e = assertViolation(GraphVerifier.Rule.UNIQUE_NODE_NAMES);
            assertEquals(List.of(a.name()), e.offenders());
        }

        @Test
        void nodeNameMustNotShadowVariable() {
            Node a = builder.createRelu("a", input.output());
            a.setName(input.name());
            assertViolation(GraphVerifier.Rule.UNIQUE_NODE_NAMES);
        }
    }

    @Nested
    @DisplayName("Edges")
    class Edges {

        @Test
        void erasedProducerLeavesDanglingEdge() {
            Node a = builder.createRelu("a", input.output());
            Node b = builder.createTanh("b", a.output());
            function.eraseNode(a);
            GraphVerificationException e = assertViolation(GraphVerifier.Rule.RESOLVED_EDGES);
            assertTrue(e.offenders().contains(b.name()));
        }

        @Test
        void rewiringBeforeErasureKeepsGraphValid() {
            Node a = builder.createRelu("a", input.output());
            Node b = builder.createTanh("b", a.output());
            Node c = builder.createSigmoid("c", a.output());

            assertEquals(2, function.replaceAllUsesOfWith(a.output(), input.output()));
            assertTrue(function.usersOf(a.output()).isEmpty());
            function.eraseNode(a);

            assertDoesNotThrow(function::verify);
            assertEquals(List.of(b, c), function.usersOf(input.output()));
            assertEquals(List.of(b, c), function.nodes());
        }

        @Test
        void erasedVariableLeavesDanglingEdge() {
            builder.createRelu("a", input.output());
            function.eraseNode(input);
            assertTrue(module.variables().isEmpty());
            assertViolation(GraphVerifier.Rule.RESOLVED_EDGES);
        }

        @Test
        void erasingNodeOfAnotherFunctionFails() {
            Function other = module.createFunction("other");
            Node foreign = other.builder().createRelu("a", input.output());
            assertThrows(GraphBuildException.class, () -> function.eraseNode(foreign));
            assertEquals(1, other.nodes().size());
        }

        @Test
        void edgeIntoAnotherFunctionDoesNotResolve() {
            Function other = module.createFunction("other");
            Node foreign = other.builder().createRelu("a", input.output());
            builder.createTanh("b", foreign.output());
            assertViolation(GraphVerifier.Rule.RESOLVED_EDGES);
        }

        @Test
        void edgeTypeMustMatchProducer() {
            Node a = builder.createRelu("a", input.output());
            TypeRef wrong = module.uniqueType(ElemKind.FLOAT, List.of(192));
            a.setNthInput(0, new NodeValue(input.id(), 0, wrong));
            assertViolation(GraphVerifier.Rule.RESOLVED_EDGES);
        }

        @Test
        void resultNumberMustExist() {
            Node a = builder.createRelu("a", input.output());
            a.setNthInput(0, new NodeValue(input.id(), 1, input.type()));
            assertViolation(GraphVerifier.Rule.RESOLVED_EDGES);
        }

        @Test
        void replaceRequiresIdenticalTypes() {
            Node a = builder.createRelu("a", input.output());
            Variable other = module.createVariable(ElemKind.FLOAT, List.of(3), "other", Visibility.PUBLIC,
                    TrainKind.NONE);
            assertThrows(GraphBuildException.class, () -> function.replaceAllUsesOfWith(a.output(), other.output()));
        }
    }

    @Nested
    @DisplayName("Node Shapes")
    class NodeShapes {

        @Test
        void wrongOperandCount() {
            rawNode("add", NodeKind.ADD, List.of(input.output()), List.of(input.type()), NodeParams.None.INSTANCE);
            GraphVerificationException e = assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
            assertTrue(e.getMessage().contains("inputs"));
        }

        @Test
        void wrongResultCount() {
            rawNode("topk", NodeKind.TOP_K, List.of(input.output()), List.of(input.type()),
                    new NodeParams.TopK(3));
            assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
        }

        @Test
        void emptyConcat() {
            rawNode("concat", NodeKind.CONCAT, List.of(), List.of(input.type()), new NodeParams.Concat(0));
            assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
        }

        @Test
        void elementwiseShapeMismatch() {
            Variable other = module.createVariable(ElemKind.FLOAT, List.of(3), "other", Visibility.PUBLIC,
                    TrainKind.NONE);
            rawNode("add", NodeKind.ADD, List.of(input.output(), other.output()), List.of(input.type()),
                    NodeParams.None.INSTANCE);
            assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
        }

        @Test
        void reshapeChangingElementCount() {
            TypeRef out = module.uniqueType(ElemKind.FLOAT, List.of(10));
            rawNode("reshape", NodeKind.RESHAPE, List.of(input.output()), List.of(out),
                    new NodeParams.Reshape(List.of(10)));
            assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
        }

        @Test
        void convolutionResultDisagreesWithParams() {
            Node conv = builder.createConv("conv", input.output(), 4, 3, 1, 0);
            TypeRef wrong = module.uniqueType(ElemKind.FLOAT, List.of(1, 8, 8, 4));
            rawNode("conv2", NodeKind.CONVOLUTION, conv.inputs(), List.of(wrong),
                    new NodeParams.Convolution(3, 1, 0, 4));
            GraphVerificationException e = assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
            assertTrue(e.offenders().get(0).startsWith("conv2"));
        }

        @Test
        void topKIndicesMustBeIndexKind() {
            TypeRef out = module.uniqueType(ElemKind.FLOAT, List.of(1, 8, 8, 2));
            rawNode("topk", NodeKind.TOP_K, List.of(input.output()), List.of(out, out), new NodeParams.TopK(2));
            assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
        }

        @Test
        void dequantizeOfFloatInput() {
            rawNode("deq", NodeKind.DEQUANTIZE, List.of(input.output()), List.of(input.type()),
                    NodeParams.None.INSTANCE);
            assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
        }

        @Test
        void fullyConnectedWeightsMustCoverWholeFlattenedInput() {
            TypeRef huge = module.uniqueType(ElemKind.FLOAT, List.of(1, 65536, 65537));
            Node in = builder.createSplat("huge", huge, 0.0f);
            Variable weights = module.createVariable(ElemKind.FLOAT, List.of(65536, 10), "weights",
                    Visibility.PRIVATE, TrainKind.NONE);
            Variable bias = module.createVariable(ElemKind.FLOAT, List.of(10), "bias", Visibility.PRIVATE,
                    TrainKind.NONE);
            TypeRef out = module.uniqueType(ElemKind.FLOAT, List.of(1, 10));
            rawNode("fc", NodeKind.FULLY_CONNECTED, List.of(in.output(), weights.output(), bias.output()),
                    List.of(out), NodeParams.None.INSTANCE);
            assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
        }

        @Test
        void concatOverflowIsReported() {
            TypeRef wide = module.uniqueType(ElemKind.FLOAT, List.of(Integer.MAX_VALUE));
            Node a = builder.createSplat("a", wide, 0.0f);
            rawNode("concat", NodeKind.CONCAT, List.of(a.output(), a.output()), List.of(wide),
                    new NodeParams.Concat(0));
            GraphVerificationException e = assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
            assertTrue(e.getMessage().contains("does not fit"));
        }

        @Test
        void saveIntoWrongElemKind() {
            Variable dest = module.createVariable(ElemKind.INDEX, List.of(1, 8, 8, 3), "dest", Visibility.PUBLIC,
                    TrainKind.NONE);
            rawNode("save", NodeKind.SAVE, List.of(input.output(), dest.output()), List.of(),
                    NodeParams.None.INSTANCE);
            assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
        }

        @Test
        void gatherWithFloatIndices() {
            Variable idx = module.createVariable(ElemKind.FLOAT, List.of(2), "idx", Visibility.PUBLIC,
                    TrainKind.NONE);
            TypeRef out = module.uniqueType(ElemKind.FLOAT, List.of(2, 8, 8, 3));
            rawNode("gather", NodeKind.GATHER, List.of(input.output(), idx.output()), List.of(out),
                    NodeParams.None.INSTANCE);
            assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
        }

        @Test
        void saveIntoWrongShape() {
            Variable dest = module.createVariable(ElemKind.FLOAT, List.of(3), "dest", Visibility.PUBLIC,
                    TrainKind.NONE);
            rawNode("save", NodeKind.SAVE, List.of(input.output(), dest.output()), List.of(),
                    NodeParams.None.INSTANCE);
            assertViolation(GraphVerifier.Rule.WELL_FORMED_NODES);
        }
    }

    @Test
    void namesAreCheckedBeforeEdges() {
        Node a = builder.createRelu("a", input.output());
        Node b = builder.createTanh("b", a.output());
        function.eraseNode(a);
        b.setName(input.name());
        assertViolation(GraphVerifier.Rule.UNIQUE_NODE_NAMES);
    }
}
