package io.surfworks.graphforge.core.graph;

import java.util.List;

/**
 * The closed set of operator kinds a {@link Node} can have, with the names of
 * their input and result slots.
 *
 * <p>Code that must treat every operator (verification, description) switches
 * over this enum in a switch expression without a default arm, so adding a
 * kind breaks compilation until each such switch handles it.
 */
public enum NodeKind {
    CONVOLUTION("Convolution", inputs("Input", "Filter", "Bias"), results("Result")),
    POOL_MAX("PoolMax", inputs("Input"), results("Result")),
    POOL_AVG("PoolAvg", inputs("Input"), results("Result")),
    FULLY_CONNECTED("FullyConnected", inputs("Input", "Weights", "Bias"), results("Result")),
    RELU("Relu", inputs("Input"), results("Result")),
    SIGMOID("Sigmoid", inputs("Input"), results("Result")),
    TANH("Tanh", inputs("Input"), results("Result")),
    SOFT_MAX("SoftMax", inputs("Input", "Selected"), results("Result")),
    CROSS_ENTROPY_LOSS("CrossEntropyLoss", inputs("P", "Labels"), results("CE")),
    REGRESSION("Regression", inputs("Input", "Expected"), results("Result")),
    RESHAPE("Reshape", inputs("Input"), results("Result")),
    TRANSPOSE("Transpose", inputs("Input"), results("Result")),
    BROADCAST("Broadcast", inputs("Input"), results("Result")),
    CONCAT("Concat", true, inputs(), results("Result")),
    SLICE("Slice", inputs("Input"), results("Result")),
    BATCH_NORMALIZATION("BatchNormalization", inputs("Input", "Scale", "Bias", "Mean", "Var"), results("Result")),
    LOCAL_RESPONSE_NORMALIZATION("LocalResponseNormalization", inputs("Input", "Scale"), results("Result")),
    ADD("Add", inputs("LHS", "RHS"), results("Result")),
    MUL("Mul", inputs("LHS", "RHS"), results("Result")),
    SUB("Sub", inputs("LHS", "RHS"), results("Result")),
    DIV("Div", inputs("LHS", "RHS"), results("Result")),
    MAX("Max", inputs("LHS", "RHS"), results("Result")),
    MIN("Min", inputs("LHS", "RHS"), results("Result")),
    CMP_LTE("CmpLTE", inputs("LHS", "RHS"), results("Result")),
    POW("Pow", inputs("Base"), results("Result")),
    SELECT("Select", inputs("Cond", "LHS", "RHS"), results("Result")),
    SPLAT("Splat", inputs(), results("Result")),
    MATMUL("MatMul", inputs("LHS", "RHS"), results("Result")),
    BATCHED_REDUCE_ADD("BatchedReduceAdd", inputs("Batch"), results("Result")),
    BATCHED_ADD("BatchedAdd", inputs("Batch", "Slice"), results("Result")),
    SAVE("Save", inputs("Input", "Output"), results()),
    QUANTIZATION_PROFILE("QuantizationProfile", inputs("Input", "Histogram", "ComputationInfo"), results()),
    TOP_K("TopK", inputs("Input"), results("Values", "Indices")),
    GATHER("Gather", inputs("Data", "Indices"), results("Result")),
    QUANTIZE("Quantize", inputs("Input"), results("Result")),
    DEQUANTIZE("Dequantize", inputs("Input"), results("Result")),
    RESCALE_QUANTIZED("RescaleQuantized", inputs("Input"), results("Result"));

    private final String displayName;
    private final boolean variadic;
    private final List<String> inputNames;
    private final List<String> resultNames;

    NodeKind(String displayName, List<String> inputNames, List<String> resultNames) {
        this(displayName, false, inputNames, resultNames);
    }

    NodeKind(String displayName, boolean variadic, List<String> inputNames, List<String> resultNames) {
        this.displayName = displayName;
        this.variadic = variadic;
        this.inputNames = inputNames;
        this.resultNames = resultNames;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * True when the kind takes any positive number of inputs instead of a
     * fixed slot list.
     */
    public boolean isVariadic() {
        return variadic;
    }

    public List<String> inputNames() {
        return inputNames;
    }

    public List<String> resultNames() {
        return resultNames;
    }

    public String inputName(int idx) {
        if (variadic) {
            return "Input" + idx;
        }
        return inputNames.get(idx);
    }

    public String resultName(int idx) {
        return resultNames.get(idx);
    }

    private static List<String> inputs(String... names) {
        return List.of(names);
    }

    private static List<String> results(String... names) {
        return List.of(names);
    }
}
