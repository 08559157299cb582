package io.surfworks.graphforge.core.tensor;

import io.surfworks.graphforge.core.types.ElemKind;
import io.surfworks.graphforge.core.types.Type;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * Payload of a variable: a little-endian heap buffer laid out row-major
 * according to its {@link Type}.
 *
 * <p>Quantized kinds hold the raw integer representation; callers apply
 * scale and offset themselves.
 */
public final class Tensor {

    private final Type type;
    private final ByteBuffer data;

    private Tensor(Type type, ByteBuffer data) {
        this.type = type;
        this.data = data;
    }

    // ==================== Factory Methods ====================

    /**
     * Create a zero-initialized tensor of the given type.
     */
    public static Tensor zeros(Type type) {
        Objects.requireNonNull(type, "type");
        long bytes = type.byteSize();
        if (bytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Tensor of type " + type + " is too large: " + bytes + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) bytes).order(ByteOrder.LITTLE_ENDIAN);
        return new Tensor(type, buffer);
    }

    /**
     * Create a float tensor from a flattened array.
     */
    public static Tensor fromFloatArray(float[] values, int... shape) {
        Tensor tensor = zeros(Type.of(ElemKind.FLOAT, shape));
        if (values.length != tensor.elementCount()) {
            throw new IllegalArgumentException(
                "Data length " + values.length + " doesn't match shape " + Arrays.toString(shape) +
                " (expected " + tensor.elementCount() + " elements)");
        }
        for (int i = 0; i < values.length; i++) {
            tensor.setFloat(i, values[i]);
        }
        return tensor;
    }

    // ==================== Accessors ====================

    public Type type() {
        return type;
    }

    public ElemKind elemKind() {
        return type.elemKind();
    }

    public long elementCount() {
        return type.size();
    }

    // ==================== Element Access ====================

    public float getFloat(long index) {
        requireKind(ElemKind.FLOAT);
        return data.getFloat(offsetOf(index));
    }

    public void setFloat(long index, float value) {
        requireKind(ElemKind.FLOAT);
        data.putFloat(offsetOf(index), value);
    }

    public byte getInt8(long index) {
        requireKind(ElemKind.INT8_QUANTIZED);
        return data.get(offsetOf(index));
    }

    public void setInt8(long index, byte value) {
        requireKind(ElemKind.INT8_QUANTIZED);
        data.put(offsetOf(index), value);
    }

    public int getInt32(long index) {
        requireKind(ElemKind.INT32_QUANTIZED);
        return data.getInt(offsetOf(index));
    }

    public void setInt32(long index, int value) {
        requireKind(ElemKind.INT32_QUANTIZED);
        data.putInt(offsetOf(index), value);
    }

    public long getIndex(long index) {
        requireKind(ElemKind.INDEX);
        return data.getLong(offsetOf(index));
    }

    public void setIndex(long index, long value) {
        requireKind(ElemKind.INDEX);
        data.putLong(offsetOf(index), value);
    }

    // ==================== Initialization ====================

    public void zero() {
        Arrays.fill(data.array(), (byte) 0);
    }

    /**
     * Fill every element with {@code value}, converted to the element kind.
     * Integer kinds round to nearest and saturate.
     */
    public void broadcast(float value) {
        long count = elementCount();
        switch (type.elemKind()) {
            case FLOAT -> {
                for (long i = 0; i < count; i++) {
                    setFloat(i, value);
                }
            }
            case INT8_QUANTIZED -> {
                long q = Math.max(Byte.MIN_VALUE, Math.min(Byte.MAX_VALUE, Math.round((double) value)));
                for (long i = 0; i < count; i++) {
                    setInt8(i, (byte) q);
                }
            }
            case INT32_QUANTIZED -> {
                long q = Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, Math.round((double) value)));
                for (long i = 0; i < count; i++) {
                    setInt32(i, (int) q);
                }
            }
            case INDEX -> {
                long q = Math.round((double) value);
                for (long i = 0; i < count; i++) {
                    setIndex(i, q);
                }
            }
        }
    }

    /**
     * Xavier initialization: values drawn uniformly from
     * {@code [-sqrt(3 / fanIn), sqrt(3 / fanIn))}.
     */
    public void initXavier(float fanIn, Random random) {
        requireKind(ElemKind.FLOAT);
        if (!(fanIn > 0.0f)) {
            throw new IllegalArgumentException("Xavier fan-in must be positive, got " + fanIn);
        }
        double scale = Math.sqrt(3.0 / fanIn);
        long count = elementCount();
        for (long i = 0; i < count; i++) {
            setFloat(i, (float) ((random.nextDouble() * 2.0 - 1.0) * scale));
        }
    }

    // ==================== Bulk Operations ====================

    public float[] toFloatArray() {
        requireKind(ElemKind.FLOAT);
        float[] result = new float[(int) elementCount()];
        for (int i = 0; i < result.length; i++) {
            result[i] = getFloat(i);
        }
        return result;
    }

    private int offsetOf(long index) {
        if (index < 0 || index >= elementCount()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range for " + type);
        }
        return (int) (index * type.elemKind().byteSize());
    }

    private void requireKind(ElemKind kind) {
        if (type.elemKind() != kind) {
            throw new IllegalStateException("Tensor of type " + type + " accessed as " + kind);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Tensor[type=").append(type);
        sb.append(", elements=").append(elementCount());
        if (elementCount() <= 10 && type.elemKind() == ElemKind.FLOAT) {
            sb.append(", data=").append(Arrays.toString(toFloatArray()));
        }
        sb.append("]");
        return sb.toString();
    }
}
