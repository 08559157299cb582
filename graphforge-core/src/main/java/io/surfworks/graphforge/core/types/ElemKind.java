package io.surfworks.graphforge.core.types;

/**
 * Element kinds a tensor {@link Type} can carry.
 *
 * <p>Quantized kinds store integers that map back to real values through
 * the type's scale and offset: {@code real = scale * (q - offset)}.
 */
public enum ElemKind {
    FLOAT(4, false, "float"),
    INT8_QUANTIZED(1, true, "i8"),
    INT32_QUANTIZED(4, true, "i32"),
    INDEX(8, false, "index");

    private final int byteSize;
    private final boolean quantized;
    private final String shortName;

    ElemKind(int byteSize, boolean quantized, String shortName) {
        this.byteSize = byteSize;
        this.quantized = quantized;
        this.shortName = shortName;
    }

    public int byteSize() {
        return byteSize;
    }

    public boolean isQuantized() {
        return quantized;
    }

    public boolean isFloating() {
        return this == FLOAT;
    }

    public String shortName() {
        return shortName;
    }
}
