package com.wurgobes.sparsemedian;

// Supported unsigned sample widths.
// Samples are held in an int, 32 bit values use all bits and are compared unsigned.
public enum SampleDepth {
    U8(8),
    U16(16),
    U32(32);

    private final int bits;

    SampleDepth(int bits) {
        this.bits = bits;
    }

    public int bits() {
        return bits;
    }

    public int bytes() {
        return bits / 8;
    }

    // Largest sample value, as an unsigned int
    public int maxValue() {
        return bits == 32 ? -1 : (1 << bits) - 1;
    }

    public int mask(final int value) {
        return value & maxValue();
    }

    public static SampleDepth fromBits(final int bits) {
        for (SampleDepth depth : values()) {
            if (depth.bits == bits) return depth;
        }
        throw new IllegalArgumentException("Bitdepth not supported: " + bits + " (use 8, 16 or 32)");
    }
}
