package com.wurgobes.sparsemedian;

// How window positions outside of the image are mapped back inside
public enum BorderMode {
    REPLICATE, // Clamp to the nearest edge
    WRAP; // Continue on the opposite edge

    public int index(final int i, final int size) {
        switch (this) {
            case WRAP:
                return Math.floorMod(i, size);
            case REPLICATE:
            default:
                return i < 0 ? 0 : (i >= size ? size - 1 : i);
        }
    }

    public static BorderMode fromName(final String name) {
        for (BorderMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name)) return mode;
        }
        throw new IllegalArgumentException("Unknown border mode: " + name);
    }
}
