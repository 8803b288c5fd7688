package com.wurgobes.sparsemedian;

// Thrown when more occurrences of a value are removed than the histogram holds
public class HistogramUnderflowException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int key;
    private final int requested;
    private final int available;

    public HistogramUnderflowException(int key, int requested, int available) {
        super("Cannot remove " + requested + " occurrences of " + Integer.toUnsignedString(key)
                + ", only " + available + " recorded");
        this.key = key;
        this.requested = requested;
        this.available = available;
    }

    public int getKey() {
        return key;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
