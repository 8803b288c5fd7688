package com.wurgobes.sparsemedian;

import java.util.ArrayList;
import java.util.List;

// Bulk operations between two histograms, built on insert and delete
public final class HistogramMerge {

    private HistogramMerge() {

    }

    // Add the content of source to target
    public static void add(final OrderStatisticHistogram target, final OrderStatisticHistogram source) {
        // Snapshot first, target and source may be the same histogram
        for (int[] entry : entries(source)) {
            target.insert(entry[0], entry[1]);
        }
    }

    // Remove the content of source from target.
    // Every value of source must be in target at least as many times, otherwise nothing is removed.
    public static void subtract(final OrderStatisticHistogram target, final OrderStatisticHistogram source) {
        final List<int[]> entries = entries(source);
        for (int[] entry : entries) {
            final int available = target.get(entry[0]);
            if (available < entry[1]) throw new HistogramUnderflowException(entry[0], entry[1], available);
        }
        for (int[] entry : entries) {
            target.delete(entry[0], entry[1]);
        }
    }

    private static List<int[]> entries(final OrderStatisticHistogram h) {
        final List<int[]> entries = new ArrayList<>(h.distinctKeys());
        h.forEachEntry((key, count) -> entries.add(new int[]{key, count}));
        return entries;
    }
}
