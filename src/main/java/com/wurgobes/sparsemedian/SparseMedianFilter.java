package com.wurgobes.sparsemedian;
/* Sparse histogram median filter
(c) Hohlbein Lab, Wageningen University

2D median filter over a square window of side 2 * radius + 1.
The histogram is NOT rebuilt for each pixel: every row starts with a full window at column 0,
after which the window is shifted one column to the right by removing the column that leaves
and adding the column that enters.

Rows are processed in parallel, every thread owns one histogram and takes the next row to do
from a shared counter. Threads only write the rows they took, the input is only read.

Execution time: O(width * height * radius * log(radius) / threads)
Additional memory: O(threads * radius^2)

This software is released under the GPL v3. You may copy, distribute and modify
the software as long as you track changes/dates in source files. Any
modifications to or software including (via compiler) GPL-licensed code
must also be made available under the GPL along with build & install instructions.
https://www.gnu.org/licenses/gpl-3.0.en.html
 */

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

import org.apache.commons.lang3.Validate;

import static ij.util.ThreadUtil.createThreadArray;
import static ij.util.ThreadUtil.getNbCpus;
import static ij.util.ThreadUtil.startAndJoin;
import static java.lang.Math.min;


public class SparseMedianFilter {

    private SparseMedianFilter() {

    }

    // Median filter with edge replication on all processors
    public static void filter(final int[] in, final int[] out, final int width, final int height, final int radius) {
        filter(in, out, width, height, radius, BorderMode.REPLICATE, 0);
    }

    // nThreads == 0 uses all processors
    public static void filter(final int[] in, final int[] out, final int width, final int height, final int radius,
                              final BorderMode border, final int nThreads) {
        Validate.notNull(in, "Input buffer is null");
        Validate.notNull(out, "Output buffer is null");
        Validate.notNull(border, "Border mode is null");
        Validate.isTrue(width >= 0 && height >= 0, "Invalid image size %dx%d", width, height);
        Validate.isTrue(radius >= 0, "Radius must not be negative: %d", radius);
        Validate.isTrue(nThreads >= 0, "Thread count must not be negative: %d", nThreads);
        Validate.isTrue(in.length == (long) width * height, "Input holds %d samples, expected %dx%d", in.length, width, height);
        Validate.isTrue(out.length == in.length, "Output holds %d samples, expected %d", out.length, in.length);
        // Rows still to do read the input around them, so it may not be overwritten
        Validate.isTrue(in != out, "Input and output must be different buffers");

        if (width == 0 || height == 0) return;

        runRows(height, nThreads, () -> {
            final OrderStatisticHistogram hist = new OrderStatisticHistogram(); // Private to this thread
            return i -> filterRow(hist, in, out, i, width, height, radius, border);
        });
    }

    // Hand rows 0..height-1 to worker threads, each worker builds its own row task.
    // The first failure of any worker, Errors included, is rethrown here once all workers have joined.
    static void runRows(final int height, final int nThreads, final Supplier<IntConsumer> workerFactory) {
        final AtomicInteger ai = new AtomicInteger(0); // Next row to process
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        final Thread[] threads = createThreadArray(min(nThreads == 0 ? getNbCpus() : nThreads, height));
        for (int ithread = 0; ithread < threads.length; ithread++) {
            threads[ithread] = new Thread(() -> {
                try {
                    final IntConsumer rowTask = workerFactory.get();
                    for (int i = ai.getAndIncrement(); i < height && failure.get() == null; i = ai.getAndIncrement()) {
                        rowTask.accept(i);
                    }
                } catch (Throwable t) {
                    failure.compareAndSet(null, t);
                }
            }, "sparse-median-" + ithread);
        }
        startAndJoin(threads);

        final Throwable t = failure.get();
        if (t instanceof Error) throw (Error) t;
        if (t instanceof RuntimeException) throw (RuntimeException) t;
        if (t != null) throw new IllegalStateException("Median filter worker failed", t);
    }

    // Median of the window centred at (i, j), computed from an empty histogram
    public static int medianFromScratch(final int[] in, final int width, final int height, final int radius,
                                        final BorderMode border, final int i, final int j) {
        final OrderStatisticHistogram hist = new OrderStatisticHistogram();
        fill(hist, in, i, j, radius, width, height, border);
        return hist.median();
    }

    static void filterRow(final OrderStatisticHistogram hist, final int[] in, final int[] out, final int i,
                          final int width, final int height, final int radius, final BorderMode border) {
        hist.clear();
        fill(hist, in, i, 0, radius, width, height, border);
        // Stop before the last column, so the window is never shifted out of the row
        int j;
        for (j = 0; j < width - 1; j++) {
            out[i * width + j] = hist.median();
            shift(hist, in, i, j, radius, width, height, border);
        }
        out[i * width + j] = hist.median();
    }

    // Insert every sample of the window centred at (i, j)
    private static void fill(final OrderStatisticHistogram hist, final int[] in, final int i, final int j,
                             final int radius, final int width, final int height, final BorderMode border) {
        for (int di = -radius; di <= radius; di++) {
            final int row = border.index(i + di, height) * width;
            for (int dj = -radius; dj <= radius; dj++) {
                hist.insert(in[row + border.index(j + dj, width)], 1);
            }
        }
    }

    // Move the window centred at (i, j) one column to the right
    private static void shift(final OrderStatisticHistogram hist, final int[] in, final int i, final int j,
                              final int radius, final int width, final int height, final BorderMode border) {
        final int leaving = border.index(j - radius, width);
        final int entering = border.index(j + radius + 1, width);
        for (int di = -radius; di <= radius; di++) {
            final int row = border.index(i + di, height) * width;
            try {
                hist.delete(in[row + leaving], 1);
            } catch (HistogramUnderflowException e) {
                // Every removed sample was inserted before, so this is a bug in the window bookkeeping
                throw new IllegalStateException("Window of row " + i + " lost track of column " + (j - radius), e);
            }
            hist.insert(in[row + entering], 1);
        }
    }
}
