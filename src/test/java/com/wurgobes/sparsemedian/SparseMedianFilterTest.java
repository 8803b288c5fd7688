package com.wurgobes.sparsemedian;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicIntegerArray;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;


public class SparseMedianFilterTest {

    // Sort the window and take the middle, the reference the filter has to match
    private static int[] naiveMedian(int[] in, int width, int height, int radius, BorderMode border) {
        int side = 2 * radius + 1;
        int[] out = new int[in.length];
        long[] window = new long[side * side];
        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                int w = 0;
                for (int di = -radius; di <= radius; di++) {
                    for (int dj = -radius; dj <= radius; dj++) {
                        window[w++] = in[border.index(i + di, height) * width + border.index(j + dj, width)] & 0xFFFFFFFFL;
                    }
                }
                Arrays.sort(window);
                out[i * width + j] = (int) window[window.length / 2];
            }
        }
        return out;
    }

    private static int[] ramp(int n) {
        int[] in = new int[n];
        for (int i = 0; i < n; i++) in[i] = i;
        return in;
    }

    @Test
    public void rampWithRadiusOne() {
        int[] in = ramp(25);
        int[] out = new int[25];
        SparseMedianFilter.filter(in, out, 5, 5, 1);
        // {6, 7, 8, 11, 12, 13, 16, 17, 18}
        assertEquals(12, out[2 * 5 + 2]);
        // corner window is {0, 0, 1, 0, 0, 1, 5, 5, 6}
        assertEquals(1, out[0]);
        assertArrayEquals(naiveMedian(in, 5, 5, 1, BorderMode.REPLICATE), out);
    }

    @Test
    public void radiusZeroIsIdentity() {
        int[] in = RandomImage.generate(13, 9, SampleDepth.U16, 3);
        int[] out = new int[in.length];
        SparseMedianFilter.filter(in, out, 13, 9, 0);
        assertArrayEquals(in, out);
    }

    @Test
    public void matchesSortedWindows() {
        int width = 37;
        int height = 23;
        int[] in = RandomImage.generate(width, height, SampleDepth.U8, 11);
        for (BorderMode border : BorderMode.values()) {
            for (int radius = 1; radius <= 4; radius++) {
                int[] out = new int[in.length];
                SparseMedianFilter.filter(in, out, width, height, radius, border, 0);
                assertArrayEquals(border + " radius " + radius, naiveMedian(in, width, height, radius, border), out);
            }
        }
    }

    @Test
    public void incrementalMatchesFromScratch() {
        int width = 29;
        int height = 6;
        int radius = 3;
        int[] in = RandomImage.generate(width, height, SampleDepth.U16, 5);
        int[] out = new int[in.length];
        SparseMedianFilter.filter(in, out, width, height, radius, BorderMode.REPLICATE, 2);
        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                assertEquals("pixel " + i + "," + j,
                        SparseMedianFilter.medianFromScratch(in, width, height, radius, BorderMode.REPLICATE, i, j),
                        out[i * width + j]);
            }
        }
    }

    @Test
    public void unsigned32BitSamples() {
        int width = 11;
        int height = 7;
        int[] in = RandomImage.generate(width, height, SampleDepth.U32, 17);
        int[] out = new int[in.length];
        SparseMedianFilter.filter(in, out, width, height, 2);
        assertArrayEquals(naiveMedian(in, width, height, 2, BorderMode.REPLICATE), out);
    }

    @Test
    public void resultDoesNotDependOnThreadCount() {
        int width = 40;
        int height = 31;
        int[] in = RandomImage.generate(width, height, SampleDepth.U16, 23);
        int[] single = new int[in.length];
        SparseMedianFilter.filter(in, single, width, height, 3, BorderMode.REPLICATE, 1);
        for (int threads : new int[]{2, 3, 8, 64}) {
            int[] out = new int[in.length];
            SparseMedianFilter.filter(in, out, width, height, 3, BorderMode.REPLICATE, threads);
            assertArrayEquals("threads " + threads, single, out);
        }
    }

    @Test
    public void windowLargerThanImage() {
        int[] in = RandomImage.generate(4, 3, SampleDepth.U8, 29);
        for (BorderMode border : BorderMode.values()) {
            int[] out = new int[in.length];
            SparseMedianFilter.filter(in, out, 4, 3, 5, border, 0);
            assertArrayEquals(border.name(), naiveMedian(in, 4, 3, 5, border), out);
        }
    }

    @Test
    public void singleColumn() {
        int[] in = {9, 1, 7, 3, 5};
        int[] out = new int[in.length];
        SparseMedianFilter.filter(in, out, 1, 5, 1);
        // windows are the column triples with the border sample repeated three times
        assertArrayEquals(naiveMedian(in, 1, 5, 1, BorderMode.REPLICATE), out);
        assertEquals(7, out[1]);
    }

    @Test
    public void emptyImage() {
        SparseMedianFilter.filter(new int[0], new int[0], 0, 10, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void wrongBufferSize() {
        SparseMedianFilter.filter(new int[10], new int[10], 3, 3, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeRadius() {
        SparseMedianFilter.filter(new int[9], new int[9], 3, 3, -1);
    }

    @Test
    public void rowFilterReusesHistogram() {
        int[] in = ramp(20);
        int[] out = new int[20];
        OrderStatisticHistogram hist = new OrderStatisticHistogram();
        for (int i = 0; i < 4; i++) {
            SparseMedianFilter.filterRow(hist, in, out, i, 5, 4, 1, BorderMode.REPLICATE);
        }
        assertArrayEquals(naiveMedian(in, 5, 4, 1, BorderMode.REPLICATE), out);
    }

    @Test(expected = IllegalArgumentException.class)
    public void inPlaceFilteringRejected() {
        int[] buf = ramp(9);
        SparseMedianFilter.filter(buf, buf, 3, 3, 1);
    }

    @Test
    public void workerErrorReachesCaller() {
        final OutOfMemoryError error = new OutOfMemoryError("row 5");
        try {
            SparseMedianFilter.runRows(12, 3, () -> i -> {
                if (i == 5) throw error;
            });
            fail("Worker error was not rethrown");
        } catch (OutOfMemoryError e) {
            assertSame(error, e);
        }
    }

    @Test
    public void workerExceptionReachesCaller() {
        final IllegalStateException failure = new IllegalStateException("row 0");
        try {
            SparseMedianFilter.runRows(4, 2, () -> i -> {
                if (i == 0) throw failure;
            });
            fail("Worker exception was not rethrown");
        } catch (IllegalStateException e) {
            assertSame(failure, e);
        }
    }

    @Test
    public void failingWorkerSetupReachesCaller() {
        try {
            SparseMedianFilter.runRows(4, 2, () -> {
                throw new StackOverflowError();
            });
            fail("Worker setup error was not rethrown");
        } catch (StackOverflowError expected) {
            // rethrown unchanged
        }
    }

    @Test
    public void everyRowRunsOnce() {
        final AtomicIntegerArray runs = new AtomicIntegerArray(17);
        SparseMedianFilter.runRows(17, 4, () -> runs::incrementAndGet);
        for (int i = 0; i < 17; i++) assertEquals("row " + i, 1, runs.get(i));
    }
}
