package com.wurgobes.sparsemedian;
/* Sparse Median Filter
(c) Hohlbein Lab, Wageningen University

Command line driver: reads a raw image, runs the sparse histogram median filter on it,
reports how long that took and writes the filtered raw image.
With repeat=N the filter runs N times on the same input and the mean time is reported,
which is what the benchmark scripts use.

This software is released under the GPL v3. You may copy, distribute and modify
the software as long as you track changes/dates in source files. Any
modifications to or software including (via compiler) GPL-licensed code
must also be made available under the GPL along with build & install instructions.
https://www.gnu.org/licenses/gpl-3.0.en.html
 */

import java.io.IOException;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.scijava.log.Logger;
import org.scijava.log.StderrLogService;


public class MedianFilter {

    static final String USAGE = "Usage: source=<file> width=<X> height=<Y> [radius=41] [target=out.raw] [depth=8|16|32]\n"
            + "       [border=replicate|wrap] [threads=0] [repeat=1]\n\n"
            + "source\t\tinput file name, raw samples without header\n"
            + "width\t\tX dimension\n"
            + "height\t\tY dimension\n"
            + "radius\t\tfilter radius, the window has side 2 * radius + 1\n"
            + "target\t\toutput file name\n"
            + "depth\t\tbits per sample\n"
            + "border\t\thow samples outside of the image are taken\n"
            + "threads\t\tworker threads, 0 for all processors\n"
            + "repeat\t\tamount of timed runs\n";

    private MedianFilter() {

    }

    public static void main(final String[] args) {
        System.exit(run(args, new StderrLogService()));
    }

    // Returns the exit status
    static int run(final String[] args, final Logger log) {
        if (args.length == 0 || "-h".equals(args[0])) {
            log.info(USAGE);
            return args.length == 0 ? 1 : 0;
        }

        final FilterSettings settings;
        try {
            settings = FilterSettings.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("FATAL: " + e.getMessage());
            log.info(USAGE);
            return 1;
        }

        try {
            run(settings, log);
        } catch (IOException e) {
            log.error("FATAL: " + e.getMessage(), e);
            return 1;
        }
        return 0;
    }

    // Filter settings.getSource() into settings.getTarget(), returns the execution times in seconds
    public static SummaryStatistics run(final FilterSettings settings, final Logger log) throws IOException {
        settings.validate();
        final int[] in = RawImageIO.read(settings.getSource(), settings.getWidth(), settings.getHeight(), settings.getDepth());
        final int[] out = new int[in.length];

        log.info(settings.describe());

        final SummaryStatistics times = new SummaryStatistics();
        for (int r = 0; r < settings.getRepeat(); r++) {
            final long start = System.nanoTime();
            SparseMedianFilter.filter(in, out, settings.getWidth(), settings.getHeight(), settings.getRadius(),
                    settings.getBorder(), settings.getThreads());
            final double elapsed = (System.nanoTime() - start) / 1e9;
            times.addValue(elapsed);
            log.info(String.format("Execution time.. %f", elapsed));
        }
        if (times.getN() > 1) {
            log.info(String.format("Mean time....... %.4f (sd %.4f over %d runs)", times.getMean(), times.getStandardDeviation(), times.getN()));
        }

        RawImageIO.write(settings.getTarget(), out, settings.getDepth());
        log.debug("Wrote " + out.length + " samples to " + settings.getTarget());
        return times;
    }
}
