package com.wurgobes.sparsemedian;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.Random;

import org.scijava.log.Logger;
import org.scijava.log.StderrLogService;

// Writes a raw image of uniformly random samples, used as input for benchmarks.
// Usage: [width=1024] [height=768] [depth=16] [seed=<n>] [target=image.raw]
public class RandomImage {

    private static final String[] KEYWORDS = {"width", "height", "depth", "seed", "target"};

    private RandomImage() {

    }

    public static int[] generate(final int width, final int height, final SampleDepth depth, final long seed) {
        final Random random = new Random(seed);
        final int[] samples = new int[width * height];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = depth.mask(random.nextInt());
        }
        return samples;
    }

    public static void main(final String[] args) {
        System.exit(run(args, new StderrLogService()));
    }

    static int run(final String[] args, final Logger log) {
        int width = 1024;
        int height = 768;
        SampleDepth depth = SampleDepth.U16;
        long seed = System.nanoTime();
        File target = new File("image.raw");

        try {
            for (Map.Entry<String, String> e : FilterSettings.tokenize(args, KEYWORDS).entrySet()) {
                switch (e.getKey()) {
                    case "width":
                        width = Integer.parseInt(e.getValue());
                        break;
                    case "height":
                        height = Integer.parseInt(e.getValue());
                        break;
                    case "depth":
                        depth = SampleDepth.fromBits(Integer.parseInt(e.getValue()));
                        break;
                    case "seed":
                        seed = Long.parseLong(e.getValue());
                        break;
                    default:
                        target = new File(e.getValue());
                }
            }
            if (width < 0 || height < 0) throw new IllegalArgumentException("Invalid image size " + width + "x" + height);
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too
            log.error("FATAL: " + e.getMessage());
            return 1;
        }

        try {
            RawImageIO.write(target, generate(width, height, depth, seed), depth);
        } catch (IOException e) {
            log.error("FATAL: can not create output file \"" + target + "\"", e);
            return 1;
        }
        log.info("Wrote " + width + "x" + height + " random " + depth.bits() + " bit samples to " + target);
        return 0;
    }
}
