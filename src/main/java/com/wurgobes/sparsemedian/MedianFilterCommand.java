package com.wurgobes.sparsemedian;

import java.io.File;
import java.io.IOException;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.scijava.command.Command;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;

@Plugin(type = Command.class, headless = true,
        menuPath = "Plugins>Process>Sparse Median Filter (raw image)")
public class MedianFilterCommand implements Command {

    @Parameter
    private LogService log;

    @Parameter(label = "Input file", description = "raw image without header", style = "open")
    private File source;

    @Parameter(label = "Output file", style = "save")
    private File target;

    @Parameter(label = "Width", min = "1")
    private int width;

    @Parameter(label = "Height", min = "1")
    private int height;

    @Parameter(label = "Radius", description = "the window has side 2 * radius + 1", min = "0")
    private int radius = 41;

    @Parameter(label = "Bits per sample", choices = {"8", "16", "32"})
    private String depth = "16";

    @Parameter(label = "Border", choices = {"replicate", "wrap"})
    private String border = "replicate";

    @Parameter(label = "Threads", description = "0 for all processors", min = "0")
    private int threads = 0;

    @Override
    public void run() {
        final FilterSettings settings = new FilterSettings();
        try {
            settings.setSource(source);
            settings.setTarget(target);
            settings.setWidth(width);
            settings.setHeight(height);
            settings.setRadius(radius);
            settings.setDepth(SampleDepth.fromBits(Integer.parseInt(depth)));
            settings.setBorder(BorderMode.fromName(border));
            settings.setThreads(threads);
            settings.validate();
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            return;
        }

        //sanity check on the input, larger windows work but only replicate the border more
        if (2 * radius + 1 > Math.min(width, height)) {
            log.warn("Window of " + (2 * radius + 1) + " is larger than the image " + width + "x" + height);
        }

        try {
            final SummaryStatistics times = MedianFilter.run(settings, log);
            log.info("Runtime of SparseMedianFilter = " + Math.round(times.getSum() * 1000) + "ms");
        } catch (IOException e) {
            log.error("Failed to filter " + source, e);
        }
    }
}
