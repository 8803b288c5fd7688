package com.wurgobes.sparsemedian;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

// Settings of one median filter run.
// Parsed from keyword=value tokens, e.g. "source=img.raw width=1024 height=1024 radius=16 depth=16"
public class FilterSettings {

    static final String[] KEYWORDS = {"source", "target", "width", "height", "radius", "depth", "border", "threads", "repeat"};

    private File source;
    private File target = new File("out.raw");
    private int width = -1;
    private int height = -1;
    private int radius = 41;
    private SampleDepth depth = SampleDepth.U16;
    private BorderMode border = BorderMode.REPLICATE;
    private int threads = 0; // 0 for all processors
    private int repeat = 1;

    public static FilterSettings parse(final String... args) {
        final FilterSettings settings = new FilterSettings();
        for (Map.Entry<String, String> e : tokenize(args, KEYWORDS).entrySet()) {
            final String value = e.getValue();
            try {
                switch (e.getKey()) {
                    case "source":
                        settings.source = new File(value);
                        break;
                    case "target":
                        settings.target = new File(value);
                        break;
                    case "width":
                        settings.width = Integer.parseInt(value);
                        break;
                    case "height":
                        settings.height = Integer.parseInt(value);
                        break;
                    case "radius":
                        settings.radius = Integer.parseInt(value);
                        break;
                    case "depth":
                        settings.depth = SampleDepth.fromBits(Integer.parseInt(value));
                        break;
                    case "border":
                        settings.border = BorderMode.fromName(value);
                        break;
                    case "threads":
                        settings.threads = Integer.parseInt(value);
                        break;
                    case "repeat":
                        settings.repeat = Integer.parseInt(value);
                        break;
                    default:
                        throw new IllegalStateException("Unhandled keyword " + e.getKey());
                }
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Failed to parse argument: " + e.getKey() + "=" + value, ex);
            }
        }
        settings.validate();
        return settings;
    }

    // Split keyword=value tokens, rejecting malformed tokens and unknown keywords
    static Map<String, String> tokenize(final String[] args, final String[] keywords) {
        final Map<String, String> values = new LinkedHashMap<>();
        for (String a : args) {
            for (String token : StringUtils.split(a)) {
                final int eq = token.indexOf('=');
                if (eq <= 0) {
                    throw new IllegalArgumentException("Malformed token: " + token + ".\nDid you remember to format it as keyword=value?");
                }
                final String keyword = token.substring(0, eq);
                if (!StringUtils.equalsAny(keyword, keywords)) {
                    throw new IllegalArgumentException("Keyword " + keyword + " not found\nDid you mean: " + getTheClosestMatch(keywords, keyword) + "?");
                }
                values.put(keyword, token.substring(eq + 1));
            }
        }
        return values;
    }

    static String getTheClosestMatch(final String[] strings, final String target) {
        int distance = Integer.MAX_VALUE;
        String closest = null;
        for (String compareString : strings) {
            final int currentDistance = StringUtils.getLevenshteinDistance(compareString, target);
            if (currentDistance < distance) {
                distance = currentDistance;
                closest = compareString;
            }
        }
        return closest;
    }

    public void validate() {
        if (width < 0 || height < 0) throw new IllegalArgumentException("You must specify width and height");
        if (source == null) throw new IllegalArgumentException("No input file given");
        if (radius < 0) throw new IllegalArgumentException("Radius must not be negative: " + radius);
        if (threads < 0) throw new IllegalArgumentException("Thread count must not be negative: " + threads);
        if (repeat < 1) throw new IllegalArgumentException("Repeat must be at least 1: " + repeat);
        // One image has to fit in a single array
        if ((long) width * height * depth.bytes() > Integer.MAX_VALUE)
            throw new IllegalArgumentException("Image of " + width + "x" + height + " samples of " + depth.bits() + " bit is too large");
    }

    // Summary printed before running
    public String describe() {
        return String.format("Algorithm....... sparse-hist-byrow%n"
                        + "Input........... %s%n"
                        + "X dim........... %d%n"
                        + "Y dim........... %d%n"
                        + "Data size (B)... %d%n"
                        + "Radius.......... %d%n"
                        + "Border.......... %s%n"
                        + "Threads......... %s%n"
                        + "Output.......... %s",
                source, width, height, depth.bytes(), radius, border.name().toLowerCase(),
                threads == 0 ? "all" : Integer.toString(threads), target);
    }

    public File getSource() {
        return source;
    }

    public void setSource(File source) {
        this.source = source;
    }

    public File getTarget() {
        return target;
    }

    public void setTarget(File target) {
        this.target = target;
    }

    public int getWidth() {
        return width;
    }

    public void setWidth(int width) {
        this.width = width;
    }

    public int getHeight() {
        return height;
    }

    public void setHeight(int height) {
        this.height = height;
    }

    public int getRadius() {
        return radius;
    }

    public void setRadius(int radius) {
        this.radius = radius;
    }

    public SampleDepth getDepth() {
        return depth;
    }

    public void setDepth(SampleDepth depth) {
        this.depth = depth;
    }

    public BorderMode getBorder() {
        return border;
    }

    public void setBorder(BorderMode border) {
        this.border = border;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    public int getRepeat() {
        return repeat;
    }

    public void setRepeat(int repeat) {
        this.repeat = repeat;
    }
}
