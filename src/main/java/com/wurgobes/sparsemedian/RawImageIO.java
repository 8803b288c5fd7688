package com.wurgobes.sparsemedian;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

// Raw images: width * height samples in row major order, no header.
// Samples are stored little endian with depth.bytes() bytes each.
public final class RawImageIO {

    private RawImageIO() {

    }

    public static int[] read(final File file, final int width, final int height, final SampleDepth depth) throws IOException {
        if (width < 0 || height < 0) throw new IllegalArgumentException("Invalid image size " + width + "x" + height);
        final long size = (long) width * height * depth.bytes();
        if (size > Integer.MAX_VALUE)
            throw new IllegalArgumentException("Image of " + width + "x" + height + " samples of " + depth.bits() + " bit is too large");
        final byte[] raw = new byte[(int) size];
        try (DataInputStream is = new DataInputStream(new BufferedInputStream(new FileInputStream(file)))) {
            is.readFully(raw);
        } catch (EOFException e) {
            throw new IOException("File " + file + " is smaller than " + width + "x" + height + " samples of " + depth.bits() + " bit", e);
        }
        return decode(raw, depth);
    }

    public static void write(final File file, final int[] samples, final SampleDepth depth) throws IOException {
        try (OutputStream os = new BufferedOutputStream(new FileOutputStream(file))) {
            os.write(encode(samples, depth));
        }
    }

    static int[] decode(final byte[] raw, final SampleDepth depth) {
        final ByteBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        final int[] samples = new int[raw.length / depth.bytes()];
        for (int i = 0; i < samples.length; i++) {
            switch (depth) {
                case U8:
                    samples[i] = buffer.get() & 0xFF;
                    break;
                case U16:
                    samples[i] = buffer.getShort() & 0xFFFF;
                    break;
                default:
                    samples[i] = buffer.getInt();
            }
        }
        return samples;
    }

    static byte[] encode(final int[] samples, final SampleDepth depth) {
        final ByteBuffer buffer = ByteBuffer.allocate(samples.length * depth.bytes()).order(ByteOrder.LITTLE_ENDIAN);
        for (int s : samples) {
            switch (depth) {
                case U8:
                    buffer.put((byte) s);
                    break;
                case U16:
                    buffer.putShort((short) s);
                    break;
                default:
                    buffer.putInt(s);
            }
        }
        return buffer.array();
    }
}
