package com.wurgobes.sparsemedian;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertArrayEquals;


public class RawImageIOTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void samplesAreLittleEndian() {
        assertArrayEquals(new byte[]{0x34, 0x12, (byte) 0xFF, (byte) 0xFF},
                RawImageIO.encode(new int[]{0x1234, 0xFFFF}, SampleDepth.U16));
        assertArrayEquals(new byte[]{0x78, 0x56, 0x34, 0x12, 0, 0, 0, (byte) 0x80},
                RawImageIO.encode(new int[]{0x12345678, 0x80000000}, SampleDepth.U32));
        assertArrayEquals(new byte[]{7, (byte) 200}, RawImageIO.encode(new int[]{7, 200}, SampleDepth.U8));
    }

    @Test
    public void decodedSamplesAreUnsigned() {
        assertArrayEquals(new int[]{255, 1}, RawImageIO.decode(new byte[]{(byte) 0xFF, 1}, SampleDepth.U8));
        assertArrayEquals(new int[]{0xFFFE}, RawImageIO.decode(new byte[]{(byte) 0xFE, (byte) 0xFF}, SampleDepth.U16));
    }

    @Test
    public void readWhatWasWritten() throws IOException {
        File file = folder.newFile("img.raw");
        int[] samples = RandomImage.generate(6, 4, SampleDepth.U16, 1);
        RawImageIO.write(file, samples, SampleDepth.U16);
        assertArrayEquals(samples, RawImageIO.read(file, 6, 4, SampleDepth.U16));
    }

    @Test(expected = IOException.class)
    public void shortFileIsAnError() throws IOException {
        File file = folder.newFile("short.raw");
        Files.write(file.toPath(), new byte[10]);
        RawImageIO.read(file, 4, 4, SampleDepth.U8);
    }

    @Test(expected = IOException.class)
    public void missingFileIsAnError() throws IOException {
        RawImageIO.read(new File(folder.getRoot(), "missing.raw"), 1, 1, SampleDepth.U8);
    }

    @Test(expected = IllegalArgumentException.class)
    public void oversizedImageIsRejected() throws IOException {
        File file = folder.newFile("tiny.raw");
        Files.write(file.toPath(), new byte[4]);
        RawImageIO.read(file, 50000, 50000, SampleDepth.U8);
    }
}
