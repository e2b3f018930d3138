package io;

import image.ColorSpace;
import image.LinearImage;
import image.TestImages;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import util.CfaPattern;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ImageLoaderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path pgm(String name, int w, int h, int maxval, byte[] data) throws IOException {
        Path p = tmp.getRoot().toPath().resolve(name);
        byte[] header = ("P5\n# test mosaic\n" + w + " " + h + "\n" + maxval + "\n").getBytes(StandardCharsets.US_ASCII);
        byte[] all = new byte[header.length + data.length];
        System.arraycopy(header, 0, all, 0, header.length);
        System.arraycopy(data, 0, all, header.length, data.length);
        Files.write(p, all);
        return p;
    }

    @Test
    public void decodesPngToLinear() throws Exception {
        LinearImage grey = LinearImage.filled(6, 4, 0.2f, 0.2f, 0.2f);
        File f = tmp.newFile("grey.png");
        TestImages.writePng(grey, f);

        DecodedSource d = ImageLoader.decodeSource(f.toPath());
        assertEquals(6, d.image().width());
        assertEquals(SourceMetadata.SourceFormat.RASTER, d.metadata().format());
        assertFalse(d.metadata().isMosaic());
        int code = (int) (ColorSpace.linearToSrgb(0.2f) * 255f);
        assertEquals(ColorSpace.srgb8ToLinear(code), d.image().g()[0], 0f);
    }

    @Test
    public void decodesEightBitMosaic() throws Exception {
        byte[] data = new byte[16];
        Arrays.fill(data, (byte) 128);
        DecodedSource d = ImageLoader.decodeSource(pgm("flat.pgm", 4, 4, 255, data));
        assertEquals(SourceMetadata.SourceFormat.BAYER_MOSAIC, d.metadata().format());
        assertEquals(8, d.metadata().bitsPerSample());
        assertEquals(CfaPattern.RGGB, d.metadata().cfa().orElseThrow());
        assertEquals(128 / 255f, d.image().b()[5], 1e-6f);
    }

    @Test
    public void decodesSixteenBitMosaic() throws Exception {
        byte[] data = new byte[2 * 4];
        for (int i = 0; i < 4; i++) {
            data[2 * i] = (byte) 0x80;
            data[2 * i + 1] = 0x00;
        }
        PgmMosaicReader.Mosaic m = PgmMosaicReader.read(pgm("wide.pgm", 2, 2, 65535, data));
        assertEquals(16, m.bitsPerSample());
        assertEquals(0x8000 / 65535f, m.samples()[3], 1e-6f);
    }

    @Test
    public void truncatedMosaicFails() throws Exception {
        Path p = pgm("short.pgm", 4, 4, 255, new byte[10]);
        try {
            ImageLoader.decodeSource(p);
            fail("expected DecodeException");
        } catch (DecodeException e) {
            assertTrue(e.getMessage().contains("Truncated"));
            assertEquals(p, e.source());
        }
    }

    @Test(expected = DecodeException.class)
    public void wrongMagicFails() throws Exception {
        Path p = tmp.getRoot().toPath().resolve("ascii.pgm");
        Files.write(p, "P2\n2 2\n255\n1 2 3 4\n".getBytes(StandardCharsets.US_ASCII));
        ImageLoader.decodeSource(p);
    }

    @Test(expected = DecodeException.class)
    public void missingFileFails() throws Exception {
        ImageLoader.decodeSource(tmp.getRoot().toPath().resolve("nope.png"));
    }

    @Test(expected = DecodeException.class)
    public void unreadableRasterFails() throws Exception {
        File f = tmp.newFile("junk.png");
        Files.write(f.toPath(), new byte[] { 1, 2, 3, 4, 5 });
        ImageLoader.decodeSource(f.toPath());
    }

    @Test
    public void oversizedMosaicHeaderFails() throws Exception {
        // 65536 * 65537 wraps to 65536 in int arithmetic
        for (Path p : new Path[] {
                pgm("wrap.pgm", 65536, 65537, 255, new byte[65536]),
                pgm("huge.pgm", 50000, 50000, 255, new byte[16]) }) {
            try {
                ImageLoader.decodeSource(p);
                fail("expected DecodeException for " + p.getFileName());
            } catch (DecodeException e) {
                assertTrue(e.getMessage(), e.getMessage().contains("too large"));
            }
        }
    }
}
