package image;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Interleaved 8-bit RGBA output, the display/export form of a render.
 */
public final class Rgba8Buffer {

    private final int width;
    private final int height;
    private final byte[] data;

    public Rgba8Buffer(int width, int height, byte[] data) {
        if (data.length != width * height * 4)
            throw new IllegalArgumentException("RGBA buffer must hold " + (width * height * 4) + " bytes, got "
                    + data.length);
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Backing array, RGBA order. Callers must not modify it. */
    public byte[] data() {
        return data;
    }

    public long byteSize() {
        return data.length;
    }

    public int argb(int x, int y) {
        int i = (y * width + x) * 4;
        int r = data[i] & 0xFF;
        int g = data[i + 1] & 0xFF;
        int b = data[i + 2] & 0xFF;
        int a = data[i + 3] & 0xFF;
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    /** Unpack RGBA to an ARGB BufferedImage for ImageIO. */
    public BufferedImage toBufferedImage() {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++)
                row[x] = argb(x, y);
            out.setRGB(0, y, width, 1, row, 0, width);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Rgba8Buffer other))
            return false;
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }
}
