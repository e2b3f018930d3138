package image;

import java.util.Arrays;

/**
 * Floyd–Steinberg error diffusion.
 *
 * Rows run top to bottom, left to right. Error is pushed 7/16 right, 3/16 below-left,
 * 5/16 below and 1/16 below-right; neighbours outside the image are skipped, never wrapped.
 * Two row-sized error buffers per channel are swapped after each row.
 */
public final class Dithering {

    private Dithering() {
    }

    /**
     * Quantize every channel to {@code bitDepth} bits.
     *
     * @param applyGamma sRGB-encode each sample before quantizing
     * @return quantized code values, three per pixel (RGB interleaved)
     */
    public static int[] floydSteinberg(LinearImage img, int bitDepth, boolean applyGamma) {
        if (bitDepth < 1 || bitDepth > 16)
            throw new IllegalArgumentException("bitDepth must be in [1,16]: " + bitDepth);
        int w = img.width(), h = img.height();
        int maxValue = (1 << bitDepth) - 1;
        int[] out = new int[w * h * 3];
        float[][] planes = { img.r(), img.g(), img.b() };
        for (int c = 0; c < 3; c++)
            diffuseChannel(planes[c], w, h, maxValue, applyGamma, out, c, null);
        return out;
    }

    /** 8-bit sRGB with diffusion, packed as RGBA. */
    public static Rgba8Buffer toRgba8(LinearImage img) {
        int[] q = floydSteinberg(img, 8, true);
        int n = img.pixelCount();
        byte[] data = new byte[n * 4];
        for (int i = 0; i < n; i++) {
            data[i * 4] = (byte) q[i * 3];
            data[i * 4 + 1] = (byte) q[i * 3 + 1];
            data[i * 4 + 2] = (byte) q[i * 3 + 2];
            data[i * 4 + 3] = (byte) 0xFF;
        }
        return new Rgba8Buffer(img.width(), img.height(), data);
    }

    /**
     * Dither and write the dequantized values back. Values stay in the linear domain
     * (no gamma), clamped to [0,1].
     */
    public static LinearImage ditherInPlace(LinearImage img, int bitDepth) {
        if (bitDepth < 1 || bitDepth > 16)
            throw new IllegalArgumentException("bitDepth must be in [1,16]: " + bitDepth);
        LinearImage out = img.copy();
        int maxValue = (1 << bitDepth) - 1;
        diffuseChannel(out.r(), out.width(), out.height(), maxValue, false, null, 0, out.r());
        diffuseChannel(out.g(), out.width(), out.height(), maxValue, false, null, 0, out.g());
        diffuseChannel(out.b(), out.width(), out.height(), maxValue, false, null, 0, out.b());
        return out;
    }

    private static void diffuseChannel(float[] src, int w, int h, int maxValue, boolean applyGamma,
            int[] codes, int channel, float[] writeBack) {
        float[] currentRow = new float[w];
        float[] nextRow = new float[w];
        float max = maxValue;

        for (int y = 0; y < h; y++) {
            Arrays.fill(nextRow, 0f);
            boolean hasNext = y + 1 < h;
            int row = y * w;
            for (int x = 0; x < w; x++) {
                float v = clamp01(src[row + x]);
                if (applyGamma)
                    v = ColorSpace.linearToSrgb(v);
                v = clamp01(v + currentRow[x]);

                int q = (int) (v * max + 0.5f);
                if (q < 0)
                    q = 0;
                else if (q > maxValue)
                    q = maxValue;
                float err = v - q / max;

                if (codes != null)
                    codes[(row + x) * 3 + channel] = q;
                if (writeBack != null)
                    writeBack[row + x] = q / max;

                if (x + 1 < w)
                    currentRow[x + 1] += err * 7f / 16f;
                if (hasNext) {
                    if (x > 0)
                        nextRow[x - 1] += err * 3f / 16f;
                    nextRow[x] += err * 5f / 16f;
                    if (x + 1 < w)
                        nextRow[x + 1] += err * 1f / 16f;
                }
            }
            float[] tmp = currentRow;
            currentRow = nextRow;
            nextRow = tmp;
        }
    }

    private static float clamp01(float v) {
        return (v < 0f) ? 0f : (v > 1f) ? 1f : v;
    }
}
