package stages;

import image.LinearImage;

/**
 * Approximate bilateral filter for large spatial sigmas:
 * box-downsample, run the reference filter at σs/factor, bilinear-upsample.
 *
 * The factor keeps the effective sigma in roughly [2,4], so the inner loop stays small.
 */
public final class BilateralFast implements BilateralFilter {

    public static final String NAME = "cpu-fast";

    public static final int MAX_FACTOR = 16;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public LinearImage apply(LinearImage src, float spatialSigma, float rangeSigma) {
        int factor = downsampleFactor(spatialSigma);
        if (factor == 1)
            return BilateralStandard.filter(src, spatialSigma, rangeSigma);

        LinearImage small = downsample(src, factor);
        LinearImage filtered = BilateralStandard.filter(small, spatialSigma / factor, rangeSigma);
        return upsample(filtered, src.width(), src.height());
    }

    /** 1 up to σ=4, then 2, 4, 8 at the doubling thresholds, 16 beyond σ=32. */
    public static int downsampleFactor(float spatialSigma) {
        if (spatialSigma <= 4f)
            return 1;
        if (spatialSigma <= 8f)
            return 2;
        if (spatialSigma <= 16f)
            return 4;
        if (spatialSigma <= 32f)
            return 8;
        return MAX_FACTOR;
    }

    /** Box average into ceil(w/f) x ceil(h/f); partial blocks at the edges average what exists. */
    static LinearImage downsample(LinearImage src, int factor) {
        int w = src.width(), h = src.height();
        int dw = (w + factor - 1) / factor;
        int dh = (h + factor - 1) / factor;
        LinearImage out = LinearImage.blank(dw, dh);
        float[] ir = src.r(), ig = src.g(), ib = src.b();
        float[] or = out.r(), og = out.g(), ob = out.b();

        for (int y = 0; y < dh; y++) {
            int sy0 = y * factor, sy1 = Math.min(h, sy0 + factor);
            for (int x = 0; x < dw; x++) {
                int sx0 = x * factor, sx1 = Math.min(w, sx0 + factor);
                float sr = 0f, sg = 0f, sb = 0f;
                int count = 0;
                for (int sy = sy0; sy < sy1; sy++) {
                    int row = sy * w;
                    for (int sx = sx0; sx < sx1; sx++) {
                        sr += ir[row + sx];
                        sg += ig[row + sx];
                        sb += ib[row + sx];
                        count++;
                    }
                }
                int o = y * dw + x;
                or[o] = sr / count;
                og[o] = sg / count;
                ob[o] = sb / count;
            }
        }
        return out;
    }

    /** Bilinear resample with pixel-center alignment, clamped at the borders. */
    static LinearImage upsample(LinearImage src, int outW, int outH) {
        int sw = src.width(), sh = src.height();
        float scaleX = (float) sw / outW;
        float scaleY = (float) sh / outH;
        LinearImage out = LinearImage.blank(outW, outH);
        float[][] in = { src.r(), src.g(), src.b() };
        float[][] dst = { out.r(), out.g(), out.b() };

        for (int y = 0; y < outH; y++) {
            float fy = clamp((y + 0.5f) * scaleY - 0.5f, 0f, sh - 1);
            int y0 = (int) fy;
            int y1 = Math.min(y0 + 1, sh - 1);
            float ty = fy - y0;
            for (int x = 0; x < outW; x++) {
                float fx = clamp((x + 0.5f) * scaleX - 0.5f, 0f, sw - 1);
                int x0 = (int) fx;
                int x1 = Math.min(x0 + 1, sw - 1);
                float tx = fx - x0;
                int o = y * outW + x;
                for (int c = 0; c < 3; c++) {
                    float[] p = in[c];
                    float top = p[y0 * sw + x0] * (1f - tx) + p[y0 * sw + x1] * tx;
                    float bottom = p[y1 * sw + x0] * (1f - tx) + p[y1 * sw + x1] * tx;
                    dst[c][o] = top * (1f - ty) + bottom * ty;
                }
            }
        }
        return out;
    }

    private static float clamp(float v, float lo, float hi) {
        return (v < lo) ? lo : (v > hi) ? hi : v;
    }
}
