package stages;

import image.LinearImage;
import util.ParallelRows;

/**
 * Reference CPU bilateral filter, O(r²) per pixel with r = ceil(3·σs).
 * Rows are split over the kernel worker pool.
 */
public final class BilateralStandard implements BilateralFilter {

    public static final String NAME = "cpu-standard";

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
        return filter(src, spatialSigma, rangeSigma);
    }

    public static LinearImage filter(LinearImage src, float spatialSigma, float rangeSigma) {
        if (!(spatialSigma > 0f) || !(rangeSigma > 0f))
            throw new IllegalArgumentException("sigmas must be positive: spatial=" + spatialSigma
                    + " range=" + rangeSigma);

        final int w = src.width(), h = src.height();
        final int radius = BilateralFilter.radiusFor(spatialSigma);
        final float[] spatial = spatialKernel(radius, spatialSigma);
        final float rangeDenom = 2f * rangeSigma * rangeSigma;
        final int side = 2 * radius + 1;

        final float[] lum = new float[w * h];
        for (int i = 0; i < lum.length; i++)
            lum[i] = src.luminance(i);

        final float[] ir = src.r(), ig = src.g(), ib = src.b();
        LinearImage out = LinearImage.blank(w, h);
        final float[] or = out.r(), og = out.g(), ob = out.b();

        ParallelRows.forRows(h, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                for (int x = 0; x < w; x++) {
                    int c = y * w + x;
                    float centerLum = lum[c];
                    float sr = 0f, sg = 0f, sb = 0f, sw = 0f;

                    for (int dy = -radius; dy <= radius; dy++) {
                        int ny = y + dy;
                        if (ny < 0 || ny >= h)
                            continue;
                        int krow = (dy + radius) * side;
                        int nrow = ny * w;
                        for (int dx = -radius; dx <= radius; dx++) {
                            int nx = x + dx;
                            if (nx < 0 || nx >= w)
                                continue;
                            int n = nrow + nx;
                            float d = lum[n] - centerLum;
                            float weight = spatial[krow + dx + radius] * (float) Math.exp(-(d * d) / rangeDenom);
                            sr += ir[n] * weight;
                            sg += ig[n] * weight;
                            sb += ib[n] * weight;
                            sw += weight;
                        }
                    }

                    if (sw > 0f) {
                        or[c] = sr / sw;
                        og[c] = sg / sw;
                        ob[c] = sb / sw;
                    } else {
                        or[c] = ir[c];
                        og[c] = ig[c];
                        ob[c] = ib[c];
                    }
                }
            }
        });
        return out;
    }

    /** Row-major (2r+1)² table of exp(-d²/2σ²). */
    static float[] spatialKernel(int radius, float sigma) {
        int side = 2 * radius + 1;
        float[] k = new float[side * side];
        float denom = 2f * sigma * sigma;
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                k[(dy + radius) * side + dx + radius] = (float) Math.exp(-(dx * dx + dy * dy) / denom);
            }
        }
        return k;
    }
}
