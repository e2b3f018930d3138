package stages;

import image.LinearImage;
import params.AdjustmentParameters;
import pipeline.ProcessingStage;
import util.ParallelRows;

/**
 * Noise reduction (bilateral blend) followed by unsharp-mask sharpening.
 */
public final class DetailsProcessor implements StageProcessor {

    static final float EPS = 0.01f;

    private static final float[] BLUR = {
            1f, 2f, 1f,
            2f, 4f, 2f,
            1f, 2f, 1f
    };

    private final BilateralDispatcher bilateral;

    public DetailsProcessor(BilateralDispatcher bilateral) {
        this.bilateral = bilateral;
    }

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.DETAILS;
    }

    @Override
    public boolean shouldExecute(AdjustmentParameters p) {
        return p.sharpening() > EPS || p.noiseReduction() > EPS;
    }

    @Override
    public LinearImage process(LinearImage input, AdjustmentParameters p) {
        LinearImage img = input;
        if (p.noiseReduction() > EPS)
            img = noiseReduction(img, p.noiseReduction() / 100f);
        if (p.sharpening() > EPS)
            img = sharpen(img, p.sharpening() / 100f);
        return img;
    }

    LinearImage noiseReduction(LinearImage src, float nr) {
        float spatial = 3f + 5f * nr;
        float range = 0.1f + 0.2f * nr;
        LinearImage filtered = bilateral.filter(src, spatial, range);
        LinearImage out = LinearImage.blank(src.width(), src.height());
        float[][] a = { src.r(), src.g(), src.b() };
        float[][] f = { filtered.r(), filtered.g(), filtered.b() };
        float[][] o = { out.r(), out.g(), out.b() };
        for (int c = 0; c < 3; c++) {
            for (int i = 0; i < a[c].length; i++)
                o[c][i] = (1f - nr) * a[c][i] + nr * f[c][i];
        }
        return out;
    }

    /** Unsharp mask over a 3×3 binomial blur; weights renormalized where the kernel leaves the image. */
    static LinearImage sharpen(LinearImage src, float amount) {
        final int w = src.width(), h = src.height();
        LinearImage out = LinearImage.blank(w, h);
        final float[][] in = { src.r(), src.g(), src.b() };
        final float[][] dst = { out.r(), out.g(), out.b() };

        ParallelRows.forRows(h, (y0, y1) -> {
            for (int y = y0; y < y1; y++) {
                for (int x = 0; x < w; x++) {
                    int i = y * w + x;
                    for (int c = 0; c < 3; c++) {
                        float[] p = in[c];
                        float sum = 0f, wsum = 0f;
                        int k = 0;
                        for (int j = -1; j <= 1; j++) {
                            for (int m = -1; m <= 1; m++, k++) {
                                int ny = y + j, nx = x + m;
                                if (ny < 0 || ny >= h || nx < 0 || nx >= w)
                                    continue;
                                sum += p[ny * w + nx] * BLUR[k];
                                wsum += BLUR[k];
                            }
                        }
                        float blurred = sum / wsum;
                        dst[c][i] = Math.max(0f, p[i] + (p[i] - blurred) * amount);
                    }
                }
            }
        });
        return out;
    }
}
