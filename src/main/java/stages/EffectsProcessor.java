package stages;

import image.LinearImage;
import params.AdjustmentParameters;
import pipeline.ProcessingStage;
import util.ParallelRows;

/**
 * Clarity, texture, dehaze, vignette and grain, in that order.
 */
public final class EffectsProcessor implements StageProcessor {

    static final float CLARITY_SPATIAL_SIGMA = 5f;
    static final float CLARITY_RANGE_SIGMA = 0.2f;
    static final float TEXTURE_SPATIAL_SIGMA = 2f;
    static final float TEXTURE_RANGE_SIGMA = 0.1f;
    static final float EPS = 0.01f;

    private final BilateralDispatcher bilateral;
    private final int grainSeed;

    public EffectsProcessor(BilateralDispatcher bilateral) {
        this(bilateral, GrainEffect.DEFAULT_SEED);
    }

    public EffectsProcessor(BilateralDispatcher bilateral, int grainSeed) {
        this.bilateral = bilateral;
        this.grainSeed = grainSeed;
    }

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.EFFECTS;
    }

    @Override
    public boolean shouldExecute(AdjustmentParameters p) {
        return Math.abs(p.clarity()) > EPS || Math.abs(p.texture()) > EPS || Math.abs(p.dehaze()) > EPS
                || Math.abs(p.vignette()) > EPS || p.grain() > 0.1f;
    }

    @Override
    public LinearImage process(LinearImage input, AdjustmentParameters p) {
        LinearImage img = input;
        if (Math.abs(p.clarity()) > EPS)
            img = clarity(img, p.clarity() / 100f);
        if (Math.abs(p.texture()) > EPS)
            img = texture(img, p.texture() / 100f);
        if (Math.abs(p.dehaze()) > EPS || Math.abs(p.vignette()) > EPS || p.grain() > 0.1f)
            img = pointEffects(img, p.dehaze() / 100f, p.vignette() / 100f, p.grain() / 100f);
        return img;
    }

    /** Local contrast from a mid-scale detail layer, eased off in deep shadows and highlights. */
    LinearImage clarity(LinearImage src, float amount) {
        LinearImage detail = bilateral.extractDetail(src, CLARITY_SPATIAL_SIGMA, CLARITY_RANGE_SIGMA);
        return addDetail(src, detail, amount, true);
    }

    LinearImage texture(LinearImage src, float amount) {
        LinearImage detail = bilateral.extractDetail(src, TEXTURE_SPATIAL_SIGMA, TEXTURE_RANGE_SIGMA);
        return addDetail(src, detail, amount, false);
    }

    static float clarityProtection(float luminance) {
        float protection = 1f;
        if (luminance > 0.8f)
            protection = 1f - (luminance - 0.8f) / 0.2f;
        else if (luminance < 0.2f)
            protection = luminance / 0.2f;
        return Math.max(0.2f, protection);
    }

    private static LinearImage addDetail(LinearImage src, LinearImage detail, float amount, boolean protect) {
        final int w = src.width();
        LinearImage out = LinearImage.blank(w, src.height());
        final float[] ir = src.r(), ig = src.g(), ib = src.b();
        final float[] dr = detail.r(), dg = detail.g(), db = detail.b();
        final float[] or = out.r(), og = out.g(), ob = out.b();
        ParallelRows.forRows(src.height(), (y0, y1) -> {
            for (int i = y0 * w; i < y1 * w; i++) {
                float a = protect ? amount * clarityProtection(src.luminance(i)) : amount;
                or[i] = Math.max(0f, ir[i] + dr[i] * a);
                og[i] = Math.max(0f, ig[i] + dg[i] * a);
                ob[i] = Math.max(0f, ib[i] + db[i] * a);
            }
        });
        return out;
    }

    /** Per-pixel effects fused into one pass: dehaze, vignette, grain. */
    private LinearImage pointEffects(LinearImage src, float dehaze, float vignette, float grain) {
        final int w = src.width(), h = src.height();
        LinearImage out = LinearImage.blank(w, h);
        final float[] ir = src.r(), ig = src.g(), ib = src.b();
        final float[] or = out.r(), og = out.g(), ob = out.b();
        final boolean doDehaze = Math.abs(dehaze) > EPS / 100f;
        final boolean doVignette = Math.abs(vignette) > EPS / 100f;
        final int seed = grainSeed;

        ParallelRows.forRows(h, (y0, y1) -> {
            float[] px = new float[3];
            for (int y = y0; y < y1; y++) {
                for (int x = 0; x < w; x++) {
                    int i = y * w + x;
                    px[0] = ir[i];
                    px[1] = ig[i];
                    px[2] = ib[i];
                    if (doDehaze)
                        dehaze(px, dehaze);
                    if (doVignette) {
                        float s = VignetteEffect.strength(VignetteEffect.normalizedDistance(x, y, w, h), vignette);
                        px[0] *= s;
                        px[1] *= s;
                        px[2] *= s;
                    }
                    GrainEffect.apply(px, grain, x, y, seed);
                    or[i] = Math.max(0f, px[0]);
                    og[i] = Math.max(0f, px[1]);
                    ob[i] = Math.max(0f, px[2]);
                }
            }
        });
        return out;
    }

    /** Contrast about mid-grey plus a saturation lift, both scaled by {@code f}. */
    static void dehaze(float[] px, float f) {
        for (int c = 0; c < 3; c++)
            px[c] = px[c] + (px[c] - 0.5f) * f * 0.5f;
        float lum = 0.2126f * px[0] + 0.7152f * px[1] + 0.0722f * px[2];
        float sat = 1f + 0.3f * f;
        for (int c = 0; c < 3; c++)
            px[c] = Math.max(0f, lum + (px[c] - lum) * sat);
    }
}
