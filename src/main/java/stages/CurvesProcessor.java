package stages;

import image.LinearImage;
import params.AdjustmentParameters;
import pipeline.ProcessingStage;
import util.ParallelRows;

import java.util.Optional;

/** Master RGB curve, then the per-channel curves. */
public final class CurvesProcessor implements StageProcessor {

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.CURVES;
    }

    @Override
    public boolean shouldExecute(AdjustmentParameters p) {
        return rgb(p).isPresent() || red(p).isPresent() || green(p).isPresent() || blue(p).isPresent();
    }

    private static Optional<ToneCurve> rgb(AdjustmentParameters p) {
        return ToneCurve.of(p.enableRgbCurve(), p.rgbCurvePoints());
    }

    private static Optional<ToneCurve> red(AdjustmentParameters p) {
        return ToneCurve.of(p.enableRedCurve(), p.redCurvePoints());
    }

    private static Optional<ToneCurve> green(AdjustmentParameters p) {
        return ToneCurve.of(p.enableGreenCurve(), p.greenCurvePoints());
    }

    private static Optional<ToneCurve> blue(AdjustmentParameters p) {
        return ToneCurve.of(p.enableBlueCurve(), p.blueCurvePoints());
    }

    @Override
    public LinearImage process(LinearImage input, AdjustmentParameters p) {
        final ToneCurve master = rgb(p).orElse(null);
        final ToneCurve cr = red(p).orElse(null);
        final ToneCurve cg = green(p).orElse(null);
        final ToneCurve cb = blue(p).orElse(null);

        final int w = input.width();
        LinearImage out = LinearImage.blank(w, input.height());
        final float[] ir = input.r(), ig = input.g(), ib = input.b();
        final float[] or = out.r(), og = out.g(), ob = out.b();

        ParallelRows.forRows(input.height(), (y0, y1) -> {
            for (int i = y0 * w; i < y1 * w; i++) {
                float r = ir[i], g = ig[i], b = ib[i];
                if (master != null) {
                    r = master.apply(r);
                    g = master.apply(g);
                    b = master.apply(b);
                }
                if (cr != null)
                    r = cr.apply(r);
                if (cg != null)
                    g = cg.apply(g);
                if (cb != null)
                    b = cb.apply(b);
                or[i] = clamp01(r);
                og[i] = clamp01(g);
                ob[i] = clamp01(b);
            }
        });
        return out;
    }

    private static float clamp01(float v) {
        return (v < 0f) ? 0f : (v > 1f) ? 1f : v;
    }
}
