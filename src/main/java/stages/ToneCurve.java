package stages;

import params.CurvePoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 256-entry lookup table built from a cubic Hermite spline through the control points.
 */
public final class ToneCurve {

    public static final int LUT_SIZE = 256;

    private final float[] lut;

    private ToneCurve(float[] lut) {
        this.lut = lut;
    }

    /** Empty when the curve is disabled or is the identity diagonal. */
    public static Optional<ToneCurve> of(boolean enabled, List<CurvePoint> points) {
        if (!enabled || points == null || points.size() < 2
                || params.AdjustmentParameters.isIdentityCurve(points))
            return Optional.empty();
        return Optional.of(new ToneCurve(buildLut(points)));
    }

    static float[] buildLut(List<CurvePoint> points) {
        List<CurvePoint> pts = new ArrayList<>(points);
        pts.sort(Comparator.comparingDouble(CurvePoint::x));
        int n = pts.size();
        float[] xs = new float[n], ys = new float[n];
        for (int i = 0; i < n; i++) {
            xs[i] = pts.get(i).x();
            ys[i] = pts.get(i).y();
        }
        float[] tangents = tangents(xs, ys);

        float[] lut = new float[LUT_SIZE];
        int seg = 0;
        for (int i = 0; i < LUT_SIZE; i++) {
            float x = i / (float) (LUT_SIZE - 1);
            float y;
            if (x <= xs[0]) {
                y = ys[0];
            } else if (x >= xs[n - 1]) {
                y = ys[n - 1];
            } else {
                while (seg < n - 2 && x > xs[seg + 1])
                    seg++;
                float h = xs[seg + 1] - xs[seg];
                if (h <= 0f) {
                    y = ys[seg + 1];
                } else {
                    float t = (x - xs[seg]) / h;
                    float t2 = t * t, t3 = t2 * t;
                    float h00 = 2f * t3 - 3f * t2 + 1f;
                    float h10 = t3 - 2f * t2 + t;
                    float h01 = -2f * t3 + 3f * t2;
                    float h11 = t3 - t2;
                    y = h00 * ys[seg] + h10 * h * tangents[seg] + h01 * ys[seg + 1] + h11 * h * tangents[seg + 1];
                }
            }
            lut[i] = (y < 0f) ? 0f : (y > 1f) ? 1f : y;
        }
        return lut;
    }

    /** Slopes from the neighbouring points; one-sided at the ends. */
    private static float[] tangents(float[] xs, float[] ys) {
        int n = xs.length;
        float[] m = new float[n];
        for (int i = 0; i < n; i++) {
            int a = Math.max(0, i - 1), b = Math.min(n - 1, i + 1);
            float dx = xs[b] - xs[a];
            m[i] = dx > 0f ? (ys[b] - ys[a]) / dx : 0f;
        }
        return m;
    }

    /** Linear interpolation between LUT entries; input and output clamped to [0,1]. */
    public float apply(float v) {
        v = (v < 0f) ? 0f : (v > 1f) ? 1f : v;
        float pos = v * (LUT_SIZE - 1);
        int i0 = (int) pos;
        if (i0 >= LUT_SIZE - 1)
            return lut[LUT_SIZE - 1];
        float t = pos - i0;
        return lut[i0] * (1f - t) + lut[i0 + 1] * t;
    }

    float[] lut() {
        return lut;
    }
}
