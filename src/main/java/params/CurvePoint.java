package params;

/** Tone-curve control point, both coordinates normalized to [0,1]. */
public record CurvePoint(float x, float y) {

    public CurvePoint {
        if (Float.isNaN(x) || Float.isNaN(y))
            throw new IllegalArgumentException("curve point coordinates must be numbers");
    }

    public static CurvePoint of(float x, float y) {
        return new CurvePoint(x, y);
    }
}
