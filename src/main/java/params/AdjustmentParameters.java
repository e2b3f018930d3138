package params;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of every user-tunable value.
 *
 * Record equality is full structural equality, including curve points and HSL bands,
 * which the change detector relies on to recognise "nothing changed".
 */
public record AdjustmentParameters(
        // global
        float globalExposure,
        float contrast,
        float saturation,
        // tone regions
        float highlights,
        float shadows,
        float whites,
        float blacks,
        // presence
        float clarity,
        float vibrance,
        // white balance
        float temperature,
        float tint,
        // color grading
        float gradingHighlightsTemp,
        float gradingHighlightsTint,
        float gradingMidtonesTemp,
        float gradingMidtonesTint,
        float gradingShadowsTemp,
        float gradingShadowsTint,
        float gradingBlending,
        float gradingBalance,
        // effects
        float texture,
        float dehaze,
        float vignette,
        float grain,
        // details
        float sharpening,
        float noiseReduction,
        // curves
        boolean enableRgbCurve,
        List<CurvePoint> rgbCurvePoints,
        boolean enableRedCurve,
        List<CurvePoint> redCurvePoints,
        boolean enableGreenCurve,
        List<CurvePoint> greenCurvePoints,
        boolean enableBlueCurve,
        List<CurvePoint> blueCurvePoints,
        // hsl, 8 bands of 45 degrees starting at red
        boolean enableHsl,
        List<Float> hslHueShift,
        List<Float> hslSaturation,
        List<Float> hslLuminance,
        // geometry
        float rotation,
        boolean cropEnabled,
        float cropLeft,
        float cropTop,
        float cropRight,
        float cropBottom) {

    public static final int HSL_BANDS = 8;

    public static final List<CurvePoint> IDENTITY_CURVE = List.of(CurvePoint.of(0f, 0f), CurvePoint.of(1f, 1f));

    private static final List<Float> ZERO_BANDS = Collections.nCopies(HSL_BANDS, 0f);

    private static final AdjustmentParameters NEUTRAL = new Builder().build();

    public AdjustmentParameters {
        rgbCurvePoints = curve(rgbCurvePoints, "rgb");
        redCurvePoints = curve(redCurvePoints, "red");
        greenCurvePoints = curve(greenCurvePoints, "green");
        blueCurvePoints = curve(blueCurvePoints, "blue");
        hslHueShift = bands(hslHueShift, "hue");
        hslSaturation = bands(hslSaturation, "saturation");
        hslLuminance = bands(hslLuminance, "luminance");
        if (cropEnabled && (cropLeft >= cropRight || cropTop >= cropBottom))
            throw new IllegalArgumentException("crop rectangle is empty: l=" + cropLeft + " t=" + cropTop
                    + " r=" + cropRight + " b=" + cropBottom);
    }

    private static List<CurvePoint> curve(List<CurvePoint> pts, String name) {
        if (pts == null)
            return IDENTITY_CURVE;
        if (pts.size() < 2)
            throw new IllegalArgumentException(name + " curve needs at least two points, got " + pts.size());
        return List.copyOf(pts);
    }

    private static List<Float> bands(List<Float> values, String name) {
        if (values == null)
            return ZERO_BANDS;
        if (values.size() != HSL_BANDS)
            throw new IllegalArgumentException("hsl " + name + " needs " + HSL_BANDS + " bands, got " + values.size());
        return List.copyOf(values);
    }

    /** Every slider at its neutral position. */
    public static AdjustmentParameters neutral() {
        return NEUTRAL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static boolean isIdentityCurve(List<CurvePoint> pts) {
        return IDENTITY_CURVE.equals(pts);
    }

    public static float[] toArray(List<Float> bands) {
        float[] out = new float[bands.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = bands.get(i);
        return out;
    }

    public static List<Float> bandsOf(float... values) {
        List<Float> out = new ArrayList<>(values.length);
        for (float v : values)
            out.add(v);
        return out;
    }

    /** Mutable builder; {@link #build()} produces the immutable snapshot. */
    public static final class Builder {
        private float globalExposure = 0f;
        private float contrast = 1f;
        private float saturation = 1f;
        private float highlights, shadows, whites, blacks;
        private float clarity, vibrance;
        private float temperature, tint;
        private float gradingHighlightsTemp, gradingHighlightsTint;
        private float gradingMidtonesTemp, gradingMidtonesTint;
        private float gradingShadowsTemp, gradingShadowsTint;
        private float gradingBlending = 50f;
        private float gradingBalance;
        private float texture, dehaze, vignette, grain;
        private float sharpening, noiseReduction;
        private boolean enableRgbCurve;
        private List<CurvePoint> rgbCurvePoints = IDENTITY_CURVE;
        private boolean enableRedCurve;
        private List<CurvePoint> redCurvePoints = IDENTITY_CURVE;
        private boolean enableGreenCurve;
        private List<CurvePoint> greenCurvePoints = IDENTITY_CURVE;
        private boolean enableBlueCurve;
        private List<CurvePoint> blueCurvePoints = IDENTITY_CURVE;
        private boolean enableHsl;
        private List<Float> hslHueShift = ZERO_BANDS;
        private List<Float> hslSaturation = ZERO_BANDS;
        private List<Float> hslLuminance = ZERO_BANDS;
        private float rotation;
        private boolean cropEnabled;
        private float cropLeft = 0f, cropTop = 0f, cropRight = 1f, cropBottom = 1f;

        private Builder() {
        }

        private Builder(AdjustmentParameters p) {
            globalExposure = p.globalExposure;
            contrast = p.contrast;
            saturation = p.saturation;
            highlights = p.highlights;
            shadows = p.shadows;
            whites = p.whites;
            blacks = p.blacks;
            clarity = p.clarity;
            vibrance = p.vibrance;
            temperature = p.temperature;
            tint = p.tint;
            gradingHighlightsTemp = p.gradingHighlightsTemp;
            gradingHighlightsTint = p.gradingHighlightsTint;
            gradingMidtonesTemp = p.gradingMidtonesTemp;
            gradingMidtonesTint = p.gradingMidtonesTint;
            gradingShadowsTemp = p.gradingShadowsTemp;
            gradingShadowsTint = p.gradingShadowsTint;
            gradingBlending = p.gradingBlending;
            gradingBalance = p.gradingBalance;
            texture = p.texture;
            dehaze = p.dehaze;
            vignette = p.vignette;
            grain = p.grain;
            sharpening = p.sharpening;
            noiseReduction = p.noiseReduction;
            enableRgbCurve = p.enableRgbCurve;
            rgbCurvePoints = p.rgbCurvePoints;
            enableRedCurve = p.enableRedCurve;
            redCurvePoints = p.redCurvePoints;
            enableGreenCurve = p.enableGreenCurve;
            greenCurvePoints = p.greenCurvePoints;
            enableBlueCurve = p.enableBlueCurve;
            blueCurvePoints = p.blueCurvePoints;
            enableHsl = p.enableHsl;
            hslHueShift = p.hslHueShift;
            hslSaturation = p.hslSaturation;
            hslLuminance = p.hslLuminance;
            rotation = p.rotation;
            cropEnabled = p.cropEnabled;
            cropLeft = p.cropLeft;
            cropTop = p.cropTop;
            cropRight = p.cropRight;
            cropBottom = p.cropBottom;
        }

        public Builder globalExposure(float v) { globalExposure = v; return this; }
        public Builder contrast(float v) { contrast = v; return this; }
        public Builder saturation(float v) { saturation = v; return this; }
        public Builder highlights(float v) { highlights = v; return this; }
        public Builder shadows(float v) { shadows = v; return this; }
        public Builder whites(float v) { whites = v; return this; }
        public Builder blacks(float v) { blacks = v; return this; }
        public Builder clarity(float v) { clarity = v; return this; }
        public Builder vibrance(float v) { vibrance = v; return this; }
        public Builder temperature(float v) { temperature = v; return this; }
        public Builder tint(float v) { tint = v; return this; }
        public Builder gradingHighlightsTemp(float v) { gradingHighlightsTemp = v; return this; }
        public Builder gradingHighlightsTint(float v) { gradingHighlightsTint = v; return this; }
        public Builder gradingMidtonesTemp(float v) { gradingMidtonesTemp = v; return this; }
        public Builder gradingMidtonesTint(float v) { gradingMidtonesTint = v; return this; }
        public Builder gradingShadowsTemp(float v) { gradingShadowsTemp = v; return this; }
        public Builder gradingShadowsTint(float v) { gradingShadowsTint = v; return this; }
        public Builder gradingBlending(float v) { gradingBlending = v; return this; }
        public Builder gradingBalance(float v) { gradingBalance = v; return this; }
        public Builder texture(float v) { texture = v; return this; }
        public Builder dehaze(float v) { dehaze = v; return this; }
        public Builder vignette(float v) { vignette = v; return this; }
        public Builder grain(float v) { grain = v; return this; }
        public Builder sharpening(float v) { sharpening = v; return this; }
        public Builder noiseReduction(float v) { noiseReduction = v; return this; }
        public Builder enableRgbCurve(boolean v) { enableRgbCurve = v; return this; }
        public Builder rgbCurvePoints(List<CurvePoint> v) { rgbCurvePoints = v; return this; }
        public Builder enableRedCurve(boolean v) { enableRedCurve = v; return this; }
        public Builder redCurvePoints(List<CurvePoint> v) { redCurvePoints = v; return this; }
        public Builder enableGreenCurve(boolean v) { enableGreenCurve = v; return this; }
        public Builder greenCurvePoints(List<CurvePoint> v) { greenCurvePoints = v; return this; }
        public Builder enableBlueCurve(boolean v) { enableBlueCurve = v; return this; }
        public Builder blueCurvePoints(List<CurvePoint> v) { blueCurvePoints = v; return this; }
        public Builder enableHsl(boolean v) { enableHsl = v; return this; }
        public Builder hslHueShift(List<Float> v) { hslHueShift = v; return this; }
        public Builder hslSaturation(List<Float> v) { hslSaturation = v; return this; }
        public Builder hslLuminance(List<Float> v) { hslLuminance = v; return this; }
        public Builder rotation(float v) { rotation = v; return this; }
        public Builder cropEnabled(boolean v) { cropEnabled = v; return this; }
        public Builder cropLeft(float v) { cropLeft = v; return this; }
        public Builder cropTop(float v) { cropTop = v; return this; }
        public Builder cropRight(float v) { cropRight = v; return this; }
        public Builder cropBottom(float v) { cropBottom = v; return this; }

        public AdjustmentParameters build() {
            return new AdjustmentParameters(globalExposure, contrast, saturation,
                    highlights, shadows, whites, blacks,
                    clarity, vibrance,
                    temperature, tint,
                    gradingHighlightsTemp, gradingHighlightsTint,
                    gradingMidtonesTemp, gradingMidtonesTint,
                    gradingShadowsTemp, gradingShadowsTint,
                    gradingBlending, gradingBalance,
                    texture, dehaze, vignette, grain,
                    sharpening, noiseReduction,
                    enableRgbCurve, rgbCurvePoints,
                    enableRedCurve, redCurvePoints,
                    enableGreenCurve, greenCurvePoints,
                    enableBlueCurve, blueCurvePoints,
                    enableHsl, hslHueShift, hslSaturation, hslLuminance,
                    rotation, cropEnabled, cropLeft, cropTop, cropRight, cropBottom);
        }
    }
}
