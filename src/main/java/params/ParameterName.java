package params;

import pipeline.ProcessingStage;

import java.util.function.Function;

import static pipeline.ProcessingStage.COLOR;
import static pipeline.ProcessingStage.CURVES;
import static pipeline.ProcessingStage.DETAILS;
import static pipeline.ProcessingStage.EFFECTS;
import static pipeline.ProcessingStage.TONE_BASE;

/**
 * Every field of {@link AdjustmentParameters}, bound to the one stage that reads it.
 */
public enum ParameterName {

    GLOBAL_EXPOSURE(TONE_BASE, AdjustmentParameters::globalExposure),
    CONTRAST(TONE_BASE, AdjustmentParameters::contrast),
    HIGHLIGHTS(TONE_BASE, AdjustmentParameters::highlights),
    SHADOWS(TONE_BASE, AdjustmentParameters::shadows),
    WHITES(TONE_BASE, AdjustmentParameters::whites),
    BLACKS(TONE_BASE, AdjustmentParameters::blacks),
    // geometry is applied before any tone work, so it invalidates from the first stage
    ROTATION(TONE_BASE, AdjustmentParameters::rotation),
    CROP_ENABLED(TONE_BASE, AdjustmentParameters::cropEnabled),
    CROP_LEFT(TONE_BASE, AdjustmentParameters::cropLeft),
    CROP_TOP(TONE_BASE, AdjustmentParameters::cropTop),
    CROP_RIGHT(TONE_BASE, AdjustmentParameters::cropRight),
    CROP_BOTTOM(TONE_BASE, AdjustmentParameters::cropBottom),

    ENABLE_RGB_CURVE(CURVES, AdjustmentParameters::enableRgbCurve),
    RGB_CURVE_POINTS(CURVES, AdjustmentParameters::rgbCurvePoints),
    ENABLE_RED_CURVE(CURVES, AdjustmentParameters::enableRedCurve),
    RED_CURVE_POINTS(CURVES, AdjustmentParameters::redCurvePoints),
    ENABLE_GREEN_CURVE(CURVES, AdjustmentParameters::enableGreenCurve),
    GREEN_CURVE_POINTS(CURVES, AdjustmentParameters::greenCurvePoints),
    ENABLE_BLUE_CURVE(CURVES, AdjustmentParameters::enableBlueCurve),
    BLUE_CURVE_POINTS(CURVES, AdjustmentParameters::blueCurvePoints),

    TEMPERATURE(COLOR, AdjustmentParameters::temperature),
    TINT(COLOR, AdjustmentParameters::tint),
    SATURATION(COLOR, AdjustmentParameters::saturation),
    VIBRANCE(COLOR, AdjustmentParameters::vibrance),
    ENABLE_HSL(COLOR, AdjustmentParameters::enableHsl),
    HSL_HUE_SHIFT(COLOR, AdjustmentParameters::hslHueShift),
    HSL_SATURATION(COLOR, AdjustmentParameters::hslSaturation),
    HSL_LUMINANCE(COLOR, AdjustmentParameters::hslLuminance),
    GRADING_HIGHLIGHTS_TEMP(COLOR, AdjustmentParameters::gradingHighlightsTemp),
    GRADING_HIGHLIGHTS_TINT(COLOR, AdjustmentParameters::gradingHighlightsTint),
    GRADING_MIDTONES_TEMP(COLOR, AdjustmentParameters::gradingMidtonesTemp),
    GRADING_MIDTONES_TINT(COLOR, AdjustmentParameters::gradingMidtonesTint),
    GRADING_SHADOWS_TEMP(COLOR, AdjustmentParameters::gradingShadowsTemp),
    GRADING_SHADOWS_TINT(COLOR, AdjustmentParameters::gradingShadowsTint),
    GRADING_BLENDING(COLOR, AdjustmentParameters::gradingBlending),
    GRADING_BALANCE(COLOR, AdjustmentParameters::gradingBalance),

    CLARITY(EFFECTS, AdjustmentParameters::clarity),
    TEXTURE(EFFECTS, AdjustmentParameters::texture),
    DEHAZE(EFFECTS, AdjustmentParameters::dehaze),
    VIGNETTE(EFFECTS, AdjustmentParameters::vignette),
    GRAIN(EFFECTS, AdjustmentParameters::grain),

    SHARPENING(DETAILS, AdjustmentParameters::sharpening),
    NOISE_REDUCTION(DETAILS, AdjustmentParameters::noiseReduction);

    private final ProcessingStage stage;
    private final Function<AdjustmentParameters, Object> reader;

    ParameterName(ProcessingStage stage, Function<AdjustmentParameters, Object> reader) {
        this.stage = stage;
        this.reader = reader;
    }

    public ProcessingStage stage() {
        return stage;
    }

    /** Boxed field value: Float, Boolean, List&lt;CurvePoint&gt; or List&lt;Float&gt;. */
    public Object read(AdjustmentParameters p) {
        return reader.apply(p);
    }
}
