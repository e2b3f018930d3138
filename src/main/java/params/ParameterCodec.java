package params;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Text form of {@link AdjustmentParameters}, one {@code key=value} line per field, used by
 * parameter stores and the edit shell.
 *
 * Keys are the lower-cased {@link ParameterName}s. Band lists are comma separated; curve
 * points are {@code x:y} pairs separated by commas. Keys that are absent keep their default.
 */
public final class ParameterCodec {

    private ParameterCodec() {
    }

    public static String key(ParameterName name) {
        return name.name().toLowerCase(Locale.ROOT);
    }

    /** Lenient lookup: {@code global_exposure}, {@code globalExposure} and {@code GLOBAL-EXPOSURE} all match. */
    public static ParameterName parseName(String s) {
        String want = squash(s);
        for (ParameterName n : ParameterName.values()) {
            if (squash(n.name()).equals(want))
                return n;
        }
        throw new IllegalArgumentException("Unknown parameter: " + s);
    }

    public static String encode(AdjustmentParameters p) {
        StringBuilder sb = new StringBuilder();
        for (ParameterName n : ParameterName.values())
            sb.append(key(n)).append('=').append(format(n.read(p))).append('\n');
        return sb.toString();
    }

    public static AdjustmentParameters decode(String text) {
        Properties props = new Properties();
        try {
            props.load(new StringReader(text));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed parameter text", e);
        }
        AdjustmentParameters.Builder b = AdjustmentParameters.builder();
        for (String k : props.stringPropertyNames())
            set(b, parseName(k), props.getProperty(k));
        return b.build();
    }

    /**
     * Apply one textual value to a builder.
     *
     * @throws IllegalArgumentException if the value does not parse for that field
     */
    public static AdjustmentParameters.Builder set(AdjustmentParameters.Builder b, ParameterName n, String value) {
        String v = value.trim();
        switch (n) {
            case GLOBAL_EXPOSURE -> b.globalExposure(f(v));
            case CONTRAST -> b.contrast(f(v));
            case HIGHLIGHTS -> b.highlights(f(v));
            case SHADOWS -> b.shadows(f(v));
            case WHITES -> b.whites(f(v));
            case BLACKS -> b.blacks(f(v));
            case ROTATION -> b.rotation(f(v));
            case CROP_ENABLED -> b.cropEnabled(bool(v));
            case CROP_LEFT -> b.cropLeft(f(v));
            case CROP_TOP -> b.cropTop(f(v));
            case CROP_RIGHT -> b.cropRight(f(v));
            case CROP_BOTTOM -> b.cropBottom(f(v));
            case ENABLE_RGB_CURVE -> b.enableRgbCurve(bool(v));
            case RGB_CURVE_POINTS -> b.rgbCurvePoints(points(v));
            case ENABLE_RED_CURVE -> b.enableRedCurve(bool(v));
            case RED_CURVE_POINTS -> b.redCurvePoints(points(v));
            case ENABLE_GREEN_CURVE -> b.enableGreenCurve(bool(v));
            case GREEN_CURVE_POINTS -> b.greenCurvePoints(points(v));
            case ENABLE_BLUE_CURVE -> b.enableBlueCurve(bool(v));
            case BLUE_CURVE_POINTS -> b.blueCurvePoints(points(v));
            case TEMPERATURE -> b.temperature(f(v));
            case TINT -> b.tint(f(v));
            case SATURATION -> b.saturation(f(v));
            case VIBRANCE -> b.vibrance(f(v));
            case ENABLE_HSL -> b.enableHsl(bool(v));
            case HSL_HUE_SHIFT -> b.hslHueShift(bands(v));
            case HSL_SATURATION -> b.hslSaturation(bands(v));
            case HSL_LUMINANCE -> b.hslLuminance(bands(v));
            case GRADING_HIGHLIGHTS_TEMP -> b.gradingHighlightsTemp(f(v));
            case GRADING_HIGHLIGHTS_TINT -> b.gradingHighlightsTint(f(v));
            case GRADING_MIDTONES_TEMP -> b.gradingMidtonesTemp(f(v));
            case GRADING_MIDTONES_TINT -> b.gradingMidtonesTint(f(v));
            case GRADING_SHADOWS_TEMP -> b.gradingShadowsTemp(f(v));
            case GRADING_SHADOWS_TINT -> b.gradingShadowsTint(f(v));
            case GRADING_BLENDING -> b.gradingBlending(f(v));
            case GRADING_BALANCE -> b.gradingBalance(f(v));
            case CLARITY -> b.clarity(f(v));
            case TEXTURE -> b.texture(f(v));
            case DEHAZE -> b.dehaze(f(v));
            case VIGNETTE -> b.vignette(f(v));
            case GRAIN -> b.grain(f(v));
            case SHARPENING -> b.sharpening(f(v));
            case NOISE_REDUCTION -> b.noiseReduction(f(v));
        }
        return b;
    }

    /** Text form of one field, as {@link #set} accepts it. */
    public static String value(ParameterName n, AdjustmentParameters p) {
        return format(n.read(p));
    }

    private static String format(Object value) {
        if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < list.size(); i++) {
                if (i > 0)
                    sb.append(',');
                Object e = list.get(i);
                if (e instanceof CurvePoint p)
                    sb.append(p.x()).append(':').append(p.y());
                else
                    sb.append(e);
            }
            return sb.toString();
        }
        return String.valueOf(value);
    }

    private static float f(String v) {
        try {
            float x = Float.parseFloat(v);
            if (Float.isNaN(x) || Float.isInfinite(x))
                throw new IllegalArgumentException("Not a finite number: " + v);
            return x;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + v, e);
        }
    }

    private static boolean bool(String v) {
        return switch (v.toLowerCase(Locale.ROOT)) {
            case "true", "1", "on", "yes" -> true;
            case "false", "0", "off", "no" -> false;
            default -> throw new IllegalArgumentException("Not a boolean: " + v);
        };
    }

    private static List<Float> bands(String v) {
        List<Float> out = new ArrayList<>();
        for (String part : v.split(","))
            out.add(f(part));
        return out;
    }

    private static List<CurvePoint> points(String v) {
        List<CurvePoint> out = new ArrayList<>();
        for (String part : v.split(",")) {
            int c = part.indexOf(':');
            if (c < 0)
                throw new IllegalArgumentException("Curve point must be x:y, got " + part);
            out.add(CurvePoint.of(f(part.substring(0, c)), f(part.substring(c + 1))));
        }
        return out;
    }

    private static String squash(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            if (c != '_' && c != '-' && c != '.')
                sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }
}
