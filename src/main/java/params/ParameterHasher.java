package params;

import pipeline.ProcessingStage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-stage parameter digests. Floats are rounded to four decimals first so sub-precision
 * noise from sliders does not miss the cache.
 */
public final class ParameterHasher {

    private ParameterHasher() {
    }

    public static ParameterHash hash(ProcessingStage stage, AdjustmentParameters params) {
        StringBuilder sb = new StringBuilder(256);
        for (ParameterName n : StageParameterMapping.parametersFor(stage)) {
            sb.append(n.name()).append('=');
            appendValue(sb, n.read(params));
            sb.append(';');
        }
        String canonical = sb.toString();
        return new ParameterHash(stage, sha256Hex(canonical), canonical);
    }

    public static Map<ProcessingStage, ParameterHash> hashAll(AdjustmentParameters params) {
        Map<ProcessingStage, ParameterHash> out = new EnumMap<>(ProcessingStage.class);
        for (ProcessingStage s : ProcessingStage.values())
            out.put(s, hash(s, params));
        return out;
    }

    /** Canonical text of a single value, the form both hashing and change detection compare. */
    public static String canonical(Object value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value);
        return sb.toString();
    }

    static String round4(float v) {
        String s = String.format(Locale.ROOT, "%.4f", v);
        return "-0.0000".equals(s) ? "0.0000" : s;
    }

    private static void appendValue(StringBuilder sb, Object value) {
        if (value instanceof Float f) {
            sb.append(round4(f));
        } else if (value instanceof Boolean b) {
            sb.append(b ? '1' : '0');
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0)
                    sb.append(',');
                Object e = list.get(i);
                if (e instanceof CurvePoint p)
                    sb.append('(').append(round4(p.x())).append(',').append(round4(p.y())).append(')');
                else
                    appendValue(sb, e);
            }
            sb.append(']');
        } else {
            sb.append(value);
        }
    }

    public static String sha256Hex(String text) {
        return HexFormat.of().formatHex(sha256(text.getBytes(StandardCharsets.UTF_8)));
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
