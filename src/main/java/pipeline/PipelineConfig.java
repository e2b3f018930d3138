package pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stages.BilateralConfig;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Recognized pipeline options.
 *
 * Values come from {@code pipeline.properties} on the classpath, then from JVM system
 * properties of the same name (e.g. {@code -Dbilateral.gpu.enabled=true}). Bad values
 * keep the default.
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String RESOURCE = "pipeline.properties";

    public static final long DEFAULT_L1_BYTES = 50L * 1024 * 1024;
    public static final int DEFAULT_L2_ENTRIES = 3;
    public static final long DEFAULT_DEBOUNCE_MS = 150;
    public static final List<Integer> DEFAULT_LADDER = List.of(1200, 800, 600);

    private final boolean cacheEnabled;
    private final boolean verifyOnHit;
    private final long l1MaxBytes;
    private final int l2MaxEntries;
    private final boolean incrementalEnabled;
    private final long debounceMs;
    private final List<Integer> previewLadder;
    private final boolean dither;
    private final boolean softClip;
    private final BilateralConfig bilateral;

    private PipelineConfig(Builder b) {
        this.cacheEnabled = b.cacheEnabled;
        this.verifyOnHit = b.verifyOnHit;
        this.l1MaxBytes = b.l1MaxBytes;
        this.l2MaxEntries = b.l2MaxEntries;
        this.incrementalEnabled = b.incrementalEnabled;
        this.debounceMs = b.debounceMs;
        this.previewLadder = List.copyOf(b.previewLadder);
        this.dither = b.dither;
        this.softClip = b.softClip;
        this.bilateral = b.bilateral.validated();
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /** Classpath resource, then system properties. */
    public static PipelineConfig load() {
        Properties props = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null)
                props.load(in);
            else
                log.debug("No {} on classpath, using defaults", RESOURCE);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", RESOURCE, e.getMessage());
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            props.setProperty(key, System.getProperty(key));
        }
        return fromProperties(props);
    }

    public static PipelineConfig fromProperties(Properties p) {
        Builder b = builder();
        b.cacheEnabled = bool(p, "cache.enabled", b.cacheEnabled);
        b.verifyOnHit = bool(p, "cache.verifyOnHit", b.verifyOnHit);
        b.l1MaxBytes = positiveLong(p, "cache.l1.maxBytes", b.l1MaxBytes);
        b.l2MaxEntries = (int) positiveLong(p, "cache.l2.maxEntries", b.l2MaxEntries);
        b.incrementalEnabled = bool(p, "incremental.enabled", b.incrementalEnabled);
        b.debounceMs = nonNegativeLong(p, "render.debounceMs", b.debounceMs);
        b.previewLadder = ladder(p, "preview.ladder", b.previewLadder);
        b.dither = bool(p, "output.dither", b.dither);
        b.softClip = bool(p, "output.softClip", b.softClip);

        BilateralConfig d = BilateralConfig.defaults();
        boolean gpu = bool(p, "bilateral.gpu.enabled", d.enableGpu());
        // legacy switch from the command line: -DuseGPU=true
        if (p.getProperty("useGPU") != null)
            gpu = gpu || Boolean.parseBoolean(p.getProperty("useGPU").trim());
        b.bilateral = new BilateralConfig(
                bool(p, "bilateral.cache.enabled", d.enableCache()),
                (int) positiveLong(p, "bilateral.cache.maxEntries", d.maxCacheEntries()),
                positiveLong(p, "bilateral.cache.maxMemoryMb", d.maxCacheMemoryMb()),
                bool(p, "bilateral.fast.enabled", d.enableFastApproximation()),
                floatValue(p, "bilateral.fast.threshold", d.fastApproxThreshold()),
                gpu,
                positiveLong(p, "bilateral.gpu.thresholdPixels", d.gpuThresholdPixels()));
        return b.build();
    }

    // ---- parsing helpers ----

    private static boolean bool(Properties p, String key, boolean def) {
        String v = p.getProperty(key);
        if (v == null)
            return def;
        v = v.trim();
        if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false"))
            return Boolean.parseBoolean(v);
        log.warn("Config {}='{}' is not a boolean, keeping {}", key, v, def);
        return def;
    }

    private static long positiveLong(Properties p, String key, long def) {
        long v = nonNegativeLong(p, key, def);
        if (v == 0) {
            log.warn("Config {} must be positive, keeping {}", key, def);
            return def;
        }
        return v;
    }

    private static long nonNegativeLong(Properties p, String key, long def) {
        String v = p.getProperty(key);
        if (v == null)
            return def;
        try {
            long parsed = Long.parseLong(v.trim());
            if (parsed >= 0)
                return parsed;
        } catch (NumberFormatException ignored) {
            // reported below
        }
        log.warn("Config {}='{}' is not a non-negative integer, keeping {}", key, v, def);
        return def;
    }

    private static float floatValue(Properties p, String key, float def) {
        String v = p.getProperty(key);
        if (v == null)
            return def;
        try {
            return Float.parseFloat(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Config {}='{}' is not a number, keeping {}", key, v, def);
            return def;
        }
    }

    private static List<Integer> ladder(Properties p, String key, List<Integer> def) {
        String v = p.getProperty(key);
        if (v == null)
            return def;
        List<Integer> out = new ArrayList<>();
        try {
            for (String part : v.split(",")) {
                int edge = Integer.parseInt(part.trim());
                if (edge <= 0 || (!out.isEmpty() && edge >= out.get(out.size() - 1)))
                    throw new NumberFormatException("ladder must be positive and strictly decreasing");
                out.add(edge);
            }
        } catch (NumberFormatException e) {
            log.warn("Config {}='{}' is invalid ({}), keeping {}", key, v, e.getMessage(), def);
            return def;
        }
        return out.isEmpty() ? def : out;
    }

    // ---- accessors ----

    public boolean cacheEnabled() {
        return cacheEnabled;
    }

    public boolean verifyOnHit() {
        return verifyOnHit;
    }

    public long l1MaxBytes() {
        return l1MaxBytes;
    }

    public int l2MaxEntries() {
        return l2MaxEntries;
    }

    public boolean incrementalEnabled() {
        return incrementalEnabled;
    }

    public long debounceMs() {
        return debounceMs;
    }

    public List<Integer> previewLadder() {
        return previewLadder;
    }

    public boolean dither() {
        return dither;
    }

    public boolean softClip() {
        return softClip;
    }

    public BilateralConfig bilateral() {
        return bilateral;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.cacheEnabled = cacheEnabled;
        b.verifyOnHit = verifyOnHit;
        b.l1MaxBytes = l1MaxBytes;
        b.l2MaxEntries = l2MaxEntries;
        b.incrementalEnabled = incrementalEnabled;
        b.debounceMs = debounceMs;
        b.previewLadder = previewLadder;
        b.dither = dither;
        b.softClip = softClip;
        b.bilateral = bilateral;
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PipelineConfig{cache=" + cacheEnabled + ", verifyOnHit=" + verifyOnHit + ", l1=" + l1MaxBytes
                + "B, l2=" + l2MaxEntries + ", incremental=" + incrementalEnabled + ", debounce=" + debounceMs
                + "ms, ladder=" + previewLadder + ", dither=" + dither + ", softClip=" + softClip
                + ", bilateral=" + bilateral + "}";
    }

    public static final class Builder {
        private boolean cacheEnabled = true;
        private boolean verifyOnHit = true;
        private long l1MaxBytes = DEFAULT_L1_BYTES;
        private int l2MaxEntries = DEFAULT_L2_ENTRIES;
        private boolean incrementalEnabled = true;
        private long debounceMs = DEFAULT_DEBOUNCE_MS;
        private List<Integer> previewLadder = DEFAULT_LADDER;
        private boolean dither = true;
        private boolean softClip = false;
        private BilateralConfig bilateral = BilateralConfig.defaults();

        private Builder() {
        }

        public Builder cacheEnabled(boolean v) {
            cacheEnabled = v;
            return this;
        }

        public Builder verifyOnHit(boolean v) {
            verifyOnHit = v;
            return this;
        }

        public Builder l1MaxBytes(long v) {
            l1MaxBytes = v;
            return this;
        }

        public Builder l2MaxEntries(int v) {
            l2MaxEntries = v;
            return this;
        }

        public Builder incrementalEnabled(boolean v) {
            incrementalEnabled = v;
            return this;
        }

        public Builder debounceMs(long v) {
            debounceMs = v;
            return this;
        }

        public Builder previewLadder(List<Integer> v) {
            previewLadder = v;
            return this;
        }

        public Builder dither(boolean v) {
            dither = v;
            return this;
        }

        public Builder softClip(boolean v) {
            softClip = v;
            return this;
        }

        public Builder bilateral(BilateralConfig v) {
            bilateral = v;
            return this;
        }

        public PipelineConfig build() {
            if (l2MaxEntries <= 0 || l1MaxBytes <= 0)
                throw new IllegalArgumentException("cache limits must be positive");
            if (previewLadder.isEmpty())
                throw new IllegalArgumentException("preview ladder must not be empty");
            return new PipelineConfig(this);
        }
    }
}
