package params;

import pipeline.ProcessingStage;

/**
 * Digest of one stage's parameter subset.
 *
 * @param stage     stage the digest was computed for
 * @param digest    hex SHA-256 of {@code canonical}
 * @param canonical rounded values the digest was taken over, kept for exact verification
 */
public record ParameterHash(ProcessingStage stage, String digest, String canonical) {

    /** Digest and rounded values both agree. */
    public boolean matches(ParameterHash other) {
        return other != null && stage == other.stage && digest.equals(other.digest)
                && canonical.equals(other.canonical);
    }

    public String shortDigest() {
        return digest.substring(0, 12);
    }

    @Override
    public String toString() {
        return stage + ":" + shortDigest();
    }
}
