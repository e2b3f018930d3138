package cache;

import pipeline.ProcessingStage;

/**
 * L2 lookup key. The upstream id already folds in the source and every earlier stage's
 * parameters, so equal keys mean equal stage output.
 */
public record StageCacheKey(ProcessingStage stage, String paramDigest, String upstreamId) {

    @Override
    public String toString() {
        return stage + "[" + paramDigest.substring(0, Math.min(12, paramDigest.length())) + "@"
                + upstreamId.substring(0, Math.min(12, upstreamId.length())) + "]";
    }
}
