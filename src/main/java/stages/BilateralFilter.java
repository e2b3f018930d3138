package stages;

import image.LinearImage;

/**
 * Edge-preserving smoothing: Gaussian spatial weight times a Gaussian range weight on
 * Rec.709 luminance difference.
 */
public interface BilateralFilter {

    String name();

    /** Whether this implementation can run in the current process. */
    boolean isAvailable();

    /**
     * @throws KernelException if the implementation fails while running
     */
    LinearImage apply(LinearImage image, float spatialSigma, float rangeSigma);

    static int radiusFor(float spatialSigma) {
        return (int) Math.ceil(3.0f * spatialSigma);
    }
}
