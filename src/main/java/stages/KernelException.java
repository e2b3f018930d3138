package stages;

/**
 * A numeric kernel failed to produce its output (device loss, bad launch, invalid state).
 */
public class KernelException extends RuntimeException {

    private final String kernel;

    public KernelException(String kernel, String message) {
        super(kernel + ": " + message);
        this.kernel = kernel;
    }

    public KernelException(String kernel, String message, Throwable cause) {
        super(kernel + ": " + message, cause);
        this.kernel = kernel;
    }

    /** Name of the kernel or stage that failed. */
    public String kernel() {
        return kernel;
    }
}
