package stages;

import image.LinearImage;

import org.jocl.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.jocl.CL.*;

/**
 * Bilateral filter on the GPU using JOCL (OpenCL 1.2/2.0).
 *
 * One work item per pixel in 8x8 work groups; the global size is rounded up to a
 * multiple of 8 and the kernel discards the overhang. Every OpenCL object is released
 * in the call that created it.
 */
public final class GpuBilateral implements BilateralFilter {

    private static final Logger log = LoggerFactory.getLogger(GpuBilateral.class);

    public static final String NAME = "gpu-opencl";

    static final int LOCAL_SIZE = 8;

    private static final String KERNEL = """
                __kernel void bilateral(
                    __global const float* input,   // interleaved RGB
                    __global float* output,
                    const int width,
                    const int height,
                    const float spatialSigma,
                    const float rangeSigma)
                {
                    int x = get_global_id(0);
                    int y = get_global_id(1);
                    if (x >= width || y >= height)
                        return;

                    int radius = (int) ceil(3.0f * spatialSigma);
                    float sDen = 2.0f * spatialSigma * spatialSigma;
                    float rDen = 2.0f * rangeSigma * rangeSigma;

                    int c = (y * width + x) * 3;
                    float centerLum = 0.2126f * input[c] + 0.7152f * input[c + 1] + 0.0722f * input[c + 2];

                    float sr = 0.0f, sg = 0.0f, sb = 0.0f, sw = 0.0f;
                    for (int dy = -radius; dy <= radius; dy++) {
                        int ny = y + dy;
                        if (ny < 0 || ny >= height)
                            continue;
                        for (int dx = -radius; dx <= radius; dx++) {
                            int nx = x + dx;
                            if (nx < 0 || nx >= width)
                                continue;
                            int n = (ny * width + nx) * 3;
                            float lum = 0.2126f * input[n] + 0.7152f * input[n + 1] + 0.0722f * input[n + 2];
                            float d = lum - centerLum;
                            float w = exp(-(float)(dx * dx + dy * dy) / sDen) * exp(-(d * d) / rDen);
                            sr += input[n] * w;
                            sg += input[n + 1] * w;
                            sb += input[n + 2] * w;
                            sw += w;
                        }
                    }

                    if (sw > 0.0f) {
                        output[c] = sr / sw;
                        output[c + 1] = sg / sw;
                        output[c + 2] = sb / sw;
                    } else {
                        output[c] = input[c];
                        output[c + 1] = input[c + 1];
                        output[c + 2] = input[c + 2];
                    }
                }
            """;

    private volatile Boolean available;

    @Override
    public String name() {
        return NAME;
    }

    /** Probes once for an OpenCL platform with a GPU device. */
    @Override
    public boolean isAvailable() {
        Boolean a = available;
        if (a == null) {
            synchronized (this) {
                if (available == null)
                    available = probe();
                a = available;
            }
        }
        return a;
    }

    /** Forget the probe result, e.g. after a device loss. */
    public void markUnavailable() {
        available = Boolean.FALSE;
    }

    private static boolean probe() {
        try {
            CL.setExceptionsEnabled(true);
            int[] numPlatforms = new int[1];
            clGetPlatformIDs(0, null, numPlatforms);
            if (numPlatforms[0] == 0)
                return false;
            cl_platform_id[] platforms = new cl_platform_id[numPlatforms[0]];
            clGetPlatformIDs(platforms.length, platforms, null);
            for (cl_platform_id p : platforms) {
                int[] numDevices = new int[1];
                try {
                    clGetDeviceIDs(p, CL_DEVICE_TYPE_GPU, 0, null, numDevices);
                } catch (CLException noGpu) {
                    continue;
                }
                if (numDevices[0] > 0)
                    return true;
            }
            return false;
        } catch (Throwable t) {
            log.debug("OpenCL probe failed: {}", t.toString());
            return false;
        }
    }

    @Override
    public LinearImage apply(LinearImage src, float spatialSigma, float rangeSigma) {
        if (!(spatialSigma > 0f) || !(rangeSigma > 0f))
            throw new IllegalArgumentException("sigmas must be positive: spatial=" + spatialSigma
                    + " range=" + rangeSigma);
        try {
            return runOnGpu(src, spatialSigma, rangeSigma);
        } catch (Throwable t) {
            throw new KernelException(NAME, "OpenCL bilateral failed: " + t.getMessage(), t);
        }
    }

    // ---- JOCL implementation ----
    private static LinearImage runOnGpu(LinearImage src, float spatialSigma, float rangeSigma) {
        CL.setExceptionsEnabled(true);

        int w = src.width();
        int h = src.height();
        int n = w * h;

        // Pack planar RGB → interleaved
        float[] host = new float[n * 3];
        float[] r = src.r(), g = src.g(), b = src.b();
        for (int i = 0; i < n; i++) {
            host[i * 3] = r[i];
            host[i * 3 + 1] = g[i];
            host[i * 3 + 2] = b[i];
        }

        // --- Platform & device ---
        int[] numPlatforms = new int[1];
        clGetPlatformIDs(0, null, numPlatforms);
        if (numPlatforms[0] == 0)
            throw new IllegalStateException("No OpenCL platforms found");

        cl_platform_id[] platforms = new cl_platform_id[numPlatforms[0]];
        clGetPlatformIDs(platforms.length, platforms, null);
        cl_platform_id platform = platforms[0];

        int[] numDevices = new int[1];
        clGetDeviceIDs(platform, CL_DEVICE_TYPE_GPU, 0, null, numDevices);
        if (numDevices[0] == 0)
            throw new IllegalStateException("No OpenCL GPU device found");
        cl_device_id[] devices = new cl_device_id[numDevices[0]];
        clGetDeviceIDs(platform, CL_DEVICE_TYPE_GPU, devices.length, devices, null);
        cl_device_id device = devices[0];

        cl_context context = null;
        cl_command_queue queue = null;
        cl_program program = null;
        cl_kernel kernel = null;
        cl_mem in = null;
        cl_mem out = null;
        try {
            cl_context_properties props = new cl_context_properties();
            props.addProperty(CL_CONTEXT_PLATFORM, platform);
            context = clCreateContext(props, 1, new cl_device_id[] { device }, null, null, null);
            queue = clCreateCommandQueueWithProperties(context, device, new cl_queue_properties(), null);

            program = clCreateProgramWithSource(context, 1, new String[] { KERNEL }, null, null);
            clBuildProgram(program, 0, null, null, null, null);
            kernel = clCreateKernel(program, "bilateral", null);

            long bytes = (long) Sizeof.cl_float * host.length;
            in = clCreateBuffer(context, CL_MEM_READ_ONLY | CL_MEM_COPY_HOST_PTR, bytes, Pointer.to(host), null);
            out = clCreateBuffer(context, CL_MEM_WRITE_ONLY, bytes, null, null);

            clSetKernelArg(kernel, 0, Sizeof.cl_mem, Pointer.to(in));
            clSetKernelArg(kernel, 1, Sizeof.cl_mem, Pointer.to(out));
            clSetKernelArg(kernel, 2, Sizeof.cl_int, Pointer.to(new int[] { w }));
            clSetKernelArg(kernel, 3, Sizeof.cl_int, Pointer.to(new int[] { h }));
            clSetKernelArg(kernel, 4, Sizeof.cl_float, Pointer.to(new float[] { spatialSigma }));
            clSetKernelArg(kernel, 5, Sizeof.cl_float, Pointer.to(new float[] { rangeSigma }));

            long[] global = new long[] { roundUp(w), roundUp(h) };
            long[] local = new long[] { LOCAL_SIZE, LOCAL_SIZE };
            clEnqueueNDRangeKernel(queue, kernel, 2, null, global, local, 0, null, null);

            float[] result = new float[host.length];
            clEnqueueReadBuffer(queue, out, CL_TRUE, 0, bytes, Pointer.to(result), 0, null, null);

            // Unpack interleaved → planar
            LinearImage dst = LinearImage.blank(w, h);
            float[] or = dst.r(), og = dst.g(), ob = dst.b();
            for (int i = 0; i < n; i++) {
                or[i] = result[i * 3];
                og[i] = result[i * 3 + 1];
                ob[i] = result[i * 3 + 2];
            }
            return dst;
        } finally {
            if (in != null)
                clReleaseMemObject(in);
            if (out != null)
                clReleaseMemObject(out);
            if (kernel != null)
                clReleaseKernel(kernel);
            if (program != null)
                clReleaseProgram(program);
            if (queue != null)
                clReleaseCommandQueue(queue);
            if (context != null)
                clReleaseContext(context);
        }
    }

    static long roundUp(int size) {
        return ((size + LOCAL_SIZE - 1) / LOCAL_SIZE) * (long) LOCAL_SIZE;
    }
}
