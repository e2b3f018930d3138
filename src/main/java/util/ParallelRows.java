package util;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Splits a row range across a bounded worker pool and joins before returning.
 *
 * Each band owns a disjoint range of rows, so kernels write without locking.
 * Calls made from inside a worker run serially on that worker.
 */
public final class ParallelRows {

    /** Body for rows {@code [y0, y1)}. */
    @FunctionalInterface
    public interface RowBand {
        void run(int y0, int y1);
    }

    public static final int MAX_WORKERS = 4;

    private static final int CORES = Math.max(1, Runtime.getRuntime().availableProcessors());
    private static final int WORKERS = Math.min(MAX_WORKERS, CORES);

    private static final ThreadLocal<Boolean> IN_WORKER = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private static final ThreadPoolExecutor POOL = createPool();

    private ParallelRows() {
    }

    private static ThreadPoolExecutor createPool() {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(() -> {
                IN_WORKER.set(Boolean.TRUE);
                r.run();
            }, "kernel-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                WORKERS, WORKERS, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(2, CORES * 2)), tf,
                new ThreadPoolExecutor.CallerRunsPolicy());
        exec.allowCoreThreadTimeOut(true);
        return exec;
    }

    public static int workers() {
        return WORKERS;
    }

    /**
     * Run {@code body} over {@code [0, height)}, split into at most {@link #workers()} bands.
     * Exceptions thrown by a band are rethrown here after every band has finished.
     */
    public static void forRows(int height, RowBand body) {
        forRows(height, WORKERS, body);
    }

    public static void forRows(int height, int maxBands, RowBand body) {
        if (height <= 0)
            return;
        int bands = Math.max(1, Math.min(Math.min(maxBands, WORKERS), height));
        if (bands == 1 || IN_WORKER.get()) {
            body.run(0, height);
            return;
        }

        int rowsPer = (height + bands - 1) / bands;
        CountDownLatch latch = new CountDownLatch(bands);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        for (int i = 0; i < bands; i++) {
            final int y0 = i * rowsPer;
            final int y1 = Math.min(height, y0 + rowsPer);
            POOL.execute(() -> {
                try {
                    if (y0 < y1 && failure.get() == null)
                        body.run(y0, y1);
                } catch (Throwable t) {
                    failure.compareAndSet(null, t);
                } finally {
                    latch.countDown();
                }
            });
        }

        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for row workers", e);
        }

        Throwable t = failure.get();
        if (t instanceof RuntimeException re)
            throw re;
        if (t instanceof Error err)
            throw err;
        if (t != null)
            throw new IllegalStateException(t);
    }
}
