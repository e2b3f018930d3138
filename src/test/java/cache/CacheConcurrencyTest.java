package cache;

import image.LinearImage;
import image.Rgba8Buffer;
import image.TestImages;
import org.junit.Test;
import params.AdjustmentParameters;
import params.ParameterHash;
import params.ParameterHasher;

import java.util.Arrays;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static pipeline.ProcessingStage.EFFECTS;

public class CacheConcurrencyTest {

    private static final int READERS = 4;
    private static final int KEYS = 8;
    private static final int WRITES = 2000;

    @Test
    public void stageCacheReadersSeeWholeEntriesWhileWriterEvicts() throws Exception {
        StageCache cache = new StageCache(3, true);
        ParameterHash[] hashes = new ParameterHash[KEYS];
        LinearImage[] images = new LinearImage[KEYS];
        long[] checksums = new long[KEYS];
        for (int i = 0; i < KEYS; i++) {
            hashes[i] = ParameterHasher.hash(EFFECTS, AdjustmentParameters.builder().clarity(i).build());
            images[i] = TestImages.noise(16, 12, i);
            checksums[i] = images[i].contentHash();
        }

        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
        AtomicInteger hits = new AtomicInteger();
        run(failures, () -> {
            for (int n = 0; n < WRITES; n++) {
                int k = n % KEYS;
                cache.putIfCurrent(EFFECTS, hashes[k], "up", images[k], () -> true);
            }
        }, () -> {
            ThreadLocalRandom rnd = ThreadLocalRandom.current();
            int k = rnd.nextInt(KEYS);
            Optional<LinearImage> hit = cache.get(EFFECTS, hashes[k], "up");
            if (hit.isPresent()) {
                hits.incrementAndGet();
                assertEquals(checksums[k], hit.get().contentHash());
                assertArrayEquals(images[k].r(), hit.get().r(), 0f);
            }
            assertTrue(cache.size() <= 3);
            assertTrue(cache.bytes() <= 3 * images[0].byteSize());
        });

        assertTrue("no failures: " + failures, failures.isEmpty());
        assertEquals(0, cache.corruptions());
        assertTrue(cache.size() <= 3);
        assertEquals(hits.get(), cache.hits());
    }

    @Test
    public void previewCacheStaysWithinBudgetUnderConcurrentAccess() throws Exception {
        int bufBytes = 8 * 8 * 4;
        PreviewCache cache = new PreviewCache(3L * bufBytes);
        Rgba8Buffer[] bufs = new Rgba8Buffer[KEYS];
        for (int i = 0; i < KEYS; i++) {
            byte[] data = new byte[bufBytes];
            Arrays.fill(data, (byte) i);
            bufs[i] = new Rgba8Buffer(8, 8, data);
        }

        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
        run(failures, () -> {
            for (int n = 0; n < WRITES; n++)
                cache.put("id" + (n % KEYS), bufs[n % KEYS]);
        }, () -> {
            int k = ThreadLocalRandom.current().nextInt(KEYS);
            cache.get("id" + k).ifPresent(b -> assertArrayEquals(bufs[k].data(), b.data()));
            assertTrue(cache.size() <= 3);
            assertTrue(cache.bytes() <= cache.maxBytes());
        });

        assertTrue("no failures: " + failures, failures.isEmpty());
        assertEquals(cache.size() * (long) bufBytes, cache.bytes());
    }

    /** One writer runs to completion while readers loop until it finishes. */
    private static void run(Queue<Throwable> failures, Runnable writer, Runnable readStep) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(READERS + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        try {
            for (int r = 0; r < READERS; r++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        while (writing.get())
                            readStep.run();
                    } catch (Throwable t) {
                        failures.add(t);
                    }
                });
            }
            pool.execute(() -> {
                try {
                    start.await();
                    writer.run();
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    writing.set(false);
                }
            });
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        }
    }
}
