package me.golemcore.courier.domain.service;

import me.golemcore.courier.domain.model.JobId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobLocksTest {

    private static final JobId JOB = JobId.of("U1", "2024-01-01 00:00:00");

    private JobLocks jobLocks;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        jobLocks = new JobLocks();
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void returnsActionResultAndReleasesEntry() {
        assertEquals("done", jobLocks.withLock(JOB, () -> "done"));
        assertEquals(0, jobLocks.size());
    }

    @Test
    void oneShotIdsDoNotAccumulate() {
        for (int i = 0; i < 10_000; i++) {
            jobLocks.withLock(JobId.of("U1", "bogus " + i), () -> {
            });
        }

        assertEquals(0, jobLocks.size());
    }

    @Test
    void entryIsReleasedWhenActionThrows() {
        assertThrows(IllegalStateException.class, () -> jobLocks.withLock(JOB, () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, jobLocks.size());
    }

    @Test
    void sameJobIsMutuallyExclusive() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < 8; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int j = 0; j < 200; j++) {
                    jobLocks.withLock(JOB, () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        inside.decrementAndGet();
                    });
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertEquals(1, maxInside.get());
        assertEquals(0, jobLocks.size());
    }

    @Test
    void waiterRunsAfterHolderAndEntryIsReleased() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger order = new AtomicInteger();

        Future<?> holder = executor.submit(() -> jobLocks.withLock(JOB, () -> {
            holding.countDown();
            awaitQuietly(release);
            order.compareAndSet(0, 1);
        }));
        assertTrue(holding.await(5, TimeUnit.SECONDS));
        Future<?> waiter = executor.submit(() -> jobLocks.withLock(JOB, () -> {
            order.compareAndSet(1, 2);
        }));

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        waiter.get(5, TimeUnit.SECONDS);

        assertEquals(2, order.get());
        assertEquals(0, jobLocks.size());
    }

    @Test
    void differentJobsProceedInParallel() throws Exception {
        JobId other = JobId.of("U2", "2024-01-01 00:00:00");
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> blocked = executor.submit(() -> jobLocks.withLock(JOB, () -> {
            holding.countDown();
            awaitQuietly(release);
        }));
        assertTrue(holding.await(5, TimeUnit.SECONDS));

        Future<String> free = executor.submit(() -> jobLocks.withLock(other, () -> "ran"));
        assertEquals("ran", free.get(5, TimeUnit.SECONDS));
        assertFalse(blocked.isDone());

        release.countDown();
        blocked.get(5, TimeUnit.SECONDS);
        assertEquals(0, jobLocks.size());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("interrupted");
        }
    }
}
