package com.watersort.visualizer.simulation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SolveWorkerTest {

    @Test
    void refusesSecondJobUntilFirstReturns() throws InterruptedException {
        SolveWorker worker = new SolveWorker("solve-worker-test", Runnable::run);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch idle = new CountDownLatch(1);
        AtomicInteger secondRuns = new AtomicInteger();

        assertTrue(worker.start(() -> {
            started.countDown();
            awaitQuietly(release);
        }, idle::countDown));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(worker.isBusy());
        assertFalse(worker.start(secondRuns::incrementAndGet, () -> { }));

        release.countDown();
        assertTrue(idle.await(5, TimeUnit.SECONDS));
        assertFalse(worker.isBusy());
        assertEquals(0, secondRuns.get());
    }

    @Test
    void interruptedJobStillKeepsWorkerBusyUntilItReturns() throws InterruptedException {
        SolveWorker worker = new SolveWorker("solve-worker-test", Runnable::run);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch idle = new CountDownLatch(1);
        Thread[] jobThread = new Thread[1];

        worker.start(() -> {
            jobThread[0] = Thread.currentThread();
            started.countDown();
            // Ignores interrupts the way a budget-bound search does.
            while (release.getCount() > 0) {
                Thread.onSpinWait();
            }
        }, idle::countDown);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        jobThread[0].interrupt();
        assertFalse(idle.await(100, TimeUnit.MILLISECONDS));
        assertTrue(worker.isBusy());

        release.countDown();
        assertTrue(idle.await(5, TimeUnit.SECONDS));
        assertFalse(worker.isBusy());
    }

    @Test
    void failingJobReleasesWorker() throws InterruptedException {
        SolveWorker worker = new SolveWorker("solve-worker-test", Runnable::run);
        CountDownLatch idle = new CountDownLatch(1);

        assertTrue(worker.start(() -> {
            throw new IllegalStateException("boom");
        }, idle::countDown));

        assertTrue(idle.await(5, TimeUnit.SECONDS));
        assertFalse(worker.isBusy());
        CountDownLatch second = new CountDownLatch(1);
        assertTrue(worker.start(second::countDown, () -> { }));
        assertTrue(second.await(5, TimeUnit.SECONDS));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
