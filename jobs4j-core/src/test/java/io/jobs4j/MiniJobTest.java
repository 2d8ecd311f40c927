package io.jobs4j;

import io.jobs4j.core.JobInitializationException;
import io.jobs4j.loop.LoopSchedule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MiniJobTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    static class CountingMiniJob extends MiniJob {
        final AtomicInteger inits = new AtomicInteger();
        final AtomicInteger starts = new AtomicInteger();
        final AtomicInteger runs = new AtomicInteger();
        final AtomicInteger stops = new AtomicInteger();
        final CountDownLatch firstRun = new CountDownLatch(1);

        CountingMiniJob(LoopSchedule schedule, Integer count, ExecutorService executor) {
            super(schedule, count, false, executor);
        }

        @Override
        protected void onInit() {
            inits.incrementAndGet();
        }

        @Override
        protected void onStart() {
            starts.incrementAndGet();
        }

        @Override
        protected void onRun() {
            runs.incrementAndGet();
            firstRun.countDown();
        }

        @Override
        protected void onStop() {
            stops.incrementAndGet();
        }
    }

    @Test
    void startShouldRequireInitializationAndInitializeOnlyOnce() {
        CountingMiniJob job = new CountingMiniJob(LoopSchedule.immediate(), 1, executor);

        assertThrows(JobInitializationException.class, job::start);

        job.initialize();
        assertTrue(job.isInitialized());
        assertEquals(1, job.inits.get());
        assertThrows(JobInitializationException.class, job::initialize);
        assertEquals(1, job.inits.get());
    }

    @Test
    void failingInitHookShouldRaiseInitializationError() {
        MiniJob job = new MiniJob(LoopSchedule.immediate(), 1, false, executor) {
            @Override
            protected void onInit() {
                throw new IllegalStateException("no config");
            }

            @Override
            protected void onRun() {
            }
        };

        JobInitializationException error = assertThrows(JobInitializationException.class, job::initialize);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertFalse(job.isInitialized());
    }

    @Test
    void countedMiniJobShouldRunCountTimesBetweenStartAndStopHooks() throws Exception {
        CountingMiniJob job = new CountingMiniJob(LoopSchedule.interval(Duration.ofMillis(5)), 3, executor);
        job.initialize();

        assertTrue(job.start());
        job.whenStopped().get(5, TimeUnit.SECONDS);

        assertEquals(3, job.runs.get());
        assertEquals(3, job.loopCount());
        assertEquals(1, job.starts.get());
        assertEquals(1, job.stops.get());
        assertFalse(job.isRunning());
    }

    @Test
    void gracefulStopWhileIdlingShouldEndWithoutAnotherRun() throws Exception {
        CountingMiniJob job = new CountingMiniJob(LoopSchedule.interval(Duration.ofMillis(300)), null, executor);
        job.initialize();
        job.start();
        assertTrue(job.firstRun.await(5, TimeUnit.SECONDS));

        assertTrue(job.stop());
        job.whenStopped().get(5, TimeUnit.SECONDS);

        assertEquals(1, job.runs.get());
        assertEquals(1, job.stops.get());
        assertFalse(job.isIdling());
        assertFalse(job.stop());
    }

    @Test
    void forcedStopShouldInterruptBlockingRunAndStillRunStopHook() throws Exception {
        CountDownLatch inRun = new CountDownLatch(1);
        AtomicInteger stops = new AtomicInteger();
        MiniJob job = new MiniJob(LoopSchedule.immediate(), null, false, executor) {
            @Override
            protected void onRun() throws Exception {
                inRun.countDown();
                Thread.sleep(60_000);
            }

            @Override
            protected void onStop() {
                stops.incrementAndGet();
            }
        };
        job.initialize();
        job.start();
        assertTrue(inRun.await(5, TimeUnit.SECONDS));

        assertTrue(job.stop(true));
        job.whenStopped().get(5, TimeUnit.SECONDS);

        assertEquals(1, stops.get());
        assertFalse(job.isRunning());
    }

    @Test
    void restartShouldRunStartHookAgain() throws Exception {
        CountingMiniJob job = new CountingMiniJob(LoopSchedule.interval(Duration.ofSeconds(30)), null, executor);
        job.initialize();
        job.start();
        assertTrue(job.firstRun.await(5, TimeUnit.SECONDS));

        assertTrue(job.restart());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (job.runs.get() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(2, job.runs.get());
        assertEquals(2, job.starts.get());
        assertEquals(1, job.stops.get());

        job.stop(true);
        job.whenStopped().get(5, TimeUnit.SECONDS);
    }

    @Test
    void restartOfStoppedMiniJobShouldStartIt() throws Exception {
        CountingMiniJob job = new CountingMiniJob(LoopSchedule.immediate(), 1, executor);
        job.initialize();

        assertTrue(job.restart());
        assertTrue(job.firstRun.await(5, TimeUnit.SECONDS));
        job.whenStopped().get(5, TimeUnit.SECONDS);

        assertEquals(1, job.runs.get());
    }
}
