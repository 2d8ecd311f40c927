package io.jobs4j.loop;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PeriodicLoopTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void countedLoopShouldRunBodyExactlyCountTimes() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        RecordingHooks hooks = new RecordingHooks();
        PeriodicLoop loop = new PeriodicLoop("counted", runs::incrementAndGet, hooks,
                LoopSchedule.interval(Duration.ofMillis(5)), 3, false, executor);

        loop.start().get(5, TimeUnit.SECONDS);

        assertEquals(3, runs.get());
        assertEquals(1, hooks.before.get());
        assertEquals(1, hooks.after.get());
        assertFalse(loop.isRunning());
    }

    @Test
    void countedLoopShouldFinishRightAfterLastBodyWithoutWaitingAnotherInterval() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        RecordingHooks hooks = new RecordingHooks();
        PeriodicLoop loop = new PeriodicLoop("single", runs::incrementAndGet, hooks,
                LoopSchedule.interval(Duration.ofSeconds(30)), 1, false, executor);

        loop.start().get(5, TimeUnit.SECONDS);

        assertEquals(1, runs.get());
        assertEquals(1, hooks.after.get());
    }

    @Test
    void stopWhileWaitingForNextIterationShouldNotRunBodyAgain() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch ran = new CountDownLatch(1);
        PeriodicLoop loop = new PeriodicLoop("waiting", () -> {
            runs.incrementAndGet();
            ran.countDown();
        }, new RecordingHooks(), LoopSchedule.interval(Duration.ofMillis(300)), null, false, executor);

        var finished = loop.start();
        assertTrue(ran.await(5, TimeUnit.SECONDS));
        loop.stop();
        finished.get(5, TimeUnit.SECONDS);

        assertEquals(1, runs.get());
    }

    @Test
    void stopShouldFinishCurrentIterationAndRunAfterHook() throws Exception {
        CountDownLatch inBody = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        RecordingHooks hooks = new RecordingHooks();
        PeriodicLoop loop = new PeriodicLoop("graceful", () -> {
            runs.incrementAndGet();
            inBody.countDown();
            release.await();
        }, hooks, LoopSchedule.immediate(), null, false, executor);

        var finished = loop.start();
        assertTrue(inBody.await(5, TimeUnit.SECONDS));
        loop.stop();
        release.countDown();
        finished.get(5, TimeUnit.SECONDS);

        assertEquals(1, runs.get());
        assertEquals(1, hooks.after.get());
    }

    @Test
    void cancelShouldInterruptBodyAndStillRunAfterHook() throws Exception {
        CountDownLatch inBody = new CountDownLatch(1);
        RecordingHooks hooks = new RecordingHooks();
        PeriodicLoop loop = new PeriodicLoop("cancelled", () -> {
            inBody.countDown();
            Thread.sleep(60_000);
        }, hooks, LoopSchedule.immediate(), null, false, executor);

        var finished = loop.start();
        assertTrue(inBody.await(5, TimeUnit.SECONDS));
        assertTrue(loop.cancel());
        finished.get(5, TimeUnit.SECONDS);

        assertEquals(1, hooks.after.get());
        assertEquals(0, hooks.errors.get());
        assertFalse(loop.cancel());
    }

    @Test
    void unexpectedFailureShouldEndRunThroughErrorHook() throws Exception {
        RecordingHooks hooks = new RecordingHooks();
        PeriodicLoop loop = new PeriodicLoop("failing", () -> {
            throw new IllegalStateException("boom");
        }, hooks, LoopSchedule.immediate(), null, true, executor);

        loop.start().get(5, TimeUnit.SECONDS);

        assertEquals(1, hooks.errors.get());
        assertInstanceOf(IllegalStateException.class, hooks.lastError.get());
        assertEquals(1, hooks.after.get());
    }

    @Test
    void whitelistedFailureWithoutReconnectShouldAlsoEndRun() throws Exception {
        RecordingHooks hooks = new RecordingHooks();
        PeriodicLoop loop = new PeriodicLoop("io", () -> {
            throw new IOException("network down");
        }, hooks, LoopSchedule.immediate(), null, false, executor);

        loop.start().get(5, TimeUnit.SECONDS);

        assertInstanceOf(IOException.class, hooks.lastError.get());
    }

    @Test
    void failingBeforeHookShouldSkipBodyAndAfterHook() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        RecordingHooks hooks = new RecordingHooks() {
            @Override
            public void beforeLoop() throws Exception {
                super.beforeLoop();
                throw new IllegalStateException("setup failed");
            }
        };
        PeriodicLoop loop = new PeriodicLoop("setup", runs::incrementAndGet, hooks,
                LoopSchedule.immediate(), null, false, executor);

        loop.start().get(5, TimeUnit.SECONDS);

        assertEquals(0, runs.get());
        assertEquals(0, hooks.after.get());
        assertEquals(0, hooks.errors.get());
    }

    @Test
    void startWhileRunningShouldFail() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        PeriodicLoop loop = new PeriodicLoop("busy", release::await, new RecordingHooks(),
                LoopSchedule.immediate(), 1, false, executor);

        var finished = loop.start();
        assertThrows(IllegalStateException.class, loop::start);
        release.countDown();
        finished.get(5, TimeUnit.SECONDS);
    }

    @Test
    void restartShouldBeginNewRunAfterCancelledOne() throws Exception {
        RecordingHooks hooks = new RecordingHooks();
        CountDownLatch firstRun = new CountDownLatch(1);
        CountDownLatch secondRun = new CountDownLatch(2);
        PeriodicLoop loop = new PeriodicLoop("restarting", () -> {
            firstRun.countDown();
            secondRun.countDown();
            Thread.sleep(60_000);
        }, hooks, LoopSchedule.immediate(), null, false, executor);

        loop.start();
        assertTrue(firstRun.await(5, TimeUnit.SECONDS));
        assertTrue(loop.restart());

        assertTrue(secondRun.await(5, TimeUnit.SECONDS));
        assertEquals(2, hooks.before.get());
        loop.cancel();
        loop.whenFinished().get(5, TimeUnit.SECONDS);
    }

    static class RecordingHooks implements LoopHooks {
        final AtomicInteger before = new AtomicInteger();
        final AtomicInteger after = new AtomicInteger();
        final AtomicInteger errors = new AtomicInteger();
        final AtomicReference<Exception> lastError = new AtomicReference<>();

        @Override
        public void beforeLoop() throws Exception {
            before.incrementAndGet();
        }

        @Override
        public void afterLoop() {
            after.incrementAndGet();
        }

        @Override
        public void onError(Exception error) {
            errors.incrementAndGet();
            lastError.set(error);
        }
    }
}
