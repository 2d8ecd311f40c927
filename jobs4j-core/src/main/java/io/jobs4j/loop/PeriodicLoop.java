package io.jobs4j.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Repeatedly invokes a {@link LoopBody} on a thread of the given executor.
 *
 * <p>Run order: {@link LoopHooks#beforeLoop()}, then the body at the configured
 * {@link LoopSchedule}, then {@link LoopHooks#afterLoop()}. Iterations of one loop never overlap.
 *
 * <ul>
 *   <li>{@link #stop()} lets the current iteration finish and ends the run afterwards.</li>
 *   <li>{@link #cancel()} interrupts the running thread immediately. The after hook still runs.</li>
 *   <li>{@link #restart()} cancels and starts again once the cancelled run has fully finished.</li>
 * </ul>
 *
 * <p>A body failure whose type is whitelisted is retried with {@link ExponentialBackoff} when
 * reconnecting is enabled; any other failure ends the run and is handed to
 * {@link LoopHooks#onError(Exception)}. A failure in the before hook ends the run without
 * calling the error or after hooks; its owner is expected to clean up itself.
 */
public class PeriodicLoop {
    private static final Logger log = LoggerFactory.getLogger(PeriodicLoop.class);

    public static final Set<Class<? extends Exception>> DEFAULT_EXCEPTION_WHITELIST = Set.of(
            IOException.class,
            UncheckedIOException.class,
            TimeoutException.class
    );

    private final String name;
    private final LoopBody body;
    private final LoopHooks hooks;
    private final ExecutorService executor;
    private final Set<Class<? extends Exception>> exceptionWhitelist =
            new CopyOnWriteArraySet<>(DEFAULT_EXCEPTION_WHITELIST);

    private volatile LoopSchedule schedule;
    private volatile Integer count;
    private volatile boolean reconnect;

    private final Object monitor = new Object();
    private CompletableFuture<Void> completion;
    private Thread runner;
    private boolean finishing;

    private volatile boolean stopNextIteration;
    private volatile boolean cancelRequested;
    private volatile boolean beingCancelled;
    private volatile boolean failed;
    private volatile boolean lastIterationFailed;
    private volatile int currentLoop;
    private volatile Instant nextIteration;
    private volatile Instant lastIteration;

    public PeriodicLoop(String name,
                        LoopBody body,
                        LoopHooks hooks,
                        LoopSchedule schedule,
                        Integer count,
                        boolean reconnect,
                        ExecutorService executor) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        if (count != null && count <= 0) {
            throw new IllegalArgumentException("count must be positive or null");
        }
        this.count = count;
        this.reconnect = reconnect;
    }

    /**
     * Starts a new run.
     *
     * @return a future completed once the run, including its after hook, has finished
     * @throws IllegalStateException if a run is already in progress
     */
    public CompletableFuture<Void> start() {
        synchronized (monitor) {
            if (isRunning()) {
                throw new IllegalStateException("loop " + name + " is already running");
            }
            stopNextIteration = false;
            cancelRequested = false;
            beingCancelled = false;
            failed = false;
            lastIterationFailed = false;
            finishing = false;
            currentLoop = 0;
            completion = new CompletableFuture<>();
            CompletableFuture<Void> current = completion;
            executor.execute(() -> runLoop(current));
            return current;
        }
    }

    /**
     * Ends the run gracefully after the iteration in progress.
     */
    public void stop() {
        if (isRunning()) {
            stopNextIteration = true;
        }
    }

    /**
     * Interrupts the run. No-op if nothing runs or the run is already finishing.
     *
     * @return whether a cancellation was issued
     */
    public boolean cancel() {
        synchronized (monitor) {
            if (!isRunning() || finishing || cancelRequested) {
                return false;
            }
            cancelRequested = true;
            if (runner != null) {
                runner.interrupt();
            }
            return true;
        }
    }

    /**
     * Cancels the run and starts a new one once it has finished.
     */
    public boolean restart() {
        CompletableFuture<Void> current;
        synchronized (monitor) {
            if (!isRunning() || finishing || cancelRequested) {
                return false;
            }
            current = completion;
        }
        current.thenRun(this::start);
        return cancel();
    }

    public boolean isRunning() {
        synchronized (monitor) {
            return completion != null && !completion.isDone();
        }
    }

    /**
     * Future of the run in progress, or an already completed future if nothing runs.
     */
    public CompletableFuture<Void> whenFinished() {
        synchronized (monitor) {
            return completion != null ? completion : CompletableFuture.completedFuture(null);
        }
    }

    public boolean isBeingCancelled() {
        return cancelRequested || beingCancelled;
    }

    public boolean failed() {
        return failed;
    }

    public int currentLoop() {
        return currentLoop;
    }

    public Integer count() {
        return count;
    }

    public boolean reconnect() {
        return reconnect;
    }

    public void setReconnect(boolean reconnect) {
        this.reconnect = reconnect;
    }

    public Instant nextIteration() {
        return isRunning() ? nextIteration : null;
    }

    public Instant lastIteration() {
        return lastIteration;
    }

    public LoopSchedule schedule() {
        return schedule;
    }

    /**
     * Takes effect from the next computed iteration.
     */
    public void changeSchedule(LoopSchedule schedule) {
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
    }

    @SafeVarargs
    public final void addExceptionTypes(Class<? extends Exception>... types) {
        for (Class<? extends Exception> type : types) {
            exceptionWhitelist.add(Objects.requireNonNull(type, "types must not contain null"));
        }
    }

    @SafeVarargs
    public final boolean removeExceptionTypes(Class<? extends Exception>... types) {
        boolean removed = false;
        for (Class<? extends Exception> type : types) {
            removed |= exceptionWhitelist.remove(type);
        }
        return removed;
    }

    public void clearExceptionTypes() {
        exceptionWhitelist.clear();
    }

    public Set<Class<? extends Exception>> exceptionTypes() {
        return Set.copyOf(exceptionWhitelist);
    }

    private boolean isWhitelisted(Exception e) {
        for (Class<? extends Exception> type : exceptionWhitelist) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }

    private void runLoop(CompletableFuture<Void> current) {
        synchronized (monitor) {
            runner = Thread.currentThread();
        }
        boolean runAfterHook = true;
        ExponentialBackoff backoff = null;
        try {
            checkCancelled();
            try {
                hooks.beforeLoop();
            } catch (Exception e) {
                if (cancelRequested || e instanceof InterruptedException) {
                    throw new LoopCancelledException();
                }
                runAfterHook = false;
                log.debug("loop before hook failed name={} msg={}", name, e.getMessage());
                return;
            }
            checkCancelled();

            LoopSchedule active = schedule;
            nextIteration = active.isWallClock() ? active.next(Instant.now()) : Instant.now();

            while (true) {
                active = schedule;
                if (active.isWallClock()) {
                    sleepUntil(nextIteration);
                }
                if (!lastIterationFailed) {
                    lastIteration = nextIteration;
                    nextIteration = nextAfter(active, lastIteration);
                    while (active.isWallClock() && !nextIteration.isAfter(lastIteration)) {
                        log.warn("clock drift detected name={} now={} target={}", name, Instant.now(), nextIteration);
                        sleepUntil(nextIteration);
                        nextIteration = nextAfter(active, lastIteration);
                    }
                }

                try {
                    body.run();
                    lastIterationFailed = false;
                } catch (Exception e) {
                    if (cancelRequested || e instanceof InterruptedException) {
                        throw new LoopCancelledException();
                    }
                    if (!isWhitelisted(e)) {
                        throw e;
                    }
                    lastIterationFailed = true;
                    if (!reconnect) {
                        throw e;
                    }
                    if (backoff == null) {
                        backoff = new ExponentialBackoff();
                    }
                    Duration delay = backoff.delay();
                    log.warn("loop iteration failed, reconnecting name={} delay={} msg={}", name, delay, e.getMessage());
                    sleep(delay);
                    continue;
                }

                checkCancelled();
                if (stopNextIteration) {
                    return;
                }
                currentLoop++;
                Integer limit = count;
                if (limit != null && currentLoop == limit) {
                    break;
                }

                if (!active.isWallClock()) {
                    sleepUntil(nextIteration);
                    if (stopNextIteration) {
                        return;
                    }
                }
            }
        } catch (LoopCancelledException e) {
            beingCancelled = true;
        } catch (Exception e) {
            failed = true;
            try {
                hooks.onError(e);
            } catch (RuntimeException hookError) {
                log.warn("loop error hook failed name={} msg={}", name, hookError.getMessage(), hookError);
            }
        } finally {
            synchronized (monitor) {
                finishing = true;
            }
            // a late cancel() must not leak into the after hook
            Thread.interrupted();
            if (runAfterHook) {
                try {
                    hooks.afterLoop();
                } catch (Exception e) {
                    log.debug("loop after hook failed name={} msg={}", name, e.getMessage());
                }
            }
            currentLoop = 0;
            stopNextIteration = false;
            beingCancelled = false;
            cancelRequested = false;
            failed = false;
            synchronized (monitor) {
                runner = null;
            }
            current.complete(null);
        }
    }

    private static Instant nextAfter(LoopSchedule schedule, Instant last) {
        if (schedule.isWallClock()) {
            Instant now = Instant.now();
            return schedule.next(now.isAfter(last) ? now : last);
        }
        return schedule.next(last);
    }

    private void checkCancelled() {
        if (cancelRequested || Thread.currentThread().isInterrupted()) {
            throw new LoopCancelledException();
        }
    }

    private void sleepUntil(Instant target) {
        if (target == null) {
            return;
        }
        sleep(Duration.between(Instant.now(), target));
    }

    private void sleep(Duration duration) {
        long ms = duration.toMillis();
        if (ms <= 0) {
            checkCancelled();
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            throw new LoopCancelledException();
        }
    }

    @Override
    public String toString() {
        return "PeriodicLoop{name=" + name + ", schedule=" + schedule + ", running=" + isRunning() + "}";
    }

    private static final class LoopCancelledException extends RuntimeException {
        private LoopCancelledException() {
            super(null, null, false, false);
        }
    }
}
