package io.jobs4j;

import io.jobs4j.core.JobFlags;
import io.jobs4j.core.JobInitializationException;
import io.jobs4j.loop.LoopHooks;
import io.jobs4j.loop.LoopSchedule;
import io.jobs4j.loop.PeriodicLoop;
import io.jobs4j.utils.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * A looping job that runs on its own, without a {@link JobManager}.
 *
 * <p>Only the basic lifecycle is available: {@link #initialize()}, {@link #start()},
 * {@link #stop(boolean)} and {@link #restart()}. There are no permissions, guards, output fields
 * or events. Useful where a job wants to drive helper loops itself.
 *
 * <pre>{@code
 * MiniJob ticker = new MiniJob(Duration.ofSeconds(1)) {
 *     @Override
 *     protected void onRun() {
 *         externalData().merge("ticks", 1, (a, b) -> (int) a + (int) b);
 *     }
 * };
 * ticker.initialize();
 * ticker.start();
 * }</pre>
 */
public abstract class MiniJob {
    private static final Logger log = LoggerFactory.getLogger(MiniJob.class);

    private static final ExecutorService SHARED_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r);
        t.setName("jobs4j.minijob");
        t.setDaemon(true);
        return t;
    });

    private final String identifier;
    private final LoopSchedule initialSchedule;
    private final Integer count;
    private final boolean reconnect;
    private final ExecutorService executor;
    private final JobFlags flags = new JobFlags();
    private final Map<String, Object> externalData = new ConcurrentHashMap<>();
    private final Object stateLock = new Object();

    private volatile PeriodicLoop loop;
    private volatile int loopCount;
    private volatile Instant idlingSince;

    protected MiniJob() {
        this(LoopSchedule.immediate(), null, true, null);
    }

    protected MiniJob(Duration interval) {
        this(LoopSchedule.interval(interval), null, true, null);
    }

    protected MiniJob(Duration interval, Integer count) {
        this(LoopSchedule.interval(interval), count, true, null);
    }

    /**
     * @param count     number of run iterations per start, {@code null} for unlimited
     * @param reconnect retry transient failures with backoff instead of stopping
     * @param executor  runs the loop; {@code null} uses a shared daemon pool
     */
    protected MiniJob(LoopSchedule schedule, Integer count, boolean reconnect, ExecutorService executor) {
        this.initialSchedule = Objects.requireNonNull(schedule, "schedule must not be null");
        if (count != null && count <= 0) {
            throw new IllegalArgumentException("count must be positive or null");
        }
        this.count = count;
        this.reconnect = reconnect;
        this.executor = executor != null ? executor : SHARED_EXECUTOR;
        this.identifier = getClass().getSimpleName() + "-" + Timestamps.uniqueNowNanos();
    }

    /* ==== hooks ==== */

    protected void onInit() throws Exception {
    }

    protected void onStart() throws Exception {
    }

    protected abstract void onRun() throws Exception;

    protected void onStop() throws Exception {
    }

    protected void onRunError(Exception error) {
        log.warn("minijob run failed id={} msg={}", identifier, error.getMessage(), error);
    }

    /* ==== lifecycle ==== */

    /**
     * Runs {@link #onInit()} once.
     *
     * @throws JobInitializationException if already initialized, or if {@code onInit} fails
     */
    public final void initialize() {
        synchronized (stateLock) {
            if (flags.hasAny(JobFlags.INITIALIZED | JobFlags.IS_INITIALIZING)) {
                throw new JobInitializationException("minijob " + identifier + " has already been initialized");
            }
            flags.set(JobFlags.IS_INITIALIZING);
        }
        try {
            onInit();
            flags.set(JobFlags.INITIALIZED);
            log.debug("minijob initialized id={}", identifier);
        } catch (Exception e) {
            throw new JobInitializationException("minijob " + identifier + " failed to initialize: "
                    + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } finally {
            flags.clear(JobFlags.IS_INITIALIZING);
        }
    }

    /**
     * @return false if already running
     * @throws JobInitializationException if not initialized
     */
    public final boolean start() {
        synchronized (stateLock) {
            if (!flags.has(JobFlags.INITIALIZED)) {
                throw new JobInitializationException("minijob " + identifier + " was not initialized");
            }
            PeriodicLoop current = loop;
            if (current != null && current.isRunning()) {
                return false;
            }
            if (current == null) {
                current = new PeriodicLoop(identifier, this::runIteration, new Hooks(), initialSchedule, count,
                        reconnect, executor);
                loop = current;
            }
            current.start();
            log.debug("minijob started id={}", identifier);
            return true;
        }
    }

    /**
     * A forced stop interrupts the loop; otherwise it ends after the iteration in progress, or
     * right away while waiting for the next one.
     *
     * @return false if not running
     */
    public final boolean stop(boolean force) {
        synchronized (stateLock) {
            PeriodicLoop current = loop;
            if (current == null || !current.isRunning()) {
                return false;
            }
            if (force) {
                return current.cancel();
            }
            current.stop();
            return true;
        }
    }

    public final boolean stop() {
        return stop(false);
    }

    /**
     * Stops the loop and starts it again once the stop has completed. A job that is not running
     * is simply started.
     */
    public final boolean restart() {
        synchronized (stateLock) {
            PeriodicLoop current = loop;
            if (current == null || !current.isRunning()) {
                return start();
            }
            return current.restart();
        }
    }

    /**
     * Completes once the current run has stopped, or right away if nothing runs.
     */
    public final CompletableFuture<Void> whenStopped() {
        PeriodicLoop current = loop;
        return current != null ? current.whenFinished() : CompletableFuture.completedFuture(null);
    }

    /* ==== accessors ==== */

    public final String identifier() {
        return identifier;
    }

    public final boolean isInitialized() {
        return flags.has(JobFlags.INITIALIZED);
    }

    public final boolean isRunning() {
        PeriodicLoop current = loop;
        return current != null && current.isRunning();
    }

    public final boolean isIdling() {
        return flags.has(JobFlags.IS_IDLING);
    }

    public final Instant idlingSince() {
        return idlingSince;
    }

    /**
     * Completed runs across all starts.
     */
    public final int loopCount() {
        return loopCount;
    }

    public final Instant nextIteration() {
        PeriodicLoop current = loop;
        return current != null ? current.nextIteration() : null;
    }

    public final LoopSchedule getSchedule() {
        PeriodicLoop current = loop;
        return current != null ? current.schedule() : initialSchedule;
    }

    /**
     * Takes effect from the next computed iteration.
     */
    public final void changeSchedule(LoopSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        PeriodicLoop current = loop;
        if (current == null) {
            throw new IllegalStateException("minijob " + identifier + " was never started");
        }
        current.changeSchedule(schedule);
    }

    /**
     * Free-form data for readers outside the job.
     */
    public final Map<String, Object> externalData() {
        return externalData;
    }

    private void runIteration() throws Exception {
        flags.clear(JobFlags.IS_IDLING);
        idlingSince = null;
        onRun();
        LoopSchedule schedule = loop.schedule();
        if (schedule.isWallClock() || !schedule.interval().isZero()) {
            flags.set(JobFlags.IS_IDLING);
            idlingSince = Instant.now();
        }
        loopCount++;
    }

    private final class Hooks implements LoopHooks {

        @Override
        public void beforeLoop() throws Exception {
            flags.clear(JobFlags.STOPPED | JobFlags.IS_IDLING);
            onStart();
        }

        @Override
        public void onError(Exception error) {
            onRunError(error);
        }

        @Override
        public void afterLoop() {
            flags.clear(JobFlags.IS_IDLING);
            idlingSince = null;
            try {
                onStop();
            } catch (Exception e) {
                log.warn("minijob stop failed id={} msg={}", identifier, e.getMessage(), e);
            } finally {
                flags.set(JobFlags.STOPPED);
                log.debug("minijob stopped id={} loops={}", identifier, loopCount);
            }
        }
    }

    @Override
    public String toString() {
        return "MiniJob{id=" + identifier + ", running=" + isRunning() + "}";
    }
}
