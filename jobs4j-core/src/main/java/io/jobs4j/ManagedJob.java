package io.jobs4j;

import io.jobs4j.core.JobException;
import io.jobs4j.core.JobFlags;
import io.jobs4j.core.JobInitializationException;
import io.jobs4j.core.JobIsDoneException;
import io.jobs4j.core.JobIsGuardedException;
import io.jobs4j.core.JobPermissionLevel;
import io.jobs4j.core.JobStateException;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.JobStopReason;
import io.jobs4j.loop.LoopHooks;
import io.jobs4j.loop.LoopSchedule;
import io.jobs4j.loop.PeriodicLoop;
import io.jobs4j.mixins.EventSource;
import io.jobs4j.mixins.JobMixin;
import io.jobs4j.mixins.MixinHost;
import io.jobs4j.utils.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A job driven by a {@link PeriodicLoop} and owned by a {@link JobManager}.
 *
 * <p>Lifecycle: created by the manager, initialized once ({@link #onInit()}), registered, then
 * started any number of times. Every start runs {@link #onStart()}, then {@link #onRun()} per loop
 * iteration, then {@link #onStop()}. A job ends for good when it completes or is killed; it is then
 * ejected from its manager and its {@link JobProxy} switches to a cached snapshot.
 *
 * <p>Jobs never touch other jobs directly. They use {@link #manager()} to get proxies and to
 * operate on other jobs, with every call checked against their permission level.
 *
 * <p>Subclass {@link IntervalJob}, {@link EventJob} or {@link MultiEventJob} rather than this
 * class.
 */
public abstract class ManagedJob {
    private static final Logger log = LoggerFactory.getLogger(ManagedJob.class);

    private static final Map<Class<?>, Long> CLASS_FIRST_SEEN = new ConcurrentHashMap<>();
    private static final Map<Class<?>, Map<String, Method>> PUBLIC_METHODS = new ConcurrentHashMap<>();

    /* ==== identity ==== */
    private final String identifier;
    private final Instant createdAt = Instant.now();
    private final JobFlags flags = new JobFlags();
    private final Map<String, Object> data = new ConcurrentHashMap<>();
    private final JobProxy proxy;
    private final MixinHost mixinHost = new Host();
    private final List<JobMixin> mixins = new CopyOnWriteArrayList<>();

    private final Object stateLock = new Object();

    /* ==== manager relation ==== */
    private volatile JobManager manager;
    private volatile JobManagerProxy managerProxy;
    private volatile ManagedJob creator;
    private volatile ManagedJob guardian;
    private final Set<ManagedJob> guardedJobs = ConcurrentHashMap.newKeySet();
    private volatile JobPermissionLevel permissionLevel;
    private volatile boolean registered;
    private volatile String scheduleIdentifier;
    private volatile Duration pendingStopTimeout;

    /* ==== loop ==== */
    private final LoopSchedule initialSchedule;
    private final Integer count;
    private final boolean reconnect;
    private volatile PeriodicLoop loop;
    private volatile int loopCount;

    /* ==== timestamps ==== */
    private volatile Instant registeredAt;
    private volatile Instant initializedSince;
    private volatile Instant runningSince;
    private volatile Instant stoppedSince;
    private volatile Instant idlingSince;
    private volatile Instant completedAt;
    private volatile Instant killedAt;

    /* ==== errors ==== */
    private volatile Exception startException;
    private volatile Exception runException;
    private volatile Exception stopException;
    private volatile JobStopReason lastStoppingReason;

    /* ==== waiters, guarded by stateLock ==== */
    private final List<CompletableFuture<JobStatus>> doneFutures = new ArrayList<>();
    private final List<CompletableFuture<JobStatus>> stopFutures = new ArrayList<>();
    private final List<CompletableFuture<Void>> unguardFutures = new ArrayList<>();
    private final Map<String, List<CompletableFuture<Object>>> outputFieldFutures = new LinkedHashMap<>();
    private final Map<String, List<QueueWaiter>> outputQueueFutures = new LinkedHashMap<>();

    /* ==== outputs ==== */
    private final Set<String> outputFieldNames;
    private final Set<String> outputQueueNames;
    private final Map<String, Object> outputFields = new ConcurrentHashMap<>();
    private final Map<String, List<Object>> outputQueues = new ConcurrentHashMap<>();
    private final List<JobOutputQueueProxy> outputQueueProxies = new CopyOnWriteArrayList<>();

    ManagedJob(LoopSchedule schedule, Integer count, boolean reconnect) {
        this.initialSchedule = Objects.requireNonNull(schedule, "schedule must not be null");
        if (count != null && count <= 0) {
            throw new IllegalArgumentException("count must be positive or null");
        }
        this.count = count;
        this.reconnect = reconnect;

        Class<?> cls = getClass();
        long classSeen = CLASS_FIRST_SEEN.computeIfAbsent(cls, c -> Timestamps.uniqueNowNanos());
        this.identifier = cls.getSimpleName() + "-" + classSeen + "-" + Timestamps.uniqueNowNanos();

        JobMetadata metadata = cls.getAnnotation(JobMetadata.class);
        this.outputFieldNames = metadata != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(metadata.outputFields())))
                : Set.of();
        this.outputQueueNames = metadata != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(metadata.outputQueues())))
                : Set.of();
        for (String name : outputQueueNames) {
            outputQueues.put(name, new CopyOnWriteArrayList<>());
        }
        this.proxy = new JobProxy(this);
    }

    /* ==== hooks ==== */

    /**
     * One-shot setup, run when the manager initializes the job.
     */
    protected void onInit() throws Exception {
    }

    protected void onStart() throws Exception {
    }

    protected abstract void onRun() throws Exception;

    protected void onStop() throws Exception {
    }

    protected void onStartError(Exception error) {
        log.warn("job start failed id={} msg={}", identifier, error.getMessage(), error);
    }

    protected void onRunError(Exception error) {
        log.warn("job run failed id={} msg={}", identifier, error.getMessage(), error);
    }

    protected void onStopError(Exception error) {
        log.warn("job stop failed id={} msg={}", identifier, error.getMessage(), error);
    }

    /* ==== accessors ==== */

    public final String identifier() {
        return identifier;
    }

    public final Instant createdAt() {
        return createdAt;
    }

    /**
     * Namespace for caller-defined instance data.
     */
    public final Map<String, Object> data() {
        return data;
    }

    public final JobProxy proxy() {
        return proxy;
    }

    /**
     * Manager access for this job. Every call acts with this job as invoker.
     */
    public final JobManagerProxy manager() {
        return managerProxy;
    }

    public final JobProxy creator() {
        ManagedJob c = creator;
        return c != null ? c.proxy : null;
    }

    public final JobProxy guardian() {
        ManagedJob g = guardian;
        return g != null ? g.proxy : null;
    }

    public final JobPermissionLevel permissionLevel() {
        return permissionLevel;
    }

    public final String scheduleIdentifier() {
        return scheduleIdentifier;
    }

    public final boolean wasScheduled() {
        return scheduleIdentifier != null;
    }

    public final int loopCount() {
        return loopCount;
    }

    final JobFlags flags() {
        return flags;
    }

    protected final MixinHost mixinHost() {
        return mixinHost;
    }

    final void addMixin(JobMixin mixin) {
        if (flags.has(JobFlags.INITIALIZED) || manager != null) {
            throw new IllegalStateException("mixins must be added while the job is constructed");
        }
        mixins.add(Objects.requireNonNull(mixin, "mixin must not be null"));
    }

    final List<JobMixin> mixins() {
        return mixins;
    }

    final EventSource eventSource() {
        for (JobMixin mixin : mixins) {
            if (mixin instanceof EventSource source) {
                return source;
            }
        }
        return null;
    }

    final JobManager jobManager() {
        return manager;
    }

    final ManagedJob creatorJob() {
        return creator;
    }

    final ManagedJob guardianJob() {
        return guardian;
    }

    final Set<ManagedJob> guardedJobs() {
        return guardedJobs;
    }

    /* ==== manager-side wiring ==== */

    final void bind(JobManager manager, ManagedJob creator) {
        if (this.manager != null) {
            throw new JobStateException("job " + identifier + " is already bound to a manager");
        }
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
        this.creator = creator;
        this.managerProxy = new JobManagerProxy(manager, this);
    }

    final void assignCreator(ManagedJob creator) {
        this.creator = creator;
    }

    final void markRegistered(JobPermissionLevel level) {
        this.permissionLevel = Objects.requireNonNull(level, "level must not be null");
        this.registeredAt = Instant.now();
        this.registered = true;
    }

    final void assignScheduleIdentifier(String scheduleIdentifier) {
        this.scheduleIdentifier = scheduleIdentifier;
    }

    final void setPendingStopTimeout(Duration timeout) {
        this.pendingStopTimeout = timeout;
    }

    final void assignGuardian(ManagedJob guardian) {
        synchronized (stateLock) {
            if (this.guardian != null) {
                throw new JobIsGuardedException("job " + identifier + " is already guarded");
            }
            this.guardian = guardian;
        }
    }

    /**
     * Drops the guardian and resolves unguard waiters.
     */
    final void releaseGuardian() {
        List<CompletableFuture<Void>> waiters;
        synchronized (stateLock) {
            guardian = null;
            waiters = new ArrayList<>(unguardFutures);
            unguardFutures.clear();
        }
        for (CompletableFuture<Void> f : waiters) {
            f.complete(null);
        }
    }

    /**
     * Runs {@link #onInit()} once.
     *
     * @return false if the job was already initialized
     */
    final boolean initializeInternal() {
        synchronized (stateLock) {
            if (isDone()) {
                throw new JobIsDoneException("job " + identifier + " is already done");
            }
            if (flags.has(JobFlags.INITIALIZED)) {
                return false;
            }
            if (flags.has(JobFlags.IS_INITIALIZING)) {
                throw new JobInitializationException("job " + identifier + " is already initializing");
            }
            flags.set(JobFlags.IS_INITIALIZING);
        }
        try {
            onInit();
            flags.set(JobFlags.INITIALIZED);
            initializedSince = Instant.now();
            log.debug("job initialized id={}", identifier);
            return true;
        } catch (Exception e) {
            throw new JobInitializationException("job " + identifier + " failed to initialize: " + e.getMessage(), e);
        } finally {
            flags.clear(JobFlags.IS_INITIALIZING);
        }
    }

    /* ==== lifecycle control ==== */

    /**
     * Starts the loop.
     *
     * @return false if the job is not alive, already running or done
     */
    final boolean startInternal() {
        synchronized (stateLock) {
            if (!isAlive() || isRunning() || isDone()) {
                return false;
            }
            PeriodicLoop current = loop;
            if (current == null) {
                current = new PeriodicLoop(identifier, this::runIteration, new Hooks(), initialSchedule, count,
                        reconnect, manager.jobExecutor());
                loop = current;
            }
            current.start();
            log.debug("job started id={}", identifier);
            return true;
        }
    }

    /**
     * Stops this job. A forced stop, or any stop while idling, cancels the loop immediately;
     * otherwise the loop ends after the iteration in progress.
     *
     * @return false if the job is not running or already stopping
     */
    public final boolean stop(boolean force) {
        synchronized (stateLock) {
            return requestStop(force, true);
        }
    }

    public final boolean stop() {
        return stop(false);
    }

    final boolean stopExternal(boolean force) {
        synchronized (stateLock) {
            return requestStop(force, false);
        }
    }

    // caller holds stateLock
    private boolean requestStop(boolean force, boolean bySelf) {
        if (!isRunning() || flags.hasAny(JobFlags.TOLD_TO_STOP | JobFlags.IS_STOPPING | JobFlags.STOPPED)) {
            return false;
        }
        flags.set(JobFlags.TOLD_TO_STOP);
        flags.set(JobFlags.TOLD_TO_STOP_BY_SELF, bySelf);
        if (force || flags.has(JobFlags.IS_IDLING)) {
            flags.set(JobFlags.TOLD_TO_STOP_BY_FORCE);
            loop.cancel();
        } else {
            if (!flags.has(JobFlags.IS_STARTING)) {
                flags.set(JobFlags.SKIP_NEXT_RUN);
            }
            loop.stop();
        }
        log.debug("job told to stop id={} force={} self={}", identifier, force, bySelf);
        return true;
    }

    /**
     * Force-stops this job and starts it again once its loop has finished.
     *
     * @return false if the job is not running, already restarting or being force-stopped
     */
    public final boolean restart() {
        synchronized (stateLock) {
            return requestRestart(true);
        }
    }

    final boolean restartExternal() {
        synchronized (stateLock) {
            return requestRestart(false);
        }
    }

    // caller holds stateLock
    private boolean requestRestart(boolean bySelf) {
        if (flags.hasAny(JobFlags.TOLD_TO_RESTART | JobFlags.TOLD_TO_STOP_BY_FORCE) || !isRunning()) {
            return false;
        }
        CompletableFuture<Void> finished = loop.whenFinished();
        flags.set(JobFlags.TOLD_TO_RESTART);
        if (!flags.hasAny(JobFlags.TOLD_TO_STOP | JobFlags.IS_STOPPING)) {
            requestStop(true, bySelf);
        }
        finished.thenRun(() -> {
            if (isAlive() && !isDone()) {
                startInternal();
            }
        });
        return true;
    }

    /**
     * Ends this job for good with status {@link JobStatus#COMPLETED}.
     */
    public final boolean complete() {
        synchronized (stateLock) {
            if (flags.hasAny(JobFlags.TOLD_TO_FINISH) || isDone() || !isRunning()) {
                return false;
            }
            flags.set(JobFlags.TOLD_TO_COMPLETE);
            if (!flags.has(JobFlags.IS_STOPPING)) {
                requestStop(true, true);
            }
            return true;
        }
    }

    /**
     * Ends this job for good with status {@link JobStatus#KILLED}. A kill issued while starting
     * takes effect at the first run attempt.
     */
    public final boolean kill() {
        synchronized (stateLock) {
            if (flags.hasAny(JobFlags.TOLD_TO_BE_KILLED) || isDone() || !isRunning()) {
                return false;
            }
            flags.set(JobFlags.TOLD_TO_BE_KILLED);
            if (flags.has(JobFlags.IS_STARTING)) {
                flags.set(JobFlags.INTERNAL_STARTUP_KILL);
            } else if (!flags.has(JobFlags.IS_STOPPING)) {
                requestStop(true, true);
            }
            return true;
        }
    }

    /**
     * Kills this job on behalf of another job or the manager.
     *
     * @param awaken for a job that is not running: start it without {@link #onStart()} so its
     *               {@link #onStop()} runs before the kill, instead of killing it right away
     */
    final boolean killExternal(boolean awaken) {
        Runnable deferred = null;
        synchronized (stateLock) {
            if (isDone() || flags.has(JobFlags.TOLD_TO_BE_KILLED)) {
                return false;
            }
            if (isRunning()) {
                flags.set(JobFlags.TOLD_TO_BE_KILLED);
                if (!flags.has(JobFlags.IS_STOPPING)) {
                    requestStop(true, false);
                }
            } else if (awaken && isAlive()) {
                flags.set(JobFlags.EXTERNAL_STARTUP_KILL);
                if (!startInternal()) {
                    flags.clear(JobFlags.EXTERNAL_STARTUP_KILL);
                    return false;
                }
            } else {
                flags.set(JobFlags.TOLD_TO_BE_KILLED);
                deferred = stopCleanup(JobStopReason.External.KILLING);
            }
        }
        if (deferred != null) {
            deferred.run();
        }
        return true;
    }

    /* ==== loop callbacks ==== */

    private void runIteration() throws Exception {
        if (flags.has(JobFlags.EXTERNAL_STARTUP_KILL)) {
            synchronized (stateLock) {
                flags.set(JobFlags.TOLD_TO_BE_KILLED);
                requestStop(true, false);
            }
            return;
        }
        if (flags.has(JobFlags.INTERNAL_STARTUP_KILL)) {
            synchronized (stateLock) {
                requestStop(true, true);
            }
            return;
        }
        if (flags.has(JobFlags.SKIP_NEXT_RUN)) {
            return;
        }
        markIdling(false);
        for (JobMixin mixin : mixins) {
            mixin.mixinRoutine();
        }
        onRun();
        PeriodicLoop current = loop;
        if (current != null && !isImmediate(current.schedule())) {
            markIdling(true);
        }
        loopCount++;
    }

    private static boolean isImmediate(LoopSchedule schedule) {
        return schedule.kind() == LoopSchedule.Kind.INTERVAL && schedule.interval().isZero();
    }

    private final class Hooks implements LoopHooks {

        @Override
        public void beforeLoop() throws Exception {
            startException = null;
            runException = null;
            stopException = null;
            flags.clear(JobFlags.STOPPED | JobFlags.IS_IDLING);
            flags.set(JobFlags.IS_STARTING);
            runningSince = Instant.now();
            stoppedSince = null;
            idlingSince = null;
            try {
                if (!flags.has(JobFlags.EXTERNAL_STARTUP_KILL)) {
                    for (JobMixin mixin : mixins) {
                        mixin.onMixinStart();
                    }
                    onStart();
                }
            } catch (Exception e) {
                if (loop.isBeingCancelled() || e instanceof InterruptedException) {
                    throw e;
                }
                startException = e;
                flags.set(JobFlags.TOLD_TO_STOP | JobFlags.TOLD_TO_STOP_BY_SELF | JobFlags.IS_STOPPING);
                safely(() -> onStartError(e), "start error hook");
                Runnable deferred = stopCleanup(JobStopReason.Internal.ERROR);
                loop.whenFinished().thenRun(deferred);
                throw e;
            } finally {
                flags.clear(JobFlags.IS_STARTING);
            }
        }

        @Override
        public void onError(Exception error) {
            runException = error;
            flags.set(JobFlags.TOLD_TO_STOP | JobFlags.TOLD_TO_STOP_BY_SELF | JobFlags.IS_STOPPING);
            safely(() -> onRunError(error), "run error hook");
        }

        @Override
        public void afterLoop() {
            flags.set(JobFlags.IS_STOPPING);
            for (JobMixin mixin : mixins) {
                safely(mixin::onMixinStop, "mixin stop");
            }
            try {
                if (!flags.has(JobFlags.TOLD_TO_STOP_BY_SELF)) {
                    runStopHookWithTimeout();
                } else {
                    try {
                        onStop();
                    } catch (Exception e) {
                        stopException = e;
                        safely(() -> onStopError(e), "stop error hook");
                    }
                }
            } finally {
                Runnable deferred = stopCleanup(null);
                loop.whenFinished().thenRun(deferred);
            }
        }
    }

    private void runStopHookWithTimeout() {
        Duration timeout = pendingStopTimeout;
        if (timeout == null && manager != null) {
            timeout = manager.getGlobalJobStopTimeout();
        }
        Future<?> stopping = manager.jobExecutor().submit(() -> {
            onStop();
            return null;
        });
        try {
            if (timeout == null) {
                stopping.get();
            } else {
                stopping.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            stopping.cancel(true);
            stopException = e;
            log.warn("job stop timed out id={} timeout={}", identifier, timeout);
            safely(() -> onStopError(e), "stop error hook");
        } catch (ExecutionException e) {
            Exception cause = e.getCause() instanceof Exception ex ? ex : e;
            stopException = cause;
            safely(() -> onStopError(cause), "stop error hook");
        } catch (InterruptedException e) {
            stopping.cancel(true);
            stopException = e;
            Thread.currentThread().interrupt();
        }
    }

    private void safely(ThrowingRunnable action, String what) {
        try {
            action.run();
        } catch (Exception e) {
            log.warn("job {} failed id={} msg={}", what, identifier, e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface ThrowingRunnable {
        void run() throws Exception;
    }

    /**
     * Resets stop state and records the stop. Returns the part of the cleanup that must run
     * without holding this job's lock: resolving waiters and, for a finished job, releasing
     * guards and leaving the manager.
     */
    private Runnable stopCleanup(JobStopReason reason) {
        synchronized (stateLock) {
            lastStoppingReason = reason != null ? reason : getStoppingReason();
            boolean completing = flags.has(JobFlags.TOLD_TO_COMPLETE);
            boolean killing = flags.has(JobFlags.TOLD_TO_BE_KILLED);

            flags.clear(JobFlags.SKIP_NEXT_RUN | JobFlags.IS_STARTING | JobFlags.INTERNAL_STARTUP_KILL
                    | JobFlags.EXTERNAL_STARTUP_KILL | JobFlags.TOLD_TO_STOP | JobFlags.TOLD_TO_STOP_BY_SELF
                    | JobFlags.TOLD_TO_STOP_BY_FORCE | JobFlags.IS_STOPPING | JobFlags.TOLD_TO_RESTART
                    | JobFlags.IS_IDLING);
            loopCount = 0;
            idlingSince = null;
            runningSince = null;
            pendingStopTimeout = null;
            for (JobMixin mixin : mixins) {
                safely(mixin::onMixinStopCleanup, "mixin stop cleanup");
            }

            List<CompletableFuture<JobStatus>> stops = new ArrayList<>(stopFutures);
            stopFutures.clear();

            if (!completing && !killing) {
                flags.set(JobFlags.STOPPED);
                stoppedSince = Instant.now();
                log.debug("job stopped id={} reason={}", identifier, lastStoppingReason);
                return () -> {
                    for (CompletableFuture<JobStatus> f : stops) {
                        f.complete(JobStatus.STOPPED);
                    }
                };
            }

            JobStatus terminal = completing ? JobStatus.COMPLETED : JobStatus.KILLED;
            flags.clear(JobFlags.INITIALIZED | JobFlags.TOLD_TO_FINISH | JobFlags.STOPPED);
            stoppedSince = null;
            if (completing) {
                flags.set(JobFlags.COMPLETED);
                completedAt = Instant.now();
            } else {
                flags.set(JobFlags.KILLED);
                killedAt = Instant.now();
            }
            outputQueueProxies.clear();

            List<CompletableFuture<JobStatus>> dones = new ArrayList<>(doneFutures);
            doneFutures.clear();
            List<CompletableFuture<Object>> fieldWaiters = new ArrayList<>();
            outputFieldFutures.values().forEach(fieldWaiters::addAll);
            outputFieldFutures.clear();
            List<CompletableFuture<Object>> queueWaiters = new ArrayList<>();
            outputQueueFutures.values().forEach(list -> list.forEach(w -> queueWaiters.add(w.future())));
            outputQueueFutures.clear();

            log.debug("job done id={} status={} reason={}", identifier, terminal, lastStoppingReason);
            return () -> {
                try {
                    JobManager m = manager;
                    if (m != null) {
                        m.jobDone(this);
                    }
                } catch (RuntimeException e) {
                    log.error("job ejection failed id={} msg={}", identifier, e.getMessage(), e);
                } finally {
                    for (CompletableFuture<Object> f : fieldWaiters) {
                        f.complete(terminal);
                    }
                    for (CompletableFuture<Object> f : queueWaiters) {
                        f.complete(terminal);
                    }
                    for (CompletableFuture<JobStatus> f : stops) {
                        f.complete(terminal);
                    }
                    for (CompletableFuture<JobStatus> f : dones) {
                        f.complete(terminal);
                    }
                }
            };
        }
    }

    final void markIdling(boolean idling) {
        if (idling) {
            if (!flags.has(JobFlags.IS_IDLING)) {
                idlingSince = Instant.now();
            }
            flags.set(JobFlags.IS_IDLING);
        } else {
            flags.clear(JobFlags.IS_IDLING);
            idlingSince = null;
        }
    }

    /* ==== state queries ==== */

    public final boolean isInitialized() {
        return flags.has(JobFlags.INITIALIZED);
    }

    public final boolean isInitializing() {
        return flags.has(JobFlags.IS_INITIALIZING);
    }

    /**
     * Initialized and registered with a manager.
     */
    public final boolean isAlive() {
        return registered && flags.has(JobFlags.INITIALIZED);
    }

    public final boolean isRunning() {
        PeriodicLoop current = loop;
        return current != null && current.isRunning();
    }

    public final boolean isStarting() {
        return flags.has(JobFlags.IS_STARTING);
    }

    public final boolean isIdling() {
        return flags.has(JobFlags.IS_IDLING);
    }

    public final boolean isStopping() {
        return flags.has(JobFlags.IS_STOPPING);
    }

    public final boolean isStoppingByForce() {
        return flags.has(JobFlags.IS_STOPPING | JobFlags.TOLD_TO_STOP_BY_FORCE);
    }

    public final boolean isToldToStop() {
        return flags.has(JobFlags.TOLD_TO_STOP);
    }

    public final boolean isStopped() {
        return flags.has(JobFlags.STOPPED);
    }

    public final boolean isRestarting() {
        return flags.has(JobFlags.IS_STOPPING | JobFlags.TOLD_TO_RESTART);
    }

    public final boolean isCompleting() {
        return flags.has(JobFlags.IS_STOPPING | JobFlags.TOLD_TO_COMPLETE);
    }

    public final boolean isBeingKilled() {
        return flags.has(JobFlags.IS_STOPPING | JobFlags.TOLD_TO_BE_KILLED);
    }

    public final boolean isBeingStartupKilled() {
        return flags.hasAny(JobFlags.INTERNAL_STARTUP_KILL | JobFlags.EXTERNAL_STARTUP_KILL)
                && flags.has(JobFlags.IS_STOPPING);
    }

    public final boolean isCompleted() {
        return flags.has(JobFlags.COMPLETED);
    }

    public final boolean isKilled() {
        return flags.has(JobFlags.KILLED);
    }

    public final boolean isDone() {
        return flags.hasAny(JobFlags.DONE);
    }

    public final boolean isBeingGuarded() {
        return guardian != null;
    }

    /**
     * Whether the last run ended because of an exception in a hook.
     */
    public final boolean runFailed() {
        return startException != null || runException != null;
    }

    public final Instant registeredAt() {
        return registeredAt;
    }

    public final Instant initializedSince() {
        return initializedSince;
    }

    public final Instant aliveSince() {
        return isAlive() ? registeredAt : null;
    }

    public final Instant runningSince() {
        return runningSince;
    }

    public final Instant stoppedSince() {
        return stoppedSince;
    }

    public final Instant idlingSince() {
        return idlingSince;
    }

    public final Instant completedAt() {
        return completedAt;
    }

    public final Instant killedAt() {
        return killedAt;
    }

    public final Instant doneSince() {
        return completedAt != null ? completedAt : killedAt;
    }

    public final Exception getStartException() {
        return startException;
    }

    public final Exception getRunException() {
        return runException;
    }

    public final Exception getStopException() {
        return stopException;
    }

    public final JobStopReason getLastStoppingReason() {
        return lastStoppingReason;
    }

    /**
     * Why the job is stopping right now, or {@code null} if it is not stopping.
     */
    public final JobStopReason getStoppingReason() {
        if (!flags.has(JobFlags.IS_STOPPING)) {
            return null;
        }
        if (startException != null || runException != null || stopException != null) {
            return JobStopReason.Internal.ERROR;
        }
        for (JobMixin mixin : mixins) {
            JobStopReason reason = mixin.stoppingReason();
            if (reason != null) {
                return reason;
            }
        }
        PeriodicLoop current = loop;
        if (current != null && current.count() != null && current.currentLoop() >= current.count()) {
            return JobStopReason.Internal.EXECUTION_COUNT_LIMIT;
        }
        if (flags.has(JobFlags.TOLD_TO_STOP_BY_SELF)) {
            if (flags.has(JobFlags.TOLD_TO_RESTART)) {
                return JobStopReason.Internal.RESTART;
            } else if (flags.has(JobFlags.TOLD_TO_COMPLETE)) {
                return JobStopReason.Internal.COMPLETION;
            } else if (flags.has(JobFlags.TOLD_TO_BE_KILLED)) {
                return JobStopReason.Internal.KILLING;
            }
            return JobStopReason.Internal.UNSPECIFIC;
        }
        if (flags.has(JobFlags.TOLD_TO_RESTART)) {
            return JobStopReason.External.RESTART;
        } else if (flags.has(JobFlags.TOLD_TO_BE_KILLED)) {
            return JobStopReason.External.KILLING;
        }
        return JobStopReason.External.UNKNOWN;
    }

    public final JobStatus status() {
        if (isAlive()) {
            if (isRunning()) {
                if (isStarting()) {
                    return JobStatus.STARTING;
                } else if (isIdling()) {
                    return JobStatus.IDLING;
                } else if (isStopping()) {
                    if (flags.has(JobFlags.TOLD_TO_COMPLETE)) {
                        return JobStatus.COMPLETING;
                    } else if (flags.has(JobFlags.TOLD_TO_BE_KILLED)) {
                        return JobStatus.BEING_KILLED;
                    } else if (flags.has(JobFlags.TOLD_TO_RESTART)) {
                        return JobStatus.RESTARTING;
                    }
                    return JobStatus.STOPPING;
                }
                return JobStatus.RUNNING;
            }
            return isStopped() ? JobStatus.STOPPED : JobStatus.INITIALIZED;
        }
        if (isCompleted()) {
            return JobStatus.COMPLETED;
        } else if (isKilled()) {
            return JobStatus.KILLED;
        } else if (isInitializing()) {
            return JobStatus.INITIALIZING;
        } else if (isInitialized()) {
            return JobStatus.INITIALIZED;
        }
        return JobStatus.FRESH;
    }

    /* ==== loop details ==== */

    final PeriodicLoop loop() {
        return loop;
    }

    final LoopSchedule initialSchedule() {
        return initialSchedule;
    }

    final Integer count() {
        return count;
    }

    /* ==== waits ==== */

    /**
     * Resolves with {@link JobStatus#COMPLETED} or {@link JobStatus#KILLED} once the job is done.
     *
     * @param timeout {@code null} to wait indefinitely; on expiry the future fails with
     *                {@link TimeoutException}
     */
    public final CompletableFuture<JobStatus> awaitDone(Duration timeout) {
        CompletableFuture<JobStatus> f;
        synchronized (stateLock) {
            if (isDone()) {
                return CompletableFuture.completedFuture(status());
            }
            f = new CompletableFuture<>();
            doneFutures.add(f);
        }
        return withTimeout(f, timeout);
    }

    /**
     * Resolves with {@link JobStatus#STOPPED}, or the terminal status, when the running loop ends.
     *
     * @throws JobStateException if the job is not running
     */
    public final CompletableFuture<JobStatus> awaitStop(Duration timeout) {
        CompletableFuture<JobStatus> f;
        synchronized (stateLock) {
            if (!isRunning()) {
                throw new JobStateException("job " + identifier + " is not running");
            }
            f = new CompletableFuture<>();
            stopFutures.add(f);
        }
        return withTimeout(f, timeout);
    }

    /**
     * @throws JobStateException if the job is not guarded
     */
    public final CompletableFuture<Void> awaitUnguard(Duration timeout) {
        CompletableFuture<Void> f;
        synchronized (stateLock) {
            if (guardian == null) {
                throw new JobStateException("job " + identifier + " is not being guarded");
            }
            f = new CompletableFuture<>();
            unguardFutures.add(f);
        }
        return withTimeout(f, timeout);
    }

    private static <T> CompletableFuture<T> withTimeout(CompletableFuture<T> f, Duration timeout) {
        if (timeout == null) {
            return f;
        }
        return f.orTimeout(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    /* ==== output fields ==== */

    public final Set<String> getOutputFieldNames() {
        return outputFieldNames;
    }

    public final boolean hasOutputFieldName(String name) {
        return outputFieldNames.contains(name);
    }

    private void verifyOutputField(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (!outputFieldNames.contains(name)) {
            throw new IllegalArgumentException("job class " + getClass().getName() + " declares no output field '" + name + "'");
        }
    }

    /**
     * Sets a write-once output field and resolves its waiters.
     *
     * @throws JobStateException if the field was already set
     */
    public final void setOutputField(String name, Object value) {
        verifyOutputField(name);
        List<CompletableFuture<Object>> waiters;
        synchronized (stateLock) {
            if (outputFields.containsKey(name)) {
                throw new JobStateException("output field '" + name + "' of job " + identifier + " is already set");
            }
            outputFields.put(name, value);
            List<CompletableFuture<Object>> pending = outputFieldFutures.remove(name);
            waiters = pending != null ? pending : List.of();
        }
        for (CompletableFuture<Object> f : waiters) {
            f.complete(value);
        }
    }

    /**
     * @throws JobStateException if the field is not set
     */
    public final Object getOutputField(String name) {
        verifyOutputField(name);
        if (!outputFields.containsKey(name)) {
            throw new JobStateException("output field '" + name + "' of job " + identifier + " is not set");
        }
        return outputFields.get(name);
    }

    public final Object getOutputField(String name, Object defaultValue) {
        verifyOutputField(name);
        return outputFields.getOrDefault(name, defaultValue);
    }

    public final boolean outputFieldIsSet(String name) {
        verifyOutputField(name);
        return outputFields.containsKey(name);
    }

    final Map<String, Object> outputFieldValues() {
        return Map.copyOf(outputFields);
    }

    /**
     * Resolves with the field value, or with the terminal status if the job ends first.
     *
     * @throws JobIsDoneException if the job is done and the field was never set
     */
    public final CompletableFuture<Object> awaitOutputField(String name, Duration timeout) {
        verifyOutputField(name);
        CompletableFuture<Object> f;
        synchronized (stateLock) {
            if (outputFields.containsKey(name)) {
                return CompletableFuture.completedFuture(outputFields.get(name));
            }
            if (isDone()) {
                throw new JobIsDoneException("job " + identifier + " is already done");
            }
            f = new CompletableFuture<>();
            outputFieldFutures.computeIfAbsent(name, k -> new ArrayList<>()).add(f);
        }
        return withTimeout(f, timeout);
    }

    /* ==== output queues ==== */

    public final Set<String> getOutputQueueNames() {
        return outputQueueNames;
    }

    public final boolean hasOutputQueueName(String name) {
        return outputQueueNames.contains(name);
    }

    private void verifyOutputQueue(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (!outputQueueNames.contains(name)) {
            throw new IllegalArgumentException("job class " + getClass().getName() + " declares no output queue '" + name + "'");
        }
    }

    /**
     * Appends to an output queue and resolves the waiters pending at this moment.
     */
    public final void pushOutputQueue(String name, Object value) {
        verifyOutputQueue(name);
        List<QueueWaiter> waiters;
        synchronized (stateLock) {
            outputQueues.get(name).add(value);
            List<QueueWaiter> pending = outputQueueFutures.remove(name);
            waiters = pending != null ? pending : List.of();
        }
        for (QueueWaiter w : waiters) {
            w.future().complete(value);
        }
    }

    public final List<Object> getOutputQueueContents(String name) {
        verifyOutputQueue(name);
        return List.copyOf(outputQueues.get(name));
    }

    public final boolean outputQueueIsEmpty(String name) {
        verifyOutputQueue(name);
        return outputQueues.get(name).isEmpty();
    }

    /**
     * Clears an output queue. Subscribed {@link JobOutputQueueProxy}s rescue their unread values
     * first; waiters that asked for it are cancelled, the others resolve with
     * {@link JobStatus#OUTPUT_QUEUE_CLEARED}.
     */
    public final void clearOutputQueue(String name) {
        verifyOutputQueue(name);
        List<QueueWaiter> waiters;
        synchronized (stateLock) {
            List<Object> queue = outputQueues.get(name);
            List<Object> values = List.copyOf(queue);
            for (JobOutputQueueProxy p : outputQueueProxies) {
                p.outputQueueClearAlert(name, values);
            }
            queue.clear();
            List<QueueWaiter> pending = outputQueueFutures.remove(name);
            waiters = pending != null ? pending : List.of();
        }
        for (QueueWaiter w : waiters) {
            if (w.cancelIfCleared()) {
                w.future().cancel(false);
            } else {
                w.future().complete(JobStatus.OUTPUT_QUEUE_CLEARED);
            }
        }
    }

    final List<Object> outputQueueView(String name) {
        verifyOutputQueue(name);
        return outputQueues.get(name);
    }

    final Map<String, List<Object>> outputQueueValues() {
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        outputQueues.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return copy;
    }

    /**
     * Resolves with the next value pushed to the queue, with {@link JobStatus#OUTPUT_QUEUE_CLEARED}
     * if the queue is cleared first (unless {@code cancelIfCleared}, which cancels instead), or with
     * the terminal status if the job ends first.
     *
     * @throws JobIsDoneException if the job is already done
     */
    public final CompletableFuture<Object> awaitOutputQueueAdd(String name, Duration timeout, boolean cancelIfCleared) {
        verifyOutputQueue(name);
        CompletableFuture<Object> f;
        synchronized (stateLock) {
            if (isDone()) {
                throw new JobIsDoneException("job " + identifier + " is already done");
            }
            f = new CompletableFuture<>();
            outputQueueFutures.computeIfAbsent(name, k -> new ArrayList<>()).add(new QueueWaiter(f, cancelIfCleared));
        }
        return withTimeout(f, timeout);
    }

    /**
     * A new consumer of this job's output queues with its own read positions.
     */
    public final JobOutputQueueProxy getOutputQueueProxy() {
        if (outputQueueNames.isEmpty()) {
            throw new IllegalStateException("job class " + getClass().getName() + " declares no output queues");
        }
        JobOutputQueueProxy p = new JobOutputQueueProxy(proxy, outputQueueNames, this::outputQueueView, stateLock);
        if (!isDone()) {
            outputQueueProxies.add(p);
        }
        return p;
    }

    private record QueueWaiter(CompletableFuture<Object> future, boolean cancelIfCleared) {
    }

    /* ==== public methods ==== */

    static Map<String, Method> publicMethodsOf(Class<?> cls) {
        return PUBLIC_METHODS.computeIfAbsent(cls, c -> {
            Map<String, Method> found = new LinkedHashMap<>();
            for (Class<?> k = c; k != null && k != Object.class; k = k.getSuperclass()) {
                for (Method m : k.getDeclaredMethods()) {
                    PublicJobMethod marker = m.getAnnotation(PublicJobMethod.class);
                    if (marker == null || Modifier.isStatic(m.getModifiers())) {
                        continue;
                    }
                    String name = marker.value().isEmpty() ? m.getName() : marker.value();
                    if (!found.containsKey(name)) {
                        m.setAccessible(true);
                        found.put(name, m);
                    }
                }
            }
            return Collections.unmodifiableMap(found);
        });
    }

    public final Set<String> getPublicMethodNames() {
        return publicMethodsOf(getClass()).keySet();
    }

    public final boolean hasPublicMethodName(String name) {
        return publicMethodsOf(getClass()).containsKey(name);
    }

    final Object runPublicMethod(String name, Object... args) {
        Method method = publicMethodsOf(getClass()).get(name);
        if (method == null) {
            throw new IllegalArgumentException("job class " + getClass().getName() + " has no public method '" + name + "'");
        }
        if (isDone()) {
            throw new JobIsDoneException("job " + identifier + " is already done");
        }
        try {
            return method.invoke(this, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new JobException("public method '" + name + "' of job " + identifier + " failed", cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("public method '" + name + "' is not accessible", e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + identifier
                + ", level=" + permissionLevel
                + ", status=" + status()
                + "}";
    }

    private final class Host implements MixinHost {

        @Override
        public String identifier() {
            return identifier;
        }

        @Override
        public JobFlags flags() {
            return flags;
        }

        @Override
        public boolean isRunning() {
            return ManagedJob.this.isRunning();
        }

        @Override
        public boolean isStopping() {
            return ManagedJob.this.isStopping();
        }

        @Override
        public boolean start() {
            return startInternal();
        }

        @Override
        public boolean stop(boolean force) {
            return ManagedJob.this.stop(force);
        }

        @Override
        public void markIdling(boolean idling) {
            ManagedJob.this.markIdling(idling);
        }

        @Override
        public ExecutorService executor() {
            JobManager m = manager;
            if (m == null) {
                throw new IllegalStateException("job " + identifier + " is not bound to a manager");
            }
            return m.jobExecutor();
        }
    }
}
