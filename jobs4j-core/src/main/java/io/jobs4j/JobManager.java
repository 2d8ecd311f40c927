package io.jobs4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.jobs4j.config.JobManagerProperties;
import io.jobs4j.core.JobArguments;
import io.jobs4j.core.JobConflictException;
import io.jobs4j.core.JobException;
import io.jobs4j.core.JobIsDoneException;
import io.jobs4j.core.JobIsGuardedException;
import io.jobs4j.core.JobNotAliveException;
import io.jobs4j.core.JobOp;
import io.jobs4j.core.JobPermissionException;
import io.jobs4j.core.JobPermissionLevel;
import io.jobs4j.core.JobSchedulingException;
import io.jobs4j.core.JobStateException;
import io.jobs4j.core.ScheduleFailure;
import io.jobs4j.core.ScheduleRecord;
import io.jobs4j.core.ScheduleSnapshot;
import io.jobs4j.events.CustomJobEvent;
import io.jobs4j.events.JobEvent;
import io.jobs4j.internal.schedule.ScheduleCodec;
import io.jobs4j.internal.schedule.ScheduleTable;
import io.jobs4j.mixins.EventSource;
import io.jobs4j.utils.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Registry and coordinator for the jobs of one process.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobManager manager = new JobManager(new JobManagerProperties());
 * manager.initialize();
 * manager.registerJobClass(Echo.class, JobPermissionLevel.MEDIUM);
 *
 * JobProxy echo = manager.createAndRegisterJob(Echo.class, JobArguments.of("hello"));
 * echo.awaitDone(Duration.ofSeconds(5)).join();
 *
 * manager.shutdown();
 * }</pre>
 *
 * <p>Every operation on a job is checked against the permission level of the job invoking it.
 * Calls made on the manager directly act as the manager's own {@link JobPermissionLevel#SYSTEM}
 * job; jobs reach the manager through their {@link JobManagerProxy}, which passes them as invoker.
 */
public class JobManager {
    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    private final JobManagerProperties props;
    private final String identifier;
    private final ExecutorService jobExecutor;
    private final ScheduleCodec codec;
    private final ScheduleTable schedules;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private volatile boolean running;
    private volatile JobManagerJob managerJob;
    private volatile Duration globalJobStopTimeout;
    private volatile JobPermissionLevel defaultPermissionLevel;

    /* ==== registry, guarded by lock ==== */
    private final Object lock = new Object();
    private final Map<String, ManagedJob> jobs = new LinkedHashMap<>();
    private final Map<Class<?>, Set<ManagedJob>> instancesByClass = new HashMap<>();
    private final Map<Class<?>, JobPermissionLevel> classLevels = new HashMap<>();
    private final Map<String, Class<? extends ManagedJob>> classesByUuid = new HashMap<>();
    private final Map<Class<? extends JobEvent>, Set<ManagedJob>> eventJobs = new LinkedHashMap<>();
    private final List<EventWaiter> eventWaiters = new ArrayList<>();

    private record EventWaiter(Set<Class<? extends JobEvent>> types, Predicate<JobEvent> check,
                               CompletableFuture<JobEvent> future, ManagedJob owner) {
    }

    /**
     * Releases a guard when closed.
     */
    public interface JobGuard extends AutoCloseable {

        JobProxy target();

        @Override
        void close();
    }

    public JobManager() {
        this(new JobManagerProperties());
    }

    public JobManager(JobManagerProperties props) {
        this(props, JsonMapper.builder().findAndAddModules().build());
    }

    public JobManager(JobManagerProperties props, ObjectMapper objectMapper) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        JobPermissionLevel level = Objects.requireNonNull(props.getDefaultPermissionLevel(),
                "jobs4j.defaultPermissionLevel must not be null");
        if (level == JobPermissionLevel.SYSTEM) {
            throw new IllegalArgumentException("jobs4j.defaultPermissionLevel must be below SYSTEM");
        }
        Duration interval = Objects.requireNonNull(props.getSchedulingInterval(), "jobs4j.schedulingInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("jobs4j.schedulingInterval must be a positive duration");
        }
        this.defaultPermissionLevel = level;
        this.globalJobStopTimeout = validStopTimeout(props.getGlobalJobStopTimeout());
        this.identifier = resolveIdentifier(props.getManagerId());

        String prefix = props.getJobThreadNamePrefix() == null || props.getJobThreadNamePrefix().isBlank()
                ? "jobs4j.job"
                : props.getJobThreadNamePrefix();
        AtomicInteger threadCount = new AtomicInteger();
        this.jobExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.codec = new ScheduleCodec(objectMapper, Math.max(1, props.getSerializationWorkers()));
        this.schedules = new ScheduleTable(codec);
    }

    private String resolveIdentifier(String configured) {
        if (configured != null && !configured.isBlank()) {
            if (!configured.matches("\\d+-\\d+")) {
                throw new IllegalArgumentException("jobs4j.managerId must have the form '<number>-<number>'");
            }
            return configured;
        }
        return Integer.toUnsignedString(System.identityHashCode(this)) + "-" + Timestamps.uniqueNowNanos();
    }

    private static Duration validStopTimeout(Duration timeout) {
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("job stop timeout must be a positive duration or null");
        }
        return timeout;
    }

    /* ==== manager state ==== */

    public String identifier() {
        return identifier;
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    public boolean isRunning() {
        return running;
    }

    public Duration getGlobalJobStopTimeout() {
        return globalJobStopTimeout;
    }

    public void setGlobalJobStopTimeout(Duration timeout) {
        this.globalJobStopTimeout = validStopTimeout(timeout);
    }

    public JobPermissionLevel getDefaultPermissionLevel() {
        return defaultPermissionLevel;
    }

    public void setDefaultPermissionLevel(JobPermissionLevel level) {
        Objects.requireNonNull(level, "level must not be null");
        if (level == JobPermissionLevel.SYSTEM) {
            throw new IllegalArgumentException("default permission level must be below SYSTEM");
        }
        this.defaultPermissionLevel = level;
    }

    ExecutorService jobExecutor() {
        return jobExecutor;
    }

    JobManagerJob managerJob() {
        return managerJob;
    }

    private void checkInit() {
        if (!initialized.get()) {
            throw new IllegalStateException("job manager " + identifier + " is not initialized");
        }
    }

    private void checkInitAndRunning() {
        checkInit();
        if (!running) {
            throw new IllegalStateException("job manager " + identifier + " is not running");
        }
    }

    /**
     * Creates and starts the manager's own job, which runs the scheduling pass. Idempotent.
     *
     * @return false if the manager was already initialized
     */
    public boolean initialize() {
        if (!initialized.compareAndSet(false, true)) {
            return false;
        }
        running = true;
        JobManagerJob job = new JobManagerJob(props.getSchedulingInterval());
        job.bind(this, null);
        job.assignCreator(job);
        job.initializeInternal();
        synchronized (lock) {
            addJob(job, JobPermissionLevel.SYSTEM);
        }
        this.managerJob = job;
        job.startInternal();
        log.info("job manager initialized id={} schedulingInterval={} scheduling={}",
                identifier, props.getSchedulingInterval(), props.isSchedulingEnabled());
        return true;
    }

    /**
     * Stops the manager with the configured {@link JobManagerProperties#getStopOperation()}.
     */
    public void stop() {
        stop(props.getStopOperation());
    }

    /**
     * Kills (starting not-running jobs just long enough to run their stop hook) or force-stops
     * every job, then stops the manager's own job. Pending event waits are cancelled.
     */
    public void stop(JobOp operation) {
        checkInitAndRunning();
        Objects.requireNonNull(operation, "operation must not be null");
        switch (operation) {
            case STOP -> stopAllJobs(true);
            case KILL -> killAllJobs(true);
            default -> throw new IllegalArgumentException("operation must be KILL or STOP");
        }
        JobManagerJob job = managerJob;
        if (job != null) {
            job.stopExternal(true);
        }
        List<EventWaiter> waiters;
        synchronized (lock) {
            running = false;
            waiters = new ArrayList<>(eventWaiters);
            eventWaiters.clear();
        }
        for (EventWaiter w : waiters) {
            w.future().cancel(false);
        }
        log.info("job manager stopped id={} operation={}", identifier, operation);
    }

    /**
     * Resumes a stopped manager and restarts its own job.
     */
    public void resume() {
        checkInit();
        if (running) {
            throw new IllegalStateException("job manager " + identifier + " is still running");
        }
        running = true;
        JobManagerJob job = managerJob;
        if (job != null && !job.isRunning()) {
            CompletableFuture<Void> finished = job.loop() != null ? job.loop().whenFinished() : CompletableFuture.completedFuture(null);
            finished.thenRun(job::startInternal);
        }
        log.info("job manager resumed id={}", identifier);
    }

    /**
     * Stops the manager if it is running and releases its threads. The manager cannot be used
     * afterwards.
     */
    public void shutdown() {
        if (initialized.get() && running) {
            stop();
        }
        jobExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                jobExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobExecutor.shutdownNow();
        } finally {
            codec.close();
        }
        log.info("job manager shut down id={}", identifier);
    }

    /* ==== permissions ==== */

    /**
     * The single permission gate of the manager.
     *
     * @param target        job operated on, or the original scheduler for {@link JobOp#UNSCHEDULE}
     * @param targetClass   job class for {@link JobOp#CREATE}, {@link JobOp#SCHEDULE} and
     *                      {@link JobOp#UNSCHEDULE}
     * @param registerLevel level requested for {@link JobOp#REGISTER}
     * @return false instead of throwing when {@code raiseExceptions} is false
     * @throws JobPermissionException if denied and {@code raiseExceptions} is true
     */
    boolean verifyPermissions(ManagedJob invoker, JobOp op, ManagedJob target,
                              Class<? extends ManagedJob> targetClass, JobPermissionLevel registerLevel,
                              boolean raiseExceptions) {
        Objects.requireNonNull(invoker, "invoker must not be null");
        Objects.requireNonNull(op, "op must not be null");
        if (registerLevel == JobPermissionLevel.SYSTEM) {
            throw new IllegalArgumentException("SYSTEM permission level is reserved for the job manager");
        }
        if (invoker == managerJob || op == JobOp.FIND) {
            return true;
        }
        if (target instanceof JobManagerJob
                || (targetClass != null && JobManagerJob.class.isAssignableFrom(targetClass))) {
            return deny(raiseExceptions, "the job manager's own job cannot be operated on");
        }
        JobPermissionLevel level = invoker.permissionLevel();
        if (level == null || !invoker.isAlive()) {
            return deny(raiseExceptions, "invoker " + invoker.identifier() + " is not alive in this manager");
        }

        return switch (op) {
            case CUSTOM_EVENT_DISPATCH -> atLeast(level, JobPermissionLevel.MEDIUM, invoker, op, raiseExceptions);
            case EVENT_DISPATCH -> atLeast(level, JobPermissionLevel.HIGH, invoker, op, raiseExceptions);
            case CREATE, INITIALIZE -> atLeast(level, JobPermissionLevel.MEDIUM, invoker, op, raiseExceptions);
            case SCHEDULE -> {
                if (!atLeast(level, JobPermissionLevel.MEDIUM, invoker, op, raiseExceptions)) {
                    yield false;
                }
                JobPermissionLevel classLevel = resolveClassLevel(Objects.requireNonNull(targetClass, "targetClass must not be null"));
                if (classLevel.isAbove(level)) {
                    yield deny(raiseExceptions, "invoker " + invoker.identifier() + " at " + level
                            + " cannot schedule jobs of class " + targetClass.getName() + " at " + classLevel);
                }
                yield true;
            }
            case REGISTER -> {
                if (!atLeast(level, JobPermissionLevel.MEDIUM, invoker, op, raiseExceptions)) {
                    yield false;
                }
                if (registerLevel != null && registerLevel.isAbove(level)) {
                    yield deny(raiseExceptions, "invoker " + invoker.identifier() + " at " + level
                            + " cannot register a job at " + registerLevel);
                }
                yield true;
            }
            case START, STOP, RESTART, KILL, GUARD, UNGUARD ->
                    ownershipRule(invoker, level, Objects.requireNonNull(target, "target must not be null"), op, raiseExceptions);
            case UNSCHEDULE -> {
                if (target != null && target.isAlive()) {
                    if (target == invoker) {
                        yield true;
                    }
                    yield ownershipRule(invoker, level, target, op, raiseExceptions);
                }
                if (!atLeast(level, JobPermissionLevel.MEDIUM, invoker, op, raiseExceptions)) {
                    yield false;
                }
                JobPermissionLevel classLevel = targetClass != null ? resolveClassLevel(targetClass) : defaultPermissionLevel;
                if (classLevel.isAbove(level)) {
                    yield deny(raiseExceptions, "invoker " + invoker.identifier() + " at " + level
                            + " cannot unschedule jobs of level " + classLevel);
                }
                yield true;
            }
            case FIND -> true;
        };
    }

    private boolean ownershipRule(ManagedJob invoker, JobPermissionLevel level, ManagedJob target, JobOp op,
                                  boolean raiseExceptions) {
        if (!atLeast(level, JobPermissionLevel.MEDIUM, invoker, op, raiseExceptions)) {
            return false;
        }
        JobPermissionLevel targetLevel = levelOf(target);
        if (targetLevel.isAbove(level)) {
            return deny(raiseExceptions, "invoker " + invoker.identifier() + " at " + level + " cannot " + op
                    + " job " + target.identifier() + " at " + targetLevel);
        }
        boolean owner = target.creatorJob() == invoker;
        if ((targetLevel == level || level == JobPermissionLevel.MEDIUM) && !owner) {
            return deny(raiseExceptions, "invoker " + invoker.identifier() + " cannot " + op + " job "
                    + target.identifier() + " it did not create");
        }
        return true;
    }

    private static boolean atLeast(JobPermissionLevel level, JobPermissionLevel required, ManagedJob invoker,
                                   JobOp op, boolean raiseExceptions) {
        if (level.isBelow(required)) {
            return deny(raiseExceptions, "invoker " + invoker.identifier() + " at " + level + " needs "
                    + required + " for " + op);
        }
        return true;
    }

    private static boolean deny(boolean raiseExceptions, String message) {
        if (raiseExceptions) {
            throw new JobPermissionException(message);
        }
        return false;
    }

    private JobPermissionLevel levelOf(ManagedJob job) {
        JobPermissionLevel level = job.permissionLevel();
        return level != null ? level : resolveClassLevel(job.getClass());
    }

    private void checkGuard(ManagedJob invoker, ManagedJob target) {
        ManagedJob guardian = target.guardianJob();
        if (guardian != null && guardian != invoker) {
            throw new JobIsGuardedException("job " + target.identifier() + " is guarded by " + guardian.identifier());
        }
    }

    private ManagedJob jobOf(JobProxy proxy) {
        Objects.requireNonNull(proxy, "proxy must not be null");
        ManagedJob job = proxy.job();
        if (job.jobManager() != this) {
            throw new IllegalArgumentException("job " + job.identifier() + " does not belong to job manager " + identifier);
        }
        return job;
    }

    /* ==== job classes ==== */

    /**
     * Associates a permission level with a job class. A class registered once keeps its level.
     * A {@link JobMetadata#uuid()} declared on the class makes it schedulable.
     *
     * @return false if the class was already registered
     */
    public boolean registerJobClass(Class<? extends ManagedJob> cls, JobPermissionLevel level) {
        Objects.requireNonNull(cls, "cls must not be null");
        Objects.requireNonNull(level, "level must not be null");
        if (level == JobPermissionLevel.SYSTEM) {
            throw new IllegalArgumentException("SYSTEM permission level is reserved for the job manager");
        }
        if (JobManagerJob.class.isAssignableFrom(cls)) {
            throw new IllegalArgumentException("the job manager's own job class cannot be registered");
        }
        synchronized (lock) {
            if (classLevels.containsKey(cls)) {
                return false;
            }
            JobMetadata metadata = cls.getDeclaredAnnotation(JobMetadata.class);
            String uuid = metadata != null && !metadata.uuid().isBlank() ? metadata.uuid() : null;
            if (uuid != null) {
                Class<? extends ManagedJob> existing = classesByUuid.get(uuid);
                if (existing != null && existing != cls) {
                    throw new JobConflictException("job class uuid " + uuid + " is already used by " + existing.getName());
                }
                classesByUuid.put(uuid, cls);
            }
            classLevels.put(cls, level);
        }
        log.debug("job class registered class={} level={}", cls.getName(), level);
        return true;
    }

    public boolean jobClassIsRegistered(Class<? extends ManagedJob> cls) {
        synchronized (lock) {
            return classLevels.containsKey(cls);
        }
    }

    /**
     * Level of the class or of its nearest registered superclass, {@code null} if neither is
     * registered.
     */
    public JobPermissionLevel getJobClassPermissionLevel(Class<? extends ManagedJob> cls) {
        Objects.requireNonNull(cls, "cls must not be null");
        synchronized (lock) {
            for (Class<?> k = cls; k != null && k != ManagedJob.class; k = k.getSuperclass()) {
                JobPermissionLevel level = classLevels.get(k);
                if (level != null) {
                    return level;
                }
            }
            return null;
        }
    }

    private JobPermissionLevel resolveClassLevel(Class<? extends ManagedJob> cls) {
        JobPermissionLevel level = getJobClassPermissionLevel(cls);
        return level != null ? level : defaultPermissionLevel;
    }

    private Class<? extends ManagedJob> classForUuid(String uuid) {
        synchronized (lock) {
            return classesByUuid.get(uuid);
        }
    }

    private static String uuidOf(Class<? extends ManagedJob> cls) {
        JobMetadata metadata = cls.getDeclaredAnnotation(JobMetadata.class);
        return metadata != null && !metadata.uuid().isBlank() ? metadata.uuid() : null;
    }

    /* ==== job lifecycle ==== */

    public JobProxy createJob(Class<? extends ManagedJob> cls) {
        return createJob(managerInvoker(), cls, JobArguments.empty());
    }

    public JobProxy createJob(Class<? extends ManagedJob> cls, JobArguments args) {
        return createJob(managerInvoker(), cls, args);
    }

    JobProxy createJob(ManagedJob invoker, Class<? extends ManagedJob> cls, JobArguments args) {
        checkInitAndRunning();
        Objects.requireNonNull(cls, "cls must not be null");
        verifyPermissions(invoker, JobOp.CREATE, null, cls, null, true);
        ManagedJob job = construct(cls, args != null ? args : JobArguments.empty());
        job.bind(this, invoker);
        log.debug("job created id={} creator={}", job.identifier(), invoker.identifier());
        return job.proxy();
    }

    private static ManagedJob construct(Class<? extends ManagedJob> cls, JobArguments args) {
        if (Modifier.isAbstract(cls.getModifiers())) {
            throw new IllegalArgumentException("job class " + cls.getName() + " is abstract");
        }
        try {
            Constructor<? extends ManagedJob> ctor;
            try {
                ctor = cls.getDeclaredConstructor(JobArguments.class);
                ctor.setAccessible(true);
                return ctor.newInstance(args);
            } catch (NoSuchMethodException e) {
                if (!args.isEmpty()) {
                    throw new IllegalArgumentException("job class " + cls.getName()
                            + " takes no arguments but arguments were given", e);
                }
                ctor = cls.getDeclaredConstructor();
                ctor.setAccessible(true);
                return ctor.newInstance();
            }
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof JobException je) {
                throw je;
            }
            throw new JobException("job class " + cls.getName() + " could not be constructed: " + cause, cause);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("job class " + cls.getName()
                    + " needs a no-argument or a JobArguments constructor", e);
        } catch (ReflectiveOperationException e) {
            throw new JobException("job class " + cls.getName() + " could not be constructed", e);
        }
    }

    /**
     * @throws io.jobs4j.core.JobInitializationException if {@link ManagedJob#onInit()} fails
     */
    public JobProxy initializeJob(JobProxy proxy) {
        return initializeJob(managerInvoker(), proxy);
    }

    JobProxy initializeJob(ManagedJob invoker, JobProxy proxy) {
        checkInitAndRunning();
        ManagedJob job = jobOf(proxy);
        verifyPermissions(invoker, JobOp.INITIALIZE, job, null, null, true);
        checkGuard(invoker, job);
        job.initializeInternal();
        return proxy;
    }

    public JobProxy registerJob(JobProxy proxy) {
        return registerJob(managerInvoker(), proxy, null, true);
    }

    /**
     * Adds an initialized job to the registry, initializing it first if needed.
     *
     * @param level explicit level, {@code null} for the level of the job's class or the default
     * @throws JobConflictException if the class is a singleton and another instance is alive
     */
    public JobProxy registerJob(JobProxy proxy, JobPermissionLevel level, boolean start) {
        return registerJob(managerInvoker(), proxy, level, start);
    }

    JobProxy registerJob(ManagedJob invoker, JobProxy proxy, JobPermissionLevel level, boolean start) {
        checkInitAndRunning();
        ManagedJob job = jobOf(proxy);
        if (job.isDone()) {
            throw new JobIsDoneException("job " + job.identifier() + " is already done");
        }
        JobPermissionLevel resolved = level != null ? level : resolveClassLevel(job.getClass());
        verifyPermissions(invoker, JobOp.REGISTER, job, null, resolved, true);
        checkGuard(invoker, job);
        if (!job.isInitialized()) {
            job.initializeInternal();
        }
        synchronized (lock) {
            if (jobs.containsKey(job.identifier())) {
                throw new JobStateException("job " + job.identifier() + " is already registered");
            }
            JobMetadata metadata = job.getClass().getAnnotation(JobMetadata.class);
            if (metadata != null && metadata.singleton()) {
                Set<ManagedJob> live = instancesByClass.get(job.getClass());
                if (live != null && !live.isEmpty()) {
                    throw new JobConflictException("job class " + job.getClass().getName()
                            + " is a singleton and already has a live instance");
                }
            }
            addJob(job, resolved);
        }
        log.debug("job registered id={} level={} start={}", job.identifier(), resolved, start);
        if (start) {
            job.startInternal();
        }
        return proxy;
    }

    // caller holds lock
    private void addJob(ManagedJob job, JobPermissionLevel level) {
        jobs.put(job.identifier(), job);
        instancesByClass.computeIfAbsent(job.getClass(), k -> new LinkedHashSet<>()).add(job);
        EventSource source = job.eventSource();
        if (source != null) {
            for (Class<? extends JobEvent> type : source.eventTypes()) {
                eventJobs.computeIfAbsent(type, k -> new LinkedHashSet<>()).add(job);
            }
        }
        job.markRegistered(level);
    }

    // caller holds lock
    private void removeJob(ManagedJob job) {
        jobs.remove(job.identifier());
        Set<ManagedJob> instances = instancesByClass.get(job.getClass());
        if (instances != null) {
            instances.remove(job);
            if (instances.isEmpty()) {
                instancesByClass.remove(job.getClass());
            }
        }
        eventJobs.values().removeIf(set -> set.remove(job) && set.isEmpty());
    }

    /**
     * Called once by a job when it completes or is killed.
     */
    void jobDone(ManagedJob job) {
        synchronized (lock) {
            ManagedJob guardian = job.guardianJob();
            if (guardian != null) {
                guardian.guardedJobs().remove(job);
                job.releaseGuardian();
            }
            for (ManagedJob guarded : List.copyOf(job.guardedJobs())) {
                guarded.releaseGuardian();
            }
            job.guardedJobs().clear();
            removeJob(job);
        }
        job.proxy().detach();
        log.debug("job ejected id={} status={}", job.identifier(), job.status());
    }

    public JobProxy createAndRegisterJob(Class<? extends ManagedJob> cls) {
        return createAndRegisterJob(managerInvoker(), cls, JobArguments.empty(), null, true);
    }

    public JobProxy createAndRegisterJob(Class<? extends ManagedJob> cls, JobArguments args) {
        return createAndRegisterJob(managerInvoker(), cls, args, null, true);
    }

    public JobProxy createAndRegisterJob(Class<? extends ManagedJob> cls, JobArguments args,
                                         JobPermissionLevel level, boolean start) {
        return createAndRegisterJob(managerInvoker(), cls, args, level, start);
    }

    JobProxy createAndRegisterJob(ManagedJob invoker, Class<? extends ManagedJob> cls, JobArguments args,
                                  JobPermissionLevel level, boolean start) {
        JobProxy proxy = createJob(invoker, cls, args);
        initializeJob(invoker, proxy);
        return registerJob(invoker, proxy, level, start);
    }

    /**
     * @return false if the job is already running
     * @throws JobNotAliveException if the job is not registered or not initialized
     */
    public boolean startJob(JobProxy proxy) {
        return startJob(managerInvoker(), proxy);
    }

    boolean startJob(ManagedJob invoker, JobProxy proxy) {
        checkInitAndRunning();
        ManagedJob job = jobOf(proxy);
        verifyPermissions(invoker, JobOp.START, job, null, null, true);
        checkGuard(invoker, job);
        requireAlive(job);
        return job.startInternal();
    }

    public boolean restartJob(JobProxy proxy, Duration stopTimeout) {
        return restartJob(managerInvoker(), proxy, stopTimeout);
    }

    boolean restartJob(ManagedJob invoker, JobProxy proxy, Duration stopTimeout) {
        checkInitAndRunning();
        ManagedJob job = jobOf(proxy);
        verifyPermissions(invoker, JobOp.RESTART, job, null, null, true);
        checkGuard(invoker, job);
        requireAlive(job);
        job.setPendingStopTimeout(validStopTimeout(stopTimeout));
        return job.restartExternal();
    }

    /**
     * @param stopTimeout limit for the job's stop hook, {@code null} for the manager's default
     */
    public boolean stopJob(JobProxy proxy, Duration stopTimeout, boolean force) {
        return stopJob(managerInvoker(), proxy, stopTimeout, force);
    }

    boolean stopJob(ManagedJob invoker, JobProxy proxy, Duration stopTimeout, boolean force) {
        checkInitAndRunning();
        ManagedJob job = jobOf(proxy);
        verifyPermissions(invoker, JobOp.STOP, job, null, null, true);
        checkGuard(invoker, job);
        requireAlive(job);
        job.setPendingStopTimeout(validStopTimeout(stopTimeout));
        return job.stopExternal(force);
    }

    /**
     * Kills a job. A job that is not running is started without its start hook so that its stop
     * hook runs before the kill.
     */
    public boolean killJob(JobProxy proxy, Duration stopTimeout) {
        return killJob(managerInvoker(), proxy, stopTimeout);
    }

    boolean killJob(ManagedJob invoker, JobProxy proxy, Duration stopTimeout) {
        checkInitAndRunning();
        ManagedJob job = jobOf(proxy);
        verifyPermissions(invoker, JobOp.KILL, job, null, null, true);
        checkGuard(invoker, job);
        job.setPendingStopTimeout(validStopTimeout(stopTimeout));
        return job.killExternal(true);
    }

    private static void requireAlive(ManagedJob job) {
        if (!job.isAlive()) {
            throw new JobNotAliveException("job " + job.identifier() + " is not alive");
        }
    }

    /* ==== guarding ==== */

    public void guardJob(JobProxy proxy) {
        guardJob(managerInvoker(), proxy);
    }

    void guardJob(ManagedJob invoker, JobProxy proxy) {
        checkInitAndRunning();
        ManagedJob job = jobOf(proxy);
        if (job == invoker) {
            throw new IllegalArgumentException("a job cannot guard itself");
        }
        verifyPermissions(invoker, JobOp.GUARD, job, null, null, true);
        synchronized (lock) {
            if (job.isDone()) {
                throw new JobIsDoneException("job " + job.identifier() + " is already done");
            }
            job.assignGuardian(invoker);
            invoker.guardedJobs().add(job);
        }
        log.debug("job guarded id={} guardian={}", job.identifier(), invoker.identifier());
    }

    public void unguardJob(JobProxy proxy) {
        unguardJob(managerInvoker(), proxy);
    }

    void unguardJob(ManagedJob invoker, JobProxy proxy) {
        checkInitAndRunning();
        ManagedJob job = jobOf(proxy);
        verifyPermissions(invoker, JobOp.UNGUARD, job, null, null, true);
        synchronized (lock) {
            ManagedJob guardian = job.guardianJob();
            if (guardian == null) {
                throw new JobStateException("job " + job.identifier() + " is not being guarded");
            }
            if (guardian != invoker && invoker != managerJob) {
                throw new JobIsGuardedException("job " + job.identifier() + " is guarded by " + guardian.identifier());
            }
            guardian.guardedJobs().remove(job);
            job.releaseGuardian();
        }
        log.debug("job unguarded id={}", job.identifier());
    }

    /**
     * Guards a job until the returned handle is closed.
     *
     * <pre>{@code
     * try (JobManager.JobGuard guard = manager.guardingJob(proxy)) {
     *     // nobody else can stop or kill the job here
     * }
     * }</pre>
     */
    public JobGuard guardingJob(JobProxy proxy) {
        return guardingJob(managerInvoker(), proxy);
    }

    JobGuard guardingJob(ManagedJob invoker, JobProxy proxy) {
        guardJob(invoker, proxy);
        return new JobGuard() {
            private final AtomicBoolean closed = new AtomicBoolean(false);

            @Override
            public JobProxy target() {
                return proxy;
            }

            @Override
            public void close() {
                if (closed.compareAndSet(false, true) && !proxy.isDone() && proxy.guardian() != null) {
                    unguardJob(invoker, proxy);
                }
            }
        };
    }

    /* ==== bulk operations ==== */

    /**
     * Stops every job except the manager's own, ignoring guards.
     */
    public void stopAllJobs(boolean force) {
        checkInitAndRunning();
        for (ManagedJob job : registeredJobs()) {
            if (job != managerJob) {
                job.stopExternal(force);
            }
        }
    }

    /**
     * Kills every job except the manager's own, ignoring guards.
     */
    public void killAllJobs(boolean awaken) {
        checkInitAndRunning();
        for (ManagedJob job : registeredJobs()) {
            if (job != managerJob) {
                job.killExternal(awaken);
            }
        }
    }

    private List<ManagedJob> registeredJobs() {
        synchronized (lock) {
            return new ArrayList<>(jobs.values());
        }
    }

    /* ==== lookup ==== */

    public boolean hasJob(JobProxy proxy) {
        Objects.requireNonNull(proxy, "proxy must not be null");
        synchronized (lock) {
            ManagedJob job = jobs.get(proxy.identifier());
            return job != null && job.proxy() == proxy;
        }
    }

    public boolean hasJobIdentifier(String identifier) {
        synchronized (lock) {
            return jobs.containsKey(identifier);
        }
    }

    /**
     * @return the level the job was registered with, {@code null} if it is not registered here
     */
    public JobPermissionLevel getJobPermissionLevel(JobProxy proxy) {
        Objects.requireNonNull(proxy, "proxy must not be null");
        synchronized (lock) {
            ManagedJob job = jobs.get(proxy.identifier());
            return job != null ? job.permissionLevel() : null;
        }
    }

    public JobProxy findJob(String identifier) {
        return findJob(managerInvoker(), identifier);
    }

    JobProxy findJob(ManagedJob invoker, String identifier) {
        checkInit();
        verifyPermissions(invoker, JobOp.FIND, null, null, null, true);
        synchronized (lock) {
            ManagedJob job = jobs.get(identifier);
            return job != null ? job.proxy() : null;
        }
    }

    /**
     * Registered jobs matching the query, in registration order. The manager's own job is never
     * returned.
     */
    public List<JobProxy> findJobs(JobQuery query) {
        return findJobs(managerInvoker(), query);
    }

    List<JobProxy> findJobs(ManagedJob invoker, JobQuery query) {
        checkInit();
        Objects.requireNonNull(query, "query must not be null");
        verifyPermissions(invoker, JobOp.FIND, null, null, null, true);
        List<JobProxy> found = new ArrayList<>();
        for (ManagedJob job : registeredJobs()) {
            if (job == managerJob || !query.matches(job)) {
                continue;
            }
            found.add(job.proxy());
            if (query.limit() > 0 && found.size() >= query.limit()) {
                break;
            }
        }
        return found;
    }

    /* ==== events ==== */

    /**
     * Hands a copy of the event to every pending {@link #waitForEvent} whose types and check
     * match, then to every registered event job listening for its type.
     */
    public void dispatchEvent(JobEvent event) {
        dispatchEvent(managerInvoker(), event);
    }

    void dispatchEvent(ManagedJob invoker, JobEvent event) {
        checkInitAndRunning();
        Objects.requireNonNull(event, "event must not be null");
        verifyPermissions(invoker, event instanceof CustomJobEvent ? JobOp.CUSTOM_EVENT_DISPATCH : JobOp.EVENT_DISPATCH,
                null, null, null, true);
        event.assignDispatcher(invoker.proxy());

        List<EventWaiter> matched = new ArrayList<>();
        Set<ManagedJob> receivers = new LinkedHashSet<>();
        synchronized (lock) {
            eventWaiters.removeIf(w -> w.future().isDone());
            for (EventWaiter w : eventWaiters) {
                if (w.types().stream().anyMatch(t -> t.isInstance(event)) && testQuietly(w.check(), event)) {
                    matched.add(w);
                }
            }
            eventWaiters.removeAll(matched);
            for (Map.Entry<Class<? extends JobEvent>, Set<ManagedJob>> e : eventJobs.entrySet()) {
                if (e.getKey().isInstance(event)) {
                    receivers.addAll(e.getValue());
                }
            }
        }

        Set<ManagedJob> alreadyReceived = new HashSet<>();
        for (EventWaiter w : matched) {
            if (w.future().complete(event.copy()) && w.owner() != null) {
                alreadyReceived.add(w.owner());
            }
        }
        for (ManagedJob job : receivers) {
            EventSource source = job.eventSource();
            if (source == null || (alreadyReceived.contains(job) && !source.allowsDoubleDispatch())) {
                continue;
            }
            JobEvent copy = event.copy();
            if (source.eventCheck(copy)) {
                source.addEvent(copy);
            }
        }
    }

    private static boolean testQuietly(Predicate<JobEvent> check, JobEvent event) {
        if (check == null) {
            return true;
        }
        try {
            return check.test(event);
        } catch (RuntimeException e) {
            log.warn("event wait check failed event={} msg={}", event, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Resolves with a copy of the next dispatched event that is an instance of one of
     * {@code types} and passes {@code check}.
     *
     * @param check   {@code null} to accept every event of the types
     * @param timeout {@code null} to wait indefinitely
     */
    public CompletableFuture<JobEvent> waitForEvent(Set<Class<? extends JobEvent>> types,
                                                    Predicate<JobEvent> check, Duration timeout) {
        return waitForEvent(managerInvoker(), types, check, timeout);
    }

    public <E extends JobEvent> CompletableFuture<E> waitForEvent(Class<E> type, Predicate<? super E> check,
                                                                  Duration timeout) {
        return waitForEvent(managerInvoker(), type, check, timeout);
    }

    <E extends JobEvent> CompletableFuture<E> waitForEvent(ManagedJob invoker, Class<E> type,
                                                           Predicate<? super E> check, Duration timeout) {
        Objects.requireNonNull(type, "type must not be null");
        Predicate<JobEvent> typed = check == null ? null : e -> check.test(type.cast(e));
        return waitForEvent(invoker, Set.of(type), typed, timeout).thenApply(type::cast);
    }

    CompletableFuture<JobEvent> waitForEvent(ManagedJob invoker, Set<Class<? extends JobEvent>> types,
                                             Predicate<JobEvent> check, Duration timeout) {
        checkInitAndRunning();
        Objects.requireNonNull(types, "types must not be null");
        if (types.isEmpty()) {
            throw new IllegalArgumentException("types must not be empty");
        }
        CompletableFuture<JobEvent> future = new CompletableFuture<>();
        synchronized (lock) {
            eventWaiters.add(new EventWaiter(Set.copyOf(types), check, future, invoker));
        }
        if (timeout != null) {
            future.orTimeout(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        }
        return future;
    }

    /* ==== scheduling ==== */

    /**
     * Schedules the creation of a job.
     *
     * @param at             first due time
     * @param recurInterval  {@code null} or {@link Duration#ZERO} for a one-shot schedule, otherwise
     *                       the recurrence interval
     * @param maxRecurrences number of occurrences of a recurring schedule, {@code -1} for unlimited
     * @return the schedule identifier
     * @throws JobSchedulingException if the class has no registered uuid or the arguments are invalid
     */
    public String createJobSchedule(Class<? extends ManagedJob> cls, Instant at, Duration recurInterval,
                                    int maxRecurrences, JobArguments args) {
        return createJobSchedule(managerInvoker(), cls, at, recurInterval, maxRecurrences, args);
    }

    String createJobSchedule(ManagedJob invoker, Class<? extends ManagedJob> cls, Instant at, Duration recurInterval,
                             int maxRecurrences, JobArguments args) {
        checkInitAndRunning();
        Objects.requireNonNull(cls, "cls must not be null");
        Objects.requireNonNull(at, "at must not be null");
        verifyPermissions(invoker, JobOp.SCHEDULE, null, cls, null, true);

        String uuid = uuidOf(cls);
        if (uuid == null || classForUuid(uuid) != cls) {
            throw new JobSchedulingException("job class " + cls.getName() + " is not registered with a uuid");
        }
        long interval;
        if (recurInterval == null || recurInterval.isZero()) {
            interval = ScheduleRecord.NO_RECURRENCE;
        } else if (recurInterval.isNegative()) {
            throw new JobSchedulingException("recurInterval must not be negative");
        } else {
            try {
                interval = recurInterval.toNanos();
            } catch (ArithmeticException e) {
                throw new JobSchedulingException("recurInterval " + recurInterval + " is too large", e);
            }
        }
        if (interval != ScheduleRecord.NO_RECURRENCE && maxRecurrences != ScheduleRecord.UNLIMITED && maxRecurrences <= 0) {
            throw new JobSchedulingException("maxRecurrences must be positive or -1 for unlimited");
        }
        long target;
        try {
            target = Timestamps.epochNanos(at);
        } catch (ArithmeticException e) {
            throw new JobSchedulingException("at " + at + " is out of the schedulable range", e);
        }
        if (target <= 0) {
            throw new JobSchedulingException("at must be after the epoch");
        }
        long scheduled = Timestamps.uniqueNowNanos();
        JobArguments arguments = args != null ? args : JobArguments.empty();
        String scheduleId = identifier + "-" + target + "-" + scheduled;
        ScheduleRecord record = new ScheduleRecord(scheduleId, invoker.identifier(), scheduled, target, interval, 0,
                interval == ScheduleRecord.NO_RECURRENCE ? 0 : maxRecurrences, uuid, arguments.args(), arguments.kwargs());
        schedules.add(record);
        log.debug("job schedule created id={} class={} at={}", scheduleId, cls.getName(), at);
        return scheduleId;
    }

    /**
     * @throws JobSchedulingException if no pending schedule has this identifier
     */
    public void removeJobSchedule(String scheduleIdentifier) {
        removeJobSchedule(managerInvoker(), scheduleIdentifier);
    }

    void removeJobSchedule(ManagedJob invoker, String scheduleIdentifier) {
        checkInitAndRunning();
        Objects.requireNonNull(scheduleIdentifier, "scheduleIdentifier must not be null");
        ScheduleRecord record = findScheduleRecord(scheduleIdentifier);
        ManagedJob scheduler;
        synchronized (lock) {
            scheduler = jobs.get(record.scheduleCreatorIdentifier());
        }
        Class<? extends ManagedJob> cls = classForUuid(record.classUuid());
        verifyPermissions(invoker, JobOp.UNSCHEDULE, scheduler, cls, null, true);
        if (!schedules.remove(scheduleIdentifier)) {
            throw new JobSchedulingException("no schedule with identifier " + scheduleIdentifier);
        }
        log.debug("job schedule removed id={}", scheduleIdentifier);
    }

    private ScheduleRecord findScheduleRecord(String scheduleIdentifier) {
        ScheduleRecord record = schedules.get(scheduleIdentifier);
        if (record == null) {
            throw new JobSchedulingException("no schedule with identifier " + scheduleIdentifier);
        }
        return record;
    }

    public boolean hasJobSchedule(String scheduleIdentifier) {
        return schedules.contains(scheduleIdentifier);
    }

    public boolean jobScheduleHasFailed(String scheduleIdentifier) {
        return schedules.hasFailed(scheduleIdentifier);
    }

    public List<String> getJobScheduleIdentifiers() {
        return schedules.identifiers();
    }

    public List<ScheduleFailure> getScheduleFailures() {
        return schedules.failures();
    }

    /**
     * Returns the schedule postmortems and forgets them.
     */
    public List<ScheduleFailure> drainScheduleFailures() {
        return schedules.drainFailures();
    }

    public ScheduleSnapshot exportSchedules() {
        return schedules.export();
    }

    public byte[] exportSchedulesBytes() {
        return schedules.exportBytes();
    }

    /**
     * @throws JobSchedulingException if schedules exist and {@code overwrite} is false
     */
    public void importSchedules(ScheduleSnapshot snapshot, boolean overwrite) {
        schedules.importSnapshot(snapshot, overwrite);
    }

    /**
     * @param eager decode every record now instead of when its bucket first comes due
     */
    public void importSchedules(byte[] data, boolean overwrite, boolean eager) {
        schedules.importBytes(data, overwrite, eager);
    }

    /**
     * One scheduling pass, run by the manager's own job.
     */
    void runSchedulingPass() {
        if (!props.isSchedulingEnabled() || !running) {
            return;
        }
        schedules.runPass(Timestamps.nowNanos(), props.getSchedulingYieldEvery(), this::instantiateScheduled);
    }

    private void instantiateScheduled(ScheduleRecord record) {
        Class<? extends ManagedJob> cls = classForUuid(record.classUuid());
        if (cls == null) {
            throw new JobSchedulingException("no job class registered with uuid " + record.classUuid());
        }
        ManagedJob creator;
        synchronized (lock) {
            creator = jobs.get(record.scheduleCreatorIdentifier());
        }
        if (creator == null || !creator.isAlive()) {
            creator = managerJob;
        }
        ManagedJob job = construct(cls, record.arguments());
        job.bind(this, creator);
        job.assignScheduleIdentifier(record.scheduleIdentifier());
        job.initializeInternal();
        synchronized (lock) {
            JobMetadata metadata = cls.getAnnotation(JobMetadata.class);
            if (metadata != null && metadata.singleton()) {
                Set<ManagedJob> live = instancesByClass.get(cls);
                if (live != null && !live.isEmpty()) {
                    throw new JobConflictException("job class " + cls.getName()
                            + " is a singleton and already has a live instance");
                }
            }
            addJob(job, resolveClassLevel(cls));
        }
        log.debug("scheduled job registered id={} schedule={}", job.identifier(), record.scheduleIdentifier());
        job.startInternal();
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "JobManager{id=" + identifier + ", jobs=" + jobs.size() + ", running=" + running + "}";
        }
    }

    private ManagedJob managerInvoker() {
        JobManagerJob job = managerJob;
        if (job == null) {
            throw new IllegalStateException("job manager " + identifier + " is not initialized");
        }
        return job;
    }
}
