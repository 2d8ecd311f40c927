package io.jobs4j;

import io.jobs4j.core.JobIsDoneException;
import io.jobs4j.core.JobPermissionLevel;
import io.jobs4j.core.JobStateException;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.JobStopReason;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Read-mostly handle to a job, the only way jobs and hosts see other jobs.
 *
 * <p>While the job is alive, calls go to the job itself. Once the job is done and ejected from
 * its manager, the proxy serves a {@link Snapshot} taken at that moment instead, so reads keep
 * working and waits resolve immediately.
 */
public final class JobProxy {

    private interface State {
    }

    private record Live(ManagedJob job) implements State {
    }

    private record Cached(Snapshot snapshot) implements State {
    }

    /**
     * Final state of a job, taken when it leaves its manager.
     */
    public record Snapshot(
            String identifier,
            Class<? extends ManagedJob> jobClass,
            JobProxy creator,
            JobPermissionLevel permissionLevel,
            Instant createdAt,
            Instant registeredAt,
            Instant completedAt,
            Instant killedAt,
            String scheduleIdentifier,
            JobStatus status,
            JobStopReason lastStoppingReason,
            boolean runFailed,
            Map<String, Object> outputFields,
            Map<String, List<Object>> outputQueues,
            Set<String> outputFieldNames,
            Set<String> publicMethodNames
    ) {
    }

    private final String identifier;
    private final Class<? extends ManagedJob> jobClass;
    private volatile State state;

    JobProxy(ManagedJob job) {
        this.identifier = job.identifier();
        this.jobClass = job.getClass();
        this.state = new Live(job);
    }

    /**
     * Switches to the cached variant. Called once, when the job leaves its manager.
     */
    void detach() {
        if (!(state instanceof Live live)) {
            return;
        }
        ManagedJob job = live.job();
        this.state = new Cached(new Snapshot(
                job.identifier(),
                job.getClass(),
                job.creator(),
                job.permissionLevel(),
                job.createdAt(),
                job.registeredAt(),
                job.completedAt(),
                job.killedAt(),
                job.scheduleIdentifier(),
                job.status(),
                job.getLastStoppingReason(),
                job.runFailed(),
                job.outputFieldValues(),
                job.outputQueueValues(),
                job.getOutputFieldNames(),
                job.getPublicMethodNames()
        ));
    }

    private ManagedJob live() {
        return state instanceof Live l ? l.job() : null;
    }

    private Snapshot cached() {
        return ((Cached) state).snapshot();
    }

    /**
     * The live job.
     *
     * @throws JobIsDoneException if the job already left its manager
     */
    ManagedJob job() {
        ManagedJob job = live();
        if (job == null) {
            throw new JobIsDoneException("job " + identifier + " is done");
        }
        return job;
    }

    public boolean isCached() {
        return state instanceof Cached;
    }

    public Snapshot snapshot() {
        return state instanceof Cached c ? c.snapshot() : null;
    }

    /* ==== identity ==== */

    public String identifier() {
        return identifier;
    }

    public Class<? extends ManagedJob> jobClass() {
        return jobClass;
    }

    public JobProxy creator() {
        ManagedJob job = live();
        return job != null ? job.creator() : cached().creator();
    }

    public JobProxy guardian() {
        ManagedJob job = live();
        return job != null ? job.guardian() : null;
    }

    public JobPermissionLevel permissionLevel() {
        ManagedJob job = live();
        return job != null ? job.permissionLevel() : cached().permissionLevel();
    }

    public String scheduleIdentifier() {
        ManagedJob job = live();
        return job != null ? job.scheduleIdentifier() : cached().scheduleIdentifier();
    }

    public boolean wasScheduled() {
        return scheduleIdentifier() != null;
    }

    /* ==== timestamps ==== */

    public Instant createdAt() {
        ManagedJob job = live();
        return job != null ? job.createdAt() : cached().createdAt();
    }

    public Instant registeredAt() {
        ManagedJob job = live();
        return job != null ? job.registeredAt() : cached().registeredAt();
    }

    public Instant initializedSince() {
        ManagedJob job = live();
        return job != null ? job.initializedSince() : null;
    }

    public Instant aliveSince() {
        ManagedJob job = live();
        return job != null ? job.aliveSince() : null;
    }

    public Instant runningSince() {
        ManagedJob job = live();
        return job != null ? job.runningSince() : null;
    }

    public Instant stoppedSince() {
        ManagedJob job = live();
        return job != null ? job.stoppedSince() : null;
    }

    public Instant idlingSince() {
        ManagedJob job = live();
        return job != null ? job.idlingSince() : null;
    }

    public Instant completedAt() {
        ManagedJob job = live();
        return job != null ? job.completedAt() : cached().completedAt();
    }

    public Instant killedAt() {
        ManagedJob job = live();
        return job != null ? job.killedAt() : cached().killedAt();
    }

    public Instant doneSince() {
        Instant completed = completedAt();
        return completed != null ? completed : killedAt();
    }

    /* ==== state ==== */

    public JobStatus status() {
        ManagedJob job = live();
        return job != null ? job.status() : cached().status();
    }

    public int loopCount() {
        ManagedJob job = live();
        return job != null ? job.loopCount() : 0;
    }

    public boolean isInitialized() {
        ManagedJob job = live();
        return job != null && job.isInitialized();
    }

    public boolean isInitializing() {
        ManagedJob job = live();
        return job != null && job.isInitializing();
    }

    public boolean isAlive() {
        ManagedJob job = live();
        return job != null && job.isAlive();
    }

    public boolean isStarting() {
        ManagedJob job = live();
        return job != null && job.isStarting();
    }

    public boolean isRunning() {
        ManagedJob job = live();
        return job != null && job.isRunning();
    }

    public boolean isIdling() {
        ManagedJob job = live();
        return job != null && job.isIdling();
    }

    public boolean isStopping() {
        ManagedJob job = live();
        return job != null && job.isStopping();
    }

    public boolean isStopped() {
        ManagedJob job = live();
        return job != null && job.isStopped();
    }

    public boolean isRestarting() {
        ManagedJob job = live();
        return job != null && job.isRestarting();
    }

    public boolean isCompleting() {
        ManagedJob job = live();
        return job != null && job.isCompleting();
    }

    public boolean isBeingKilled() {
        ManagedJob job = live();
        return job != null && job.isBeingKilled();
    }

    public boolean isBeingStartupKilled() {
        ManagedJob job = live();
        return job != null && job.isBeingStartupKilled();
    }

    public boolean isDone() {
        ManagedJob job = live();
        return job == null || job.isDone();
    }

    public boolean isCompleted() {
        return status() == JobStatus.COMPLETED;
    }

    public boolean isKilled() {
        return status() == JobStatus.KILLED;
    }

    public boolean isBeingGuarded() {
        ManagedJob job = live();
        return job != null && job.isBeingGuarded();
    }

    public boolean runFailed() {
        ManagedJob job = live();
        return job != null ? job.runFailed() : cached().runFailed();
    }

    public JobStopReason getStoppingReason() {
        ManagedJob job = live();
        return job != null ? job.getStoppingReason() : null;
    }

    public JobStopReason getLastStoppingReason() {
        ManagedJob job = live();
        return job != null ? job.getLastStoppingReason() : cached().lastStoppingReason();
    }

    /**
     * Next due run of an {@link IntervalJob}, {@code null} for other jobs or while not running.
     */
    public Instant intervalJobNextIteration() {
        return live() instanceof IntervalJob interval ? interval.nextIteration() : null;
    }

    /* ==== waits ==== */

    public CompletableFuture<JobStatus> awaitDone(Duration timeout) {
        ManagedJob job = live();
        return job != null ? job.awaitDone(timeout) : CompletableFuture.completedFuture(cached().status());
    }

    public CompletableFuture<JobStatus> awaitStop(Duration timeout) {
        return job().awaitStop(timeout);
    }

    public CompletableFuture<Void> awaitUnguard(Duration timeout) {
        ManagedJob job = live();
        if (job == null) {
            throw new JobStateException("job " + identifier + " is not being guarded");
        }
        return job.awaitUnguard(timeout);
    }

    /* ==== outputs ==== */

    public Set<String> getOutputFieldNames() {
        ManagedJob job = live();
        return job != null ? job.getOutputFieldNames() : cached().outputFieldNames();
    }

    public boolean hasOutputFieldName(String name) {
        return getOutputFieldNames().contains(name);
    }

    public Set<String> getOutputQueueNames() {
        ManagedJob job = live();
        return job != null ? job.getOutputQueueNames() : cached().outputQueues().keySet();
    }

    public boolean hasOutputQueueName(String name) {
        return getOutputQueueNames().contains(name);
    }

    public Object getOutputField(String name) {
        ManagedJob job = live();
        if (job != null) {
            return job.getOutputField(name);
        }
        Snapshot s = cached();
        if (!s.outputFieldNames().contains(name)) {
            throw new IllegalArgumentException("job class " + jobClass.getName() + " declares no output field '" + name + "'");
        }
        if (!s.outputFields().containsKey(name)) {
            throw new JobStateException("output field '" + name + "' of job " + identifier + " is not set");
        }
        return s.outputFields().get(name);
    }

    public Object getOutputField(String name, Object defaultValue) {
        ManagedJob job = live();
        if (job != null) {
            return job.getOutputField(name, defaultValue);
        }
        return cached().outputFields().getOrDefault(name, defaultValue);
    }

    public boolean outputFieldIsSet(String name) {
        ManagedJob job = live();
        return job != null ? job.outputFieldIsSet(name) : cached().outputFields().containsKey(name);
    }

    public CompletableFuture<Object> awaitOutputField(String name, Duration timeout) {
        ManagedJob job = live();
        if (job != null) {
            return job.awaitOutputField(name, timeout);
        }
        if (cached().outputFields().containsKey(name)) {
            return CompletableFuture.completedFuture(cached().outputFields().get(name));
        }
        throw new JobIsDoneException("job " + identifier + " is already done");
    }

    public List<Object> getOutputQueueContents(String name) {
        ManagedJob job = live();
        if (job != null) {
            return job.getOutputQueueContents(name);
        }
        List<Object> values = cached().outputQueues().get(name);
        if (values == null) {
            throw new IllegalArgumentException("job class " + jobClass.getName() + " declares no output queue '" + name + "'");
        }
        return values;
    }

    public boolean outputQueueIsEmpty(String name) {
        return getOutputQueueContents(name).isEmpty();
    }

    public CompletableFuture<Object> awaitOutputQueueAdd(String name, Duration timeout, boolean cancelIfCleared) {
        return job().awaitOutputQueueAdd(name, timeout, cancelIfCleared);
    }

    /**
     * A new independent consumer of the job's output queues. After the job is done, the consumer
     * reads the final queue contents.
     */
    public JobOutputQueueProxy getOutputQueueProxy() {
        ManagedJob job = live();
        if (job != null) {
            return job.getOutputQueueProxy();
        }
        Map<String, List<Object>> queues = cached().outputQueues();
        return new JobOutputQueueProxy(this, queues.keySet(), queues::get, new Object());
    }

    /* ==== public methods ==== */

    public Set<String> getPublicMethodNames() {
        ManagedJob job = live();
        return job != null ? job.getPublicMethodNames() : cached().publicMethodNames();
    }

    public boolean hasPublicMethodName(String name) {
        return getPublicMethodNames().contains(name);
    }

    /**
     * Invokes a {@link PublicJobMethod} of the job on the caller's thread.
     *
     * @throws JobIsDoneException if the job is done
     */
    public Object runPublicMethod(String name, Object... args) {
        return job().runPublicMethod(name, args);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof JobProxy other && identifier.equals(other.identifier);
    }

    @Override
    public int hashCode() {
        return identifier.hashCode();
    }

    @Override
    public String toString() {
        return "JobProxy{id=" + identifier + ", status=" + status() + (isCached() ? ", cached" : "") + "}";
    }
}
