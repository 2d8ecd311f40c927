package io.jobs4j;

import io.jobs4j.core.JobArguments;
import io.jobs4j.core.JobOp;
import io.jobs4j.core.JobPermissionLevel;
import io.jobs4j.events.JobEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * The manager as seen from inside a job. Every operation runs with the owning job as invoker, so
 * permission checks use that job's level and creator relations.
 */
public final class JobManagerProxy {

    private final JobManager manager;
    private final ManagedJob invoker;

    JobManagerProxy(JobManager manager, ManagedJob invoker) {
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
    }

    public String identifier() {
        return manager.identifier();
    }

    public Duration getGlobalJobStopTimeout() {
        return manager.getGlobalJobStopTimeout();
    }

    public JobPermissionLevel getDefaultPermissionLevel() {
        return manager.getDefaultPermissionLevel();
    }

    /* ==== jobs ==== */

    public JobProxy createJob(Class<? extends ManagedJob> cls) {
        return manager.createJob(invoker, cls, JobArguments.empty());
    }

    public JobProxy createJob(Class<? extends ManagedJob> cls, JobArguments args) {
        return manager.createJob(invoker, cls, args);
    }

    public JobProxy initializeJob(JobProxy proxy) {
        return manager.initializeJob(invoker, proxy);
    }

    public JobProxy registerJob(JobProxy proxy) {
        return manager.registerJob(invoker, proxy, null, true);
    }

    public JobProxy registerJob(JobProxy proxy, JobPermissionLevel level, boolean start) {
        return manager.registerJob(invoker, proxy, level, start);
    }

    public JobProxy createAndRegisterJob(Class<? extends ManagedJob> cls) {
        return manager.createAndRegisterJob(invoker, cls, JobArguments.empty(), null, true);
    }

    public JobProxy createAndRegisterJob(Class<? extends ManagedJob> cls, JobArguments args) {
        return manager.createAndRegisterJob(invoker, cls, args, null, true);
    }

    public JobProxy createAndRegisterJob(Class<? extends ManagedJob> cls, JobArguments args,
                                         JobPermissionLevel level, boolean start) {
        return manager.createAndRegisterJob(invoker, cls, args, level, start);
    }

    public boolean startJob(JobProxy proxy) {
        return manager.startJob(invoker, proxy);
    }

    public boolean restartJob(JobProxy proxy, Duration stopTimeout) {
        return manager.restartJob(invoker, proxy, stopTimeout);
    }

    public boolean stopJob(JobProxy proxy, Duration stopTimeout, boolean force) {
        return manager.stopJob(invoker, proxy, stopTimeout, force);
    }

    public boolean killJob(JobProxy proxy, Duration stopTimeout) {
        return manager.killJob(invoker, proxy, stopTimeout);
    }

    public void guardJob(JobProxy proxy) {
        manager.guardJob(invoker, proxy);
    }

    public void unguardJob(JobProxy proxy) {
        manager.unguardJob(invoker, proxy);
    }

    public JobManager.JobGuard guardingJob(JobProxy proxy) {
        return manager.guardingJob(invoker, proxy);
    }

    /* ==== lookup ==== */

    public boolean hasJob(JobProxy proxy) {
        return manager.hasJob(proxy);
    }

    public boolean hasJobIdentifier(String identifier) {
        return manager.hasJobIdentifier(identifier);
    }

    public JobPermissionLevel getJobPermissionLevel(JobProxy proxy) {
        return manager.getJobPermissionLevel(proxy);
    }

    public JobProxy findJob(String identifier) {
        return manager.findJob(invoker, identifier);
    }

    public List<JobProxy> findJobs(JobQuery query) {
        return manager.findJobs(invoker, query);
    }

    /**
     * Whether the owning job may perform {@code op} on {@code target}. Never throws for a denial.
     */
    public boolean verifyPermissions(JobOp op, JobProxy target) {
        ManagedJob job = target != null ? target.job() : null;
        return manager.verifyPermissions(invoker, op, job, job != null ? job.getClass() : null, null, false);
    }

    /* ==== events ==== */

    public void dispatchEvent(JobEvent event) {
        manager.dispatchEvent(invoker, event);
    }

    public CompletableFuture<JobEvent> waitForEvent(Set<Class<? extends JobEvent>> types,
                                                    Predicate<JobEvent> check, Duration timeout) {
        return manager.waitForEvent(invoker, types, check, timeout);
    }

    public <E extends JobEvent> CompletableFuture<E> waitForEvent(Class<E> type, Predicate<? super E> check,
                                                                  Duration timeout) {
        return manager.waitForEvent(invoker, type, check, timeout);
    }

    /* ==== scheduling ==== */

    public String createJobSchedule(Class<? extends ManagedJob> cls, Instant at, Duration recurInterval,
                                    int maxRecurrences, JobArguments args) {
        return manager.createJobSchedule(invoker, cls, at, recurInterval, maxRecurrences, args);
    }

    public void removeJobSchedule(String scheduleIdentifier) {
        manager.removeJobSchedule(invoker, scheduleIdentifier);
    }

    public boolean hasJobSchedule(String scheduleIdentifier) {
        return manager.hasJobSchedule(scheduleIdentifier);
    }

    public boolean jobScheduleHasFailed(String scheduleIdentifier) {
        return manager.jobScheduleHasFailed(scheduleIdentifier);
    }

    public List<String> getJobScheduleIdentifiers() {
        return manager.getJobScheduleIdentifiers();
    }

    @Override
    public String toString() {
        return "JobManagerProxy{manager=" + manager.identifier() + ", invoker=" + invoker.identifier() + "}";
    }
}
