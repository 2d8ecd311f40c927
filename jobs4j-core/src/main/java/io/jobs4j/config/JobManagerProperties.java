package io.jobs4j.config;

import io.jobs4j.core.JobOp;
import io.jobs4j.core.JobPermissionLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for a job manager.
 */
@ConfigurationProperties(prefix = "jobs4j")
public class JobManagerProperties {
    private boolean enabled = true;
    private String managerId; // generated when null
    private Duration globalJobStopTimeout; // null = wait for onStop indefinitely
    private JobPermissionLevel defaultPermissionLevel = JobPermissionLevel.DEFAULT;
    private boolean schedulingEnabled = true;
    private Duration schedulingInterval = Duration.ofSeconds(1);
    private int schedulingYieldEvery = 100;
    private int serializationWorkers = 4;
    private String jobThreadNamePrefix = "jobs4j.job";
    private JobOp stopOperation = JobOp.KILL;
    private boolean restoreSchedulesOnStartup = false;
    private boolean saveSchedulesOnShutdown = false;
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getManagerId() {
        return managerId;
    }

    public void setManagerId(String managerId) {
        this.managerId = managerId;
    }

    public Duration getGlobalJobStopTimeout() {
        return globalJobStopTimeout;
    }

    public void setGlobalJobStopTimeout(Duration globalJobStopTimeout) {
        this.globalJobStopTimeout = globalJobStopTimeout;
    }

    public JobPermissionLevel getDefaultPermissionLevel() {
        return defaultPermissionLevel;
    }

    public void setDefaultPermissionLevel(JobPermissionLevel defaultPermissionLevel) {
        this.defaultPermissionLevel = defaultPermissionLevel;
    }

    public boolean isSchedulingEnabled() {
        return schedulingEnabled;
    }

    public void setSchedulingEnabled(boolean schedulingEnabled) {
        this.schedulingEnabled = schedulingEnabled;
    }

    public Duration getSchedulingInterval() {
        return schedulingInterval;
    }

    public void setSchedulingInterval(Duration schedulingInterval) {
        this.schedulingInterval = schedulingInterval;
    }

    public int getSchedulingYieldEvery() {
        return schedulingYieldEvery;
    }

    public void setSchedulingYieldEvery(int schedulingYieldEvery) {
        this.schedulingYieldEvery = schedulingYieldEvery;
    }

    public int getSerializationWorkers() {
        return serializationWorkers;
    }

    public void setSerializationWorkers(int serializationWorkers) {
        this.serializationWorkers = serializationWorkers;
    }

    public String getJobThreadNamePrefix() {
        return jobThreadNamePrefix;
    }

    public void setJobThreadNamePrefix(String jobThreadNamePrefix) {
        this.jobThreadNamePrefix = jobThreadNamePrefix;
    }

    public JobOp getStopOperation() {
        return stopOperation;
    }

    public void setStopOperation(JobOp stopOperation) {
        this.stopOperation = stopOperation;
    }

    public boolean isRestoreSchedulesOnStartup() {
        return restoreSchedulesOnStartup;
    }

    public void setRestoreSchedulesOnStartup(boolean restoreSchedulesOnStartup) {
        this.restoreSchedulesOnStartup = restoreSchedulesOnStartup;
    }

    public boolean isSaveSchedulesOnShutdown() {
        return saveSchedulesOnShutdown;
    }

    public void setSaveSchedulesOnShutdown(boolean saveSchedulesOnShutdown) {
        this.saveSchedulesOnShutdown = saveSchedulesOnShutdown;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
