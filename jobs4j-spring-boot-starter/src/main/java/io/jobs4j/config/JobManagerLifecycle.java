package io.jobs4j.config;

import io.jobs4j.JobManager;
import io.jobs4j.core.ScheduleSnapshot;
import io.jobs4j.core.ScheduleSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Bridges the job manager lifecycle with the Spring container lifecycle, optionally restoring the
 * schedule table before the first start and saving it on stop.
 */
public class JobManagerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(JobManagerLifecycle.class);

    private final JobManager jobManager;
    private final JobManagerProperties props;
    private final ScheduleSnapshotStore snapshotStore; // may be null
    private volatile boolean running = false;

    public JobManagerLifecycle(JobManager jobManager, JobManagerProperties props, ScheduleSnapshotStore snapshotStore) {
        this.jobManager = Objects.requireNonNull(jobManager, "jobManager must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.snapshotStore = snapshotStore;
    }

    @Override
    public void start() {
        if (jobManager.isInitialized()) {
            jobManager.resume();
        } else {
            if (props.isRestoreSchedulesOnStartup() && snapshotStore != null) {
                ScheduleSnapshot snapshot = snapshotStore.load();
                jobManager.importSchedules(snapshot, true);
                log.info("job schedules restored count={}", snapshot.size());
            }
            jobManager.initialize();
        }
        running = true;
    }

    @Override
    public void stop() {
        try {
            if (props.isSaveSchedulesOnShutdown() && snapshotStore != null) {
                snapshotStore.save(jobManager.exportSchedules());
            }
        } catch (RuntimeException e) {
            log.error("job schedules could not be saved msg={}", e.getMessage(), e);
        } finally {
            if (jobManager.isRunning()) {
                jobManager.stop();
            }
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
