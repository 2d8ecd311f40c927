package io.jobs4j;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * The manager's own {@link io.jobs4j.core.JobPermissionLevel#SYSTEM} job. It is the invoker of
 * every call made on the manager directly and runs the scheduling pass.
 */
final class JobManagerJob extends IntervalJob {
    private static final Logger log = LoggerFactory.getLogger(JobManagerJob.class);

    JobManagerJob(Duration schedulingInterval) {
        super(schedulingInterval);
    }

    @Override
    protected void onRun() {
        JobManager manager = jobManager();
        if (manager == null) {
            return;
        }
        try {
            manager.runSchedulingPass();
        } catch (RuntimeException e) {
            // keep the manager job alive, the next pass retries
            log.error("scheduling pass failed manager={} msg={}", manager.identifier(), e.getMessage(), e);
        }
    }
}
