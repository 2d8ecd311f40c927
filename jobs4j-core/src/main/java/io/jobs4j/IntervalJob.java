package io.jobs4j;

import io.jobs4j.loop.LoopSchedule;
import io.jobs4j.loop.PeriodicLoop;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * A job whose {@link #onRun()} is called at a fixed interval, at daily wall-clock times, or on a
 * cron schedule. Between two runs of a non-zero interval the job counts as idling.
 *
 * <pre>{@code
 * public class Heartbeat extends IntervalJob {
 *     public Heartbeat() {
 *         super(Duration.ofSeconds(30));
 *     }
 *
 *     @Override
 *     protected void onRun() {
 *         log.info("still alive");
 *     }
 * }
 * }</pre>
 */
public abstract class IntervalJob extends ManagedJob {

    protected IntervalJob() {
        this(LoopSchedule.immediate(), null, true);
    }

    protected IntervalJob(Duration interval) {
        this(LoopSchedule.interval(interval), null, true);
    }

    protected IntervalJob(Duration interval, Integer count) {
        this(LoopSchedule.interval(interval), count, true);
    }

    protected IntervalJob(ZoneId zone, LocalTime... times) {
        this(LoopSchedule.daily(zone, times), null, true);
    }

    /**
     * @param count     number of run iterations per start, {@code null} for unlimited
     * @param reconnect retry transient failures with backoff instead of stopping
     */
    protected IntervalJob(LoopSchedule schedule, Integer count, boolean reconnect) {
        super(schedule, count, reconnect);
    }

    /**
     * When the next run is due, or {@code null} while not running.
     */
    public final Instant nextIteration() {
        PeriodicLoop current = loop();
        return current != null ? current.nextIteration() : null;
    }

    public final LoopSchedule getSchedule() {
        PeriodicLoop current = loop();
        return current != null ? current.schedule() : initialSchedule();
    }

    /**
     * Takes effect from the next computed iteration. Before the first start, nothing runs yet and
     * the change is rejected.
     */
    public final void changeSchedule(LoopSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        PeriodicLoop current = loop();
        if (current == null) {
            throw new IllegalStateException("job " + identifier() + " was never started");
        }
        current.changeSchedule(schedule);
    }

    public final void changeInterval(Duration interval) {
        changeSchedule(LoopSchedule.interval(interval));
    }
}
