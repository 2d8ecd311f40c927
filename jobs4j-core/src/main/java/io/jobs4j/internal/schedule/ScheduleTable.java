package io.jobs4j.internal.schedule;

import io.jobs4j.core.JobSchedulingException;
import io.jobs4j.core.ScheduleFailure;
import io.jobs4j.core.ScheduleRecord;
import io.jobs4j.core.ScheduleSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pending schedule records grouped in buckets keyed by due time (epoch nanoseconds).
 *
 * <p>A bucket is either live or still serialized, as left by a partial import; serialized buckets
 * are decoded the first time they are needed. A recurring record moves to the bucket of its next
 * due time after each occurrence. Records that could not be instantiated are kept as
 * {@link ScheduleFailure postmortems} and are never exported. Only the most recent
 * {@code maxFailures} postmortems are kept; {@link #drainFailures()} hands them over and forgets them.
 *
 * <p>All access goes through one {@link ReentrantLock}. {@link #runPass} releases it while a
 * record is being instantiated, so schedules can be added and removed during a pass.
 */
public final class ScheduleTable {
    private static final Logger log = LoggerFactory.getLogger(ScheduleTable.class);

    public static final int DEFAULT_MAX_FAILURES = 1000;

    /**
     * Instantiates the job a due record describes.
     */
    @FunctionalInterface
    public interface Instantiator {
        void instantiate(ScheduleRecord record) throws Exception;
    }

    private static final class Bucket {
        private Map<String, ScheduleRecord> records;
        private byte[] blob;

        private Bucket(Map<String, ScheduleRecord> records) {
            this.records = records;
        }

        private Bucket(byte[] blob) {
            this.blob = blob;
        }
    }

    private record Due(long bucket, ScheduleRecord record) {
    }

    private final ScheduleCodec codec;
    private final ReentrantLock lock = new ReentrantLock();
    private final TreeMap<Long, Bucket> buckets = new TreeMap<>();
    private final Map<String, Long> index = new HashMap<>();
    private final Set<String> undecodedIds = new HashSet<>();
    private final Map<String, ScheduleFailure> failures = new LinkedHashMap<>();
    private final int maxFailures;

    public ScheduleTable(ScheduleCodec codec) {
        this(codec, DEFAULT_MAX_FAILURES);
    }

    public ScheduleTable(ScheduleCodec codec, int maxFailures) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        if (maxFailures <= 0) {
            throw new IllegalArgumentException("maxFailures must be positive");
        }
        this.maxFailures = maxFailures;
    }

    /* ==== queries ==== */

    public boolean contains(String scheduleIdentifier) {
        lock.lock();
        try {
            return index.containsKey(scheduleIdentifier) || undecodedIds.contains(scheduleIdentifier);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The pending record with this identifier, or {@code null}.
     */
    public ScheduleRecord get(String scheduleIdentifier) {
        lock.lock();
        try {
            if (!index.containsKey(scheduleIdentifier) && undecodedIds.contains(scheduleIdentifier)) {
                decodeAll();
            }
            Long ts = index.get(scheduleIdentifier);
            return ts != null ? records(ts, buckets.get(ts)).get(scheduleIdentifier) : null;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasFailed(String scheduleIdentifier) {
        lock.lock();
        try {
            return failures.containsKey(scheduleIdentifier);
        } finally {
            lock.unlock();
        }
    }

    public List<String> identifiers() {
        lock.lock();
        try {
            List<String> out = new ArrayList<>(index.keySet());
            out.addAll(undecodedIds);
            return out;
        } finally {
            lock.unlock();
        }
    }

    public List<ScheduleFailure> failures() {
        lock.lock();
        try {
            return List.copyOf(failures.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the kept postmortems, oldest first, and forgets them.
     */
    public List<ScheduleFailure> drainFailures() {
        lock.lock();
        try {
            List<ScheduleFailure> out = List.copyOf(failures.values());
            failures.clear();
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return index.size() + undecodedIds.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /* ==== mutation ==== */

    public void add(ScheduleRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        lock.lock();
        try {
            String id = record.scheduleIdentifier();
            if (index.containsKey(id) || undecodedIds.contains(id)) {
                throw new JobSchedulingException("schedule " + id + " already exists");
            }
            put(record.targetTimestamp(), record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false if no pending schedule has this identifier
     */
    public boolean remove(String scheduleIdentifier) {
        lock.lock();
        try {
            if (!index.containsKey(scheduleIdentifier) && undecodedIds.contains(scheduleIdentifier)) {
                decodeAll();
            }
            Long ts = index.remove(scheduleIdentifier);
            if (ts == null) {
                return false;
            }
            Bucket bucket = buckets.get(ts);
            if (bucket != null) {
                records(ts, bucket).remove(scheduleIdentifier);
                pruneIfEmpty(ts, bucket);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private void put(long ts, ScheduleRecord record) {
        Bucket bucket = buckets.get(ts);
        if (bucket == null) {
            bucket = new Bucket(new LinkedHashMap<>());
            buckets.put(ts, bucket);
        }
        records(ts, bucket).put(record.scheduleIdentifier(), record);
        index.put(record.scheduleIdentifier(), ts);
    }

    // caller holds lock
    private Map<String, ScheduleRecord> records(long ts, Bucket bucket) {
        if (bucket.records == null) {
            Map<String, ScheduleRecord> decoded = new LinkedHashMap<>(codec.decodeBucket(bucket.blob));
            bucket.records = decoded;
            bucket.blob = null;
            for (String id : decoded.keySet()) {
                undecodedIds.remove(id);
                index.put(id, ts);
            }
            log.debug("schedule bucket decoded ts={} records={}", ts, decoded.size());
        }
        return bucket.records;
    }

    // caller holds lock
    private void decodeAll() {
        for (Map.Entry<Long, Bucket> e : buckets.entrySet()) {
            records(e.getKey(), e.getValue());
        }
    }

    // caller holds lock
    private void pruneIfEmpty(long ts, Bucket bucket) {
        if (bucket.records != null && bucket.records.isEmpty()) {
            buckets.remove(ts);
        }
    }

    /* ==== scheduling pass ==== */

    /**
     * Instantiates every record due at {@code nowNanos}. A failed instantiation turns the record
     * into a postmortem; it never ends the pass.
     *
     * @param yieldEvery yield the thread after this many records
     * @return the number of records visited
     */
    public int runPass(long nowNanos, int yieldEvery, Instantiator instantiator) {
        Objects.requireNonNull(instantiator, "instantiator must not be null");
        List<Due> due = new ArrayList<>();
        lock.lock();
        try {
            for (Map.Entry<Long, Bucket> e : buckets.headMap(nowNanos, true).entrySet()) {
                for (ScheduleRecord record : records(e.getKey(), e.getValue()).values()) {
                    due.add(new Due(e.getKey(), record));
                }
            }
        } finally {
            lock.unlock();
        }

        int visited = 0;
        for (Due d : due) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (!isPendingAt(d)) {
                continue;
            }
            Exception error = null;
            try {
                instantiator.instantiate(d.record());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                error = e;
            }
            settle(d, error, nowNanos);
            visited++;
            if (yieldEvery > 0 && visited % yieldEvery == 0) {
                Thread.yield();
            }
        }
        if (visited > 0) {
            log.debug("scheduling pass visited={} pending={}", visited, size());
        }
        return visited;
    }

    private boolean isPendingAt(Due d) {
        lock.lock();
        try {
            Long ts = index.get(d.record().scheduleIdentifier());
            return ts != null && ts == d.bucket();
        } finally {
            lock.unlock();
        }
    }

    private void settle(Due d, Exception error, long nowNanos) {
        ScheduleRecord record = d.record();
        String id = record.scheduleIdentifier();
        lock.lock();
        try {
            Long ts = index.get(id);
            if (ts == null || ts != d.bucket()) {
                // removed while it was being instantiated
                return;
            }
            Bucket bucket = buckets.get(ts);
            records(ts, bucket).remove(id);
            index.remove(id);
            pruneIfEmpty(ts, bucket);

            if (error != null) {
                failures.put(id, ScheduleFailure.of(record, error));
                if (failures.size() > maxFailures) {
                    Iterator<String> oldest = failures.keySet().iterator();
                    String dropped = oldest.next();
                    oldest.remove();
                    log.debug("schedule postmortem dropped id={}", dropped);
                }
                log.warn("schedule failed id={} class={} msg={}", id, record.classUuid(), error.getMessage());
                return;
            }
            ScheduleRecord next = record.withOccurrences(record.occurrences() + 1);
            if (next.hasRemainingOccurrences()) {
                put(nextDue(d.bucket(), record.recurInterval(), nowNanos), next);
            } else {
                log.debug("schedule finished id={} occurrences={}", id, next.occurrences());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * The first slot after {@code nowNanos} on the grid {@code lastDue + k * interval}.
     */
    static long nextDue(long lastDue, long recurInterval, long nowNanos) {
        long next = lastDue + recurInterval;
        if (next <= nowNanos) {
            long missed = (nowNanos - lastDue) / recurInterval;
            next = lastDue + (missed + 1) * recurInterval;
        }
        return next;
    }

    /* ==== export / import ==== */

    public ScheduleSnapshot export() {
        lock.lock();
        try {
            decodeAll();
            List<String> identifiers = new ArrayList<>();
            Map<String, Map<String, ScheduleRecord>> data = new LinkedHashMap<>();
            for (Map.Entry<Long, Bucket> e : buckets.entrySet()) {
                Map<String, ScheduleRecord> records = e.getValue().records;
                if (records.isEmpty()) {
                    continue;
                }
                identifiers.addAll(records.keySet());
                data.put(Long.toString(e.getKey()), records);
            }
            return new ScheduleSnapshot(identifiers, data);
        } finally {
            lock.unlock();
        }
    }

    public byte[] exportBytes() {
        return codec.encodeSnapshot(export());
    }

    /**
     * @param overwrite drop current schedules first; otherwise a non-empty table rejects the import
     * @throws JobSchedulingException if the table is not empty and {@code overwrite} is false
     */
    public void importSnapshot(ScheduleSnapshot snapshot, boolean overwrite) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        lock.lock();
        try {
            prepareImport(overwrite);
            for (Map.Entry<String, Map<String, ScheduleRecord>> e : snapshot.data().entrySet()) {
                long ts = parseBucket(e.getKey());
                for (ScheduleRecord record : e.getValue().values()) {
                    put(ts, record);
                }
            }
            log.info("schedules imported count={}", index.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param eager decode every bucket now; otherwise buckets are decoded when first needed
     */
    public void importBytes(byte[] data, boolean overwrite, boolean eager) {
        Objects.requireNonNull(data, "data must not be null");
        if (eager) {
            importSnapshot(codec.decodeSnapshot(data), overwrite);
            return;
        }
        ScheduleCodec.PartialSnapshot partial = codec.decodePartial(data);
        lock.lock();
        try {
            prepareImport(overwrite);
            for (Map.Entry<String, byte[]> e : partial.buckets().entrySet()) {
                buckets.put(parseBucket(e.getKey()), new Bucket(e.getValue()));
            }
            undecodedIds.addAll(partial.identifiers());
            log.info("schedules imported count={} buckets={} lazy=true", undecodedIds.size(), buckets.size());
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private void prepareImport(boolean overwrite) {
        if (!index.isEmpty() || !undecodedIds.isEmpty()) {
            if (!overwrite) {
                throw new JobSchedulingException("schedule table is not empty and overwrite is false");
            }
            buckets.clear();
            index.clear();
            undecodedIds.clear();
        }
    }

    private static long parseBucket(String key) {
        try {
            long ts = Long.parseLong(key);
            if (ts <= 0) {
                throw new JobSchedulingException("invalid schedule bucket '" + key + "'");
            }
            return ts;
        } catch (NumberFormatException e) {
            throw new JobSchedulingException("invalid schedule bucket '" + key + "'", e);
        }
    }
}
