package io.jobs4j.internal.schedule;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.core.JobSchedulingException;
import io.jobs4j.core.ScheduleRecord;
import io.jobs4j.core.ScheduleSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * JSON (de)serialization of schedule data, run on a small fixed pool so large tables do not tie
 * up the scheduling thread. At most {@code workers} conversions are in flight at once.
 */
public final class ScheduleCodec implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScheduleCodec.class);

    private static final TypeReference<Map<String, ScheduleRecord>> BUCKET = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ExecutorService pool;
    private final Semaphore permits;

    public ScheduleCodec(ObjectMapper objectMapper, int workers) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive");
        }
        this.permits = new Semaphore(workers);
        this.pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r);
            t.setName("jobs4j.serialization");
            t.setDaemon(true);
            return t;
        });
    }

    public byte[] encodeSnapshot(ScheduleSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        return run(() -> objectMapper.writeValueAsBytes(snapshot), "encode snapshot");
    }

    public ScheduleSnapshot decodeSnapshot(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        return run(() -> objectMapper.readValue(data, ScheduleSnapshot.class), "decode snapshot");
    }

    /**
     * Reads only the outer structure of an exported snapshot. Each bucket stays serialized until
     * it is first needed.
     */
    public PartialSnapshot decodePartial(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        return run(() -> {
            JsonNode root = objectMapper.readTree(data);
            List<String> identifiers = new ArrayList<>();
            for (JsonNode id : root.path("identifiers")) {
                identifiers.add(id.asText());
            }
            Map<String, byte[]> buckets = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.path("data").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> bucket = fields.next();
                buckets.put(bucket.getKey(), objectMapper.writeValueAsBytes(bucket.getValue()));
            }
            return new PartialSnapshot(identifiers, buckets);
        }, "decode snapshot outline");
    }

    public record PartialSnapshot(List<String> identifiers, Map<String, byte[]> buckets) {
    }

    public Map<String, ScheduleRecord> decodeBucket(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        return run(() -> objectMapper.readValue(data, BUCKET), "decode bucket");
    }

    private <T> T run(Callable<T> task, String what) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobSchedulingException("interrupted before schedule data could " + what, e);
        }
        Future<T> future;
        try {
            future = pool.submit(() -> {
                try {
                    return task.call();
                } finally {
                    permits.release();
                }
            });
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobSchedulingException("interrupted while schedule data was being processed: " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw new JobSchedulingException("failed to " + what + ": " + cause.getMessage(), cause);
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new JobSchedulingException("failed to " + what, cause);
        }
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
        log.debug("schedule codec closed");
    }
}
