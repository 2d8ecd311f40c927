package io.jobs4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.core.ScheduleRecord;
import io.jobs4j.core.ScheduleSnapshot;
import io.jobs4j.core.ScheduleSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence for a job manager's schedule table.
 *
 * <p>Each record of a {@link ScheduleSnapshot} is stored as its own {@link ScheduleRecordDocument}.
 * {@link #save(ScheduleSnapshot)} replaces the stored set, {@link #load()} rebuilds the snapshot
 * with its buckets keyed by due timestamp. A recurring record keeps its first target timestamp as
 * the anchor of its grid, so the bucket it currently waits in is stored separately.
 */
public class MongoScheduleStore implements ScheduleSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(MongoScheduleStore.class);

    private static final TypeReference<List<Object>> ARGS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> KWARGS = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoScheduleStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void save(ScheduleSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        Map<String, ScheduleRecord> byId = new LinkedHashMap<>();
        Map<String, Long> dueById = new HashMap<>();
        snapshot.data().forEach((bucket, records) -> {
            long due = Long.parseLong(bucket);
            records.forEach((id, record) -> {
                byId.put(id, record);
                dueById.put(id, due);
            });
        });

        List<ScheduleRecordDocument> docs = new ArrayList<>(snapshot.size());
        int position = 0;
        for (String id : snapshot.identifiers()) {
            ScheduleRecord record = byId.get(id);
            if (record == null) {
                log.warn("schedule identifier without record skipped id={}", id);
                continue;
            }
            docs.add(toDocument(record, dueById.get(id), position++));
        }

        mongoTemplate.remove(new Query(), ScheduleRecordDocument.class);
        if (!docs.isEmpty()) {
            mongoTemplate.insertAll(docs);
        }
        log.info("job schedules saved count={}", docs.size());
    }

    @Override
    public ScheduleSnapshot load() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("position")));
        List<ScheduleRecordDocument> docs = mongoTemplate.find(q, ScheduleRecordDocument.class);

        List<String> identifiers = new ArrayList<>(docs.size());
        Map<String, Map<String, ScheduleRecord>> data = new LinkedHashMap<>();
        for (ScheduleRecordDocument doc : docs) {
            ScheduleRecord record = toRecord(doc);
            // documents written before the due timestamp existed wait at their target
            long due = doc.getDueTimestamp() > 0 ? doc.getDueTimestamp() : record.targetTimestamp();
            identifiers.add(record.scheduleIdentifier());
            data.computeIfAbsent(Long.toString(due), k -> new LinkedHashMap<>())
                    .put(record.scheduleIdentifier(), record);
        }
        log.info("job schedules loaded count={}", identifiers.size());
        return new ScheduleSnapshot(identifiers, data);
    }

    /**
     * Hard delete one stored schedule.
     *
     * @return deleted count (0 or 1)
     */
    public long deleteById(String scheduleIdentifier) {
        Objects.requireNonNull(scheduleIdentifier, "scheduleIdentifier must not be null");
        Query q = new Query(Criteria.where("_id").is(scheduleIdentifier));
        return mongoTemplate.remove(q, ScheduleRecordDocument.class).getDeletedCount();
    }

    public long count() {
        return mongoTemplate.count(new Query(), ScheduleRecordDocument.class);
    }

    private ScheduleRecordDocument toDocument(ScheduleRecord record, long dueTimestamp, int position) {
        ScheduleRecordDocument doc = new ScheduleRecordDocument();
        doc.setId(record.scheduleIdentifier());
        doc.setPosition(position);
        doc.setScheduleCreatorIdentifier(record.scheduleCreatorIdentifier());
        doc.setScheduleTimestamp(record.scheduleTimestamp());
        doc.setTargetTimestamp(record.targetTimestamp());
        doc.setDueTimestamp(dueTimestamp);
        doc.setRecurInterval(record.recurInterval());
        doc.setOccurrences(record.occurrences());
        doc.setMaxRecurrences(record.maxRecurrences());
        doc.setClassUuid(record.classUuid());
        // arbitrary argument objects become plain maps and lists Mongo can store
        doc.setJobArgs(objectMapper.convertValue(record.jobArgs(), ARGS));
        doc.setJobKwargs(objectMapper.convertValue(record.jobKwargs(), KWARGS));
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(ScheduleRecord, long, int)}.
     */
    public ScheduleRecord toRecord(ScheduleRecordDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        return new ScheduleRecord(
                doc.getId(),
                doc.getScheduleCreatorIdentifier(),
                doc.getScheduleTimestamp(),
                doc.getTargetTimestamp(),
                doc.getRecurInterval(),
                doc.getOccurrences(),
                doc.getMaxRecurrences(),
                doc.getClassUuid(),
                doc.getJobArgs(),
                doc.getJobKwargs()
        );
    }
}
