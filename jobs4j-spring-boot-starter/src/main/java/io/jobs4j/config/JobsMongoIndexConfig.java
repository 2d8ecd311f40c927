package io.jobs4j.config;

import io.jobs4j.internal.mongo.ScheduleRecordDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the schedule store.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code jobs4j.ensure-indexes-on-startup}
 * is set. In production they are usually managed by migration scripts.
 *
 * <h3>Required indexes (collection: {@code job_schedules})</h3>
 * <ul>
 *   <li><b>idx_due_timestamp</b>: { dueTimestamp: 1 }</li>
 *   <li><b>idx_position</b>: { position: 1 }, used to restore the identifier order</li>
 * </ul>
 *
 * <pre>
 * db.job_schedules.createIndex({ dueTimestamp: 1 }, { name: "idx_due_timestamp" });
 * db.job_schedules.createIndex({ position: 1 }, { name: "idx_position" });
 * </pre>
 */
public class JobsMongoIndexConfig {

    public static final String IDX_DUE_TIMESTAMP = "idx_due_timestamp";
    public static final String IDX_POSITION = "idx_position";

    private final MongoTemplate mongoTemplate;

    public JobsMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduleRecordDocument.class).ensureIndex(dueTimestampIndex());
        mongoTemplate.indexOps(ScheduleRecordDocument.class).ensureIndex(positionIndex());
    }

    public static Index dueTimestampIndex() {
        return new Index()
                .on("dueTimestamp", Sort.Direction.ASC)
                .named(IDX_DUE_TIMESTAMP);
    }

    public static Index positionIndex() {
        return new Index()
                .on("position", Sort.Direction.ASC)
                .named(IDX_POSITION);
    }
}
