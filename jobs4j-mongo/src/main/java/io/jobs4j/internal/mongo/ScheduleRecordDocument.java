package io.jobs4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;
import java.util.Map;

/**
 * Mongo document model for one persisted schedule record.
 */
@Document(collection = "job_schedules")
public class ScheduleRecordDocument {

    @Id
    private String id; // the schedule identifier

    private int position; // order of the identifier list in the exported snapshot
    private String scheduleCreatorIdentifier;
    private long scheduleTimestamp;
    private long targetTimestamp;
    private long dueTimestamp; // bucket the record waits in; moves forward as a recurring schedule fires
    private long recurInterval;
    private int occurrences;
    private int maxRecurrences;
    private String classUuid;
    private List<Object> jobArgs;
    private Map<String, Object> jobKwargs;

    public ScheduleRecordDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public String getScheduleCreatorIdentifier() {
        return scheduleCreatorIdentifier;
    }

    public void setScheduleCreatorIdentifier(String scheduleCreatorIdentifier) {
        this.scheduleCreatorIdentifier = scheduleCreatorIdentifier;
    }

    public long getScheduleTimestamp() {
        return scheduleTimestamp;
    }

    public void setScheduleTimestamp(long scheduleTimestamp) {
        this.scheduleTimestamp = scheduleTimestamp;
    }

    public long getTargetTimestamp() {
        return targetTimestamp;
    }

    public void setTargetTimestamp(long targetTimestamp) {
        this.targetTimestamp = targetTimestamp;
    }

    public long getDueTimestamp() {
        return dueTimestamp;
    }

    public void setDueTimestamp(long dueTimestamp) {
        this.dueTimestamp = dueTimestamp;
    }

    public long getRecurInterval() {
        return recurInterval;
    }

    public void setRecurInterval(long recurInterval) {
        this.recurInterval = recurInterval;
    }

    public int getOccurrences() {
        return occurrences;
    }

    public void setOccurrences(int occurrences) {
        this.occurrences = occurrences;
    }

    public int getMaxRecurrences() {
        return maxRecurrences;
    }

    public void setMaxRecurrences(int maxRecurrences) {
        this.maxRecurrences = maxRecurrences;
    }

    public String getClassUuid() {
        return classUuid;
    }

    public void setClassUuid(String classUuid) {
        this.classUuid = classUuid;
    }

    public List<Object> getJobArgs() {
        return jobArgs;
    }

    public void setJobArgs(List<Object> jobArgs) {
        this.jobArgs = jobArgs;
    }

    public Map<String, Object> getJobKwargs() {
        return jobKwargs;
    }

    public void setJobKwargs(Map<String, Object> jobKwargs) {
        this.jobKwargs = jobKwargs;
    }
}
