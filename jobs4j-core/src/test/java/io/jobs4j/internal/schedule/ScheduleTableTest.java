package io.jobs4j.internal.schedule;

import com.fasterxml.jackson.databind.json.JsonMapper;
import io.jobs4j.core.JobSchedulingException;
import io.jobs4j.core.ScheduleRecord;
import io.jobs4j.core.ScheduleSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleTableTest {

    private static final long SECOND = 1_000_000_000L;

    private final ScheduleCodec codec = new ScheduleCodec(JsonMapper.builder().findAndAddModules().build(), 2);
    private final ScheduleTable table = new ScheduleTable(codec);

    @AfterEach
    void tearDown() {
        codec.close();
    }

    @Test
    void oneShotRecordShouldRunOnceAndDisappear() {
        table.add(record("a", 100 * SECOND, ScheduleRecord.NO_RECURRENCE, 0));
        List<String> instantiated = new ArrayList<>();

        assertEquals(0, table.runPass(99 * SECOND, 0, r -> instantiated.add(r.scheduleIdentifier())));
        assertEquals(1, table.runPass(100 * SECOND, 0, r -> instantiated.add(r.scheduleIdentifier())));
        assertEquals(0, table.runPass(200 * SECOND, 0, r -> instantiated.add(r.scheduleIdentifier())));

        assertEquals(List.of("a"), instantiated);
        assertTrue(table.isEmpty());
    }

    @Test
    void recurringRecordShouldStopAfterMaxRecurrences() {
        table.add(record("r", 10 * SECOND, SECOND, 3));
        List<Integer> seen = new ArrayList<>();

        for (long now = 10; now < 20; now++) {
            table.runPass(now * SECOND, 0, r -> seen.add(r.occurrences()));
        }

        assertEquals(List.of(0, 1, 2), seen);
        assertFalse(table.contains("r"));
    }

    @Test
    void recurringRecordShouldMoveToNextSlotOnGrid() {
        table.add(record("r", 10 * SECOND, 5 * SECOND, ScheduleRecord.UNLIMITED));

        table.runPass(22 * SECOND, 0, r -> {
        });

        ScheduleRecord moved = table.get("r");
        assertNotNull(moved);
        assertEquals(1, moved.occurrences());
        assertEquals(List.of("25000000000"), List.copyOf(table.export().data().keySet()));
    }

    @Test
    void nextDueShouldSkipMissedSlots() {
        assertEquals(15 * SECOND, ScheduleTable.nextDue(10 * SECOND, 5 * SECOND, 12 * SECOND));
        assertEquals(25 * SECOND, ScheduleTable.nextDue(10 * SECOND, 5 * SECOND, 20 * SECOND));
        assertEquals(11 * SECOND, ScheduleTable.nextDue(10 * SECOND, SECOND, 10 * SECOND));
    }

    @Test
    void failedInstantiationShouldLeavePostmortem() {
        table.add(record("bad", SECOND, 2 * SECOND, ScheduleRecord.UNLIMITED));

        table.runPass(5 * SECOND, 0, r -> {
            throw new IllegalStateException("no such class");
        });

        assertFalse(table.contains("bad"));
        assertTrue(table.hasFailed("bad"));
        assertEquals("no such class", table.failures().get(0).message());
        assertTrue(table.export().isEmpty());
    }

    @Test
    void postmortemsShouldBeCappedAndDrainable() {
        ScheduleTable small = new ScheduleTable(codec, 2);
        for (String id : List.of("f1", "f2", "f3")) {
            small.add(record(id, SECOND, ScheduleRecord.NO_RECURRENCE, 0));
        }

        small.runPass(2 * SECOND, 0, r -> {
            throw new IllegalStateException("broken " + r.scheduleIdentifier());
        });

        assertFalse(small.hasFailed("f1"));
        List<String> kept = new ArrayList<>();
        small.failures().forEach(f -> kept.add(f.message()));
        assertEquals(List.of("broken f2", "broken f3"), kept);

        assertEquals(2, small.drainFailures().size());
        assertTrue(small.failures().isEmpty());
        assertFalse(small.hasFailed("f3"));
    }

    @Test
    void exportShouldKeepRecordOrderWithinBucket() {
        for (String id : List.of("z", "a", "m", "b")) {
            table.add(record(id, 7 * SECOND, ScheduleRecord.NO_RECURRENCE, 0));
        }

        ScheduleSnapshot snapshot = table.export();

        assertEquals(List.of("z", "a", "m", "b"), new ArrayList<>(snapshot.data().get(Long.toString(7 * SECOND)).keySet()));
        assertEquals(List.of("z", "a", "m", "b"), snapshot.identifiers());
    }

    @Test
    void recordRemovedDuringPassShouldNotBeInstantiated() {
        table.add(record("a", SECOND, ScheduleRecord.NO_RECURRENCE, 0));
        table.add(record("b", SECOND, ScheduleRecord.NO_RECURRENCE, 0));
        List<String> instantiated = new ArrayList<>();

        table.runPass(2 * SECOND, 0, r -> {
            instantiated.add(r.scheduleIdentifier());
            table.remove(r.scheduleIdentifier().equals("a") ? "b" : "a");
        });

        assertEquals(1, instantiated.size());
        assertTrue(table.isEmpty());
    }

    @Test
    void duplicateIdentifierShouldBeRejected() {
        table.add(record("a", SECOND, ScheduleRecord.NO_RECURRENCE, 0));

        assertThrows(JobSchedulingException.class, () -> table.add(record("a", 2 * SECOND, ScheduleRecord.NO_RECURRENCE, 0)));
    }

    @Test
    void lazyImportShouldDecodeBucketsOnDemand() {
        table.add(record("a", SECOND, ScheduleRecord.NO_RECURRENCE, 0));
        table.add(record("b", 50 * SECOND, ScheduleRecord.NO_RECURRENCE, 0));
        byte[] exported = table.exportBytes();

        ScheduleTable restored = new ScheduleTable(codec);
        restored.importBytes(exported, false, false);

        assertEquals(2, restored.size());
        assertTrue(restored.contains("b"));
        List<String> instantiated = new ArrayList<>();
        restored.runPass(2 * SECOND, 0, r -> instantiated.add(r.scheduleIdentifier()));

        assertEquals(List.of("a"), instantiated);
        assertEquals(List.of("b"), restored.identifiers());
        assertEquals(50 * SECOND, restored.get("b").targetTimestamp());
    }

    @Test
    void importShouldRequireOverwriteForNonEmptyTable() {
        table.add(record("a", SECOND, ScheduleRecord.NO_RECURRENCE, 0));
        ScheduleSnapshot snapshot = new ScheduleSnapshot(List.of("z"),
                Map.of(Long.toString(9 * SECOND), Map.of("z", record("z", 9 * SECOND, ScheduleRecord.NO_RECURRENCE, 0))));

        assertThrows(JobSchedulingException.class, () -> table.importSnapshot(snapshot, false));

        table.importSnapshot(snapshot, true);
        assertNull(table.get("a"));
        assertEquals(List.of("z"), table.identifiers());
    }

    @Test
    void snapshotBytesShouldUseDocumentedFieldNames() {
        table.add(record("a", SECOND, ScheduleRecord.NO_RECURRENCE, 0));

        String json = new String(table.exportBytes(), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"identifiers\""));
        assertTrue(json.contains("\"schedule_identifier\":\"a\""));
        assertTrue(json.contains("\"recur_interval\":0"));
        assertTrue(json.contains("\"1000000000\""));
    }

    private static ScheduleRecord record(String id, long target, long interval, int maxRecurrences) {
        return new ScheduleRecord(id, "creator", 1L, target, interval, 0, maxRecurrences, "uuid",
                List.of(), Map.of());
    }
}
