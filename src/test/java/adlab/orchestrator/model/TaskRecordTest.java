package adlab.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskRecordTest {

    @Test
    void pendingRecordDefaults() {
        Instant now = Instant.now();
        TaskRecord record = TaskRecord.pending("t-1", TaskType.EXTRACT_AD_CONCEPT, "{}", now);

        assertEquals(TaskStatus.PENDING, record.status());
        assertEquals(0, record.attempts());
        assertEquals(1, record.version());
        assertEquals(now, record.createdAt());
        assertEquals(now, record.updatedAt());
        assertNull(record.result());
        assertNull(record.error());
        assertFalse(record.isTerminal());
    }

    @Test
    void toBuilderCopiesAllFields() {
        TaskRecord original = TaskRecord.builder()
                .id("t-2")
                .type(TaskType.GENERATE_AD_RECIPE)
                .payload("{\"a\":1}")
                .status(TaskStatus.FAILED)
                .error(TaskError.analysis("boom", 3))
                .attempts(3)
                .version(7)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();

        TaskRecord copy = original.toBuilder().build();

        assertEquals(original, copy);
        assertEquals(TaskType.GENERATE_AD_RECIPE, copy.type());
        assertEquals("boom", copy.error().message());
        assertTrue(copy.isTerminal());
    }

    @Test
    void statusTransitionsOnlyMoveForward() {
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.RUNNING));
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED));
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.COMPLETED));
        assertFalse(TaskStatus.RUNNING.canTransitionTo(TaskStatus.PENDING));

        for (TaskStatus next : TaskStatus.values()) {
            assertFalse(TaskStatus.COMPLETED.canTransitionTo(next));
            assertFalse(TaskStatus.FAILED.canTransitionTo(next));
        }
    }

    @Test
    void errorMessageNeverNull() {
        TaskError error = new TaskError(TaskError.ANALYSIS_ERROR, null, 1);
        assertEquals("", error.message());
        assertThrows(NullPointerException.class, () -> new TaskError(null, "x", 1));
    }
}
