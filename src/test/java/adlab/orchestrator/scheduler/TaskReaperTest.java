package adlab.orchestrator.scheduler;

import adlab.orchestrator.config.OrchestratorConfig;
import adlab.orchestrator.model.TaskDescriptor;
import adlab.orchestrator.model.TaskError;
import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.model.TaskStatus;
import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.store.Database;
import adlab.orchestrator.store.JdbcTaskRecordStore;
import adlab.orchestrator.store.JdbcWorkQueue;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskReaperTest {

    private Database db;
    private JdbcTaskRecordStore store;
    private JdbcWorkQueue queue;
    private TaskReaper reaper;

    @BeforeEach
    void setUp() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-reaper-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withOrphanThreshold(Duration.ofMinutes(1))
                .withRecordRetention(Duration.ofHours(1));
        db = new Database(config);
        store = new JdbcTaskRecordStore(db);
        queue = new JdbcWorkQueue(db, Duration.ofSeconds(30), Duration.ofMillis(50));
        reaper = new TaskReaper(store, queue, config);
    }

    @AfterEach
    void tearDown() {
        queue.close();
        db.close();
    }

    private TaskRecord oldPending(String id) {
        TaskRecord record = TaskRecord.pending(id, TaskType.EXTRACT_AD_CONCEPT, "{}",
                Instant.now().minus(Duration.ofMinutes(5)));
        store.create(record);
        return record;
    }

    @Test
    void failsOldPendingRecordWithoutQueueEntry() {
        oldPending("orphan");

        assertEquals(1, reaper.reapOrphans());

        TaskRecord record = store.findById("orphan").orElseThrow();
        assertEquals(TaskStatus.FAILED, record.status());
        assertEquals(TaskError.QUEUE_UNAVAILABLE, record.error().code());
    }

    @Test
    void keepsQueuedAndRecentRecords() {
        TaskRecord queued = oldPending("queued");
        queue.enqueue(TaskDescriptor.of(queued));
        store.create(TaskRecord.pending("fresh", TaskType.EXTRACT_AD_CONCEPT, "{}", Instant.now()));

        assertEquals(0, reaper.reapOrphans());

        assertEquals(TaskStatus.PENDING, store.findById("queued").orElseThrow().status());
        assertEquals(TaskStatus.PENDING, store.findById("fresh").orElseThrow().status());
    }

    @Test
    void purgesOnlyExpiredTerminalRecords() {
        store.create(TaskRecord.builder()
                .id("expired")
                .type(TaskType.EXTRACT_AD_CONCEPT)
                .payload("{}")
                .status(TaskStatus.COMPLETED)
                .result("{}")
                .createdAt(Instant.now().minus(Duration.ofHours(3)))
                .updatedAt(Instant.now().minus(Duration.ofHours(2)))
                .build());
        store.create(TaskRecord.builder()
                .id("recent")
                .type(TaskType.EXTRACT_AD_CONCEPT)
                .payload("{}")
                .status(TaskStatus.FAILED)
                .error(TaskError.analysis("boom", 3))
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build());

        assertEquals(1, reaper.purgeExpired());

        assertTrue(store.findById("expired").isEmpty());
        assertTrue(store.findById("recent").isPresent());
    }

    @Test
    void runDoesBothSweeps() {
        oldPending("orphan");

        reaper.run();

        assertEquals(TaskStatus.FAILED, store.findById("orphan").orElseThrow().status());
    }
}
