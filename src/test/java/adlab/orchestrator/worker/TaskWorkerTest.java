package adlab.orchestrator.worker;

import adlab.orchestrator.model.QueueMessage;
import adlab.orchestrator.model.TaskDescriptor;
import adlab.orchestrator.model.TaskError;
import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.model.TaskStatus;
import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.store.Database;
import adlab.orchestrator.store.JdbcTaskRecordStore;
import adlab.orchestrator.store.JdbcWorkQueue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TaskWorkerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration POLL = Duration.ofMillis(50);

    private Database db;
    private JdbcTaskRecordStore store;
    private JdbcWorkQueue queue;
    private TaskHandlerRegistry registry;
    private TaskWorker worker;

    @FunctionalInterface
    interface Body {
        JsonNode run(JsonNode payload, TaskContext context) throws AnalysisException, InterruptedException;
    }

    /** Handler whose behaviour is supplied per test. */
    static final class ScriptedHandler implements TaskHandler {
        private final Body body;
        final AtomicInteger calls = new AtomicInteger();

        ScriptedHandler(Body body) {
            this.body = body;
        }

        @Override
        public TaskType type() {
            return TaskType.EXTRACT_AD_CONCEPT;
        }

        @Override
        public JsonNode execute(JsonNode payload, TaskContext context) throws AnalysisException, InterruptedException {
            calls.incrementAndGet();
            return body.run(payload, context);
        }
    }

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-worker-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        store = new JdbcTaskRecordStore(db);
        queue = new JdbcWorkQueue(db, Duration.ofSeconds(30), POLL);
        registry = new TaskHandlerRegistry();
        RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(3, Duration.ofMillis(10), 2.0, null, false);
        worker = new TaskWorker(store, queue, registry, retryPolicy, MAPPER, Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        queue.close();
        db.close();
    }

    private String submit() {
        String id = UUID.randomUUID().toString();
        TaskRecord record = TaskRecord.pending(id, TaskType.EXTRACT_AD_CONCEPT,
                "{\"image_url\":\"http://img/1.png\"}", Instant.now());
        store.create(record);
        queue.enqueue(TaskDescriptor.of(record));
        return id;
    }

    private void deliverNext() throws InterruptedException {
        QueueMessage message = queue.dequeue(Duration.ofSeconds(2)).orElseThrow();
        worker.process(message);
    }

    @Test
    void successfulTaskIsCompletedAndAcked() throws Exception {
        registry.register(new ScriptedHandler((payload, ctx) ->
                MAPPER.createObjectNode().put("title", "from " + payload.get("image_url").asText())));
        String id = submit();

        deliverNext();

        TaskRecord record = store.findById(id).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, record.status());
        assertEquals(1, record.attempts());
        assertEquals("from http://img/1.png", MAPPER.readTree(record.result()).get("title").asText());
        assertEquals(0, queue.depth());
    }

    @Test
    void failingAttemptIsRetriedThenSucceeds() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        registry.register(new ScriptedHandler((payload, ctx) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new AnalysisException("backend returned 502");
            }
            return MAPPER.createObjectNode().put("title", "ok");
        }));
        String id = submit();

        deliverNext();

        TaskRecord between = store.findById(id).orElseThrow();
        assertEquals(TaskStatus.RUNNING, between.status());
        assertTrue(between.progress().startsWith("attempt 1/3 failed: backend returned 502"),
                between.progress());
        assertEquals(1, queue.depth());

        deliverNext();

        TaskRecord done = store.findById(id).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(2, done.attempts());
        assertEquals(0, queue.depth());
    }

    @Test
    void alwaysFailingTaskStopsAfterMaxAttempts() throws Exception {
        ScriptedHandler handler = new ScriptedHandler((payload, ctx) -> {
            throw new IllegalStateException("analysis exploded");
        });
        registry.register(handler);
        String id = submit();

        for (int i = 0; i < 3; i++) {
            deliverNext();
        }

        TaskRecord record = store.findById(id).orElseThrow();
        assertEquals(TaskStatus.FAILED, record.status());
        assertEquals(TaskError.ANALYSIS_ERROR, record.error().code());
        assertEquals("analysis exploded", record.error().message());
        assertEquals(3, record.error().attempt());
        assertEquals(3, handler.calls.get());
        assertTrue(queue.dequeue(Duration.ofMillis(200)).isEmpty());
    }

    @Test
    void errorThrownByHandlerCountsAsFailedAttempt() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        registry.register(new ScriptedHandler((payload, ctx) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new StackOverflowError("deep layout tree");
            }
            return MAPPER.createObjectNode().put("title", "ok");
        }));
        String id = submit();

        deliverNext();

        TaskRecord between = store.findById(id).orElseThrow();
        assertEquals(TaskStatus.RUNNING, between.status());
        assertTrue(between.progress().startsWith("attempt 1/3 failed: deep layout tree"), between.progress());
        assertEquals(1, queue.depth());

        deliverNext();

        TaskRecord done = store.findById(id).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(2, done.attempts());
    }

    @Test
    void interruptedAttemptIsNotCounted() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        registry.register(new ScriptedHandler((payload, ctx) -> {
            if (calls.incrementAndGet() <= 3) {
                throw new InterruptedException("shutdown");
            }
            return MAPPER.createObjectNode().put("title", "resumed");
        }));
        String id = submit();

        for (int i = 0; i < 3; i++) {
            assertThrows(InterruptedException.class, this::deliverNext);
            TaskRecord interrupted = store.findById(id).orElseThrow();
            assertEquals(TaskStatus.RUNNING, interrupted.status());
            assertEquals(0, interrupted.attempts());
            assertEquals(1, queue.depth());
        }

        deliverNext();

        TaskRecord done = store.findById(id).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(1, done.attempts());
        assertEquals(4, calls.get());
    }

    @Test
    void progressIsVisibleWhileRunning() throws Exception {
        AtomicReference<String> observed = new AtomicReference<>();
        registry.register(new ScriptedHandler((payload, ctx) -> {
            ctx.reportProgress("analyzing layout");
            observed.set(store.findById(ctx.taskId()).orElseThrow().progress());
            assertEquals(1, ctx.attempt());
            assertEquals(3, ctx.maxAttempts());
            return MAPPER.createObjectNode();
        }));
        submit();

        deliverNext();

        assertEquals("analyzing layout", observed.get());
    }

    @Test
    void duplicateDeliveryOfFinishedTaskIsDropped() throws Exception {
        ScriptedHandler handler = new ScriptedHandler((payload, ctx) -> MAPPER.createObjectNode());
        registry.register(handler);
        String id = submit();
        deliverNext();
        long version = store.findById(id).orElseThrow().version();

        // Same descriptor delivered again
        queue.enqueue(TaskDescriptor.of(store.findById(id).orElseThrow()));
        deliverNext();

        assertEquals(1, handler.calls.get());
        assertEquals(version, store.findById(id).orElseThrow().version());
        assertEquals(0, queue.depth());
    }

    @Test
    void redeliveryAfterLastAttemptFailsTask() throws Exception {
        ScriptedHandler handler = new ScriptedHandler((payload, ctx) -> MAPPER.createObjectNode());
        registry.register(handler);
        String id = submit();
        for (int i = 0; i < 3; i++) {
            store.markRunning(id, "attempt " + (i + 1));
        }

        deliverNext();

        TaskRecord record = store.findById(id).orElseThrow();
        assertEquals(TaskStatus.FAILED, record.status());
        assertEquals(TaskError.ATTEMPTS_EXHAUSTED, record.error().code());
        assertEquals(0, handler.calls.get());
        assertEquals(0, queue.depth());
    }

    @Test
    void entryWithoutRecordIsDropped() throws Exception {
        queue.enqueue(new TaskDescriptor("ghost", TaskType.EXTRACT_AD_CONCEPT, "{}", Instant.now()));

        deliverNext();

        assertEquals(0, queue.depth());
        assertTrue(store.findById("ghost").isEmpty());
    }

    @Test
    void missingHandlerFailsTask() throws Exception {
        String id = submit();

        for (int i = 0; i < 3; i++) {
            deliverNext();
        }

        TaskRecord record = store.findById(id).orElseThrow();
        assertEquals(TaskStatus.FAILED, record.status());
        assertTrue(record.error().message().contains("No handler registered"));
    }
}
