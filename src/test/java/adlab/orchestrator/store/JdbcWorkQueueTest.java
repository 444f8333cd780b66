package adlab.orchestrator.store;

import adlab.orchestrator.model.QueueMessage;
import adlab.orchestrator.model.TaskDescriptor;
import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.repository.QueueUnavailableException;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JdbcWorkQueueTest {

    private static final Duration POLL = Duration.ofMillis(50);

    private String url;
    private Database db;
    private JdbcWorkQueue queue;

    @BeforeEach
    void setUp() {
        url = "jdbc:h2:mem:test-queue-" + System.nanoTime() + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
        db = new Database(url, 8);
        queue = new JdbcWorkQueue(db, Duration.ofSeconds(30), POLL);
    }

    @AfterEach
    void tearDown() {
        queue.close();
        db.close();
    }

    private static TaskDescriptor descriptor(String id) {
        return new TaskDescriptor(id, TaskType.EXTRACT_AD_CONCEPT, "{\"image_url\":\"u\"}", Instant.now());
    }

    @Test
    void deliversInFifoOrder() throws Exception {
        queue.enqueue(descriptor("a"));
        queue.enqueue(descriptor("b"));
        queue.enqueue(descriptor("c"));

        assertEquals("a", queue.dequeue(POLL).orElseThrow().taskId());
        assertEquals("b", queue.dequeue(POLL).orElseThrow().taskId());
        assertEquals("c", queue.dequeue(POLL).orElseThrow().taskId());
        assertTrue(queue.dequeue(POLL).isEmpty());
    }

    @Test
    void emptyQueueTimesOut() throws Exception {
        long start = System.nanoTime();
        assertTrue(queue.dequeue(Duration.ofMillis(200)).isEmpty());
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(180));
    }

    @Test
    void ackRemovesEntry() throws Exception {
        queue.enqueue(descriptor("a"));
        QueueMessage message = queue.dequeue(POLL).orElseThrow();

        assertEquals(1, queue.depth());
        assertEquals(1, queue.inFlight());
        assertTrue(queue.contains("a"));

        assertTrue(queue.ack(message));
        assertEquals(0, queue.depth());
        assertFalse(queue.contains("a"));
        assertFalse(queue.ack(message));
    }

    @Test
    void unackedEntryIsRedeliveredAfterVisibilityTimeout() throws Exception {
        JdbcWorkQueue shortLease = new JdbcWorkQueue(db, Duration.ofMillis(200), POLL);
        shortLease.enqueue(descriptor("a"));

        QueueMessage first = shortLease.dequeue(POLL).orElseThrow();
        assertEquals(1, first.deliveries());
        assertTrue(shortLease.dequeue(POLL).isEmpty(), "leased entry must be invisible");

        QueueMessage second = shortLease.dequeue(Duration.ofSeconds(2)).orElseThrow();
        assertEquals("a", second.taskId());
        assertEquals(2, second.deliveries());
        assertNotEquals(first.receipt(), second.receipt());

        // The first consumer lost its lease
        assertFalse(shortLease.ack(first));
        assertFalse(shortLease.requeue(first, Duration.ZERO));
        assertTrue(shortLease.ack(second));
    }

    @Test
    void extendVisibilityKeepsLease() throws Exception {
        JdbcWorkQueue shortLease = new JdbcWorkQueue(db, Duration.ofMillis(300), POLL);
        shortLease.enqueue(descriptor("a"));
        QueueMessage message = shortLease.dequeue(POLL).orElseThrow();

        assertTrue(shortLease.extendVisibility(message, Duration.ofSeconds(30)));
        assertTrue(shortLease.dequeue(Duration.ofMillis(500)).isEmpty());
        assertTrue(shortLease.ack(message));
    }

    @Test
    void requeueWithDelayHidesEntry() throws Exception {
        queue.enqueue(descriptor("a"));
        QueueMessage message = queue.dequeue(POLL).orElseThrow();

        assertTrue(queue.requeue(message, Duration.ofMillis(300)));
        assertEquals(0, queue.inFlight());
        assertTrue(queue.dequeue(POLL).isEmpty());

        QueueMessage again = queue.dequeue(Duration.ofSeconds(2)).orElseThrow();
        assertEquals("a", again.taskId());
        assertEquals(2, again.deliveries());
    }

    @Test
    void blockedConsumerWakesOnEnqueue() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            long start = System.nanoTime();
            Future<Optional<QueueMessage>> pending = executor.submit(() -> queue.dequeue(Duration.ofSeconds(5)));

            TimeUnit.MILLISECONDS.sleep(100);
            queue.enqueue(descriptor("a"));

            Optional<QueueMessage> message = pending.get(2, TimeUnit.SECONDS);
            assertTrue(message.isPresent());
            assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(2));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void closedQueueRejectsEnqueueAndReleasesConsumers() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<QueueMessage>> pending = executor.submit(() -> queue.dequeue(Duration.ofSeconds(10)));
            TimeUnit.MILLISECONDS.sleep(100);

            queue.close();

            assertTrue(pending.get(2, TimeUnit.SECONDS).isEmpty());
            assertThrows(QueueUnavailableException.class, () -> queue.enqueue(descriptor("a")));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentConsumersNeverShareAnEntry() throws Exception {
        int tasks = 40;
        for (int i = 0; i < tasks; i++) {
            queue.enqueue(descriptor("t-" + i));
        }

        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(4);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            for (int w = 0; w < 4; w++) {
                executor.submit(() -> {
                    try {
                        Optional<QueueMessage> message;
                        while ((message = queue.dequeue(Duration.ofMillis(100))).isPresent()) {
                            if (!seen.add(message.get().taskId())) {
                                duplicates.incrementAndGet();
                            }
                            queue.ack(message.get());
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(20, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(tasks, seen.size());
        assertEquals(0, duplicates.get());
        assertEquals(0, queue.depth());
    }

    @Test
    void entriesSurviveQueueRestart() throws Exception {
        queue.enqueue(descriptor("a"));
        queue.enqueue(descriptor("b"));
        queue.close();
        db.close();

        db = new Database(url, 4);
        queue = new JdbcWorkQueue(db, Duration.ofSeconds(30), POLL);

        List<String> ids = new ArrayList<>();
        Optional<QueueMessage> message;
        while ((message = queue.dequeue(POLL)).isPresent()) {
            ids.add(message.get().taskId());
            queue.ack(message.get());
        }
        assertEquals(List.of("a", "b"), ids);
    }
}
