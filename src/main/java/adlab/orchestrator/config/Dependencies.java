package adlab.orchestrator.config;

import adlab.orchestrator.analysis.AdConceptTaskHandler;
import adlab.orchestrator.analysis.AdRecipeTaskHandler;
import adlab.orchestrator.analysis.AnalysisClient;
import adlab.orchestrator.analysis.HttpAnalysisClient;
import adlab.orchestrator.analysis.RecipePromptBuilder;
import adlab.orchestrator.analysis.SalesPageTaskHandler;
import adlab.orchestrator.api.v1.HealthController;
import adlab.orchestrator.api.v1.TaskQueryController;
import adlab.orchestrator.api.v1.TaskStreamController;
import adlab.orchestrator.api.v1.TaskSubmissionController;
import adlab.orchestrator.repository.AnalysisArchive;
import adlab.orchestrator.repository.TaskRecordStore;
import adlab.orchestrator.repository.WorkQueue;
import adlab.orchestrator.scheduler.Scheduler;
import adlab.orchestrator.server.RouterHandler;
import adlab.orchestrator.service.TaskQueryService;
import adlab.orchestrator.service.TaskSubmissionService;
import adlab.orchestrator.store.Database;
import adlab.orchestrator.store.JdbcAnalysisArchive;
import adlab.orchestrator.store.JdbcTaskRecordStore;
import adlab.orchestrator.store.JdbcWorkQueue;
import adlab.orchestrator.stream.TaskStreamService;
import adlab.orchestrator.worker.ExponentialBackoffRetryPolicy;
import adlab.orchestrator.worker.TaskHandlerRegistry;
import adlab.orchestrator.worker.TaskWorker;
import adlab.orchestrator.worker.WorkerPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.startWorkers();
 * deps.startScheduler();
 * // ... serve requests ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final ObjectMapper mapper;
    private final Database database;
    private final TaskRecordStore taskRecordStore;
    private final WorkQueue workQueue;
    private final AnalysisArchive analysisArchive;
    private final TaskHandlerRegistry handlerRegistry;
    private final ExponentialBackoffRetryPolicy retryPolicy;
    private final WorkerPool workerPool;
    private final TaskSubmissionService submissionService;
    private final TaskQueryService queryService;
    private final TaskStreamService streamService;

    // Controllers
    private final HealthController healthController;
    private final TaskSubmissionController submissionController;
    private final TaskQueryController queryController;
    private final TaskStreamController streamController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(OrchestratorConfig config, AnalysisClient analysisClient) {
        this.config = config;
        this.mapper = RouterHandler.mapper();

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.taskRecordStore = new JdbcTaskRecordStore(database);
        this.workQueue = new JdbcWorkQueue(database, config.visibilityTimeout(), config.queuePollInterval());
        this.analysisArchive = new JdbcAnalysisArchive(database);

        // Handlers
        AdConceptTaskHandler conceptHandler = new AdConceptTaskHandler(analysisClient);
        SalesPageTaskHandler salesPageHandler = new SalesPageTaskHandler(analysisClient);
        this.handlerRegistry = new TaskHandlerRegistry()
                .register(conceptHandler)
                .register(salesPageHandler)
                .register(new AdRecipeTaskHandler(conceptHandler, salesPageHandler, analysisArchive,
                        new RecipePromptBuilder(mapper), mapper));

        // Workers
        this.retryPolicy = ExponentialBackoffRetryPolicy.from(config);
        TaskWorker worker = new TaskWorker(taskRecordStore, workQueue, handlerRegistry, retryPolicy, mapper,
                config.visibilityTimeout());
        this.workerPool = new WorkerPool(workQueue, worker, config.workerCount(), config.queuePollInterval());

        // Services
        this.submissionService = new TaskSubmissionService(taskRecordStore, workQueue, handlerRegistry, mapper);
        this.queryService = new TaskQueryService(taskRecordStore);
        this.streamService = new TaskStreamService(taskRecordStore, config.streamPollInterval(),
                config.streamMaxDuration(), config.streamHeartbeatInterval());

        // Controllers
        this.healthController = new HealthController(database, taskRecordStore, workQueue, workerPool, streamService);
        this.submissionController = new TaskSubmissionController(submissionService);
        this.queryController = new TaskQueryController(queryService);
        this.streamController = new TaskStreamController(queryService, streamService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, calling the analysis backend over HTTP.
     */
    public static Dependencies create(OrchestratorConfig config) {
        if (!config.hasAnalysisUrl()) {
            log.warn("ADLAB_ANALYSIS_URL is not set; analysis tasks will fail");
        }
        return create(config, new HttpAnalysisClient(config.analysisUrl(), config.analysisTimeout(),
                RouterHandler.mapper()));
    }

    /**
     * Create dependencies with a custom analysis client.
     */
    public static Dependencies create(OrchestratorConfig config, AnalysisClient analysisClient) {
        return new Dependencies(config, analysisClient);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public Database database() {
        return database;
    }

    public TaskRecordStore taskRecordStore() {
        return taskRecordStore;
    }

    public WorkQueue workQueue() {
        return workQueue;
    }

    public AnalysisArchive analysisArchive() {
        return analysisArchive;
    }

    public TaskHandlerRegistry handlerRegistry() {
        return handlerRegistry;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public TaskSubmissionService submissionService() {
        return submissionService;
    }

    public TaskQueryService queryService() {
        return queryService;
    }

    public TaskStreamService streamService() {
        return streamService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerStreamingController(streamController)
                    .registerController(healthController)
                    .registerController(submissionController)
                    .registerController(queryController);
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(taskRecordStore, workQueue, config);
        }
        return scheduler;
    }

    public void startWorkers() {
        workerPool.start();
    }

    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            workerPool.stop();
        } catch (Exception e) {
            log.warn("Error stopping workers: {}", e.getMessage());
        }

        try {
            streamService.close();
        } catch (Exception e) {
            log.warn("Error closing stream service: {}", e.getMessage());
        }

        try {
            workQueue.close();
        } catch (Exception e) {
            log.warn("Error closing work queue: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
