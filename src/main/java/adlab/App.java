package adlab;

import adlab.orchestrator.config.Dependencies;
import adlab.orchestrator.config.OrchestratorConfig;
import adlab.orchestrator.server.OrchestratorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point.
 *
 * Starts the HTTP API, then the worker pool and the background scheduler.
 * Everything is shut down from a JVM shutdown hook.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        OrchestratorConfig config = OrchestratorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);

        int port = config.serverPort();
        log.info("Starting orchestrator on port {}...", port);
        if (!OrchestratorNettyServer.start(port, deps)) {
            log.error("Server did not start, exiting");
            deps.close();
            System.exit(1);
        }

        deps.startWorkers();
        deps.startScheduler();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            OrchestratorNettyServer.stop();
            deps.close();
        }, "adlab-shutdown"));

        Thread.currentThread().join();
    }
}
