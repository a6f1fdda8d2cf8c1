package fr.lapetina.feedback.orchestrator;

import fr.lapetina.feedback.orchestrator.api.HttpServer;
import fr.lapetina.feedback.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.feedback.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.feedback.orchestrator.infrastructure.http.RemoteInferenceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the orchestrator behind its HTTP API until the process is stopped.
 * Usage: {@code FeedbackOrchestratorApplication [config.yaml]}
 */
public class FeedbackOrchestratorApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FeedbackOrchestratorApplication.class);

    private final OrchestratorFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean();

    public FeedbackOrchestratorApplication(String configPath) throws Exception {
        this(OrchestratorFactory.create(configPath));
    }

    FeedbackOrchestratorApplication(OrchestratorFactory factory) throws Exception {
        this.factory = factory;
        OrchestratorConfig config = factory.getConfig();
        OrchestratorConfig.ServerConfig server = config.getServer();
        this.httpServer = new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                server.getThreads(),
                factory.getOrchestrator(),
                factory.getMetricsRegistry(),
                config.getMetrics().isEnabled()
        );

        RemoteInferenceClient remote = factory.getRemoteClient();
        if (!remote.isAvailable()) {
            log.warn("No API key in ${}, every request will be analyzed locally",
                    config.getRemote().getApiKeyEnv());
        }
    }

    public void start() {
        httpServer.start();
        log.info("Feedback orchestrator listening: port={}, model={}, remoteAvailable={}",
                httpServer.getPort(), factory.getRemoteClient().getModelName(),
                factory.getRemoteClient().isAvailable());
    }

    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    public void requestShutdown() {
        stopped.countDown();
    }

    public OrchestratorFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    /**
     * Stops accepting requests before the orchestrator is closed. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeStep("http server", httpServer);
        closeStep("orchestrator", factory);
        log.info("Feedback orchestrator stopped");
    }

    private static void closeStep(String name, AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close {}", name, e);
        }
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : ConfigLoader.DEFAULT_CONFIG_PATH;
        try {
            FeedbackOrchestratorApplication app = new FeedbackOrchestratorApplication(configPath);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.close();
                app.requestShutdown();
            }, "orchestrator-shutdown"));
            app.start();
            app.awaitShutdown();
        } catch (ConfigLoader.ConfigurationException e) {
            log.error("Invalid configuration {}: {}", configPath, e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            log.error("Failed to start feedback orchestrator", e);
            System.exit(1);
        }
    }
}
