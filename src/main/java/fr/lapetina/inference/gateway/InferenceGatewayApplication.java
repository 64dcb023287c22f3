package fr.lapetina.inference.gateway;

import fr.lapetina.inference.gateway.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the inference gateway.
 */
public class InferenceGatewayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InferenceGatewayApplication.class);

    private final GatewayFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public InferenceGatewayApplication(String configPath) throws Exception {
        this(GatewayFactory.create(configPath));
    }

    InferenceGatewayApplication(GatewayFactory factory) throws Exception {
        log.info("Starting inference gateway...");

        this.factory = factory.start();

        this.httpServer = new HttpServer(
                factory.getConfig(),
                factory.getRouter(),
                factory.getRunnerRegistry(),
                factory.getMetricsRegistry()
        );

        log.info("Inference gateway initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Inference gateway started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public GatewayFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down inference gateway...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Inference gateway shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            InferenceGatewayApplication app = new InferenceGatewayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start inference gateway", e);
            System.exit(1);
        }
    }
}
