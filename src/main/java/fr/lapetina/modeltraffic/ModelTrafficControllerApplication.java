package fr.lapetina.modeltraffic;

import fr.lapetina.modeltraffic.api.AdminHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Model Traffic Controller.
 */
public class ModelTrafficControllerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelTrafficControllerApplication.class);

    private final ControllerFactory factory;
    private final AdminHttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public ModelTrafficControllerApplication(String configPath) throws Exception {
        log.info("Starting Model Traffic Controller...");

        this.factory = ControllerFactory.create(configPath).start();
        this.httpServer = factory.getConfig().getServer().isEnabled()
                ? new AdminHttpServer(factory.getConfig().getServer(), factory)
                : null;

        log.info("Model Traffic Controller initialized");
    }

    public void start() {
        if (httpServer != null) {
            httpServer.start();
        }
        log.info("Model Traffic Controller started, models={}", factory.getRegistry().models());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ControllerFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Model Traffic Controller...");

        if (httpServer != null) {
            try {
                httpServer.close();
            } catch (Exception e) {
                log.warn("Error closing HTTP server", e);
            }
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Model Traffic Controller shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            ModelTrafficControllerApplication app = new ModelTrafficControllerApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Model Traffic Controller", e);
            System.exit(1);
        }
    }
}
