package fr.lapetina.agentnetwork;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the agent network.
 */
public class AgentNetworkApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentNetworkApplication.class);

    private final NetworkFactory factory;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public AgentNetworkApplication(String configPath) {
        log.info("Starting agent network...");
        this.factory = NetworkFactory.create(configPath);
        log.info("Agent network initialized");
    }

    public void start() throws Exception {
        factory.start();
        log.info("Agent network started on port {}", factory.getHttpServer().getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public NetworkFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down agent network...");

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Agent network shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            AgentNetworkApplication app = new AgentNetworkApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start agent network", e);
            System.exit(1);
        }
    }
}
