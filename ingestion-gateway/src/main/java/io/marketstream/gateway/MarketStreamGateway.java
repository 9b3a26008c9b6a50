package io.marketstream.gateway;

import io.marketstream.gateway.config.GatewayConfig;
import io.marketstream.gateway.core.IngestionController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the market stream ingestion gateway.
 */
public class MarketStreamGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarketStreamGateway.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Market Stream Gateway Starting...");
        LOGGER.info("========================================");

        try {
            // Load configuration from environment variables
            GatewayConfig config = GatewayConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Gateway ID: {}", config.gatewayId());
            LOGGER.info("  Connections: {}", config.connections().size());
            LOGGER.info("  Backoff: {}", config.backoffPolicy());
            LOGGER.info("  Dispatch: capacity={}, policy={}", config.dispatchQueueCapacity(), config.dispatchOverflowPolicy());

            IngestionController controller = new IngestionController(config);
            controller.start();

            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            controller.waitForShutdown();

            controller.close();

        } catch (Exception e) {
            LOGGER.error("Fatal error in Market Stream Gateway", e);
            System.exit(1);
        }

        LOGGER.info("Market Stream Gateway exited");
    }
}
