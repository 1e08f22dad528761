package duotalk;

import duotalk.config.ConfigurationException;
import duotalk.config.RelayConfig;
import duotalk.core.RelayStatistics;
import duotalk.server.SocketIORelayServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main application class for DuoTalk.
 * Starts the relay server and keeps it running until shutdown.
 */
public class DuoTalkApplication {
    private static final Logger logger = LoggerFactory.getLogger(DuoTalkApplication.class);

    private final RelayConfig config;
    private final RelayStatistics statistics = new RelayStatistics();
    private final SocketIORelayServer server;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * Create the application.
     *
     * @param config the resolved process configuration
     */
    public DuoTalkApplication(RelayConfig config) {
        this.config = config;
        this.server = new SocketIORelayServer(config, statistics);

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "duotalk-shutdown"));
    }

    protected void exitApplication(int status) {
        System.exit(status);
    }

    /**
     * Start the server and block until {@link #shutdown()} is called.
     */
    public void start() {
        try {
            logger.info("Starting DuoTalk relay...");
            server.start();
            statistics.recordStart();

            logger.info("Server is running on port {}", config.port());
            logger.info("Transcribing via {}", config.upstreamUrl());

            try {
                shutdownLatch.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Application interrupted");
            }
        } catch (Exception e) {
            logger.error("Failed to start application", e);
            exitApplication(1);
        }
    }

    /**
     * Stop the server and log final statistics. Safe to call more than once.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down DuoTalk relay...");

        try {
            server.stop();
            statistics.recordStop();

            logger.info("Final statistics:");
            logger.info("   Connections: {} opened, {} closed",
                    statistics.getConnectionsOpened(), statistics.getConnectionsClosed());
            logger.info("   Admissions: {}, rejections: {}",
                    statistics.getAdmissions(), statistics.getRejections());
            logger.info("   Signals: {} relayed, {} dropped",
                    statistics.getSignalsRelayed(), statistics.getSignalsDropped());
            logger.info("   Transcripts broadcast: {}", statistics.getTranscriptsBroadcast());
            logger.info("   Uptime: {} seconds", statistics.getUptime() / 1000);
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    public RelayStatistics getStatistics() {
        return statistics;
    }

    /**
     * Main entry point.
     *
     * @param args command line arguments:
     *             [0] - host (default: HOST or 0.0.0.0)
     *             [1] - port (default: PORT or 3000)
     */
    public static void main(String[] args) {
        RelayConfig config;
        try {
            config = RelayConfig.fromEnvironment(System.getenv(), args);
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        logger.info("Configuration:");
        logger.info("  Host: {}", config.host());
        logger.info("  Port: {}", config.port());
        logger.info("  Upstream: {}", config.upstreamUrl());

        new DuoTalkApplication(config).start();
    }
}
