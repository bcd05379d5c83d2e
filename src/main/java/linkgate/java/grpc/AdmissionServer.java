package linkgate.java.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import linkgate.core.clock.Clock;
import linkgate.core.clock.SystemClock;
import linkgate.java.config.AdmissionSettings;
import linkgate.java.engine.KeyedRateLimiter;
import linkgate.java.engine.MaintenanceScheduler;
import linkgate.java.engine.PopularityGatedCacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for admission control.
 *
 * <p>Features:
 * <ul>
 *   <li>Settings from the environment (see {@link AdmissionSettings})</li>
 *   <li>Port override from the first command line argument</li>
 *   <li>One cache manager and one rate limiter per process, injected into the service</li>
 *   <li>Periodic cleanup sweeps</li>
 *   <li>Graceful shutdown with timeout</li>
 * </ul>
 */
public final class AdmissionServer {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServer.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final MaintenanceScheduler maintenance;

    /**
     * Creates a server with process-wide instances built from the settings.
     *
     * @param settings Port, cache and limiter configuration
     */
    public AdmissionServer(AdmissionSettings settings) {
        this(settings, SystemClock.instance());
    }

    /**
     * Creates a server with a custom clock (useful for testing).
     *
     * @param settings Port, cache and limiter configuration
     * @param clock Time source for expiry and refill
     */
    public AdmissionServer(AdmissionSettings settings, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        PopularityGatedCacheManager cacheManager = new PopularityGatedCacheManager(clock, settings.cache());
        KeyedRateLimiter rateLimiter = new KeyedRateLimiter(clock, settings.rateLimiter());

        this.maintenance = new MaintenanceScheduler(
            settings.cacheEnabled() ? cacheManager : null,
            settings.rateLimitEnabled() ? rateLimiter : null,
            settings.maintenanceIntervalSeconds()
        );
        this.server = ServerBuilder.forPort(settings.port())
            .addService(new AdmissionServiceImpl(
                cacheManager,
                rateLimiter,
                settings.cacheEnabled(),
                settings.rateLimitEnabled()))
            .build();

        log.info("Caching: {} (max size {}, ttl {}s, popularity threshold {})",
            settings.cacheEnabled() ? "enabled" : "disabled",
            settings.cache().maxSize(),
            settings.cache().defaultTtlSeconds(),
            settings.cache().popularityThreshold());
        log.info("Rate limiting: {} ({} requests per {}s)",
            settings.rateLimitEnabled() ? "enabled" : "disabled",
            settings.rateLimiter().requestsPerWindow(),
            settings.rateLimiter().windowSeconds());
    }

    /**
     * Starts the server and the maintenance sweeps.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        maintenance.start();
        log.info("AdmissionServer started on port: {}", server.getPort());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                AdmissionServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted: {}", e.getMessage());
            }
        }));
    }

    /**
     * Stops the server gracefully.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        maintenance.stop();
        server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        log.info("AdmissionServer stopped.");
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on. Only valid after {@link #start()}.
     *
     * @return bound port number (the ephemeral one when configured with port 0)
     */
    public int getPort() {
        return server.getPort();
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        AdmissionSettings settings;
        try {
            settings = AdmissionSettings.fromEnvironment();
            if (args.length > 0) {
                settings = settings.withPort(Integer.parseInt(args[0]));
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        AdmissionServer server = new AdmissionServer(settings);
        server.start();
        server.blockUntilShutdown();
    }
}
