package eisconnect;

import eisconnect.config.EngineConfig;
import eisconnect.core.BatterySessionEngine;
import eisconnect.input.SessionReplayer;
import eisconnect.input.SessionReplayer.ReplayOptions;
import eisconnect.input.SessionReplayer.ReplayResult;
import eisconnect.output.ConsoleSessionListener;
import eisconnect.storage.FileBatteryStorageFactory;
import eisconnect.transport.SocketIOSessionServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main application class for EisConnect.
 * Wires configuration, file storage, the session engine, console output and
 * the Socket.IO server, or replays measurement files from disk.
 */
public class EisConnectApplication {
    private static final Logger logger = LoggerFactory.getLogger(EisConnectApplication.class);

    static final String MODE_SERVE = "serve";
    static final String MODE_REPLAY = "replay";

    private final EngineConfig config;
    private final BatterySessionEngine engine;
    private final SocketIOSessionServer server;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private Runnable exitHook = () -> System.exit(1);

    /**
     * Create the application from the loaded configuration with compact, colorized output.
     */
    public EisConnectApplication(EngineConfig config) {
        this(config, false, true);
    }

    /**
     * @param config    engine, storage and server settings
     * @param verbose   print every accepted sample
     * @param colorized use ANSI colors in console output
     */
    public EisConnectApplication(EngineConfig config, boolean verbose, boolean colorized) {
        this.config = config;
        this.engine = new BatterySessionEngine(config,
                new FileBatteryStorageFactory(Paths.get(config.storagePath())));
        this.engine.addListener(new ConsoleSessionListener(verbose, colorized));
        this.server = new SocketIOSessionServer(config.host(), config.port(), engine);
    }

    void setExitHook(Runnable exitHook) {
        this.exitHook = exitHook;
    }

    BatterySessionEngine getEngine() {
        return engine;
    }

    /**
     * Start the Socket.IO server and block until {@link #shutdown()} is called.
     */
    public void start() {
        try {
            logger.info("Starting EisConnect Application...");
            logger.info("════════════════════════════════════════════════════════");
            logger.info("EisConnect - battery impedance session analytics");
            logger.info("════════════════════════════════════════════════════════");

            server.start();

            logger.info("Application started successfully");
            logger.info("Listening on {}:{}, storing sessions below {}", config.host(), config.port(),
                    config.storagePath());
            logger.info("Press Ctrl+C to stop the server");

            try {
                shutdownLatch.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Application interrupted");
            }
        } catch (Exception e) {
            logger.error("Failed to start application", e);
            shutdown();
            exitHook.run();
        }
    }

    /**
     * Stop the server and release any open session. Safe to call more than once.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            shutdownLatch.countDown();
            return;
        }
        logger.info("Shutting down EisConnect Application...");
        try {
            server.stop();
            logger.info("Final state: {} ({} samples accepted in current session)",
                    engine.status(), engine.acceptedCount());
            engine.close();
            logger.info("Application shut down successfully");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    /**
     * Replay every measurement file below a base directory through the engine.
     */
    public List<ReplayResult> replay(Path basePath) {
        ReplayOptions options = ReplayOptions.defaults(Paths.get(config.storagePath(), "rejects"));
        List<ReplayResult> results = new SessionReplayer(engine, options).replayAll(basePath);

        int accepted = results.stream().mapToInt(ReplayResult::acceptedSamples).sum();
        int failed = results.stream().mapToInt(ReplayResult::failedSamples).sum();
        int rejected = results.stream().mapToInt(ReplayResult::readerRejects).sum();
        long failedFiles = results.stream().filter(result -> !result.succeeded()).count();
        logger.info("Replay summary: {} file(s), {} failed; {} samples accepted, {} failed, {} rejected by reader",
                results.size(), failedFiles, accepted, failed, rejected);
        engine.close();
        return results;
    }

    /**
     * Main entry point.
     *
     * @param args {@code serve} (default) or {@code replay <basePath>}
     */
    public static void main(String[] args) {
        String mode = args.length > 0 ? args[0] : MODE_SERVE;

        EisConnectApplication app;
        try {
            EngineConfig config = EngineConfig.load();
            logger.info("Configuration:");
            logger.info("  • Mode: {}", mode);
            logger.info("  • Host: {}", config.host());
            logger.info("  • Port: {}", config.port());
            logger.info("  • Storage: {}", config.storagePath());
            app = new EisConnectApplication(config);
        } catch (RuntimeException e) {
            logger.error("Failed to initialize application", e);
            System.exit(1);
            return;
        }

        if (MODE_REPLAY.equals(mode)) {
            if (args.length < 2) {
                logger.error("Usage: replay <basePath>");
                System.exit(1);
                return;
            }
            app.replay(Paths.get(args[1]));
        } else if (MODE_SERVE.equals(mode)) {
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown));
            app.start();
        } else {
            logger.error("Unknown mode '{}', expected '{}' or '{}'", mode, MODE_SERVE, MODE_REPLAY);
            System.exit(1);
        }
    }
}
