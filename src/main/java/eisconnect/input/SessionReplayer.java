package eisconnect.input;

import eisconnect.core.BatterySessionEngine;
import eisconnect.domain.Sample;
import eisconnect.domain.SessionMeta;
import eisconnect.error.SessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Replays measurement files through the session engine, one session per file.
 * Sample-level failures are counted and the replay moves on to the next row.
 */
public class SessionReplayer {
    private static final Logger logger = LoggerFactory.getLogger(SessionReplayer.class);

    private final BatterySessionEngine engine;
    private final ReplayOptions options;
    private final Clock clock;

    public SessionReplayer(BatterySessionEngine engine, ReplayOptions options) {
        this(engine, options, Clock.systemUTC());
    }

    public SessionReplayer(BatterySessionEngine engine, ReplayOptions options, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Discover and replay every measurement file below a base directory.
     */
    public List<ReplayResult> replayAll(Path basePath) {
        List<EisFileInfo> files = EisFileDiscovery.discover(basePath);
        List<ReplayResult> results = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            EisFileInfo file = files.get(i);
            logger.info("Replaying file {}/{}: {}", i + 1, files.size(), file.filePath());
            results.add(replay(file));
        }
        return results;
    }

    /**
     * Replay one file as a complete session.
     */
    public ReplayResult replay(EisFileInfo file) {
        int totalRows;
        try {
            totalRows = EisFileDiscovery.countRows(file.filePath());
        } catch (IOException e) {
            logger.error("Cannot read {}", file.filePath(), e);
            return ReplayResult.failed(file, "Cannot read file: " + e.getMessage());
        }

        SessionMeta meta = new SessionMeta(file.batteryId(), file.testId(), file.socPercent(),
                file.fileName(), totalRows, options.voltageThreshold(), options.impedanceThreshold(),
                options.deviationPercent());
        try {
            engine.startSession(meta);
        } catch (SessionException e) {
            logger.error("Cannot start session for {}: {}", file.fileName(), e.getMessage());
            return ReplayResult.failed(file, e.getMessage());
        }

        int accepted = 0;
        int failed = 0;
        int readerRejects = 0;
        String error = null;
        Path rejectsFile = options.rejectsDirectory().resolve(rejectsFileName(file));
        try (EisCsvReader reader = new EisCsvReader(file.filePath(), rejectsFile, clock)) {
            Optional<Sample> next;
            while ((next = reader.readNext()).isPresent()) {
                try {
                    engine.pushSample(next.get());
                    accepted++;
                } catch (SessionException e) {
                    failed++;
                    logger.warn("Sample #{} of {} failed: {}", next.get().rowIndex(), file.fileName(),
                            e.getMessage());
                }
            }
            readerRejects = reader.getRejectedCount();
        } catch (IOException e) {
            logger.error("Error reading {}", file.filePath(), e);
            error = "Read error: " + e.getMessage();
        }

        try {
            engine.endSession();
        } catch (SessionException e) {
            logger.error("Cannot end session for {}: {}", file.fileName(), e.getMessage());
            error = error == null ? e.getMessage() : error;
        }

        logger.info("Replayed {}: {} accepted, {} failed, {} rejected by reader",
                file.fileName(), accepted, failed, readerRejects);
        return new ReplayResult(file, accepted, failed, readerRejects, error);
    }

    static String rejectsFileName(EisFileInfo file) {
        return file.batteryId() + "_" + file.testId() + "_" + file.socPercent() + "_rejects.csv";
    }

    /**
     * Per-run thresholds and the directory that receives reader reject files.
     */
    public record ReplayOptions(
            double voltageThreshold,
            double impedanceThreshold,
            double deviationPercent,
            Path rejectsDirectory
    ) {
        public static final double DEFAULT_VOLTAGE_THRESHOLD = 0.05;
        public static final double DEFAULT_IMPEDANCE_THRESHOLD = 0.1;
        public static final double DEFAULT_DEVIATION_PERCENT = 25.0;

        public ReplayOptions {
            Objects.requireNonNull(rejectsDirectory, "rejectsDirectory cannot be null");
        }

        public static ReplayOptions defaults(Path rejectsDirectory) {
            return new ReplayOptions(DEFAULT_VOLTAGE_THRESHOLD, DEFAULT_IMPEDANCE_THRESHOLD,
                    DEFAULT_DEVIATION_PERCENT, rejectsDirectory);
        }
    }

    /**
     * Outcome of replaying one file. {@code error} is null when the session ran to completion.
     */
    public record ReplayResult(
            EisFileInfo file,
            int acceptedSamples,
            int failedSamples,
            int readerRejects,
            String error
    ) {
        static ReplayResult failed(EisFileInfo file, String error) {
            return new ReplayResult(file, 0, 0, 0, error);
        }

        public boolean succeeded() {
            return error == null;
        }
    }
}
