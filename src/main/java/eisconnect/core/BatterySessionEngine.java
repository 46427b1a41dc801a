package eisconnect.core;

import eisconnect.config.EngineConfig;
import eisconnect.detector.DetectionContext;
import eisconnect.detector.DetectorChain;
import eisconnect.detector.SensorBoundsDetector;
import eisconnect.domain.Ack;
import eisconnect.domain.Sample;
import eisconnect.domain.SessionMeta;
import eisconnect.error.ProcessingException;
import eisconnect.error.SessionException;
import eisconnect.error.StorageException;
import eisconnect.error.ValidationException;
import eisconnect.event.AnomalyEvent;
import eisconnect.event.SensorOutOfRangeEvent;
import eisconnect.output.SessionListener;
import eisconnect.storage.BatteryStorage;
import eisconnect.storage.BatteryStorageFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Streaming analytics engine for one battery test session at a time.
 *
 * <p>{@link #startSession}, {@link #pushSample} and {@link #endSession} all run
 * under one exclusive lock: overlapping callers block until the running call
 * finishes. Storage calls and listener callbacks execute inside that lock, so a
 * slow storage backend or listener slows the whole pipeline. Storage calls have
 * no timeout; a hung storage call blocks every later operation.
 *
 * <p>Per accepted sample the order is: validation, sensor bounds, store,
 * temperature, voltage, impedance jump, running mean and out-of-band, then the
 * last impedance is updated and the sample is counted.
 */
public class BatterySessionEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BatterySessionEngine.class);

    private final EngineConfig config;
    private final BatteryStorageFactory storageFactory;
    private final SampleValidator validator;
    private final SensorBoundsDetector boundsDetector;
    private final DetectorChain detectorChain;
    private final Clock clock;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock(true);

    private final SessionRunningState state = new SessionRunningState();
    private SessionMeta currentSession;
    private BatteryStorage storage;

    public BatterySessionEngine(EngineConfig config, BatteryStorageFactory storageFactory) {
        this(config, storageFactory, Clock.systemUTC());
    }

    public BatterySessionEngine(EngineConfig config, BatteryStorageFactory storageFactory, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.storageFactory = Objects.requireNonNull(storageFactory, "storageFactory cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.validator = new SampleValidator();
        this.boundsDetector = SensorBoundsDetector.from(config);
        this.detectorChain = DetectorChain.standard(config.temperatureThreshold());

        logger.info("Engine configured: ΔT > {}°C, R_ohm [{}, {}], Range_ohm [{}, {}]",
                config.temperatureThreshold(), config.resistanceMin(), config.resistanceMax(),
                config.rangeMin(), config.rangeMax());
    }

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
        logger.debug("Added listener: {}", listener.getClass().getSimpleName());
    }

    public boolean removeListener(SessionListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Open a session. Calling this while a session is active replaces it:
     * the old storage is closed without being finalized.
     *
     * @throws ValidationException if the metadata is missing or out of range
     * @throws StorageException    if the session storage cannot be opened
     */
    public Ack startSession(SessionMeta meta) {
        lock.lock();
        try {
            validateMeta(meta);

            BatteryStorage opened = openStorage(meta);
            if (storage != null) {
                logger.warn("Session {} replaced by {} before EndSession", currentSession.label(), meta.label());
                releaseSession();
            }

            storage = opened;
            currentSession = meta;
            state.reset();

            String message = "File: " + meta.fileName() + " | Expected: " + meta.totalRows() + " samples";
            logger.info("Session started: {} ({})", meta.label(), message);
            logger.info("Storage directory: {}", opened.getSessionDirectory());
            logger.info("Analytics thresholds: V={}V, Z={}Ω, Deviation={}%",
                    meta.voltageThreshold(), meta.impedanceThreshold(), meta.deviationPercent());

            notifyListeners(listener -> listener.onSessionStarted(meta, message));
            return Ack.inProgress("Session started");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Validate, store and analyse one sample.
     *
     * @throws ValidationException if no session is active or the sample is malformed
     * @throws ProcessingException if storage or processing fails unexpectedly
     */
    public Ack pushSample(Sample sample) {
        lock.lock();
        try {
            if (storage == null || currentSession == null) {
                throw new ValidationException("Session not started", "session", "null");
            }

            SessionRunningState before = state.snapshot();
            try {
                return processSample(sample);
            } catch (SessionException e) {
                state.restore(before);
                throw e;
            } catch (Exception e) {
                // Failed samples leave the running state untouched
                state.restore(before);
                recordProcessingReject(sample, e);
                logger.error("Failed to process sample {} for {}", Sample.describe(sample),
                        currentSession.label(), e);
                throw new ProcessingException("Processing error: " + e.getMessage(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finalize the active session and release its storage.
     *
     * @throws ValidationException if no session is active
     * @throws ProcessingException if storage cannot be finalized; the session stays active
     */
    public Ack endSession() {
        lock.lock();
        try {
            if (storage == null || currentSession == null) {
                throw new ValidationException("No active session", "session", "null");
            }

            SessionMeta meta = currentSession;
            try {
                storage.finalizeSession();
            } catch (IOException | RuntimeException e) {
                logger.error("Failed to finalize session {}", meta.label(), e);
                throw new ProcessingException("Failed to finalize session: " + e.getMessage(), e);
            }

            int accepted = state.acceptedCount();
            notifyListeners(listener -> listener.onSessionCompleted(meta, accepted));
            logger.info("Session completed: {} - {} samples processed successfully, data saved to {}",
                    meta.label(), accepted, storage.getSessionDirectory());

            releaseSession();
            return Ack.completed("Session completed");
        } finally {
            lock.unlock();
        }
    }

    public SessionState status() {
        lock.lock();
        try {
            return currentSession == null ? SessionState.IDLE : SessionState.ACTIVE;
        } finally {
            lock.unlock();
        }
    }

    public Optional<SessionMeta> currentSession() {
        lock.lock();
        try {
            return Optional.ofNullable(currentSession);
        } finally {
            lock.unlock();
        }
    }

    public int acceptedCount() {
        lock.lock();
        try {
            return state.acceptedCount();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Running mean impedance of the active session, empty before the first accepted sample.
     */
    public Optional<Double> runningMeanImpedance() {
        lock.lock();
        try {
            return state.sampleCount() == 0 ? Optional.empty() : Optional.of(state.runningMeanImpedance());
        } finally {
            lock.unlock();
        }
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Release any open storage without finalizing it.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (currentSession != null) {
                logger.warn("Closing engine with session {} still active", currentSession.label());
            }
            releaseSession();
        } finally {
            lock.unlock();
        }
    }

    private Ack processSample(Sample sample) throws IOException {
        Optional<ValidationFailure> failure = validator.validate(sample);
        if (failure.isPresent()) {
            ValidationFailure validationFailure = failure.get();
            storage.storeRejectedSample(validationFailure.message(), Sample.describe(sample));
            logger.debug("Rejected sample {}: {}", Sample.describe(sample), validationFailure.message());
            throw validationFailure.toException();
        }

        DetectionContext context = new DetectionContext(currentSession, state, Instant.now(clock));

        // Out-of-bounds samples are logged as rejects but still stored and analysed
        for (SensorOutOfRangeEvent event : boundsDetector.inspect(sample, context)) {
            emit(event);
            storage.storeRejectedSample(SensorBoundsDetector.rejectReason(event), sample.toRawString());
        }

        storage.storeSample(sample);

        double impedance = detectorChain.run(sample, context, event -> {
            try {
                emit(event);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });

        int accepted = state.incrementAccepted();
        SessionMeta meta = currentSession;
        notifyListeners(listener -> listener.onSampleAccepted(meta, sample, impedance, accepted));
        logger.debug("Sample #{} accepted: V={} Z={} F={}Hz T={}°C", accepted, sample.voltage(), impedance,
                sample.frequencyHz(), sample.temperatureC());

        return Ack.inProgress("Sample accepted");
    }

    private void emit(AnomalyEvent event) throws IOException {
        logger.warn("{} [{}] {}", event.type().alertType(), currentSession.label(), event.message());
        notifyListeners(listener -> listener.onAnomaly(event));
        storage.storeAnalyticsEvent(event.type().alertType(), event.message(), event.value(), event.threshold());
    }

    private void recordProcessingReject(Sample sample, Exception cause) {
        if (storage == null) {
            return;
        }
        try {
            storage.storeRejectedSample("Processing error: " + cause.getMessage(), Sample.describe(sample));
        } catch (IOException | RuntimeException e) {
            cause.addSuppressed(e);
            logger.error("Could not record rejected sample {}", Sample.describe(sample), e);
        }
    }

    private BatteryStorage openStorage(SessionMeta meta) {
        BatteryStorage opened = null;
        try {
            opened = storageFactory.open(meta);
            opened.initializeSession(meta);
            return opened;
        } catch (IOException | RuntimeException e) {
            if (opened != null) {
                closeQuietly(opened);
            }
            logger.error("Failed to initialize storage for {}", meta.label(), e);
            throw new StorageException("Failed to initialize session storage: " + e.getMessage(), e);
        }
    }

    private void releaseSession() {
        if (storage != null) {
            closeQuietly(storage);
        }
        storage = null;
        currentSession = null;
        state.reset();
    }

    private static void closeQuietly(BatteryStorage toClose) {
        try {
            toClose.close();
        } catch (IOException | RuntimeException e) {
            logger.warn("Error during storage disposal: {}", e.getMessage(), e);
        }
    }

    private void notifyListeners(Consumer<SessionListener> callback) {
        for (SessionListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (Exception e) {
                logger.warn("Listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private static void validateMeta(SessionMeta meta) {
        if (meta == null) {
            throw new ValidationException("EisMeta is null", "meta", "null");
        }
        if (meta.batteryId() == null || meta.batteryId().isBlank()) {
            throw new ValidationException("BatteryId is required", "BatteryId", String.valueOf(meta.batteryId()));
        }
        if (meta.testId() == null || meta.testId().isBlank()) {
            throw new ValidationException("TestId is required", "TestId", String.valueOf(meta.testId()));
        }
        if (meta.socPercent() < 0 || meta.socPercent() > 100) {
            throw new ValidationException("SoC% must be between 0 and 100", "SocPercent",
                    String.valueOf(meta.socPercent()));
        }
        if (!(meta.voltageThreshold() > 0)) {
            throw new ValidationException("V_threshold must be positive", "VThreshold",
                    String.valueOf(meta.voltageThreshold()));
        }
        if (!(meta.impedanceThreshold() > 0)) {
            throw new ValidationException("Z_threshold must be positive", "ZThreshold",
                    String.valueOf(meta.impedanceThreshold()));
        }
        if (!(meta.deviationPercent() > 0) || meta.deviationPercent() > 100) {
            throw new ValidationException("DeviationPercent must be between 0 and 100", "DeviationPercent",
                    String.valueOf(meta.deviationPercent()));
        }
    }
}
