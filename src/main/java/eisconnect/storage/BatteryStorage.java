package eisconnect.storage;

import eisconnect.domain.Sample;
import eisconnect.domain.SessionMeta;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Persistence for one session's samples, rejects and analytics events.
 * An instance is scoped to a single battery/test/SoC session and is only
 * used from inside the engine's critical section.
 */
public interface BatteryStorage extends Closeable {

    void initializeSession(SessionMeta meta) throws IOException;

    void storeSample(Sample sample) throws IOException;

    /**
     * @param reason  why the sample was rejected
     * @param rawData raw representation of the sample
     */
    void storeRejectedSample(String reason, String rawData) throws IOException;

    /**
     * @param alertType stored kind, e.g. {@code VoltageSpike}
     * @param message   human-readable description
     * @param value     magnitude of the anomaly
     * @param threshold threshold or bound it was compared against
     */
    void storeAnalyticsEvent(String alertType, String message, double value, double threshold) throws IOException;

    void finalizeSession() throws IOException;

    Path getSessionDirectory();

    int getSampleCount();
}
