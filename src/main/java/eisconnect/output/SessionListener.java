package eisconnect.output;

import eisconnect.domain.Sample;
import eisconnect.domain.SessionMeta;
import eisconnect.event.AnomalyEvent;

/**
 * Receives session notifications from the engine.
 * Callbacks run synchronously on the caller's thread, inside the engine's
 * critical section, in registration order. A slow listener slows ingestion.
 */
public interface SessionListener {

    /**
     * A session was opened.
     *
     * @param meta    the session metadata
     * @param message summary of the file being transferred
     */
    default void onSessionStarted(SessionMeta meta, String message) {
        // Default no-op implementation
    }

    /**
     * A sample went through the detector chain and was stored.
     *
     * @param acceptedCount accepted samples so far, including this one
     */
    default void onSampleAccepted(SessionMeta meta, Sample sample, double impedance, int acceptedCount) {
        // Default no-op implementation
    }

    /**
     * The detector chain raised an anomaly.
     */
    default void onAnomaly(AnomalyEvent event) {
        // Default no-op implementation
    }

    /**
     * A session was finalized.
     *
     * @param acceptedCount final number of accepted samples
     */
    default void onSessionCompleted(SessionMeta meta, int acceptedCount) {
        // Default no-op implementation
    }
}
