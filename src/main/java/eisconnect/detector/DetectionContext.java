package eisconnect.detector;

import eisconnect.core.SessionRunningState;
import eisconnect.domain.SessionMeta;
import eisconnect.event.SessionKey;

import java.time.Instant;

/**
 * What a detector needs besides the sample: the session's thresholds,
 * its running state and the detection time stamped on events.
 */
public record DetectionContext(
        SessionMeta meta,
        SessionRunningState state,
        Instant detectedAt
) {
    public SessionKey sessionKey() {
        return SessionKey.of(meta);
    }
}
