package eisconnect.event;

import eisconnect.domain.SessionMeta;

/**
 * Battery, test and state-of-charge identifiers attached to every event.
 */
public record SessionKey(String batteryId, String testId, int socPercent) {

    public static SessionKey of(SessionMeta meta) {
        return new SessionKey(meta.batteryId(), meta.testId(), meta.socPercent());
    }

    @Override
    public String toString() {
        return "Battery: " + batteryId + " | Test: " + testId + " | SoC: " + socPercent + "%";
    }
}
