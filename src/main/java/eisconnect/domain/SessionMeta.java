package eisconnect.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata describing one ingestion session: which battery, test and state of
 * charge is being measured, and the per-session detection thresholds.
 */
public record SessionMeta(
        @JsonProperty("BatteryId") String batteryId,
        @JsonProperty("TestId") String testId,
        @JsonProperty("SocPercent") int socPercent,
        @JsonProperty("FileName") String fileName,
        @JsonProperty("TotalRows") int totalRows,
        @JsonProperty("VThreshold") double voltageThreshold,
        @JsonProperty("ZThreshold") double impedanceThreshold,
        @JsonProperty("DeviationPercent") double deviationPercent
) {
    /**
     * Short identifier used in log lines and console output.
     */
    public String label() {
        return batteryId + "/" + testId + "/" + socPercent + "%";
    }
}
