package eisconnect.event;

import java.time.Instant;
import java.util.Locale;

/**
 * A sensor reading fell outside the configured plausible bounds,
 * which points at a sensor malfunction rather than battery behaviour.
 */
public record SensorOutOfRangeEvent(
        SessionKey session,
        SensorParameter parameter,
        double actualValue,
        double minValue,
        double maxValue,
        int sampleIndex,
        Instant occurredAt
) implements AnomalyEvent {

    @Override
    public AnomalyType type() {
        return parameter.anomalyType();
    }

    @Override
    public String message() {
        return String.format(Locale.ROOT, "Sensor validation failed: %s=%.3f not in range [%.3f, %.3f] for sample #%d",
                parameter.fieldName(), actualValue, minValue, maxValue, sampleIndex);
    }

    @Override
    public double value() {
        return actualValue;
    }

    /**
     * The bound that was crossed.
     */
    @Override
    public double threshold() {
        return actualValue < minValue ? minValue : maxValue;
    }
}
