package eisconnect.event;

import java.time.Instant;
import java.util.Locale;

/**
 * Temperature moved by more than the service-wide threshold between two
 * consecutive accepted samples. Usually a sign of overheating.
 */
public record TemperatureSpikeEvent(
        SessionKey session,
        double delta,
        double previousTemperature,
        double currentTemperature,
        Direction direction,
        double frequencyHz,
        double threshold,
        int sampleIndex,
        Instant occurredAt
) implements AnomalyEvent {

    @Override
    public AnomalyType type() {
        return AnomalyType.TEMPERATURE_SPIKE;
    }

    @Override
    public String message() {
        return String.format(Locale.ROOT, "Temperature spike detected: ΔT=%.3f°C (%s) at F=%.3fHz, SoC=%d%%",
                delta, direction.label(), frequencyHz, session.socPercent());
    }

    @Override
    public double value() {
        return Math.abs(delta);
    }
}
