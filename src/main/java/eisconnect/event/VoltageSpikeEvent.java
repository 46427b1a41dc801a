package eisconnect.event;

import java.time.Instant;
import java.util.Locale;

public record VoltageSpikeEvent(
        SessionKey session,
        double delta,
        double previousVoltage,
        double currentVoltage,
        Direction direction,
        double threshold,
        int sampleIndex,
        Instant occurredAt
) implements AnomalyEvent {

    @Override
    public AnomalyType type() {
        return AnomalyType.VOLTAGE_SPIKE;
    }

    @Override
    public String message() {
        return String.format(Locale.ROOT, "Voltage spike detected: ΔV=%.3fV (%s)", delta, direction.label());
    }

    @Override
    public double value() {
        return Math.abs(delta);
    }
}
