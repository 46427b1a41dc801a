package eisconnect.event;

import java.time.Instant;
import java.util.Locale;

public record ImpedanceJumpEvent(
        SessionKey session,
        double delta,
        double previousImpedance,
        double currentImpedance,
        Direction direction,
        double threshold,
        int sampleIndex,
        Instant occurredAt
) implements AnomalyEvent {

    @Override
    public AnomalyType type() {
        return AnomalyType.IMPEDANCE_JUMP;
    }

    @Override
    public String message() {
        return String.format(Locale.ROOT, "Impedance jump detected: ΔZ=%.3fΩ (%s)", delta, direction.label());
    }

    @Override
    public double value() {
        return Math.abs(delta);
    }
}
