package eisconnect.event;

import java.time.Instant;
import java.util.Locale;

/**
 * Impedance fell outside the percentage band around the session's running mean.
 * {@code bound} is the low bound when the reading is below the band and the
 * high bound when it is above.
 */
public record OutOfBandDeviationEvent(
        SessionKey session,
        double impedance,
        double bound,
        double runningMean,
        double deviationPercent,
        Direction direction,
        double frequencyHz,
        int sampleIndex,
        Instant occurredAt
) implements AnomalyEvent {

    @Override
    public AnomalyType type() {
        return AnomalyType.OUT_OF_BAND;
    }

    @Override
    public String message() {
        return String.format(Locale.ROOT, "Impedance out of band: %.3f %s expected range (Mean: %.3f)",
                impedance, direction == Direction.FALLING ? "below" : "above", runningMean);
    }

    @Override
    public double value() {
        return impedance;
    }

    @Override
    public double threshold() {
        return bound;
    }
}
