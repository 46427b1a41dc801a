package eisconnect.detector;

import eisconnect.domain.Sample;
import eisconnect.event.AnomalyEvent;
import eisconnect.event.Direction;
import eisconnect.event.OutOfBandDeviationEvent;

import java.util.Optional;

/**
 * Folds the impedance into the running mean, then checks it against the band
 * {@code mean * (1 ± DeviationPercent/100)} computed from the updated mean.
 */
public class OutOfBandDetector implements SampleDetector {

    @Override
    public Optional<AnomalyEvent> inspect(Sample sample, double impedance, DetectionContext context) {
        double deviationPercent = context.meta().deviationPercent();
        double mean = context.state().foldImpedance(impedance);

        double lowBound = mean * (1 - deviationPercent / 100.0);
        double highBound = mean * (1 + deviationPercent / 100.0);

        if (impedance < lowBound) {
            return Optional.of(event(sample, impedance, lowBound, mean, Direction.FALLING, context));
        } else if (impedance > highBound) {
            return Optional.of(event(sample, impedance, highBound, mean, Direction.RISING, context));
        }
        return Optional.empty();
    }

    private static AnomalyEvent event(Sample sample, double impedance, double bound, double mean,
                                      Direction direction, DetectionContext context) {
        return new OutOfBandDeviationEvent(context.sessionKey(), impedance, bound, mean,
                context.meta().deviationPercent(), direction, sample.frequencyHz(), sample.rowIndex(),
                context.detectedAt());
    }
}
