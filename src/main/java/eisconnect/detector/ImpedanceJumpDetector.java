package eisconnect.detector;

import eisconnect.domain.Sample;
import eisconnect.event.AnomalyEvent;
import eisconnect.event.Direction;
import eisconnect.event.ImpedanceJumpEvent;

import java.util.OptionalDouble;
import java.util.Optional;

/**
 * Flags an impedance change between consecutive samples larger than the session's ZThreshold.
 * Does not update the last impedance; the chain does that after the out-of-band check.
 */
public class ImpedanceJumpDetector implements SampleDetector {

    @Override
    public Optional<AnomalyEvent> inspect(Sample sample, double impedance, DetectionContext context) {
        OptionalDouble last = context.state().lastImpedance();
        if (last.isEmpty()) {
            return Optional.empty();
        }

        double threshold = context.meta().impedanceThreshold();
        double previous = last.getAsDouble();
        double delta = impedance - previous;
        if (Math.abs(delta) <= threshold) {
            return Optional.empty();
        }
        return Optional.of(new ImpedanceJumpEvent(context.sessionKey(), delta, previous, impedance,
                Direction.of(delta), threshold, sample.rowIndex(), context.detectedAt()));
    }
}
