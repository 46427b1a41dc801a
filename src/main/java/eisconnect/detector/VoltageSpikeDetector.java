package eisconnect.detector;

import eisconnect.core.SessionRunningState;
import eisconnect.domain.Sample;
import eisconnect.event.AnomalyEvent;
import eisconnect.event.Direction;
import eisconnect.event.VoltageSpikeEvent;

import java.util.Optional;

/**
 * Flags a voltage change between consecutive samples larger than the session's VThreshold.
 * The last voltage is always updated.
 */
public class VoltageSpikeDetector implements SampleDetector {

    @Override
    public Optional<AnomalyEvent> inspect(Sample sample, double impedance, DetectionContext context) {
        SessionRunningState state = context.state();
        double threshold = context.meta().voltageThreshold();
        double current = sample.voltage();
        Optional<AnomalyEvent> event = Optional.empty();

        if (state.lastVoltage().isPresent()) {
            double previous = state.lastVoltage().getAsDouble();
            double delta = current - previous;
            if (Math.abs(delta) > threshold) {
                event = Optional.of(new VoltageSpikeEvent(context.sessionKey(), delta, previous, current,
                        Direction.of(delta), threshold, sample.rowIndex(), context.detectedAt()));
            }
        }
        state.setLastVoltage(current);
        return event;
    }
}
