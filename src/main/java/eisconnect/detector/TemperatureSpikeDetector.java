package eisconnect.detector;

import eisconnect.core.SessionRunningState;
import eisconnect.domain.Sample;
import eisconnect.event.AnomalyEvent;
import eisconnect.event.Direction;
import eisconnect.event.TemperatureSpikeEvent;

import java.util.Optional;

/**
 * Flags a temperature change between consecutive samples larger than the
 * service-wide threshold. The last temperature is always updated.
 */
public class TemperatureSpikeDetector implements SampleDetector {
    private final double threshold;

    public TemperatureSpikeDetector(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public Optional<AnomalyEvent> inspect(Sample sample, double impedance, DetectionContext context) {
        SessionRunningState state = context.state();
        double current = sample.temperatureC();
        Optional<AnomalyEvent> event = Optional.empty();

        if (state.lastTemperature().isPresent()) {
            double previous = state.lastTemperature().getAsDouble();
            double delta = current - previous;
            if (Math.abs(delta) > threshold) {
                event = Optional.of(new TemperatureSpikeEvent(context.sessionKey(), delta, previous, current,
                        Direction.of(delta), sample.frequencyHz(), threshold, sample.rowIndex(),
                        context.detectedAt()));
            }
        }
        state.setLastTemperature(current);
        return event;
    }
}
