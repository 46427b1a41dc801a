package eisconnect.detector;

import eisconnect.domain.Sample;
import eisconnect.event.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs the post-storage detectors in a fixed order for one accepted sample.
 * Events are handed to the sink as soon as each detector raises them, and a
 * detection never stops the chain. The last impedance is updated once every
 * detector has run.
 */
public class DetectorChain {
    private static final Logger logger = LoggerFactory.getLogger(DetectorChain.class);

    private final List<SampleDetector> detectors;

    public DetectorChain(List<SampleDetector> detectors) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors cannot be null"));
    }

    /**
     * Temperature, voltage, impedance jump, then out-of-band.
     */
    public static DetectorChain standard(double temperatureThreshold) {
        return new DetectorChain(List.of(
                new TemperatureSpikeDetector(temperatureThreshold),
                new VoltageSpikeDetector(),
                new ImpedanceJumpDetector(),
                new OutOfBandDetector()));
    }

    /**
     * @return the impedance computed for the sample
     */
    public double run(Sample sample, DetectionContext context, Consumer<AnomalyEvent> sink) {
        double impedance = sample.impedance();

        for (SampleDetector detector : detectors) {
            detector.inspect(sample, impedance, context).ifPresent(event -> {
                logger.debug("{} raised {} for row {}", detector.getClass().getSimpleName(),
                        event.type(), sample.rowIndex());
                sink.accept(event);
            });
        }

        context.state().setLastImpedance(impedance);
        return impedance;
    }

    public List<SampleDetector> getDetectors() {
        return detectors;
    }
}
