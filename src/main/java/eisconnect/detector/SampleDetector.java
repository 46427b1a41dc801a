package eisconnect.detector;

import eisconnect.domain.Sample;
import eisconnect.event.AnomalyEvent;

import java.util.Optional;

/**
 * One stage of the per-sample detector chain.
 * A detector may read and update the session's running state and raises at most one event.
 */
public interface SampleDetector {

    /**
     * @param sample    the accepted sample
     * @param impedance impedance magnitude of the sample
     * @param context   session thresholds and running state
     * @return the anomaly raised for this sample, if any
     */
    Optional<AnomalyEvent> inspect(Sample sample, double impedance, DetectionContext context);
}
