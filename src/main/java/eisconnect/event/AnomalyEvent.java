package eisconnect.event;

import java.time.Instant;

/**
 * An anomaly raised by the detector chain for one accepted sample.
 * Events are dispatched to listeners and written to the analytics sink,
 * then discarded.
 */
public sealed interface AnomalyEvent permits
        VoltageSpikeEvent,
        ImpedanceJumpEvent,
        TemperatureSpikeEvent,
        SensorOutOfRangeEvent,
        OutOfBandDeviationEvent {

    AnomalyType type();

    SessionKey session();

    /**
     * Human-readable description.
     */
    String message();

    /**
     * Magnitude stored with the event: an absolute delta or the offending reading.
     */
    double value();

    /**
     * Threshold or bound the value was compared against.
     */
    double threshold();

    Instant occurredAt();
}
