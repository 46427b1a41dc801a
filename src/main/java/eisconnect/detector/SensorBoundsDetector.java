package eisconnect.detector;

import eisconnect.config.EngineConfig;
import eisconnect.domain.Sample;
import eisconnect.event.SensorOutOfRangeEvent;
import eisconnect.event.SensorParameter;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks R_ohm and Range_ohm against the service-wide plausible bounds.
 * The two checks are independent, so one sample can raise both events.
 * A non-finite reading is always out of bounds.
 * Runs before the sample is stored; it does not touch running state.
 */
public class SensorBoundsDetector {
    private final double resistanceMin;
    private final double resistanceMax;
    private final double rangeMin;
    private final double rangeMax;

    public SensorBoundsDetector(double resistanceMin, double resistanceMax, double rangeMin, double rangeMax) {
        this.resistanceMin = resistanceMin;
        this.resistanceMax = resistanceMax;
        this.rangeMin = rangeMin;
        this.rangeMax = rangeMax;
    }

    public static SensorBoundsDetector from(EngineConfig config) {
        return new SensorBoundsDetector(config.resistanceMin(), config.resistanceMax(),
                config.rangeMin(), config.rangeMax());
    }

    public List<SensorOutOfRangeEvent> inspect(Sample sample, DetectionContext context) {
        List<SensorOutOfRangeEvent> events = new ArrayList<>(2);

        if (outside(sample.resistanceOhm(), resistanceMin, resistanceMax)) {
            events.add(new SensorOutOfRangeEvent(context.sessionKey(), SensorParameter.RESISTANCE,
                    sample.resistanceOhm(), resistanceMin, resistanceMax, sample.rowIndex(), context.detectedAt()));
        }
        if (outside(sample.rangeOhm(), rangeMin, rangeMax)) {
            events.add(new SensorOutOfRangeEvent(context.sessionKey(), SensorParameter.RANGE,
                    sample.rangeOhm(), rangeMin, rangeMax, sample.rowIndex(), context.detectedAt()));
        }
        return events;
    }

    /**
     * Reject reason recorded alongside the event.
     */
    public static String rejectReason(SensorOutOfRangeEvent event) {
        return event.parameter().fieldName() + " out of bounds: " + event.actualValue()
                + " not in [" + event.minValue() + ", " + event.maxValue() + "]";
    }

    private static boolean outside(double value, double min, double max) {
        return !Double.isFinite(value) || value < min || value > max;
    }
}
