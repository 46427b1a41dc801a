package eisconnect.core;

import eisconnect.domain.Sample;

import java.time.Instant;
import java.util.Optional;

/**
 * Structural checks run on every sample before any detector sees it.
 * Checks run in a fixed order and stop at the first failure.
 * T_degC and Range_ohm are not checked here: out-of-range readings there
 * are reported by the sensor-bounds detector instead.
 */
public class SampleValidator {

    public Optional<ValidationFailure> validate(Sample sample) {
        if (sample == null) {
            return fail("sample", "null", "Sample is null");
        }

        double frequency = sample.frequencyHz();
        if (!(frequency > 0) || Double.isInfinite(frequency)) {
            return fail("FrequencyHz", frequency, "Invalid FrequencyHz: " + frequency + " (must be positive)");
        }
        if (!Double.isFinite(sample.resistanceOhm())) {
            return fail("R_ohm", sample.resistanceOhm(), "Invalid R_ohm: " + sample.resistanceOhm());
        }
        if (!Double.isFinite(sample.reactanceOhm())) {
            return fail("X_ohm", sample.reactanceOhm(), "Invalid X_ohm: " + sample.reactanceOhm());
        }
        if (!Double.isFinite(sample.voltage())) {
            return fail("V", sample.voltage(), "Invalid V: " + sample.voltage());
        }
        if (sample.rowIndex() < 0) {
            return fail("RowIndex", String.valueOf(sample.rowIndex()),
                    "Invalid RowIndex: " + sample.rowIndex() + " (must be non-negative)");
        }
        Instant capturedAt = sample.capturedAtUtc();
        if (capturedAt == null || Instant.EPOCH.equals(capturedAt)) {
            return fail("CapturedAtUtc", String.valueOf(capturedAt), "Invalid Timestamp");
        }
        return Optional.empty();
    }

    private static Optional<ValidationFailure> fail(String field, double value, String message) {
        return fail(field, String.valueOf(value), message);
    }

    private static Optional<ValidationFailure> fail(String field, String value, String message) {
        return Optional.of(new ValidationFailure(field, value, message));
    }
}
