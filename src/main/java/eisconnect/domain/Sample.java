package eisconnect.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * One EIS measurement row: frequency, resistance, reactance, voltage,
 * temperature and measurement range, plus its position in the stream.
 * The same parsing rules are used by the file reader and the live transport.
 */
public record Sample(
        @JsonProperty("FrequencyHz") double frequencyHz,
        @JsonProperty("R_ohm") double resistanceOhm,
        @JsonProperty("X_ohm") double reactanceOhm,
        @JsonProperty("V") double voltage,
        @JsonProperty("T_degC") double temperatureC,
        @JsonProperty("Range_ohm") double rangeOhm,
        @JsonProperty("RowIndex") int rowIndex,
        @JsonProperty("CapturedAtUtc") Instant capturedAtUtc,
        @JsonProperty("CapturedAtLocal") LocalDateTime capturedAtLocal
) {
    private static final String NULL_REPRESENTATION = "<null>";
    private static final int MIN_COLUMNS = 6;

    /**
     * Impedance magnitude, sqrt(R² + X²).
     */
    public double impedance() {
        return Math.sqrt(resistanceOhm * resistanceOhm + reactanceOhm * reactanceOhm);
    }

    /**
     * Raw CSV-like representation used when a sample is logged as rejected.
     */
    public String toRawString() {
        return frequencyHz + "," + resistanceOhm + "," + reactanceOhm + "," + voltage + ","
                + temperatureC + "," + rangeOhm + "," + rowIndex;
    }

    /**
     * Null-safe variant of {@link #toRawString()}.
     */
    public static String describe(Sample sample) {
        return sample == null ? NULL_REPRESENTATION : sample.toRawString();
    }

    /**
     * Parse one measurement row. Columns are FrequencyHz, R_ohm, X_ohm, V,
     * T_degC, Range_ohm; extra columns are ignored. Quotes are stripped and
     * comma, semicolon or tab are accepted as separators.
     *
     * @param csvLine  the raw row
     * @param rowIndex position of the row in its file
     * @param clock    source of the capture timestamps
     * @return the parsed sample
     * @throws IllegalArgumentException with the rejection reason if the row is unusable
     */
    public static Sample parseCsv(String csvLine, int rowIndex, Clock clock) {
        if (csvLine == null || csvLine.isBlank()) {
            throw new IllegalArgumentException("Empty line");
        }

        String[] parts = csvLine.replace("\"", "").split("[,;\t]", -1);
        if (parts.length < MIN_COLUMNS) {
            throw new IllegalArgumentException(
                    "Expected at least " + MIN_COLUMNS + " columns, found " + parts.length);
        }

        double frequencyHz;
        double resistance;
        double reactance;
        double voltage;
        double temperature;
        double range;
        try {
            frequencyHz = Double.parseDouble(parts[0].trim());
            resistance = Double.parseDouble(parts[1].trim());
            reactance = Double.parseDouble(parts[2].trim());
            voltage = Double.parseDouble(parts[3].trim());
            temperature = Double.parseDouble(parts[4].trim());
            range = Double.parseDouble(parts[5].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parsing error: " + e.getMessage(), e);
        }

        if (!(frequencyHz > 0)) {
            throw new IllegalArgumentException("FrequencyHz must be positive, got " + frequencyHz);
        }
        if (!Double.isFinite(resistance)) {
            throw new IllegalArgumentException("Invalid R_ohm value: " + resistance);
        }
        if (!Double.isFinite(reactance)) {
            throw new IllegalArgumentException("Invalid X_ohm value: " + reactance);
        }
        if (!Double.isFinite(voltage)) {
            throw new IllegalArgumentException("Invalid V value: " + voltage);
        }

        return new Sample(frequencyHz, resistance, reactance, voltage, temperature, range, rowIndex,
                Instant.now(clock), LocalDateTime.now(clock));
    }
}
