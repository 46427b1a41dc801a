package eisconnect.domain;

import eisconnect.TestFixtures;
import eisconnect.event.Direction;
import eisconnect.event.OutOfBandDeviationEvent;
import eisconnect.event.SensorOutOfRangeEvent;
import eisconnect.event.SensorParameter;
import eisconnect.event.SessionKey;
import eisconnect.event.TemperatureSpikeEvent;
import eisconnect.event.VoltageSpikeEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class DomainObjectsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final SessionKey KEY = new SessionKey("B01", "Test_1", 50);

    @Test
    @DisplayName("Should compute impedance magnitude from R and X")
    void testImpedance() {
        Sample sample = TestFixtures.sample(1);
        assertThat(sample.impedance()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should describe null sample with placeholder")
    void testDescribeNull() {
        assertThat(Sample.describe(null)).isEqualTo("<null>");
        assertThat(Sample.describe(TestFixtures.sample(7))).isEqualTo("1000.0,3.0,4.0,3.7,25.0,100.0,7");
    }

    @Test
    @DisplayName("Should parse CSV row with quotes and extra columns")
    void testParseCsv() {
        Sample sample = Sample.parseCsv("\"1000\",0.05,-0.02,3.71,24.5,3,extra", 4, CLOCK);

        assertThat(sample.frequencyHz()).isEqualTo(1000.0);
        assertThat(sample.resistanceOhm()).isEqualTo(0.05);
        assertThat(sample.reactanceOhm()).isEqualTo(-0.02);
        assertThat(sample.voltage()).isEqualTo(3.71);
        assertThat(sample.temperatureC()).isEqualTo(24.5);
        assertThat(sample.rangeOhm()).isEqualTo(3.0);
        assertThat(sample.rowIndex()).isEqualTo(4);
        assertThat(sample.capturedAtUtc()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Should accept semicolon separated rows")
    void testParseCsvSemicolon() {
        Sample sample = Sample.parseCsv("10;1;2;3.7;25;100", 1, CLOCK);
        assertThat(sample.reactanceOhm()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should reject unusable CSV rows with a reason")
    void testParseCsvRejects() {
        assertThatThrownBy(() -> Sample.parseCsv("  ", 1, CLOCK))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Empty line");
        assertThatThrownBy(() -> Sample.parseCsv("1,2,3", 1, CLOCK))
                .hasMessage("Expected at least 6 columns, found 3");
        assertThatThrownBy(() -> Sample.parseCsv("1,abc,3,4,5,6", 1, CLOCK))
                .hasMessageStartingWith("Parsing error:");
        assertThatThrownBy(() -> Sample.parseCsv("0,1,3,4,5,6", 1, CLOCK))
                .hasMessage("FrequencyHz must be positive, got 0.0");
        assertThatThrownBy(() -> Sample.parseCsv("10,NaN,3,4,5,6", 1, CLOCK))
                .hasMessage("Invalid R_ohm value: NaN");
    }

    @Test
    @DisplayName("Should label session metadata")
    void testSessionMetaLabel() {
        assertThat(TestFixtures.meta().label()).isEqualTo("B01/Test_1/50%");
        assertThat(SessionKey.of(TestFixtures.meta()).toString()).isEqualTo("Battery: B01 | Test: Test_1 | SoC: 50%");
    }

    @Test
    @DisplayName("Should build acknowledgements with status")
    void testAck() {
        assertThat(Ack.inProgress("Sample accepted"))
                .isEqualTo(new Ack(true, "Sample accepted", SessionStatus.IN_PROGRESS));
        assertThat(Ack.completed("Session completed").status()).isEqualTo(SessionStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should format voltage spike with absolute value")
    void testVoltageSpikeEvent() {
        VoltageSpikeEvent event = new VoltageSpikeEvent(KEY, -0.06, 3.76, 3.70, Direction.FALLING, 0.05, 2,
                CLOCK.instant());

        assertThat(event.message()).isEqualTo("Voltage spike detected: ΔV=-0.060V (falling)");
        assertThat(event.value()).isCloseTo(0.06, within(1e-12));
        assertThat(event.type().alertType()).isEqualTo("VoltageSpike");
    }

    @Test
    @DisplayName("Should format temperature spike with frequency and SoC")
    void testTemperatureSpikeEvent() {
        TemperatureSpikeEvent event = new TemperatureSpikeEvent(KEY, 3.5, 20.0, 23.5, Direction.RISING, 1000.0,
                2.0, 2, CLOCK.instant());

        assertThat(event.message())
                .isEqualTo("Temperature spike detected: ΔT=3.500°C (rising) at F=1000.000Hz, SoC=50%");
        assertThat(event.type().alertType()).isEqualTo("TemperatureSpike");
    }

    @Test
    @DisplayName("Should report the crossed bound as sensor event threshold")
    void testSensorOutOfRangeThreshold() {
        SensorOutOfRangeEvent low = new SensorOutOfRangeEvent(KEY, SensorParameter.RESISTANCE, 0.0001, 0.001,
                1000.0, 3, CLOCK.instant());
        SensorOutOfRangeEvent high = new SensorOutOfRangeEvent(KEY, SensorParameter.RANGE, 20000.0, 0.1,
                10000.0, 3, CLOCK.instant());

        assertThat(low.threshold()).isEqualTo(0.001);
        assertThat(high.threshold()).isEqualTo(10000.0);
        assertThat(high.type().alertType()).isEqualTo("RangeMismatch");
        assertThat(low.type().alertType()).isEqualTo("ResistanceOutOfBounds");
        assertThat(high.message())
                .isEqualTo("Sensor validation failed: Range_ohm=20000.000 not in range [0.100, 10000.000] for sample #3");
    }

    @Test
    @DisplayName("Should describe out-of-band direction in message")
    void testOutOfBandMessage() {
        OutOfBandDeviationEvent above = new OutOfBandDeviationEvent(KEY, 5.6, 5.5, 5.0, 10.0, Direction.RISING,
                1000.0, 4, CLOCK.instant());
        OutOfBandDeviationEvent below = new OutOfBandDeviationEvent(KEY, 4.0, 4.5, 5.0, 10.0, Direction.FALLING,
                1000.0, 4, CLOCK.instant());

        assertThat(above.message()).isEqualTo("Impedance out of band: 5.600 above expected range (Mean: 5.000)");
        assertThat(below.message()).isEqualTo("Impedance out of band: 4.000 below expected range (Mean: 5.000)");
        assertThat(above.type().alertType()).isEqualTo("OutOfBandWarning");
        assertThat(above.threshold()).isEqualTo(5.5);
    }

    @Test
    @DisplayName("Should derive direction from delta sign")
    void testDirection() {
        assertThat(Direction.of(0.1)).isEqualTo(Direction.RISING);
        assertThat(Direction.of(-0.1)).isEqualTo(Direction.FALLING);
        assertThat(Direction.RISING.label()).isEqualTo("rising");
    }
}
