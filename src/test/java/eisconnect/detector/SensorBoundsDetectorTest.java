package eisconnect.detector;

import eisconnect.TestFixtures;
import eisconnect.config.EngineConfig;
import eisconnect.core.SessionRunningState;
import eisconnect.domain.Sample;
import eisconnect.event.SensorOutOfRangeEvent;
import eisconnect.event.SensorParameter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SensorBoundsDetectorTest {

    private final SensorBoundsDetector detector = SensorBoundsDetector.from(EngineConfig.defaults());
    private final SessionRunningState state = new SessionRunningState();
    private final DetectionContext context = new DetectionContext(TestFixtures.meta(), state,
            Instant.parse("2025-03-01T10:00:00Z"));

    @Test
    @DisplayName("Should accept readings inside the bounds")
    void testInsideBounds() {
        assertThat(detector.inspect(TestFixtures.sample(1), context)).isEmpty();
    }

    @Test
    @DisplayName("Should accept readings exactly on the bounds")
    void testOnBounds() {
        Sample sample = TestFixtures.withRange(TestFixtures.sample(1, 1000.0, 0.0, 3.7, 25.0), 0.1);
        assertThat(detector.inspect(sample, context)).isEmpty();
    }

    @Test
    @DisplayName("Should flag resistance below minimum")
    void testResistanceTooLow() {
        List<SensorOutOfRangeEvent> events = detector.inspect(TestFixtures.sample(3, 0.0001, 4.0, 3.7, 25.0), context);

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.parameter()).isEqualTo(SensorParameter.RESISTANCE);
            assertThat(event.actualValue()).isEqualTo(0.0001);
            assertThat(event.threshold()).isEqualTo(0.001);
            assertThat(event.sampleIndex()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("Should flag both parameters independently")
    void testBothOutOfBounds() {
        Sample sample = TestFixtures.withRange(TestFixtures.sample(2, 2000.0, 4.0, 3.7, 25.0), 20000.0);

        assertThat(detector.inspect(sample, context))
                .extracting(SensorOutOfRangeEvent::parameter)
                .containsExactly(SensorParameter.RESISTANCE, SensorParameter.RANGE);
    }

    @Test
    @DisplayName("Should not touch running state")
    void testNoStateChange() {
        detector.inspect(TestFixtures.sample(1, 5000.0, 4.0, 3.7, 25.0), context);

        assertThat(state.lastImpedance()).isEmpty();
        assertThat(state.sampleCount()).isZero();
    }

    @Test
    @DisplayName("Should describe the reject reason with the bounds")
    void testRejectReason() {
        SensorOutOfRangeEvent event = detector.inspect(TestFixtures.sample(1, 5000.0, 4.0, 3.7, 25.0), context).get(0);

        assertThat(SensorBoundsDetector.rejectReason(event))
                .isEqualTo("R_ohm out of bounds: 5000.0 not in [0.001, 1000.0]");
    }

    @Test
    @DisplayName("Should flag non-finite readings as out of bounds")
    void testNonFiniteRange() {
        Sample sample = TestFixtures.withRange(TestFixtures.sample(5), Double.NaN);

        assertThat(detector.inspect(sample, context)).singleElement().satisfies(event -> {
            assertThat(event.parameter()).isEqualTo(SensorParameter.RANGE);
            assertThat(event.actualValue()).isNaN();
            assertThat(event.threshold()).isEqualTo(10000.0);
        });
        assertThat(detector.inspect(TestFixtures.withRange(TestFixtures.sample(5), Double.POSITIVE_INFINITY),
                context)).hasSize(1);
    }
}
