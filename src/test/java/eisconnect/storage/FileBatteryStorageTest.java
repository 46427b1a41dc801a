package eisconnect.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eisconnect.TestFixtures;
import eisconnect.domain.SessionMeta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FileBatteryStorageTest {

    @TempDir
    Path tempDir;

    private Path sessionDir;
    private FileBatteryStorage storage;

    @BeforeEach
    void setUp() {
        sessionDir = tempDir.resolve("B01").resolve("Test_1").resolve("50%");
        storage = new FileBatteryStorage(sessionDir,
                Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should create session files with headers on initialize")
    void testInitialize() throws IOException {
        storage.initializeSession(TestFixtures.meta());

        assertThat(Files.readAllLines(sessionDir.resolve(FileBatteryStorage.SAMPLES_FILE)))
                .containsExactly(FileBatteryStorage.SAMPLES_HEADER);
        assertThat(Files.readAllLines(sessionDir.resolve(FileBatteryStorage.REJECTS_FILE)))
                .containsExactly(FileBatteryStorage.REJECTS_HEADER);
        assertThat(Files.readAllLines(sessionDir.resolve(FileBatteryStorage.EVENTS_FILE)))
                .containsExactly(FileBatteryStorage.EVENTS_HEADER);

        JsonNode manifest = new ObjectMapper().readTree(sessionDir.resolve(FileBatteryStorage.MANIFEST_FILE).toFile());
        assertThat(manifest.get("status").asText()).isEqualTo("IN_PROGRESS");
        assertThat(manifest.get("meta").get("BatteryId").asText()).isEqualTo("B01");
        storage.close();
    }

    @Test
    @DisplayName("Should append samples, rejects and events as they arrive")
    void testWriteRows() throws IOException {
        storage.initializeSession(TestFixtures.meta());

        storage.storeSample(TestFixtures.sample(4));
        storage.storeRejectedSample("Invalid V: NaN", "1,2,3");
        storage.storeAnalyticsEvent("VoltageSpike", "Voltage spike detected: ΔV=0.060V (rising)", 0.06, 0.05);

        List<String> samples = Files.readAllLines(sessionDir.resolve(FileBatteryStorage.SAMPLES_FILE));
        assertThat(samples).hasSize(2);
        assertThat(samples.get(1)).startsWith("4,1000.0,3.0,4.0,3.7,25.0,100.0,5.0,");

        assertThat(Files.readAllLines(sessionDir.resolve(FileBatteryStorage.REJECTS_FILE)))
                .last().isEqualTo("2025-03-01T10:00:00Z,\"Invalid V: NaN\",\"1,2,3\"");
        assertThat(Files.readAllLines(sessionDir.resolve(FileBatteryStorage.EVENTS_FILE)))
                .last().asString().contains(",VoltageSpike,").endsWith(",0.06,0.05");

        assertThat(storage.getSampleCount()).isEqualTo(1);
        assertThat(storage.getRejectCount()).isEqualTo(1);
        assertThat(storage.getEventCount()).isEqualTo(1);
        storage.close();
    }

    @Test
    @DisplayName("Should mark manifest completed with counters on finalize")
    void testFinalize() throws IOException {
        storage.initializeSession(TestFixtures.meta());
        storage.storeSample(TestFixtures.sample(0));
        storage.storeSample(TestFixtures.sample(1));

        storage.finalizeSession();
        storage.close();

        JsonNode manifest = new ObjectMapper().readTree(sessionDir.resolve(FileBatteryStorage.MANIFEST_FILE).toFile());
        assertThat(manifest.get("status").asText()).isEqualTo("COMPLETED");
        assertThat(manifest.get("acceptedSamples").asInt()).isEqualTo(2);
        assertThat(manifest.get("finishedAtUtc").asText()).isEqualTo("2025-03-01T10:00:00Z");
    }

    @Test
    @DisplayName("Should refuse writes before initialize and after close")
    void testLifecycleGuards() throws IOException {
        assertThatThrownBy(() -> storage.storeSample(TestFixtures.sample(0)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not initialized");
        assertThatThrownBy(() -> storage.finalizeSession())
                .isInstanceOf(IOException.class);

        storage.initializeSession(TestFixtures.meta());
        storage.close();
        storage.close();

        assertThatThrownBy(() -> storage.storeRejectedSample("r", "x"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("already closed");
    }

    @Test
    @DisplayName("Should escape quotes in free text")
    void testQuote() {
        assertThat(FileBatteryStorage.quote("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        assertThat(FileBatteryStorage.quote(null)).isEqualTo("\"\"");
    }

    @Test
    @DisplayName("Should lay out session directories by battery, test and SoC")
    void testFactoryLayout() throws IOException {
        FileBatteryStorageFactory factory = new FileBatteryStorageFactory(tempDir);
        SessionMeta meta = TestFixtures.meta("B03", "Test_2", 75);

        try (BatteryStorage opened = factory.open(meta)) {
            assertThat(opened.getSessionDirectory()).isEqualTo(tempDir.resolve("B03").resolve("Test_2").resolve("75%"));
            assertThat(Files.isDirectory(opened.getSessionDirectory())).isTrue();
        }
    }

    @Test
    @DisplayName("Should refuse identifiers that escape the storage root")
    void testFactoryRejectsTraversal() {
        FileBatteryStorageFactory factory = new FileBatteryStorageFactory(tempDir);

        assertThatThrownBy(() -> factory.open(TestFixtures.meta("..", "Test_1", 50)))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> factory.open(TestFixtures.meta("B01", "a/b", 50)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid path segment");
    }
}
