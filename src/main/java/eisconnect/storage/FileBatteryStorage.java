package eisconnect.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import eisconnect.domain.Sample;
import eisconnect.domain.SessionMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * File-backed storage for one session directory:
 * <ul>
 *   <li>{@code session.json} - metadata and final counters</li>
 *   <li>{@code session.csv} - accepted samples</li>
 *   <li>{@code rejects.csv} - rejected samples with reason</li>
 *   <li>{@code analytics_events.csv} - anomaly events</li>
 * </ul>
 * Every row is flushed as it is written so a crash loses at most the current line.
 */
public class FileBatteryStorage implements BatteryStorage {
    private static final Logger logger = LoggerFactory.getLogger(FileBatteryStorage.class);

    static final String MANIFEST_FILE = "session.json";
    static final String SAMPLES_FILE = "session.csv";
    static final String REJECTS_FILE = "rejects.csv";
    static final String EVENTS_FILE = "analytics_events.csv";

    static final String SAMPLES_HEADER =
            "RowIndex,FrequencyHz,R_ohm,X_ohm,V,T_degC,Range_ohm,Impedance_ohm,TimestampUtc";
    static final String REJECTS_HEADER = "TimestampUtc,Reason,RawData";
    static final String EVENTS_HEADER = "TimestampUtc,AlertType,Message,Value,Threshold";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path sessionDirectory;
    private final Clock clock;

    private SessionMeta meta;
    private Instant startedAt;
    private BufferedWriter samplesWriter;
    private BufferedWriter rejectsWriter;
    private BufferedWriter eventsWriter;
    private int sampleCount;
    private int rejectCount;
    private int eventCount;
    private boolean closed;

    public FileBatteryStorage(Path sessionDirectory) {
        this(sessionDirectory, Clock.systemUTC());
    }

    public FileBatteryStorage(Path sessionDirectory, Clock clock) {
        this.sessionDirectory = sessionDirectory;
        this.clock = clock;
    }

    @Override
    public void initializeSession(SessionMeta meta) throws IOException {
        ensureOpen();
        this.meta = meta;
        this.startedAt = Instant.now(clock);

        Files.createDirectories(sessionDirectory);
        samplesWriter = openCsv(SAMPLES_FILE, SAMPLES_HEADER);
        rejectsWriter = openCsv(REJECTS_FILE, REJECTS_HEADER);
        eventsWriter = openCsv(EVENTS_FILE, EVENTS_HEADER);
        writeManifest(null, "IN_PROGRESS");

        logger.debug("Initialized session storage in {}", sessionDirectory);
    }

    @Override
    public void storeSample(Sample sample) throws IOException {
        BufferedWriter writer = requireWriter(samplesWriter);
        writeLine(writer, sample.rowIndex() + ","
                + sample.frequencyHz() + ","
                + sample.resistanceOhm() + ","
                + sample.reactanceOhm() + ","
                + sample.voltage() + ","
                + sample.temperatureC() + ","
                + sample.rangeOhm() + ","
                + sample.impedance() + ","
                + sample.capturedAtUtc());
        sampleCount++;
    }

    @Override
    public void storeRejectedSample(String reason, String rawData) throws IOException {
        BufferedWriter writer = requireWriter(rejectsWriter);
        writeLine(writer, Instant.now(clock) + "," + quote(reason) + "," + quote(rawData));
        rejectCount++;
    }

    @Override
    public void storeAnalyticsEvent(String alertType, String message, double value, double threshold)
            throws IOException {
        BufferedWriter writer = requireWriter(eventsWriter);
        writeLine(writer, Instant.now(clock) + "," + alertType + "," + quote(message) + ","
                + value + "," + threshold);
        eventCount++;
    }

    @Override
    public void finalizeSession() throws IOException {
        ensureOpen();
        if (meta == null) {
            throw new IOException("Session was never initialized");
        }
        samplesWriter.flush();
        rejectsWriter.flush();
        eventsWriter.flush();
        writeManifest(Instant.now(clock), "COMPLETED");
        logger.debug("Finalized session storage in {}: {} samples, {} rejects, {} events",
                sessionDirectory, sampleCount, rejectCount, eventCount);
    }

    @Override
    public Path getSessionDirectory() {
        return sessionDirectory;
    }

    @Override
    public int getSampleCount() {
        return sampleCount;
    }

    int getRejectCount() {
        return rejectCount;
    }

    int getEventCount() {
        return eventCount;
    }

    /**
     * Close all writers. Idempotent; any failure is rethrown after every writer has been attempted.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        List<IOException> failures = new ArrayList<>();
        for (BufferedWriter writer : new BufferedWriter[]{samplesWriter, rejectsWriter, eventsWriter}) {
            if (writer == null) {
                continue;
            }
            try {
                writer.close();
            } catch (IOException e) {
                failures.add(e);
            }
        }
        samplesWriter = null;
        rejectsWriter = null;
        eventsWriter = null;

        if (!failures.isEmpty()) {
            IOException first = failures.get(0);
            failures.stream().skip(1).forEach(first::addSuppressed);
            throw first;
        }
    }

    private BufferedWriter openCsv(String fileName, String header) throws IOException {
        BufferedWriter writer = Files.newBufferedWriter(sessionDirectory.resolve(fileName), StandardCharsets.UTF_8);
        writeLine(writer, header);
        return writer;
    }

    private void writeManifest(Instant finishedAt, String status) throws IOException {
        SessionManifest manifest = new SessionManifest(meta, startedAt, finishedAt, status,
                sampleCount, rejectCount, eventCount);
        MAPPER.writeValue(sessionDirectory.resolve(MANIFEST_FILE).toFile(), manifest);
    }

    private BufferedWriter requireWriter(BufferedWriter writer) throws IOException {
        ensureOpen();
        if (writer == null) {
            throw new IOException("Session storage not initialized: " + sessionDirectory);
        }
        return writer;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Session storage already closed: " + sessionDirectory);
        }
    }

    private static void writeLine(BufferedWriter writer, String line) throws IOException {
        writer.write(line);
        writer.newLine();
        writer.flush();
    }

    static String quote(String text) {
        if (text == null) {
            return "\"\"";
        }
        return "\"" + text.replace("\"", "\"\"") + "\"";
    }

    /**
     * Content of {@code session.json}.
     */
    record SessionManifest(
            @JsonProperty("meta") SessionMeta meta,
            @JsonProperty("startedAtUtc") Instant startedAtUtc,
            @JsonProperty("finishedAtUtc") Instant finishedAtUtc,
            @JsonProperty("status") String status,
            @JsonProperty("acceptedSamples") int acceptedSamples,
            @JsonProperty("rejectedSamples") int rejectedSamples,
            @JsonProperty("analyticsEvents") int analyticsEvents
    ) {}
}
