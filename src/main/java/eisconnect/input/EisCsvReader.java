package eisconnect.input;

import eisconnect.domain.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads EIS samples from a CSV measurement file.
 * A header line is skipped; blank and unparseable rows are written to a
 * rejects file ({@code RowIndex,Reason,RawLine}) and skipped. Row indexes
 * start at 1 with the first line after the header.
 */
public class EisCsvReader implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EisCsvReader.class);

    static final String REJECTS_HEADER = "RowIndex,Reason,RawLine";

    private final Path csvFile;
    private final Clock clock;
    private final BufferedReader reader;
    private final BufferedWriter rejectsWriter;

    private String pendingLine;
    private int currentRowIndex;
    private int acceptedCount;
    private int rejectedCount;
    private boolean closed;

    public EisCsvReader(Path csvFile, Path rejectsFile) throws IOException {
        this(csvFile, rejectsFile, Clock.systemUTC());
    }

    public EisCsvReader(Path csvFile, Path rejectsFile, Clock clock) throws IOException {
        if (!Files.isRegularFile(csvFile)) {
            throw new NoSuchFileException(csvFile.toString(), null, "CSV file not found");
        }
        this.csvFile = csvFile;
        this.clock = clock;

        Path parent = rejectsFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8);
        try {
            this.rejectsWriter = Files.newBufferedWriter(rejectsFile, StandardCharsets.UTF_8);
            writeReject(REJECTS_HEADER);
        } catch (IOException e) {
            reader.close();
            throw e;
        }

        String firstLine = reader.readLine();
        if (firstLine != null && isHeaderLine(firstLine)) {
            logger.debug("Skipped header in {}: {}", csvFile.getFileName(), firstLine);
        } else {
            pendingLine = firstLine;
        }
    }

    /**
     * Read the next valid sample, skipping and logging rejected rows.
     *
     * @return the next sample, or empty at end of file
     */
    public Optional<Sample> readNext() throws IOException {
        String line;
        while ((line = nextLine()) != null) {
            currentRowIndex++;

            if (line.isBlank()) {
                reject("Empty line", line);
                continue;
            }
            try {
                Sample sample = Sample.parseCsv(line, currentRowIndex, clock);
                acceptedCount++;
                return Optional.of(sample);
            } catch (IllegalArgumentException e) {
                reject(e.getMessage(), line);
            }
        }
        return Optional.empty();
    }

    public int getAcceptedCount() {
        return acceptedCount;
    }

    public int getRejectedCount() {
        return rejectedCount;
    }

    public Path getCsvFile() {
        return csvFile;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            reader.close();
            rejectsWriter.close();
        } catch (IOException e) {
            logger.warn("Error closing reader for {}: {}", csvFile, e.getMessage());
        }
    }

    static boolean isHeaderLine(String line) {
        if (line == null || line.isBlank()) {
            return false;
        }
        String[] parts = line.split("[,;\t]", -1);
        if (parts.length < 6) {
            return false;
        }
        String firstField = parts[0].trim().toLowerCase(Locale.ROOT);
        if (firstField.contains("freq")) {
            return true;
        }
        try {
            Double.parseDouble(parts[0].trim());
            return false;
        } catch (NumberFormatException e) {
            return true;
        }
    }

    private String nextLine() throws IOException {
        if (pendingLine != null) {
            String line = pendingLine;
            pendingLine = null;
            return line;
        }
        return reader.readLine();
    }

    private void reject(String reason, String line) throws IOException {
        rejectedCount++;
        writeReject(currentRowIndex + "," + reason.replace(',', ';') + "," + quote(line));
    }

    static String quote(String text) {
        return "\"" + text.replace("\"", "\"\"") + "\"";
    }

    private void writeReject(String row) throws IOException {
        rejectsWriter.write(row);
        rejectsWriter.newLine();
        rejectsWriter.flush();
    }
}
