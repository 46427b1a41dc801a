package eisconnect.storage;

import eisconnect.domain.SessionMeta;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Opens {@link FileBatteryStorage} under {@code <root>/<BatteryId>/<TestId>/<SocPercent>%}.
 */
public class FileBatteryStorageFactory implements BatteryStorageFactory {
    private final Path root;
    private final Clock clock;

    public FileBatteryStorageFactory(Path root) {
        this(root, Clock.systemUTC());
    }

    public FileBatteryStorageFactory(Path root, Clock clock) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public BatteryStorage open(SessionMeta meta) throws IOException {
        Path sessionDirectory = sessionDirectory(meta);
        Files.createDirectories(sessionDirectory);
        return new FileBatteryStorage(sessionDirectory, clock);
    }

    public Path getRoot() {
        return root;
    }

    Path sessionDirectory(SessionMeta meta) throws IOException {
        Path directory = root.resolve(safeSegment(meta.batteryId()))
                .resolve(safeSegment(meta.testId()))
                .resolve(meta.socPercent() + "%")
                .normalize();
        if (!directory.startsWith(root.normalize())) {
            throw new IOException("Session directory escapes storage root: " + directory);
        }
        return directory;
    }

    private static String safeSegment(String segment) throws IOException {
        String trimmed = segment.trim();
        if (trimmed.isEmpty() || trimmed.equals(".") || trimmed.equals("..")
                || trimmed.contains("/") || trimmed.contains("\\")) {
            throw new IOException("Invalid path segment: " + segment);
        }
        return trimmed;
    }
}
