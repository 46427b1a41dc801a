package eisconnect.input;

import java.nio.file.Path;

/**
 * A measurement file found on disk, with the session identity derived from its location.
 */
public record EisFileInfo(
        String batteryId,
        String testId,
        int socPercent,
        Path filePath
) {
    public String fileName() {
        return filePath.getFileName().toString();
    }
}
