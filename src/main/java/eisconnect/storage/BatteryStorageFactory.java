package eisconnect.storage;

import eisconnect.domain.SessionMeta;

import java.io.IOException;

/**
 * Opens a storage collaborator scoped to one session's battery, test and SoC.
 */
@FunctionalInterface
public interface BatteryStorageFactory {
    BatteryStorage open(SessionMeta meta) throws IOException;
}
