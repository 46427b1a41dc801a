package eisconnect.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Service-wide configuration, loaded once at startup and handed to the engine.
 * Per-session thresholds travel with {@link eisconnect.domain.SessionMeta} instead.
 *
 * @param temperatureThreshold absolute ΔT in °C above which a temperature spike is raised
 * @param resistanceMin        lowest plausible R_ohm reading
 * @param resistanceMax        highest plausible R_ohm reading
 * @param rangeMin             lowest plausible Range_ohm reading
 * @param rangeMax             highest plausible Range_ohm reading
 * @param storagePath          root directory for file-backed session storage
 * @param host                 Socket.IO bind address
 * @param port                 Socket.IO port
 */
public record EngineConfig(
        double temperatureThreshold,
        double resistanceMin,
        double resistanceMax,
        double rangeMin,
        double rangeMax,
        String storagePath,
        String host,
        int port
) {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String RESOURCE_NAME = "eisconnect.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "eisconnect.";

    static final String KEY_T_THRESHOLD = "T_threshold";
    static final String KEY_R_MIN = "R_min";
    static final String KEY_R_MAX = "R_max";
    static final String KEY_RANGE_MIN = "Range_min";
    static final String KEY_RANGE_MAX = "Range_max";
    static final String KEY_STORAGE_PATH = "storagePath";
    static final String KEY_HOST = "server.host";
    static final String KEY_PORT = "server.port";

    public EngineConfig {
        if (!(temperatureThreshold > 0)) {
            throw new IllegalArgumentException("T_threshold must be positive: " + temperatureThreshold);
        }
        if (!(resistanceMin <= resistanceMax)) {
            throw new IllegalArgumentException(
                    "R_min must not exceed R_max: [" + resistanceMin + ", " + resistanceMax + "]");
        }
        if (!(rangeMin <= rangeMax)) {
            throw new IllegalArgumentException(
                    "Range_min must not exceed Range_max: [" + rangeMin + ", " + rangeMax + "]");
        }
        if (storagePath == null || storagePath.isBlank()) {
            throw new IllegalArgumentException("storagePath is required");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("server.port out of range: " + port);
        }
    }

    /**
     * Built-in defaults.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(2.0, 0.001, 1000.0, 0.1, 10000.0, "BatteryStorage", "0.0.0.0", 3000);
    }

    /**
     * Load from the classpath resource, then apply {@code eisconnect.*} system property overrides.
     */
    public static EngineConfig load() {
        Properties properties = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.info("No {} on classpath, using defaults", RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE_NAME, e);
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                properties.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()), System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    /**
     * Build a configuration from properties; missing keys fall back to {@link #defaults()}.
     */
    public static EngineConfig fromProperties(Properties properties) {
        EngineConfig defaults = defaults();
        return new EngineConfig(
                readDouble(properties, KEY_T_THRESHOLD, defaults.temperatureThreshold()),
                readDouble(properties, KEY_R_MIN, defaults.resistanceMin()),
                readDouble(properties, KEY_R_MAX, defaults.resistanceMax()),
                readDouble(properties, KEY_RANGE_MIN, defaults.rangeMin()),
                readDouble(properties, KEY_RANGE_MAX, defaults.rangeMax()),
                properties.getProperty(KEY_STORAGE_PATH, defaults.storagePath()).trim(),
                properties.getProperty(KEY_HOST, defaults.host()).trim(),
                readInt(properties, KEY_PORT, defaults.port()));
    }

    public EngineConfig withPort(int newPort) {
        return new EngineConfig(temperatureThreshold, resistanceMin, resistanceMax, rangeMin, rangeMax,
                storagePath, host, newPort);
    }

    public EngineConfig withStoragePath(String newStoragePath) {
        return new EngineConfig(temperatureThreshold, resistanceMin, resistanceMax, rangeMin, rangeMax,
                newStoragePath, host, port);
    }

    private static double readDouble(Properties properties, String key, double fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            // Double.parseDouble is locale independent
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + raw, e);
        }
    }

    private static int readInt(Properties properties, String key, int fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }
}
