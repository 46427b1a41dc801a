package eisconnect.input;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds EIS measurement files below a base directory. Two layouts are recognised:
 * <ul>
 *   <li>Hioki exports named {@code Hk_*_SoC_<n>_*.csv} anywhere below the base path,
 *       attributed to battery {@code B01}, test {@code Test_1};</li>
 *   <li>battery directories named {@code B<dd>} holding a directory whose name contains
 *       {@code EIS}, with {@code Test_*} directories of {@code <n>%.csv} files; the SoC
 *       must be a multiple of 5.</li>
 * </ul>
 */
public final class EisFileDiscovery {
    private static final Logger logger = LoggerFactory.getLogger(EisFileDiscovery.class);

    static final String HIOKI_BATTERY_ID = "B01";
    static final String HIOKI_TEST_ID = "Test_1";

    private static final Pattern HIOKI_FILE = Pattern.compile("Hk_.*_SoC_(\\d+)_");
    private static final Pattern BATTERY_DIR = Pattern.compile("^B\\d{2}$");
    private static final Pattern SOC_IN_NAME = Pattern.compile("(\\d+)%?");

    private EisFileDiscovery() {
    }

    /**
     * @return discovered files sorted by battery, test and SoC; empty if the base path does not exist
     */
    public static List<EisFileInfo> discover(Path basePath) {
        List<EisFileInfo> files = new ArrayList<>();
        if (!Files.isDirectory(basePath)) {
            logger.warn("Base path does not exist: {}", basePath);
            return files;
        }

        try {
            for (Path csv : list(basePath, Integer.MAX_VALUE, EisFileDiscovery::isHiokiFile)) {
                Integer soc = hiokiSoc(csv);
                if (soc != null) {
                    files.add(new EisFileInfo(HIOKI_BATTERY_ID, HIOKI_TEST_ID, soc, csv));
                }
            }

            for (Path batteryDir : list(basePath, Integer.MAX_VALUE, EisFileDiscovery::isBatteryDir)) {
                String batteryId = batteryDir.getFileName().toString();
                for (Path eisDir : list(batteryDir, Integer.MAX_VALUE, EisFileDiscovery::isEisDir)) {
                    for (Path testDir : list(eisDir, 1, EisFileDiscovery::isTestDir)) {
                        String testId = testDir.getFileName().toString();
                        for (Path csv : list(testDir, 1, EisFileDiscovery::isCsvFile)) {
                            Integer soc = layoutSoc(csv);
                            if (soc != null) {
                                files.add(new EisFileInfo(batteryId, testId, soc, csv));
                            }
                        }
                    }
                }
            }
        } catch (IOException e) {
            logger.error("Error discovering EIS files below {}", basePath, e);
        }

        files.sort(Comparator.comparing(EisFileInfo::batteryId)
                .thenComparing(EisFileInfo::testId)
                .thenComparingInt(EisFileInfo::socPercent));
        logger.info("Discovered {} EIS file(s) below {}", files.size(), basePath);
        return files;
    }

    /**
     * Number of data rows in a file, not counting a leading header line.
     *
     * @throws IOException if the file cannot be read
     */
    public static int countRows(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String first = reader.readLine();
            if (first == null) {
                return 0;
            }
            int count = isHeaderLine(first) ? 0 : 1;
            while (reader.readLine() != null) {
                count++;
            }
            return count;
        }
    }

    static Integer hiokiSoc(Path file) {
        Matcher matcher = HIOKI_FILE.matcher(baseName(file));
        if (matcher.find()) {
            int soc = parseSoc(matcher.group(1));
            if (soc >= 5 && soc <= 100) {
                return soc;
            }
        }
        return null;
    }

    static Integer layoutSoc(Path file) {
        Matcher matcher = SOC_IN_NAME.matcher(baseName(file));
        if (matcher.find()) {
            int soc = parseSoc(matcher.group(1));
            if (soc >= 5 && soc <= 100 && soc % 5 == 0) {
                return soc;
            }
        }
        return null;
    }

    private static boolean isHeaderLine(String line) {
        if (line.isBlank()) {
            return false;
        }
        String firstField = line.split(",", -1)[0].trim().toLowerCase(Locale.ROOT);
        return firstField.contains("freq");
    }

    private static int parseSoc(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static boolean isHiokiFile(Path path) {
        String name = path.getFileName().toString();
        return Files.isRegularFile(path) && name.startsWith("Hk_") && name.endsWith(".csv");
    }

    private static boolean isBatteryDir(Path path) {
        return Files.isDirectory(path) && BATTERY_DIR.matcher(path.getFileName().toString()).matches();
    }

    private static boolean isEisDir(Path path) {
        return Files.isDirectory(path) && path.getFileName().toString().contains("EIS");
    }

    private static boolean isTestDir(Path path) {
        return Files.isDirectory(path) && path.getFileName().toString().startsWith("Test_");
    }

    private static boolean isCsvFile(Path path) {
        return Files.isRegularFile(path) && path.getFileName().toString().endsWith(".csv");
    }

    private static List<Path> list(Path root, int depth, Predicate<Path> filter)
            throws IOException {
        try (Stream<Path> stream = Files.walk(root, depth)) {
            return stream.filter(path -> !path.equals(root))
                    .filter(filter)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
