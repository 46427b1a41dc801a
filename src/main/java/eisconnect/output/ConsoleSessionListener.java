package eisconnect.output;

import eisconnect.domain.Sample;
import eisconnect.domain.SessionMeta;
import eisconnect.event.AnomalyEvent;
import eisconnect.event.ImpedanceJumpEvent;
import eisconnect.event.OutOfBandDeviationEvent;
import eisconnect.event.SensorOutOfRangeEvent;
import eisconnect.event.TemperatureSpikeEvent;
import eisconnect.event.VoltageSpikeEvent;

import java.io.PrintStream;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Console presentation of session progress and anomalies.
 * Compact mode prints a progress dot per sample; verbose mode prints a line per sample.
 */
public class ConsoleSessionListener implements SessionListener {

    static final int PROGRESS_INTERVAL = 50;
    static final int DETAILED_SAMPLES = 3;

    private final boolean verbose;
    private final boolean colorized;
    private final PrintStream out;
    private final Clock clock;
    private final DateTimeFormatter timeFormatter;

    // ANSI color codes
    private static final class Colors {
        static final String RESET = "\u001B[0m";
        static final String BRIGHT = "\u001B[1m";
        static final String DIM = "\u001B[2m";
        static final String RED = "\u001B[31m";
        static final String GREEN = "\u001B[32m";
        static final String YELLOW = "\u001B[33m";
        static final String MAGENTA = "\u001B[35m";
        static final String CYAN = "\u001B[36m";
    }

    /**
     * Create a console listener with specified options.
     *
     * @param verbose   if true, print every sample; if false, print progress dots
     * @param colorized if true, use ANSI colors in output
     */
    public ConsoleSessionListener(boolean verbose, boolean colorized) {
        this(verbose, colorized, System.out, Clock.systemDefaultZone());
    }

    /**
     * Create a console listener with default options (compact, colorized).
     */
    public ConsoleSessionListener() {
        this(false, true);
    }

    ConsoleSessionListener(boolean verbose, boolean colorized, PrintStream out, Clock clock) {
        this.verbose = verbose;
        this.colorized = colorized;
        this.out = out;
        this.clock = clock;
        this.timeFormatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
                .withZone(ZoneId.systemDefault());
    }

    @Override
    public void onSessionStarted(SessionMeta meta, String message) {
        printBanner(color(Colors.GREEN), "SESSION STARTED");
        out.println(batteryLine(meta));
        out.println(message);
        out.println(color(Colors.DIM) + "Time: " + now() + color(Colors.RESET));
        out.println();
    }

    @Override
    public void onSampleAccepted(SessionMeta meta, Sample sample, double impedance, int acceptedCount) {
        if (verbose || acceptedCount <= DETAILED_SAMPLES) {
            out.println(String.format(Locale.ROOT, "Sample #%d: V=%.3fV | Z=%.3fΩ | F=%.3fHz | T=%.1f°C",
                    acceptedCount, sample.voltage(), impedance, sample.frequencyHz(), sample.temperatureC()));
        } else if (acceptedCount % PROGRESS_INTERVAL == 0) {
            out.println();
            out.println(color(Colors.DIM) + "Processed " + acceptedCount + " samples..." + color(Colors.RESET));
        } else {
            out.print(".");
        }
        checkError();
    }

    @Override
    public void onAnomaly(AnomalyEvent event) {
        if (event instanceof VoltageSpikeEvent e) {
            printBanner(color(Colors.YELLOW), "VOLTAGE SPIKE DETECTED");
            out.println(String.format(Locale.ROOT, "ΔV = %+.3fV (%s)", e.delta(), e.direction().label()));
            out.println(String.format(Locale.ROOT, "Previous: %.3fV → Current: %.3fV",
                    e.previousVoltage(), e.currentVoltage()));
            out.println(String.format(Locale.ROOT, "Threshold: %.3fV", e.threshold()));
        } else if (event instanceof ImpedanceJumpEvent e) {
            printBanner(color(Colors.YELLOW), "IMPEDANCE JUMP DETECTED");
            out.println(String.format(Locale.ROOT, "ΔZ = %+.3fΩ (%s)", e.delta(), e.direction().label()));
            out.println(String.format(Locale.ROOT, "Previous: %.3fΩ → Current: %.3fΩ",
                    e.previousImpedance(), e.currentImpedance()));
            out.println(String.format(Locale.ROOT, "Threshold: %.3fΩ", e.threshold()));
        } else if (event instanceof TemperatureSpikeEvent e) {
            printBanner(color(Colors.RED), "TEMPERATURE SPIKE DETECTED - POTENTIAL OVERHEATING");
            out.println(String.format(Locale.ROOT, "ΔT = %+.3f°C (%s)", e.delta(), e.direction().label()));
            out.println(String.format(Locale.ROOT, "Previous: %.1f°C → Current: %.1f°C",
                    e.previousTemperature(), e.currentTemperature()));
            out.println(String.format(Locale.ROOT, "Frequency: %.3fHz | Threshold: %.1f°C",
                    e.frequencyHz(), e.threshold()));
        } else if (event instanceof SensorOutOfRangeEvent e) {
            printBanner(color(Colors.RED), "SENSOR VALIDATION ERROR - SENSOR MALFUNCTION");
            out.println(String.format(Locale.ROOT, "Parameter: %s = %.3f",
                    e.parameter().fieldName(), e.actualValue()));
            out.println(String.format(Locale.ROOT, "Valid Range: [%.3f, %.3f]", e.minValue(), e.maxValue()));
            out.println("Sample Index: #" + e.sampleIndex());
        } else if (event instanceof OutOfBandDeviationEvent e) {
            printBanner(color(Colors.MAGENTA), "OUT OF BAND WARNING");
            out.println(String.format(Locale.ROOT, "Parameter: Impedance = %.3f", e.impedance()));
            out.println(String.format(Locale.ROOT, "Running Mean: %.3f", e.runningMean()));
            out.println(String.format(Locale.ROOT, "Expected Range Bound: %.3f (±%.1f%%)",
                    e.bound(), e.deviationPercent()));
        }
        out.println(event.session() + " | Time: " + now());
        out.println();
        checkError();
    }

    @Override
    public void onSessionCompleted(SessionMeta meta, int acceptedCount) {
        out.println();
        printBanner(color(Colors.GREEN), "SESSION COMPLETED");
        out.println(batteryLine(meta));
        out.println(acceptedCount + " samples processed successfully");
        out.println(color(Colors.DIM) + "Time: " + now() + color(Colors.RESET));
        out.println();
        checkError();
    }

    private void printBanner(String colorCode, String title) {
        String cyan = color(Colors.CYAN);
        String reset = color(Colors.RESET);
        out.println();
        out.println(cyan + "━".repeat(60) + reset);
        out.println(color(Colors.BRIGHT) + colorCode + title + reset);
        out.println(cyan + "━".repeat(60) + reset);
    }

    private String batteryLine(SessionMeta meta) {
        return "Battery: " + meta.batteryId() + " | Test: " + meta.testId() + " | SoC: " + meta.socPercent() + "%";
    }

    private String now() {
        return timeFormatter.format(clock.instant());
    }

    // PrintStream swallows IOExceptions and reports them through checkError()
    private void checkError() {
        if (out.checkError()) {
            System.err.println("Console output error: write failure");
        }
    }

    /**
     * Apply color if colorization is enabled.
     */
    private String color(String colorCode) {
        return colorized ? colorCode : "";
    }
}
