package eisconnect.event;

/**
 * Sign of a change between two consecutive readings.
 */
public enum Direction {
    RISING("rising"),
    FALLING("falling");

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * RISING for a positive delta, FALLING otherwise.
     */
    public static Direction of(double delta) {
        return delta > 0 ? RISING : FALLING;
    }
}
