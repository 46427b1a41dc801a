package eisconnect.event;

/**
 * Kinds of analytics events, with the alert-type name they are stored under.
 */
public enum AnomalyType {
    VOLTAGE_SPIKE("VoltageSpike"),
    IMPEDANCE_JUMP("ImpedanceJump"),
    TEMPERATURE_SPIKE("TemperatureSpike"),
    RESISTANCE_OUT_OF_BOUNDS("ResistanceOutOfBounds"),
    RANGE_MISMATCH("RangeMismatch"),
    OUT_OF_BAND("OutOfBandWarning");

    private final String alertType;

    AnomalyType(String alertType) {
        this.alertType = alertType;
    }

    public String alertType() {
        return alertType;
    }
}
