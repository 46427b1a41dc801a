package eisconnect.event;

/**
 * Sample fields checked against the service-wide sensor bounds.
 */
public enum SensorParameter {
    RESISTANCE("R_ohm", AnomalyType.RESISTANCE_OUT_OF_BOUNDS),
    RANGE("Range_ohm", AnomalyType.RANGE_MISMATCH);

    private final String fieldName;
    private final AnomalyType anomalyType;

    SensorParameter(String fieldName, AnomalyType anomalyType) {
        this.fieldName = fieldName;
        this.anomalyType = anomalyType;
    }

    public String fieldName() {
        return fieldName;
    }

    public AnomalyType anomalyType() {
        return anomalyType;
    }
}
