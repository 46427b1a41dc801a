package eisconnect.core;

import java.util.OptionalDouble;

/**
 * Mutable per-session statistics. Only touched from inside the engine's
 * critical section; reset at session start and discarded at session end.
 */
public final class SessionRunningState {
    private Double lastVoltage;
    private Double lastImpedance;
    private Double lastTemperature;
    private double runningMeanImpedance;
    private long sampleCount;
    private int acceptedCount;

    public OptionalDouble lastVoltage() {
        return toOptional(lastVoltage);
    }

    public void setLastVoltage(double value) {
        this.lastVoltage = value;
    }

    public OptionalDouble lastImpedance() {
        return toOptional(lastImpedance);
    }

    public void setLastImpedance(double value) {
        this.lastImpedance = value;
    }

    public OptionalDouble lastTemperature() {
        return toOptional(lastTemperature);
    }

    public void setLastTemperature(double value) {
        this.lastTemperature = value;
    }

    /**
     * Mean of all impedances folded in so far; meaningless while {@link #sampleCount()} is 0.
     */
    public double runningMeanImpedance() {
        return runningMeanImpedance;
    }

    public long sampleCount() {
        return sampleCount;
    }

    /**
     * Fold one impedance observation into the running mean.
     *
     * @return the updated mean
     */
    public double foldImpedance(double impedance) {
        runningMeanImpedance = (runningMeanImpedance * sampleCount + impedance) / (sampleCount + 1);
        sampleCount++;
        return runningMeanImpedance;
    }

    public int acceptedCount() {
        return acceptedCount;
    }

    public int incrementAccepted() {
        return ++acceptedCount;
    }

    /**
     * Copy of the current values, for rolling back a sample that failed mid-chain.
     */
    public SessionRunningState snapshot() {
        SessionRunningState copy = new SessionRunningState();
        copy.restore(this);
        return copy;
    }

    public void restore(SessionRunningState snapshot) {
        lastVoltage = snapshot.lastVoltage;
        lastImpedance = snapshot.lastImpedance;
        lastTemperature = snapshot.lastTemperature;
        runningMeanImpedance = snapshot.runningMeanImpedance;
        sampleCount = snapshot.sampleCount;
        acceptedCount = snapshot.acceptedCount;
    }

    public void reset() {
        lastVoltage = null;
        lastImpedance = null;
        lastTemperature = null;
        runningMeanImpedance = 0;
        sampleCount = 0;
        acceptedCount = 0;
    }

    private static OptionalDouble toOptional(Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @Override
    public String toString() {
        return String.format("SessionRunningState{lastV=%s, lastZ=%s, lastT=%s, meanZ=%.6f, n=%d, accepted=%d}",
                lastVoltage, lastImpedance, lastTemperature, runningMeanImpedance, sampleCount, acceptedCount);
    }
}
