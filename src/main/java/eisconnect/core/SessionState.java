package eisconnect.core;

/**
 * Lifecycle state of the engine's single session slot.
 */
public enum SessionState {
    /** No session open; samples are refused. */
    IDLE,
    /** A session is open and accepting samples. */
    ACTIVE
}
