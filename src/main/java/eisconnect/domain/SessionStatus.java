package eisconnect.domain;

/**
 * Status reported back to the caller in an {@link Ack}.
 */
public enum SessionStatus {
    IN_PROGRESS,
    COMPLETED
}
