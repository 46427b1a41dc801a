package eisconnect.domain;

/**
 * Successful reply to a session operation.
 */
public record Ack(
        boolean success,
        String message,
        SessionStatus status
) {
    public static Ack inProgress(String message) {
        return new Ack(true, message, SessionStatus.IN_PROGRESS);
    }

    public static Ack completed(String message) {
        return new Ack(true, message, SessionStatus.COMPLETED);
    }
}
