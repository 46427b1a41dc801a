package eisconnect.error;

/**
 * An unexpected failure while handling an otherwise valid request,
 * typically a storage I/O error.
 */
public class ProcessingException extends SessionException {
    private final String details;

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
        this.details = describe(cause);
    }

    /**
     * Diagnostic detail: the cause chain as {@code Type: message} entries.
     */
    public String getDetails() {
        return details;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROCESSING;
    }

    static String describe(Throwable cause) {
        StringBuilder sb = new StringBuilder();
        Throwable current = cause;
        while (current != null) {
            if (sb.length() > 0) {
                sb.append(" <- ");
            }
            sb.append(current.getClass().getName()).append(": ").append(current.getMessage());
            current = current.getCause() == current ? null : current.getCause();
        }
        return sb.toString();
    }
}
