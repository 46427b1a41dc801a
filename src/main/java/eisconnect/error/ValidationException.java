package eisconnect.error;

/**
 * The caller supplied something the engine cannot accept: no active session,
 * malformed session metadata or a malformed sample.
 */
public class ValidationException extends SessionException {
    private final String field;
    private final String value;

    public ValidationException(String message, String field, String value) {
        super(message);
        this.field = field;
        this.value = value;
    }

    /**
     * Name of the offending field.
     */
    public String getField() {
        return field;
    }

    /**
     * String form of the offending value.
     */
    public String getValue() {
        return value;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
