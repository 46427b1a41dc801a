package eisconnect.error;

/**
 * Base class for failures reported by the session engine.
 */
public abstract class SessionException extends RuntimeException {

    protected SessionException(String message) {
        super(message);
    }

    protected SessionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
