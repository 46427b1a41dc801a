package eisconnect.error;

/**
 * The storage collaborator for a new session could not be opened or initialized.
 */
public class StorageException extends SessionException {
    private final String details;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.details = ProcessingException.describe(cause);
    }

    public String getDetails() {
        return details;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STORAGE;
    }
}
