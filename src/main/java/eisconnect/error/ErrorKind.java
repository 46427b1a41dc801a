package eisconnect.error;

/**
 * Category of a failed session operation.
 */
public enum ErrorKind {
    /** Bad input from the caller; safe to retry with corrected input. */
    VALIDATION,
    /** Unexpected internal failure; the sample should be treated as lost. */
    PROCESSING,
    /** The storage collaborator could not be initialized. */
    STORAGE
}
