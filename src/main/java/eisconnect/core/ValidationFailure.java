package eisconnect.core;

import eisconnect.error.ValidationException;

/**
 * First check a sample failed in the validation pipeline.
 */
public record ValidationFailure(String field, String value, String message) {

    public ValidationException toException() {
        return new ValidationException(message, field, value);
    }
}
