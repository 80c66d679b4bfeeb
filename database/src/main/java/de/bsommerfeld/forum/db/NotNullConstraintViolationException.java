package de.bsommerfeld.forum.db;

/**
 * Thrown when a write would leave a required column without a value.
 */
public class NotNullConstraintViolationException extends ForumDataException {

    public NotNullConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
