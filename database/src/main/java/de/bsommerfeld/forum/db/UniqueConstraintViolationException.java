package de.bsommerfeld.forum.db;

/**
 * Thrown when a write would duplicate a unique column, e.g. a second user with
 * an already registered email.
 */
public class UniqueConstraintViolationException extends ForumDataException {

    public UniqueConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
