package de.bsommerfeld.forum.db;

/**
 * Thrown when a write references a parent row (user, post or tag) that does
 * not exist.
 */
public class ForeignKeyViolationException extends ForumDataException {

    public ForeignKeyViolationException(String message) {
        super(message);
    }

    public ForeignKeyViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
