package de.bsommerfeld.forum.db;

/**
 * Base type of every failure raised by {@link ForumDatabase}. Callers that do
 * not care about the specific cause can catch this one type.
 */
public class ForumDataException extends RuntimeException {

    public ForumDataException(String message) {
        super(message);
    }

    public ForumDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
