package de.bsommerfeld.forum.db;

/**
 * Thrown when the store cannot serve a request: the connection is closed or
 * broken, the schema cannot be applied, or SQLite reports an error that is not
 * a constraint violation.
 */
public class StoreUnavailableException extends ForumDataException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
