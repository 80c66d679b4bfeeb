package de.bsommerfeld.forum.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Maps {@link SQLException}s onto the {@link ForumDataException} taxonomy.
 *
 * <p>
 * The extended SQLite result code is checked first. The message is the
 * fallback because drivers without extended codes only report the plain
 * {@code SQLITE_CONSTRAINT} code with a descriptive text.
 */
final class SqlErrors {

    private static final Logger LOG = LoggerFactory.getLogger(SqlErrors.class);

    private SqlErrors() {
    }

    /**
     * @param action short description of what was attempted, used as the
     *               message prefix
     */
    static ForumDataException translate(String action, SQLException e) {
        String message = action + " failed: " + e.getMessage();
        if (isForeignKeyViolation(e)) {
            LOG.debug("{} rejected by foreign key constraint", action);
            return new ForeignKeyViolationException(message, e);
        }
        if (isUniqueViolation(e)) {
            LOG.debug("{} rejected by unique constraint", action);
            return new UniqueConstraintViolationException(message, e);
        }
        if (isNotNullViolation(e)) {
            LOG.debug("{} rejected by not-null constraint", action);
            return new NotNullConstraintViolationException(message, e);
        }
        LOG.error("{} failed", action, e);
        return new StoreUnavailableException(message, e);
    }

    static boolean isForeignKeyViolation(SQLException e) {
        return resultCode(e) == SQLiteErrorCode.SQLITE_CONSTRAINT_FOREIGNKEY
                || messageContains(e, "foreign key constraint failed");
    }

    static boolean isUniqueViolation(SQLException e) {
        SQLiteErrorCode code = resultCode(e);
        return code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY
                || messageContains(e, "unique constraint failed");
    }

    static boolean isNotNullViolation(SQLException e) {
        return resultCode(e) == SQLiteErrorCode.SQLITE_CONSTRAINT_NOTNULL
                || messageContains(e, "not null constraint failed");
    }

    private static SQLiteErrorCode resultCode(SQLException e) {
        if (e instanceof SQLiteException) {
            return ((SQLiteException) e).getResultCode();
        }
        return null;
    }

    private static boolean messageContains(SQLException e, String fragment) {
        return e.getMessage() != null && e.getMessage().toLowerCase(Locale.ROOT).contains(fragment);
    }
}
