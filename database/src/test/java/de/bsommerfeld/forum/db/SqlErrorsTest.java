package de.bsommerfeld.forum.db;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

class SqlErrorsTest {

    @Test
    void translate_shouldMapForeignKeyFailures() {
        SQLException e = new SQLException("[SQLITE_CONSTRAINT_FOREIGNKEY] A foreign key constraint failed "
                + "(FOREIGN KEY constraint failed)");

        ForumDataException translated = SqlErrors.translate("Adding post", e);

        assertInstanceOf(ForeignKeyViolationException.class, translated);
        assertSame(e, translated.getCause());
        assertTrue(translated.getMessage().startsWith("Adding post failed"));
    }

    @Test
    void translate_shouldMapUniqueFailures() {
        SQLException e = new SQLException("[SQLITE_CONSTRAINT_UNIQUE] A UNIQUE constraint failed "
                + "(UNIQUE constraint failed: Users.Email)");

        assertInstanceOf(UniqueConstraintViolationException.class, SqlErrors.translate("Adding user", e));
    }

    @Test
    void translate_shouldMapNotNullFailures() {
        SQLException e = new SQLException("[SQLITE_CONSTRAINT_NOTNULL] A NOT NULL constraint failed "
                + "(NOT NULL constraint failed: Users.FirstName)");

        assertInstanceOf(NotNullConstraintViolationException.class, SqlErrors.translate("Modifying user 1", e));
    }

    @Test
    void translate_shouldMapNotNullFailureReportedByDriver() throws SQLException {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite::memory:");
                Statement stmt = conn.createStatement()) {
            stmt.execute(SqlLoader.schema("Tags"));

            SQLException e = assertThrows(SQLException.class,
                    () -> stmt.executeUpdate("INSERT INTO Tags (Name, Colour, AddedOn) VALUES (NULL, '#fff', 'x')"));

            ForumDataException translated = SqlErrors.translate("Adding tag", e);
            assertInstanceOf(NotNullConstraintViolationException.class, translated);
            assertSame(e, translated.getCause());
        }
    }

    @Test
    void translate_shouldMapEverythingElseToStoreUnavailable() {
        SQLException e = new SQLException("[SQLITE_BUSY] The database file is locked (database is locked)");

        assertInstanceOf(StoreUnavailableException.class, SqlErrors.translate("Loading users", e));
    }

    @Test
    void translate_shouldHandleMissingMessage() {
        assertInstanceOf(StoreUnavailableException.class, SqlErrors.translate("Loading users", new SQLException()));
    }
}
