package de.bsommerfeld.forum.db;

import de.bsommerfeld.forum.core.domain.User;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Login checks, databases written by earlier deployments, and the accessor's
 * lifecycle.
 */
class CredentialAndLifecycleTest {

    @TempDir
    Path tempDir;

    // -- attemptLogin --

    @Test
    void attemptLogin_shouldAcceptOnlyTheRightPassword() throws SQLException {
        try (SqlForumDatabase db = SqlForumDatabaseTest.open(tempDir)) {
            db.addUser("Ada", "Lovelace", "ada@example.com", "engine");

            assertTrue(db.attemptLogin("ada@example.com", "engine"));
            assertFalse(db.attemptLogin("ada@example.com", "Engine"));
            assertFalse(db.attemptLogin("ada@example.com", ""));
            assertFalse(db.attemptLogin("nobody@example.com", "engine"));
        }
    }

    @Test
    void attemptLogin_shouldTreatEmailCaseSensitively() throws SQLException {
        try (SqlForumDatabase db = SqlForumDatabaseTest.open(tempDir)) {
            db.addUser("Ada", "Lovelace", "ada@example.com", "engine");

            assertFalse(db.attemptLogin("ADA@example.com", "engine"));
        }
    }

    @Test
    void addUser_shouldRejectEmptyPassword() throws SQLException {
        try (SqlForumDatabase db = SqlForumDatabaseTest.open(tempDir)) {
            assertThrows(IllegalArgumentException.class, () -> db.addUser("A", "B", "a@x.com", ""));
            assertTrue(db.users().isEmpty());
        }
    }

    // -- Existing databases --

    @Test
    void existingDatabase_shouldBeCompletedAndReadable() throws SQLException {
        String url = "jdbc:sqlite:" + tempDir.resolve("forum.db").toAbsolutePath();
        try (Connection raw = DriverManager.getConnection(url)) {
            try (Statement stmt = raw.createStatement()) {
                stmt.execute(SqlLoader.schema("Users"));
            }
            try (PreparedStatement ps = raw.prepareStatement(
                    "INSERT INTO Users (FirstName, LastName, Email, Password, AddedOn) VALUES (?, ?, ?, ?, ?)")) {
                ps.setString(1, "Grace");
                ps.setString(2, "Hopper");
                ps.setString(3, "grace@example.com");
                ps.setString(4, PasswordHasherTest.LEGACY_HUNTER2);
                ps.setString(5, "2023-05-01 09:30:00");
                ps.executeUpdate();
            }
        }

        try (SqlForumDatabase db = SqlForumDatabaseTest.open(tempDir)) {
            User grace = db.getUser(1);
            assertEquals("Grace", grace.firstName());
            assertFalse(grace.admin());
            assertEquals(LocalDateTime.of(2023, 5, 1, 9, 30), grace.addedOn());
            assertTrue(db.attemptLogin("grace@example.com", "hunter2"));
            assertFalse(db.attemptLogin("grace@example.com", "hunter3"));

            int post = db.addPost(1, "Tables were created", "...");
            assertTrue(db.checkPostExists(post));
        }
    }

    @Test
    void reopen_shouldKeepData() throws SQLException {
        int id;
        try (SqlForumDatabase db = SqlForumDatabaseTest.open(tempDir)) {
            id = db.addTag("java", null, "#f89820");
        }
        try (SqlForumDatabase db = SqlForumDatabaseTest.open(tempDir)) {
            assertEquals("java", db.getTagName(id));
        }
    }

    // -- Lifecycle --

    @Test
    void closedAccessor_shouldRejectOperations() throws SQLException {
        SqlForumDatabase db = SqlForumDatabaseTest.open(tempDir);
        db.close();

        assertThrows(StoreUnavailableException.class, () -> db.checkUserExists(1));
        assertThrows(StoreUnavailableException.class, () -> db.addTag("t", null, "#000000"));
        assertThrows(StoreUnavailableException.class, () -> db.attemptLogin("a@x.com", "pw"));
        assertDoesNotThrow(db::close);
    }

    @Test
    void concurrentWriters_shouldAllSucceed() throws Exception {
        try (SqlForumDatabase db = SqlForumDatabaseTest.open(tempDir)) {
            int user = db.addUser("A", "B", "a@x.com", "pw");
            int post = db.addPost(user, "T", "C");

            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<Integer>> futures = new ArrayList<>();
                for (int i = 0; i < 40; i++) {
                    int n = i;
                    futures.add(pool.submit(() -> db.addComment(post, user, "comment " + n)));
                }
                for (Future<Integer> future : futures)
                    assertTrue(future.get() > 0);
            } finally {
                pool.shutdownNow();
            }

            assertEquals(40, db.comments().size());
        }
    }
}
