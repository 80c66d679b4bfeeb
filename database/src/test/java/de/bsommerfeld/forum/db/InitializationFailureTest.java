package de.bsommerfeld.forum.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Failure paths of start-up, driven by a mocked connection that refuses to
 * work.
 */
@ExtendWith(MockitoExtension.class)
class InitializationFailureTest {

    @Mock
    private Connection connection;

    @Test
    void ensureSchema_shouldFailWhenCatalogIsUnreadable() throws SQLException {
        when(connection.prepareStatement(anyString())).thenThrow(new SQLException("disk I/O error"));

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> new SchemaManager(connection).ensureSchema());
        assertEquals("disk I/O error", e.getCause().getMessage());
    }

    @Test
    void constructor_shouldCloseConnectionWhenInitializationFails() throws SQLException {
        when(connection.createStatement()).thenThrow(new SQLException("database disk image is malformed"));

        assertThrows(StoreUnavailableException.class,
                () -> new SqlForumDatabase(connection, new PasswordHasher(1000), Clock.systemUTC()));
        verify(connection).close();
    }
}
