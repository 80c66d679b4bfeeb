package de.bsommerfeld.forum.db;

import org.junit.jupiter.api.Test;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TimestampsTest {

    @Test
    void format_shouldWriteMicroseconds() {
        LocalDateTime value = LocalDateTime.of(2024, 3, 1, 10, 15, 30, 123_456_000);
        assertEquals("2024-03-01 10:15:30.123456", Timestamps.format(value));
    }

    @Test
    void format_shouldKeepZeroFraction() {
        assertEquals("2024-03-01 10:15:30.000000", Timestamps.format(LocalDateTime.of(2024, 3, 1, 10, 15, 30)));
    }

    @Test
    void parse_shouldAcceptTimestampsWithoutFraction() {
        assertEquals(LocalDateTime.of(2023, 5, 1, 9, 30), Timestamps.parse("2023-05-01 09:30:00"));
    }

    @Test
    void parse_shouldAcceptIsoSeparator() {
        assertEquals(LocalDateTime.of(2023, 5, 1, 9, 30, 0, 500_000_000), Timestamps.parse("2023-05-01T09:30:00.5"));
    }

    @Test
    void parse_shouldMapBlankToNull() {
        assertNull(Timestamps.parse(null));
        assertNull(Timestamps.parse(" "));
        assertNull(Timestamps.format(null));
    }

    @Test
    void parse_shouldReadWhatFormatWrites() {
        LocalDateTime value = LocalDateTime.of(2030, 12, 31, 23, 59, 59, 999_999_000);
        assertEquals(value, Timestamps.parse(Timestamps.format(value)));
    }

    @Test
    void parse_shouldReadDateOnlyAsMidnight() {
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), Timestamps.parse("2024-01-01"));
    }

    @Test
    void parse_shouldDropTrailingOffset() {
        assertEquals(LocalDateTime.of(2024, 1, 1, 10, 0), Timestamps.parse("2024-01-01 10:00:00+00:00"));
        assertEquals(LocalDateTime.of(2024, 1, 1, 10, 0), Timestamps.parse("2024-01-01T10:00:00Z"));
    }

    @Test
    void parse_shouldRejectGarbage() {
        assertThrows(DateTimeParseException.class, () -> Timestamps.parse("yesterday"));
    }

    @Test
    void read_shouldWrapUnreadableValueNamingTheColumn() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("AddedOn")).thenReturn("yesterday");

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> Timestamps.read(rs, "AddedOn"));

        assertTrue(e.getMessage().contains("AddedOn"));
        assertInstanceOf(DateTimeParseException.class, e.getCause());
    }

    @Test
    void read_shouldMapNullColumnToNull() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("EditedOn")).thenReturn(null);

        assertNull(Timestamps.read(rs, "EditedOn"));
    }
}
