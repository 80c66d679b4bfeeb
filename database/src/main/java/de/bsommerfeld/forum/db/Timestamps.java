package de.bsommerfeld.forum.db;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Text encoding of timestamp columns. Values are written as
 * {@code yyyy-MM-dd HH:mm:ss.SSSSSS}; reading also accepts a {@code T}
 * separator and any fraction length, since rows written by other clients of
 * the same database file omit the fraction when it is zero. A date without a
 * time reads as midnight; a trailing offset is dropped.
 */
final class Timestamps {

    private static final DateTimeFormatter WRITE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private static final DateTimeFormatter READ = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendLiteral('T').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .toFormatter();

    private Timestamps() {
    }

    /** Returns {@code null} for a {@code null} input. */
    static String format(LocalDateTime value) {
        return value == null ? null : WRITE.format(value);
    }

    /** Returns {@code null} for a {@code null} or blank column. */
    static LocalDateTime parse(String value) {
        if (value == null || value.isBlank())
            return null;
        return LocalDateTime.parse(value.trim(), READ);
    }

    /**
     * Reads a timestamp column.
     *
     * @throws StoreUnavailableException if the stored text is not a timestamp
     */
    static LocalDateTime read(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        try {
            return parse(value);
        } catch (DateTimeParseException e) {
            throw new StoreUnavailableException(
                    "Column " + column + " holds an unreadable timestamp '" + value + "'", e);
        }
    }
}
