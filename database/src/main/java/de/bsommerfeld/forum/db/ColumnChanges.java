package de.bsommerfeld.forum.db;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered set of column assignments for a modify operation. Only columns a
 * caller explicitly set are present, and a present column may hold
 * {@code null}: "clear the bio" and "leave the bio alone" are different
 * change sets.
 */
abstract class ColumnChanges {

    private final Map<String, Object> assignments = new LinkedHashMap<>();

    final void set(String column, Object value) {
        assignments.put(column, value);
    }

    /** Sets a column that the schema declares {@code NOT NULL}. */
    final void setRequired(String column, Object value) {
        if (value == null)
            throw new IllegalArgumentException(column + " must not be null");
        assignments.put(column, value);
    }

    /** Column name to new value, in the order the options were set. */
    final Map<String, Object> assignments() {
        return Collections.unmodifiableMap(assignments);
    }

    /** Whether at least one option has been set. */
    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + assignments.keySet();
    }
}
