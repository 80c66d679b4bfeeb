package de.bsommerfeld.forum.core.domain;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable snapshot of a row in the {@code Tags} table.
 *
 * @param id          surrogate key assigned by the store
 * @param name        display name, not required to be unique
 * @param description optional explanation, {@code null} if unset
 * @param colour      display colour as stored by the caller (e.g. {@code #ff8800})
 * @param addedOn     creation time
 */
public record Tag(
        int id,
        String name,
        String description,
        String colour,
        LocalDateTime addedOn) {

    /**
     * Reduces full tag records to their ids, preserving iteration order.
     * Operations that accept tags take identifiers; this bridges callers that
     * hold records.
     */
    public static Set<Integer> idsOf(Collection<Tag> tags) {
        Set<Integer> ids = new LinkedHashSet<>();
        for (Tag tag : tags) {
            ids.add(tag.id());
        }
        return ids;
    }
}
