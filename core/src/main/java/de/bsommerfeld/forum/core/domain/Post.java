package de.bsommerfeld.forum.core.domain;

import java.time.LocalDateTime;

/**
 * Immutable snapshot of a row in the {@code Posts} table. Tag associations
 * are not part of the row; they live in {@link PostTag}.
 *
 * @param id        surrogate key assigned by the store
 * @param creatorId id of the owning {@link User}
 * @param title     post headline
 * @param content   post body
 * @param addedOn   creation time
 * @param expiresOn time after which the post is stale, {@code null} if it
 *                  never expires
 */
public record Post(
        int id,
        int creatorId,
        String title,
        String content,
        LocalDateTime addedOn,
        LocalDateTime expiresOn) {
}
