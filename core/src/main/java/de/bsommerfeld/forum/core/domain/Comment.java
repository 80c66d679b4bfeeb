package de.bsommerfeld.forum.core.domain;

import java.time.LocalDateTime;

/**
 * Immutable snapshot of a row in the {@code Comments} table.
 *
 * @param id        surrogate key assigned by the store
 * @param postId    id of the {@link Post} the comment belongs to
 * @param userId    id of the authoring {@link User}
 * @param content   comment text
 * @param addedOn   creation time
 * @param editedOn  time of the last content change, {@code null} if never
 *                  edited
 * @param deletedOn soft-delete marker, {@code null} while the comment is live
 */
public record Comment(
        int id,
        int postId,
        int userId,
        String content,
        LocalDateTime addedOn,
        LocalDateTime editedOn,
        LocalDateTime deletedOn) {

    public boolean isDeleted() {
        return deletedOn != null;
    }
}
