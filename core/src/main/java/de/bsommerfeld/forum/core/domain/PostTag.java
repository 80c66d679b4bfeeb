package de.bsommerfeld.forum.core.domain;

/**
 * One row of the {@code PostTags} association table. Has no surrogate key;
 * the pair itself is the identity.
 *
 * @param postId id of the tagged {@link Post}
 * @param tagId  id of the applied {@link Tag}
 */
public record PostTag(int postId, int tagId) {
}
