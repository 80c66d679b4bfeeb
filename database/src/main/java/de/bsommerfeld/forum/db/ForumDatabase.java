package de.bsommerfeld.forum.db;

import de.bsommerfeld.forum.core.domain.Comment;
import de.bsommerfeld.forum.core.domain.Post;
import de.bsommerfeld.forum.core.domain.PostTag;
import de.bsommerfeld.forum.core.domain.Tag;
import de.bsommerfeld.forum.core.domain.User;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Gateway to the forum store. Every read and write of users, posts, tags,
 * comments and their associations goes through this contract; there is no
 * other query surface.
 *
 * <p>
 * Implementations hold one connection for their whole lifetime and must be
 * {@linkplain #close() closed} once at shutdown. Operations are synchronous.
 * Operations that touch more than one row commit atomically or not at all.
 *
 * <h3>Failure semantics</h3>
 * <ul>
 * <li>writes referencing a missing parent throw
 * {@link ForeignKeyViolationException}</li>
 * <li>a duplicate email throws {@link UniqueConstraintViolationException}</li>
 * <li>{@code null} for a required value throws
 * {@link IllegalArgumentException} before anything is written; a required
 * column left empty by other means throws
 * {@link NotNullConstraintViolationException}</li>
 * <li>{@code get*} and {@code modify*} on a missing id throw
 * {@link NotFoundException}</li>
 * <li>{@code remove*} and {@link #unlinkTag} on a missing id do nothing</li>
 * <li>everything else the store reports surfaces as
 * {@link StoreUnavailableException}</li>
 * </ul>
 *
 * <h3>Comments are soft-deleted</h3>
 * {@link #removeComment} only stamps {@code DeletedOn}. A soft-deleted comment
 * is invisible to {@link #getComment}, {@link #checkCommentExists} and
 * {@link #comments()}. Comments removed as part of a post, user or tag cascade
 * are deleted physically.
 */
public interface ForumDatabase extends AutoCloseable {

    // -- Creation --

    /**
     * Registers a user. {@code admin} starts as {@code false} and {@code bio}
     * as {@code null}; the password is stored as a PBKDF2 credential.
     *
     * @return the new user's id
     * @throws UniqueConstraintViolationException if the email is taken
     * @throws IllegalArgumentException           if the password is null or
     *                                            empty, or a name or the email
     *                                            is null
     */
    int addUser(String firstName, String lastName, String email, String password);

    /**
     * Equivalent to {@code addPost(creatorId, title, content, null, Set.of())}.
     */
    default int addPost(int creatorId, String title, String content) {
        return addPost(creatorId, title, content, null, Set.of());
    }

    /**
     * Equivalent to {@code addPost(creatorId, title, content, expiresOn, Set.of())}.
     */
    default int addPost(int creatorId, String title, String content, LocalDateTime expiresOn) {
        return addPost(creatorId, title, content, expiresOn, Set.of());
    }

    /**
     * Creates a post and links it to the given tags in one transaction. If any
     * tag does not exist, neither the post nor any link is written. Callers
     * holding {@link Tag} records can pass {@link Tag#idsOf}.
     *
     * @param expiresOn {@code null} for a post that never expires
     * @param tagIds    {@code null} for no tags; must not contain {@code null}
     * @return the new post's id
     * @throws ForeignKeyViolationException if the creator or a tag is missing
     * @throws IllegalArgumentException     if the title, the content or a tag
     *                                      id is null
     */
    int addPost(int creatorId, String title, String content, LocalDateTime expiresOn,
            Collection<Integer> tagIds);

    /**
     * @param description {@code null} if the tag has none
     * @return the new tag's id
     * @throws IllegalArgumentException if the name or the colour is null
     */
    int addTag(String name, String description, String colour);

    /**
     * @return the new comment's id
     * @throws ForeignKeyViolationException if the post or the author is missing
     * @throws IllegalArgumentException     if the content is null
     */
    int addComment(int postId, int userId, String content);

    /**
     * Associates a tag with a post. Linking an already linked pair changes
     * nothing.
     *
     * @throws ForeignKeyViolationException if the post or the tag is missing
     */
    void linkTag(int postId, int tagId);

    // -- Removal --

    /**
     * Deletes a user together with their posts (including each post's
     * comments and tag links) and every comment they wrote elsewhere.
     */
    void removeUser(int userId);

    /**
     * Deletes a post together with its comments and tag links.
     */
    void removePost(int postId);

    /**
     * Deletes a tag, its links, and <strong>every post that carried it</strong>
     * (with those posts' comments and remaining links). Deleting the posts and
     * not just the links matches the behaviour existing forum databases were
     * built around; callers that only want to detach a tag use
     * {@link #unlinkTag}.
     */
    void removeTag(int tagId);

    /**
     * Soft-deletes a comment by stamping {@code DeletedOn}. Removing an
     * already removed comment keeps the original timestamp.
     */
    void removeComment(int commentId);

    /**
     * Removes the association between a post and a tag. Neither side is
     * deleted.
     */
    void unlinkTag(int postId, int tagId);

    // -- Keyed reads --

    /** @throws NotFoundException if no user has this id */
    User getUser(int userId);

    /** @throws NotFoundException if no post has this id */
    Post getPost(int postId);

    /** @throws NotFoundException if no tag has this id */
    Tag getTag(int tagId);

    /** @throws NotFoundException if no live comment has this id */
    Comment getComment(int commentId);

    /**
     * Ids of the tags linked to a post; empty for an untagged or missing post.
     */
    Set<Integer> getPostTags(int postId);

    default String getUserFirstName(int userId) {
        return getUser(userId).firstName();
    }

    default String getUserLastName(int userId) {
        return getUser(userId).lastName();
    }

    default String getUserEmail(int userId) {
        return getUser(userId).email();
    }

    default boolean isUserAdmin(int userId) {
        return getUser(userId).admin();
    }

    default String getUserBio(int userId) {
        return getUser(userId).bio();
    }

    default LocalDateTime getUserAddedOn(int userId) {
        return getUser(userId).addedOn();
    }

    default int getPostCreatorId(int postId) {
        return getPost(postId).creatorId();
    }

    default String getPostTitle(int postId) {
        return getPost(postId).title();
    }

    default String getPostContent(int postId) {
        return getPost(postId).content();
    }

    default LocalDateTime getPostAddedOn(int postId) {
        return getPost(postId).addedOn();
    }

    default LocalDateTime getPostExpiresOn(int postId) {
        return getPost(postId).expiresOn();
    }

    default String getTagName(int tagId) {
        return getTag(tagId).name();
    }

    default String getTagDescription(int tagId) {
        return getTag(tagId).description();
    }

    default String getTagColour(int tagId) {
        return getTag(tagId).colour();
    }

    default LocalDateTime getTagAddedOn(int tagId) {
        return getTag(tagId).addedOn();
    }

    default int getCommentPostId(int commentId) {
        return getComment(commentId).postId();
    }

    default int getCommentUserId(int commentId) {
        return getComment(commentId).userId();
    }

    default String getCommentContent(int commentId) {
        return getComment(commentId).content();
    }

    default LocalDateTime getCommentAddedOn(int commentId) {
        return getComment(commentId).addedOn();
    }

    default LocalDateTime getCommentEditedOn(int commentId) {
        return getComment(commentId).editedOn();
    }

    // -- Bulk snapshots --

    /** Every user, ordered by id. */
    List<User> users();

    /** Every post, ordered by id. */
    List<Post> posts();

    /** Every tag, ordered by id. */
    List<Tag> tags();

    /** Every live comment, ordered by id. Soft-deleted comments are omitted. */
    List<Comment> comments();

    /** Every post/tag association, ordered by post then tag. */
    List<PostTag> postTags();

    // -- Modification --

    /**
     * Applies the options set on {@code changes}. An empty change set only
     * checks that the user exists.
     *
     * @throws NotFoundException                  if the user is missing
     * @throws UniqueConstraintViolationException if the new email is taken
     */
    void modifyUser(int userId, UserChanges changes);

    /**
     * Applies the options set on {@code changes}. A tag replacement deletes
     * all current links and inserts the new set in the same transaction as the
     * column update.
     *
     * @throws NotFoundException            if the post is missing
     * @throws ForeignKeyViolationException if a replacement tag is missing
     */
    void modifyPost(int postId, PostChanges changes);

    /**
     * @throws NotFoundException if the tag is missing
     */
    void modifyTag(int tagId, TagChanges changes);

    /**
     * Applies the options set on {@code changes} and stamps {@code EditedOn}
     * when the content changes.
     *
     * @throws NotFoundException if no live comment has this id
     */
    void modifyComment(int commentId, CommentChanges changes);

    // -- Existence --

    boolean checkUserExists(int userId);

    boolean checkPostExists(int postId);

    boolean checkTagExists(int tagId);

    /** {@code false} for soft-deleted comments. */
    boolean checkCommentExists(int commentId);

    boolean checkTagLinked(int postId, int tagId);

    // -- Credentials --

    /**
     * Verifies a login. Returns {@code false} both for an unknown email and a
     * wrong password, after the same amount of hashing work.
     */
    boolean attemptLogin(String email, String password);

    /**
     * Releases the connection. Further calls throw
     * {@link StoreUnavailableException}. Closing twice is harmless.
     */
    @Override
    void close();
}
