/**
 * Data-access layer for the forum: users, posts, tags, comments and the
 * post/tag association, stored in SQLite.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Application]
 *        │
 *        ▼
 *   ForumDatabase      ← interface, the whole external contract
 *        │
 *        ▼
 *   SqlForumDatabase   ← one connection, one lock, transactional writes
 *    ┌───┴──────────┬───────────────┐
 *    │              │               │
 * SchemaManager  SqlLoader   PasswordHasher
 * </pre>
 *
 * <h2>Schema</h2>
 *
 * <pre>
 * Users    (Id PK, FirstName, LastName, Email UNIQUE, Password, Admin, Bio?, AddedOn)
 * Posts    (Id PK, CreatorId → Users, Title, Content, AddedOn, ExpiresOn?)
 * Tags     (Id PK, Name, Description?, Colour, AddedOn)
 * Comments (Id PK, PostId → Posts, UserId → Users, Content, AddedOn, EditedOn?, DeletedOn?)
 * PostTags (PostId → Posts, TagId → Tags)
 * </pre>
 *
 * All foreign keys are declared {@code ON DELETE CASCADE}. Timestamps are
 * stored as {@code yyyy-MM-dd HH:mm:ss.SSSSSS} text.
 *
 * <h2>Cascade rules</h2>
 * <ul>
 * <li>User → their posts (→ comments, links) and their comments</li>
 * <li>Post → its comments and links</li>
 * <li>Tag → its links and every post that carried it (→ comments, links)</li>
 * <li>Comment → nothing; single comments are soft-deleted via
 * {@code DeletedOn}</li>
 * </ul>
 *
 * <h2>SQL file inventory</h2>
 * {@code schema/<Table>.sql} holds one {@code CREATE TABLE IF NOT EXISTS}
 * per table. {@code sql/*.sql} holds one statement per file, named
 * {@code <operation>-<entity>}: {@code insert-*}, {@code select-*},
 * {@code select-all-*}, {@code exists-*}, {@code delete-*} and
 * {@code soft-delete-comment}.
 */
package de.bsommerfeld.forum.db;
