package de.bsommerfeld.forum.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.forum.core.config.DatabaseConfig;
import de.bsommerfeld.forum.core.config.ForumConfig;
import de.bsommerfeld.forum.core.domain.Comment;
import de.bsommerfeld.forum.core.domain.Post;
import de.bsommerfeld.forum.core.domain.PostTag;
import de.bsommerfeld.forum.core.domain.Tag;
import de.bsommerfeld.forum.core.domain.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SQLite-backed {@link ForumDatabase}.
 *
 * <p>
 * Statements live in {@code sql/*.sql} and table definitions in
 * {@code schema/*.sql}, both loaded through {@link SqlLoader}. The only SQL
 * assembled in code is the {@code SET} list of the modify operations, built
 * from the fixed column names of the change-set classes.
 *
 * <h3>Connection strategy</h3>
 * One {@link Connection} is opened in the constructor and kept until
 * {@link #close()}. Foreign-key enforcement is switched on for it and the
 * {@link SchemaManager} runs before the constructor returns. Every operation
 * holds the accessor's lock for its duration because a JDBC connection's
 * transaction state is shared by all callers.
 *
 * <h3>Transaction boundaries</h3>
 * Writes run in an explicit {@code SERIALIZABLE} transaction with
 * rollback-on-failure, whether they touch one row or a whole cascade. Reads
 * use auto-commit.
 *
 * <h3>Cascades</h3>
 * Removals delete children before parents ({@code Comments},
 * {@code PostTags}, {@code Posts}, then the target row) instead of relying on
 * {@code ON DELETE CASCADE}, so databases created without foreign-key
 * enforcement are cleaned up the same way.
 */
@Singleton
public class SqlForumDatabase implements ForumDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqlForumDatabase.class);

    private final Object lock = new Object();
    private final Connection connection;
    private final PasswordHasher hasher;
    private final Clock clock;
    private boolean closed;

    @Inject
    public SqlForumDatabase(ForumConfig config) {
        this(open(config.getDatabase()),
                new PasswordHasher(config.getSecurity().getPasswordRounds()),
                Clock.systemDefaultZone());
    }

    /**
     * Takes ownership of an already opened connection. The connection is
     * closed if initialization fails.
     */
    SqlForumDatabase(Connection connection, PasswordHasher hasher, Clock clock) {
        this.connection = connection;
        this.hasher = hasher;
        this.clock = clock;
        try {
            initialize();
        } catch (RuntimeException e) {
            closeConnection();
            throw e;
        }
    }

    private static Connection open(DatabaseConfig config) {
        String url = config.getJdbcUrl();
        LOG.info("Opening database at {}", url);
        try {
            if (!DatabaseConfig.IN_MEMORY.equals(config.getPath())) {
                Path parent = Path.of(config.getPath()).toAbsolutePath().getParent();
                if (parent != null && !Files.exists(parent))
                    Files.createDirectories(parent);
            }
            Connection conn = DriverManager.getConnection(url);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA busy_timeout = " + config.getBusyTimeoutMillis());
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
            return conn;
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot create database directory for " + url, e);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Cannot open database at " + url, e);
        }
    }

    private void initialize() {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA foreign_keys = ON");
            connection.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Database initialization failed", e);
        }
        List<String> created = new SchemaManager(connection).ensureSchema();
        LOG.info("Database ready ({} tables created).", created.size());
    }

    // =====================================================================
    // Creation
    // =====================================================================

    @Override
    public int addUser(String firstName, String lastName, String email, String password) {
        requireValue("FirstName", firstName);
        requireValue("LastName", lastName);
        requireValue("Email", email);
        LOG.info("Adding user '{} {}' ({}) to the database.", firstName, lastName, email);
        String credential = hasher.hash(password);
        return write("Adding user " + email,
                conn -> insert(conn, "insert-user", firstName, lastName, email, credential, now()));
    }

    @Override
    public int addPost(int creatorId, String title, String content, LocalDateTime expiresOn,
            Collection<Integer> tagIds) {
        requireValue("Title", title);
        requireValue("Content", content);
        Set<Integer> tags = tagIds == null ? Set.of() : PostChanges.tagIdSet(tagIds);
        LOG.info("Adding post '{}' by user {} with {} tags to the database.", title, creatorId, tags.size());
        return write("Adding post '" + title + "'", conn -> {
            requireParent(conn, "exists-user", creatorId, "Post", "User");
            int postId = insert(conn, "insert-post", creatorId, title, content, now(), expiresOn);
            linkTags(conn, postId, tags);
            return postId;
        });
    }

    @Override
    public int addTag(String name, String description, String colour) {
        requireValue("Name", name);
        requireValue("Colour", colour);
        LOG.info("Adding tag '{}' to the database.", name);
        return write("Adding tag '" + name + "'",
                conn -> insert(conn, "insert-tag", name, description, colour, now()));
    }

    @Override
    public int addComment(int postId, int userId, String content) {
        requireValue("Content", content);
        LOG.info("Adding comment by user {} on post {} to the database.", userId, postId);
        return write("Adding comment on post " + postId, conn -> {
            requireParent(conn, "exists-post", postId, "Comment", "Post");
            requireParent(conn, "exists-user", userId, "Comment", "User");
            return insert(conn, "insert-comment", postId, userId, content, now());
        });
    }

    @Override
    public void linkTag(int postId, int tagId) {
        write("Linking tag " + tagId + " to post " + postId, conn -> {
            requireParent(conn, "exists-post", postId, "PostTag", "Post");
            linkTags(conn, postId, Set.of(tagId));
            return null;
        });
    }

    /**
     * Inserts one link per tag, skipping pairs that are already linked.
     * Every tag is checked first so a missing one aborts the surrounding
     * transaction.
     */
    private void linkTags(Connection conn, int postId, Set<Integer> tagIds) throws SQLException {
        for (int tagId : tagIds) {
            requireParent(conn, "exists-tag", tagId, "PostTag", "Tag");
            if (update(conn, "insert-post-tag", postId, tagId, postId, tagId) == 0) {
                LOG.debug("Tag {} already linked to post {}", tagId, postId);
            }
        }
    }

    // =====================================================================
    // Removal
    // =====================================================================

    @Override
    public void removeUser(int userId) {
        write("Removing user " + userId, conn -> {
            List<Integer> postIds = selectAll(conn, "select-post-ids-by-creator", rs -> rs.getInt("Id"), userId);
            int comments = 0;
            for (int postId : postIds)
                comments += deletePostTree(conn, postId);
            comments += update(conn, "delete-comments-by-user", userId);

            if (update(conn, "delete-user", userId) > 0) {
                LOG.info("Removed user {} with {} posts and {} comments.", userId, postIds.size(), comments);
            } else {
                LOG.debug("User {} does not exist, nothing to remove.", userId);
            }
            return null;
        });
    }

    @Override
    public void removePost(int postId) {
        write("Removing post " + postId, conn -> {
            boolean existed = exists(conn, "exists-post", postId);
            int comments = deletePostTree(conn, postId);
            if (existed) {
                LOG.info("Removed post {} with {} comments.", postId, comments);
            } else {
                LOG.debug("Post {} does not exist, nothing to remove.", postId);
            }
            return null;
        });
    }

    @Override
    public void removeTag(int tagId) {
        write("Removing tag " + tagId, conn -> {
            List<Integer> postIds = selectAll(conn, "select-tagged-post-ids", rs -> rs.getInt("PostId"), tagId);
            for (int postId : postIds)
                deletePostTree(conn, postId);
            update(conn, "delete-post-tags-for-tag", tagId);

            if (update(conn, "delete-tag", tagId) > 0) {
                LOG.info("Removed tag {} and the {} posts carrying it.", tagId, postIds.size());
            } else {
                LOG.debug("Tag {} does not exist, removed {} dangling posts.", tagId, postIds.size());
            }
            return null;
        });
    }

    @Override
    public void removeComment(int commentId) {
        write("Removing comment " + commentId, conn -> {
            if (update(conn, "soft-delete-comment", now(), commentId) > 0) {
                LOG.info("Marked comment {} as deleted.", commentId);
            } else {
                LOG.debug("Comment {} does not exist or is already deleted.", commentId);
            }
            return null;
        });
    }

    @Override
    public void unlinkTag(int postId, int tagId) {
        write("Unlinking tag " + tagId + " from post " + postId, conn -> {
            int removed = update(conn, "delete-post-tag", postId, tagId);
            LOG.debug("Unlinked tag {} from post {} ({} rows).", tagId, postId, removed);
            return null;
        });
    }

    /**
     * Deletes a post's comments, its tag links and then the post itself.
     *
     * @return number of comments deleted
     */
    private int deletePostTree(Connection conn, int postId) throws SQLException {
        int comments = update(conn, "delete-comments-for-post", postId);
        update(conn, "delete-post-tags-for-post", postId);
        update(conn, "delete-post", postId);
        return comments;
    }

    // =====================================================================
    // Keyed reads
    // =====================================================================

    @Override
    public User getUser(int userId) {
        User user = read("Fetching user " + userId,
                conn -> selectOne(conn, "select-user", SqlForumDatabase::mapUser, userId));
        if (user == null)
            throw new NotFoundException("User", userId);
        return user;
    }

    @Override
    public Post getPost(int postId) {
        Post post = read("Fetching post " + postId,
                conn -> selectOne(conn, "select-post", SqlForumDatabase::mapPost, postId));
        if (post == null)
            throw new NotFoundException("Post", postId);
        return post;
    }

    @Override
    public Tag getTag(int tagId) {
        Tag tag = read("Fetching tag " + tagId,
                conn -> selectOne(conn, "select-tag", SqlForumDatabase::mapTag, tagId));
        if (tag == null)
            throw new NotFoundException("Tag", tagId);
        return tag;
    }

    @Override
    public Comment getComment(int commentId) {
        Comment comment = read("Fetching comment " + commentId,
                conn -> selectOne(conn, "select-comment", SqlForumDatabase::mapComment, commentId));
        if (comment == null)
            throw new NotFoundException("Comment", commentId);
        return comment;
    }

    @Override
    public Set<Integer> getPostTags(int postId) {
        return read("Fetching tags of post " + postId,
                conn -> new LinkedHashSet<>(selectAll(conn, "select-post-tags", rs -> rs.getInt("TagId"), postId)));
    }

    // =====================================================================
    // Bulk snapshots
    // =====================================================================

    @Override
    public List<User> users() {
        return read("Loading all users", conn -> selectAll(conn, "select-all-users", SqlForumDatabase::mapUser));
    }

    @Override
    public List<Post> posts() {
        return read("Loading all posts", conn -> selectAll(conn, "select-all-posts", SqlForumDatabase::mapPost));
    }

    @Override
    public List<Tag> tags() {
        return read("Loading all tags", conn -> selectAll(conn, "select-all-tags", SqlForumDatabase::mapTag));
    }

    @Override
    public List<Comment> comments() {
        return read("Loading all comments",
                conn -> selectAll(conn, "select-all-comments", SqlForumDatabase::mapComment));
    }

    @Override
    public List<PostTag> postTags() {
        return read("Loading all post tags", conn -> selectAll(conn, "select-all-post-tags",
                rs -> new PostTag(rs.getInt("PostId"), rs.getInt("TagId"))));
    }

    // =====================================================================
    // Modification
    // =====================================================================

    @Override
    public void modifyUser(int userId, UserChanges changes) {
        Map<String, Object> assignments = new LinkedHashMap<>(changes.assignments());
        if (changes.password() != null)
            assignments.put("Password", hasher.hash(changes.password()));
        LOG.info("Modifying user {}: {}", userId, assignments.keySet());
        write("Modifying user " + userId, conn -> {
            modifyRow(conn, "Users", "User", "exists-user", userId, assignments);
            return null;
        });
    }

    @Override
    public void modifyPost(int postId, PostChanges changes) {
        Set<Integer> tags = changes.tags();
        LOG.info("Modifying post {}: {}{}", postId, changes.assignments().keySet(),
                tags == null ? "" : " tags=" + tags);
        write("Modifying post " + postId, conn -> {
            modifyRow(conn, "Posts", "Post", "exists-post", postId, changes.assignments());
            if (tags != null) {
                update(conn, "delete-post-tags-for-post", postId);
                linkTags(conn, postId, tags);
            }
            return null;
        });
    }

    @Override
    public void modifyTag(int tagId, TagChanges changes) {
        LOG.info("Modifying tag {}: {}", tagId, changes.assignments().keySet());
        write("Modifying tag " + tagId, conn -> {
            modifyRow(conn, "Tags", "Tag", "exists-tag", tagId, changes.assignments());
            return null;
        });
    }

    @Override
    public void modifyComment(int commentId, CommentChanges changes) {
        Map<String, Object> assignments = new LinkedHashMap<>(changes.assignments());
        LOG.info("Modifying comment {}: {}", commentId, assignments.keySet());
        write("Modifying comment " + commentId, conn -> {
            if (assignments.containsKey("Content"))
                assignments.put("EditedOn", now());
            modifyRow(conn, "Comments", "Comment", "exists-comment", commentId, assignments);
            return null;
        });
    }

    /**
     * Checks the row exists, then runs {@code UPDATE <table> SET ... WHERE Id = ?}
     * over the given assignments. Column names come from the change-set
     * classes, never from caller input.
     */
    private void modifyRow(Connection conn, String table, String entity, String existsSql, int id,
            Map<String, Object> assignments) throws SQLException {
        if (!exists(conn, existsSql, id))
            throw new NotFoundException(entity, id);
        if (assignments.isEmpty())
            return;

        StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET ");
        List<Object> params = new ArrayList<>();
        for (Map.Entry<String, Object> assignment : assignments.entrySet()) {
            if (!params.isEmpty())
                sql.append(", ");
            sql.append(assignment.getKey()).append(" = ?");
            params.add(assignment.getValue());
        }
        sql.append(" WHERE Id = ?");
        params.add(id);

        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            bind(ps, params.toArray());
            ps.executeUpdate();
        }
    }

    // =====================================================================
    // Existence
    // =====================================================================

    @Override
    public boolean checkUserExists(int userId) {
        return read("Checking user " + userId, conn -> exists(conn, "exists-user", userId));
    }

    @Override
    public boolean checkPostExists(int postId) {
        return read("Checking post " + postId, conn -> exists(conn, "exists-post", postId));
    }

    @Override
    public boolean checkTagExists(int tagId) {
        return read("Checking tag " + tagId, conn -> exists(conn, "exists-tag", tagId));
    }

    @Override
    public boolean checkCommentExists(int commentId) {
        return read("Checking comment " + commentId, conn -> exists(conn, "exists-comment", commentId));
    }

    @Override
    public boolean checkTagLinked(int postId, int tagId) {
        return read("Checking link of tag " + tagId + " to post " + postId,
                conn -> exists(conn, "exists-post-tag", postId, tagId));
    }

    // =====================================================================
    // Credentials
    // =====================================================================

    @Override
    public boolean attemptLogin(String email, String password) {
        String stored = read("Looking up credential",
                conn -> selectOne(conn, "select-password-by-email", rs -> rs.getString("Password"), email));
        if (stored == null) {
            LOG.debug("Login rejected: no account for the given email.");
            return hasher.verifyAgainstDecoy(password);
        }
        boolean accepted = hasher.verify(password, stored);
        LOG.debug("Login for {} {}.", email, accepted ? "accepted" : "rejected");
        return accepted;
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    @Override
    public void close() {
        synchronized (lock) {
            if (closed)
                return;
            closed = true;
            LOG.info("Closing database connection.");
            closeConnection();
        }
    }

    private void closeConnection() {
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close database connection", e);
        }
    }

    // =====================================================================
    // Execution helpers
    // =====================================================================

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /** Runs a read on the shared connection in auto-commit mode. */
    private <T> T read(String action, SqlWork<T> work) {
        synchronized (lock) {
            Connection conn = openConnection();
            try {
                return work.run(conn);
            } catch (SQLException e) {
                throw SqlErrors.translate(action, e);
            }
        }
    }

    /**
     * Runs {@code work} in one transaction. Any exception, including the
     * {@link ForumDataException}s raised by integrity checks, rolls back
     * everything the work has done.
     */
    private <T> T write(String action, SqlWork<T> work) {
        synchronized (lock) {
            Connection conn = openConnection();
            try {
                conn.setAutoCommit(false);
                try {
                    T result = work.run(conn);
                    conn.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    rollback(conn, action, e);
                    throw e;
                } finally {
                    conn.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw SqlErrors.translate(action, e);
            }
        }
    }

    private void rollback(Connection conn, String action, Exception cause) {
        try {
            conn.rollback();
            LOG.debug("{} rolled back: {}", action, cause.getMessage());
        } catch (SQLException e) {
            cause.addSuppressed(e);
            LOG.error("Rollback of '{}' failed", action, e);
        }
    }

    private Connection openConnection() {
        if (closed)
            throw new StoreUnavailableException("Database accessor is closed");
        return connection;
    }

    private static void requireValue(String column, Object value) {
        if (value == null)
            throw new IllegalArgumentException(column + " must not be null");
    }

    private void requireParent(Connection conn, String existsSql, int id, String child, String parent)
            throws SQLException {
        if (!exists(conn, existsSql, id))
            throw new ForeignKeyViolationException(child + " references missing " + parent + " " + id);
    }

    /** Executes an insert and returns the row id SQLite assigned to it. */
    private static int insert(Connection conn, String sqlName, Object... params) throws SQLException {
        update(conn, sqlName, params);
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-last-insert-id"));
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next())
                throw new SQLException("No row id after " + sqlName);
            return rs.getInt(1);
        }
    }

    private static int update(Connection conn, String sqlName, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            bind(ps, params);
            return ps.executeUpdate();
        }
    }

    private static boolean exists(Connection conn, String sqlName, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static <T> T selectOne(Connection conn, String sqlName, RowMapper<T> mapper, Object... params)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapper.map(rs) : null;
            }
        }
    }

    private static <T> List<T> selectAll(Connection conn, String sqlName, RowMapper<T> mapper, Object... params)
            throws SQLException {
        List<T> results = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    results.add(mapper.map(rs));
            }
        }
        return results;
    }

    /** Binds positional parameters; timestamps are written as text. */
    private static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object value = params[i];
            int index = i + 1;
            if (value == null) {
                ps.setNull(index, Types.NULL);
            } else if (value instanceof LocalDateTime) {
                ps.setString(index, Timestamps.format((LocalDateTime) value));
            } else if (value instanceof Boolean) {
                ps.setBoolean(index, (Boolean) value);
            } else if (value instanceof Integer) {
                ps.setInt(index, (Integer) value);
            } else {
                ps.setString(index, value.toString());
            }
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    // =====================================================================
    // ResultSet → Record mapping
    // =====================================================================

    private static User mapUser(ResultSet rs) throws SQLException {
        return new User(
                rs.getInt("Id"), rs.getString("FirstName"),
                rs.getString("LastName"), rs.getString("Email"),
                rs.getString("Password"), rs.getBoolean("Admin"),
                rs.getString("Bio"), Timestamps.read(rs, "AddedOn"));
    }

    private static Post mapPost(ResultSet rs) throws SQLException {
        return new Post(
                rs.getInt("Id"), rs.getInt("CreatorId"),
                rs.getString("Title"), rs.getString("Content"),
                Timestamps.read(rs, "AddedOn"),
                Timestamps.read(rs, "ExpiresOn"));
    }

    private static Tag mapTag(ResultSet rs) throws SQLException {
        return new Tag(
                rs.getInt("Id"), rs.getString("Name"),
                rs.getString("Description"), rs.getString("Colour"),
                Timestamps.read(rs, "AddedOn"));
    }

    private static Comment mapComment(ResultSet rs) throws SQLException {
        return new Comment(
                rs.getInt("Id"), rs.getInt("PostId"),
                rs.getInt("UserId"), rs.getString("Content"),
                Timestamps.read(rs, "AddedOn"),
                Timestamps.read(rs, "EditedOn"),
                Timestamps.read(rs, "DeletedOn"));
    }
}
