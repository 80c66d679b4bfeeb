package de.bsommerfeld.forum.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Creates the tables the accessor depends on. Additive only: existing tables
 * are never dropped or altered, so a database written by an older client keeps
 * its data and its exact column layout.
 */
final class SchemaManager {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaManager.class);

    /** Required tables in foreign-key dependency order. */
    static final List<String> TABLES = List.of("Users", "Posts", "Tags", "Comments", "PostTags");

    private final Connection connection;

    SchemaManager(Connection connection) {
        this.connection = connection;
    }

    /**
     * Creates every table of {@link #TABLES} that is missing, in a single
     * transaction.
     *
     * @return the tables that were created, empty if the schema was complete
     * @throws StoreUnavailableException if the catalog cannot be read or a
     *                                   table cannot be created
     */
    List<String> ensureSchema() {
        LOG.debug("Checking that the tables exist in the database.");
        try {
            Set<String> existing = existingTables();
            List<String> missing = new ArrayList<>();
            for (String table : TABLES) {
                if (!existing.contains(table))
                    missing.add(table);
            }
            if (missing.isEmpty()) {
                LOG.debug("Schema complete, nothing to create.");
                return missing;
            }

            if (missing.size() == TABLES.size()) {
                LOG.info("Empty database, creating all {} tables.", TABLES.size());
            } else {
                LOG.warn("Tables {} do not exist in the database. Recreating them.", missing);
            }
            createTables(missing);
            return missing;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Schema initialization failed", e);
        }
    }

    private Set<String> existingTables() throws SQLException {
        Set<String> tables = new HashSet<>();
        try (PreparedStatement ps = connection.prepareStatement(SqlLoader.load("select-table-names"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                tables.add(rs.getString("name"));
        }
        return tables;
    }

    private void createTables(List<String> tables) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try (Statement stmt = connection.createStatement()) {
            for (String table : tables) {
                stmt.execute(SqlLoader.schema(table));
                LOG.debug("Created table {}", table);
            }
            connection.commit();
        } catch (SQLException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }
}
