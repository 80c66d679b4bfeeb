package de.bsommerfeld.forum.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * Location of the SQLite file and connection tuning.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    /** Path value that selects a private in-memory database. */
    public static final String IN_MEMORY = ":memory:";

    @JsonProperty("Path")
    private String path = "ServerData/database.db";

    @JsonProperty("BusyTimeoutMillis")
    private int busyTimeoutMillis = 5000;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }

    public void setBusyTimeoutMillis(int busyTimeoutMillis) {
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    /**
     * JDBC URL for the configured path. Relative paths resolve against the
     * working directory.
     */
    @JsonIgnore
    public String getJdbcUrl() {
        if (IN_MEMORY.equals(path)) {
            return "jdbc:sqlite::memory:";
        }
        return "jdbc:sqlite:" + Path.of(path).toAbsolutePath();
    }
}
