package de.bsommerfeld.forum.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.json}. Section names keep the capitalised spelling of
 * the existing server configuration files; sections this layer does not use
 * ({@code Server}, {@code Logging}) are ignored when reading.
 *
 * @see ForumConfigLoader
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForumConfig {

    @JsonProperty("Database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("Security")
    private SecurityConfig security = new SecurityConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public void setDatabase(DatabaseConfig database) {
        this.database = database;
    }

    public SecurityConfig getSecurity() {
        return security;
    }

    public void setSecurity(SecurityConfig security) {
        this.security = security;
    }
}
