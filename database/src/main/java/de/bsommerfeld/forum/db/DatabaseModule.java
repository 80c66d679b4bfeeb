package de.bsommerfeld.forum.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.forum.core.config.ForumConfig;
import de.bsommerfeld.forum.core.config.ForumConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module for the data-access layer. Binds the configuration and makes
 * {@link ForumDatabase} a process-wide singleton backed by
 * {@link SqlForumDatabase}. The application closes the accessor at shutdown.
 */
public class DatabaseModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseModule.class);

    private final ForumConfig config;

    /**
     * Loads {@code config.json} from the given path, creating it with defaults
     * if missing.
     */
    public DatabaseModule(Path configPath) {
        this(ForumConfigLoader.load(configPath));
    }

    public DatabaseModule(ForumConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        LOG.debug("Binding ForumDatabase to SqlForumDatabase at {}", config.getDatabase().getPath());
        bind(ForumConfig.class).toInstance(config);
        bind(ForumDatabase.class).to(SqlForumDatabase.class);
    }
}
