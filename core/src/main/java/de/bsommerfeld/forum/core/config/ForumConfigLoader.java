package de.bsommerfeld.forum.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ForumConfig} from a JSON file. A missing file is created with
 * the defaults so operators get a template to edit on first start.
 */
public final class ForumConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ForumConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ForumConfigLoader() {
    }

    /**
     * @param path location of {@code config.json}
     * @return the parsed configuration, or defaults if the file did not exist
     * @throws IllegalStateException if the file cannot be read, parsed or
     *                               created
     */
    public static ForumConfig load(Path path) {
        LOG.info("Loading configuration from: {}", path.toAbsolutePath());
        try {
            if (!Files.exists(path)) {
                ForumConfig defaults = new ForumConfig();
                write(path, defaults);
                LOG.info("No configuration found, wrote defaults to {}", path.toAbsolutePath());
                return defaults;
            }
            ForumConfig config = MAPPER.readValue(path.toFile(), ForumConfig.class);
            if (config.getDatabase() == null)
                config.setDatabase(new DatabaseConfig());
            if (config.getSecurity() == null)
                config.setSecurity(new SecurityConfig());
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration from " + path, e);
        }
    }

    static void write(Path path, ForumConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), config);
    }
}
