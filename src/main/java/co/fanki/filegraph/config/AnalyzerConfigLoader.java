package co.fanki.filegraph.config;

import co.fanki.filegraph.path.domain.PathMapper;
import co.fanki.filegraph.shared.ConfigurationException;
import co.fanki.filegraph.shared.Preconditions;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and validates the JSON configuration file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AnalyzerConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalyzerConfigLoader.class);

    private final ObjectMapper objectMapper;

    /**
     * Creates a new loader.
     *
     * @param theObjectMapper the mapper used to read the file
     */
    public AnalyzerConfigLoader(final ObjectMapper theObjectMapper) {
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required")
                .copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Loads a configuration file.
     *
     * @param file the JSON file
     * @return the validated configuration
     * @throws ConfigurationException if the file is missing, is not valid
     *         JSON, or holds an invalid setting
     */
    public AnalyzerConfig load(final Path file) {
        Preconditions.requireNonNull(file, "Config file is required");

        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Config file not found: "
                    + file.toAbsolutePath());
        }

        final AnalyzerConfig config;
        try {
            config = objectMapper.readValue(file.toFile(),
                    AnalyzerConfig.class);
        } catch (final IOException e) {
            throw new ConfigurationException("Cannot read config file "
                    + file + ": " + e.getMessage(), e);
        }

        validate(config);

        LOG.info("Loaded config {}: {} entry points, {} path mappings",
                file, config.entryPoints().size(),
                config.pathMappings().size());

        return config;
    }

    private static void validate(final AnalyzerConfig config) {
        Preconditions.requireConfiguration(config != null,
                "Config file is empty");
        Preconditions.requireConfiguration(
                config.pwd() != null && !config.pwd().isBlank(),
                "Config 'pwd' is required");

        for (int i = 0; i < config.entryPoints().size(); i++) {
            final AnalyzerConfig.EntryPoint entryPoint =
                    config.entryPoints().get(i);
            Preconditions.requireConfiguration(entryPoint != null
                    && entryPoint.path() != null
                    && !entryPoint.path().isBlank(),
                    "Entry point #" + (i + 1) + " has no 'path'");
        }

        // Fails on the first malformed rule.
        new PathMapper(config.pathMappings());
    }

}
