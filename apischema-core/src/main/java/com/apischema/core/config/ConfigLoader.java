package com.apischema.core.config;

import com.apischema.core.config.SchemaConfig.DocumentInfo;
import com.apischema.core.version.SemanticVersion;
import com.apischema.core.version.VersionParseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the document settings of a generation run from {@code apischema.yaml}.
 *
 * <p>Generation never fails because of its settings: a missing, unreadable, empty or
 * unparsable file yields {@link SchemaConfig#defaults()}. The documented version is the
 * fallback for requests that name none, so it is checked here; a malformed one is replaced
 * by the default version and the rest of the file is kept.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SchemaConfig config = ConfigLoader.load(Paths.get(ConfigLoader.DEFAULT_FILE_NAME));
 * String fallbackVersion = config.document().version();
 * }</pre>
 */
public final class ConfigLoader {

    /** File name looked up in the working directory when none is given */
    public static final String DEFAULT_FILE_NAME = "apischema.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads the generation settings.
     *
     * @param configPath path to the settings file
     * @return settings from the file, or defaults when it cannot be used
     */
    public static SchemaConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("No settings file at {}, documenting with default title and version", configPath);
            return SchemaConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Settings file {} is not a readable file, using defaults", configPath);
            return SchemaConfig.defaults();
        }

        SchemaConfig config;
        try {
            log.debug("Reading settings from {}", configPath);
            config = YAML_MAPPER.readValue(configPath.toFile(), SchemaConfig.class);
        } catch (IOException e) {
            log.error("Cannot parse settings file {}, using defaults: {}", configPath, e.getMessage());
            return SchemaConfig.defaults();
        }
        if (config == null) {
            log.warn("Settings file {} is empty, using defaults", configPath);
            return SchemaConfig.defaults();
        }

        config = withCheckedVersion(config, configPath);
        log.info("Documenting '{}' at version {} (settings from {})",
            config.document().title(), config.document().version(), configPath);
        return config;
    }

    private static SchemaConfig withCheckedVersion(SchemaConfig config, Path configPath) {
        DocumentInfo document = config.document();
        try {
            SemanticVersion.parse(document.version());
            return config;
        } catch (VersionParseException e) {
            String fallback = DocumentInfo.defaults().version();
            log.error("Document version '{}' in {} is not a version, falling back to {}",
                document.version(), configPath, fallback);
            return new SchemaConfig(
                new DocumentInfo(document.title(), fallback, document.description(), document.url()),
                config.generation());
        }
    }
}
