package de.bsommerfeld.canvas.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes {@link GlobalConfig} as TOML.
 *
 * <p>
 * A missing file is not an error: defaults are written so the user has a
 * complete file to edit. Keys that are no longer known are ignored on load
 * and dropped on the next save.
 *
 * <p>
 * Saves go through a {@code .tmp} sibling and an atomic rename, so a crash
 * mid-write never leaves a truncated config behind.
 */
public final class ConfigStore {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigStore.class);

    private final Path path;
    private final TomlMapper mapper;

    public ConfigStore(Path path) {
        this.path = path;
        this.mapper = TomlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public Path getPath() {
        return path;
    }

    /**
     * Loads the configuration, creating the file with defaults if absent.
     *
     * @throws IllegalStateException if the file exists but cannot be parsed
     */
    public GlobalConfig load() {
        GlobalConfig config;
        if (Files.exists(path)) {
            try {
                config = mapper.readValue(path.toFile(), GlobalConfig.class);
                LOG.info("Loaded configuration from {}", path);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to parse configuration: " + path, e);
            }
        } else {
            LOG.info("No configuration at {}, writing defaults", path);
            config = new GlobalConfig();
            save(config);
        }
        config.attach(this);
        return config;
    }

    /**
     * Serializes the configuration to disk.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public void save(GlobalConfig config) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), config);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOG.debug("Configuration saved to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save configuration: " + path, e);
        }
    }
}
