package de.bsommerfeld.storygraph.core.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a TOML file. A missing file is created with
 * the defaults so users have something to edit; unknown keys are ignored so
 * older binaries tolerate newer files.
 *
 * <p>
 * Only annotated fields are (de)serialized. Convenience methods on the config
 * POJOs such as {@link StorageConfig#resolveDatabaseFile()} never leak into
 * the file.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .visibility(PropertyAccessor.ALL, Visibility.NONE)
            .visibility(PropertyAccessor.FIELD, Visibility.ANY)
            .build();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code path}, writing defaults first if the
     * file does not exist yet.
     *
     * @throws IOException if the file cannot be read, parsed, or created
     */
    public static GlobalConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            GlobalConfig defaults = new GlobalConfig();
            save(path, defaults);
            LOG.info("Created default configuration at {}", path.toAbsolutePath());
            return defaults;
        }
        GlobalConfig config = MAPPER.readValue(path.toFile(), GlobalConfig.class);
        LOG.debug("Loaded configuration from {}", path.toAbsolutePath());
        return config;
    }

    /**
     * Writes {@code config} to {@code path}, creating parent directories.
     */
    public static void save(Path path, GlobalConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), config);
    }
}
