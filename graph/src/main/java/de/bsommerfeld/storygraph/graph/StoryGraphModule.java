package de.bsommerfeld.storygraph.graph;

import com.google.inject.AbstractModule;
import de.bsommerfeld.storygraph.core.config.ApplicationMode;
import de.bsommerfeld.storygraph.core.config.BranchConfig;
import de.bsommerfeld.storygraph.core.config.ConfigLoader;
import de.bsommerfeld.storygraph.core.config.GlobalConfig;
import de.bsommerfeld.storygraph.core.config.StorageConfig;
import de.bsommerfeld.storygraph.core.util.StorageUtils;
import de.bsommerfeld.storygraph.db.DatabaseService;
import de.bsommerfeld.storygraph.db.InMemoryDatabaseService;
import de.bsommerfeld.storygraph.db.SqlDatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Guice module wiring configuration and storage for the graph engine.
 */
public class StoryGraphModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(StoryGraphModule.class);

    private final Path configPath;
    private final ApplicationMode mode;

    public StoryGraphModule() {
        this(StorageUtils.getConfigFile(), ApplicationMode.get());
    }

    public StoryGraphModule(Path configPath, ApplicationMode mode) {
        this.configPath = configPath;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        GlobalConfig config;
        try {
            LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
            config = ConfigLoader.load(configPath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration from " + configPath, e);
        }

        bind(GlobalConfig.class).toInstance(config);
        bind(StorageConfig.class).toInstance(config.getStorage());
        bind(BranchConfig.class).toInstance(config.getBranches());

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application mode: {}", mode);
        if (mode.usesPersistentStorage()) {
            bind(DatabaseService.class).to(SqlDatabaseService.class);
        } else {
            bind(DatabaseService.class).to(InMemoryDatabaseService.class);
        }
    }
}
