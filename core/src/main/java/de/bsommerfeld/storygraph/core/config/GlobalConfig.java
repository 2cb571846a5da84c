package de.bsommerfeld.storygraph.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to its own POJO so modules
 * can be handed only the part they need.
 */
public class GlobalConfig {

    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    @JsonProperty("branches")
    private BranchConfig branches = new BranchConfig();

    public StorageConfig getStorage() {
        return storage;
    }

    public BranchConfig getBranches() {
        return branches;
    }
}
