package de.bsommerfeld.storygraph.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Branch naming and read-path healing behavior.
 */
public class BranchConfig {

    @JsonProperty("default-name")
    private String defaultName = "main";

    @JsonProperty("repair-on-read")
    private boolean repairOnRead = true;

    public String getDefaultName() {
        return defaultName;
    }

    public void setDefaultName(String defaultName) {
        this.defaultName = defaultName;
    }

    public boolean isRepairOnRead() {
        return repairOnRead;
    }

    public void setRepairOnRead(boolean repairOnRead) {
        this.repairOnRead = repairOnRead;
    }

    /**
     * Trims {@code name} and substitutes the default branch for {@code null}
     * or blank input. Any casing of the default name maps to the stored
     * default name.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return defaultName;
        }
        String trimmed = name.trim();
        return defaultName.equalsIgnoreCase(trimmed) ? defaultName : trimmed;
    }

    public boolean isDefault(String name) {
        return defaultName.equals(normalize(name));
    }
}
