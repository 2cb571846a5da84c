package de.bsommerfeld.storygraph.graph;

/**
 * Why a branch head fails to resolve back to a root.
 */
public enum CorruptionReason {

    HEAD_NOT_FOUND("head not found"),
    CYCLE_DETECTED("cycle detected"),
    DANGLING_PARENT("dangling parent reference");

    private final String description;

    CorruptionReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
