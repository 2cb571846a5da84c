package de.bsommerfeld.storygraph.core.event;

import java.util.Map;

/**
 * Events published by the graph engine after a mutation has been committed.
 */
public final class StoryEvents {

    private StoryEvents() {
    }

    /**
     * A snippet was excised. {@code replacementId} is the snippet that took
     * its place on the active path, or {@code null} if none did.
     */
    public record SnippetDeletedEvent(String story, String snippetId, String replacementId) {
    }

    /**
     * A branch lost its head and had no viable replacement.
     */
    public record BranchRemovedEvent(String story, String branch, String formerHeadId) {
    }

    /**
     * A corrupted branch was moved back to a healthy ancestor.
     */
    public record BranchRepairedEvent(String story, String branch, String previousHeadId, String newHeadId) {
    }

    public record StoryDeletedEvent(String story, int snippetCount, int branchCount) {
    }

    /**
     * A story was copied. {@code idMapping} maps each source snippet id to the
     * id of its copy; collaborators use it to duplicate metadata keyed by
     * snippet id.
     */
    public record StoryDuplicatedEvent(String source, String target, boolean fullGraph,
            Map<String, String> idMapping) {
    }
}
