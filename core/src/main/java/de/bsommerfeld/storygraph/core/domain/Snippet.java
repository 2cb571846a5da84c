package de.bsommerfeld.storygraph.core.domain;

/**
 * Immutable row of the snippet graph. A story's snippets form a forest of
 * out-trees linked backward through {@code parentId}; {@code childId} marks the
 * one child that is the active continuation at this point. Other children of
 * the same parent are alternates.
 *
 * <p>
 * Records are never mutated in place. Structural operations write the changed
 * column and re-read the row, so a {@code Snippet} is always a snapshot.
 *
 * @param id        opaque unique identifier
 * @param story     story this snippet belongs to
 * @param parentId  snippet directly before this one, {@code null} for a root
 * @param childId   active continuation, {@code null} when none is selected
 * @param kind      producer tag
 * @param content   text payload, never {@code null} but possibly empty
 * @param createdAt creation timestamp in epoch milliseconds
 */
public record Snippet(
        String id,
        String story,
        String parentId,
        String childId,
        SnippetKind kind,
        String content,
        long createdAt) {

    public Snippet {
        content = content != null ? content : "";
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean hasActiveChild() {
        return childId != null;
    }

    public boolean belongsTo(String storyName) {
        return story.equals(storyName);
    }

    public Snippet withParentId(String newParentId) {
        return new Snippet(id, story, newParentId, childId, kind, content, createdAt);
    }

    public Snippet withChildId(String newChildId) {
        return new Snippet(id, story, parentId, newChildId, kind, content, createdAt);
    }

    /**
     * Copy of this row moved into another story under a new id. Links are
     * passed explicitly because they must be remapped by the caller.
     */
    public Snippet copyInto(String newId, String newStory, String newParentId, String newChildId) {
        return new Snippet(newId, newStory, newParentId, newChildId, kind, content, createdAt);
    }
}
