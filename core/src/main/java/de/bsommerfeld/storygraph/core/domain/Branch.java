package de.bsommerfeld.storygraph.core.domain;

/**
 * Named, movable pointer to the tip of a linear story history. Identity is
 * {@code (story, name)}; moving a branch only rewrites {@code headId}.
 *
 * @param story     owning story
 * @param name      branch name, unique per story
 * @param headId    snippet currently designated as the tip
 * @param createdAt creation timestamp in epoch milliseconds, kept across moves
 */
public record Branch(String story, String name, String headId, long createdAt) {

    public Branch withHead(String newHeadId) {
        return new Branch(story, name, newHeadId, createdAt);
    }
}
