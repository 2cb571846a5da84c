package de.bsommerfeld.storygraph.graph;

/**
 * Base of the recoverable failures reported by the graph engine. Callers
 * distinguish the subclasses to render different messages; corruption is
 * never thrown, see {@link BranchValidation}.
 */
public abstract class StoryGraphException extends RuntimeException {

    protected StoryGraphException(String message) {
        super(message);
    }
}
