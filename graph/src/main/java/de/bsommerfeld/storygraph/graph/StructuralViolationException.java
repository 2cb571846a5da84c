package de.bsommerfeld.storygraph.graph;

/**
 * Thrown when an operation would break a graph invariant: deleting a root,
 * activating a snippet that is not a child, or referencing a snippet of
 * another story. The graph is left unchanged.
 */
public class StructuralViolationException extends StoryGraphException {

    public StructuralViolationException(String message) {
        super(message);
    }
}
