package de.bsommerfeld.storygraph.graph;

/**
 * Thrown when a referenced story, snippet, or branch does not exist.
 */
public class NotFoundException extends StoryGraphException {

    public NotFoundException(String message) {
        super(message);
    }
}
