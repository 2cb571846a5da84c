package de.bsommerfeld.storygraph.graph;

import de.bsommerfeld.storygraph.core.domain.Snippet;

import java.util.List;

/**
 * A linear history from root to head together with its rendered text.
 *
 * @param story  owning story
 * @param headId last snippet of the path, {@code null} for an empty path
 * @param path   snippets in reading order
 * @param text   {@link GraphStore#buildText(List)} of {@code path}
 */
public record StoryPath(String story, String headId, List<Snippet> path, String text) {

    public StoryPath {
        path = List.copyOf(path);
    }

    public static StoryPath of(String story, List<Snippet> path) {
        String head = path.isEmpty() ? null : path.get(path.size() - 1).id();
        return new StoryPath(story, head, path, GraphStore.buildText(path));
    }

    public boolean isEmpty() {
        return path.isEmpty();
    }
}
