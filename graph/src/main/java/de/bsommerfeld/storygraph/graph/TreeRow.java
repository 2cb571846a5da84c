package de.bsommerfeld.storygraph.graph;

import de.bsommerfeld.storygraph.core.domain.Snippet;

import java.util.List;

/**
 * One main-path snippet with all of its children, active and alternate,
 * oldest first.
 */
public record TreeRow(Snippet parent, List<Snippet> children) {

    public TreeRow {
        children = List.copyOf(children);
    }
}
