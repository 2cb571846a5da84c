package de.bsommerfeld.storygraph.core.domain;

import java.util.Locale;

/**
 * Tag distinguishing who produced a snippet. {@link #USER} and {@link #AI} are
 * the well-known values, but the set is open: any non-blank tag is accepted so
 * callers can introduce new producers without a schema change.
 *
 * @param value lower-case tag as persisted in the {@code kind} column
 */
public record SnippetKind(String value) {

    public static final SnippetKind USER = new SnippetKind("user");
    public static final SnippetKind AI = new SnippetKind("ai");

    public SnippetKind {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Snippet kind must not be blank");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a persisted or user-supplied tag.
     */
    public static SnippetKind of(String value) {
        return new SnippetKind(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
