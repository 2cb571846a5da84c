package de.bsommerfeld.storygraph.core.util;

import java.util.UUID;

/**
 * Generates opaque snippet identifiers: 32 lower-case hex characters from a
 * random UUID.
 */
public final class SnippetIds {

    private SnippetIds() {
    }

    public static String newId() {
        UUID uuid = UUID.randomUUID();
        return String.format("%016x%016x", uuid.getMostSignificantBits(), uuid.getLeastSignificantBits());
    }
}
