package com.apischema.core.util;

import java.util.stream.Collectors;

/**
 * Helpers for documentation text attached to handlers and descriptors.
 */
public final class Docs {

    private Docs() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Strips every line and the text as a whole.
     *
     * <p>Indentation from source-level declarations does not survive into the document.
     *
     * @param text documentation text, may be null
     * @return normalized text, empty if none
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.lines()
            .map(String::strip)
            .collect(Collectors.joining("\n"))
            .strip();
    }
}
