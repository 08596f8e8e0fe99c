package com.apischema.core.generator;

/**
 * A single route could not be turned into a link or placed in the document tree.
 *
 * <p>The generator logs and skips the route; the rest of the document is still produced.
 */
public class LinkCompilationException extends RuntimeException {

    public LinkCompilationException(String message) {
        super(message);
    }

    public LinkCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
