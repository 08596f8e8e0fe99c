package com.apischema.core.version;

/**
 * Thrown when a version string, either in a constraint or in a request, cannot be parsed.
 */
public class VersionParseException extends IllegalArgumentException {

    private final String input;

    /**
     * Creates a new exception for the given input.
     *
     * @param input the text that failed to parse (may be null)
     * @param message detail message
     */
    public VersionParseException(String input, String message) {
        super(message);
        this.input = input;
    }

    /**
     * Returns the text that failed to parse.
     *
     * @return offending input, possibly null
     */
    public String input() {
        return input;
    }
}
