package com.apischema.core.version;

/**
 * Thrown when no entry of a {@link VersionMap} accepts the requested version.
 *
 * <p>Callers usually translate this into a client error (HTTP 400).
 */
public class NoMatchingVersionException extends RuntimeException {

    private final String requestedVersion;

    /**
     * Creates a new exception.
     *
     * @param requestedVersion the version that was requested
     */
    public NoMatchingVersionException(String requestedVersion) {
        super("Invalid request version " + requestedVersion);
        this.requestedVersion = requestedVersion;
    }

    /**
     * Returns the version that could not be matched.
     *
     * @return requested version
     */
    public String requestedVersion() {
        return requestedVersion;
    }
}
