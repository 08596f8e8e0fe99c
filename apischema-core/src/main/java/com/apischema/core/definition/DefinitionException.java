package com.apischema.core.definition;

/**
 * Thrown when an API definition file cannot be read or refers to something it does not declare.
 */
public class DefinitionException extends RuntimeException {

    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
