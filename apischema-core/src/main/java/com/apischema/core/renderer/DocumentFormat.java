package com.apischema.core.renderer;

/**
 * Serialization formats supported by {@link ApiDocumentWriter}.
 */
public enum DocumentFormat {
    JSON("json"),
    YAML("yaml");

    private final String extension;

    DocumentFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
