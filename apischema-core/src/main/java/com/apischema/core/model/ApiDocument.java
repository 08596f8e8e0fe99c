package com.apischema.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Root of a generated API description.
 *
 * @param version documented API version
 * @param title document title
 * @param description document description
 * @param url base URL of the API
 * @param content root node of the link tree
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiDocument(
    String version,
    String title,
    String description,
    String url,
    DocumentNode content
) {
    /**
     * Compact constructor with validation.
     */
    public ApiDocument {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
