package com.apischema.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A compiled request parameter of a {@link Link}.
 *
 * @param name parameter name
 * @param location where the parameter travels
 * @param required whether the client must send it
 * @param schema value schema
 * @param description description, may be null
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record FieldDescriptor(
    String name,
    FieldLocation location,
    boolean required,
    SchemaFragment schema,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
    }
}
