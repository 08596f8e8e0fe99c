package com.apischema.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Value types a {@link SchemaFragment} may describe.
 */
public enum SchemaType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY;

    /**
     * Returns the lower-case wire name.
     *
     * @return e.g. {@code "object"}
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
