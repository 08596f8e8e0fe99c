package com.apischema.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where a request field travels.
 */
public enum FieldLocation {
    /** URL path template variable */
    PATH,

    /** Query string parameter */
    QUERY,

    /** Member of a form or JSON request body */
    FORM,

    /** The whole request body */
    BODY;

    /**
     * Returns whether the field is sent in the request body.
     *
     * @return true for {@link #FORM} and {@link #BODY}
     */
    public boolean isBody() {
        return this == FORM || this == BODY;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
