package com.apischema.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Schema of a successful response.
 *
 * @param description response description, may be null
 * @param schema response body schema, null for the empty response
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseSchema(String description, SchemaFragment schema) {

    private static final ResponseSchema EMPTY = new ResponseSchema(null, null);

    /**
     * Returns the declared empty response.
     *
     * @return empty response schema
     */
    public static ResponseSchema empty() {
        return EMPTY;
    }

    /**
     * Returns whether this response documents no body.
     *
     * @return true when there is no schema
     */
    @JsonIgnore
    public boolean isEmpty() {
        return schema == null;
    }
}
