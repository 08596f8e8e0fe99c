package com.apischema.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Full description of one endpoint.
 *
 * @param url URL template with the version substituted
 * @param action lower-case HTTP method
 * @param encoding request body media type, null when there is no body
 * @param description endpoint description
 * @param fields request parameters in order: path, body or query, pagination, filters
 * @param responseSchema schema of the successful response
 * @param errorStatusCodes declared error statuses (status code to description)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Link(
    String url,
    String action,
    String encoding,
    String description,
    List<FieldDescriptor> fields,
    ResponseSchema responseSchema,
    Map<Integer, String> errorStatusCodes
) {
    /**
     * Compact constructor with validation.
     */
    public Link {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(action, "action must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
        if (responseSchema == null) {
            responseSchema = ResponseSchema.empty();
        }
        errorStatusCodes = errorStatusCodes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(errorStatusCodes));
    }
}
