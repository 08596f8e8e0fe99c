package com.apischema.core.generator;

import com.apischema.core.model.ResponseSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of composing a response descriptor.
 *
 * @param responseSchema response schema, {@link ResponseSchema#empty()} when there is no body
 * @param errorStatusCodes declared error statuses (status code to description)
 */
public record ComposedResponse(ResponseSchema responseSchema, Map<Integer, String> errorStatusCodes) {

    /**
     * Compact constructor with validation.
     */
    public ComposedResponse {
        if (responseSchema == null) {
            responseSchema = ResponseSchema.empty();
        }
        errorStatusCodes = errorStatusCodes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(errorStatusCodes));
    }

    /**
     * Returns a result without body and without error statuses.
     *
     * @return empty result
     */
    public static ComposedResponse empty() {
        return new ComposedResponse(ResponseSchema.empty(), Map.of());
    }
}
