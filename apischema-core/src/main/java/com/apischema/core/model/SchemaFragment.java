package com.apischema.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recursive schema description of one value.
 *
 * @param type value type
 * @param title short title, may be null
 * @param description longer description, may be null
 * @param format string format hint (uri, email, date-time, ...), may be null
 * @param pattern regular expression a string must match, may be null
 * @param enumValues allowed values
 * @param properties member schemas for {@link SchemaType#OBJECT}
 * @param items element schema for {@link SchemaType#ARRAY}, may be null
 * @param required names of required properties
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SchemaFragment(
    SchemaType type,
    String title,
    String description,
    String format,
    String pattern,
    List<String> enumValues,
    Map<String, SchemaFragment> properties,
    SchemaFragment items,
    List<String> required
) {
    /**
     * Compact constructor with validation.
     */
    public SchemaFragment {
        Objects.requireNonNull(type, "type must not be null");
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = required == null ? List.of() : List.copyOf(required);
    }

    /**
     * Creates a fragment carrying only a type, title and description.
     *
     * @param type value type
     * @param title title, may be null
     * @param description description, may be null
     * @return fragment
     */
    public static SchemaFragment of(SchemaType type, String title, String description) {
        return new SchemaFragment(type, title, description, null, null, null, null, null, null);
    }

    public static SchemaFragment string() {
        return of(SchemaType.STRING, null, null);
    }

    /**
     * Creates an object fragment.
     *
     * @param properties member schemas in order
     * @return object fragment
     */
    public static SchemaFragment object(Map<String, SchemaFragment> properties) {
        return new SchemaFragment(SchemaType.OBJECT, null, null, null, null, null, properties, null, null);
    }

    /**
     * Creates an array fragment.
     *
     * @param items element schema, may be null
     * @return array fragment
     */
    public static SchemaFragment array(SchemaFragment items) {
        return new SchemaFragment(SchemaType.ARRAY, null, null, null, null, null, null, items, null);
    }

    public SchemaFragment withTitle(String title) {
        return new SchemaFragment(type, title, description, format, pattern, enumValues, properties, items, required);
    }

    public SchemaFragment withDescription(String description) {
        return new SchemaFragment(type, title, description, format, pattern, enumValues, properties, items, required);
    }

    public SchemaFragment withFormat(String format) {
        return new SchemaFragment(type, title, description, format, pattern, enumValues, properties, items, required);
    }

    public SchemaFragment withPattern(String pattern) {
        return new SchemaFragment(type, title, description, format, pattern, enumValues, properties, items, required);
    }

    public SchemaFragment withEnumValues(List<String> enumValues) {
        return new SchemaFragment(type, title, description, format, pattern, enumValues, properties, items, required);
    }

    public SchemaFragment withProperties(Map<String, SchemaFragment> properties) {
        return new SchemaFragment(type, title, description, format, pattern, enumValues, properties, items, required);
    }

    public SchemaFragment withRequired(List<String> required) {
        return new SchemaFragment(type, title, description, format, pattern, enumValues, properties, items, required);
    }
}
