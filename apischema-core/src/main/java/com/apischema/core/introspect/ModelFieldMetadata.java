package com.apischema.core.introspect;

/**
 * What the model layer knows about a field behind a path variable.
 *
 * @param modelVerboseName human name of the model, e.g. {@code "user"}
 * @param verboseName human name of the field, may be null
 * @param helpText field help text, may be null
 * @param primaryKey whether the field is the primary key
 * @param autoIncrement whether the field is an auto-incremented integer
 */
public record ModelFieldMetadata(
    String modelVerboseName,
    String verboseName,
    String helpText,
    boolean primaryKey,
    boolean autoIncrement
) {
}
