package com.apischema.core.introspect;

import com.apischema.core.descriptor.DeclaredField;
import com.apischema.core.model.SchemaFragment;

/**
 * Turns one declared field into a basic schema fragment.
 *
 * <p>Implementations are not expected to represent free-form {@code DICT}/{@code JSON}
 * fields faithfully; the generator overrides those itself.
 */
@FunctionalInterface
public interface FieldSchemaIntrospector {

    /**
     * Derives a schema for a field.
     *
     * @param field declared field
     * @return schema fragment, never null
     */
    SchemaFragment toSchema(DeclaredField field);
}
