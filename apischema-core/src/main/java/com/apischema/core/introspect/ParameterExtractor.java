package com.apischema.core.introspect;

import com.apischema.core.model.FieldDescriptor;
import com.apischema.core.model.SchemaFragment;

import java.util.List;
import java.util.Optional;

/**
 * Folds body fields into a single body schema.
 */
@FunctionalInterface
public interface ParameterExtractor {

    /**
     * Builds the body schema for a field list.
     *
     * @param fields fields in order; non-body fields are ignored
     * @return object schema with {@code properties}, or empty if there is no body field
     */
    Optional<SchemaFragment> extractBodySchema(List<FieldDescriptor> fields);
}
