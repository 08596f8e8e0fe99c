package com.apischema.core.introspect;

import com.apischema.core.model.FieldDescriptor;
import com.apischema.core.model.FieldLocation;
import com.apischema.core.model.SchemaFragment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default {@link ParameterExtractor}.
 *
 * <p>A {@code body} field stands for the whole body and its schema is used as is.
 * Otherwise every {@code form} field becomes a property of one object schema, and
 * required form fields are listed in its {@code required} names.
 */
public class DefaultParameterExtractor implements ParameterExtractor {

    @Override
    public Optional<SchemaFragment> extractBodySchema(List<FieldDescriptor> fields) {
        Map<String, SchemaFragment> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();

        for (FieldDescriptor field : fields) {
            if (field.location() == FieldLocation.BODY) {
                return Optional.of(field.schema());
            }
            if (field.location() != FieldLocation.FORM) {
                continue;
            }
            SchemaFragment schema = field.schema();
            if (schema.description() == null && field.description() != null) {
                schema = schema.withDescription(field.description());
            }
            properties.put(field.name(), schema);
            if (field.required()) {
                required.add(field.name());
            }
        }

        if (properties.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SchemaFragment.object(properties).withRequired(required));
    }
}
