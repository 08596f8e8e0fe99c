package com.apischema.core.generator;

import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.DeclaredField;
import com.apischema.core.descriptor.FieldKind;
import com.apischema.core.introspect.ParameterExtractor;
import com.apischema.core.model.FieldDescriptor;
import com.apischema.core.model.FieldLocation;
import com.apischema.core.model.ResponseSchema;
import com.apischema.core.model.SchemaFragment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the response schema of a descriptor.
 *
 * <p>Nested descriptor fields are composed recursively and merged into the
 * {@code properties} of the flat schema after the flat fields, so a nested entry
 * replaces a flat one of the same name. A nested entry carries the help text of the
 * field that holds it. Lists of nested descriptors compose their element the same way.
 * Only the outermost schema carries the response description.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ResponseSchemaComposer composer = new ResponseSchemaComposer(deriver, new DefaultParameterExtractor());
 * ComposedResponse response = composer.compose(userDescriptor, "Returns the current user.");
 * SchemaFragment profile = response.responseSchema().schema().properties().get("profile");
 * }</pre>
 */
public class ResponseSchemaComposer {

    private final FieldDeriver fieldDeriver;
    private final ParameterExtractor parameterExtractor;

    public ResponseSchemaComposer(FieldDeriver fieldDeriver, ParameterExtractor parameterExtractor) {
        this.fieldDeriver = Objects.requireNonNull(fieldDeriver, "fieldDeriver must not be null");
        this.parameterExtractor = Objects.requireNonNull(parameterExtractor, "parameterExtractor must not be null");
    }

    /**
     * Composes the response schema and error statuses of a descriptor.
     *
     * @param descriptor response descriptor
     * @param description response description, may be null
     * @return response schema (possibly empty) and the descriptor's declared error statuses
     */
    public ComposedResponse compose(DataShapeDescriptor descriptor, String description) {
        SchemaFragment schema = composeSchema(descriptor);
        ResponseSchema responseSchema = schema == null
            ? ResponseSchema.empty()
            : new ResponseSchema(description, schema);
        return new ComposedResponse(responseSchema, descriptor.errorStatusCodes());
    }

    /**
     * Returns the schema of a descriptor, or null when it documents nothing.
     */
    private SchemaFragment composeSchema(DataShapeDescriptor descriptor) {
        if (descriptor.many()) {
            SchemaFragment element = composeSchema(new DataShapeDescriptor(
                descriptor.name(), descriptor.documentation(), descriptor.fields(), descriptor.errorStatusCodes(), false));
            return element == null ? null : SchemaFragment.array(element);
        }

        Map<String, SchemaFragment> nestedObjects = new LinkedHashMap<>();
        List<FieldDescriptor> flatFields = new ArrayList<>();

        for (DeclaredField field : descriptor.fields()) {
            if (field.kind() == FieldKind.HIDDEN) {
                continue;
            }
            if (field.kind() == FieldKind.NESTED) {
                SchemaFragment nested = composeSchema(field.nested());
                if (nested != null) {
                    nestedObjects.put(field.name(), nested.withDescription(field.helpTextAsString()));
                    continue;
                }
            }
            flatFields.add(new FieldDescriptor(
                field.name(),
                FieldLocation.FORM,
                field.required(),
                flatSchema(field),
                null
            ));
        }

        Optional<SchemaFragment> extracted = parameterExtractor.extractBodySchema(flatFields);
        if (extracted.isEmpty()) {
            return nestedObjects.isEmpty() ? null : SchemaFragment.object(nestedObjects);
        }

        SchemaFragment schema = extracted.get();
        Map<String, SchemaFragment> properties = new LinkedHashMap<>(schema.properties());
        properties.putAll(nestedObjects);
        return schema.withProperties(properties);
    }

    /**
     * A list of nested descriptors gets its element composed like a response of its own, so
     * list items read the same as the single-item response.
     */
    private SchemaFragment flatSchema(DeclaredField field) {
        DeclaredField child = field.child();
        if (field.kind() == FieldKind.LIST && child != null && child.kind() == FieldKind.NESTED) {
            SchemaFragment element = composeSchema(child.nested());
            if (element != null) {
                return SchemaFragment.array(element)
                    .withTitle(field.label())
                    .withDescription(field.helpTextAsString());
            }
        }
        return fieldDeriver.schemaFor(field);
    }
}
