package com.apischema.core.generator;

import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.DeclaredField;
import com.apischema.core.descriptor.FieldKind;
import com.apischema.core.introspect.FieldSchemaIntrospector;
import com.apischema.core.model.FieldDescriptor;
import com.apischema.core.model.FieldLocation;
import com.apischema.core.model.SchemaFragment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Converts declared fields into request parameters.
 *
 * <p>Read-only and hidden fields never become parameters. On a partial update nothing
 * is required. Free-form {@code DICT}/{@code JSON} fields get an {@code object}
 * schema with no properties; every other kind is left to the
 * {@link FieldSchemaIntrospector}.
 */
public class FieldDeriver {

    static final String PARTIAL_UPDATE_METHOD = "PATCH";

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private final FieldSchemaIntrospector introspector;

    public FieldDeriver(FieldSchemaIntrospector introspector) {
        this.introspector = Objects.requireNonNull(introspector, "introspector must not be null");
    }

    /**
     * Returns where request fields travel for a method.
     *
     * @param method HTTP method
     * @return {@code form} for POST/PUT/PATCH, {@code query} otherwise
     */
    public static FieldLocation locationFor(String method) {
        return BODY_METHODS.contains(method.toUpperCase(Locale.ROOT)) ? FieldLocation.FORM : FieldLocation.QUERY;
    }

    /**
     * Derives one parameter.
     *
     * @param field declared field
     * @param location parameter location
     * @param method HTTP method of the request
     * @return parameter, or empty for read-only and hidden fields
     */
    public Optional<FieldDescriptor> derive(DeclaredField field, FieldLocation location, String method) {
        if (field.readOnly() || field.kind() == FieldKind.HIDDEN) {
            return Optional.empty();
        }
        boolean required = field.required() && !PARTIAL_UPDATE_METHOD.equalsIgnoreCase(method);
        return Optional.of(new FieldDescriptor(
            field.name(),
            location,
            required,
            schemaFor(field),
            field.helpTextAsString()
        ));
    }

    /**
     * Derives the parameters of a whole request descriptor.
     *
     * <p>A list-shaped descriptor is sent as a single required {@code data} array.
     *
     * @param descriptor request descriptor
     * @param method HTTP method of the request
     * @return parameters in declaration order
     */
    public List<FieldDescriptor> requestFields(DataShapeDescriptor descriptor, String method) {
        FieldLocation location = locationFor(method);
        if (descriptor.many()) {
            return List.of(new FieldDescriptor("data", location, true, SchemaFragment.array(null), null));
        }

        List<FieldDescriptor> fields = new ArrayList<>();
        for (DeclaredField field : descriptor.fields()) {
            derive(field, location, method).ifPresent(fields::add);
        }
        return fields;
    }

    /**
     * Returns the schema of a field: the fallback for free-form kinds, the introspected
     * schema otherwise.
     *
     * @param field declared field
     * @return schema fragment
     */
    public SchemaFragment schemaFor(DeclaredField field) {
        return fallbackSchema(field).orElseGet(() -> introspector.toSchema(field));
    }

    /**
     * Returns the fallback schema for kinds the introspector cannot represent.
     *
     * @param field declared field
     * @return empty {@code object} schema for {@code DICT}/{@code JSON}, empty otherwise
     */
    public Optional<SchemaFragment> fallbackSchema(DeclaredField field) {
        return switch (field.kind()) {
            case DICT, JSON -> Optional.of(SchemaFragment.object(Map.of())
                .withTitle(field.label())
                .withDescription(field.helpTextAsString()));
            case PRIMITIVE, LIST, NESTED, HIDDEN -> Optional.empty();
        };
    }
}
