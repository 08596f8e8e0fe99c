package com.apischema.core.introspect;

import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.DeclaredField;
import com.apischema.core.descriptor.PrimitiveType;
import com.apischema.core.model.SchemaFragment;
import com.apischema.core.model.SchemaType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Introspector mapping field kinds and primitive types onto schema types.
 *
 * <p>Label becomes the title, help text the description. Nested descriptors become
 * objects of their fields, lists become arrays of their child. Hidden, dict and JSON
 * fields have no better representation here than a string.
 */
public class DefaultFieldSchemaIntrospector implements FieldSchemaIntrospector {

    @Override
    public SchemaFragment toSchema(DeclaredField field) {
        SchemaFragment schema = switch (field.kind()) {
            case PRIMITIVE -> primitive(field);
            case LIST -> SchemaFragment.array(field.child() == null ? SchemaFragment.string() : toSchema(field.child()));
            case NESTED -> nested(field.nested());
            case HIDDEN, DICT, JSON -> SchemaFragment.string();
        };
        return schema.withTitle(field.label()).withDescription(field.helpTextAsString());
    }

    private SchemaFragment primitive(DeclaredField field) {
        PrimitiveType type = field.primitiveType();
        return switch (type) {
            case STRING -> SchemaFragment.string();
            case INTEGER -> SchemaFragment.of(SchemaType.INTEGER, null, null);
            case NUMBER -> SchemaFragment.of(SchemaType.NUMBER, null, null);
            case BOOLEAN -> SchemaFragment.of(SchemaType.BOOLEAN, null, null);
            case URL -> SchemaFragment.string().withFormat("uri");
            case EMAIL -> SchemaFragment.string().withFormat("email");
            case UUID -> SchemaFragment.string().withFormat("uuid");
            case DATE -> SchemaFragment.string().withFormat("date");
            case DATETIME -> SchemaFragment.string().withFormat("date-time");
            case CHOICE -> SchemaFragment.string().withEnumValues(field.choices());
        };
    }

    private SchemaFragment nested(DataShapeDescriptor descriptor) {
        Map<String, SchemaFragment> properties = new LinkedHashMap<>();
        for (DeclaredField member : descriptor.fields()) {
            properties.put(member.name(), toSchema(member));
        }
        SchemaFragment object = SchemaFragment.object(properties);
        return descriptor.many() ? SchemaFragment.array(object) : object;
    }
}
