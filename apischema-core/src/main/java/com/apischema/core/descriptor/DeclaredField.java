package com.apischema.core.descriptor;

import java.util.List;
import java.util.Objects;

/**
 * One declared field of a {@link DataShapeDescriptor}.
 *
 * <p>Use the static factories to create fields and the {@code as...}/{@code with...}
 * methods to derive variants; instances are immutable.
 *
 * @param name field name as it appears on the wire
 * @param kind field kind
 * @param primitiveType scalar type, only for {@link FieldKind#PRIMITIVE}
 * @param label human readable label, may be null
 * @param helpText help text, may be null or a {@link LocalizedText}
 * @param required whether clients must supply the field
 * @param readOnly whether the field is output-only
 * @param nested nested descriptor, only for {@link FieldKind#NESTED}
 * @param child element field, only for {@link FieldKind#LIST}
 * @param choices allowed values, only for {@link PrimitiveType#CHOICE}
 */
public record DeclaredField(
    String name,
    FieldKind kind,
    PrimitiveType primitiveType,
    String label,
    CharSequence helpText,
    boolean required,
    boolean readOnly,
    DataShapeDescriptor nested,
    DeclaredField child,
    List<String> choices
) {
    /**
     * Compact constructor with validation.
     */
    public DeclaredField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == FieldKind.PRIMITIVE && primitiveType == null) {
            primitiveType = PrimitiveType.STRING;
        }
        if (kind == FieldKind.NESTED) {
            Objects.requireNonNull(nested, "nested descriptor must not be null for field " + name);
        }
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static DeclaredField primitive(String name, PrimitiveType type) {
        return new DeclaredField(name, FieldKind.PRIMITIVE, type, null, null, false, false, null, null, null);
    }

    public static DeclaredField choice(String name, List<String> choices) {
        return new DeclaredField(name, FieldKind.PRIMITIVE, PrimitiveType.CHOICE, null, null, false, false, null, null, choices);
    }

    public static DeclaredField nested(String name, DataShapeDescriptor descriptor) {
        return new DeclaredField(name, FieldKind.NESTED, null, null, null, false, false, descriptor, null, null);
    }

    /**
     * Creates a list field; {@code child} describes one element and its name is ignored.
     *
     * @param name field name
     * @param child element field, may be null for untyped lists
     * @return list field
     */
    public static DeclaredField listOf(String name, DeclaredField child) {
        return new DeclaredField(name, FieldKind.LIST, null, null, null, false, false, null, child, null);
    }

    public static DeclaredField hidden(String name) {
        return new DeclaredField(name, FieldKind.HIDDEN, null, null, null, false, false, null, null, null);
    }

    public static DeclaredField dict(String name) {
        return new DeclaredField(name, FieldKind.DICT, null, null, null, false, false, null, null, null);
    }

    public static DeclaredField json(String name) {
        return new DeclaredField(name, FieldKind.JSON, null, null, null, false, false, null, null, null);
    }

    public DeclaredField asRequired() {
        return new DeclaredField(name, kind, primitiveType, label, helpText, true, readOnly, nested, child, choices);
    }

    public DeclaredField asReadOnly() {
        return new DeclaredField(name, kind, primitiveType, label, helpText, required, true, nested, child, choices);
    }

    public DeclaredField withLabel(String label) {
        return new DeclaredField(name, kind, primitiveType, label, helpText, required, readOnly, nested, child, choices);
    }

    public DeclaredField withHelpText(CharSequence helpText) {
        return new DeclaredField(name, kind, primitiveType, label, helpText, required, readOnly, nested, child, choices);
    }

    /**
     * Returns the help text as a concrete string, resolving lazy text.
     *
     * @return help text or null
     */
    public String helpTextAsString() {
        return helpText == null ? null : helpText.toString();
    }
}
