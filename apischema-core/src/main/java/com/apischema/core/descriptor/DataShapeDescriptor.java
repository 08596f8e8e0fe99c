package com.apischema.core.descriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of a structured payload.
 *
 * <p>Descriptors are declared once, usually at startup, and are read-only afterwards.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DataShapeDescriptor user = DataShapeDescriptor.builder("UserSerializer")
 *     .documentation("A registered user.")
 *     .field(DeclaredField.primitive("id", PrimitiveType.INTEGER).asReadOnly())
 *     .field(DeclaredField.primitive("email", PrimitiveType.EMAIL).asRequired())
 *     .errorStatus(404, "User not found")
 *     .build();
 * }</pre>
 *
 * @param name descriptor name
 * @param documentation free documentation text, empty if none
 * @param fields declared fields in order
 * @param errorStatusCodes declared error statuses (status code to description)
 * @param many whether the payload is a list of this shape
 */
public record DataShapeDescriptor(
    String name,
    String documentation,
    List<DeclaredField> fields,
    Map<Integer, String> errorStatusCodes,
    boolean many
) implements ShapeDeclaration {

    /**
     * Compact constructor with validation.
     */
    public DataShapeDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (documentation == null) {
            documentation = "";
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
        errorStatusCodes = errorStatusCodes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(errorStatusCodes));
    }

    /**
     * Starts a new descriptor.
     *
     * @param name descriptor name
     * @return builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Returns a list-shaped variant of this descriptor.
     *
     * @return copy with {@code many = true}
     */
    public DataShapeDescriptor asList() {
        return new DataShapeDescriptor(name, documentation, fields, errorStatusCodes, true);
    }

    @Override
    public boolean isVersioned() {
        return false;
    }

    @Override
    public DataShapeDescriptor resolve(String runtimeVersion) {
        return this;
    }

    /**
     * Builder for {@link DataShapeDescriptor}.
     */
    public static final class Builder {
        private final String name;
        private String documentation = "";
        private final List<DeclaredField> fields = new ArrayList<>();
        private final Map<Integer, String> errorStatusCodes = new LinkedHashMap<>();
        private boolean many;

        private Builder(String name) {
            this.name = name;
        }

        public Builder documentation(String documentation) {
            this.documentation = documentation;
            return this;
        }

        public Builder field(DeclaredField field) {
            fields.add(field);
            return this;
        }

        public Builder fields(List<DeclaredField> fields) {
            this.fields.addAll(fields);
            return this;
        }

        public Builder errorStatus(int statusCode, String description) {
            errorStatusCodes.put(statusCode, description);
            return this;
        }

        public Builder many(boolean many) {
            this.many = many;
            return this;
        }

        public DataShapeDescriptor build() {
            return new DataShapeDescriptor(name, documentation, fields, errorStatusCodes, many);
        }
    }
}
