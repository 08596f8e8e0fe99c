package com.apischema.core.version;

import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.ShapeDeclaration;

import java.util.Objects;

/**
 * A family of alternative descriptors selected by API version.
 *
 * @param name family name
 * @param documentation documentation of the family as a whole, empty if none
 * @param versions alternatives in priority order
 */
public record VersionedShape(
    String name,
    String documentation,
    VersionMap versions
) implements ShapeDeclaration {

    /**
     * Compact constructor with validation.
     */
    public VersionedShape {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(versions, "versions must not be null");
        if (documentation == null) {
            documentation = "";
        }
    }

    @Override
    public boolean isVersioned() {
        return true;
    }

    @Override
    public DataShapeDescriptor resolve(String runtimeVersion) {
        return VersionResolver.resolve(versions, runtimeVersion);
    }
}
