package com.apischema.core.descriptor;

/**
 * Something a route can declare as its request or response shape: either a concrete
 * {@link DataShapeDescriptor} or a family of alternatives selected by API version.
 */
public interface ShapeDeclaration {

    /**
     * Returns the declaration name used in logs and error messages.
     *
     * @return name
     */
    String name();

    /**
     * Returns the documentation attached to the declaration itself.
     *
     * @return documentation, empty if none
     */
    String documentation();

    /**
     * Returns whether the concrete descriptor depends on the requested version.
     *
     * @return true for version-mapped families
     */
    boolean isVersioned();

    /**
     * Returns the concrete descriptor for the given runtime version.
     *
     * @param runtimeVersion requested API version
     * @return descriptor to document
     */
    DataShapeDescriptor resolve(String runtimeVersion);
}
