package com.apischema.core.descriptor;

/**
 * Kinds of declared fields.
 *
 * <p>The set is closed; schema derivation switches over it exhaustively.
 */
public enum FieldKind {
    /** Scalar value, see {@link PrimitiveType} */
    PRIMITIVE,

    /** Homogeneous list of a child field */
    LIST,

    /** Nested data-shape descriptor */
    NESTED,

    /** Server-populated field never exposed to clients */
    HIDDEN,

    /** Free-form mapping of string keys to values */
    DICT,

    /** Free-form JSON document */
    JSON
}
