package com.apischema.core.descriptor;

/**
 * Scalar types a {@link FieldKind#PRIMITIVE} field may carry.
 */
public enum PrimitiveType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    URL,
    EMAIL,
    UUID,
    DATE,
    DATETIME,
    CHOICE
}
