package com.rowguard.types;

import java.util.Objects;

/**
 * Array of elements of a single type.
 *
 * @param elementType the element type
 * @param containsNull whether elements may be null
 */
public record ArrayType(DataType elementType, boolean containsNull) implements DataType {

    public ArrayType {
        Objects.requireNonNull(elementType, "elementType must not be null");
    }

    public ArrayType(DataType elementType) {
        this(elementType, true);
    }

    @Override
    public String typeName() {
        return "array<" + elementType.typeName() + ">";
    }

    @Override
    public boolean containsMap() {
        return elementType.containsMap();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
