package com.rowguard.types;

/**
 * Atomic, parameterless data types.
 */
public enum PrimitiveType implements DataType {
    BOOLEAN("boolean"),
    BYTE("byte"),
    SHORT("short"),
    INTEGER("integer"),
    LONG("long"),
    FLOAT("float"),
    DOUBLE("double"),
    STRING("string"),
    BINARY("binary"),
    DATE("date"),
    TIMESTAMP("timestamp"),
    NULL("null");

    private final String typeName;

    PrimitiveType(String typeName) {
        this.typeName = typeName;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    /**
     * Returns whether values of this type are numbers.
     *
     * @return true for integral and floating point types
     */
    public boolean isNumeric() {
        return this == BYTE || this == SHORT || this == INTEGER || this == LONG
            || this == FLOAT || this == DOUBLE;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
