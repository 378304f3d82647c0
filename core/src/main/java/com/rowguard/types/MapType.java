package com.rowguard.types;

import java.util.Objects;

/**
 * Map from keys of one type to values of another.
 *
 * @param keyType the key type
 * @param valueType the value type
 */
public record MapType(DataType keyType, DataType valueType) implements DataType {

    public MapType {
        Objects.requireNonNull(keyType, "keyType must not be null");
        Objects.requireNonNull(valueType, "valueType must not be null");
    }

    @Override
    public String typeName() {
        return "map<" + keyType.typeName() + "," + valueType.typeName() + ">";
    }

    @Override
    public boolean containsMap() {
        return true;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
