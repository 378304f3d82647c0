package com.rowguard.types;

/**
 * Sealed interface for the data types carried by plan output attributes and expressions.
 *
 * <p>The type system mirrors the engine's type hierarchy closely enough for offload checks:
 * a native backend decides per type whether it can read, shuffle, sort or group by a
 * column.
 *
 * <ul>
 *   <li>Atomic types: {@link PrimitiveType}, {@link DecimalType}</li>
 *   <li>Complex types: {@link ArrayType}, {@link MapType}, {@link StructType}</li>
 * </ul>
 */
public sealed interface DataType
    permits PrimitiveType, DecimalType, ArrayType, MapType, StructType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns whether this type, or any type nested in it, is a map.
     *
     * <p>Map-typed values cannot be used as grouping, join, sort or partitioning keys.
     *
     * @return true if a map type occurs anywhere in this type
     */
    default boolean containsMap() {
        return false;
    }
}
