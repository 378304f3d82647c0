package com.rowguard.types;

import java.util.Objects;

/**
 * One column of a {@link StructType}. Columns are nullable unless declared otherwise.
 */
public record StructField(String name, DataType dataType, boolean nullable) {

    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public StructField(String name, DataType dataType) {
        this(name, dataType, true);
    }

    /** Renders the column the way the DDL schema form spells it, e.g. {@code id:bigint}. */
    @Override
    public String toString() {
        return name + ":" + dataType.typeName();
    }
}
