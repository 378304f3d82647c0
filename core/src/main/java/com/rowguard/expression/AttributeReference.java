package com.rowguard.expression;

import com.rowguard.types.DataType;
import com.rowguard.types.StructField;
import com.rowguard.types.StructType;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A named, typed column produced by a plan node.
 *
 * <p>Two attributes are the same column when they share an expression id, regardless of
 * name. Output attribute sets are compared by id, so renaming a column does not change
 * the set while recreating it does.
 */
public final class AttributeReference implements Expression {

    private static final AtomicLong NEXT_EXPR_ID = new AtomicLong();

    private final String name;
    private final DataType dataType;
    private final boolean nullable;
    private final long exprId;

    /**
     * Creates an attribute with an explicit expression id.
     *
     * @param name the column name
     * @param dataType the column type
     * @param nullable whether the column is nullable
     * @param exprId the expression id identifying the column
     */
    public AttributeReference(String name, DataType dataType, boolean nullable, long exprId) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
        this.exprId = exprId;
    }

    /**
     * Creates an attribute with a freshly allocated expression id.
     *
     * @param name the column name
     * @param dataType the column type
     * @param nullable whether the column is nullable
     */
    public AttributeReference(String name, DataType dataType, boolean nullable) {
        this(name, dataType, nullable, newExprId());
    }

    /**
     * Creates a nullable attribute with a freshly allocated expression id.
     *
     * @param name the column name
     * @param dataType the column type
     */
    public AttributeReference(String name, DataType dataType) {
        this(name, dataType, true);
    }

    /**
     * Allocates a new, process-unique expression id.
     *
     * @return the id
     */
    public static long newExprId() {
        return NEXT_EXPR_ID.incrementAndGet();
    }

    /**
     * Creates one fresh attribute per field of a schema.
     *
     * @param schema the schema
     * @return the attributes, in field order
     */
    public static List<AttributeReference> fromSchema(StructType schema) {
        return schema.fields().stream()
            .map(AttributeReference::fromField)
            .toList();
    }

    private static AttributeReference fromField(StructField field) {
        return new AttributeReference(field.name(), field.dataType(), field.nullable());
    }

    public String name() {
        return name;
    }

    public long exprId() {
        return exprId;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String prettyName() {
        return "attribute";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeReference)) return false;
        AttributeReference that = (AttributeReference) o;
        return exprId == that.exprId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(exprId);
    }

    @Override
    public String toString() {
        return name + "#" + exprId;
    }
}
