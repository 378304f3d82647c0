package com.rowguard.expression;

import com.rowguard.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * A sort key: the ordered expression plus direction and null placement.
 *
 * @param child the expression being ordered
 * @param ascending whether the order is ascending
 * @param nullsFirst whether nulls sort before non-null values
 */
public record SortOrder(Expression child, boolean ascending, boolean nullsFirst) implements Expression {

    public SortOrder {
        Objects.requireNonNull(child, "child must not be null");
    }

    public static SortOrder asc(Expression child) {
        return new SortOrder(child, true, true);
    }

    public static SortOrder desc(Expression child) {
        return new SortOrder(child, false, false);
    }

    @Override
    public DataType dataType() {
        return child.dataType();
    }

    @Override
    public boolean nullable() {
        return child.nullable();
    }

    @Override
    public List<Expression> children() {
        return List.of(child);
    }

    @Override
    public String prettyName() {
        return "sortorder";
    }
}
