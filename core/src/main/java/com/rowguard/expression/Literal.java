package com.rowguard.expression;

import com.rowguard.types.DataType;
import com.rowguard.types.PrimitiveType;

import java.util.List;
import java.util.Objects;

/**
 * A constant. A null {@code value} is a typed SQL NULL.
 */
public record Literal(Object value, DataType dataType) implements Expression {

    public Literal {
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public static Literal of(int value) {
        return new Literal(value, PrimitiveType.INTEGER);
    }

    public static Literal of(long value) {
        return new Literal(value, PrimitiveType.LONG);
    }

    public static Literal of(double value) {
        return new Literal(value, PrimitiveType.DOUBLE);
    }

    public static Literal of(String value) {
        return new Literal(value, PrimitiveType.STRING);
    }

    public static Literal of(boolean value) {
        return new Literal(value, PrimitiveType.BOOLEAN);
    }

    public static Literal nullOf(DataType dataType) {
        return new Literal(null, dataType);
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public String prettyName() {
        return "literal";
    }

    @Override
    public String toString() {
        return value == null ? "null" : value.toString();
    }
}
