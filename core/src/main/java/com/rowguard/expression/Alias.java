package com.rowguard.expression;

import com.rowguard.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * Names a computed expression so it can appear in a node's output.
 *
 * <p>The alias owns an expression id; {@link #toAttribute()} returns the column it
 * produces.
 */
public final class Alias implements Expression {

    private final Expression child;
    private final String name;
    private final long exprId;

    public Alias(Expression child, String name) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.exprId = AttributeReference.newExprId();
    }

    public Expression child() {
        return child;
    }

    public String name() {
        return name;
    }

    /**
     * Returns the output column produced by this alias.
     *
     * @return the attribute, stable across calls
     */
    public AttributeReference toAttribute() {
        return new AttributeReference(name, child.dataType(), child.nullable(), exprId);
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
        return "alias";
    }

    @Override
    public String toString() {
        return child + " AS " + name + "#" + exprId;
    }
}
