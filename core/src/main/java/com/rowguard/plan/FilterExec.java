package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;

import java.util.List;
import java.util.Objects;

/**
 * Physical filter: keeps the rows of its child for which the condition holds.
 */
public final class FilterExec extends UnaryExec {

    private final Expression condition;

    public FilterExec(Expression condition, PhysicalPlan child) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public Expression condition() {
        return condition;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FILTER;
    }

    @Override
    public List<AttributeReference> output() {
        // Filter doesn't change the schema
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        return List.of(condition);
    }

    @Override
    protected FilterExec withNewChild(PhysicalPlan newChild) {
        return new FilterExec(condition, newChild);
    }

    @Override
    public String toString() {
        return "Filter " + condition;
    }
}
