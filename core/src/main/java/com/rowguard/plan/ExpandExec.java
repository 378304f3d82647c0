package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;

import java.util.List;

/**
 * Emits one output row per projection for every input row (grouping sets, rollup, cube).
 */
public final class ExpandExec extends UnaryExec {

    private final List<List<Expression>> projections;
    private final List<AttributeReference> output;

    public ExpandExec(List<List<Expression>> projections, List<AttributeReference> output, PhysicalPlan child) {
        super(child);
        this.projections = projections.stream().map(List::copyOf).toList();
        this.output = List.copyOf(output);
    }

    public List<List<Expression>> projections() {
        return projections;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPAND;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public List<Expression> expressions() {
        return projections.stream().flatMap(List::stream).toList();
    }

    @Override
    protected ExpandExec withNewChild(PhysicalPlan newChild) {
        return new ExpandExec(projections, output, newChild);
    }
}
