package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;

import java.util.List;

/**
 * Reduces the number of partitions without a shuffle.
 */
public final class CoalesceExec extends UnaryExec {

    private final int numPartitions;

    public CoalesceExec(int numPartitions, PhysicalPlan child) {
        super(child);
        this.numPartitions = numPartitions;
    }

    public int numPartitions() {
        return numPartitions;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COALESCE;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    protected CoalesceExec withNewChild(PhysicalPlan newChild) {
        return new CoalesceExec(numPartitions, newChild);
    }

    @Override
    public String toString() {
        return "Coalesce " + numPartitions;
    }
}
