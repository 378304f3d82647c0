package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;

import java.util.List;

/**
 * Reads shuffle output of a materialized query stage with adaptive partition specs
 * (coalesced, split for skew, or local reads).
 */
public final class AQEShuffleReadExec extends UnaryExec {

    private final int numPartitionSpecs;

    public AQEShuffleReadExec(int numPartitionSpecs, PhysicalPlan child) {
        super(child);
        this.numPartitionSpecs = numPartitionSpecs;
    }

    public int numPartitionSpecs() {
        return numPartitionSpecs;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AQE_SHUFFLE_READ;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    protected AQEShuffleReadExec withNewChild(PhysicalPlan newChild) {
        return new AQEShuffleReadExec(numPartitionSpecs, newChild);
    }

    @Override
    public String toString() {
        return "AQEShuffleRead " + numPartitionSpecs;
    }
}
