package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;

import java.util.List;
import java.util.Objects;

/**
 * Redistributes rows between stages according to a {@link Partitioning}.
 */
public final class ShuffleExchangeExec extends UnaryExec {

    private final Partitioning partitioning;

    public ShuffleExchangeExec(Partitioning partitioning, PhysicalPlan child) {
        super(child);
        this.partitioning = Objects.requireNonNull(partitioning, "partitioning must not be null");
    }

    public Partitioning partitioning() {
        return partitioning;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SHUFFLE_EXCHANGE;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        return partitioning.keys();
    }

    @Override
    protected ShuffleExchangeExec withNewChild(PhysicalPlan newChild) {
        return new ShuffleExchangeExec(partitioning, newChild);
    }

    @Override
    public String toString() {
        return String.format("Exchange %s(%s, %d)", partitioning.scheme(), partitioning.keys(),
            partitioning.numPartitions());
    }
}
