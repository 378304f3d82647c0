package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;

import java.util.List;

/**
 * Keeps the rows whose per-row random draw falls in {@code [lowerBound, upperBound)}.
 */
public final class SampleExec extends UnaryExec {

    private final double lowerBound;
    private final double upperBound;
    private final boolean withReplacement;
    private final long seed;

    public SampleExec(double lowerBound, double upperBound, boolean withReplacement, long seed,
                      PhysicalPlan child) {
        super(child);
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.withReplacement = withReplacement;
        this.seed = seed;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public double upperBound() {
        return upperBound;
    }

    public boolean withReplacement() {
        return withReplacement;
    }

    public long seed() {
        return seed;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SAMPLE;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    protected SampleExec withNewChild(PhysicalPlan newChild) {
        return new SampleExec(lowerBound, upperBound, withReplacement, seed, newChild);
    }

    @Override
    public String toString() {
        return String.format("Sample %s, %s, %s, %d", lowerBound, upperBound, withReplacement, seed);
    }
}
