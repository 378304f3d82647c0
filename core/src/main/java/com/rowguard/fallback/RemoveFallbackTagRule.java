package com.rowguard.fallback;

import com.rowguard.plan.PhysicalPlan;

import java.util.Objects;

/**
 * Removes every tag from the tree, so that the pipeline can run again from scratch.
 */
public final class RemoveFallbackTagRule implements FallbackRule {

    private final FallbackTagStore store;

    public RemoveFallbackTagRule(FallbackTagStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public PhysicalPlan apply(PhysicalPlan plan) {
        plan.foreach(store::untag);
        return plan;
    }
}
