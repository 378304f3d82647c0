package com.rowguard.fallback;

import com.rowguard.plan.PhysicalPlan;

/**
 * One pass of the fallback pipeline over a whole plan tree.
 *
 * <p>Rules record their decisions in the {@link FallbackTagStore} they were built with
 * and return the (possibly restructured) tree.
 */
@FunctionalInterface
public interface FallbackRule {

    PhysicalPlan apply(PhysicalPlan plan);

    default String ruleName() {
        return getClass().getSimpleName();
    }
}
