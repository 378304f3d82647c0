package com.rowguard.fallback;

import com.rowguard.plan.PhysicalPlan;

import java.util.Objects;

/**
 * Outcome of one pipeline run: the (possibly restructured) tree and its tags.
 *
 * @param plan the tree after all structural fixups
 * @param tags the tags of the run
 */
public record FallbackResult(PhysicalPlan plan, FallbackTagStore tags) {

    public FallbackResult {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(tags, "tags must not be null");
    }

    public boolean isOffloadable(PhysicalPlan node) {
        return tags.maybeOffloadable(node);
    }

    public FallbackReport report() {
        return FallbackReport.of(plan, tags);
    }
}
