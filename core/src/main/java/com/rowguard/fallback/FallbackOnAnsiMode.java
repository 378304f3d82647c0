package com.rowguard.fallback;

import com.rowguard.config.RowguardConfig;
import com.rowguard.plan.PhysicalPlan;

import java.util.Objects;

/**
 * Tags every node when strict ANSI arithmetic is on, which the native backend does not implement.
 */
public final class FallbackOnAnsiMode implements FallbackRule {

    static final String REASON = "does not support ansi mode";

    private final RowguardConfig conf;
    private final FallbackTagStore store;

    public FallbackOnAnsiMode(RowguardConfig conf, FallbackTagStore store) {
        this.conf = Objects.requireNonNull(conf, "conf must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public PhysicalPlan apply(PhysicalPlan plan) {
        if (conf.ansiEnabled()) {
            plan.foreach(node -> store.add(node, REASON));
        }
        return plan;
    }
}
