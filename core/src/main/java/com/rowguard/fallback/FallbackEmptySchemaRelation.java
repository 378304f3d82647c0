package com.rowguard.fallback;

import com.rowguard.backend.BackendSettings;
import com.rowguard.plan.NodeKind;
import com.rowguard.plan.PhysicalPlan;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

/**
 * Tags nodes that would receive zero-column input, for backends that cannot handle it.
 *
 * <p>The node and each of its empty-output children are tagged, except write-files
 * children, which never produce columns. Each node gets the reason at most once per run.
 */
public final class FallbackEmptySchemaRelation implements FallbackRule {

    static final String REASON = "at least one of its children has empty output";

    private final BackendSettings backend;
    private final FallbackTagStore store;

    public FallbackEmptySchemaRelation(BackendSettings backend, FallbackTagStore store) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public PhysicalPlan apply(PhysicalPlan plan) {
        Set<PhysicalPlan> tagged = Collections.newSetFromMap(new IdentityHashMap<>());
        plan.foreach(node -> tagIfChildHasEmptyOutput(node, tagged));
        return plan;
    }

    private void tagIfChildHasEmptyOutput(PhysicalPlan node, Set<PhysicalPlan> tagged) {
        if (!backend.fallbackOnEmptySchema(node)) {
            return;
        }
        if (node.children().stream().noneMatch(child -> child.output().isEmpty())) {
            return;
        }
        if (tagged.add(node)) {
            store.add(node, REASON);
        }
        for (PhysicalPlan child : node.children()) {
            if (child.output().isEmpty() && child.kind() != NodeKind.WRITE_FILES && tagged.add(child)) {
                store.add(child, REASON);
            }
        }
    }
}
