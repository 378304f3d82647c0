package com.rowguard.fallback;

import com.rowguard.config.RowguardConfig;
import com.rowguard.expression.AttributeReference;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.plan.RDDScanExec;
import com.rowguard.plan.UnaryExec;
import com.rowguard.types.PrimitiveType;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Gives single-row relations a placeholder column so that their parents do not read an
 * empty schema.
 *
 * <p>A unary node over a {@code OneRowRelation} scan whose output differs from the scan's
 * gets a fresh scan with a single {@code fake_column} string column. Rewritten nodes and
 * their rebuilt ancestors keep the tags of the nodes they replace.
 */
public final class PlanOneRowRelation implements FallbackRule {

    static final String FAKE_COLUMN = "fake_column";

    private final RowguardConfig conf;
    private final FallbackTagStore store;

    public PlanOneRowRelation(RowguardConfig conf, FallbackTagStore store) {
        this.conf = Objects.requireNonNull(conf, "conf must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public PhysicalPlan apply(PhysicalPlan plan) {
        if (!conf.oneRowRelationEnabled()) {
            return plan;
        }
        return transformDown(plan, new IdentityHashMap<>());
    }

    private PhysicalPlan transformDown(PhysicalPlan node, Map<PhysicalPlan, PhysicalPlan> done) {
        PhysicalPlan cached = done.get(node);
        if (cached != null) {
            return cached;
        }
        PhysicalPlan current = node;
        if (needsFakeSchema(node)) {
            RDDScanExec fake = new RDDScanExec(
                List.of(new AttributeReference(FAKE_COLUMN, PrimitiveType.STRING)), RDDScanExec.ONE_ROW_RELATION);
            current = replace(node, node.withNewChildren(List.of(fake)));
        }

        List<PhysicalPlan> newChildren = new ArrayList<>(current.children().size());
        boolean changed = false;
        for (PhysicalPlan child : current.children()) {
            PhysicalPlan newChild = transformDown(child, done);
            changed |= newChild != child;
            newChildren.add(newChild);
        }
        if (changed) {
            current = replace(current, current.withNewChildren(newChildren));
        }
        done.put(node, current);
        return current;
    }

    private static boolean needsFakeSchema(PhysicalPlan node) {
        if (!(node instanceof UnaryExec unary)) {
            return false;
        }
        return unary.child() instanceof RDDScanExec scan
            && scan.isOneRowRelation()
            && !unary.outputSet().equals(scan.outputSet());
    }

    private PhysicalPlan replace(PhysicalPlan oldNode, PhysicalPlan newNode) {
        store.transfer(oldNode, newNode);
        return newNode;
    }
}
