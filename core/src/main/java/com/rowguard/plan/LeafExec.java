package com.rowguard.plan;

import java.util.List;

/**
 * A node without children.
 */
public abstract class LeafExec extends PhysicalPlan {

    protected LeafExec() {
        super();
    }

    @Override
    public final PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        checkArity(newChildren);
        return this;
    }
}
