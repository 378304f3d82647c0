package com.rowguard.plan;

import java.util.List;

/**
 * A node with exactly one child.
 */
public abstract class UnaryExec extends PhysicalPlan {

    protected UnaryExec(PhysicalPlan child) {
        super(child);
    }

    /**
     * Returns the child node.
     *
     * @return the child
     */
    public PhysicalPlan child() {
        return children.get(0);
    }

    /**
     * Returns a copy of this node over a different child.
     *
     * @param newChild the replacement child
     * @return the copy
     */
    protected abstract UnaryExec withNewChild(PhysicalPlan newChild);

    @Override
    public final PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        checkArity(newChildren);
        return withNewChild(newChildren.get(0));
    }
}
