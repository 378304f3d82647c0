package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;

import java.util.List;

/**
 * Concatenates the rows of all children. Output columns are those of the first child.
 */
public final class UnionExec extends PhysicalPlan {

    public UnionExec(List<PhysicalPlan> children) {
        super(children);
        if (children.isEmpty()) {
            throw new IllegalArgumentException("union requires at least one child");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNION;
    }

    @Override
    public List<AttributeReference> output() {
        return children.get(0).output();
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        checkArity(newChildren);
        return new UnionExec(newChildren);
    }
}
