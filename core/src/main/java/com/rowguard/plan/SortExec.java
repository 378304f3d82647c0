package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;
import com.rowguard.expression.SortOrder;

import java.util.List;

/**
 * Sorts rows within each partition, or globally when {@code global} is set.
 */
public final class SortExec extends UnaryExec {

    private final List<SortOrder> sortOrder;
    private final boolean global;

    public SortExec(List<SortOrder> sortOrder, boolean global, PhysicalPlan child) {
        super(child);
        this.sortOrder = List.copyOf(sortOrder);
        this.global = global;
    }

    public List<SortOrder> sortOrder() {
        return sortOrder;
    }

    public boolean global() {
        return global;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SORT;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        return List.copyOf(sortOrder);
    }

    @Override
    protected SortExec withNewChild(PhysicalPlan newChild) {
        return new SortExec(sortOrder, global, newChild);
    }

    @Override
    public String toString() {
        return "Sort " + sortOrder + ", global=" + global;
    }
}
