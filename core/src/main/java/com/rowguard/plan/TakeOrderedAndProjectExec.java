package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;
import com.rowguard.expression.SortOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-N: sorts, keeps the first {@code limit} rows after {@code offset}, then projects.
 */
public final class TakeOrderedAndProjectExec extends UnaryExec {

    private final int limit;
    private final int offset;
    private final List<SortOrder> sortOrder;
    private final List<Expression> projectList;

    public TakeOrderedAndProjectExec(int limit, int offset, List<SortOrder> sortOrder,
                                     List<Expression> projectList, PhysicalPlan child) {
        super(child);
        this.limit = limit;
        this.offset = offset;
        this.sortOrder = List.copyOf(sortOrder);
        this.projectList = List.copyOf(projectList);
    }

    public int limit() {
        return limit;
    }

    public int offset() {
        return offset;
    }

    public List<SortOrder> sortOrder() {
        return sortOrder;
    }

    public List<Expression> projectList() {
        return projectList;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TAKE_ORDERED_AND_PROJECT;
    }

    @Override
    public List<AttributeReference> output() {
        return ProjectExec.toAttributes(projectList);
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(sortOrder);
        all.addAll(projectList);
        return all;
    }

    @Override
    protected TakeOrderedAndProjectExec withNewChild(PhysicalPlan newChild) {
        return new TakeOrderedAndProjectExec(limit, offset, sortOrder, projectList, newChild);
    }

    @Override
    public String toString() {
        return String.format("TakeOrderedAndProject limit=%d, offset=%d, orderBy=%s, output=%s",
            limit, offset, sortOrder, projectList);
    }
}
