package com.rowguard.plan;

import com.rowguard.expression.Alias;
import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;
import com.rowguard.expression.SortOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates window functions over partitions of its child's rows.
 *
 * <p>Output is the child's output followed by one attribute per window expression.
 */
public final class WindowExec extends UnaryExec {

    private final List<Alias> windowExpressions;
    private final List<Expression> partitionSpec;
    private final List<SortOrder> orderSpec;

    public WindowExec(List<Alias> windowExpressions, List<Expression> partitionSpec,
                      List<SortOrder> orderSpec, PhysicalPlan child) {
        super(child);
        this.windowExpressions = List.copyOf(windowExpressions);
        this.partitionSpec = List.copyOf(partitionSpec);
        this.orderSpec = List.copyOf(orderSpec);
    }

    public List<Alias> windowExpressions() {
        return windowExpressions;
    }

    public List<Expression> partitionSpec() {
        return partitionSpec;
    }

    public List<SortOrder> orderSpec() {
        return orderSpec;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WINDOW;
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> fields = new ArrayList<>(child().output());
        for (Alias alias : windowExpressions) {
            fields.add(alias.toAttribute());
        }
        return fields;
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(windowExpressions);
        all.addAll(partitionSpec);
        all.addAll(orderSpec);
        return all;
    }

    @Override
    protected WindowExec withNewChild(PhysicalPlan newChild) {
        return new WindowExec(windowExpressions, partitionSpec, orderSpec, newChild);
    }

    @Override
    public String toString() {
        return "Window " + windowExpressions + ", partitionBy=" + partitionSpec + ", orderBy=" + orderSpec;
    }
}
