package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Physical aggregation. Three strategies share this class: hash, sort and object-hash
 * aggregation.
 *
 * <p>Grouping expressions are attributes or aliases; aggregate expressions are aliases over
 * aggregate function calls such as {@code sum(amount) AS total}. The output is the
 * grouping columns followed by the aggregate results.
 */
public final class AggregateExec extends UnaryExec {

    private final NodeKind kind;
    private final List<Expression> groupingExpressions;
    private final List<Expression> aggregateExpressions;

    public AggregateExec(NodeKind kind, List<Expression> groupingExpressions,
                         List<Expression> aggregateExpressions, PhysicalPlan child) {
        super(child);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (!kind.isAggregate()) {
            throw new IllegalArgumentException("Not an aggregate kind: " + kind);
        }
        this.groupingExpressions = List.copyOf(groupingExpressions);
        this.aggregateExpressions = List.copyOf(aggregateExpressions);
    }

    public static AggregateExec hash(List<Expression> grouping, List<Expression> aggregates, PhysicalPlan child) {
        return new AggregateExec(NodeKind.HASH_AGGREGATE, grouping, aggregates, child);
    }

    public List<Expression> groupingExpressions() {
        return groupingExpressions;
    }

    public List<Expression> aggregateExpressions() {
        return aggregateExpressions;
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> out = new ArrayList<>(ProjectExec.toAttributes(groupingExpressions));
        out.addAll(ProjectExec.toAttributes(aggregateExpressions));
        return out;
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(groupingExpressions);
        all.addAll(aggregateExpressions);
        return all;
    }

    @Override
    protected AggregateExec withNewChild(PhysicalPlan newChild) {
        return new AggregateExec(kind, groupingExpressions, aggregateExpressions, newChild);
    }

    @Override
    public String toString() {
        return String.format("%s(keys=%s, functions=%s)", nodeName(), groupingExpressions, aggregateExpressions);
    }
}
