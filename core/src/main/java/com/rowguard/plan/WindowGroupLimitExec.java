package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;
import com.rowguard.expression.SortOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the first {@code limit} rows of each window partition, ranked by a rank-like
 * function ({@code row_number}, {@code rank}, {@code dense_rank}).
 */
public final class WindowGroupLimitExec extends UnaryExec {

    /**
     * Whether the limit is applied before or after the shuffle.
     */
    public enum Mode {
        PARTIAL,
        FINAL
    }

    private final List<Expression> partitionSpec;
    private final List<SortOrder> orderSpec;
    private final String rankFunction;
    private final int limit;
    private final Mode mode;

    public WindowGroupLimitExec(List<Expression> partitionSpec, List<SortOrder> orderSpec, String rankFunction,
                                int limit, Mode mode, PhysicalPlan child) {
        super(child);
        this.partitionSpec = List.copyOf(partitionSpec);
        this.orderSpec = List.copyOf(orderSpec);
        this.rankFunction = Objects.requireNonNull(rankFunction, "rankFunction must not be null");
        this.limit = limit;
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public List<Expression> partitionSpec() {
        return partitionSpec;
    }

    public List<SortOrder> orderSpec() {
        return orderSpec;
    }

    public String rankFunction() {
        return rankFunction;
    }

    public int limit() {
        return limit;
    }

    public Mode mode() {
        return mode;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WINDOW_GROUP_LIMIT;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(partitionSpec);
        all.addAll(orderSpec);
        return all;
    }

    @Override
    protected WindowGroupLimitExec withNewChild(PhysicalPlan newChild) {
        return new WindowGroupLimitExec(partitionSpec, orderSpec, rankFunction, limit, mode, newChild);
    }

    @Override
    public String toString() {
        return String.format("WindowGroupLimit %s, %s, %s, %d, %s", partitionSpec, orderSpec, rankFunction,
            limit, mode);
    }
}
