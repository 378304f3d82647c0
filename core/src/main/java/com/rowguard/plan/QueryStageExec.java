package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;

import java.util.List;
import java.util.Objects;

/**
 * A materialized adaptive-execution stage.
 *
 * <p>The wrapped plan has already been planned and executed independently, so it is not
 * a child: traversals stop here and fallback rules never tag it.
 */
public final class QueryStageExec extends LeafExec {

    private final int stageId;
    private final PhysicalPlan plan;

    public QueryStageExec(int stageId, PhysicalPlan plan) {
        this.stageId = stageId;
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
    }

    public int stageId() {
        return stageId;
    }

    public PhysicalPlan plan() {
        return plan;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.QUERY_STAGE;
    }

    @Override
    public List<AttributeReference> output() {
        return plan.output();
    }

    @Override
    public String toString() {
        return "QueryStage " + stageId;
    }
}
