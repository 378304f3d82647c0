package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;
import com.rowguard.types.PrimitiveType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Physical join of two relations.
 *
 * <p>Five strategies share this class:
 * <ul>
 *   <li>{@link NodeKind#SHUFFLED_HASH_JOIN} - equi-join, both sides shuffled, one side built into a hash table</li>
 *   <li>{@link NodeKind#BROADCAST_HASH_JOIN} - equi-join against a broadcast hash relation</li>
 *   <li>{@link NodeKind#SORT_MERGE_JOIN} - equi-join over sorted inputs</li>
 *   <li>{@link NodeKind#CARTESIAN_PRODUCT} - inner join without keys</li>
 *   <li>{@link NodeKind#BROADCAST_NESTED_LOOP_JOIN} - any join type against a broadcast side, without keys</li>
 * </ul>
 *
 * <p>Equi-join strategies carry pairwise left/right keys. All strategies may carry an
 * extra non-equi condition.
 */
public final class JoinExec extends PhysicalPlan {

    /**
     * Join semantics.
     */
    public enum JoinType {
        INNER,
        LEFT_OUTER,
        RIGHT_OUTER,
        FULL_OUTER,
        LEFT_SEMI,
        LEFT_ANTI,
        /** Left rows plus a boolean column telling whether a match exists. */
        EXISTENCE,
        CROSS
    }

    public enum BuildSide {
        LEFT,
        RIGHT
    }

    private final NodeKind kind;
    private final List<Expression> leftKeys;
    private final List<Expression> rightKeys;
    private final JoinType joinType;
    private final Optional<BuildSide> buildSide;
    private final Optional<Expression> condition;
    private final boolean skewJoin;
    private final boolean nullAwareAntiJoin;
    private final long existsId = AttributeReference.newExprId();

    /**
     * Creates a join node.
     *
     * @param kind one of the join kinds
     * @param leftKeys equi-join keys of the left side
     * @param rightKeys equi-join keys of the right side, pairwise with {@code leftKeys}
     * @param joinType the join semantics
     * @param buildSide the side built into a hash table or broadcast, if any
     * @param condition the extra join condition, if any
     * @param left the left relation
     * @param right the right relation
     * @param skewJoin whether the planner split skewed partitions of this join
     * @param nullAwareAntiJoin whether this is a null-aware anti join ({@code NOT IN} subquery)
     */
    public JoinExec(NodeKind kind, List<Expression> leftKeys, List<Expression> rightKeys, JoinType joinType,
                    Optional<BuildSide> buildSide, Optional<Expression> condition,
                    PhysicalPlan left, PhysicalPlan right, boolean skewJoin, boolean nullAwareAntiJoin) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (!kind.isJoin()) {
            throw new IllegalArgumentException("Not a join kind: " + kind);
        }
        this.leftKeys = List.copyOf(leftKeys);
        this.rightKeys = List.copyOf(rightKeys);
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.buildSide = Objects.requireNonNull(buildSide, "buildSide must not be null");
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.skewJoin = skewJoin;
        this.nullAwareAntiJoin = nullAwareAntiJoin;
    }

    public static JoinExec shuffledHashJoin(List<Expression> leftKeys, List<Expression> rightKeys,
                                            JoinType joinType, BuildSide buildSide,
                                            PhysicalPlan left, PhysicalPlan right) {
        return new JoinExec(NodeKind.SHUFFLED_HASH_JOIN, leftKeys, rightKeys, joinType,
            Optional.of(buildSide), Optional.empty(), left, right, false, false);
    }

    public static JoinExec broadcastHashJoin(List<Expression> leftKeys, List<Expression> rightKeys,
                                             JoinType joinType, BuildSide buildSide,
                                             PhysicalPlan left, PhysicalPlan right) {
        return new JoinExec(NodeKind.BROADCAST_HASH_JOIN, leftKeys, rightKeys, joinType,
            Optional.of(buildSide), Optional.empty(), left, right, false, false);
    }

    public static JoinExec sortMergeJoin(List<Expression> leftKeys, List<Expression> rightKeys,
                                         JoinType joinType, PhysicalPlan left, PhysicalPlan right) {
        return new JoinExec(NodeKind.SORT_MERGE_JOIN, leftKeys, rightKeys, joinType,
            Optional.empty(), Optional.empty(), left, right, false, false);
    }

    public static JoinExec cartesianProduct(Optional<Expression> condition, PhysicalPlan left, PhysicalPlan right) {
        return new JoinExec(NodeKind.CARTESIAN_PRODUCT, List.of(), List.of(), JoinType.INNER,
            Optional.empty(), condition, left, right, false, false);
    }

    public static JoinExec broadcastNestedLoopJoin(JoinType joinType, BuildSide buildSide,
                                                   Optional<Expression> condition,
                                                   PhysicalPlan left, PhysicalPlan right) {
        return new JoinExec(NodeKind.BROADCAST_NESTED_LOOP_JOIN, List.of(), List.of(), joinType,
            Optional.of(buildSide), condition, left, right, false, false);
    }

    /**
     * Returns a copy of this join with a different extra condition.
     *
     * @param newCondition the condition
     * @return the copy
     */
    public JoinExec withCondition(Expression newCondition) {
        return new JoinExec(kind, leftKeys, rightKeys, joinType, buildSide, Optional.of(newCondition),
            left(), right(), skewJoin, nullAwareAntiJoin);
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    public PhysicalPlan left() {
        return children.get(0);
    }

    public PhysicalPlan right() {
        return children.get(1);
    }

    public List<Expression> leftKeys() {
        return leftKeys;
    }

    public List<Expression> rightKeys() {
        return rightKeys;
    }

    public JoinType joinType() {
        return joinType;
    }

    public Optional<BuildSide> buildSide() {
        return buildSide;
    }

    public Optional<Expression> condition() {
        return condition;
    }

    public boolean isSkewJoin() {
        return skewJoin;
    }

    public boolean isNullAwareAntiJoin() {
        return nullAwareAntiJoin;
    }

    @Override
    public List<AttributeReference> output() {
        switch (joinType) {
            case LEFT_SEMI:
            case LEFT_ANTI:
                return left().output();
            case EXISTENCE:
                List<AttributeReference> withExists = new ArrayList<>(left().output());
                withExists.add(new AttributeReference("exists", PrimitiveType.BOOLEAN, false, existsId));
                return withExists;
            default:
                List<AttributeReference> fields = new ArrayList<>(left().output());
                fields.addAll(right().output());
                return fields;
        }
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(leftKeys);
        all.addAll(rightKeys);
        condition.ifPresent(all::add);
        return all;
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        checkArity(newChildren);
        return new JoinExec(kind, leftKeys, rightKeys, joinType, buildSide, condition,
            newChildren.get(0), newChildren.get(1), skewJoin, nullAwareAntiJoin);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s, %s%s", nodeName(), leftKeys, rightKeys, joinType,
            condition.map(c -> ", " + c).orElse(""));
    }
}
