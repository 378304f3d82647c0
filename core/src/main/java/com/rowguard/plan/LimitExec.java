package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;

import java.util.List;
import java.util.Objects;

/**
 * Returns at most {@code limit} rows, optionally skipping {@code offset} rows first.
 *
 * <p>A local limit applies per partition; a global limit applies to the whole result
 * and is the only kind that carries an offset.
 */
public final class LimitExec extends UnaryExec {

    private final NodeKind kind;
    private final int limit;
    private final int offset;

    public LimitExec(NodeKind kind, int limit, int offset, PhysicalPlan child) {
        super(child);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (kind != NodeKind.GLOBAL_LIMIT && kind != NodeKind.LOCAL_LIMIT) {
            throw new IllegalArgumentException("Not a limit kind: " + kind);
        }
        if (kind == NodeKind.LOCAL_LIMIT && offset != 0) {
            throw new IllegalArgumentException("local limit has no offset");
        }
        this.limit = limit;
        this.offset = offset;
    }

    public static LimitExec global(int limit, PhysicalPlan child) {
        return new LimitExec(NodeKind.GLOBAL_LIMIT, limit, 0, child);
    }

    public static LimitExec local(int limit, PhysicalPlan child) {
        return new LimitExec(NodeKind.LOCAL_LIMIT, limit, 0, child);
    }

    public int limit() {
        return limit;
    }

    public int offset() {
        return offset;
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    protected LimitExec withNewChild(PhysicalPlan newChild) {
        return new LimitExec(kind, limit, offset, newChild);
    }

    @Override
    public String toString() {
        return offset > 0
            ? String.format("%s %d, offset=%d", nodeName(), limit, offset)
            : nodeName() + " " + limit;
    }
}
