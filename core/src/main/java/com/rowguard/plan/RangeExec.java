package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.types.PrimitiveType;

import java.util.List;

/**
 * Leaf producing the integers {@code [start, end)} by {@code step} in a single
 * {@code id} column.
 */
public final class RangeExec extends LeafExec {

    private final long start;
    private final long end;
    private final long step;
    private final List<AttributeReference> output;

    public RangeExec(long start, long end, long step) {
        if (step == 0) {
            throw new IllegalArgumentException("step must not be 0");
        }
        this.start = start;
        this.end = end;
        this.step = step;
        this.output = List.of(new AttributeReference("id", PrimitiveType.LONG, false));
    }

    public long start() {
        return start;
    }

    public long end() {
        return end;
    }

    public long step() {
        return step;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RANGE;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public String toString() {
        return String.format("Range (%d, %d, step=%d)", start, end, step);
    }
}
