package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;

import java.util.List;
import java.util.Objects;

/**
 * Collects the rows of its child and ships them to every task of the consuming stage.
 */
public final class BroadcastExchangeExec extends UnaryExec {

    /**
     * Shape of the broadcast relation.
     */
    public enum Mode {
        /** Rows broadcast as-is (nested loop joins). */
        IDENTITY,
        /** Rows indexed by key (hash joins). */
        HASHED
    }

    private final Mode mode;
    private final List<Expression> keys;

    public BroadcastExchangeExec(Mode mode, List<Expression> keys, PhysicalPlan child) {
        super(child);
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.keys = List.copyOf(keys);
        if (mode == Mode.IDENTITY && !keys.isEmpty()) {
            throw new IllegalArgumentException("identity broadcast has no keys");
        }
    }

    public Mode mode() {
        return mode;
    }

    public List<Expression> keys() {
        return keys;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BROADCAST_EXCHANGE;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        return keys;
    }

    @Override
    protected BroadcastExchangeExec withNewChild(PhysicalPlan newChild) {
        return new BroadcastExchangeExec(mode, keys, newChild);
    }

    @Override
    public String toString() {
        return "BroadcastExchange " + mode + keys;
    }
}
