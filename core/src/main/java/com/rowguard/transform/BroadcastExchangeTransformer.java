package com.rowguard.transform;

import com.rowguard.plan.BroadcastExchangeExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Columnar broadcast.
 */
public final class BroadcastExchangeTransformer extends TransformCandidate {

    private final BroadcastExchangeExec exchange;

    public BroadcastExchangeTransformer(BroadcastExchangeExec exchange, TransformContext context) {
        super(exchange, context);
        this.exchange = exchange;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        ExpressionConverter.checkNotMapTyped(exchange.keys(), "broadcast key");
        converter.convertAll(exchange.keys());
        converter.checkAttributes(exchange.child().output());
        return ValidationOutcome.passed();
    }
}
