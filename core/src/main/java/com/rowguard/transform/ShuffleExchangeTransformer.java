package com.rowguard.transform;

import com.rowguard.plan.Partitioning;
import com.rowguard.plan.ShuffleExchangeExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Columnar shuffle.
 */
public final class ShuffleExchangeTransformer extends TransformCandidate {

    private final ShuffleExchangeExec exchange;

    public ShuffleExchangeTransformer(ShuffleExchangeExec exchange, TransformContext context) {
        super(exchange, context);
        this.exchange = exchange;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        Partitioning partitioning = exchange.partitioning();
        if (!context.backend().supportPartitioning(partitioning.scheme())) {
            return ValidationOutcome.failed("Unsupported shuffle partitioning: " + partitioning.scheme());
        }
        ExpressionConverter.checkNotMapTyped(partitioning.keys(), "partitioning key");
        converter.convertAll(partitioning.keys());
        converter.checkAttributes(exchange.child().output());
        return ValidationOutcome.passed();
    }
}
