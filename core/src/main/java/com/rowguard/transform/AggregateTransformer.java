package com.rowguard.transform;

import com.rowguard.plan.AggregateExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Native hash aggregate. Sort and object-hash aggregates are validated as hash aggregates.
 */
public final class AggregateTransformer extends TransformCandidate {

    private final AggregateExec aggregate;

    public AggregateTransformer(AggregateExec aggregate, TransformContext context) {
        super(aggregate, context);
        this.aggregate = aggregate;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        ExpressionConverter.checkNotMapTyped(aggregate.groupingExpressions(), "grouping key");
        converter.convertAll(aggregate.groupingExpressions());
        converter.convertAll(aggregate.aggregateExpressions());
        return ValidationOutcome.passed();
    }
}
