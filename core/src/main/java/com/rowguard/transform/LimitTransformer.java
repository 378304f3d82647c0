package com.rowguard.transform;

import com.rowguard.plan.LimitExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Native limit, global or local.
 */
public final class LimitTransformer extends TransformCandidate {

    private final LimitExec limit;

    public LimitTransformer(LimitExec limit, TransformContext context) {
        super(limit, context);
        this.limit = limit;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        if (limit.limit() < 0 || limit.offset() < 0) {
            return ValidationOutcome.failed(String.format("Invalid limit %d with offset %d",
                limit.limit(), limit.offset()));
        }
        return ValidationOutcome.passed();
    }
}
