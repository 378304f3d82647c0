package com.rowguard.transform;

import com.rowguard.plan.CoalesceExec;
import com.rowguard.validation.ValidationOutcome;

public final class CoalesceTransformer extends TransformCandidate {

    private final CoalesceExec coalesce;

    public CoalesceTransformer(CoalesceExec coalesce, TransformContext context) {
        super(coalesce, context);
        this.coalesce = coalesce;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        if (coalesce.numPartitions() < 1) {
            return ValidationOutcome.failed("Coalesce needs at least one partition: " + coalesce.numPartitions());
        }
        return ValidationOutcome.passed();
    }
}
