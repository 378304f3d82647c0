package com.rowguard.transform;

import com.rowguard.plan.TakeOrderedAndProjectExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Native top-N with projection.
 */
public final class TakeOrderedAndProjectTransformer extends TransformCandidate {

    private final TakeOrderedAndProjectExec topN;

    public TakeOrderedAndProjectTransformer(TakeOrderedAndProjectExec topN, TransformContext context) {
        super(topN, context);
        this.topN = topN;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        if (topN.limit() < 0 || topN.offset() < 0) {
            return ValidationOutcome.failed(String.format("Invalid limit %d with offset %d",
                topN.limit(), topN.offset()));
        }
        ExpressionConverter.checkNotMapTyped(topN.sortOrder(), "sort key");
        converter.convertAll(topN.sortOrder());
        converter.convertAll(topN.projectList());
        return ValidationOutcome.passed();
    }
}
