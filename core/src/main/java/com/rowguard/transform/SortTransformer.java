package com.rowguard.transform;

import com.rowguard.plan.SortExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Native sort.
 */
public final class SortTransformer extends TransformCandidate {

    private final SortExec sort;

    public SortTransformer(SortExec sort, TransformContext context) {
        super(sort, context);
        this.sort = sort;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        ExpressionConverter.checkNotMapTyped(sort.sortOrder(), "sort key");
        converter.convertAll(sort.sortOrder());
        return ValidationOutcome.passed();
    }
}
