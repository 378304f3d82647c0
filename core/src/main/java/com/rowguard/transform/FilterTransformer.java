package com.rowguard.transform;

import com.rowguard.plan.FilterExec;
import com.rowguard.types.PrimitiveType;
import com.rowguard.validation.ValidationOutcome;

/**
 * Native filter.
 */
public final class FilterTransformer extends TransformCandidate {

    private final FilterExec filter;

    public FilterTransformer(FilterExec filter, TransformContext context) {
        super(filter, context);
        this.filter = filter;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        if (filter.condition().dataType() != PrimitiveType.BOOLEAN) {
            return ValidationOutcome.failed("Filter condition must be boolean but was "
                + filter.condition().dataType().typeName());
        }
        converter.convert(filter.condition());
        return ValidationOutcome.passed();
    }
}
