package com.rowguard.transform;

import com.rowguard.expression.Expression;
import com.rowguard.plan.ExpandExec;
import com.rowguard.validation.ValidationOutcome;

import java.util.List;

/**
 * Native expand (grouping sets, rollup, cube).
 */
public final class ExpandTransformer extends TransformCandidate {

    private final ExpandExec expand;

    public ExpandTransformer(ExpandExec expand, TransformContext context) {
        super(expand, context);
        this.expand = expand;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        int width = expand.output().size();
        for (List<Expression> projection : expand.projections()) {
            if (projection.size() != width) {
                return ValidationOutcome.failed(String.format(
                    "Expand projection has %d columns but output has %d", projection.size(), width));
            }
            converter.convertAll(projection);
        }
        return ValidationOutcome.passed();
    }
}
