package com.rowguard.transform;

import com.rowguard.expression.AttributeReference;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.plan.UnionExec;
import com.rowguard.validation.ValidationOutcome;

import java.util.List;

/**
 * Native union. Every child must produce the same column types in the same order.
 */
public final class UnionTransformer extends TransformCandidate {

    private final UnionExec union;

    public UnionTransformer(UnionExec union, TransformContext context) {
        super(union, context);
        this.union = union;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        List<AttributeReference> first = union.children().get(0).output();
        for (PhysicalPlan child : union.children()) {
            List<AttributeReference> other = child.output();
            if (other.size() != first.size()) {
                return ValidationOutcome.failed(String.format(
                    "Union children have different column counts: %d vs %d", first.size(), other.size()));
            }
            for (int i = 0; i < first.size(); i++) {
                if (!first.get(i).dataType().equals(other.get(i).dataType())) {
                    return ValidationOutcome.failed(String.format(
                        "Union column %d has different types: %s vs %s", i,
                        first.get(i).dataType().typeName(), other.get(i).dataType().typeName()));
                }
            }
        }
        converter.checkAttributes(first);
        return ValidationOutcome.passed();
    }
}
