package com.rowguard.transform;

import com.rowguard.expression.Expression;
import com.rowguard.plan.JoinExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Native join, for every join strategy.
 */
public final class JoinTransformer extends TransformCandidate {

    private final JoinExec join;

    public JoinTransformer(JoinExec join, TransformContext context) {
        super(join, context);
        this.join = join;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        if (!context.backend().supportJoinType(join.kind(), join.joinType())) {
            return ValidationOutcome.failed(String.format("%s does not support join type %s",
                join.nodeName(), join.joinType()));
        }
        if (join.leftKeys().size() != join.rightKeys().size()) {
            return ValidationOutcome.failed(String.format("Join key count mismatch: %d vs %d",
                join.leftKeys().size(), join.rightKeys().size()));
        }
        for (int i = 0; i < join.leftKeys().size(); i++) {
            Expression left = join.leftKeys().get(i);
            Expression right = join.rightKeys().get(i);
            if (!left.dataType().equals(right.dataType())) {
                return ValidationOutcome.failed(String.format("Join keys %s and %s have different types: %s vs %s",
                    left, right, left.dataType().typeName(), right.dataType().typeName()));
            }
        }
        ExpressionConverter.checkNotMapTyped(join.leftKeys(), "join key");
        converter.convertAll(join.leftKeys());
        converter.convertAll(join.rightKeys());
        join.condition().ifPresent(converter::convert);
        return ValidationOutcome.passed();
    }
}
