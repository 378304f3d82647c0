package com.rowguard.transform;

import com.rowguard.plan.WindowExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Native window.
 */
public final class WindowTransformer extends TransformCandidate {

    private final WindowExec window;

    public WindowTransformer(WindowExec window, TransformContext context) {
        super(window, context);
        this.window = window;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        ExpressionConverter.checkNotMapTyped(window.partitionSpec(), "window partition key");
        converter.convertAll(window.windowExpressions());
        converter.convertAll(window.partitionSpec());
        converter.convertAll(window.orderSpec());
        return ValidationOutcome.passed();
    }
}
