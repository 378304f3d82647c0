package com.rowguard.transform;

import com.rowguard.plan.SampleExec;
import com.rowguard.validation.ValidationOutcome;

public final class SampleTransformer extends TransformCandidate {

    private final SampleExec sample;

    public SampleTransformer(SampleExec sample, TransformContext context) {
        super(sample, context);
        this.sample = sample;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        if (sample.withReplacement()) {
            return ValidationOutcome.failed("Sampling with replacement is not supported");
        }
        double lower = sample.lowerBound();
        double upper = sample.upperBound();
        if (lower < 0.0 || upper > 1.0 || lower > upper) {
            return ValidationOutcome.failed(String.format("Invalid sampling bounds [%s, %s]", lower, upper));
        }
        return ValidationOutcome.passed();
    }
}
