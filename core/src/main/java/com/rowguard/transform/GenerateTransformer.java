package com.rowguard.transform;

import com.rowguard.plan.GenerateExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Native generator.
 */
public final class GenerateTransformer extends TransformCandidate {

    private final GenerateExec generate;

    public GenerateTransformer(GenerateExec generate, TransformContext context) {
        super(generate, context);
        this.generate = generate;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        String name = generate.generator().functionName();
        if (!context.backend().supportGenerator(name)) {
            return ValidationOutcome.failed("Generator " + name + " is not supported");
        }
        converter.convertAll(generate.generator().arguments());
        converter.checkAttributes(generate.generatorOutput());
        return ValidationOutcome.passed();
    }
}
