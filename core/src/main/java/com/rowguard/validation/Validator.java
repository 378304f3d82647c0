package com.rowguard.validation;

import com.rowguard.plan.PhysicalPlan;

/**
 * A pure check deciding whether a plan node may be offloaded.
 */
@FunctionalInterface
public interface Validator {

    ValidationOutcome validate(PhysicalPlan plan);

    /**
     * Returns the name used in generic failure reasons.
     *
     * @return the validator name, the simple class name by default
     */
    default String name() {
        return getClass().getSimpleName();
    }

    default ValidationOutcome pass() {
        return ValidationOutcome.passed();
    }

    /**
     * Fails with the generic reason naming this validator and the node.
     *
     * @param plan the rejected node
     * @return the failed outcome
     */
    default ValidationOutcome fail(PhysicalPlan plan) {
        return ValidationOutcome.failed(String.format("[%s] Validation failed on node %s", name(), plan.nodeName()));
    }

    default ValidationOutcome fail(String reason) {
        return ValidationOutcome.failed(reason);
    }
}
