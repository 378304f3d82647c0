package com.rowguard.transform;

import com.rowguard.plan.PhysicalPlan;
import com.rowguard.validation.ValidationOutcome;

import java.util.Objects;

/**
 * Native counterpart of a plan node, built only to decide whether the node can be offloaded.
 *
 * <p>A candidate is built from the node's current fields and discarded after
 * {@link #doValidate()}. Subclasses check what they can locally; the backend's
 * {@link com.rowguard.backend.NativeValidator} has the last word.
 */
public abstract class TransformCandidate {

    protected final PhysicalPlan original;
    protected final TransformContext context;
    protected final ExpressionConverter converter;

    protected TransformCandidate(PhysicalPlan original, TransformContext context) {
        this.original = Objects.requireNonNull(original, "original must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.converter = context.converter();
    }

    /**
     * Validates the candidate: local checks first, then the backend's deep check.
     *
     * @return the outcome
     * @throws com.rowguard.exception.NotSupportedException if an expression or type cannot be converted
     */
    public final ValidationOutcome doValidate() {
        ValidationOutcome local = validateLocally();
        if (!local.isPassed()) {
            return local;
        }
        return context.nativeValidator().validate(this);
    }

    /**
     * Checks whether the native side can represent this node.
     *
     * @return the outcome of the local checks
     */
    protected abstract ValidationOutcome validateLocally();

    public PhysicalPlan original() {
        return original;
    }

    public String nodeName() {
        return original.nodeName();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + original.nodeName() + ")";
    }
}
