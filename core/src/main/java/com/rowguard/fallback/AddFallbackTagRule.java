package com.rowguard.fallback;

import com.rowguard.exception.NotSupportedException;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.transform.TransformCandidate;
import com.rowguard.transform.TransformContext;
import com.rowguard.transform.TransformRegistry;
import com.rowguard.validation.FallbackInjects;
import com.rowguard.validation.ValidationOutcome;
import com.rowguard.validation.Validator;
import com.rowguard.validation.Validators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Main pass: decides for every node, children before parents, whether it can be offloaded.
 *
 * <p>Each node first goes through the validator chain. When the chain passes, the node's
 * transform candidate (if its kind is registered and eligible) is built and validated.
 * Any failure is recorded as a fallback tag. Unregistered kinds are assumed offloadable.
 *
 * <p>{@link NotSupportedException} and {@link UnsupportedOperationException} raised during
 * dispatch become tags as well; every other exception aborts the pass.
 */
public final class AddFallbackTagRule implements FallbackRule {

    private static final Logger logger = LoggerFactory.getLogger(AddFallbackTagRule.class);

    private final FallbackTagStore store;
    private final TransformContext context;
    private final TransformRegistry registry;
    private final Validator validator;

    /**
     * Creates the rule with the standard validator chain.
     *
     * @param store the tag store
     * @param context the transform collaborators
     * @param registry the transform dispatch table
     * @param injects test-injected rejections
     */
    public AddFallbackTagRule(FallbackTagStore store, TransformContext context, TransformRegistry registry,
                              FallbackInjects injects) {
        this(store, context, registry, Validators.builder()
            .fallbackByHint(store)
            .fallbackIfScanOnlyWithFilterPushed(context.conf().scanOnly())
            .fallbackComplexExpressions(context.conf().expressionDepthThreshold())
            .fallbackByBackendSettings(context.backend())
            .fallbackByUserOptions(context.conf())
            .fallbackByTestInjects(injects)
            .build());
    }

    /**
     * Creates the rule with a custom validator chain.
     *
     * @param store the tag store
     * @param context the transform collaborators
     * @param registry the transform dispatch table
     * @param validator the validator chain
     */
    public AddFallbackTagRule(FallbackTagStore store, TransformContext context, TransformRegistry registry,
                              Validator validator) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    @Override
    public PhysicalPlan apply(PhysicalPlan plan) {
        plan.foreachUp(this::addFallbackTag);
        return plan;
    }

    private void addFallbackTag(PhysicalPlan plan) {
        ValidationOutcome outcome = validator.validate(plan);
        if (!outcome.isPassed()) {
            // A node failing on its own recorded reason keeps the tag as is
            Optional<String> existing = store.getTagOption(plan).map(FallbackTag::describe);
            if (!existing.equals(outcome.reason())) {
                store.add(plan, outcome);
            }
            return;
        }

        try {
            registry.lookup(plan.kind())
                .filter(registration -> registration.eligible().test(plan, context))
                .ifPresent(registration -> {
                    TransformCandidate candidate = registration.factory().apply(plan, context);
                    ValidationOutcome result = candidate.doValidate();
                    if (!result.isPassed()) {
                        logger.debug("{} cannot be offloaded: {}", plan.nodeName(), result.reason().orElse(""));
                    }
                    store.add(plan, result);
                });
        } catch (NotSupportedException | UnsupportedOperationException e) {
            store.add(plan, String.format("%s, original plan is %s(%s)", e.getMessage(), plan.nodeName(),
                plan.children().stream().map(PhysicalPlan::nodeName).collect(Collectors.joining(", "))));
            if (!(e instanceof NotSupportedException)) {
                logger.warn("Unsupported operation while validating {}; this exception may need fixing",
                    plan.nodeName(), e);
            }
        }
    }
}
