package com.rowguard.fallback;

import com.rowguard.backend.BackendSettings;
import com.rowguard.backend.DefaultBackendSettings;
import com.rowguard.backend.NativeValidator;
import com.rowguard.config.RowguardConfig;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.transform.TransformContext;
import com.rowguard.transform.TransformRegistry;
import com.rowguard.validation.FallbackInjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Runs the fallback rules over a plan tree, in order:
 * <ol>
 *   <li>{@link FallbackOnAnsiMode}</li>
 *   <li>{@link FallbackMultiCodegens}</li>
 *   <li>{@link AddFallbackTagRule}</li>
 *   <li>{@link PlanOneRowRelation}, then {@link FallbackEmptySchemaRelation}</li>
 * </ol>
 *
 * <p>Every {@link #apply(PhysicalPlan)} call gets its own {@link FallbackTagStore}.
 * {@link #revalidate(FallbackResult)} clears a previous result with
 * {@link RemoveFallbackTagRule} and runs the rules again on the same store.
 * When a rule throws, the store of the run is cleared before the exception propagates.
 *
 * <p>Example:
 * <pre>
 *   FallbackPipeline pipeline = FallbackPipeline.builder()
 *       .conf(RowguardConfig.of(settings))
 *       .backend(DefaultBackendSettings.defaults())
 *       .build();
 *   FallbackResult result = pipeline.apply(plan);
 *   boolean offload = result.isOffloadable(plan);
 * </pre>
 */
public final class FallbackPipeline {

    private static final Logger logger = LoggerFactory.getLogger(FallbackPipeline.class);

    private final RowguardConfig conf;
    private final TransformContext context;
    private final TransformRegistry registry;
    private final FallbackInjects injects;
    private final Predicate<PhysicalPlan> chainJoin;

    private FallbackPipeline(Builder builder) {
        this.conf = builder.conf;
        this.context = new TransformContext(builder.backend, builder.conf, builder.nativeValidator);
        this.registry = builder.registry;
        this.injects = builder.injects;
        this.chainJoin = builder.chainJoin != null
            ? builder.chainJoin
            : FallbackMultiCodegens.defaultChainJoin(builder.conf);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tags a plan tree from scratch.
     *
     * @param plan the tree
     * @return the restructured tree and its tags
     */
    public FallbackResult apply(PhysicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        FallbackTagStore store = new FallbackTagStore(conf.recordTagOrigin());
        return run(plan, store, false);
    }

    /**
     * Clears the tags of a previous run and tags its tree again.
     *
     * @param previous the previous result
     * @return the new result, sharing the previous store
     */
    public FallbackResult revalidate(FallbackResult previous) {
        Objects.requireNonNull(previous, "previous must not be null");
        return run(previous.plan(), previous.tags(), true);
    }

    /**
     * Returns the rules of one run, in execution order.
     *
     * @param store the tag store the rules write to
     * @return the rules
     */
    public List<FallbackRule> rules(FallbackTagStore store) {
        return List.of(
            new FallbackOnAnsiMode(conf, store),
            new FallbackMultiCodegens(conf, store, chainJoin),
            new AddFallbackTagRule(store, context, registry, injects),
            new PlanOneRowRelation(conf, store),
            new FallbackEmptySchemaRelation(context.backend(), store));
    }

    private FallbackResult run(PhysicalPlan plan, FallbackTagStore store, boolean clearFirst) {
        PhysicalPlan current = plan;
        FallbackRule rule = null;
        try {
            if (clearFirst) {
                rule = new RemoveFallbackTagRule(store);
                current = rule.apply(current);
            }
            for (FallbackRule next : rules(store)) {
                rule = next;
                current = next.apply(current);
            }
        } catch (RuntimeException e) {
            store.clear();
            logger.error("Fallback rule {} failed on plan rooted at {}",
                Optional.ofNullable(rule).map(FallbackRule::ruleName).orElse("?"), plan.nodeName(), e);
            throw e;
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Fallback tagging finished: {} of {} nodes fall back",
                store.size(), current.collectNodes().size());
        }
        return new FallbackResult(current, store);
    }

    /**
     * Builder for {@link FallbackPipeline}. Every collaborator has a default.
     */
    public static final class Builder {
        private RowguardConfig conf = RowguardConfig.defaults();
        private BackendSettings backend = DefaultBackendSettings.defaults();
        private NativeValidator nativeValidator = NativeValidator.ACCEPT_ALL;
        private TransformRegistry registry = TransformRegistry.defaults();
        private FallbackInjects injects = FallbackInjects.none();
        private Predicate<PhysicalPlan> chainJoin;

        private Builder() {
        }

        public Builder conf(RowguardConfig conf) {
            this.conf = Objects.requireNonNull(conf, "conf must not be null");
            return this;
        }

        public Builder backend(BackendSettings backend) {
            this.backend = Objects.requireNonNull(backend, "backend must not be null");
            return this;
        }

        public Builder nativeValidator(NativeValidator nativeValidator) {
            this.nativeValidator = Objects.requireNonNull(nativeValidator, "nativeValidator must not be null");
            return this;
        }

        public Builder registry(TransformRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
            return this;
        }

        public Builder injects(FallbackInjects injects) {
            this.injects = Objects.requireNonNull(injects, "injects must not be null");
            return this;
        }

        /**
         * Overrides which joins extend a fused-codegen chain.
         *
         * @param chainJoin the predicate
         * @return this builder
         */
        public Builder chainJoin(Predicate<PhysicalPlan> chainJoin) {
            this.chainJoin = Objects.requireNonNull(chainJoin, "chainJoin must not be null");
            return this;
        }

        public FallbackPipeline build() {
            return new FallbackPipeline(this);
        }
    }
}
