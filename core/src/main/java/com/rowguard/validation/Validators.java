package com.rowguard.validation;

import com.rowguard.backend.BackendSettings;
import com.rowguard.config.OperatorSwitch;
import com.rowguard.config.RowguardConfig;
import com.rowguard.expression.Expression;
import com.rowguard.expression.ExpressionUtils;
import com.rowguard.fallback.FallbackTagStore;
import com.rowguard.plan.FilterExec;
import com.rowguard.plan.NodeKind;
import com.rowguard.plan.PhysicalPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in validators and the builder that chains them.
 *
 * <p>A chain has AND semantics: validators run left to right, the first failure is the
 * chain's outcome and the remaining validators are not consulted.
 *
 * <p>Example:
 * <pre>
 *   Validator chain = Validators.builder()
 *       .fallbackByHint(store)
 *       .fallbackIfScanOnlyWithFilterPushed(conf.scanOnly())
 *       .fallbackComplexExpressions(conf.expressionDepthThreshold())
 *       .build();
 * </pre>
 */
public final class Validators {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Ordered chain of validators.
     */
    public static final class Builder {
        private final List<Validator> validators = new ArrayList<>();

        private Builder() {
        }

        /**
         * Fails nodes that already carry a fallback tag, with the recorded reason.
         *
         * @param store the tag store of the current run
         * @return this builder
         */
        public Builder fallbackByHint(FallbackTagStore store) {
            return add(new FallbackByHint(store));
        }

        /**
         * Fails every non-scan node when running in scan-only mode. A filter directly on top
         * of a file source or batch scan passes, since its condition is pushed into the scan.
         *
         * @param scanOnly whether scan-only mode is engaged
         * @return this builder
         */
        public Builder fallbackIfScanOnlyWithFilterPushed(boolean scanOnly) {
            return add(new FallbackIfScanOnlyWithFilterPushed(scanOnly));
        }

        public Builder fallbackComplexExpressions(int depthThreshold) {
            return add(new FallbackComplexExpressions(depthThreshold));
        }

        public Builder fallbackByBackendSettings(BackendSettings settings) {
            return add(new FallbackByBackendSettings(settings));
        }

        public Builder fallbackByUserOptions(RowguardConfig conf) {
            return add(new FallbackByUserOptions(conf));
        }

        public Builder fallbackByTestInjects(FallbackInjects injects) {
            return add(new FallbackByTestInjects(injects));
        }

        public Builder add(Validator validator) {
            validators.add(Objects.requireNonNull(validator, "validator must not be null"));
            return this;
        }

        public Validator build() {
            if (validators.isEmpty()) {
                return NoopValidator.INSTANCE;
            }
            return new ValidatorPipeline(validators);
        }
    }

    private static final class NoopValidator implements Validator {
        private static final NoopValidator INSTANCE = new NoopValidator();

        @Override
        public ValidationOutcome validate(PhysicalPlan plan) {
            return pass();
        }
    }

    private static final class ValidatorPipeline implements Validator {
        private final List<Validator> validators;

        private ValidatorPipeline(List<Validator> validators) {
            this.validators = List.copyOf(validators);
        }

        @Override
        public ValidationOutcome validate(PhysicalPlan plan) {
            for (Validator validator : validators) {
                ValidationOutcome outcome = validator.validate(plan);
                if (!outcome.isPassed()) {
                    return outcome;
                }
            }
            return pass();
        }
    }

    private static final class FallbackByHint implements Validator {
        private final FallbackTagStore store;

        private FallbackByHint(FallbackTagStore store) {
            this.store = Objects.requireNonNull(store, "store must not be null");
        }

        @Override
        public ValidationOutcome validate(PhysicalPlan plan) {
            return store.getTagOption(plan)
                .map(tag -> fail(tag.describe()))
                .orElseGet(this::pass);
        }
    }

    private static final class FallbackIfScanOnlyWithFilterPushed implements Validator {
        private final boolean scanOnly;

        private FallbackIfScanOnlyWithFilterPushed(boolean scanOnly) {
            this.scanOnly = scanOnly;
        }

        @Override
        public ValidationOutcome validate(PhysicalPlan plan) {
            if (!scanOnly) {
                return pass();
            }
            NodeKind kind = plan.kind();
            if (kind.isDataSourceScan()) {
                return pass();
            }
            if (plan instanceof FilterExec filter) {
                NodeKind childKind = filter.child().kind();
                boolean childIsScan = childKind == NodeKind.FILE_SOURCE_SCAN || childKind == NodeKind.BATCH_SCAN;
                return childIsScan ? pass() : fail(filter);
            }
            return fail(plan);
        }
    }

    private static final class FallbackComplexExpressions implements Validator {
        private final int depthThreshold;

        private FallbackComplexExpressions(int depthThreshold) {
            if (depthThreshold < 1) {
                throw new IllegalArgumentException("depthThreshold must be positive: " + depthThreshold);
            }
            this.depthThreshold = depthThreshold;
        }

        @Override
        public ValidationOutcome validate(PhysicalPlan plan) {
            for (Expression expression : plan.expressions()) {
                if (ExpressionUtils.treeDepth(expression) > depthThreshold) {
                    return fail("Disabled because at least one present expression exceeded depth threshold: "
                        + plan.nodeName());
                }
            }
            return pass();
        }
    }

    private static final class FallbackByBackendSettings implements Validator {
        private final BackendSettings settings;

        private FallbackByBackendSettings(BackendSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
        }

        @Override
        public ValidationOutcome validate(PhysicalPlan plan) {
            switch (plan.kind()) {
                case SHUFFLE_EXCHANGE:
                case TAKE_ORDERED_AND_PROJECT:
                    return settings.supportColumnarShuffleExec() ? pass() : fail(plan);
                case SORT_MERGE_JOIN:
                    return settings.supportSortMergeJoinExec() ? pass() : fail(plan);
                case WRITE_FILES:
                    return settings.enableNativeWriteFiles() ? pass() : fail(plan);
                case SORT_AGGREGATE:
                    return settings.replaceSortAggWithHashAgg() ? pass() : fail(plan);
                case CARTESIAN_PRODUCT:
                    return settings.supportCartesianProductExec() ? pass() : fail(plan);
                case BROADCAST_NESTED_LOOP_JOIN:
                    return settings.supportBroadcastNestedLoopJoinExec() ? pass() : fail(plan);
                default:
                    return pass();
            }
        }
    }

    private static final class FallbackByUserOptions implements Validator {
        private static final Map<NodeKind, List<OperatorSwitch>> REQUIRED_SWITCHES = requiredSwitches();

        private final RowguardConfig conf;

        private FallbackByUserOptions(RowguardConfig conf) {
            this.conf = Objects.requireNonNull(conf, "conf must not be null");
        }

        @Override
        public ValidationOutcome validate(PhysicalPlan plan) {
            for (OperatorSwitch op : REQUIRED_SWITCHES.getOrDefault(plan.kind(), Collections.emptyList())) {
                if (!conf.isEnabled(op)) {
                    return fail(plan);
                }
            }
            return pass();
        }

        private static Map<NodeKind, List<OperatorSwitch>> requiredSwitches() {
            Map<NodeKind, List<OperatorSwitch>> map = new EnumMap<>(NodeKind.class);
            map.put(NodeKind.FILE_SOURCE_SCAN, List.of(OperatorSwitch.FILE_SCAN));
            map.put(NodeKind.BATCH_SCAN, List.of(OperatorSwitch.BATCH_SCAN));
            map.put(NodeKind.HIVE_TABLE_SCAN, List.of(OperatorSwitch.HIVE_TABLE_SCAN));
            map.put(NodeKind.PROJECT, List.of(OperatorSwitch.PROJECT));
            map.put(NodeKind.FILTER, List.of(OperatorSwitch.FILTER));
            map.put(NodeKind.HASH_AGGREGATE, List.of(OperatorSwitch.HASH_AGGREGATE));
            map.put(NodeKind.SORT_AGGREGATE, List.of(OperatorSwitch.HASH_AGGREGATE));
            map.put(NodeKind.OBJECT_HASH_AGGREGATE, List.of(OperatorSwitch.HASH_AGGREGATE));
            map.put(NodeKind.UNION, List.of(OperatorSwitch.UNION));
            map.put(NodeKind.EXPAND, List.of(OperatorSwitch.EXPAND));
            map.put(NodeKind.SORT, List.of(OperatorSwitch.SORT));
            map.put(NodeKind.WINDOW, List.of(OperatorSwitch.WINDOW));
            map.put(NodeKind.WINDOW_GROUP_LIMIT, List.of(OperatorSwitch.WINDOW_GROUP_LIMIT));
            map.put(NodeKind.SHUFFLE_EXCHANGE, List.of(OperatorSwitch.SHUFFLE));
            map.put(NodeKind.BROADCAST_EXCHANGE, List.of(OperatorSwitch.BROADCAST_EXCHANGE));
            map.put(NodeKind.SHUFFLED_HASH_JOIN, List.of(OperatorSwitch.SHUFFLED_HASH_JOIN));
            map.put(NodeKind.SORT_MERGE_JOIN, List.of(OperatorSwitch.SORT_MERGE_JOIN));
            map.put(NodeKind.BROADCAST_HASH_JOIN, List.of(OperatorSwitch.BROADCAST_HASH_JOIN));
            map.put(NodeKind.BROADCAST_NESTED_LOOP_JOIN,
                List.of(OperatorSwitch.BROADCAST_HASH_JOIN, OperatorSwitch.BROADCAST_NESTED_LOOP_JOIN));
            map.put(NodeKind.CARTESIAN_PRODUCT, List.of(OperatorSwitch.CARTESIAN_PRODUCT));
            map.put(NodeKind.GLOBAL_LIMIT, List.of(OperatorSwitch.LIMIT));
            map.put(NodeKind.LOCAL_LIMIT, List.of(OperatorSwitch.LIMIT));
            map.put(NodeKind.GENERATE, List.of(OperatorSwitch.GENERATE));
            map.put(NodeKind.COALESCE, List.of(OperatorSwitch.COALESCE));
            map.put(NodeKind.TAKE_ORDERED_AND_PROJECT, List.of(OperatorSwitch.TAKE_ORDERED_AND_PROJECT,
                OperatorSwitch.SORT, OperatorSwitch.SHUFFLE, OperatorSwitch.PROJECT));
            map.put(NodeKind.SAMPLE, List.of(OperatorSwitch.SAMPLE));
            return map;
        }
    }

    private static final class FallbackByTestInjects implements Validator {
        private final FallbackInjects injects;

        private FallbackByTestInjects(FallbackInjects injects) {
            this.injects = Objects.requireNonNull(injects, "injects must not be null");
        }

        @Override
        public ValidationOutcome validate(PhysicalPlan plan) {
            return injects.shouldFallback(plan) ? fail(plan) : pass();
        }
    }

    private Validators() {
        // Utility class - prevent instantiation
    }
}
