package com.rowguard.transform;

import com.rowguard.plan.AggregateExec;
import com.rowguard.plan.BroadcastExchangeExec;
import com.rowguard.plan.CoalesceExec;
import com.rowguard.plan.EvalPythonExec;
import com.rowguard.plan.ExpandExec;
import com.rowguard.plan.FilterExec;
import com.rowguard.plan.GenerateExec;
import com.rowguard.plan.JoinExec;
import com.rowguard.plan.LimitExec;
import com.rowguard.plan.NodeKind;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.plan.ProjectExec;
import com.rowguard.plan.SampleExec;
import com.rowguard.plan.ScanExec;
import com.rowguard.plan.ShuffleExchangeExec;
import com.rowguard.plan.SortExec;
import com.rowguard.plan.TakeOrderedAndProjectExec;
import com.rowguard.plan.UnionExec;
import com.rowguard.plan.WindowExec;
import com.rowguard.plan.WindowGroupLimitExec;
import com.rowguard.plan.WriteFilesExec;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * Maps node kinds to the transform candidates that validate them.
 *
 * <p>A registration pairs a side condition with a factory. When the side condition
 * does not hold, the node is not dispatched and stays offloadable; so does every node
 * whose kind is not registered.
 */
public final class TransformRegistry {

    /**
     * A registered kind.
     *
     * @param eligible decides whether a node of the kind is dispatched at all
     * @param factory builds the candidate; may throw {@link com.rowguard.exception.NotSupportedException}
     */
    public record Registration(BiPredicate<PhysicalPlan, TransformContext> eligible,
                               BiFunction<PhysicalPlan, TransformContext, TransformCandidate> factory) {

        public Registration {
            Objects.requireNonNull(eligible, "eligible must not be null");
            Objects.requireNonNull(factory, "factory must not be null");
        }
    }

    private static final BiPredicate<PhysicalPlan, TransformContext> ALWAYS = (plan, context) -> true;

    private static final TransformRegistry DEFAULTS = createDefaults();

    private final Map<NodeKind, Registration> registrations;

    private TransformRegistry(Map<NodeKind, Registration> registrations) {
        this.registrations = Collections.unmodifiableMap(new EnumMap<>(registrations));
    }

    /**
     * Returns the registry covering every offloadable operator.
     *
     * @return the default registry
     */
    public static TransformRegistry defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a registry without any registration: every node passes dispatch.
     *
     * @return the empty registry
     */
    public static TransformRegistry empty() {
        return new TransformRegistry(new EnumMap<>(NodeKind.class));
    }

    public Optional<Registration> lookup(NodeKind kind) {
        return Optional.ofNullable(registrations.get(kind));
    }

    public boolean isRegistered(NodeKind kind) {
        return registrations.containsKey(kind);
    }

    /**
     * Returns a copy with an additional or replaced registration that is always eligible.
     *
     * @param kind the node kind
     * @param factory the candidate factory
     * @return the new registry
     */
    public TransformRegistry with(NodeKind kind, BiFunction<PhysicalPlan, TransformContext, TransformCandidate> factory) {
        return with(kind, ALWAYS, factory);
    }

    public TransformRegistry with(NodeKind kind, BiPredicate<PhysicalPlan, TransformContext> eligible,
                                  BiFunction<PhysicalPlan, TransformContext, TransformCandidate> factory) {
        Map<NodeKind, Registration> copy = new EnumMap<>(NodeKind.class);
        copy.putAll(registrations);
        copy.put(kind, new Registration(eligible, factory));
        return new TransformRegistry(copy);
    }

    public TransformRegistry without(NodeKind kind) {
        Map<NodeKind, Registration> copy = new EnumMap<>(NodeKind.class);
        copy.putAll(registrations);
        copy.remove(kind);
        return new TransformRegistry(copy);
    }

    private static TransformRegistry createDefaults() {
        Map<NodeKind, Registration> map = new EnumMap<>(NodeKind.class);

        // Scans with partition or runtime filters are left to the filter operators above them
        map.put(NodeKind.FILE_SOURCE_SCAN, new Registration(
            (plan, context) -> ((ScanExec) plan).partitionFilters().isEmpty(),
            (plan, context) -> new ScanTransformer((ScanExec) plan, context)));
        map.put(NodeKind.BATCH_SCAN, new Registration(
            (plan, context) -> ((ScanExec) plan).runtimeFilters().isEmpty(),
            (plan, context) -> new ScanTransformer((ScanExec) plan, context)));
        register(map, NodeKind.HIVE_TABLE_SCAN, (plan, context) -> new ScanTransformer((ScanExec) plan, context));

        register(map, NodeKind.PROJECT, (plan, context) -> new ProjectTransformer((ProjectExec) plan, context));
        register(map, NodeKind.FILTER, (plan, context) -> new FilterTransformer((FilterExec) plan, context));
        for (NodeKind aggregate : new NodeKind[] {
            NodeKind.HASH_AGGREGATE, NodeKind.SORT_AGGREGATE, NodeKind.OBJECT_HASH_AGGREGATE}) {
            register(map, aggregate, (plan, context) -> new AggregateTransformer((AggregateExec) plan, context));
        }
        register(map, NodeKind.UNION, (plan, context) -> new UnionTransformer((UnionExec) plan, context));
        register(map, NodeKind.EXPAND, (plan, context) -> new ExpandTransformer((ExpandExec) plan, context));
        register(map, NodeKind.WRITE_FILES,
            (plan, context) -> new WriteFilesTransformer((WriteFilesExec) plan, context));
        register(map, NodeKind.SORT, (plan, context) -> new SortTransformer((SortExec) plan, context));
        register(map, NodeKind.SHUFFLE_EXCHANGE,
            (plan, context) -> new ShuffleExchangeTransformer((ShuffleExchangeExec) plan, context));
        register(map, NodeKind.BROADCAST_EXCHANGE,
            (plan, context) -> new BroadcastExchangeTransformer((BroadcastExchangeExec) plan, context));
        for (NodeKind join : new NodeKind[] {
            NodeKind.SHUFFLED_HASH_JOIN, NodeKind.BROADCAST_HASH_JOIN, NodeKind.SORT_MERGE_JOIN,
            NodeKind.CARTESIAN_PRODUCT, NodeKind.BROADCAST_NESTED_LOOP_JOIN}) {
            register(map, join, (plan, context) -> new JoinTransformer((JoinExec) plan, context));
        }
        register(map, NodeKind.WINDOW, (plan, context) -> new WindowTransformer((WindowExec) plan, context));
        register(map, NodeKind.WINDOW_GROUP_LIMIT,
            (plan, context) -> new WindowGroupLimitTransformer((WindowGroupLimitExec) plan, context));
        register(map, NodeKind.COALESCE, (plan, context) -> new CoalesceTransformer((CoalesceExec) plan, context));
        register(map, NodeKind.GLOBAL_LIMIT, (plan, context) -> new LimitTransformer((LimitExec) plan, context));
        register(map, NodeKind.LOCAL_LIMIT, (plan, context) -> new LimitTransformer((LimitExec) plan, context));
        register(map, NodeKind.GENERATE, (plan, context) -> new GenerateTransformer((GenerateExec) plan, context));
        register(map, NodeKind.BATCH_EVAL_PYTHON,
            (plan, context) -> new EvalPythonTransformer((EvalPythonExec) plan, context));
        // Arrow UDFs only go through the generic python path when the columnar arrow path is unavailable
        map.put(NodeKind.ARROW_EVAL_PYTHON, new Registration(
            (plan, context) -> !context.backend().supportColumnarArrowUdf() || !context.conf().arrowUdfEnabled(),
            (plan, context) -> new EvalPythonTransformer((EvalPythonExec) plan, context)));
        register(map, NodeKind.TAKE_ORDERED_AND_PROJECT,
            (plan, context) -> new TakeOrderedAndProjectTransformer((TakeOrderedAndProjectExec) plan, context));
        register(map, NodeKind.SAMPLE, (plan, context) -> new SampleTransformer((SampleExec) plan, context));

        return new TransformRegistry(map);
    }

    private static void register(Map<NodeKind, Registration> map, NodeKind kind,
                                 BiFunction<PhysicalPlan, TransformContext, TransformCandidate> factory) {
        map.put(kind, new Registration(ALWAYS, factory));
    }
}
