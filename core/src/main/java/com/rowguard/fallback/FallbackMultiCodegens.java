package com.rowguard.fallback;

import com.rowguard.config.RowguardConfig;
import com.rowguard.plan.NodeKind;
import com.rowguard.plan.PhysicalPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Keeps long fused-codegen chains in the default engine.
 *
 * <p>Scanning top-down, at each node the rule checks whether a run of at least
 * {@code physicalJoinOptimizationLevel} chainable nodes starts there along some path.
 * A node is chainable when it supports codegen or matches the chain-join predicate.
 * When such a run exists the rule tags from that node down:
 * <ul>
 *   <li>shuffle and broadcast exchanges are tagged, and scanning resumes below them</li>
 *   <li>chainable nodes are tagged, and tagging continues into their children</li>
 *   <li>query stages end the walk and are never tagged</li>
 *   <li>any other node is left untagged, and scanning resumes below it</li>
 * </ul>
 */
public final class FallbackMultiCodegens implements FallbackRule {

    private static final Logger logger = LoggerFactory.getLogger(FallbackMultiCodegens.class);

    static final String REASON = "fallback multi codegens";

    private final RowguardConfig conf;
    private final FallbackTagStore store;
    private final Predicate<PhysicalPlan> chainJoin;

    /**
     * Creates the rule with the default chain-join predicate: shuffled hash joins, plus
     * sort-merge joins when they are forced into shuffled hash joins.
     *
     * @param conf the configuration
     * @param store the tag store
     */
    public FallbackMultiCodegens(RowguardConfig conf, FallbackTagStore store) {
        this(conf, store, defaultChainJoin(conf));
    }

    public FallbackMultiCodegens(RowguardConfig conf, FallbackTagStore store, Predicate<PhysicalPlan> chainJoin) {
        this.conf = Objects.requireNonNull(conf, "conf must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.chainJoin = Objects.requireNonNull(chainJoin, "chainJoin must not be null");
    }

    /**
     * Returns the default chain-join predicate for a configuration.
     *
     * @param conf the configuration
     * @return the predicate
     */
    public static Predicate<PhysicalPlan> defaultChainJoin(RowguardConfig conf) {
        boolean forceShuffledHashJoin = conf.forceShuffledHashJoin();
        return plan -> plan.kind() == NodeKind.SHUFFLED_HASH_JOIN
            || (forceShuffledHashJoin && plan.kind() == NodeKind.SORT_MERGE_JOIN);
    }

    @Override
    public PhysicalPlan apply(PhysicalPlan plan) {
        if (!conf.joinOptimizeEnabled()) {
            return plan;
        }
        Set<PhysicalPlan> tagged = Collections.newSetFromMap(new IdentityHashMap<>());
        tagOnFallbackForMultiCodegens(plan, tagged);
        if (!tagged.isEmpty()) {
            logger.debug("Fused-chain fallback tagged {} nodes", tagged.size());
        }
        return plan;
    }

    /**
     * Returns whether a run of at least {@code physicalJoinOptimizationLevel} chainable
     * nodes starts at the given node.
     *
     * @param plan the node
     * @param count chainable nodes already seen above this node
     * @return true when the run is long enough
     */
    boolean existsMultiCodegens(PhysicalPlan plan, int count) {
        if (!isChainable(plan)) {
            return false;
        }
        if (count + 1 >= conf.joinOptimizationLevel()) {
            return true;
        }
        for (PhysicalPlan child : plan.children()) {
            if (existsMultiCodegens(child, count + 1)) {
                return true;
            }
        }
        return false;
    }

    private boolean isChainable(PhysicalPlan plan) {
        return plan.supportsCodegen() || chainJoin.test(plan);
    }

    private void tagOnFallbackForMultiCodegens(PhysicalPlan plan, Set<PhysicalPlan> tagged) {
        if (existsMultiCodegens(plan, 0)) {
            addFallbackTagRecursive(plan, tagged);
        } else {
            for (PhysicalPlan child : plan.children()) {
                tagOnFallbackForMultiCodegens(child, tagged);
            }
        }
    }

    private void addFallbackTagRecursive(PhysicalPlan plan, Set<PhysicalPlan> tagged) {
        NodeKind kind = plan.kind();
        if (kind == NodeKind.SHUFFLE_EXCHANGE || kind == NodeKind.BROADCAST_EXCHANGE) {
            addFallbackTag(plan, tagged);
            for (PhysicalPlan child : plan.children()) {
                tagOnFallbackForMultiCodegens(child, tagged);
            }
        } else if (kind == NodeKind.QUERY_STAGE) {
            return;
        } else if (isChainable(plan)) {
            addFallbackTag(plan, tagged);
            for (PhysicalPlan child : plan.children()) {
                addFallbackTagRecursive(child, tagged);
            }
        } else {
            // Non-codegen nodes, including adaptive shuffle reads, break the chain
            for (PhysicalPlan child : plan.children()) {
                tagOnFallbackForMultiCodegens(child, tagged);
            }
        }
    }

    private void addFallbackTag(PhysicalPlan plan, Set<PhysicalPlan> tagged) {
        if (tagged.add(plan)) {
            store.add(plan, REASON);
        }
    }
}
