package com.rowguard.validation;

import com.rowguard.plan.PhysicalPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Rejections injected by tests to force fallback of chosen nodes.
 */
public final class FallbackInjects {

    private static final FallbackInjects NONE = new FallbackInjects(List.of());

    private final List<Predicate<PhysicalPlan>> predicates;

    private FallbackInjects(List<Predicate<PhysicalPlan>> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    public static FallbackInjects none() {
        return NONE;
    }

    /**
     * Returns injects that reject every node matching one of the predicates.
     *
     * @param predicates the predicates
     * @return the injects
     */
    @SafeVarargs
    public static FallbackInjects of(Predicate<PhysicalPlan>... predicates) {
        return new FallbackInjects(List.of(predicates));
    }

    /**
     * Returns a copy with one more predicate.
     *
     * @param predicate the predicate
     * @return the new injects
     */
    public FallbackInjects and(Predicate<PhysicalPlan> predicate) {
        List<Predicate<PhysicalPlan>> all = new ArrayList<>(predicates);
        all.add(Objects.requireNonNull(predicate, "predicate must not be null"));
        return new FallbackInjects(all);
    }

    public boolean shouldFallback(PhysicalPlan plan) {
        for (Predicate<PhysicalPlan> predicate : predicates) {
            if (predicate.test(plan)) {
                return true;
            }
        }
        return false;
    }
}
