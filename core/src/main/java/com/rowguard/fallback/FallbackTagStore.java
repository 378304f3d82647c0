package com.rowguard.fallback;

import com.rowguard.plan.PhysicalPlan;
import com.rowguard.validation.ValidationOutcome;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Side table of fallback tags, keyed by node identity.
 *
 * <p>Two structurally equal but distinct node instances carry independent tags. A store
 * belongs to one pipeline invocation and is not thread-safe.
 *
 * <p>Merge rules of {@link #tag(PhysicalPlan, FallbackTag)}, given an existing tag
 * {@code (r0, locked0)} and a new tag {@code (r1, locked1)}:
 * <ul>
 *   <li>untagged node: the new tag is stored</li>
 *   <li>either tag is not {@link Unsupported}: {@link IllegalStateException}</li>
 *   <li>{@code r0} absent: the new tag replaces the old one</li>
 *   <li>{@code locked0}: the existing tag wins</li>
 *   <li>{@code r1} absent: the existing tag wins</li>
 *   <li>otherwise: {@code (r0 + "; " + r1, locked1)}</li>
 * </ul>
 */
public final class FallbackTagStore {

    private static final Logger logger = LoggerFactory.getLogger(FallbackTagStore.class);

    private final Map<PhysicalPlan, FallbackTag> tags = new IdentityHashMap<>();
    private final Map<PhysicalPlan, String> origins = new IdentityHashMap<>();
    private final boolean recordOrigin;

    /**
     * Creates an empty store that does not record tag origins.
     */
    public FallbackTagStore() {
        this(false);
    }

    /**
     * Creates an empty store.
     *
     * @param recordOrigin whether to remember the call stack that last tagged each node
     */
    public FallbackTagStore(boolean recordOrigin) {
        this.recordOrigin = recordOrigin;
    }

    /**
     * Records a tag on a node, merging with any existing tag.
     *
     * @param plan the node
     * @param tag the new tag
     * @throws IllegalStateException if the node is tagged and either tag is not {@link Unsupported}
     */
    public void tag(PhysicalPlan plan, FallbackTag tag) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(tag, "tag must not be null");
        FallbackTag existing = tags.get(plan);
        FallbackTag merged = existing == null ? tag : merge(existing, tag);
        tags.put(plan, merged);
        if (recordOrigin) {
            origins.put(plan, ExceptionUtils.getStackTrace(new Throwable("Fallback tag origin")));
        }
        if (logger.isTraceEnabled()) {
            logger.trace("Tagged {}: {}", plan.nodeName(), merged.describe());
        }
    }

    private static FallbackTag merge(FallbackTag existing, FallbackTag incoming) {
        if (!(existing instanceof Unsupported) || !(incoming instanceof Unsupported)) {
            throw new IllegalStateException(String.format(
                "Cannot merge fallback tags of different kinds: %s and %s", existing, incoming));
        }
        Unsupported current = (Unsupported) existing;
        Unsupported next = (Unsupported) incoming;
        if (current.reason().isEmpty()) {
            return next;
        }
        if (current.locked() || next.reason().isEmpty()) {
            return current;
        }
        return new Unsupported(
            Optional.of(current.reason().get() + "; " + next.reason().get()), next.locked());
    }

    /**
     * Removes the tag of a node. Does nothing when the node is untagged.
     *
     * @param plan the node
     */
    public void untag(PhysicalPlan plan) {
        tags.remove(plan);
        origins.remove(plan);
    }

    /**
     * Tags a node with an appendable reason.
     *
     * @param plan the node
     * @param reason the reason
     */
    public void add(PhysicalPlan plan, String reason) {
        tag(plan, Unsupported.appendable(reason));
    }

    /**
     * Tags a node when the outcome failed. A passed outcome leaves the node untouched.
     *
     * @param plan the node
     * @param outcome the validation outcome
     */
    public void add(PhysicalPlan plan, ValidationOutcome outcome) {
        outcome.reason().ifPresent(reason -> add(plan, reason));
    }

    /**
     * Tags every node of a subtree, leaving alone any subtree already committed to the
     * native engine. A node reachable through several parents is tagged once.
     *
     * @param root the subtree root
     * @param tag the tag
     */
    public void addRecursively(PhysicalPlan root, FallbackTag tag) {
        addRecursively(root, tag, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private void addRecursively(PhysicalPlan node, FallbackTag tag, Set<PhysicalPlan> seen) {
        if (node.isNative() || !seen.add(node)) {
            return;
        }
        tag(node, tag);
        for (PhysicalPlan child : node.children()) {
            addRecursively(child, tag, seen);
        }
    }

    /**
     * Moves the tag of a node, and its recorded origin, to the node that replaces it.
     * Does nothing when {@code from} is untagged.
     *
     * @param from the replaced node
     * @param to the replacement
     */
    public void transfer(PhysicalPlan from, PhysicalPlan to) {
        FallbackTag tag = tags.remove(from);
        if (tag == null) {
            return;
        }
        String origin = origins.remove(from);
        FallbackTag existing = tags.get(to);
        tags.put(to, existing == null ? tag : merge(existing, tag));
        if (origin != null) {
            origins.put(to, origin);
        }
    }

    /**
     * Returns whether a node carries a tag.
     *
     * @param plan the node
     * @return true when tagged
     */
    public boolean nonEmpty(PhysicalPlan plan) {
        return tags.containsKey(plan);
    }

    /**
     * Returns whether a node may be offloaded, i.e. carries no tag.
     *
     * @param plan the node
     * @return true when untagged
     */
    public boolean maybeOffloadable(PhysicalPlan plan) {
        return !nonEmpty(plan);
    }

    /**
     * Returns the tag of a node.
     *
     * @param plan the node
     * @return the tag
     * @throws IllegalStateException if the node is untagged
     */
    public FallbackTag getTag(PhysicalPlan plan) {
        FallbackTag tag = tags.get(plan);
        if (tag == null) {
            throw new IllegalStateException("Fallback tag not set in plan: " + plan.nodeName());
        }
        return tag;
    }

    public Optional<FallbackTag> getTagOption(PhysicalPlan plan) {
        return Optional.ofNullable(tags.get(plan));
    }

    /**
     * Returns the recorded origin of the tag of a node.
     *
     * @param plan the node
     * @return the stack trace of the last tagging call; empty when origin recording is off
     */
    public Optional<String> origin(PhysicalPlan plan) {
        return Optional.ofNullable(origins.get(plan));
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public int size() {
        return tags.size();
    }

    /**
     * Removes every tag.
     */
    public void clear() {
        tags.clear();
        origins.clear();
    }
}
