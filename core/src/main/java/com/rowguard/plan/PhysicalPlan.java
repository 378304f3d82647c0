package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Base class for all physical plan nodes handed to the offload engine.
 *
 * <p>A node has a {@link NodeKind}, zero or more ordered children, and an ordered list of
 * output attributes. Kind-specific fields live on the concrete subclasses and are
 * immutable. The offload engine only reads nodes; fallback decisions are recorded in a
 * side table keyed by node identity, never on the node itself.
 *
 * <p>A tree may share a subtree instance between several parents. It is never cyclic.
 * The traversal helpers visit each distinct instance once.
 */
public abstract class PhysicalPlan {

    /** Child nodes in the plan tree */
    protected final List<PhysicalPlan> children;

    /**
     * Creates a leaf node.
     */
    protected PhysicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a node with a single child.
     *
     * @param child the child node
     */
    protected PhysicalPlan(PhysicalPlan child) {
        this.children = Collections.singletonList(Objects.requireNonNull(child, "child must not be null"));
    }

    /**
     * Creates a node with multiple children.
     *
     * @param children the child nodes
     */
    protected PhysicalPlan(List<PhysicalPlan> children) {
        this.children = List.copyOf(children);
    }

    /**
     * Returns the operator kind of this node.
     *
     * @return the kind
     */
    public abstract NodeKind kind();

    /**
     * Returns the columns this node produces, in order.
     *
     * @return the output attributes
     */
    public abstract List<AttributeReference> output();

    /**
     * Returns a copy of this node with the given children, keeping every other field.
     *
     * @param newChildren the replacement children, same arity as {@link #children()}
     * @return the copy
     * @throws IllegalArgumentException if the arity differs
     */
    public abstract PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren);

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<PhysicalPlan> children() {
        return children;
    }

    /**
     * Returns every expression held directly by this node (not by its children).
     *
     * @return the expressions, empty by default
     */
    public List<Expression> expressions() {
        return Collections.emptyList();
    }

    /**
     * Returns the operator name used in fallback reasons.
     *
     * @return the node name
     */
    public String nodeName() {
        return kind().nodeName();
    }

    /**
     * Returns whether the default engine fuses this node into generated code.
     *
     * @return true when codegen-capable
     */
    public boolean supportsCodegen() {
        return kind().supportsCodegen();
    }

    /**
     * Returns whether this node roots a subtree already committed to the native engine.
     * Recursive tagging skips subtrees rooted at such a node.
     *
     * @return true for finalized native-offload boundaries
     */
    public boolean isNative() {
        return false;
    }

    /**
     * Returns the output attributes as a set (compared by expression id).
     *
     * @return the output set
     */
    public Set<AttributeReference> outputSet() {
        return new LinkedHashSet<>(output());
    }

    /**
     * Applies an action to this node and then to its descendants (pre-order).
     *
     * @param action the action
     */
    public void foreach(Consumer<PhysicalPlan> action) {
        foreachDown(this, action, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /**
     * Applies an action to the descendants of this node and then to the node itself
     * (post-order): every child is fully processed before its parent.
     *
     * @param action the action
     */
    public void foreachUp(Consumer<PhysicalPlan> action) {
        foreachUp(this, action, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /**
     * Collects this node and its descendants in pre-order.
     *
     * @return the nodes
     */
    public List<PhysicalPlan> collectNodes() {
        List<PhysicalPlan> nodes = new ArrayList<>();
        foreach(nodes::add);
        return nodes;
    }

    /**
     * Returns an indented, multi-line rendering of the tree rooted here.
     *
     * @return the tree string
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(this, 0, sb);
        return sb.toString();
    }

    protected void checkArity(List<PhysicalPlan> newChildren) {
        if (newChildren.size() != children.size()) {
            throw new IllegalArgumentException(String.format(
                "%s expects %d children but got %d", nodeName(), children.size(), newChildren.size()));
        }
    }

    private static void foreachDown(PhysicalPlan node, Consumer<PhysicalPlan> action, Set<PhysicalPlan> seen) {
        if (!seen.add(node)) {
            return;
        }
        action.accept(node);
        for (PhysicalPlan child : node.children()) {
            foreachDown(child, action, seen);
        }
    }

    private static void foreachUp(PhysicalPlan node, Consumer<PhysicalPlan> action, Set<PhysicalPlan> seen) {
        if (!seen.add(node)) {
            return;
        }
        for (PhysicalPlan child : node.children()) {
            foreachUp(child, action, seen);
        }
        action.accept(node);
    }

    private static void appendTree(PhysicalPlan node, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(node).append('\n');
        for (PhysicalPlan child : node.children()) {
            appendTree(child, depth + 1, sb);
        }
    }

    /**
     * Returns a one-line description of this node (without its children).
     *
     * @return a string representation
     */
    @Override
    public String toString() {
        return nodeName() + " " + output();
    }
}
