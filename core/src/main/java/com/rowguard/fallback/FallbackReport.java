package com.rowguard.fallback;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rowguard.plan.PhysicalPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Per-node summary of a tagged tree, for logs and tooling.
 *
 * <p>Entries are listed in pre-order. A subtree shared by several parents is listed once,
 * under its first parent.
 */
public final class FallbackReport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * One node of the report.
     *
     * @param depth distance from the root
     * @param node the node name
     * @param offloadable whether the node carries no tag
     * @param reason the fallback reason, null when offloadable
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(int depth, String node, boolean offloadable, String reason) {
    }

    private final List<Entry> entries;

    private FallbackReport(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * Builds the report of a tree.
     *
     * @param plan the root
     * @param tags the tags
     * @return the report
     */
    public static FallbackReport of(PhysicalPlan plan, FallbackTagStore tags) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(tags, "tags must not be null");
        List<Entry> entries = new ArrayList<>();
        collect(plan, 0, tags, entries, Collections.newSetFromMap(new IdentityHashMap<>()));
        return new FallbackReport(entries);
    }

    private static void collect(PhysicalPlan node, int depth, FallbackTagStore tags, List<Entry> out,
                                Set<PhysicalPlan> seen) {
        if (!seen.add(node)) {
            return;
        }
        String reason = tags.getTagOption(node).map(FallbackTag::describe).orElse(null);
        out.add(new Entry(depth, node.nodeName(), reason == null, reason));
        for (PhysicalPlan child : node.children()) {
            collect(child, depth + 1, tags, out, seen);
        }
    }

    public List<Entry> entries() {
        return entries;
    }

    public long fallbackCount() {
        return entries.stream().filter(entry -> !entry.offloadable()).count();
    }

    /**
     * Renders the report as a JSON array.
     *
     * @return the JSON text
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render fallback report", e);
        }
    }

    /**
     * Renders the report as an indented tree, one node per line.
     *
     * @return the tree string
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        for (Entry entry : entries) {
            sb.append("  ".repeat(entry.depth()))
              .append(entry.offloadable() ? "+ " : "- ")
              .append(entry.node());
            if (entry.reason() != null) {
                sb.append(" [").append(entry.reason()).append(']');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return treeString();
    }
}
