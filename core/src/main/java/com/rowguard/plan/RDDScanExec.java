package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;

import java.util.List;
import java.util.Objects;

/**
 * Scan over rows produced in memory by the default engine.
 *
 * <p>The planner uses a named instance, {@code OneRowRelation}, as the synthetic single-row
 * source of queries without a FROM clause. That relation has no columns.
 */
public final class RDDScanExec extends LeafExec {

    public static final String ONE_ROW_RELATION = "OneRowRelation";

    private final List<AttributeReference> output;
    private final String name;

    public RDDScanExec(List<AttributeReference> output, String name) {
        this.output = List.copyOf(output);
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Creates the zero-column single-row relation.
     *
     * @return the relation
     */
    public static RDDScanExec oneRowRelation() {
        return new RDDScanExec(List.of(), ONE_ROW_RELATION);
    }

    public String name() {
        return name;
    }

    public boolean isOneRowRelation() {
        return ONE_ROW_RELATION.equals(name);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RDD_SCAN;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public String toString() {
        return String.format("Scan %s %s", name, output);
    }
}
