package com.rowguard.expression;

import com.rowguard.types.DataType;

import java.util.List;

/**
 * Base interface for the expressions held by physical plan nodes.
 *
 * <p>Expressions are read-only here: offload validation walks them to decide whether a
 * native backend can evaluate them (known functions, supported types, bounded depth),
 * it never evaluates them.
 *
 * <p>Expressions appear in:
 * <ul>
 *   <li>project lists and filter conditions</li>
 *   <li>grouping and aggregate expressions</li>
 *   <li>join keys and join conditions</li>
 *   <li>sort orders, partitioning keys and window specifications</li>
 * </ul>
 */
public interface Expression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();

    /**
     * Returns the direct sub-expressions of this expression.
     *
     * @return the children, empty for leaves
     */
    List<Expression> children();

    /**
     * Returns a short name used in fallback reasons and logs.
     *
     * @return the expression name
     */
    String prettyName();
}
