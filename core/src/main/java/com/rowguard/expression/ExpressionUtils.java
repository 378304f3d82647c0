package com.rowguard.expression;

/**
 * Utility methods for inspecting expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns the depth of an expression tree. A leaf has depth 1.
     *
     * @param expr the expression
     * @return the depth
     */
    public static int treeDepth(Expression expr) {
        int maxChild = 0;
        for (Expression child : expr.children()) {
            maxChild = Math.max(maxChild, treeDepth(child));
        }
        return maxChild + 1;
    }
}
