package com.rowguard.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Default values of every configuration key read by the fallback engine.
 *
 * <p>User-supplied settings are layered over these defaults by {@link RowguardConfig}.
 */
public final class RowguardDefaults {

    public static final String PREFIX = "spark.rowguard.sql.columnar.";

    public static final String ANSI_ENABLED = "spark.sql.ansi.enabled";
    public static final String SCAN_ONLY = PREFIX + "scanOnly";
    public static final String JOIN_OPTIMIZE_ENABLED = PREFIX + "physicalJoinOptimizeEnable";
    public static final String JOIN_OPTIMIZATION_LEVEL = PREFIX + "physicalJoinOptimizationLevel";
    public static final String FORCE_SHUFFLED_HASH_JOIN = PREFIX + "forceShuffledHashJoin";
    public static final String EXPRESSION_DEPTH_THRESHOLD = PREFIX + "fallback.expressions.threshold";
    public static final String ONE_ROW_RELATION = PREFIX + "oneRowRelation";
    public static final String ARROW_UDF = PREFIX + "arrowUdf";
    public static final String RECORD_TAG_ORIGIN = PREFIX + "fallback.recordTagOrigin";

    /**
     * Returns the default settings.
     *
     * @return a fresh, mutable map of default key-value pairs
     */
    public static Map<String, String> getDefaults() {
        Map<String, String> defaults = new HashMap<>();

        // SQL behavior
        defaults.put(ANSI_ENABLED, "false");

        // Fallback heuristics
        defaults.put(SCAN_ONLY, "false");
        defaults.put(JOIN_OPTIMIZE_ENABLED, "false");
        defaults.put(JOIN_OPTIMIZATION_LEVEL, "12");
        defaults.put(FORCE_SHUFFLED_HASH_JOIN, "true");
        defaults.put(EXPRESSION_DEPTH_THRESHOLD, "50");
        defaults.put(RECORD_TAG_ORIGIN, "false");

        // Structural fixups
        defaults.put(ONE_ROW_RELATION, "true");

        // Python UDFs
        defaults.put(ARROW_UDF, "true");

        // Per-operator switches
        for (OperatorSwitch op : OperatorSwitch.values()) {
            defaults.put(op.key(), "true");
        }

        return defaults;
    }

    private RowguardDefaults() {
        // Utility class - prevent instantiation
    }
}
