package com.rowguard.plan;

/**
 * Closed set of physical operator kinds known to the offload engine.
 *
 * <p>Each kind carries its display name and whether the default engine fuses it into
 * generated code together with adjacent operators. That second property drives the
 * fused-chain fallback heuristic: splitting a long fused chain across two engines costs
 * more than keeping it together.
 */
public enum NodeKind {

    FILE_SOURCE_SCAN("FileSourceScan", true),
    BATCH_SCAN("BatchScan", false),
    HIVE_TABLE_SCAN("HiveTableScan", false),
    RDD_SCAN("RDDScan", true),
    RANGE("Range", true),
    PROJECT("Project", true),
    FILTER("Filter", true),
    HASH_AGGREGATE("HashAggregate", true),
    SORT_AGGREGATE("SortAggregate", false),
    OBJECT_HASH_AGGREGATE("ObjectHashAggregate", false),
    UNION("Union", false),
    EXPAND("Expand", true),
    WRITE_FILES("WriteFiles", false),
    SORT("Sort", true),
    SHUFFLE_EXCHANGE("ShuffleExchange", false),
    BROADCAST_EXCHANGE("BroadcastExchange", false),
    // Shuffled hash and sort-merge joins take part in fused chains through the
    // configurable chain-join predicate, not through this flag.
    SHUFFLED_HASH_JOIN("ShuffledHashJoin", false),
    BROADCAST_HASH_JOIN("BroadcastHashJoin", true),
    SORT_MERGE_JOIN("SortMergeJoin", false),
    CARTESIAN_PRODUCT("CartesianProduct", false),
    BROADCAST_NESTED_LOOP_JOIN("BroadcastNestedLoopJoin", true),
    WINDOW("Window", false),
    WINDOW_GROUP_LIMIT("WindowGroupLimit", false),
    COALESCE("Coalesce", false),
    GLOBAL_LIMIT("GlobalLimit", true),
    LOCAL_LIMIT("LocalLimit", true),
    GENERATE("Generate", true),
    BATCH_EVAL_PYTHON("BatchEvalPython", false),
    ARROW_EVAL_PYTHON("ArrowEvalPython", false),
    TAKE_ORDERED_AND_PROJECT("TakeOrderedAndProject", false),
    SAMPLE("Sample", true),
    AQE_SHUFFLE_READ("AQEShuffleRead", false),
    QUERY_STAGE("QueryStage", false),
    NATIVE_STAGE("NativeStage", false);

    private final String nodeName;
    private final boolean codegen;

    NodeKind(String nodeName, boolean codegen) {
        this.nodeName = nodeName;
        this.codegen = codegen;
    }

    /**
     * Returns the operator name used in fallback reasons and reports.
     *
     * @return the node name
     */
    public String nodeName() {
        return nodeName;
    }

    /**
     * Returns whether operators of this kind fuse into generated code by default.
     *
     * @return true for codegen-capable kinds
     */
    public boolean supportsCodegen() {
        return codegen;
    }

    /**
     * Returns whether this kind reads from a data source.
     *
     * @return true for file source, batch and hive table scans
     */
    public boolean isDataSourceScan() {
        return this == FILE_SOURCE_SCAN || this == BATCH_SCAN || this == HIVE_TABLE_SCAN;
    }

    /**
     * Returns whether this kind is a join.
     *
     * @return true for the five join kinds
     */
    public boolean isJoin() {
        return this == SHUFFLED_HASH_JOIN || this == BROADCAST_HASH_JOIN || this == SORT_MERGE_JOIN
            || this == CARTESIAN_PRODUCT || this == BROADCAST_NESTED_LOOP_JOIN;
    }

    public boolean isAggregate() {
        return this == HASH_AGGREGATE || this == SORT_AGGREGATE || this == OBJECT_HASH_AGGREGATE;
    }
}
