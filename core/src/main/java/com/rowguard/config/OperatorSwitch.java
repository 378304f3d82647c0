package com.rowguard.config;

/**
 * User switches that enable or disable offloading of one operator family.
 */
public enum OperatorSwitch {

    FILE_SCAN("filescan"),
    BATCH_SCAN("batchscan"),
    HIVE_TABLE_SCAN("hivetablescan"),
    PROJECT("project"),
    FILTER("filter"),
    HASH_AGGREGATE("hashagg"),
    UNION("union"),
    EXPAND("expand"),
    SORT("sort"),
    WINDOW("window"),
    WINDOW_GROUP_LIMIT("windowGroupLimit"),
    SHUFFLE("shuffle"),
    BROADCAST_EXCHANGE("broadcastExchange"),
    SHUFFLED_HASH_JOIN("shuffledHashJoin"),
    SORT_MERGE_JOIN("sortMergeJoin"),
    BROADCAST_HASH_JOIN("broadcastJoin"),
    BROADCAST_NESTED_LOOP_JOIN("broadcastNestedLoopJoin"),
    CARTESIAN_PRODUCT("cartesianProduct"),
    LIMIT("limit"),
    GENERATE("generate"),
    COALESCE("coalesce"),
    TAKE_ORDERED_AND_PROJECT("takeOrderedAndProject"),
    SAMPLE("sample");

    private final String suffix;

    OperatorSwitch(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Returns the configuration key of this switch.
     *
     * @return the full key, e.g. {@code spark.rowguard.sql.columnar.sort}
     */
    public String key() {
        return RowguardDefaults.PREFIX + suffix;
    }
}
