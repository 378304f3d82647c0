package com.rowguard.plan;

/**
 * Storage formats a scan may read or a write may produce.
 */
public enum FileFormat {
    PARQUET,
    ORC,
    CSV,
    JSON,
    TEXT,
    AVRO,
    DWRF,
    HIVE_TEXT
}
