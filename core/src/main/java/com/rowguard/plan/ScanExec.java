package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;
import com.rowguard.types.StructType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Physical plan node reading a table from a data source.
 *
 * <p>Three kinds share this class:
 * <ul>
 *   <li>{@link NodeKind#FILE_SOURCE_SCAN} - file based source (parquet, orc, ...).
 *       May carry partition filters pushed in by the planner.</li>
 *   <li>{@link NodeKind#BATCH_SCAN} - connector (v2) source. May carry runtime filters
 *       from dynamic partition pruning.</li>
 *   <li>{@link NodeKind#HIVE_TABLE_SCAN} - hive serde table.</li>
 * </ul>
 *
 * <p>Data filters are the predicates the source evaluates while reading; they do not
 * change which nodes are dispatched for validation. Partition and runtime filters do:
 * a scan with such filters is left to the filter operators above it.
 */
public final class ScanExec extends LeafExec {

    private final NodeKind kind;
    private final String tableName;
    private final FileFormat format;
    private final List<AttributeReference> output;
    private final List<Expression> dataFilters;
    private final List<Expression> partitionFilters;
    private final List<Expression> runtimeFilters;

    /**
     * Creates a scan node.
     *
     * @param kind one of the data source scan kinds
     * @param tableName the table or path being read
     * @param format the storage format
     * @param output the columns produced
     * @param dataFilters predicates evaluated by the reader
     * @param partitionFilters partition pruning predicates (file source scans only)
     * @param runtimeFilters dynamic pruning predicates (batch scans only)
     */
    public ScanExec(NodeKind kind, String tableName, FileFormat format, List<AttributeReference> output,
                    List<Expression> dataFilters, List<Expression> partitionFilters,
                    List<Expression> runtimeFilters) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (!kind.isDataSourceScan()) {
            throw new IllegalArgumentException("Not a data source scan kind: " + kind);
        }
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.output = List.copyOf(output);
        this.dataFilters = List.copyOf(dataFilters);
        this.partitionFilters = List.copyOf(partitionFilters);
        this.runtimeFilters = List.copyOf(runtimeFilters);
        if (kind != NodeKind.FILE_SOURCE_SCAN && !partitionFilters.isEmpty()) {
            throw new IllegalArgumentException("partition filters are only valid on file source scans");
        }
        if (kind != NodeKind.BATCH_SCAN && !runtimeFilters.isEmpty()) {
            throw new IllegalArgumentException("runtime filters are only valid on batch scans");
        }
    }

    public static ScanExec fileSource(String tableName, FileFormat format, StructType schema) {
        return new ScanExec(NodeKind.FILE_SOURCE_SCAN, tableName, format,
            AttributeReference.fromSchema(schema), List.of(), List.of(), List.of());
    }

    public static ScanExec batch(String tableName, FileFormat format, StructType schema) {
        return new ScanExec(NodeKind.BATCH_SCAN, tableName, format,
            AttributeReference.fromSchema(schema), List.of(), List.of(), List.of());
    }

    public static ScanExec hiveTable(String tableName, FileFormat format, StructType schema) {
        return new ScanExec(NodeKind.HIVE_TABLE_SCAN, tableName, format,
            AttributeReference.fromSchema(schema), List.of(), List.of(), List.of());
    }

    /**
     * Returns a copy of this file source scan with partition filters pushed in.
     *
     * @param filters the partition filters
     * @return the copy
     */
    public ScanExec withPartitionFilters(List<Expression> filters) {
        return new ScanExec(kind, tableName, format, output, dataFilters, filters, runtimeFilters);
    }

    /**
     * Returns a copy of this batch scan with runtime filters attached.
     *
     * @param filters the runtime filters
     * @return the copy
     */
    public ScanExec withRuntimeFilters(List<Expression> filters) {
        return new ScanExec(kind, tableName, format, output, dataFilters, partitionFilters, filters);
    }

    public ScanExec withDataFilters(List<Expression> filters) {
        return new ScanExec(kind, tableName, format, output, filters, partitionFilters, runtimeFilters);
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    public String tableName() {
        return tableName;
    }

    public FileFormat format() {
        return format;
    }

    public List<Expression> dataFilters() {
        return dataFilters;
    }

    public List<Expression> partitionFilters() {
        return partitionFilters;
    }

    public List<Expression> runtimeFilters() {
        return runtimeFilters;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(dataFilters);
        all.addAll(partitionFilters);
        all.addAll(runtimeFilters);
        return all;
    }

    @Override
    public String toString() {
        return String.format("%s %s(%s) %s", nodeName(), tableName, format, output);
    }
}
