package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Writes the rows of its child to files. Produces no columns.
 */
public final class WriteFilesExec extends UnaryExec {

    private final FileFormat fileFormat;
    private final List<AttributeReference> partitionColumns;
    private final OptionalInt numBuckets;
    private final Map<String, String> options;
    private final Map<String, String> staticPartitions;

    /**
     * Creates a write node.
     *
     * @param child the rows to write
     * @param fileFormat the output format
     * @param partitionColumns dynamic partition columns
     * @param numBuckets bucket count when the table is bucketed
     * @param options writer options
     * @param staticPartitions partition values fixed by the statement
     */
    public WriteFilesExec(PhysicalPlan child, FileFormat fileFormat, List<AttributeReference> partitionColumns,
                          OptionalInt numBuckets, Map<String, String> options, Map<String, String> staticPartitions) {
        super(child);
        this.fileFormat = Objects.requireNonNull(fileFormat, "fileFormat must not be null");
        this.partitionColumns = List.copyOf(partitionColumns);
        this.numBuckets = Objects.requireNonNull(numBuckets, "numBuckets must not be null");
        this.options = Map.copyOf(options);
        this.staticPartitions = Map.copyOf(staticPartitions);
    }

    public WriteFilesExec(PhysicalPlan child, FileFormat fileFormat) {
        this(child, fileFormat, List.of(), OptionalInt.empty(), Map.of(), Map.of());
    }

    public FileFormat fileFormat() {
        return fileFormat;
    }

    public List<AttributeReference> partitionColumns() {
        return partitionColumns;
    }

    public OptionalInt numBuckets() {
        return numBuckets;
    }

    public Map<String, String> options() {
        return options;
    }

    public Map<String, String> staticPartitions() {
        return staticPartitions;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WRITE_FILES;
    }

    @Override
    public List<AttributeReference> output() {
        return List.of();
    }

    @Override
    protected WriteFilesExec withNewChild(PhysicalPlan newChild) {
        return new WriteFilesExec(newChild, fileFormat, partitionColumns, numBuckets, options, staticPartitions);
    }

    @Override
    public String toString() {
        return "WriteFiles " + fileFormat;
    }
}
