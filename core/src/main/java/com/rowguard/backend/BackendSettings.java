package com.rowguard.backend;

import com.rowguard.plan.FileFormat;
import com.rowguard.plan.JoinExec;
import com.rowguard.plan.NodeKind;
import com.rowguard.plan.Partitioning;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.types.DataType;
import com.rowguard.types.StructField;

import java.util.List;

/**
 * Capabilities of the native backend the offload engine targets.
 *
 * <p>The fallback rules consult these predicates to reject nodes the backend cannot run,
 * before any per-node transform is attempted. Implementations must be side-effect free.
 */
public interface BackendSettings {

    /** Whether the backend implements its own columnar shuffle. */
    boolean supportColumnarShuffleExec();

    boolean supportSortMergeJoinExec();

    boolean supportCartesianProductExec();

    boolean supportBroadcastNestedLoopJoinExec();

    /** Whether the backend can write files natively. */
    boolean enableNativeWriteFiles();

    /**
     * Whether sort aggregates are replaced with hash aggregates before offload. A sort
     * aggregate is only offloadable when this holds.
     */
    boolean replaceSortAggWithHashAgg();

    /** Whether the backend evaluates arrow python UDFs natively through a columnar path. */
    boolean supportColumnarArrowUdf();

    /**
     * Whether the given node must fall back when one of its children produces no columns.
     *
     * @param plan the node
     * @return true when zero-column input is not supported for this node
     */
    boolean fallbackOnEmptySchema(PhysicalPlan plan);

    /**
     * Whether the backend implements the given function.
     *
     * @param functionName lower-case function name
     * @return true when supported
     */
    boolean supportsFunction(String functionName);

    /**
     * Whether the backend can represent values of the given type.
     *
     * @param dataType the type
     * @return true when supported
     */
    boolean supportsType(DataType dataType);

    /**
     * Whether the backend can read the given format with the given schema.
     *
     * @param format the file format
     * @param fields the fields to read
     * @return true when supported
     */
    boolean supportFileFormatRead(FileFormat format, List<StructField> fields);

    boolean supportFileFormatWrite(FileFormat format);

    /**
     * Whether the backend supports a join type for a join strategy.
     *
     * @param joinKind one of the join kinds
     * @param joinType the join semantics
     * @return true when supported
     */
    boolean supportJoinType(NodeKind joinKind, JoinExec.JoinType joinType);

    boolean supportPartitioning(Partitioning.Scheme scheme);

    boolean supportGenerator(String generatorName);
}
