package com.rowguard.backend;

import com.rowguard.plan.FileFormat;
import com.rowguard.plan.JoinExec;
import com.rowguard.plan.NodeKind;
import com.rowguard.plan.Partitioning;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.types.ArrayType;
import com.rowguard.types.DataType;
import com.rowguard.types.DecimalType;
import com.rowguard.types.MapType;
import com.rowguard.types.PrimitiveType;
import com.rowguard.types.StructField;
import com.rowguard.types.StructType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Table-driven {@link BackendSettings}.
 *
 * <p>The defaults describe a vectorized backend comparable to a typical columnar engine:
 * columnar shuffle, native writes, sort-merge join, parquet/orc/dwrf reads and the
 * common scalar and aggregate functions. Every capability can be changed through
 * {@link #builder()}.
 *
 * <p>Example:
 * <pre>
 *   BackendSettings settings = DefaultBackendSettings.builder()
 *       .supportSortMergeJoinExec(false)
 *       .unsupportedFunction("regexp_extract")
 *       .build();
 * </pre>
 */
public final class DefaultBackendSettings implements BackendSettings {

    /** Functions understood by the default backend. */
    public static final Set<String> DEFAULT_FUNCTIONS = Set.of(
        // comparison and logic
        "equalto", "=", "<>", "<", "<=", ">", ">=", "and", "or", "not", "isnull", "isnotnull", "in",
        "coalesce", "if", "casewhen",
        // arithmetic
        "+", "-", "*", "/", "%", "add", "subtract", "multiply", "divide", "abs", "round", "floor", "ceil",
        // strings
        "upper", "lower", "substring", "concat", "length", "trim", "like", "contains", "startswith",
        "endswith", "regexp_extract",
        // dates
        "year", "month", "dayofmonth", "date_add", "date_sub", "datediff",
        // casts and hashing
        "cast", "hash", "murmur3hash", "md5",
        // aggregates
        "sum", "count", "avg", "min", "max", "first", "last", "stddev", "variance",
        "collect_list", "collect_set", "approx_count_distinct",
        // window
        "row_number", "rank", "dense_rank", "percent_rank", "cume_dist", "ntile", "lag", "lead",
        // generators
        "explode", "posexplode", "inline", "json_tuple", "stack");

    private static final BackendSettings DEFAULT = builder().build();

    private final boolean columnarShuffle;
    private final boolean sortMergeJoin;
    private final boolean cartesianProduct;
    private final boolean broadcastNestedLoopJoin;
    private final boolean nativeWriteFiles;
    private final boolean replaceSortAggWithHashAgg;
    private final boolean columnarArrowUdf;
    private final Set<NodeKind> emptySchemaFallbackKinds;
    private final Set<String> functions;
    private final Predicate<DataType> typeSupport;
    private final Set<FileFormat> readFormats;
    private final Set<FileFormat> writeFormats;
    private final Map<NodeKind, Set<JoinExec.JoinType>> joinTypes;
    private final Set<Partitioning.Scheme> partitionings;
    private final Set<String> generators;

    private DefaultBackendSettings(Builder builder) {
        this.columnarShuffle = builder.columnarShuffle;
        this.sortMergeJoin = builder.sortMergeJoin;
        this.cartesianProduct = builder.cartesianProduct;
        this.broadcastNestedLoopJoin = builder.broadcastNestedLoopJoin;
        this.nativeWriteFiles = builder.nativeWriteFiles;
        this.replaceSortAggWithHashAgg = builder.replaceSortAggWithHashAgg;
        this.columnarArrowUdf = builder.columnarArrowUdf;
        this.emptySchemaFallbackKinds = Collections.unmodifiableSet(EnumSet.copyOf(builder.emptySchemaFallbackKinds));
        this.functions = Set.copyOf(builder.functions);
        this.typeSupport = builder.typeSupport;
        this.readFormats = Collections.unmodifiableSet(EnumSet.copyOf(builder.readFormats));
        this.writeFormats = Collections.unmodifiableSet(EnumSet.copyOf(builder.writeFormats));
        Map<NodeKind, Set<JoinExec.JoinType>> joins = new EnumMap<>(NodeKind.class);
        builder.joinTypes.forEach((kind, types) ->
            joins.put(kind, Collections.unmodifiableSet(EnumSet.copyOf(types))));
        this.joinTypes = Collections.unmodifiableMap(joins);
        this.partitionings = Collections.unmodifiableSet(EnumSet.copyOf(builder.partitionings));
        this.generators = Set.copyOf(builder.generators);
    }

    /**
     * Returns the settings with every default capability.
     *
     * @return the shared default instance
     */
    public static BackendSettings defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean supportColumnarShuffleExec() {
        return columnarShuffle;
    }

    @Override
    public boolean supportSortMergeJoinExec() {
        return sortMergeJoin;
    }

    @Override
    public boolean supportCartesianProductExec() {
        return cartesianProduct;
    }

    @Override
    public boolean supportBroadcastNestedLoopJoinExec() {
        return broadcastNestedLoopJoin;
    }

    @Override
    public boolean enableNativeWriteFiles() {
        return nativeWriteFiles;
    }

    @Override
    public boolean replaceSortAggWithHashAgg() {
        return replaceSortAggWithHashAgg;
    }

    @Override
    public boolean supportColumnarArrowUdf() {
        return columnarArrowUdf;
    }

    @Override
    public boolean fallbackOnEmptySchema(PhysicalPlan plan) {
        return emptySchemaFallbackKinds.contains(plan.kind());
    }

    @Override
    public boolean supportsFunction(String functionName) {
        return functions.contains(functionName.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean supportsType(DataType dataType) {
        return typeSupport.test(dataType);
    }

    @Override
    public boolean supportFileFormatRead(FileFormat format, List<StructField> fields) {
        if (!readFormats.contains(format)) {
            return false;
        }
        for (StructField field : fields) {
            if (!supportsType(field.dataType())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean supportFileFormatWrite(FileFormat format) {
        return writeFormats.contains(format);
    }

    @Override
    public boolean supportJoinType(NodeKind joinKind, JoinExec.JoinType joinType) {
        return joinTypes.getOrDefault(joinKind, Collections.emptySet()).contains(joinType);
    }

    @Override
    public boolean supportPartitioning(Partitioning.Scheme scheme) {
        return partitionings.contains(scheme);
    }

    @Override
    public boolean supportGenerator(String generatorName) {
        return generators.contains(generatorName.toLowerCase(Locale.ROOT));
    }

    /**
     * Type support of the default backend: every primitive type except {@code null},
     * decimals, and arrays, maps and structs of supported types.
     *
     * @param dataType the type
     * @return true when supported
     */
    static boolean defaultTypeSupport(DataType dataType) {
        if (dataType instanceof PrimitiveType primitive) {
            return primitive != PrimitiveType.NULL;
        }
        if (dataType instanceof DecimalType) {
            return true;
        }
        if (dataType instanceof ArrayType array) {
            return defaultTypeSupport(array.elementType());
        }
        if (dataType instanceof MapType map) {
            return defaultTypeSupport(map.keyType()) && defaultTypeSupport(map.valueType());
        }
        if (dataType instanceof StructType struct) {
            for (StructField field : struct.fields()) {
                if (!defaultTypeSupport(field.dataType())) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * Builder for {@link DefaultBackendSettings}. Starts from the default capabilities.
     */
    public static final class Builder {
        private boolean columnarShuffle = true;
        private boolean sortMergeJoin = true;
        private boolean cartesianProduct = true;
        private boolean broadcastNestedLoopJoin = true;
        private boolean nativeWriteFiles = true;
        private boolean replaceSortAggWithHashAgg = false;
        private boolean columnarArrowUdf = false;
        private final Set<NodeKind> emptySchemaFallbackKinds = EnumSet.noneOf(NodeKind.class);
        private final Set<String> functions = new HashSet<>(DEFAULT_FUNCTIONS);
        private Predicate<DataType> typeSupport = DefaultBackendSettings::defaultTypeSupport;
        private final Set<FileFormat> readFormats = EnumSet.of(FileFormat.PARQUET, FileFormat.ORC, FileFormat.DWRF);
        private final Set<FileFormat> writeFormats = EnumSet.of(FileFormat.PARQUET);
        private final Map<NodeKind, Set<JoinExec.JoinType>> joinTypes = new EnumMap<>(NodeKind.class);
        private final Set<Partitioning.Scheme> partitionings = EnumSet.of(
            Partitioning.Scheme.HASH, Partitioning.Scheme.RANGE, Partitioning.Scheme.ROUND_ROBIN,
            Partitioning.Scheme.SINGLE);
        private final Set<String> generators = new HashSet<>(Set.of("explode", "posexplode", "inline", "stack"));

        private Builder() {
            Set<JoinExec.JoinType> hashJoinTypes = EnumSet.of(
                JoinExec.JoinType.INNER, JoinExec.JoinType.LEFT_OUTER, JoinExec.JoinType.RIGHT_OUTER,
                JoinExec.JoinType.FULL_OUTER, JoinExec.JoinType.LEFT_SEMI, JoinExec.JoinType.LEFT_ANTI,
                JoinExec.JoinType.EXISTENCE);
            joinTypes.put(NodeKind.SHUFFLED_HASH_JOIN, EnumSet.copyOf(hashJoinTypes));
            joinTypes.put(NodeKind.BROADCAST_HASH_JOIN, EnumSet.copyOf(hashJoinTypes));
            joinTypes.put(NodeKind.SORT_MERGE_JOIN, EnumSet.of(
                JoinExec.JoinType.INNER, JoinExec.JoinType.LEFT_OUTER, JoinExec.JoinType.RIGHT_OUTER,
                JoinExec.JoinType.LEFT_SEMI, JoinExec.JoinType.LEFT_ANTI));
            joinTypes.put(NodeKind.CARTESIAN_PRODUCT, EnumSet.of(
                JoinExec.JoinType.INNER, JoinExec.JoinType.CROSS));
            joinTypes.put(NodeKind.BROADCAST_NESTED_LOOP_JOIN, EnumSet.of(
                JoinExec.JoinType.INNER, JoinExec.JoinType.CROSS, JoinExec.JoinType.LEFT_OUTER,
                JoinExec.JoinType.RIGHT_OUTER));
        }

        public Builder supportColumnarShuffleExec(boolean value) {
            this.columnarShuffle = value;
            return this;
        }

        public Builder supportSortMergeJoinExec(boolean value) {
            this.sortMergeJoin = value;
            return this;
        }

        public Builder supportCartesianProductExec(boolean value) {
            this.cartesianProduct = value;
            return this;
        }

        public Builder supportBroadcastNestedLoopJoinExec(boolean value) {
            this.broadcastNestedLoopJoin = value;
            return this;
        }

        public Builder enableNativeWriteFiles(boolean value) {
            this.nativeWriteFiles = value;
            return this;
        }

        public Builder replaceSortAggWithHashAgg(boolean value) {
            this.replaceSortAggWithHashAgg = value;
            return this;
        }

        public Builder supportColumnarArrowUdf(boolean value) {
            this.columnarArrowUdf = value;
            return this;
        }

        /**
         * Makes nodes of the given kind fall back when a child has an empty output.
         *
         * @param kind the node kind
         * @return this builder
         */
        public Builder fallbackOnEmptySchema(NodeKind kind) {
            emptySchemaFallbackKinds.add(Objects.requireNonNull(kind, "kind must not be null"));
            return this;
        }

        public Builder supportedFunction(String name) {
            functions.add(name.toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder unsupportedFunction(String name) {
            functions.remove(name.toLowerCase(Locale.ROOT));
            return this;
        }

        /**
         * Replaces the type-support predicate.
         *
         * @param predicate returns true for supported types
         * @return this builder
         */
        public Builder typeSupport(Predicate<DataType> predicate) {
            this.typeSupport = Objects.requireNonNull(predicate, "predicate must not be null");
            return this;
        }

        public Builder readFormats(FileFormat first, FileFormat... rest) {
            readFormats.clear();
            readFormats.addAll(EnumSet.of(first, rest));
            return this;
        }

        public Builder writeFormats(FileFormat first, FileFormat... rest) {
            writeFormats.clear();
            writeFormats.addAll(EnumSet.of(first, rest));
            return this;
        }

        public Builder unsupportedJoinType(NodeKind joinKind, JoinExec.JoinType joinType) {
            Set<JoinExec.JoinType> types = joinTypes.get(joinKind);
            if (types != null) {
                types.remove(joinType);
            }
            return this;
        }

        public Builder unsupportedPartitioning(Partitioning.Scheme scheme) {
            partitionings.remove(scheme);
            return this;
        }

        public Builder unsupportedGenerator(String name) {
            generators.remove(name.toLowerCase(Locale.ROOT));
            return this;
        }

        public DefaultBackendSettings build() {
            return new DefaultBackendSettings(this);
        }
    }
}
