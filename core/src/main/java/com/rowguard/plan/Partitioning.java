package com.rowguard.plan;

import com.rowguard.expression.Expression;

import java.util.List;
import java.util.Objects;

/**
 * How a shuffle distributes rows across output partitions.
 *
 * @param scheme the partitioning scheme
 * @param keys partitioning keys (hash and range partitioning only)
 * @param numPartitions number of output partitions
 */
public record Partitioning(Scheme scheme, List<Expression> keys, int numPartitions) {

    public enum Scheme {
        HASH,
        RANGE,
        ROUND_ROBIN,
        SINGLE,
        // Custom partitioners supplied by the user code
        OTHER
    }

    public Partitioning {
        Objects.requireNonNull(scheme, "scheme must not be null");
        keys = List.copyOf(keys);
        if (numPartitions < 1) {
            throw new IllegalArgumentException("numPartitions must be positive: " + numPartitions);
        }
    }

    public static Partitioning hash(List<Expression> keys, int numPartitions) {
        return new Partitioning(Scheme.HASH, keys, numPartitions);
    }

    public static Partitioning roundRobin(int numPartitions) {
        return new Partitioning(Scheme.ROUND_ROBIN, List.of(), numPartitions);
    }

    public static Partitioning single() {
        return new Partitioning(Scheme.SINGLE, List.of(), 1);
    }
}
