package com.geoshard.application.service;

import com.geoshard.domain.model.CellId;
import com.geoshard.domain.model.LoadStatistics;
import com.geoshard.domain.model.ScoredCellSet;
import com.geoshard.domain.model.Shard;
import com.geoshard.domain.model.ShardCollection;
import com.geoshard.infrastructure.exception.BuildInvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Cuts the scored cells, in CellId order, into contiguous shards with the most even load.
 *
 * Every integer capacity between {@code totalLoad / maxShardCount} and
 * {@code totalLoad / minShardCount} is tried with a greedy linear scan: a shard is closed before
 * the cell whose score would make its load reach or exceed the capacity, and that cell opens the
 * next shard. A shard always holds at least one cell, so a cell scoring at or above capacity ends
 * up alone. Partitions whose shard count falls outside the bounds are discarded; among the rest
 * the smallest population standard deviation wins, the smallest capacity on ties.
 *
 * When no capacity yields an admissible shard count (all scores zero, or load concentrated in a
 * handful of cells) every shard count in the bounds is tried instead, cutting at the load
 * quantiles, or at cell-count quantiles when there is no load at all.
 *
 * Scores must be non-negative. Load only grows along the scan, so each greedy cut is found by
 * binary search over prefix sums rather than cell by cell.
 */
public class ShardPartitioner {

    private static final Logger log = LoggerFactory.getLogger(ShardPartitioner.class);

    public static final String DEFAULT_SHARD_NAME_PREFIX = "geoshard_user_index_";

    private final String shardNamePrefix;

    public ShardPartitioner() {
        this(DEFAULT_SHARD_NAME_PREFIX);
    }

    public ShardPartitioner(String shardNamePrefix) {
        if (shardNamePrefix == null || shardNamePrefix.isBlank()) {
            throw new IllegalArgumentException("Shard name prefix cannot be empty");
        }
        this.shardNamePrefix = shardNamePrefix;
    }

    /**
     * @throws BuildInvariantViolationException if the cell set is empty, holds a negative score or
     *         its total load overflows a long
     * @throws IllegalArgumentException if the bounds are non-positive, inverted, or ask for more
     *         shards than there are cells
     */
    public ShardCollection partition(ScoredCellSet cells, int minShardCount, int maxShardCount) {
        if (cells.isEmpty()) {
            throw BuildInvariantViolationException.emptyCellSet();
        }
        checkBounds(cells, minShardCount, maxShardCount);

        ScoredCellSet.Snapshot snapshot = cells.snapshot();
        long[] prefix = prefixSums(snapshot);
        long totalLoad = prefix[prefix.length - 1];

        long minCapacity = totalLoad / maxShardCount;
        long maxCapacity = totalLoad / minShardCount;
        log.debug("Searching capacities {}..{} for {} cells with total load {}",
            minCapacity, maxCapacity, snapshot.size(), totalLoad);

        Cuts best = null;
        double bestDeviation = Double.MAX_VALUE;
        long bestCapacity = -1;
        for (long capacity = minCapacity; capacity <= maxCapacity; capacity++) {
            Cuts cuts = greedyCuts(prefix, capacity, maxShardCount);
            if (cuts == null || cuts.shardCount() < minShardCount) {
                continue;
            }
            double deviation = LoadStatistics.standardDeviation(cuts.loads(prefix));
            log.debug("capacity={} shards={} stddev={}", capacity, cuts.shardCount(), deviation);
            if (deviation < bestDeviation) {
                bestDeviation = deviation;
                best = cuts;
                bestCapacity = capacity;
            }
        }

        if (best != null) {
            log.info("Selected capacity {} giving {} shards with load stddev {}",
                bestCapacity, best.shardCount(), bestDeviation);
            return materialize(snapshot, prefix, best, cells.storageLevel());
        }

        log.warn("No capacity in {}..{} yields between {} and {} shards, splitting by shard count instead",
            minCapacity, maxCapacity, minShardCount, maxShardCount);
        return partitionByCount(snapshot, prefix, cells.storageLevel(), minShardCount, maxShardCount);
    }

    /**
     * Greedy partition at one capacity, with no shard count bounds applied.
     */
    public ShardCollection partitionAtCapacity(ScoredCellSet cells, long capacity) {
        if (cells.isEmpty()) {
            throw BuildInvariantViolationException.emptyCellSet();
        }
        ScoredCellSet.Snapshot snapshot = cells.snapshot();
        long[] prefix = prefixSums(snapshot);
        return materialize(snapshot, prefix, greedyCuts(prefix, capacity, snapshot.size()), cells.storageLevel());
    }

    /**
     * Quantile split into exactly {@code shardCount} non-empty shards.
     */
    public ShardCollection partitionIntoCount(ScoredCellSet cells, int shardCount) {
        if (cells.isEmpty()) {
            throw BuildInvariantViolationException.emptyCellSet();
        }
        checkBounds(cells, shardCount, shardCount);
        ScoredCellSet.Snapshot snapshot = cells.snapshot();
        long[] prefix = prefixSums(snapshot);
        return materialize(snapshot, prefix, quantileCuts(cutWeights(prefix), shardCount), cells.storageLevel());
    }

    private ShardCollection partitionByCount(ScoredCellSet.Snapshot snapshot, long[] prefix, int storageLevel,
                                             int minShardCount, int maxShardCount) {
        long[] weights = cutWeights(prefix);
        Cuts best = null;
        double bestDeviation = Double.MAX_VALUE;
        for (int shardCount = minShardCount; shardCount <= maxShardCount && shardCount <= snapshot.size(); shardCount++) {
            Cuts cuts = quantileCuts(weights, shardCount);
            double deviation = LoadStatistics.standardDeviation(cuts.loads(prefix));
            log.debug("shardCount={} stddev={}", shardCount, deviation);
            if (deviation < bestDeviation) {
                bestDeviation = deviation;
                best = cuts;
            }
        }
        log.info("Selected {} shards by count with load stddev {}", best.shardCount(), bestDeviation);
        return materialize(snapshot, prefix, best, storageLevel);
    }

    private static void checkBounds(ScoredCellSet cells, int minShardCount, int maxShardCount) {
        if (minShardCount <= 0 || maxShardCount <= 0) {
            throw new IllegalArgumentException("Shard count bounds must be positive (min=" + minShardCount
                + ", max=" + maxShardCount + ")");
        }
        if (minShardCount > maxShardCount) {
            throw new IllegalArgumentException("Minimum shard count " + minShardCount
                + " exceeds maximum shard count " + maxShardCount);
        }
        if (minShardCount > cells.size()) {
            throw new IllegalArgumentException("Minimum shard count " + minShardCount + " exceeds the "
                + cells.size() + " available cells");
        }
    }

    private static long[] prefixSums(ScoredCellSet.Snapshot snapshot) {
        long[] scores = snapshot.scores();
        long[] prefix = new long[scores.length + 1];
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] < 0) {
                throw BuildInvariantViolationException.negativeScore(snapshot.cells()[i], scores[i]);
            }
            try {
                prefix[i + 1] = Math.addExact(prefix[i], scores[i]);
            } catch (ArithmeticException e) {
                throw BuildInvariantViolationException.scoreOverflow(snapshot.cells()[i], scores[i]);
            }
        }
        return prefix;
    }

    // Cumulative weights used for quantile cuts: the load, or one per cell when there is none.
    private static long[] cutWeights(long[] prefix) {
        if (prefix[prefix.length - 1] > 0) {
            return prefix;
        }
        long[] counts = new long[prefix.length];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = i;
        }
        return counts;
    }

    /**
     * Returns null as soon as the scan needs more than {@code shardLimit} shards.
     */
    static Cuts greedyCuts(long[] prefix, long capacity, int shardLimit) {
        int cellCount = prefix.length - 1;
        int[] ends = new int[Math.min(shardLimit, cellCount)];
        int shardCount = 0;
        int start = 0;
        while (start < cellCount) {
            if (shardCount == ends.length) {
                return null;
            }
            int end = greedyEnd(prefix, start, capacity);
            ends[shardCount++] = end;
            start = end;
        }
        return new Cuts(Arrays.copyOf(ends, shardCount));
    }

    // Exclusive end of the shard opened at start: the first later cell i whose inclusion brings
    // the load to capacity, i.e. the smallest i > start with prefix[i + 1] - prefix[start] >= capacity.
    private static int greedyEnd(long[] prefix, int start, long capacity) {
        int cellCount = prefix.length - 1;
        long target = prefix[start] + capacity;
        int lo = start + 2;
        int hi = cellCount;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (prefix[mid] >= target) {
                found = mid;
                hi = mid - 1;
            } else {
                lo = mid + 1;
            }
        }
        return found == -1 ? cellCount : found - 1;
    }

    static Cuts quantileCuts(long[] weights, int shardCount) {
        int cellCount = weights.length - 1;
        long total = weights[cellCount];
        int[] ends = new int[shardCount];
        int previous = 0;
        for (int k = 1; k < shardCount; k++) {
            // leave at least one cell for each of the shards still to come
            int lo = previous + 1;
            int hi = cellCount - (shardCount - k);
            double target = (double) total * k / shardCount;
            int cut = firstReaching(weights, lo, hi, target);
            if (cut > lo && target - weights[cut - 1] < weights[cut] - target) {
                cut--;
            }
            ends[k - 1] = cut;
            previous = cut;
        }
        ends[shardCount - 1] = cellCount;
        return new Cuts(ends);
    }

    private static int firstReaching(long[] weights, int lo, int hi, double target) {
        int found = hi;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (weights[mid] >= target) {
                found = mid;
                hi = mid - 1;
            } else {
                lo = mid + 1;
            }
        }
        return found;
    }

    private ShardCollection materialize(ScoredCellSet.Snapshot snapshot, long[] prefix, Cuts cuts, int storageLevel) {
        CellId[] cells = snapshot.cells();
        List<Shard> shards = new ArrayList<>(cuts.shardCount());
        int start = 0;
        for (int i = 0; i < cuts.shardCount(); i++) {
            int end = cuts.ends()[i];
            shards.add(new Shard(
                shardNamePrefix + i,
                storageLevel,
                cells[start],
                cells[end - 1],
                end - start,
                prefix[end] - prefix[start]
            ));
            start = end;
        }
        return ShardCollection.of(shards);
    }

    /**
     * Exclusive end index of every shard, ascending; the last one is the cell count.
     */
    record Cuts(int[] ends) {
        int shardCount() {
            return ends.length;
        }

        long[] loads(long[] prefix) {
            long[] loads = new long[ends.length];
            int start = 0;
            for (int i = 0; i < ends.length; i++) {
                loads[i] = prefix[ends[i]] - prefix[start];
                start = ends[i];
            }
            return loads;
        }
    }
}
