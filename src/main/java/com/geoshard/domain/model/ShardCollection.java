package com.geoshard.domain.model;

import java.util.List;

/**
 * The immutable shard table: shards ordered by start cell, all at one storage level,
 * with disjoint ranges.
 *
 * Safe to share between any number of readers.
 */
public record ShardCollection(List<Shard> shards) {

    public ShardCollection {
        if (shards == null || shards.isEmpty()) {
            throw new IllegalArgumentException("A shard collection must hold at least one shard");
        }
        shards = List.copyOf(shards);
        Shard previous = null;
        for (Shard shard : shards) {
            if (previous != null) {
                if (shard.storageLevel() != previous.storageLevel()) {
                    throw new IllegalArgumentException("Shard " + shard.name() + " is at level "
                        + shard.storageLevel() + " but " + previous.name() + " is at level " + previous.storageLevel());
                }
                if (!previous.end().isBefore(shard.start())) {
                    throw new IllegalArgumentException("Shard " + shard.name() + " overlaps or precedes " + previous.name());
                }
            }
            previous = shard;
        }
    }

    public static ShardCollection of(List<Shard> shards) {
        return new ShardCollection(shards);
    }

    public int storageLevel() {
        return shards.get(0).storageLevel();
    }

    public int size() {
        return shards.size();
    }

    public Shard get(int index) {
        return shards.get(index);
    }

    public Shard first() {
        return shards.get(0);
    }

    public Shard last() {
        return shards.get(shards.size() - 1);
    }

    public long totalLoad() {
        return shards.stream().mapToLong(Shard::load).sum();
    }

    public long totalCells() {
        return shards.stream().mapToLong(Shard::cellCount).sum();
    }

    public long[] loads() {
        return shards.stream().mapToLong(Shard::load).toArray();
    }

    /**
     * Population standard deviation of the shards' loads.
     */
    public double standardDeviation() {
        return LoadStatistics.standardDeviation(loads());
    }
}
