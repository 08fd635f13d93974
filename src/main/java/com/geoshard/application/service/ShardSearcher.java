package com.geoshard.application.service;

import com.geoshard.application.port.in.LocateShardUseCase;
import com.geoshard.application.port.out.SpatialIndex;
import com.geoshard.domain.model.CellId;
import com.geoshard.domain.model.Coordinate;
import com.geoshard.domain.model.Shard;
import com.geoshard.domain.model.ShardCollection;
import com.geoshard.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves locations and cells to the shard that owns them.
 *
 * Immutable after construction and safe for any number of concurrent readers. Shards are sorted
 * and disjoint, so the owner is found by binary search over the start cells. A cell outside every
 * range resolves to the last shard.
 */
public class ShardSearcher implements LocateShardUseCase {

    private static final Logger log = LoggerFactory.getLogger(ShardSearcher.class);

    private final ShardCollection shards;
    private final SpatialIndex spatialIndex;
    private final int storageLevel;
    private final CellId[] starts;

    public ShardSearcher(ShardCollection shards, SpatialIndex spatialIndex) {
        this.shards = shards;
        this.spatialIndex = spatialIndex;
        this.storageLevel = shards.storageLevel();
        this.starts = shards.shards().stream().map(Shard::start).toArray(CellId[]::new);
    }

    public ShardCollection shards() {
        return shards;
    }

    public int storageLevel() {
        return storageLevel;
    }

    public CellId cellForLocation(Coordinate location) {
        return spatialIndex.cellFor(location, storageLevel);
    }

    @Override
    public Shard shardForLocation(Coordinate location) {
        return lookup(cellForLocation(location));
    }

    @Override
    public Shard shardForUser(User user) {
        return shardForLocation(user.location());
    }

    /**
     * Cells finer than the storage level are resolved through their ancestor at the storage level.
     */
    @Override
    public Shard shardForCell(CellId cell) {
        if (spatialIndex.levelOf(cell) > storageLevel) {
            return lookup(spatialIndex.parent(cell, storageLevel));
        }
        return lookup(cell);
    }

    /**
     * Cells at the storage level covering the disc.
     */
    public List<CellId> cellsInRadius(Coordinate center, double radiusMeters) {
        return spatialIndex.coveringDisc(center, radiusMeters, storageLevel);
    }

    @Override
    public List<Shard> shardsInRadius(Coordinate center, double radiusMeters) {
        Set<Shard> matched = new LinkedHashSet<>();
        for (CellId cell : cellsInRadius(center, radiusMeters)) {
            matched.add(lookup(cell));
        }
        return new ArrayList<>(matched);
    }

    private Shard lookup(CellId cell) {
        int index = lastStartAtOrBefore(cell);
        if (index >= 0) {
            Shard shard = shards.get(index);
            if (shard.contains(cell)) {
                return shard;
            }
        }
        log.debug("Cell {} is outside every shard range, falling back to {}", cell, shards.last().name());
        return shards.last();
    }

    private int lastStartAtOrBefore(CellId cell) {
        int lo = 0;
        int hi = starts.length - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (starts[mid].isAfter(cell)) {
                hi = mid - 1;
            } else {
                found = mid;
                lo = mid + 1;
            }
        }
        return found;
    }
}
