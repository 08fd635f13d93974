package com.geoshard.application.port.in;

import com.geoshard.domain.model.CellId;
import com.geoshard.domain.model.Coordinate;
import com.geoshard.domain.model.Shard;
import com.geoshard.domain.model.User;

import java.util.List;

/**
 * Read-only lookups against a built shard table. Lookups never fail.
 */
public interface LocateShardUseCase {

    Shard shardForLocation(Coordinate location);

    Shard shardForCell(CellId cell);

    Shard shardForUser(User user);

    /**
     * Distinct shards intersecting the disc, in order of first match along the covering.
     */
    List<Shard> shardsInRadius(Coordinate center, double radiusMeters);
}
