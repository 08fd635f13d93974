package com.geoshard.application.port.in;

import com.geoshard.application.port.out.UserSource;
import com.geoshard.application.scoring.LoadScorer;
import com.geoshard.domain.error.BuildError;
import com.geoshard.domain.model.Result;
import com.geoshard.domain.model.ShardCollection;

public interface BuildShardsUseCase {

    /**
     * Builds a shard table with the default scorer.
     */
    Result<ShardCollection, BuildError> buildShards(int storageLevel, int minShardCount, int maxShardCount, UserSource users);

    Result<ShardCollection, BuildError> buildShards(int storageLevel, int minShardCount, int maxShardCount, UserSource users,
                                                    LoadScorer scorer);
}
