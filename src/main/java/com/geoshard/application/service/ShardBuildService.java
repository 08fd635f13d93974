package com.geoshard.application.service;

import com.geoshard.application.port.in.BuildShardsUseCase;
import com.geoshard.application.port.out.MetricsPort;
import com.geoshard.application.port.out.UserSource;
import com.geoshard.application.scoring.LoadScorer;
import com.geoshard.domain.error.BuildError;
import com.geoshard.domain.error.ValidationError.ShardCountError;
import com.geoshard.domain.model.Result;
import com.geoshard.domain.model.ScoredCellSet;
import com.geoshard.domain.model.ShardCollection;
import com.geoshard.domain.model.ShardingRequest;
import com.geoshard.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.stream.Stream;

/**
 * Runs the one-shot build pipeline: enumerate the cells, score them, partition them.
 *
 * The build is atomic from the caller's view. It either returns a complete shard table,
 * a rejected configuration, or throws on a broken invariant; nothing partial escapes.
 */
@Service
public class ShardBuildService implements BuildShardsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ShardBuildService.class);

    private final CellEnumerator cellEnumerator;
    private final LoadScorer defaultScorer;
    private final ShardPartitioner partitioner;
    private final MetricsPort metrics;

    public ShardBuildService(
            CellEnumerator cellEnumerator,
            LoadScorer defaultScorer,
            ShardPartitioner partitioner,
            MetricsPort metrics) {
        this.cellEnumerator = cellEnumerator;
        this.defaultScorer = defaultScorer;
        this.partitioner = partitioner;
        this.metrics = metrics;
    }

    @Override
    public Result<ShardCollection, BuildError> buildShards(int storageLevel, int minShardCount, int maxShardCount,
                                                           UserSource users) {
        return buildShards(storageLevel, minShardCount, maxShardCount, users, defaultScorer);
    }

    @Override
    public Result<ShardCollection, BuildError> buildShards(int storageLevel, int minShardCount, int maxShardCount,
                                                           UserSource users, LoadScorer scorer) {
        log.debug("Building shards: level={}, minShards={}, maxShards={}, scorer={}",
            storageLevel, minShardCount, maxShardCount, scorer.getClass().getSimpleName());
        metrics.incrementBuilds();
        long startedAt = System.nanoTime();
        try {
            Result<ShardingRequest, BuildError> request = ShardingRequest
                .create(storageLevel, minShardCount, maxShardCount)
                .mapError(BuildError.InvalidConfiguration::new);
            if (request.isFailure()) {
                return reject(request.errorOrNull());
            }
            return build(request.getOrThrow(), users, scorer);
        } catch (RuntimeException e) {
            metrics.incrementBuildFailures();
            log.error("Shard build failed at level {}: {}", storageLevel, e.getMessage());
            throw e;
        } finally {
            metrics.recordBuildDuration(Duration.ofNanos(System.nanoTime() - startedAt));
        }
    }

    private Result<ShardCollection, BuildError> build(ShardingRequest request, UserSource users, LoadScorer scorer) {
        ScoredCellSet cells = cellEnumerator.enumerate(request.storageLevel());
        metrics.recordCellsEnumerated(cells.size());
        if (request.minShardCount() > cells.size()) {
            return reject(new BuildError.InvalidConfiguration(
                new ShardCountError.ExceedsCellCount(request.minShardCount(), cells.size(), request.storageLevel())));
        }

        try (Stream<? extends User> stream = users.open()) {
            scorer.score(cells, stream.iterator());
        }
        cells.freeze();
        log.info("Scored {} cells at level {} with total load {}", cells.size(), request.storageLevel(), cells.totalLoad());

        ShardCollection shards = partitioner.partition(cells, request.minShardCount(), request.maxShardCount());
        metrics.recordShardCount(shards.size());
        log.info("Built {} shards at level {}: load={}, stddev={}",
            shards.size(), request.storageLevel(), shards.totalLoad(), shards.standardDeviation());
        return Result.success(shards);
    }

    private Result<ShardCollection, BuildError> reject(BuildError error) {
        log.warn("Shard build rejected: {} ({})", error.message(), error.code());
        metrics.incrementBuildFailures();
        return Result.failure(error);
    }
}
