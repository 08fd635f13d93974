package com.geoshard.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoshard.adapter.out.users.JsonLinesUserSource;
import com.geoshard.application.port.in.BuildShardsUseCase;
import com.geoshard.application.port.out.ShardCollectionCodec;
import com.geoshard.application.port.out.SpatialIndex;
import com.geoshard.application.port.out.UserSource;
import com.geoshard.application.scoring.LoadScorer;
import com.geoshard.application.scoring.UserCountScorer;
import com.geoshard.application.scoring.WeightedUserScorer;
import com.geoshard.application.service.ShardPartitioner;
import com.geoshard.application.service.ShardSearcher;
import com.geoshard.domain.model.ShardCollection;
import com.geoshard.infrastructure.exception.GeoshardException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

/**
 * Wires the sharding engine and produces the process-wide shard table.
 *
 * The searcher bean is built once at startup, either imported from {@code geoshard.import-file}
 * or built from {@code geoshard.users-file} (no users when unset). Replacing the table means
 * building a new searcher and swapping it wholesale.
 */
@Configuration
public class GeoshardConfig {

    private static final Logger log = LoggerFactory.getLogger(GeoshardConfig.class);

    private final GeoshardProperties properties;

    public GeoshardConfig(GeoshardProperties properties) {
        this.properties = properties;
    }

    @Bean
    public LoadScorer loadScorer(SpatialIndex spatialIndex) {
        log.info("Scoring cells with {}", properties.getScorer());
        return switch (properties.getScorer()) {
            case USER_COUNT -> new UserCountScorer(spatialIndex);
            case WEIGHTED -> new WeightedUserScorer(spatialIndex);
        };
    }

    @Bean
    public ShardPartitioner shardPartitioner() {
        return new ShardPartitioner(properties.getShardNamePrefix());
    }

    @Bean
    public ShardSearcher shardSearcher(
            BuildShardsUseCase buildShards,
            ShardCollectionCodec codec,
            SpatialIndex spatialIndex,
            ObjectMapper objectMapper) {
        if (StringUtils.hasText(properties.getImportFile())) {
            log.info("Importing shard table from {}", properties.getImportFile());
            return new ShardSearcher(codec.read(Path.of(properties.getImportFile())), spatialIndex);
        }

        UserSource users;
        if (StringUtils.hasText(properties.getUsersFile())) {
            users = new JsonLinesUserSource(Path.of(properties.getUsersFile()), objectMapper);
        } else {
            log.warn("No geoshard.users-file configured - building shards without load");
            users = UserSource.empty();
        }

        var result = buildShards.buildShards(
            properties.getStorageLevel(),
            properties.getMinShardCount(),
            properties.getMaxShardCount(),
            users);
        if (result.isFailure()) {
            throw new GeoshardException(result.errorOrNull().code(),
                "Shard build failed: " + result.errorOrNull().message());
        }

        ShardCollection shards = result.getOrThrow();
        if (StringUtils.hasText(properties.getExportFile())) {
            codec.write(shards, Path.of(properties.getExportFile()));
        }
        return new ShardSearcher(shards, spatialIndex);
    }
}
