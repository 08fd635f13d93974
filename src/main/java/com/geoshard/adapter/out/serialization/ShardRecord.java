package com.geoshard.adapter.out.serialization;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire form of one shard. Cells travel as spatial index tokens.
 */
public record ShardRecord(
    @JsonProperty("name") String name,
    @JsonProperty("storage_level") int storageLevel,
    @JsonProperty("start") String start,
    @JsonProperty("end") String end,
    @JsonProperty("cell_count") int cellCount,
    @JsonProperty("load") @JsonAlias("cell_score") long load
) {}
