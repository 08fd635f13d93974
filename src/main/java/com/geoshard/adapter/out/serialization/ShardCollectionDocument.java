package com.geoshard.adapter.out.serialization;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ShardCollectionDocument(
    @JsonProperty("shards") List<ShardRecord> shards
) {}
