package com.geoshard.adapter.out.users;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a user file: {@code {"id": "u-1", "lat": 40.71, "lng": -74.0, "weight": 3}}.
 * {@code id} and {@code weight} are optional.
 */
record UserLine(
    @JsonProperty("id") String id,
    @JsonProperty("lat") @JsonAlias("latitude") Double latitude,
    @JsonProperty("lng") @JsonAlias({"lon", "longitude"}) Double longitude,
    @JsonProperty("weight") Long weight
) {}
