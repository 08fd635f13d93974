package com.geoshard.domain.model;

/**
 * Anything that needs to be distributed across shards.
 * All that is required is a location that the spatial index can map to a cell.
 */
public interface User {

    Coordinate location();
}
