package com.geoshard.domain.model;

/**
 * Plain user record: an id, where the user is, and how much load the user brings.
 */
public record LocatedUser(String id, Coordinate location, long weight) implements WeightedUser {

    public LocatedUser {
        if (location == null) {
            throw new IllegalArgumentException("User " + id + " has no location");
        }
    }

    public static LocatedUser at(String id, double latitude, double longitude) {
        return new LocatedUser(id, Coordinate.of(latitude, longitude), 1L);
    }
}
