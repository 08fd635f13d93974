package com.geoshard.domain.model;

import com.geoshard.domain.error.ValidationError.CoordinateError;

/**
 * A point on the sphere in degrees.
 */
public record Coordinate(double latitude, double longitude) {

    public Coordinate {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new IllegalStateException("Coordinate must be finite - use parse() for validation");
        }
    }

    /**
     * Parses an untrusted latitude/longitude pair, returning a Result for out-of-range values.
     */
    public static Result<Coordinate, CoordinateError> parse(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            return Result.failure(new CoordinateError.LatitudeOutOfRange(latitude));
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            return Result.failure(new CoordinateError.LongitudeOutOfRange(longitude));
        }
        return Result.success(new Coordinate(latitude, longitude));
    }

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
