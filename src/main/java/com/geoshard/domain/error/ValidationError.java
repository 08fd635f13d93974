package com.geoshard.domain.error;

/**
 * Sealed type representing rejected input and configuration.
 * These are expected outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // Shard count bounds
    sealed interface ShardCountError extends ValidationError {

        record NonPositive(int minShardCount, int maxShardCount) implements ShardCountError {
            @Override
            public String message() {
                return "Shard count bounds must be positive (min=" + minShardCount + ", max=" + maxShardCount + ")";
            }

            @Override
            public String code() {
                return "SHARD_COUNT_NON_POSITIVE";
            }
        }

        record MinExceedsMax(int minShardCount, int maxShardCount) implements ShardCountError {
            @Override
            public String message() {
                return "Minimum shard count " + minShardCount + " exceeds maximum shard count " + maxShardCount;
            }

            @Override
            public String code() {
                return "SHARD_COUNT_MIN_EXCEEDS_MAX";
            }
        }

        record ExceedsCellCount(int minShardCount, int cellCount, int storageLevel) implements ShardCountError {
            @Override
            public String message() {
                return "Minimum shard count " + minShardCount + " exceeds the " + cellCount
                    + " cells available at storage level " + storageLevel;
            }

            @Override
            public String code() {
                return "SHARD_COUNT_EXCEEDS_CELLS";
            }
        }
    }

    // Storage level
    sealed interface StorageLevelError extends ValidationError {

        record OutOfRange(int storageLevel, int maxStorageLevel) implements StorageLevelError {
            @Override
            public String message() {
                return "Storage level must be between 0 and " + maxStorageLevel + " (was " + storageLevel + ")";
            }

            @Override
            public String code() {
                return "STORAGE_LEVEL_OUT_OF_RANGE";
            }
        }
    }

    // Coordinates from untrusted sources
    sealed interface CoordinateError extends ValidationError {

        record LatitudeOutOfRange(double latitude) implements CoordinateError {
            @Override
            public String message() {
                return "Latitude must be between -90 and 90 degrees (was " + latitude + ")";
            }

            @Override
            public String code() {
                return "LATITUDE_OUT_OF_RANGE";
            }
        }

        record LongitudeOutOfRange(double longitude) implements CoordinateError {
            @Override
            public String message() {
                return "Longitude must be between -180 and 180 degrees (was " + longitude + ")";
            }

            @Override
            public String code() {
                return "LONGITUDE_OUT_OF_RANGE";
            }
        }
    }
}
