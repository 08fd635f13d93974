package com.geoshard.domain.model;

import com.geoshard.domain.error.ValidationError;
import com.geoshard.domain.error.ValidationError.ShardCountError;
import com.geoshard.domain.error.ValidationError.StorageLevelError;

/**
 * Validated parameters of one shard build.
 *
 * {@code storageLevel} sets the cell granularity: every level up quadruples the number
 * of cells and with it the cost of the build.
 */
public record ShardingRequest(
    int storageLevel,
    int minShardCount,
    int maxShardCount
) {
    public static final int MAX_STORAGE_LEVEL = 30;

    /**
     * Creates a ShardingRequest, returning a Result for rejected bounds.
     */
    public static Result<ShardingRequest, ValidationError> create(int storageLevel, int minShardCount, int maxShardCount) {
        if (storageLevel < 0 || storageLevel > MAX_STORAGE_LEVEL) {
            return Result.failure(new StorageLevelError.OutOfRange(storageLevel, MAX_STORAGE_LEVEL));
        }
        if (minShardCount <= 0 || maxShardCount <= 0) {
            return Result.failure(new ShardCountError.NonPositive(minShardCount, maxShardCount));
        }
        if (minShardCount > maxShardCount) {
            return Result.failure(new ShardCountError.MinExceedsMax(minShardCount, maxShardCount));
        }
        return Result.success(new ShardingRequest(storageLevel, minShardCount, maxShardCount));
    }
}
