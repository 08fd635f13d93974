package com.geoshard.domain.model;

import com.geoshard.domain.error.ValidationError.ShardCountError;
import com.geoshard.domain.error.ValidationError.StorageLevelError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShardingRequestTest {

    @Test
    void createShouldSucceedWithValidBounds() {
        var result = ShardingRequest.create(8, 40, 100);
        assertTrue(result.isSuccess());
        assertEquals(new ShardingRequest(8, 40, 100), result.getOrThrow());
    }

    @Test
    void createShouldAcceptSingleShard() {
        assertTrue(ShardingRequest.create(4, 1, 1).isSuccess());
    }

    @Test
    void createShouldFailWithNonPositiveMinimum() {
        var result = ShardingRequest.create(8, 0, 100);
        assertTrue(result.isFailure());
        assertInstanceOf(ShardCountError.NonPositive.class, result.errorOrNull());
        assertEquals("SHARD_COUNT_NON_POSITIVE", result.errorOrNull().code());
    }

    @Test
    void createShouldFailWithNegativeMaximum() {
        var result = ShardingRequest.create(8, 1, -5);
        assertInstanceOf(ShardCountError.NonPositive.class, result.errorOrNull());
    }

    @Test
    void createShouldFailWhenMinimumExceedsMaximum() {
        var result = ShardingRequest.create(8, 100, 40);
        assertTrue(result.isFailure());
        assertInstanceOf(ShardCountError.MinExceedsMax.class, result.errorOrNull());
        assertTrue(result.errorOrNull().message().contains("100"));
    }

    @Test
    void createShouldFailWithStorageLevelOutOfRange() {
        assertInstanceOf(StorageLevelError.OutOfRange.class, ShardingRequest.create(31, 1, 2).errorOrNull());
        assertInstanceOf(StorageLevelError.OutOfRange.class, ShardingRequest.create(-1, 1, 2).errorOrNull());
    }
}
