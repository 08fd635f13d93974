package com.geoshard.infrastructure.exception;

/**
 * A serialized shard collection could not be read or describes an invalid shard table.
 */
public class ShardCollectionFormatException extends GeoshardException {

    public static final String UNREADABLE = "SHARD_COLLECTION_UNREADABLE";
    public static final String INVALID = "SHARD_COLLECTION_INVALID";
    public static final String UNWRITABLE = "SHARD_COLLECTION_UNWRITABLE";

    public ShardCollectionFormatException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public ShardCollectionFormatException(String errorCode, String message) {
        super(errorCode, message);
    }
}
