package com.geoshard.application.port.out;

import com.geoshard.domain.model.ShardCollection;

import java.nio.file.Path;

/**
 * Port for the shard table exchange format.
 * A decoded collection must look up exactly like the one that was encoded.
 */
public interface ShardCollectionCodec {

    String encode(ShardCollection shards);

    ShardCollection decode(String serialized);

    void write(ShardCollection shards, Path target);

    ShardCollection read(Path source);
}
