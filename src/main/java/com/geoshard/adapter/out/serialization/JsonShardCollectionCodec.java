package com.geoshard.adapter.out.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoshard.application.port.out.ShardCollectionCodec;
import com.geoshard.application.port.out.SpatialIndex;
import com.geoshard.domain.model.CellId;
import com.geoshard.domain.model.Shard;
import com.geoshard.domain.model.ShardCollection;
import com.geoshard.infrastructure.exception.ShardCollectionFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON exchange format for shard tables, using Jackson.
 *
 * <pre>
 * {"shards": [{"name": "geoshard_user_index_0", "storage_level": 8, "start": "0fc", "end": "1b4",
 *              "cell_count": 7342, "load": 48}, ...]}
 * </pre>
 */
@Component
public class JsonShardCollectionCodec implements ShardCollectionCodec {

    private static final Logger log = LoggerFactory.getLogger(JsonShardCollectionCodec.class);

    private final ObjectMapper objectMapper;
    private final SpatialIndex spatialIndex;

    public JsonShardCollectionCodec(ObjectMapper objectMapper, SpatialIndex spatialIndex) {
        this.objectMapper = objectMapper;
        this.spatialIndex = spatialIndex;
    }

    @Override
    public String encode(ShardCollection shards) {
        List<ShardRecord> records = new ArrayList<>(shards.size());
        for (Shard shard : shards.shards()) {
            records.add(new ShardRecord(
                shard.name(),
                shard.storageLevel(),
                spatialIndex.toToken(shard.start()),
                spatialIndex.toToken(shard.end()),
                shard.cellCount(),
                shard.load()
            ));
        }
        try {
            return objectMapper.writeValueAsString(new ShardCollectionDocument(records));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize shard collection", e);
        }
    }

    @Override
    public ShardCollection decode(String serialized) {
        ShardCollectionDocument document;
        try {
            document = objectMapper.readValue(serialized, ShardCollectionDocument.class);
        } catch (JsonProcessingException e) {
            throw new ShardCollectionFormatException(ShardCollectionFormatException.UNREADABLE,
                "Shard collection is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.shards() == null) {
            throw new ShardCollectionFormatException(ShardCollectionFormatException.INVALID,
                "Shard collection has no shards array");
        }

        List<Shard> shards = new ArrayList<>(document.shards().size());
        try {
            for (ShardRecord record : document.shards()) {
                shards.add(toShard(record));
            }
            return ShardCollection.of(shards);
        } catch (IllegalArgumentException e) {
            throw new ShardCollectionFormatException(ShardCollectionFormatException.INVALID,
                "Invalid shard collection: " + e.getMessage(), e);
        }
    }

    @Override
    public void write(ShardCollection shards, Path target) {
        try {
            Files.writeString(target, encode(shards), StandardCharsets.UTF_8);
            log.info("Wrote {} shards to {}", shards.size(), target);
        } catch (IOException e) {
            throw new ShardCollectionFormatException(ShardCollectionFormatException.UNWRITABLE,
                "Failed to write shard collection to " + target, e);
        }
    }

    @Override
    public ShardCollection read(Path source) {
        String serialized;
        try {
            serialized = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ShardCollectionFormatException(ShardCollectionFormatException.UNREADABLE,
                "Failed to read shard collection from " + source, e);
        }
        ShardCollection shards = decode(serialized);
        log.info("Read {} shards at level {} from {}", shards.size(), shards.storageLevel(), source);
        return shards;
    }

    private Shard toShard(ShardRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("Shard entry is null");
        }
        if (record.start() == null || record.end() == null) {
            throw new IllegalArgumentException("Shard " + record.name() + " is missing its start or end token");
        }
        CellId start = spatialIndex.fromToken(record.start());
        CellId end = spatialIndex.fromToken(record.end());
        if (spatialIndex.levelOf(start) != record.storageLevel() || spatialIndex.levelOf(end) != record.storageLevel()) {
            throw new IllegalArgumentException("Shard " + record.name() + " has cells that are not at storage level "
                + record.storageLevel());
        }
        return new Shard(record.name(), record.storageLevel(), start, end, record.cellCount(), record.load());
    }
}
