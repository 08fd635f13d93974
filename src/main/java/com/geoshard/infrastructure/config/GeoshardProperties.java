package com.geoshard.infrastructure.config;

import com.geoshard.application.service.ShardPartitioner;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration of the shard build run at startup.
 *
 * Example:
 * <pre>
 * geoshard:
 *   storage-level: 8
 *   min-shard-count: 40
 *   max-shard-count: 100
 *   scorer: USER_COUNT
 *   users-file: /data/users.jsonl
 *   export-file: /data/shards.json
 * </pre>
 *
 * When {@code import-file} is set the shard table is read from it and no build runs.
 */
@Component
@ConfigurationProperties(prefix = "geoshard")
public class GeoshardProperties {

    public enum ScorerType {
        USER_COUNT,
        WEIGHTED
    }

    private int storageLevel = 8;
    private int minShardCount = 40;
    private int maxShardCount = 100;
    private ScorerType scorer = ScorerType.USER_COUNT;
    private String shardNamePrefix = ShardPartitioner.DEFAULT_SHARD_NAME_PREFIX;
    private String usersFile;
    private String importFile;
    private String exportFile;

    public int getStorageLevel() {
        return storageLevel;
    }

    public void setStorageLevel(int storageLevel) {
        this.storageLevel = storageLevel;
    }

    public int getMinShardCount() {
        return minShardCount;
    }

    public void setMinShardCount(int minShardCount) {
        this.minShardCount = minShardCount;
    }

    public int getMaxShardCount() {
        return maxShardCount;
    }

    public void setMaxShardCount(int maxShardCount) {
        this.maxShardCount = maxShardCount;
    }

    public ScorerType getScorer() {
        return scorer;
    }

    public void setScorer(ScorerType scorer) {
        this.scorer = scorer;
    }

    public String getShardNamePrefix() {
        return shardNamePrefix;
    }

    public void setShardNamePrefix(String shardNamePrefix) {
        this.shardNamePrefix = shardNamePrefix;
    }

    public String getUsersFile() {
        return usersFile;
    }

    public void setUsersFile(String usersFile) {
        this.usersFile = usersFile;
    }

    public String getImportFile() {
        return importFile;
    }

    public void setImportFile(String importFile) {
        this.importFile = importFile;
    }

    public String getExportFile() {
        return exportFile;
    }

    public void setExportFile(String exportFile) {
        this.exportFile = exportFile;
    }
}
