package com.geoshard.application.port.out;

import java.time.Duration;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementBuilds();

    void incrementBuildFailures();

    void recordBuildDuration(Duration duration);

    void recordCellsEnumerated(int cellCount);

    void recordShardCount(int shardCount);
}
