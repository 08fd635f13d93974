package com.geoshard.infrastructure.metrics;

import com.geoshard.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter builds;
    private final Counter buildFailures;
    private final Timer buildDuration;
    private final AtomicInteger cellsEnumerated = new AtomicInteger();
    private final AtomicInteger shardCount = new AtomicInteger();

    public AppMetrics(MeterRegistry registry) {
        this.builds = Counter.builder("geoshard_builds_total")
            .description("Total number of shard builds started")
            .register(registry);

        this.buildFailures = Counter.builder("geoshard_build_failures_total")
            .description("Total number of shard builds rejected or aborted")
            .register(registry);

        this.buildDuration = Timer.builder("geoshard_build_duration_seconds")
            .description("Time taken to enumerate, score and partition cells")
            .register(registry);

        Gauge.builder("geoshard_cells_enumerated", cellsEnumerated, AtomicInteger::get)
            .description("Cells enumerated by the most recent build")
            .register(registry);

        Gauge.builder("geoshard_shard_count", shardCount, AtomicInteger::get)
            .description("Shards produced by the most recent build")
            .register(registry);
    }

    @Override
    public void incrementBuilds() {
        builds.increment();
    }

    @Override
    public void incrementBuildFailures() {
        buildFailures.increment();
    }

    @Override
    public void recordBuildDuration(Duration duration) {
        buildDuration.record(duration);
    }

    @Override
    public void recordCellsEnumerated(int cellCount) {
        cellsEnumerated.set(cellCount);
    }

    @Override
    public void recordShardCount(int count) {
        shardCount.set(count);
    }
}
