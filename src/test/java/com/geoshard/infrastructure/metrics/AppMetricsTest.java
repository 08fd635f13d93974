package com.geoshard.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AppMetrics")
class AppMetricsTest {

    private SimpleMeterRegistry registry;
    private AppMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AppMetrics(registry);
    }

    @Test
    @DisplayName("Should count builds and failures")
    void shouldCountBuilds() {
        metrics.incrementBuilds();
        metrics.incrementBuilds();
        metrics.incrementBuildFailures();

        assertEquals(2.0, registry.get("geoshard_builds_total").counter().count());
        assertEquals(1.0, registry.get("geoshard_build_failures_total").counter().count());
    }

    @Test
    @DisplayName("Should time builds")
    void shouldRecordDuration() {
        metrics.recordBuildDuration(Duration.ofMillis(250));

        var timer = registry.get("geoshard_build_duration_seconds").timer();
        assertEquals(1, timer.count());
        assertEquals(250.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    @DisplayName("Should report the latest build's cell and shard counts")
    void shouldGaugeLatestBuild() {
        metrics.recordCellsEnumerated(1536);
        metrics.recordShardCount(40);
        metrics.recordShardCount(42);

        assertEquals(1536.0, registry.get("geoshard_cells_enumerated").gauge().value());
        assertEquals(42.0, registry.get("geoshard_shard_count").gauge().value());
    }
}
