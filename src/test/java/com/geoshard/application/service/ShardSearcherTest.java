package com.geoshard.application.service;

import com.geoshard.adapter.out.spatial.S2SpatialIndex;
import com.geoshard.application.port.out.SpatialIndex;
import com.geoshard.domain.model.CellId;
import com.geoshard.domain.model.Coordinate;
import com.geoshard.domain.model.LocatedUser;
import com.geoshard.domain.model.ScoredCellSet;
import com.geoshard.domain.model.Shard;
import com.geoshard.domain.model.ShardCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ShardSearcher")
class ShardSearcherTest {

    private static final int LEVEL = 6;

    @Mock
    private SpatialIndex spatialIndex;

    private ShardSearcher searcher;

    private static Shard shard(String name, long start, long end) {
        return new Shard(name, LEVEL, CellId.of(start), CellId.of(end), (int) (end - start + 1), end - start);
    }

    @BeforeEach
    void setUp() {
        ShardCollection shards = ShardCollection.of(List.of(
            shard("a", 10, 12),
            shard("b", 13, 16),
            shard("c", 17, 19)
        ));
        searcher = new ShardSearcher(shards, spatialIndex);
    }

    @Nested
    @DisplayName("shardForCell")
    class ShardForCellTests {

        @Test
        @DisplayName("Should return the shard whose range holds the cell")
        void shouldFindOwningShard() {
            // Given
            when(spatialIndex.levelOf(any())).thenReturn(LEVEL);

            // When / Then
            assertEquals("a", searcher.shardForCell(CellId.of(10)).name());
            assertEquals("a", searcher.shardForCell(CellId.of(12)).name());
            assertEquals("b", searcher.shardForCell(CellId.of(13)).name());
            assertEquals("b", searcher.shardForCell(CellId.of(15)).name());
            assertEquals("c", searcher.shardForCell(CellId.of(19)).name());
        }

        @Test
        @DisplayName("Should fall back to the last shard for cells outside every range")
        void shouldFallBackToLastShard() {
            // Given
            when(spatialIndex.levelOf(any())).thenReturn(LEVEL);

            // When / Then
            assertEquals("c", searcher.shardForCell(CellId.of(25)).name());
            assertEquals("c", searcher.shardForCell(CellId.of(5)).name());
        }

        @Test
        @DisplayName("Should order cell ids as unsigned values")
        void shouldTreatHighBitCellsAsLargest() {
            // Given
            when(spatialIndex.levelOf(any())).thenReturn(LEVEL);

            // When / Then
            assertEquals("c", searcher.shardForCell(CellId.of(-1L)).name());
        }

        @Test
        @DisplayName("Should resolve finer cells through their ancestor")
        void shouldMapFinerCellsToParent() {
            // Given
            CellId fine = CellId.of(1_000_000L);
            when(spatialIndex.levelOf(fine)).thenReturn(LEVEL + 4);
            when(spatialIndex.parent(fine, LEVEL)).thenReturn(CellId.of(14));

            // When
            Shard shard = searcher.shardForCell(fine);

            // Then
            assertEquals("b", shard.name());
        }
    }

    @Nested
    @DisplayName("locations")
    class LocationTests {

        @Test
        @DisplayName("Should map a location through its storage-level cell")
        void shouldFindShardForLocation() {
            // Given
            Coordinate location = Coordinate.of(40.7128, -74.0060);
            when(spatialIndex.cellFor(location, LEVEL)).thenReturn(CellId.of(11));

            // When / Then
            assertEquals(CellId.of(11), searcher.cellForLocation(location));
            assertEquals("a", searcher.shardForLocation(location).name());
        }

        @Test
        @DisplayName("Should map a user through their location")
        void shouldFindShardForUser() {
            // Given
            LocatedUser user = LocatedUser.at("u-1", 51.5074, -0.1278);
            when(spatialIndex.cellFor(user.location(), LEVEL)).thenReturn(CellId.of(18));

            // When / Then
            assertEquals("c", searcher.shardForUser(user).name());
        }
    }

    @Nested
    @DisplayName("shardsInRadius")
    class RadiusTests {

        @Test
        @DisplayName("Should return each intersecting shard once in first-match order")
        void shouldReturnDistinctShards() {
            // Given
            Coordinate center = Coordinate.of(0.0, 0.0);
            when(spatialIndex.coveringDisc(eq(center), anyDouble(), eq(LEVEL)))
                .thenReturn(List.of(CellId.of(11), CellId.of(12), CellId.of(13), CellId.of(16), CellId.of(17)));

            // When
            List<Shard> shards = searcher.shardsInRadius(center, 1_000.0);

            // Then
            assertEquals(List.of("a", "b", "c"), shards.stream().map(Shard::name).toList());
        }

        @Test
        @DisplayName("Should return a single shard for a disc inside one range")
        void shouldReturnSingleShard() {
            // Given
            Coordinate center = Coordinate.of(10.0, 10.0);
            when(spatialIndex.coveringDisc(center, 50.0, LEVEL)).thenReturn(List.of(CellId.of(14), CellId.of(15)));

            // When / Then
            assertEquals(List.of("b"), searcher.shardsInRadius(center, 50.0).stream().map(Shard::name).toList());
        }
    }

    @Nested
    @DisplayName("over S2")
    class S2Tests {

        private final S2SpatialIndex index = new S2SpatialIndex();

        @Test
        @DisplayName("Should resolve every enumerated cell to the shard whose range holds it")
        void shouldResolveEveryCell() {
            // Given
            ScoredCellSet cells = new CellEnumerator(index).enumerate(3);
            ShardCollection shards = new ShardPartitioner().partitionIntoCount(cells.freeze(), 7);
            ShardSearcher s2Searcher = new ShardSearcher(shards, index);

            // When / Then
            for (CellId cell : cells.cells()) {
                Shard shard = s2Searcher.shardForCell(cell);
                assertTrue(shard.contains(cell), cell + " resolved to " + shard.name());
            }
        }

        @Test
        @DisplayName("Should resolve leaf cells like their storage-level ancestor")
        void shouldResolveLeafCells() {
            // Given
            ScoredCellSet cells = new CellEnumerator(index).enumerate(3);
            ShardSearcher s2Searcher = new ShardSearcher(new ShardPartitioner().partitionIntoCount(cells.freeze(), 5), index);
            Coordinate tokyo = Coordinate.of(35.6762, 139.6503);

            // When
            Shard byLeaf = s2Searcher.shardForCell(index.cellFor(tokyo, index.maxLevel()));

            // Then
            assertEquals(s2Searcher.shardForLocation(tokyo), byLeaf);
        }
    }
}
