package com.geoshard.application.scoring;

import com.geoshard.adapter.out.spatial.S2SpatialIndex;
import com.geoshard.domain.model.CellId;
import com.geoshard.domain.model.Coordinate;
import com.geoshard.domain.model.LocatedUser;
import com.geoshard.domain.model.ScoredCellSet;
import com.geoshard.domain.model.User;
import com.geoshard.infrastructure.exception.BuildInvariantViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WeightedUserScorer")
class WeightedUserScorerTest {

    private static final int LEVEL = 6;

    private final S2SpatialIndex index = new S2SpatialIndex();
    private final WeightedUserScorer scorer = new WeightedUserScorer(index);

    @Test
    @DisplayName("Should add each user's weight, counting unweighted users once")
    void shouldSumWeights() {
        // Given
        Coordinate berlin = Coordinate.of(52.5200, 13.4050);
        CellId cell = index.cellFor(berlin, LEVEL);
        ScoredCellSet cells = ScoredCellSet.zeroed(LEVEL, List.of(cell));
        User plain = () -> berlin;
        List<User> users = List.of(
            new LocatedUser("heavy", berlin, 40L),
            new LocatedUser("light", berlin, 2L),
            plain
        );

        // When
        scorer.score(cells, users.iterator());

        // Then
        assertEquals(43L, cells.scoreOf(cell));
    }

    @Test
    @DisplayName("Should fail instead of wrapping when weights overflow a long")
    void shouldRejectOverflowingWeights() {
        // Given
        Coordinate oslo = Coordinate.of(59.9139, 10.7522);
        CellId cell = index.cellFor(oslo, LEVEL);
        ScoredCellSet cells = ScoredCellSet.zeroed(LEVEL, List.of(cell));
        List<User> users = List.of(
            new LocatedUser("huge", oslo, Long.MAX_VALUE),
            new LocatedUser("one-more", oslo, 1L)
        );

        // When
        var ex = assertThrows(BuildInvariantViolationException.class, () -> scorer.score(cells, users.iterator()));

        // Then
        assertEquals(BuildInvariantViolationException.SCORE_OVERFLOW, ex.getErrorCode());
        assertEquals(Long.MAX_VALUE, cells.scoreOf(cell));
    }
}
