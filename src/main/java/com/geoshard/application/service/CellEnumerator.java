package com.geoshard.application.service;

import com.geoshard.application.port.out.SpatialIndex;
import com.geoshard.domain.model.CellId;
import com.geoshard.domain.model.Coordinate;
import com.geoshard.domain.model.ScoredCellSet;
import com.geoshard.infrastructure.exception.BuildInvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Discovers every cell at a storage level by flood-filling the index's neighbor graph from the
 * cell containing (0, 0).
 *
 * The traversal runs on an explicit worklist: at realistic levels the graph has hundreds of
 * thousands of nodes, far deeper than a call stack allows.
 */
@Component
public class CellEnumerator {

    private static final Logger log = LoggerFactory.getLogger(CellEnumerator.class);

    static final Coordinate SEED_LOCATION = Coordinate.of(0.0, 0.0);

    private final SpatialIndex spatialIndex;

    public CellEnumerator(SpatialIndex spatialIndex) {
        this.spatialIndex = spatialIndex;
    }

    /**
     * Returns every cell reachable from the seed at {@code storageLevel}, each scored zero.
     *
     * @throws BuildInvariantViolationException if no cell is discovered
     */
    public ScoredCellSet enumerate(int storageLevel) {
        return enumerateFrom(spatialIndex.cellFor(SEED_LOCATION, storageLevel), storageLevel);
    }

    ScoredCellSet enumerateFrom(CellId seed, int storageLevel) {
        log.debug("Enumerating cells at level {} from seed {}", storageLevel, seed);

        Set<CellId> seen = new HashSet<>();
        Deque<CellId> worklist = new ArrayDeque<>();
        worklist.push(seed);
        while (!worklist.isEmpty()) {
            CellId current = worklist.pop();
            if (!spatialIndex.isValid(current) || !seen.add(current)) {
                continue;
            }
            for (CellId neighbor : spatialIndex.allNeighbors(current, storageLevel)) {
                if (!seen.contains(neighbor)) {
                    worklist.push(neighbor);
                }
            }
        }

        if (seen.isEmpty()) {
            throw BuildInvariantViolationException.noCellsEnumerated(storageLevel);
        }
        log.info("Enumerated {} cells at storage level {}", seen.size(), storageLevel);
        return ScoredCellSet.zeroed(storageLevel, seen);
    }
}
