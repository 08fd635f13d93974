package com.geoshard.application.port.out;

import com.geoshard.domain.model.CellId;
import com.geoshard.domain.model.Coordinate;

import java.util.List;

/**
 * Port for the hierarchical spatial cell index.
 * Abstracts the cell scheme (coordinate to cell mapping, hierarchy, adjacency, coverings)
 * from the sharding engine. Implementations must be safe for concurrent use.
 */
public interface SpatialIndex {

    /**
     * Finest level the index supports.
     */
    int maxLevel();

    /**
     * Returns the cell at {@code level} containing the coordinate.
     */
    CellId cellFor(Coordinate coordinate, int level);

    /**
     * Returns the ancestor of {@code cell} at {@code level}, or the cell itself when it already is
     * at that level.
     *
     * @throws IllegalArgumentException if {@code level} is finer than the cell's own level
     */
    CellId parent(CellId cell, int level);

    int levelOf(CellId cell);

    boolean isValid(CellId cell);

    /**
     * Returns every cell at {@code level} that touches {@code cell}, including diagonal neighbors.
     */
    List<CellId> allNeighbors(CellId cell, int level);

    /**
     * Covers a disc of {@code radiusMeters} around {@code center} with cells at exactly
     * {@code level}. The result is sorted and free of duplicates.
     */
    List<CellId> coveringDisc(Coordinate center, double radiusMeters, int level);

    /**
     * Stable text form of a cell, used by the exchange format.
     */
    String toToken(CellId cell);

    /**
     * @throws IllegalArgumentException if the token does not describe a valid cell
     */
    CellId fromToken(String token);
}
