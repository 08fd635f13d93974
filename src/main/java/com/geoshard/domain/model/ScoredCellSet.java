package com.geoshard.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Ordered mapping of every cell at one storage level to its load score.
 *
 * Built once by the enumerator with all scores at zero, mutated only while a scorer runs,
 * then frozen. Iteration order is always CellId order, whatever order the cells were
 * discovered in. Not thread-safe; a build runs on a single thread.
 */
public final class ScoredCellSet {

    private final int storageLevel;
    private final NavigableMap<CellId, Long> scores;
    private boolean frozen;

    private ScoredCellSet(int storageLevel, NavigableMap<CellId, Long> scores) {
        this.storageLevel = storageLevel;
        this.scores = scores;
    }

    /**
     * Creates a set holding each given cell once, every score zero.
     */
    public static ScoredCellSet zeroed(int storageLevel, Collection<CellId> cells) {
        NavigableMap<CellId, Long> scores = new TreeMap<>();
        for (CellId cell : cells) {
            scores.put(cell, 0L);
        }
        return new ScoredCellSet(storageLevel, scores);
    }

    public int storageLevel() {
        return storageLevel;
    }

    public int size() {
        return scores.size();
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    public boolean contains(CellId cell) {
        return scores.containsKey(cell);
    }

    /**
     * @throws IllegalArgumentException if the cell is not part of this set
     */
    public long scoreOf(CellId cell) {
        Long score = scores.get(cell);
        if (score == null) {
            throw new IllegalArgumentException("Cell " + cell + " is not part of the cell set");
        }
        return score;
    }

    /**
     * Adds {@code weight} to the cell's score.
     *
     * @return false if the cell is not part of this set, in which case nothing changes
     * @throws IllegalStateException if the set has been frozen
     * @throws ArithmeticException if the score would overflow a long
     */
    public boolean addLoad(CellId cell, long weight) {
        ensureMutable();
        Long current = scores.get(cell);
        if (current == null) {
            return false;
        }
        scores.put(cell, Math.addExact(current, weight));
        return true;
    }

    /**
     * Replaces the cell's score.
     *
     * @return false if the cell is not part of this set, in which case nothing changes
     * @throws IllegalStateException if the set has been frozen
     */
    public boolean setScore(CellId cell, long score) {
        ensureMutable();
        if (!scores.containsKey(cell)) {
            return false;
        }
        scores.put(cell, score);
        return true;
    }

    public ScoredCellSet freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public long totalLoad() {
        long total = 0;
        for (long score : scores.values()) {
            total += score;
        }
        return total;
    }

    public CellId firstCell() {
        return scores.firstKey();
    }

    public CellId lastCell() {
        return scores.lastKey();
    }

    /**
     * Cells in CellId order.
     */
    public List<CellId> cells() {
        return List.copyOf(scores.keySet());
    }

    /**
     * Read-only view of the scores in CellId order.
     */
    public NavigableMap<CellId, Long> view() {
        return Collections.unmodifiableNavigableMap(scores);
    }

    /**
     * Snapshot of the scores as parallel arrays, both in CellId order.
     */
    public Snapshot snapshot() {
        CellId[] cells = new CellId[scores.size()];
        long[] values = new long[scores.size()];
        int i = 0;
        for (Map.Entry<CellId, Long> entry : scores.entrySet()) {
            cells[i] = entry.getKey();
            values[i] = entry.getValue();
            i++;
        }
        return new Snapshot(cells, values);
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Cell set at level " + storageLevel + " is frozen");
        }
    }

    public record Snapshot(CellId[] cells, long[] scores) {
        public int size() {
            return cells.length;
        }
    }
}
