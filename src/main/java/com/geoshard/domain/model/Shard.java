package com.geoshard.domain.model;

/**
 * One shard: a contiguous, inclusive range of cells in CellId order plus the load it carries.
 */
public record Shard(
    String name,
    int storageLevel,
    CellId start,
    CellId end,
    int cellCount,
    long load
) {
    public Shard {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Shard name cannot be empty");
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("Shard " + name + " must have a start and an end cell");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Shard " + name + " starts after it ends: " + start + " > " + end);
        }
        if (cellCount <= 0) {
            throw new IllegalArgumentException("Shard " + name + " must hold at least one cell, was " + cellCount);
        }
    }

    public boolean contains(CellId cell) {
        return !cell.isBefore(start) && !cell.isAfter(end);
    }
}
