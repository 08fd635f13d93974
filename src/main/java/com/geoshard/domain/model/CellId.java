package com.geoshard.domain.model;

/**
 * Value Object for a spatial cell identifier.
 * Wraps the raw 64-bit id handed out by the spatial index. Ids compare as unsigned
 * 64-bit integers, which is the order of the index's space-filling curve.
 */
public record CellId(long value) implements Comparable<CellId> {

    public static CellId of(long value) {
        return new CellId(value);
    }

    @Override
    public int compareTo(CellId other) {
        return Long.compareUnsigned(value, other.value);
    }

    public boolean isBefore(CellId other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(CellId other) {
        return compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(value, 16);
    }
}
