package com.geoshard.adapter.out.spatial;

import com.geoshard.application.port.out.SpatialIndex;
import com.geoshard.domain.model.CellId;
import com.geoshard.domain.model.Coordinate;
import com.google.common.geometry.S1Angle;
import com.google.common.geometry.S2Cap;
import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2CellUnion;
import com.google.common.geometry.S2LatLng;
import com.google.common.geometry.S2RegionCoverer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Spatial index backed by the S2 geometry library.
 *
 * S2 projects the sphere onto the six faces of a cube and orders the cells of every face
 * along a Hilbert curve, so cells that are close in CellId order are close on the sphere.
 * Cell ids are unsigned 64-bit values; see {@link CellId} for the ordering.
 */
@Component
public class S2SpatialIndex implements SpatialIndex {

    public static final double EARTH_RADIUS_METERS = 6.37e6;

    // Only a soft limit: with min level == max level the coverer returns as many cells as needed.
    private static final int MAX_COVERING_CELLS = 1 << 16;

    @Override
    public int maxLevel() {
        return S2CellId.MAX_LEVEL;
    }

    @Override
    public CellId cellFor(Coordinate coordinate, int level) {
        S2LatLng latLng = S2LatLng.fromDegrees(coordinate.latitude(), coordinate.longitude());
        return toCellId(S2CellId.fromLatLng(latLng).parent(level));
    }

    @Override
    public CellId parent(CellId cell, int level) {
        S2CellId id = toS2(cell);
        int ownLevel = id.level();
        if (level > ownLevel) {
            throw new IllegalArgumentException("Cell " + id.toToken() + " at level " + ownLevel
                + " has no parent at finer level " + level);
        }
        return level == ownLevel ? cell : toCellId(id.parent(level));
    }

    @Override
    public int levelOf(CellId cell) {
        return toS2(cell).level();
    }

    @Override
    public boolean isValid(CellId cell) {
        return toS2(cell).isValid();
    }

    @Override
    public List<CellId> allNeighbors(CellId cell, int level) {
        List<S2CellId> neighbors = new ArrayList<>(8);
        toS2(cell).getAllNeighbors(level, neighbors);
        List<CellId> result = new ArrayList<>(neighbors.size());
        for (S2CellId neighbor : neighbors) {
            result.add(toCellId(neighbor));
        }
        return result;
    }

    @Override
    public List<CellId> coveringDisc(Coordinate center, double radiusMeters, int level) {
        if (!Double.isFinite(radiusMeters) || radiusMeters < 0) {
            throw new IllegalArgumentException("Radius must be a non-negative distance in meters, was " + radiusMeters);
        }
        S2LatLng centerLatLng = S2LatLng.fromDegrees(center.latitude(), center.longitude());
        S2Cap disc = S2Cap.fromAxisAngle(centerLatLng.toPoint(), S1Angle.radians(radiusMeters / EARTH_RADIUS_METERS));

        S2RegionCoverer coverer = S2RegionCoverer.builder()
                .setMinLevel(level)
                .setMaxLevel(level)
                .setMaxCells(MAX_COVERING_CELLS)
                .build();
        S2CellUnion covering = coverer.getCovering(disc);

        // A normalized union may merge four siblings into their parent; bring everything back to level.
        NavigableSet<CellId> cells = new TreeSet<>();
        for (S2CellId id : covering) {
            if (id.level() < level) {
                S2CellId end = id.childEnd(level);
                for (S2CellId child = id.childBegin(level); !child.equals(end); child = child.next()) {
                    cells.add(toCellId(child));
                }
            } else {
                cells.add(toCellId(id.parent(level)));
            }
        }
        return List.copyOf(cells);
    }

    @Override
    public String toToken(CellId cell) {
        return toS2(cell).toToken();
    }

    @Override
    public CellId fromToken(String token) {
        S2CellId id;
        try {
            id = S2CellId.fromToken(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed cell token: " + token, e);
        }
        if (!id.isValid()) {
            throw new IllegalArgumentException("Token does not describe a valid cell: " + token);
        }
        return toCellId(id);
    }

    private static S2CellId toS2(CellId cell) {
        return new S2CellId(cell.value());
    }

    private static CellId toCellId(S2CellId id) {
        return CellId.of(id.id());
    }
}
