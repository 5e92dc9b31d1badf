package com.conveyal.proximity.rasterize;

import com.conveyal.proximity.grid.GridCell;
import com.conveyal.proximity.grid.GridGeometry;

import java.util.BitSet;
import java.util.Collection;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Binary grid congruent to a reference Grid, marking the cells that contain at least one road or facility.
 * Backed by a BitSet in the reference grid's row-major cell order.
 */
public class OccupancyGrid {

    public final GridGeometry geometry;

    private final BitSet occupied;

    OccupancyGrid (GridGeometry geometry, BitSet occupied) {
        this.geometry = geometry;
        this.occupied = (BitSet) occupied.clone();
    }

    /** Build an occupancy grid directly from a list of cells. Cells outside the grid are ignored. */
    public static OccupancyGrid of (GridGeometry geometry, Collection<GridCell> cells) {
        BitSet bits = new BitSet(geometry.cellCount());
        for (GridCell cell : cells) {
            if (geometry.contains(cell)) {
                bits.set(geometry.index(cell.row, cell.col));
            }
        }
        return new OccupancyGrid(geometry, bits);
    }

    public boolean isOccupied (int row, int col) {
        checkArgument(geometry.contains(row, col), "Cell (%s, %s) is outside the grid.", row, col);
        return occupied.get(geometry.index(row, col));
    }

    public int occupiedCount () {
        return occupied.cardinality();
    }

    public boolean isEmpty () {
        return occupied.isEmpty();
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof OccupancyGrid)) return false;
        OccupancyGrid that = (OccupancyGrid) other;
        return geometry.equals(that.geometry) && occupied.equals(that.occupied);
    }

    @Override
    public int hashCode () {
        return 31 * geometry.hashCode() + occupied.hashCode();
    }

}
