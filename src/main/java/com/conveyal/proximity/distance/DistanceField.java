package com.conveyal.proximity.distance;

import com.conveyal.proximity.grid.GridGeometry;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * For every cell of a grid, the straight line distance in kilometers from the cell center to the center of the
 * nearest occupied cell. Zero at occupied cells.
 */
public class DistanceField {

    public final GridGeometry geometry;

    private final double[] kilometers;

    DistanceField (GridGeometry geometry, double[] kilometers) {
        checkArgument(kilometers.length == geometry.cellCount());
        this.geometry = geometry;
        this.kilometers = kilometers;
    }

    public double getKm (int row, int col) {
        checkArgument(geometry.contains(row, col), "Cell (%s, %s) is outside the grid.", row, col);
        return kilometers[geometry.index(row, col)];
    }

    public double maxKm () {
        double max = 0;
        for (double km : kilometers) {
            max = Math.max(max, km);
        }
        return max;
    }

}
