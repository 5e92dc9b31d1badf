package com.conveyal.proximity.grid;

import org.locationtech.jts.geom.Coordinate;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A coarse grid whose cells each summarize a square block of cells of a population grid: the urban and rural
 * population of the block and how many of its cells are urban or rural. Blocks with no valid cell hold no data.
 */
public class BlockGrid {

    public final GridGeometry geometry;

    /** Number of fine cells along each side of a block. */
    public final int factor;

    private final double[] urbanPopulation;
    private final double[] ruralPopulation;
    private final int[] urbanCells;
    private final int[] ruralCells;
    private final boolean[] hasData;

    BlockGrid (GridGeometry geometry, int factor, double[] urbanPopulation, double[] ruralPopulation,
               int[] urbanCells, int[] ruralCells, boolean[] hasData) {
        this.geometry = geometry;
        this.factor = factor;
        this.urbanPopulation = urbanPopulation;
        this.ruralPopulation = ruralPopulation;
        this.urbanCells = urbanCells;
        this.ruralCells = ruralCells;
        this.hasData = hasData;
    }

    public boolean hasData (int row, int col) {
        return hasData[index(row, col)];
    }

    public double urbanPopulation (int row, int col) {
        return urbanPopulation[index(row, col)];
    }

    public double ruralPopulation (int row, int col) {
        return ruralPopulation[index(row, col)];
    }

    public int urbanCells (int row, int col) {
        return urbanCells[index(row, col)];
    }

    public int ruralCells (int row, int col) {
        return ruralCells[index(row, col)];
    }

    public Coordinate center (int row, int col) {
        return geometry.coordOf(row, col);
    }

    private int index (int row, int col) {
        checkArgument(geometry.contains(row, col), "Block (%s, %s) is outside the grid.", row, col);
        return geometry.index(row, col);
    }

}
