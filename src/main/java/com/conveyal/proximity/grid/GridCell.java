package com.conveyal.proximity.grid;

import java.util.Objects;

/** Row and column indexes of one grid cell. Row 0 is the top (usually northernmost) row. */
public final class GridCell {

    public final int row;
    public final int col;

    public GridCell (int row, int col) {
        this.row = row;
        this.col = col;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof GridCell)) return false;
        GridCell that = (GridCell) other;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode () {
        return Objects.hash(row, col);
    }

    @Override
    public String toString () {
        return "(" + row + ", " + col + ")";
    }

}
