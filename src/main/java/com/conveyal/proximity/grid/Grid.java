package com.conveyal.proximity.grid;

import com.conveyal.proximity.error.FormatException;
import com.conveyal.proximity.error.NoOverlapException;
import com.conveyal.proximity.util.GeometryUtils;
import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single band of numeric raster values (population counts or densities) together with the GridGeometry that
 * places it on the earth and the sentinel value that marks cells without data. Grids are immutable: masking,
 * cropping and aggregation all produce new Grids.
 *
 * Values are stored in a flat array in row-major order from the top row. NaN is always treated as no-data in
 * addition to the declared sentinel, and every other value must be finite.
 */
public class Grid {

    private static final Logger LOG = LoggerFactory.getLogger(Grid.class);

    /** Human readable identifier, usually the source file or the scope this grid was masked to. */
    public final String name;

    public final GridGeometry geometry;

    public final double noDataValue;

    private final double[] values;

    public Grid (String name, GridGeometry geometry, double[] values, double noDataValue) {
        checkNotNull(geometry);
        checkArgument(values.length == geometry.cellCount(),
                "Expected %s values for %s but got %s.", geometry.cellCount(), geometry, values.length);
        this.name = name;
        this.geometry = geometry;
        this.noDataValue = noDataValue;
        this.values = values.clone();
        for (int i = 0; i < this.values.length; i++) {
            double value = this.values[i];
            if (Double.isInfinite(value) && value != noDataValue) {
                throw new FormatException(String.format("Raster %s has a non-finite value at cell %d.", name, i));
            }
        }
    }

    public int width () {
        return geometry.width;
    }

    public int height () {
        return geometry.height;
    }

    public double getValue (int row, int col) {
        checkArgument(geometry.contains(row, col), "Cell (%s, %s) is outside the grid.", row, col);
        return values[geometry.index(row, col)];
    }

    public boolean isNoData (int row, int col) {
        return isNoData(getValue(row, col));
    }

    public boolean isNoData (double value) {
        return Double.isNaN(value) || value == noDataValue;
    }

    /** @return the number of cells that hold data. */
    public int validCellCount () {
        int count = 0;
        for (double value : values) {
            if (!isNoData(value)) count++;
        }
        return count;
    }

    /**
     * Return a new Grid cropped to the bounding box of the polygon, in which every cell whose center does not fall
     * within the polygon is set to no-data. The polygon must already be in this grid's CRS.
     *
     * @throws NoOverlapException if the polygon and grid extents do not intersect, or if no cell center lies
     *         inside the polygon.
     */
    public Grid mask (Geometry polygon) {
        return mask(polygon, name);
    }

    public Grid mask (Geometry polygon, String maskedName) {
        checkArgument(GeometryUtils.isPolygonal(polygon), "Only polygons can be used to mask a grid.");
        Envelope polygonEnvelope = polygon.getEnvelopeInternal();
        if (polygon.isEmpty() || !polygonEnvelope.intersects(geometry.worldEnvelope())) {
            throw new NoOverlapException(String.format("Boundary of %s does not overlap raster %s.", maskedName, name));
        }
        Geometry pixelPolygon = geometry.toPixelSpace(polygon);
        Envelope pixelEnvelope = pixelPolygon.getEnvelopeInternal();
        int minCol = Math.max(0, (int) FastMath.floor(pixelEnvelope.getMinX()));
        int minRow = Math.max(0, (int) FastMath.floor(pixelEnvelope.getMinY()));
        int maxCol = Math.min(geometry.width, (int) FastMath.ceil(pixelEnvelope.getMaxX()));
        int maxRow = Math.min(geometry.height, (int) FastMath.ceil(pixelEnvelope.getMaxY()));
        if (maxCol <= minCol || maxRow <= minRow) {
            throw new NoOverlapException(String.format("Boundary of %s does not overlap raster %s.", maskedName, name));
        }
        int cropWidth = maxCol - minCol;
        int cropHeight = maxRow - minRow;
        PreparedGeometry prepared = PreparedGeometryFactory.prepare(pixelPolygon);
        double[] cropped = new double[cropWidth * cropHeight];
        int inside = 0;
        for (int row = 0; row < cropHeight; row++) {
            for (int col = 0; col < cropWidth; col++) {
                double x = minCol + col + 0.5;
                double y = minRow + row + 0.5;
                boolean covered = prepared.intersects(GeometryUtils.geometryFactory.createPoint(new Coordinate(x, y)));
                if (covered) {
                    cropped[row * cropWidth + col] = values[geometry.index(minRow + row, minCol + col)];
                    inside++;
                } else {
                    cropped[row * cropWidth + col] = noDataValue;
                }
            }
        }
        if (inside == 0) {
            throw new NoOverlapException(String.format(
                    "Boundary of %s does not contain the center of any cell of raster %s.", maskedName, name));
        }
        LOG.debug("Masked {} to {}: {}x{} window with {} cells inside the boundary.",
                name, maskedName, cropWidth, cropHeight, inside);
        GridGeometry croppedGeometry = geometry.subGrid(minCol, minRow, cropWidth, cropHeight);
        return new Grid(maskedName, croppedGeometry, cropped, noDataValue);
    }

    /** Copy of the values in row-major order. */
    public double[] toArray () {
        return values.clone();
    }

    @Override
    public String toString () {
        return "Grid " + name + " (" + geometry + ")";
    }

    /** Two grids are equal if they have the same geometry, the same sentinel and identical values. */
    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof Grid)) return false;
        Grid that = (Grid) other;
        return geometry.equals(that.geometry) &&
                Double.compare(noDataValue, that.noDataValue) == 0 &&
                Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode () {
        return 31 * geometry.hashCode() + Arrays.hashCode(values);
    }

}
