package com.conveyal.proximity.grid;

import com.conveyal.proximity.error.FormatException;
import com.conveyal.proximity.util.GeometryUtils;
import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The shape of a raster and its placement on the earth: a width and height in cells, an affine transform from pixel
 * space to world coordinates, and the coordinate reference system of those world coordinates.
 *
 * Pixel space follows the GDAL convention. The pixel coordinate (col, row) is the upper left corner of the cell in
 * that column and row, so the cell center is at (col + 0.5, row + 0.5) and the whole grid covers [0, width] by
 * [0, height]. Grids produced by cropping or coarsening another grid are given a new geometry derived from this one,
 * so two congruent rasters always have equal geometries.
 */
public class GridGeometry {

    public final int width;

    public final int height;

    /** Normalized CRS code, e.g. EPSG:4326. */
    public final String crs;

    /** True if world coordinates are longitude and latitude in degrees. */
    public final boolean geographic;

    private final int cellCount;

    private final AffineTransform pixelToWorld;

    private final AffineTransform worldToPixel;

    public GridGeometry (int width, int height, AffineTransform pixelToWorld, String crs) {
        checkArgument(width > 0 && height > 0, "Grid dimensions must be positive, got %s x %s.", width, height);
        checkNotNull(pixelToWorld);
        this.width = width;
        this.height = height;
        this.cellCount = cellCount(width, height);
        this.pixelToWorld = new AffineTransform(pixelToWorld);
        try {
            this.worldToPixel = this.pixelToWorld.createInverse();
        } catch (NoninvertibleTransformException e) {
            throw new FormatException("Raster transform is not invertible: " + pixelToWorld, e);
        }
        this.crs = Crs.normalize(crs);
        this.geographic = Crs.isGeographic(this.crs);
    }

    /**
     * Factory for the usual case of an unrotated grid whose rows run from north to south.
     * @param west world x coordinate of the left edge of the grid.
     * @param north world y coordinate of the top edge of the grid.
     */
    public static GridGeometry northUp (double west, double north, double cellWidth, double cellHeight,
                                        int width, int height, String crs) {
        checkArgument(cellWidth > 0 && cellHeight > 0, "Cell sizes must be positive.");
        AffineTransform transform = new AffineTransform(cellWidth, 0, 0, -cellHeight, west, north);
        return new GridGeometry(width, height, transform, crs);
    }

    /**
     * @return the cell containing the given world coordinate. The cell may lie outside the grid, check it with
     *         contains() before using it as an index.
     */
    public GridCell cellOf (double x, double y) {
        Point2D pixel = worldToPixel.transform(new Point2D.Double(x, y), null);
        return new GridCell((int) FastMath.floor(pixel.getY()), (int) FastMath.floor(pixel.getX()));
    }

    /** @return the world coordinate of the center of the given cell. */
    public Coordinate coordOf (int row, int col) {
        Point2D world = pixelToWorld.transform(new Point2D.Double(col + 0.5, row + 0.5), null);
        return new Coordinate(world.getX(), world.getY());
    }

    public boolean contains (GridCell cell) {
        return contains(cell.row, cell.col);
    }

    public boolean contains (int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    public int cellCount () {
        return cellCount;
    }

    /**
     * @return the number of cells in a grid of the given dimensions.
     * @throws FormatException if there are too many cells to hold in one array.
     */
    public static int cellCount (int width, int height) {
        try {
            return Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            throw new FormatException(String.format("Raster of %d x %d cells is too large to hold in memory.",
                    width, height), e);
        }
    }

    /** Flattened index of a cell, rows in order from the top, columns varying fastest. */
    public int index (int row, int col) {
        return row * width + col;
    }

    /** @return the bounding box of the whole grid in world coordinates. */
    public Envelope worldEnvelope () {
        Envelope envelope = new Envelope();
        double[][] corners = {{0, 0}, {width, 0}, {0, height}, {width, height}};
        for (double[] corner : corners) {
            Point2D world = pixelToWorld.transform(new Point2D.Double(corner[0], corner[1]), null);
            envelope.expandToInclude(world.getX(), world.getY());
        }
        return envelope;
    }

    /** @return a copy of the transform from pixel space to world coordinates. */
    public AffineTransform pixelToWorld () {
        return new AffineTransform(pixelToWorld);
    }

    /** Transform a geometry in world coordinates into the pixel space of this grid, returning a new geometry. */
    public Geometry toPixelSpace (Geometry worldGeometry) {
        AffineTransformation transformation = new AffineTransformation(
                worldToPixel.getScaleX(), worldToPixel.getShearX(), worldToPixel.getTranslateX(),
                worldToPixel.getShearY(), worldToPixel.getScaleY(), worldToPixel.getTranslateY()
        );
        return transformation.transform(worldGeometry);
    }

    /** Width of one cell in CRS units. */
    public double cellWidth () {
        return FastMath.hypot(pixelToWorld.getScaleX(), pixelToWorld.getShearY());
    }

    /** Height of one cell in CRS units. */
    public double cellHeight () {
        return FastMath.hypot(pixelToWorld.getShearX(), pixelToWorld.getScaleY());
    }

    /**
     * Cell width in kilometers. Degrees are converted with a fixed number of kilometers per degree. When
     * scaleByLatitude is true the result is also multiplied by the cosine of the latitude at the center of the grid,
     * which makes cells narrower than they are tall away from the equator. Projected units are assumed to be meters.
     */
    public double cellSizeKmX (boolean scaleByLatitude) {
        if (!geographic) {
            return cellWidth() / 1000;
        }
        double km = cellWidth() * GeometryUtils.KM_PER_DEGREE;
        if (scaleByLatitude) {
            double centerLat = worldEnvelope().centre().y;
            km *= FastMath.cos(FastMath.toRadians(centerLat));
        }
        return km;
    }

    /** Cell height in kilometers, see cellSizeKmX. */
    public double cellSizeKmY () {
        if (!geographic) {
            return cellHeight() / 1000;
        }
        return cellHeight() * GeometryUtils.KM_PER_DEGREE;
    }

    /**
     * @return the geometry of a rectangular window of this grid, whose upper left cell is at the given offsets.
     */
    public GridGeometry subGrid (int colOffset, int rowOffset, int subWidth, int subHeight) {
        checkArgument(colOffset >= 0 && rowOffset >= 0, "Window offsets must not be negative.");
        checkArgument(colOffset + subWidth <= width && rowOffset + subHeight <= height, "Window exceeds grid.");
        AffineTransform transform = new AffineTransform(pixelToWorld);
        transform.translate(colOffset, rowOffset);
        return new GridGeometry(subWidth, subHeight, transform, crs);
    }

    /**
     * @return the geometry of a coarser grid where each cell covers factor x factor cells of this one. Trailing rows
     *         and columns that do not fill a whole block are dropped.
     */
    public GridGeometry coarsen (int factor) {
        checkArgument(factor > 0, "Aggregation factor must be positive.");
        checkArgument(width >= factor && height >= factor, "Aggregation factor %s exceeds grid size.", factor);
        AffineTransform transform = new AffineTransform(pixelToWorld);
        transform.scale(factor, factor);
        return new GridGeometry(width / factor, height / factor, transform, crs);
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof GridGeometry)) return false;
        GridGeometry that = (GridGeometry) other;
        return width == that.width && height == that.height &&
                pixelToWorld.equals(that.pixelToWorld) && crs.equals(that.crs);
    }

    @Override
    public int hashCode () {
        return Objects.hash(width, height, pixelToWorld, crs);
    }

    @Override
    public String toString () {
        return String.format("%dx%d grid in %s, transform %s", width, height, crs, pixelToWorld);
    }

}
