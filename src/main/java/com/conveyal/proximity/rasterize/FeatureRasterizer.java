package com.conveyal.proximity.rasterize;

import com.conveyal.proximity.error.CrsMismatchException;
import com.conveyal.proximity.features.Feature;
import com.conveyal.proximity.features.FeatureSet;
import com.conveyal.proximity.grid.Crs;
import com.conveyal.proximity.grid.GridGeometry;
import com.conveyal.proximity.util.GeometryUtils;
import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;

/**
 * Burns vector features into an OccupancyGrid aligned with a reference grid.
 *
 * Geometries are first transformed into the pixel space of the reference grid, where every cell is a unit square.
 * A point occupies the cell that contains it. A line occupies every cell it passes through, found by walking cell
 * boundaries along each segment (a supercover, so a segment passing exactly through a cell corner also occupies
 * the two cells beside that corner, unless the corner is an end of the segment). A polygon occupies every cell its
 * rings pass through plus every cell whose center lies inside it. Parts of geometries outside the grid are silently
 * ignored.
 */
public class FeatureRasterizer {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureRasterizer.class);

    /** Parametric distance within which a corner counts as the start or end of a segment. */
    private static final double END_TOLERANCE = 1e-9;

    /**
     * @throws CrsMismatchException if the features are not in the CRS of the reference grid. Reproject them first.
     */
    public OccupancyGrid rasterize (FeatureSet features, GridGeometry reference) {
        if (!Crs.same(features.crs, reference.crs)) {
            throw new CrsMismatchException(features.crs, reference.crs);
        }
        BitSet bits = new BitSet(reference.cellCount());
        Envelope gridEnvelope = reference.worldEnvelope();
        int outside = 0;
        for (Feature feature : features) {
            if (!gridEnvelope.intersects(feature.geometry.getEnvelopeInternal())) {
                outside++;
                continue;
            }
            burn(reference.toPixelSpace(feature.geometry), reference, bits);
        }
        OccupancyGrid occupancy = new OccupancyGrid(reference, bits);
        LOG.debug("Rasterized {} features ({} outside grid) into {} occupied cells.",
                features.size(), outside, occupancy.occupiedCount());
        return occupancy;
    }

    private static void burn (Geometry pixelGeometry, GridGeometry grid, BitSet bits) {
        if (pixelGeometry.isEmpty()) {
            return;
        }
        if (pixelGeometry instanceof Point) {
            Coordinate c = pixelGeometry.getCoordinate();
            set(grid, bits, (int) FastMath.floor(c.y), (int) FastMath.floor(c.x));
        } else if (pixelGeometry instanceof LineString) {
            burnLine(((LineString) pixelGeometry).getCoordinateSequence(), grid, bits);
        } else if (pixelGeometry instanceof Polygon) {
            Polygon polygon = (Polygon) pixelGeometry;
            burnLine(polygon.getExteriorRing().getCoordinateSequence(), grid, bits);
            for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
                burnLine(polygon.getInteriorRingN(i).getCoordinateSequence(), grid, bits);
            }
            burnInterior(polygon, grid, bits);
        } else if (pixelGeometry instanceof GeometryCollection) {
            for (int i = 0; i < pixelGeometry.getNumGeometries(); i++) {
                burn(pixelGeometry.getGeometryN(i), grid, bits);
            }
        } else {
            throw new IllegalArgumentException("Unsupported geometry type " + pixelGeometry.getGeometryType());
        }
    }

    private static void burnLine (CoordinateSequence coordinates, GridGeometry grid, BitSet bits) {
        if (coordinates.size() == 1) {
            set(grid, bits, (int) FastMath.floor(coordinates.getY(0)), (int) FastMath.floor(coordinates.getX(0)));
        }
        for (int i = 1; i < coordinates.size(); i++) {
            double[] clipped = clip(coordinates.getX(i - 1), coordinates.getY(i - 1),
                    coordinates.getX(i), coordinates.getY(i), grid.width, grid.height);
            if (clipped != null) {
                traverse(clipped[0], clipped[1], clipped[2], clipped[3], grid, bits);
            }
        }
    }

    /**
     * Liang-Barsky clipping of a segment to the rectangle [0, width] x [0, height].
     * @return {x0, y0, x1, y1} of the clipped segment, or null if it lies entirely outside.
     */
    static double[] clip (double x0, double y0, double x1, double y1, double width, double height) {
        double dx = x1 - x0;
        double dy = y1 - y0;
        double[] p = {-dx, dx, -dy, dy};
        double[] q = {x0, width - x0, y0, height - y0};
        double t0 = 0;
        double t1 = 1;
        for (int i = 0; i < 4; i++) {
            if (p[i] == 0) {
                if (q[i] < 0) return null;
            } else {
                double r = q[i] / p[i];
                if (p[i] < 0) {
                    if (r > t1) return null;
                    if (r > t0) t0 = r;
                } else {
                    if (r < t0) return null;
                    if (r < t1) t1 = r;
                }
            }
        }
        return new double[] {x0 + t0 * dx, y0 + t0 * dy, x0 + t1 * dx, y0 + t1 * dy};
    }

    /**
     * Walk the cells crossed by a segment lying within the grid, in the manner of Amanatides and Woo: at each step
     * move into the neighboring cell whose boundary the segment reaches first. Like a point, an end point lying on a
     * cell boundary marks the cell below and to the right of it.
     */
    private static void traverse (double x0, double y0, double x1, double y1, GridGeometry grid, BitSet bits) {
        int col = clampCol(x0, grid);
        int row = clampRow(y0, grid);
        int endCol = clampCol(x1, grid);
        int endRow = clampRow(y1, grid);
        double dx = x1 - x0;
        double dy = y1 - y0;
        int stepX = dx > 0 ? 1 : dx < 0 ? -1 : 0;
        int stepY = dy > 0 ? 1 : dy < 0 ? -1 : 0;
        double tDeltaX = stepX == 0 ? Double.POSITIVE_INFINITY : 1 / Math.abs(dx);
        double tDeltaY = stepY == 0 ? Double.POSITIVE_INFINITY : 1 / Math.abs(dy);
        double tMaxX = stepX > 0 ? (col + 1 - x0) / dx : stepX < 0 ? (col - x0) / dx : Double.POSITIVE_INFINITY;
        double tMaxY = stepY > 0 ? (row + 1 - y0) / dy : stepY < 0 ? (row - y0) / dy : Double.POSITIVE_INFINITY;
        set(grid, bits, row, col);
        // Bound the walk in case rounding carries it past the end cell.
        int remaining = Math.abs(endCol - col) + Math.abs(endRow - row);
        while (remaining > 0 && (col != endCol || row != endRow)) {
            if (tMaxX < tMaxY) {
                col += stepX;
                tMaxX += tDeltaX;
                remaining--;
            } else if (tMaxY < tMaxX) {
                row += stepY;
                tMaxY += tDeltaY;
                remaining--;
            } else {
                // Exactly through a corner. The cells beside it are only crossed if the corner is not an end point.
                if (tMaxX > END_TOLERANCE && tMaxX < 1 - END_TOLERANCE) {
                    set(grid, bits, row, col + stepX);
                    set(grid, bits, row + stepY, col);
                }
                col += stepX;
                row += stepY;
                tMaxX += tDeltaX;
                tMaxY += tDeltaY;
                remaining -= 2;
            }
            set(grid, bits, row, col);
        }
    }

    /** Mark every cell whose center falls inside the polygon. */
    private static void burnInterior (Polygon pixelPolygon, GridGeometry grid, BitSet bits) {
        Envelope envelope = pixelPolygon.getEnvelopeInternal();
        int minCol = Math.max(0, (int) FastMath.floor(envelope.getMinX()));
        int maxCol = Math.min(grid.width - 1, (int) FastMath.ceil(envelope.getMaxX()));
        int minRow = Math.max(0, (int) FastMath.floor(envelope.getMinY()));
        int maxRow = Math.min(grid.height - 1, (int) FastMath.ceil(envelope.getMaxY()));
        PreparedGeometry prepared = PreparedGeometryFactory.prepare(pixelPolygon);
        for (int row = minRow; row <= maxRow; row++) {
            for (int col = minCol; col <= maxCol; col++) {
                int index = grid.index(row, col);
                if (bits.get(index)) continue;
                Point center = GeometryUtils.geometryFactory.createPoint(new Coordinate(col + 0.5, row + 0.5));
                if (prepared.intersects(center)) {
                    bits.set(index);
                }
            }
        }
    }

    private static int clampCol (double x, GridGeometry grid) {
        return Math.min(grid.width - 1, Math.max(0, (int) FastMath.floor(x)));
    }

    private static int clampRow (double y, GridGeometry grid) {
        return Math.min(grid.height - 1, Math.max(0, (int) FastMath.floor(y)));
    }

    private static void set (GridGeometry grid, BitSet bits, int row, int col) {
        if (grid.contains(row, col)) {
            bits.set(grid.index(row, col));
        }
    }

}
