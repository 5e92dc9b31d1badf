package com.conveyal.proximity.distance;

import com.conveyal.proximity.error.NoReferenceFeaturesException;
import com.conveyal.proximity.grid.GridGeometry;
import com.conveyal.proximity.rasterize.OccupancyGrid;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.IntStream;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Exact Euclidean distance transform of a binary occupancy grid, after Felzenszwalb and Huttenlocher, "Distance
 * Transforms of Sampled Functions" (Theory of Computing, 2012).
 *
 * The squared distance transform separates into two passes of a one-dimensional transform, first down every column
 * and then along every row, each running in linear time by computing the lower envelope of a set of parabolas. Cell
 * sizes enter as weights on the squared index differences (the column pass is weighted by the squared cell height
 * and the row pass by the squared cell width) so that non-square cells are handled exactly. Columns and then rows
 * are independent of one another and are processed in parallel.
 */
public class EuclideanDistanceTransform {

    private static final Logger LOG = LoggerFactory.getLogger(EuclideanDistanceTransform.class);

    /** Stands in for infinity so that sums and differences of unreached values stay finite. */
    static final double BIG = 1e30;

    /**
     * @param cellSizeX width of a cell in kilometers.
     * @param cellSizeY height of a cell in kilometers.
     * @throws NoReferenceFeaturesException if no cell is occupied.
     */
    public DistanceField computeDistances (OccupancyGrid occupancy, double cellSizeX, double cellSizeY) {
        checkArgument(cellSizeX > 0 && cellSizeY > 0, "Cell sizes must be positive, got %s and %s.", cellSizeX, cellSizeY);
        if (occupancy.isEmpty()) {
            throw new NoReferenceFeaturesException("No occupied cells to measure distances from.");
        }
        GridGeometry geometry = occupancy.geometry;
        final int width = geometry.width;
        final int height = geometry.height;
        final double[] squared = new double[geometry.cellCount()];
        final double weightY = cellSizeY * cellSizeY;
        final double weightX = cellSizeX * cellSizeX;

        IntStream.range(0, width).parallel().forEach(col -> {
            double[] f = new double[height];
            for (int row = 0; row < height; row++) {
                f[row] = occupancy.isOccupied(row, col) ? 0 : BIG;
            }
            double[] d = transform1d(f, weightY);
            for (int row = 0; row < height; row++) {
                squared[row * width + col] = d[row];
            }
        });

        IntStream.range(0, height).parallel().forEach(row -> {
            double[] f = new double[width];
            System.arraycopy(squared, row * width, f, 0, width);
            double[] d = transform1d(f, weightX);
            System.arraycopy(d, 0, squared, row * width, width);
        });

        double[] kilometers = new double[squared.length];
        for (int i = 0; i < squared.length; i++) {
            kilometers[i] = FastMath.sqrt(squared[i]);
        }
        LOG.debug("Distance transform of {}x{} cells ({} x {} km) complete.", width, height, cellSizeX, cellSizeY);
        return new DistanceField(geometry, kilometers);
    }

    /**
     * One-dimensional squared distance transform: d(p) = min over q of (weight * (p - q)^2 + f(q)).
     * Samples at or above BIG do not contribute a parabola. If every sample is BIG the output is all BIG.
     */
    static double[] transform1d (double[] f, double weight) {
        int n = f.length;
        double[] d = new double[n];
        int[] v = new int[n];         // Locations of parabolas in the lower envelope
        double[] z = new double[n + 1]; // Boundaries between parabolas
        int k = -1;
        for (int q = 0; q < n; q++) {
            if (f[q] >= BIG) continue;
            double s = Double.NEGATIVE_INFINITY;
            while (k >= 0) {
                int p = v[k];
                s = ((f[q] + weight * q * q) - (f[p] + weight * p * p)) / (2 * weight * (q - p));
                if (s <= z[k]) {
                    k--;
                } else {
                    break;
                }
            }
            k++;
            v[k] = q;
            z[k] = k == 0 ? Double.NEGATIVE_INFINITY : s;
            z[k + 1] = Double.POSITIVE_INFINITY;
        }
        if (k < 0) {
            Arrays.fill(d, BIG);
            return d;
        }
        k = 0;
        for (int p = 0; p < n; p++) {
            while (z[k + 1] < p) {
                k++;
            }
            double offset = p - v[k];
            d[p] = weight * offset * offset + f[v[k]];
        }
        return d;
    }

}
