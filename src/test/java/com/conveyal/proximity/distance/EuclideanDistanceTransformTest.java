package com.conveyal.proximity.distance;

import com.conveyal.proximity.TestData;
import com.conveyal.proximity.error.NoReferenceFeaturesException;
import com.conveyal.proximity.grid.GridCell;
import com.conveyal.proximity.grid.GridGeometry;
import com.conveyal.proximity.rasterize.OccupancyGrid;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EuclideanDistanceTransformTest {

    private final EuclideanDistanceTransform transform = new EuclideanDistanceTransform();

    @Test
    void distancesFromSingleCell () {
        GridGeometry geometry = TestData.geometry(4, 4);
        OccupancyGrid occupancy = OccupancyGrid.of(geometry, List.of(new GridCell(0, 0)));
        DistanceField field = transform.computeDistances(occupancy, 1, 1);
        assertEquals(0, field.getKm(0, 0));
        assertEquals(1, field.getKm(0, 1));
        assertEquals(1, field.getKm(1, 0));
        assertEquals(Math.sqrt(2), field.getKm(1, 1), 1e-12);
        assertEquals(2, field.getKm(0, 2));
        assertEquals(3, field.getKm(0, 3));
        assertEquals(Math.sqrt(18), field.getKm(3, 3), 1e-12);
        assertEquals(Math.sqrt(18), field.maxKm(), 1e-12);
    }

    /** Compare against the minimum over all occupied cells, for random sparse occupancy and unequal cell sizes. */
    @ParameterizedTest
    @CsvSource({"1, 1, 1", "0.5, 2, 2", "0.092, 0.111, 3"})
    void matchesBruteForce (double cellSizeX, double cellSizeY, long seed) {
        GridGeometry geometry = TestData.geometry(23, 17);
        Random random = new Random(seed);
        List<GridCell> occupied = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            occupied.add(new GridCell(random.nextInt(geometry.height), random.nextInt(geometry.width)));
        }
        DistanceField field = transform.computeDistances(OccupancyGrid.of(geometry, occupied), cellSizeX, cellSizeY);
        for (int row = 0; row < geometry.height; row++) {
            for (int col = 0; col < geometry.width; col++) {
                double best = Double.POSITIVE_INFINITY;
                for (GridCell cell : occupied) {
                    double dx = (col - cell.col) * cellSizeX;
                    double dy = (row - cell.row) * cellSizeY;
                    best = Math.min(best, Math.sqrt(dx * dx + dy * dy));
                }
                assertEquals(best, field.getKm(row, col), 1e-9, "Distance at row " + row + " col " + col);
            }
        }
    }

    @Test
    void anisotropicCells () {
        GridGeometry geometry = TestData.geometry(5, 5);
        OccupancyGrid occupancy = OccupancyGrid.of(geometry, List.of(new GridCell(2, 2)));
        DistanceField field = transform.computeDistances(occupancy, 0.5, 2);
        assertEquals(1, field.getKm(2, 0), 1e-12);
        assertEquals(4, field.getKm(0, 2), 1e-12);
        assertEquals(Math.sqrt(1 + 16), field.getKm(0, 0), 1e-12);
    }

    @Test
    void emptyOccupancyNeedsReferenceFeatures () {
        OccupancyGrid empty = OccupancyGrid.of(TestData.geometry(3, 3), List.of());
        assertThrows(NoReferenceFeaturesException.class, () -> transform.computeDistances(empty, 1, 1));
    }

    @Test
    void oneDimensionalTransform () {
        double big = EuclideanDistanceTransform.BIG;
        double[] d = EuclideanDistanceTransform.transform1d(new double[] {big, 0, big, big, 0}, 1);
        assertArrayEquals(new double[] {1, 0, 1, 1, 0}, d, 1e-12);
        double[] none = EuclideanDistanceTransform.transform1d(new double[] {big, big}, 1);
        assertEquals(big, none[0]);
    }

}
