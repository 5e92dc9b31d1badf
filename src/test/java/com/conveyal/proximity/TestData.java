package com.conveyal.proximity;

import com.conveyal.proximity.features.Feature;
import com.conveyal.proximity.features.FeatureSet;
import com.conveyal.proximity.grid.Grid;
import com.conveyal.proximity.grid.GridGeometry;
import com.conveyal.proximity.util.GeometryUtils;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Small grids and feature sets shared by tests. The reference grid is 4 x 4 cells of 1 km in UTM zone 33N, with
 * urban population (positive values) in the upper left block and rural population (negative values) in the upper
 * right block, and a single road in the upper left cell.
 */
public abstract class TestData {

    public static final String UTM_33N = "EPSG:32633";

    public static final double WEST = 500_000;

    public static final double NORTH = 1_000_000;

    public static final double NO_DATA = -9999;

    public static final double[][] SIGNED_POPULATION = {
        {100, 100, -50, -50},
        {100, 100, -50, -50},
        {0, 0, 0, 0},
        {0, 0, 0, 0}
    };

    public static GridGeometry geometry (int width, int height) {
        return GridGeometry.northUp(WEST, NORTH, 1000, 1000, width, height, UTM_33N);
    }

    public static Grid grid (double[][] rows) {
        int height = rows.length;
        int width = rows[0].length;
        double[] values = new double[width * height];
        for (int row = 0; row < height; row++) {
            System.arraycopy(rows[row], 0, values, row * width, width);
        }
        return new Grid("test", geometry(width, height), values, NO_DATA);
    }

    public static Grid signedPopulation () {
        return grid(SIGNED_POPULATION);
    }

    /** A road point at the center of the given cell of the reference geometry. */
    public static Feature roadAt (int row, int col) {
        Coordinate center = geometry(4, 4).coordOf(row, col);
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("highway", "primary");
        return new Feature(GeometryUtils.geometryFactory.createPoint(center), attributes);
    }

    public static FeatureSet features (Feature... features) {
        return new FeatureSet(UTM_33N, new ArrayList<>(List.of(features)));
    }

    /**
     * A rectangle covering whole cells of the reference geometry, inset by 10 m so that no edge falls exactly on a
     * cell boundary.
     */
    public static Geometry cellBox (int firstRow, int firstCol, int lastRow, int lastCol) {
        Envelope envelope = new Envelope(
            WEST + firstCol * 1000 + 10, WEST + (lastCol + 1) * 1000 - 10,
            NORTH - (lastRow + 1) * 1000 + 10, NORTH - firstRow * 1000 - 10
        );
        return GeometryUtils.toGeometry(envelope);
    }

    /** Minimal valid analysis properties. The input paths are never read by the tests that use these. */
    public static Properties properties (String policy) {
        Properties properties = new Properties();
        properties.setProperty("population-raster", "population.asc");
        properties.setProperty("features", "roads.geojson");
        properties.setProperty("output-directory", "output");
        properties.setProperty("classification-policy", policy);
        properties.setProperty("threads", "2");
        return properties;
    }

    public static AnalysisConfig config (String policy) {
        return AnalysisConfig.fromProperties(properties(policy));
    }

}
