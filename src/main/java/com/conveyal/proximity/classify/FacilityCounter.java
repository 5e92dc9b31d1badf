package com.conveyal.proximity.classify;

import com.conveyal.proximity.error.CrsMismatchException;
import com.conveyal.proximity.features.Feature;
import com.conveyal.proximity.features.FeatureSet;
import com.conveyal.proximity.grid.Crs;
import com.conveyal.proximity.grid.Grid;
import com.conveyal.proximity.grid.GridCell;
import com.conveyal.proximity.grid.GridGeometry;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tallies reference features by the class of the population cell they stand in, using the same classification
 * policy as the cells themselves. A point feature stands in the cell containing it. Lines and polygons are located
 * at a point inside them.
 */
public class FacilityCounter {

    private static final Logger LOG = LoggerFactory.getLogger(FacilityCounter.class);

    private final ClassificationPolicy policy;

    public FacilityCounter (ClassificationPolicy policy) {
        this.policy = policy;
    }

    /**
     * @param facilities features in the CRS of the scope grid.
     * @param boundary outline of the scope in the same CRS, or null if the scope is the whole grid. Features not
     *                 within it are not part of the scope and are not counted.
     * @throws CrsMismatchException if the features are not in the CRS of the grid.
     */
    public FacilityDistribution count (FeatureSet facilities, Grid scopeGrid, Geometry boundary) {
        GridGeometry geometry = scopeGrid.geometry;
        if (!Crs.same(facilities.crs, geometry.crs)) {
            throw new CrsMismatchException(facilities.crs, geometry.crs);
        }
        PreparedGeometry prepared = boundary == null ? null : PreparedGeometryFactory.prepare(boundary);
        int urban = 0;
        int rural = 0;
        int unpopulated = 0;
        int unknown = 0;
        for (Feature facility : facilities) {
            if (facility.geometry.isEmpty()) continue;
            Point location = location(facility.geometry);
            if (prepared != null && !prepared.covers(location)) continue;
            GridCell cell = geometry.cellOf(location.getX(), location.getY());
            if (!geometry.contains(cell) || scopeGrid.isNoData(cell.row, cell.col)) {
                unknown++;
                continue;
            }
            double value = scopeGrid.getValue(cell.row, cell.col);
            if (!policy.isPopulated(value)) {
                unpopulated++;
            } else if (policy.classify(value) == UrbanRural.URBAN) {
                urban++;
            } else {
                rural++;
            }
        }
        FacilityDistribution distribution = new FacilityDistribution(urban, rural, unpopulated, unknown);
        LOG.debug("{}: {}", scopeGrid.name, distribution);
        return distribution;
    }

    static Point location (Geometry geometry) {
        if (geometry instanceof Point) {
            return (Point) geometry;
        }
        return geometry.getInteriorPoint();
    }

}
