package com.conveyal.proximity.boundary;

import com.conveyal.proximity.features.Feature;
import com.conveyal.proximity.features.FeatureSet;
import com.conveyal.proximity.grid.Crs;
import com.conveyal.proximity.grid.Grid;
import com.conveyal.proximity.grid.GridGeometry;
import com.conveyal.proximity.util.GeometryUtils;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns administrative boundary polygons into analysis scopes, and crops the population grid to each scope.
 *
 * Boundaries are grouped on a name attribute. Countries made of several features (islands, exclaves) become one
 * scope whose boundary is the union of their polygons. Boundaries are reprojected into the CRS of the population
 * grid once, here, so that masking never has to reproject.
 */
public class BoundaryResolver {

    private static final Logger LOG = LoggerFactory.getLogger(BoundaryResolver.class);

    public interface Config {
        String boundaryNameAttribute ();
    }

    private final String nameAttribute;

    private final RegionDefinitions regions;

    public BoundaryResolver (Config config, RegionDefinitions regions) {
        this.nameAttribute = config.boundaryNameAttribute();
        this.regions = regions;
    }

    public List<Scope> resolve (FeatureSet boundaries, GridGeometry grid) {
        Map<String, List<Geometry>> polygonsByName = new LinkedHashMap<>();
        int unnamed = 0;
        int notPolygonal = 0;
        for (Feature feature : boundaries) {
            String name = feature.attributeAsString(nameAttribute);
            if (name == null || name.isEmpty()) {
                unnamed++;
                continue;
            }
            if (!GeometryUtils.isPolygonal(feature.geometry)) {
                notPolygonal++;
                continue;
            }
            polygonsByName.computeIfAbsent(name, k -> new ArrayList<>()).add(feature.geometry);
        }
        if (unnamed > 0) {
            LOG.warn("Ignored {} boundary features without a value for {}.", unnamed, nameAttribute);
        }
        if (notPolygonal > 0) {
            LOG.warn("Ignored {} boundary features that are not polygons.", notPolygonal);
        }
        List<Scope> scopes = new ArrayList<>(polygonsByName.size());
        for (Map.Entry<String, List<Geometry>> entry : polygonsByName.entrySet()) {
            Geometry union = GeometryUtils.unionPolygons(entry.getValue());
            Geometry boundary = Crs.reproject(union, boundaries.crs, grid.crs);
            scopes.add(new Scope(entry.getKey(), boundary, regions.regionOf(entry.getKey())));
        }
        LOG.info("Resolved {} scopes from {} boundary features.", scopes.size(), boundaries.size());
        return scopes;
    }

    /** A single scope covering the whole population grid. */
    public Scope wholeGrid (String name) {
        return new Scope(name, null, regions.regionOf(name));
    }

    /**
     * @return the fraction of the area of the scope boundary lying within the extent of the grid, or null if the
     *         scope is the whole grid. Areas are measured in units of the grid CRS.
     */
    public static Double overlapRatio (GridGeometry grid, Scope scope) {
        if (scope.boundary == null) {
            return null;
        }
        double area = scope.boundary.getArea();
        if (area == 0) {
            return 0.0;
        }
        Geometry extent = GeometryUtils.toGeometry(grid.worldEnvelope());
        return scope.boundary.intersection(extent).getArea() / area;
    }

    /**
     * Crop and mask the grid to the scope.
     * @throws com.conveyal.proximity.error.NoOverlapException if the scope does not overlap the grid.
     */
    public static Grid scopeGrid (Grid grid, Scope scope) {
        if (scope.boundary == null) {
            return grid;
        }
        return grid.mask(scope.boundary, scope.id);
    }

}
