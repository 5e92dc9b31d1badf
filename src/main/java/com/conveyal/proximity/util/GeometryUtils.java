package com.conveyal.proximity.util;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Shared geometry factory and small helpers for working with JTS geometries.
 */
public abstract class GeometryUtils {

    public static final GeometryFactory geometryFactory = new GeometryFactory();

    /**
     * Kilometres per degree at the equator. Used to convert geographic cell sizes to kilometres. The same constant is
     * applied to both axes unless longitude scaling by latitude is switched on.
     */
    public static final double KM_PER_DEGREE = 111.32;

    public static Geometry toGeometry (Envelope envelope) {
        return geometryFactory.toGeometry(envelope);
    }

    /**
     * Union a collection of polygonal geometries into one. Used to merge several boundary features that share a
     * name (islands, exclaves) into a single scope boundary.
     */
    public static Geometry unionPolygons (Collection<? extends Geometry> geometries) {
        List<Polygon> polygons = new ArrayList<>();
        for (Geometry geometry : geometries) {
            collectPolygons(geometry, polygons);
        }
        if (polygons.isEmpty()) {
            return geometryFactory.createPolygon();
        }
        if (polygons.size() == 1) {
            return polygons.get(0);
        }
        return geometryFactory.buildGeometry(polygons).union();
    }

    private static void collectPolygons (Geometry geometry, List<Polygon> out) {
        if (geometry instanceof Polygon) {
            out.add((Polygon) geometry);
        } else if (geometry instanceof GeometryCollection) {
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                collectPolygons(geometry.getGeometryN(i), out);
            }
        }
    }

    public static boolean isPolygonal (Geometry geometry) {
        return geometry instanceof Polygonal;
    }

}
