package com.conveyal.proximity.grid;

import com.conveyal.proximity.error.CrsException;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.locationtech.proj4j.proj.LongLatProjection;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Coordinate reference system identifiers and reprojection. CRS identity is carried around as a normalized
 * authority code string such as "EPSG:4326", and resolved to a proj4j definition only when needed.
 */
public abstract class Crs {

    public static final String WGS84 = "EPSG:4326";

    private static final Pattern AUTHORITY = Pattern.compile("[A-Z]+");

    private static final Pattern CODE = Pattern.compile("\\d{1,9}");

    private static final CRSFactory crsFactory = new CRSFactory();

    private static final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();

    private static final Map<String, CoordinateReferenceSystem> crsCache = new ConcurrentHashMap<>();

    /**
     * Reduce the many spellings of a CRS identifier to a single "AUTHORITY:code" form. The OGC URN and CRS84
     * forms that appear in GeoJSON files are recognized, and CRS84 is treated as EPSG:4326 since both are used with
     * longitude first throughout this code base.
     */
    public static String normalize (String code) {
        if (code == null || code.isBlank()) {
            throw new CrsException("Empty coordinate reference system identifier.");
        }
        String upper = code.trim().toUpperCase(Locale.ROOT);
        if (upper.endsWith("CRS84") || upper.equals("CRS:84")) {
            return WGS84;
        }
        String authority;
        String number;
        if (upper.startsWith("URN:OGC:DEF:CRS:")) {
            // urn:ogc:def:crs:EPSG::4326 or urn:ogc:def:crs:EPSG:6.6:4326
            String[] parts = upper.split(":");
            authority = parts.length > 5 ? parts[4] : "";
            number = parts[parts.length - 1];
        } else {
            int colon = upper.indexOf(':');
            authority = colon > 0 ? upper.substring(0, colon) : "";
            number = colon > 0 ? upper.substring(colon + 1) : "";
        }
        if (!AUTHORITY.matcher(authority).matches() || !CODE.matcher(number).matches()) {
            throw new CrsException("Unrecognized coordinate reference system identifier: " + code);
        }
        return authority + ":" + Integer.parseInt(number);
    }

    public static boolean same (String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    /** Resolve a code to a proj4j definition, failing with a CrsException if proj4j does not know it. */
    public static CoordinateReferenceSystem resolve (String code) {
        String normalized = normalize(code);
        return crsCache.computeIfAbsent(normalized, c -> {
            try {
                return crsFactory.createFromName(c);
            } catch (Proj4jException e) {
                throw new CrsException("Coordinate reference system is not supported: " + c, e);
            }
        });
    }

    /** True if coordinates in this CRS are longitude and latitude in degrees. */
    public static boolean isGeographic (String code) {
        return resolve(code).getProjection() instanceof LongLatProjection;
    }

    /**
     * Return a copy of the geometry reprojected from one CRS to another, or the geometry itself if the two are the
     * same. Input geometries are never modified.
     */
    public static Geometry reproject (Geometry geometry, String fromCrs, String toCrs) {
        if (same(fromCrs, toCrs)) {
            return geometry;
        }
        CoordinateTransform transform;
        try {
            transform = transformFactory.createTransform(resolve(fromCrs), resolve(toCrs));
        } catch (Proj4jException e) {
            throw new CrsException(String.format("Cannot transform from %s to %s", fromCrs, toCrs), e);
        }
        Geometry copy = geometry.copy();
        copy.apply(new ReprojectionFilter(transform));
        copy.geometryChanged();
        return copy;
    }

    private static class ReprojectionFilter implements CoordinateSequenceFilter {

        private final CoordinateTransform transform;
        private final ProjCoordinate source = new ProjCoordinate();
        private final ProjCoordinate target = new ProjCoordinate();

        ReprojectionFilter (CoordinateTransform transform) {
            this.transform = transform;
        }

        @Override
        public void filter (CoordinateSequence seq, int i) {
            source.x = seq.getX(i);
            source.y = seq.getY(i);
            try {
                transform.transform(source, target);
            } catch (Proj4jException e) {
                throw new CrsException(String.format("Coordinate (%f, %f) could not be reprojected.", source.x, source.y), e);
            }
            seq.setOrdinate(i, 0, target.x);
            seq.setOrdinate(i, 1, target.y);
        }

        @Override
        public boolean isDone () {
            return false;
        }

        @Override
        public boolean isGeometryChanged () {
            return true;
        }
    }

}
