package com.conveyal.proximity.boundary;

import org.locationtech.jts.geom.Geometry;

/**
 * The unit of analysis: a named area (usually a country) with its boundary in the CRS of the population grid, and
 * the region it rolls up into.
 */
public class Scope {

    public final String id;

    /** Null if the scope covers the whole grid. */
    public final Geometry boundary;

    /** Null if the scope is not assigned to any region. */
    public final String region;

    public Scope (String id, Geometry boundary, String region) {
        this.id = id;
        this.boundary = boundary;
        this.region = region;
    }

    @Override
    public String toString () {
        return region == null ? id : id + " (" + region + ")";
    }

}
