package com.conveyal.proximity.classify;

/**
 * Classification of one populated cell: how many people live there, whether they are urban or rural, how far the
 * cell is from the nearest road or facility, and the distance band it falls in.
 */
public class CellRecord {

    public final String scopeId;

    /** Null if the scope belongs to no region. */
    public final String regionId;

    public final int row;

    public final int col;

    /** World coordinates of the cell center, in the CRS of the population grid. */
    public final double x;

    public final double y;

    /** Raster value before classification, which may be negative under the sign policy. */
    public final double value;

    /** Number of people, always positive. */
    public final double population;

    public final UrbanRural urbanRural;

    public final double distanceKm;

    public final int band;

    public final String bandLabel;

    public CellRecord (String scopeId, String regionId, int row, int col, double x, double y, double value,
                       double population, UrbanRural urbanRural, double distanceKm, int band, String bandLabel) {
        this.scopeId = scopeId;
        this.regionId = regionId;
        this.row = row;
        this.col = col;
        this.x = x;
        this.y = y;
        this.value = value;
        this.population = population;
        this.urbanRural = urbanRural;
        this.distanceKm = distanceKm;
        this.band = band;
        this.bandLabel = bandLabel;
    }

    @Override
    public String toString () {
        return String.format("%s (%d, %d) %s %.1f at %.3f km in %s",
                scopeId, row, col, urbanRural.label(), population, distanceKm, bandLabel);
    }

}
