package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.classify.CellRecord;
import com.conveyal.proximity.classify.FacilityDistribution;
import com.conveyal.proximity.classify.UrbanRural;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;

/**
 * Descriptive statistics of one scope that are not part of the distance tables: how much of the scope the raster
 * covers, how many cells hold data, how population is distributed over urban and rural cells, and where the
 * reference features lie. Written alongside the scope result but not read back or rolled up.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"overlapRatio", "validCells", "urban", "rural", "facilities"})
public class ScopeProfile {

    /**
     * Fraction of the area of the scope boundary that lies within the raster extent. Below one, the raster cuts off
     * part of the scope. Null when the scope is the whole raster.
     */
    public final Double overlapRatio;

    /** Cells of the scope holding data, populated or not. */
    public final int validCells;

    public final DensityStats urban;

    public final DensityStats rural;

    public final FacilityDistribution facilities;

    public ScopeProfile (Double overlapRatio, int validCells, Collection<CellRecord> records,
                         FacilityDistribution facilities) {
        this.overlapRatio = overlapRatio;
        this.validCells = validCells;
        this.urban = DensityStats.of(records, UrbanRural.URBAN);
        this.rural = DensityStats.of(records, UrbanRural.RURAL);
        this.facilities = facilities;
    }

}
