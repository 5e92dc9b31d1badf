package com.conveyal.proximity.aggregate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Population and cell counts within one discrete distance band. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"label", "lowerKm", "upperKm", "population", "cells", "urbanCells", "ruralCells", "shareOfTotal"})
public class BandRow {

    public final String label;

    public final double lowerKm;

    /** Null for the last, unbounded band. */
    public final Double upperKm;

    public final PopulationSplit population;

    public final int cells;

    public final Integer urbanCells;

    public final Integer ruralCells;

    public final Shares shareOfTotal;

    public BandRow (String label, double lowerKm, double upperKm, PopulationSplit population, int cells,
                    Integer urbanCells, Integer ruralCells, PopulationSplit scopeTotal) {
        this.label = label;
        this.lowerKm = lowerKm;
        this.upperKm = Double.isInfinite(upperKm) ? null : upperKm;
        this.population = population;
        this.cells = cells;
        this.urbanCells = urbanCells;
        this.ruralCells = ruralCells;
        this.shareOfTotal = Shares.ofTotal(population, scopeTotal);
    }

    public double upperKmOrInfinity () {
        return upperKm == null ? Double.POSITIVE_INFINITY : upperKm;
    }

}
