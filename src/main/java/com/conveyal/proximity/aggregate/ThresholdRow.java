package com.conveyal.proximity.aggregate;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of a cumulative-threshold table: the population living within the threshold distance of a road or
 * facility, and the population left without access at that distance.
 */
@JsonPropertyOrder({"thresholdKm", "reachable", "noAccess", "shareOfTotal", "coverage"})
public class ThresholdRow {

    public final double thresholdKm;

    public final PopulationSplit reachable;

    /** Scope total minus reachable. Its split is reported only when both class totals are known. */
    public final PopulationSplit noAccess;

    /** Reachable population, and each reachable class, as a share of the scope's total population. */
    public final Shares shareOfTotal;

    /** Reachable share of each class's own population. */
    public final Shares coverage;

    public ThresholdRow (double thresholdKm, PopulationSplit reachable, PopulationSplit scopeTotal) {
        this.thresholdKm = thresholdKm;
        this.reachable = reachable;
        this.noAccess = scopeTotal.minus(reachable);
        this.shareOfTotal = Shares.ofTotal(reachable, scopeTotal);
        this.coverage = Shares.ofClass(reachable, scopeTotal);
    }

}
