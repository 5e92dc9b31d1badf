package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.classify.DistanceBands;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate statistics for one scope (usually a country): totals, a cumulative-threshold table keyed on the
 * threshold in kilometers ("1", "2.5"), a band table keyed on band label ("0-1km", ">100km"), and the urban/rural
 * access gap. Immutable once built, and safe to hand from a worker thread to the reducer.
 */
@JsonPropertyOrder({"id", "region", "cells", "population", "thresholds", "bands", "accessGap", "profile"})
public class ScopeResult {

    public final String id;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String region;

    /** Number of populated cells. */
    public final int cells;

    public final PopulationSplit population;

    public final Map<String, ThresholdRow> thresholds;

    public final Map<String, BandRow> bands;

    public final AccessGap accessGap;

    /** Descriptive statistics of the scope, present on results computed in this run. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final ScopeProfile profile;

    public ScopeResult (String id, String region, int cells, PopulationSplit population,
                        List<ThresholdRow> thresholdRows, List<BandRow> bandRows, AccessGap accessGap) {
        this.id = id;
        this.region = region;
        this.cells = cells;
        this.population = population;
        Map<String, ThresholdRow> thresholdMap = new LinkedHashMap<>();
        for (ThresholdRow row : thresholdRows) {
            thresholdMap.put(DistanceBands.formatKm(row.thresholdKm), row);
        }
        Map<String, BandRow> bandMap = new LinkedHashMap<>();
        for (BandRow row : bandRows) {
            bandMap.put(row.label, row);
        }
        this.thresholds = Collections.unmodifiableMap(thresholdMap);
        this.bands = Collections.unmodifiableMap(bandMap);
        this.accessGap = accessGap;
        this.profile = null;
    }

    private ScopeResult (ScopeResult result, ScopeProfile profile) {
        this.id = result.id;
        this.region = result.region;
        this.cells = result.cells;
        this.population = result.population;
        this.thresholds = result.thresholds;
        this.bands = result.bands;
        this.accessGap = result.accessGap;
        this.profile = profile;
    }

    /** A copy of this result carrying the given profile. */
    public ScopeResult withProfile (ScopeProfile profile) {
        return new ScopeResult(this, profile);
    }

    /** @return the row for the given threshold, or null if it is not in the table. */
    public ThresholdRow threshold (double km) {
        return thresholds.get(DistanceBands.formatKm(km));
    }

    /** No-access residual at a threshold, see ThresholdRow.noAccess. */
    public PopulationSplit noAccess (double km) {
        ThresholdRow row = threshold(km);
        if (row == null) {
            throw new IllegalArgumentException("No cumulative threshold at " + km + " km in " + id);
        }
        return row.noAccess;
    }

    @Override
    public String toString () {
        return "ScopeResult " + id + ": " + population;
    }

}
