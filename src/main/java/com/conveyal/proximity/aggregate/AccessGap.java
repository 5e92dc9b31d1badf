package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.classify.DistanceBands;
import com.conveyal.proximity.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Summary of the difference in access between urban and rural people: the population-weighted mean distance to the
 * nearest road or facility for each class, and the coverage of each class at a few headline thresholds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccessGap {

    public final Double urbanMeanKm;

    public final Double ruralMeanKm;

    /** Rural mean distance minus urban mean distance. */
    public final Double meanGapKm;

    public final List<CoverageGap> coverage;

    public AccessGap (Double urbanMeanKm, Double ruralMeanKm, List<CoverageGap> coverage) {
        this.urbanMeanKm = urbanMeanKm;
        this.ruralMeanKm = ruralMeanKm;
        this.meanGapKm = (urbanMeanKm == null || ruralMeanKm == null) ? null : ruralMeanKm - urbanMeanKm;
        this.coverage = Collections.unmodifiableList(new ArrayList<>(coverage));
    }

    /**
     * Derive coverage gaps from a cumulative-threshold table.
     * @param thresholds keyed as in ScopeResult.thresholds.
     */
    public static AccessGap of (Double urbanMeanKm, Double ruralMeanKm, Map<String, ThresholdRow> thresholds,
                                double[] gapThresholds) {
        List<CoverageGap> coverage = new ArrayList<>();
        for (double km : gapThresholds) {
            ThresholdRow row = thresholds.get(DistanceBands.formatKm(km));
            if (row == null) {
                throw new ConfigurationException("Gap threshold " + km + " km is not one of the cumulative thresholds.");
            }
            coverage.add(new CoverageGap(km, row.coverage.urban, row.coverage.rural));
        }
        return new AccessGap(urbanMeanKm, ruralMeanKm, coverage);
    }

    /** Thresholds at which coverage gaps are reported. */
    public double[] gapThresholds () {
        return coverage.stream().mapToDouble(c -> c.thresholdKm).toArray();
    }

}
