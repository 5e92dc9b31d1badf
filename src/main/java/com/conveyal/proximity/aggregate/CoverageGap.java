package com.conveyal.proximity.aggregate;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Urban and rural coverage at one threshold distance, and how far rural coverage lags urban coverage. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CoverageGap {

    public final double thresholdKm;
    public final Double urban;
    public final Double rural;
    /** Urban coverage minus rural coverage. */
    public final Double gap;

    public CoverageGap (double thresholdKm, Double urban, Double rural) {
        this.thresholdKm = thresholdKm;
        this.urban = urban;
        this.rural = rural;
        this.gap = (urban == null || rural == null) ? null : urban - rural;
    }

}
