package com.conveyal.proximity.classify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * How the reference features (usually facilities) inside one scope are spread over urban and rural cells. Every
 * feature inside the scope is counted exactly once, so urban + rural + unpopulated + unknown == total.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"total", "urban", "rural", "unpopulated", "unknown", "urbanShare", "ruralShare", "urbanRuralRatio"})
public class FacilityDistribution {

    public final int total;

    public final int urban;

    public final int rural;

    /** Features in cells that hold data but no population. */
    public final int unpopulated;

    /** Features in cells without data, or outside the raster. */
    public final int unknown;

    /** Null when there are no features. */
    public final Double urbanShare;

    public final Double ruralShare;

    /** Urban features per rural feature. Null when there are no rural features. */
    public final Double urbanRuralRatio;

    public FacilityDistribution (int urban, int rural, int unpopulated, int unknown) {
        this.urban = urban;
        this.rural = rural;
        this.unpopulated = unpopulated;
        this.unknown = unknown;
        this.total = urban + rural + unpopulated + unknown;
        this.urbanShare = total == 0 ? null : (double) urban / total;
        this.ruralShare = total == 0 ? null : (double) rural / total;
        this.urbanRuralRatio = rural == 0 ? null : (double) urban / rural;
    }

    @Override
    public String toString () {
        return String.format("%d features: %d urban, %d rural, %d unpopulated, %d unknown",
                total, urban, rural, unpopulated, unknown);
    }

}
