package com.conveyal.proximity.aggregate;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Fractions between 0 and 1 for the whole population and its urban and rural parts. Each is null when it cannot be
 * computed, because the split is unknown or because the denominator is zero.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Shares {

    public final Double total;
    public final Double urban;
    public final Double rural;

    private Shares (Double total, Double urban, Double rural) {
        this.total = total;
        this.urban = urban;
        this.rural = rural;
    }

    /** Each part of the numerator as a share of the whole of the denominator. */
    public static Shares ofTotal (PopulationSplit part, PopulationSplit whole) {
        Double urban = part.splitKnown() ? ratio(part.urban(), whole.total()) : null;
        Double rural = part.splitKnown() ? ratio(part.rural(), whole.total()) : null;
        return new Shares(ratio(part.total(), whole.total()), urban, rural);
    }

    /** Each part of the numerator as a share of the same part of the denominator. */
    public static Shares ofClass (PopulationSplit part, PopulationSplit whole) {
        boolean known = part.splitKnown() && whole.splitKnown();
        Double urban = known ? ratio(part.urban(), whole.urban()) : null;
        Double rural = known ? ratio(part.rural(), whole.rural()) : null;
        return new Shares(ratio(part.total(), whole.total()), urban, rural);
    }

    static Double ratio (long numerator, long denominator) {
        return denominator == 0 ? null : (double) numerator / denominator;
    }

}
