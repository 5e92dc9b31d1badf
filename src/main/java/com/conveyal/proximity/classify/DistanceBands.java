package com.conveyal.proximity.classify;

import com.conveyal.proximity.error.ConfigurationException;

import java.math.BigDecimal;
import java.util.Arrays;

/**
 * Discrete distance bands defined by ascending breakpoints b1 < b2 < ... < bn in kilometers. The first band is
 * [0, b1], band i is (b(i-1), bi], and the last band (bn, infinity) is unbounded. A cell exactly at a breakpoint
 * falls in the nearer band, consistent with cumulative thresholds which count distances less than or equal to the
 * threshold.
 */
public class DistanceBands {

    public static final double[] DEFAULT_BREAKPOINTS = {1, 2, 5, 10, 20, 50, 100};

    private final double[] breakpoints;

    private final String[] labels;

    public DistanceBands (double... breakpoints) {
        checkAscending(breakpoints, "Distance band breakpoints");
        this.breakpoints = breakpoints.clone();
        this.labels = new String[breakpoints.length + 1];
        for (int i = 0; i < labels.length; i++) {
            if (i == breakpoints.length) {
                labels[i] = ">" + formatKm(breakpoints[i - 1]) + "km";
            } else {
                labels[i] = formatKm(lowerKm(i)) + "-" + formatKm(breakpoints[i]) + "km";
            }
        }
    }

    public int bandCount () {
        return labels.length;
    }

    /** @return the index of the band containing the distance. */
    public int bandOf (double distanceKm) {
        return indexOf(breakpoints, distanceKm);
    }

    public String label (int band) {
        return labels[band];
    }

    public double lowerKm (int band) {
        return band == 0 ? 0 : breakpoints[band - 1];
    }

    /** @return the upper bound of the band, infinite for the last band. */
    public double upperKm (int band) {
        return band == breakpoints.length ? Double.POSITIVE_INFINITY : breakpoints[band];
    }

    public double[] breakpoints () {
        return breakpoints.clone();
    }

    /**
     * @return the index of the first of the ascending limits that is at least the value, or limits.length if the
     *         value exceeds them all.
     */
    public static int indexOf (double[] limits, double value) {
        int i = Arrays.binarySearch(limits, value);
        return i >= 0 ? i : -i - 1;
    }

    /** Kilometers without a trailing fractional zero: 1.0 is written "1" and 2.5 is "2.5". */
    public static String formatKm (double km) {
        BigDecimal decimal = BigDecimal.valueOf(km).stripTrailingZeros();
        return decimal.scale() < 0 ? decimal.setScale(0).toPlainString() : decimal.toPlainString();
    }

    public static void checkAscending (double[] values, String description) {
        if (values.length == 0) {
            throw new ConfigurationException(description + " must not be empty.");
        }
        for (int i = 0; i < values.length; i++) {
            if (!(values[i] > 0) || Double.isInfinite(values[i])) {
                throw new ConfigurationException(description + " must be positive finite numbers: " +
                        Arrays.toString(values));
            }
            if (i > 0 && values[i] <= values[i - 1]) {
                throw new ConfigurationException(description + " must be strictly ascending: " +
                        Arrays.toString(values));
            }
        }
    }

    @Override
    public boolean equals (Object other) {
        return other instanceof DistanceBands && Arrays.equals(breakpoints, ((DistanceBands) other).breakpoints);
    }

    @Override
    public int hashCode () {
        return Arrays.hashCode(breakpoints);
    }

}
