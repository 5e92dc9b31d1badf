package com.conveyal.proximity.aggregate;

import org.apache.commons.math3.util.FastMath;

/**
 * Population is summed in fixed point, as a long number of millionths of a person, so that sums are exact and do not
 * depend on the order in which cells or scopes are added. This is what allows partition sums to be checked for exact
 * equality with totals.
 */
public abstract class Population {

    public static final double FIXED_FACTOR = 1e6;

    public static long toFixed (double persons) {
        return FastMath.round(persons * FIXED_FACTOR);
    }

    public static double toPersons (long fixed) {
        return fixed / FIXED_FACTOR;
    }

}
