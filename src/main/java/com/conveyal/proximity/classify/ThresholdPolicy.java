package com.conveyal.proximity.classify;

import com.conveyal.proximity.error.ConfigurationException;

/**
 * For unsigned population rasters: cells at or above the density threshold are urban, other populated cells are
 * rural. Values at or below zero are not population.
 */
public class ThresholdPolicy implements ClassificationPolicy {

    public static final String NAME = "threshold";

    public final double threshold;

    public ThresholdPolicy (double threshold) {
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new ConfigurationException("Density threshold must be a positive number, got " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public boolean isPopulated (double value) {
        return value > 0;
    }

    @Override
    public UrbanRural classify (double value) {
        return value >= threshold ? UrbanRural.URBAN : UrbanRural.RURAL;
    }

    @Override
    public double magnitude (double value) {
        return value;
    }

    @Override
    public String name () {
        return NAME;
    }

    @Override
    public String toString () {
        return NAME + " " + threshold;
    }

}
