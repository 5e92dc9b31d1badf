package com.conveyal.proximity.classify;

import com.conveyal.proximity.error.ConfigurationException;

/**
 * Decides which raster values represent people and whether those people are urban or rural. Two policies exist
 * because the source rasters come in two encodings: a signed raster where the sign carries the class, and an
 * unsigned density raster where the class follows from a density threshold. They interpret the same numbers
 * differently and must not be mixed within one run.
 *
 * Policies only see values that are not no-data.
 */
public interface ClassificationPolicy {

    /** Whether a cell with this value holds any population to classify. */
    boolean isPopulated (double value);

    UrbanRural classify (double value);

    /** Number of people represented by the value. */
    double magnitude (double value);

    String name ();

    /**
     * Create the policy named in the configuration.
     * @param densityThreshold required for the threshold policy, and not allowed with the sign policy.
     */
    static ClassificationPolicy forName (String name, Double densityThreshold) {
        if (SignPolicy.NAME.equalsIgnoreCase(name)) {
            if (densityThreshold != null) {
                throw new ConfigurationException("A density threshold was given but the sign classification " +
                        "policy ignores it. Remove density-threshold or use the threshold policy.");
            }
            return new SignPolicy();
        } else if (ThresholdPolicy.NAME.equalsIgnoreCase(name)) {
            if (densityThreshold == null) {
                throw new ConfigurationException("The threshold classification policy requires density-threshold.");
            }
            return new ThresholdPolicy(densityThreshold);
        }
        throw new ConfigurationException("Unknown classification policy '" + name + "', expected sign or threshold.");
    }

}
