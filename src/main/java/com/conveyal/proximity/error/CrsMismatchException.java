package com.conveyal.proximity.error;

/**
 * Features and a reference grid are in different coordinate reference systems. Nothing reprojects implicitly:
 * callers must reproject the features (see FeatureSet.reproject) before rasterizing them.
 */
public class CrsMismatchException extends CrsException {

    public final String featureCrs;
    public final String gridCrs;

    public CrsMismatchException (String featureCrs, String gridCrs) {
        super(String.format("Features are in %s but the reference grid is in %s. Reproject before rasterizing.",
                featureCrs, gridCrs));
        this.featureCrs = featureCrs;
        this.gridCrs = gridCrs;
    }

}
