package com.conveyal.proximity.classify;

/**
 * For signed rasters where positive values are urban population, negative values are rural population, and zero
 * means nobody lives in the cell.
 */
public class SignPolicy implements ClassificationPolicy {

    public static final String NAME = "sign";

    @Override
    public boolean isPopulated (double value) {
        return value != 0;
    }

    @Override
    public UrbanRural classify (double value) {
        return value > 0 ? UrbanRural.URBAN : UrbanRural.RURAL;
    }

    @Override
    public double magnitude (double value) {
        return Math.abs(value);
    }

    @Override
    public String name () {
        return NAME;
    }

    @Override
    public String toString () {
        return NAME;
    }

}
