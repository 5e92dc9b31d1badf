package com.conveyal.proximity.classify;

import java.util.Locale;

public enum UrbanRural {

    URBAN, RURAL;

    /** Lower case name used in output files. */
    public String label () {
        return name().toLowerCase(Locale.ROOT);
    }

}
