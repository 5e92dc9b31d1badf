package com.conveyal.proximity.error;

/**
 * No coordinate reference system could be determined for an input, or the one found is not understood.
 * Recoverable by supplying the CRS explicitly (the raster-crs configuration key) before retrying.
 */
public class CrsException extends ScopeException {

    public CrsException (String message) {
        super(message);
    }

    public CrsException (String message, Throwable cause) {
        super(message, cause);
    }

}
