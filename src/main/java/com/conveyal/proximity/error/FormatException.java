package com.conveyal.proximity.error;

/** An input raster or vector source could not be parsed. */
public class FormatException extends ScopeException {

    public FormatException (String message) {
        super(message);
    }

    public FormatException (String message, Throwable cause) {
        super(message, cause);
    }

}
