package com.conveyal.proximity.error;

/** A boundary polygon and a grid do not intersect at all. The scope is skipped and reported with zero coverage. */
public class NoOverlapException extends ScopeException {

    public NoOverlapException (String message) {
        super(message);
    }

}
