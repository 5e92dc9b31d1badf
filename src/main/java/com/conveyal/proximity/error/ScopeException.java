package com.conveyal.proximity.error;

/**
 * Common supertype of problems that are fatal to the analysis of one scope (usually one country) but not to the
 * run as a whole. These are caught at the per-scope boundary in the pipeline, recorded against the scope, and the
 * scope is excluded from region rollups. Problems that indicate a defect or a bad configuration do not extend this
 * class and abort the whole run.
 */
public abstract class ScopeException extends RuntimeException {

    protected ScopeException (String message) {
        super(message);
    }

    protected ScopeException (String message, Throwable cause) {
        super(message, cause);
    }

}
