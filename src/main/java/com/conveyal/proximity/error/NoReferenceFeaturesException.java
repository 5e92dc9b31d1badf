package com.conveyal.proximity.error;

/**
 * The occupancy grid of a scope is empty, so every distance would be undefined. This usually means the road or
 * facility input is missing for that area rather than legitimately sparse, so the scope is flagged for review.
 */
public class NoReferenceFeaturesException extends ScopeException {

    public NoReferenceFeaturesException (String message) {
        super(message);
    }

}
