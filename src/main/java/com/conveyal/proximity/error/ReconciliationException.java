package com.conveyal.proximity.error;

import java.util.List;

/**
 * An aggregate invariant failed after rollup, for example partition sums not equal to the scope total. This is a
 * logic defect and not bad input, so it is never caught at the scope boundary: it aborts the run.
 */
public class ReconciliationException extends RuntimeException {

    public final String scopeId;
    public final List<String> violations;

    public ReconciliationException (String scopeId, List<String> violations) {
        super("Aggregates for " + scopeId + " do not reconcile: " + String.join("; ", violations));
        this.scopeId = scopeId;
        this.violations = List.copyOf(violations);
    }

}
