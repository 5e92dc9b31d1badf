package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.error.ReconciliationException;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the invariants every aggregate table must satisfy. A violation means the aggregation logic is wrong, not
 * that the input is bad, so it is reported as a ReconciliationException which aborts the run.
 */
public abstract class Reconciliation {

    /** Tolerance on shares of a complete partition summing to one. */
    public static final double SHARE_TOLERANCE = 1e-3;

    public static void check (ScopeResult result) {
        List<String> violations = violations(result);
        if (!violations.isEmpty()) {
            throw new ReconciliationException(result.id, violations);
        }
    }

    public static List<String> violations (ScopeResult result) {
        List<String> violations = new ArrayList<>();
        PopulationSplit total = result.population;

        // Band table partitions the scope exactly.
        PopulationSplit bandSum = PopulationSplit.ZERO;
        int cellSum = 0;
        double bandShareSum = 0;
        double classShareSum = 0;
        for (BandRow band : result.bands.values()) {
            bandSum = bandSum.plus(band.population);
            cellSum += band.cells;
            if (band.shareOfTotal.total != null) {
                bandShareSum += band.shareOfTotal.total;
            }
            if (band.shareOfTotal.urban != null && band.shareOfTotal.rural != null) {
                classShareSum += band.shareOfTotal.urban + band.shareOfTotal.rural;
            }
        }
        if (bandSum.total() != total.total()) {
            violations.add(String.format("band populations sum to %.6f but total is %.6f",
                    bandSum.totalPersons(), total.totalPersons()));
        }
        if (total.splitKnown() && bandSum.splitKnown() &&
                (bandSum.urban() != total.urban() || bandSum.rural() != total.rural())) {
            violations.add("urban or rural band populations do not sum to the class totals");
        }
        if (cellSum != result.cells) {
            violations.add(String.format("band cell counts sum to %d but scope has %d cells", cellSum, result.cells));
        }
        if (total.total() > 0) {
            if (FastMath.abs(bandShareSum - 1) > SHARE_TOLERANCE) {
                violations.add(String.format("band shares sum to %.6f", bandShareSum));
            }
            if (total.splitKnown() && FastMath.abs(classShareSum - 1) > SHARE_TOLERANCE) {
                violations.add(String.format("urban and rural band shares sum to %.6f", classShareSum));
            }
        }

        // Cumulative table is monotone and never exceeds the total.
        ThresholdRow previous = null;
        for (ThresholdRow row : result.thresholds.values()) {
            if (previous != null) {
                if (previous.thresholdKm >= row.thresholdKm) {
                    violations.add("thresholds are not ascending at " + row.thresholdKm + " km");
                }
                if (row.reachable.total() < previous.reachable.total()) {
                    violations.add("reachable population decreases at " + row.thresholdKm + " km");
                }
                if (row.reachable.splitKnown() && previous.reachable.splitKnown() &&
                        (row.reachable.urban() < previous.reachable.urban() ||
                         row.reachable.rural() < previous.reachable.rural())) {
                    violations.add("urban or rural reachable population decreases at " + row.thresholdKm + " km");
                }
            }
            if (row.noAccess.total() < 0) {
                violations.add("no-access population is negative at " + row.thresholdKm + " km");
            }
            if (row.noAccess.splitKnown() && (row.noAccess.urban() < 0 || row.noAccess.rural() < 0)) {
                violations.add("urban or rural no-access population is negative at " + row.thresholdKm + " km");
            }
            previous = row;
        }
        return violations;
    }

}
