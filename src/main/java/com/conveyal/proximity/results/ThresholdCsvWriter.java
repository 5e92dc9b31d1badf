package com.conveyal.proximity.results;

import com.conveyal.proximity.aggregate.ScopeResult;
import com.conveyal.proximity.aggregate.ThresholdRow;
import com.conveyal.proximity.classify.DistanceBands;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

/**
 * Writes the cumulative-threshold tables of many scopes, regions and the continent into one long table with one
 * row per result and threshold. Urban and rural columns are left empty where the split is unknown.
 */
public class ThresholdCsvWriter extends CsvTableWriter {

    public enum Level {
        SCOPE, REGION, CONTINENT;

        String label () {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ThresholdCsvWriter (File file) throws IOException {
        super(file);
    }

    @Override
    protected String[] columnHeaders () {
        return new String[] {
            "level", "id", "threshold_km",
            "reachable_total", "reachable_urban", "reachable_rural",
            "no_access_total", "no_access_urban", "no_access_rural",
            "share_of_total", "coverage_urban", "coverage_rural"
        };
    }

    public void write (Level level, ScopeResult result) throws IOException {
        for (ThresholdRow row : result.thresholds.values()) {
            writeRow(
                level.label(), result.id, DistanceBands.formatKm(row.thresholdKm),
                format(row.reachable.totalPersons()), format(row.reachable.urbanPersons()),
                format(row.reachable.ruralPersons()),
                format(row.noAccess.totalPersons()), format(row.noAccess.urbanPersons()),
                format(row.noAccess.ruralPersons()),
                format(row.shareOfTotal.total), format(row.coverage.urban), format(row.coverage.rural)
            );
        }
    }

}
