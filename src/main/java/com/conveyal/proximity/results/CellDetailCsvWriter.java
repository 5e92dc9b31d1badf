package com.conveyal.proximity.results;

import com.conveyal.proximity.classify.CellRecord;

import java.io.File;
import java.io.IOException;

/** Writes the individual cell records of a scope, for auditing the classification and distances. */
public class CellDetailCsvWriter extends CsvTableWriter {

    public CellDetailCsvWriter (File file) throws IOException {
        super(file);
    }

    @Override
    protected String[] columnHeaders () {
        return new String[] {"scope", "row", "col", "x", "y", "population", "class", "distance_km", "band"};
    }

    public void write (Iterable<CellRecord> records) throws IOException {
        for (CellRecord record : records) {
            writeRow(
                record.scopeId, Integer.toString(record.row), Integer.toString(record.col),
                format(record.x), format(record.y), format(record.population),
                record.urbanRural.label(), format(record.distanceKm), record.bandLabel
            );
        }
    }

}
