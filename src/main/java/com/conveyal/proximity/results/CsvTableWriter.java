package com.conveyal.proximity.results;

import com.csvreader.CsvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Common supertype of the CSV outputs. Writes a header row on creation and then rows of exactly as many columns.
 * Rows may be written from several threads.
 */
public abstract class CsvTableWriter implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(CsvTableWriter.class);

    private final CsvWriter csvWriter;

    private final int nColumns;

    protected final File file;

    /**
     * Override to provide column names. Called from the constructor, so implementations must not read fields of the
     * subclass.
     */
    protected abstract String[] columnHeaders ();

    protected CsvTableWriter (File file) throws IOException {
        this.file = file;
        BufferedWriter bufferedWriter = new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8));
        csvWriter = new CsvWriter(bufferedWriter, ',');
        String[] headers = columnHeaders();
        nColumns = headers.length;
        csvWriter.writeRecord(headers);
        LOG.debug("Created CSV file {}", file);
    }

    protected synchronized void writeRow (String... values) throws IOException {
        checkArgument(values.length == nColumns, "Attempted to write the wrong number of columns to %s", file);
        csvWriter.writeRecord(values);
    }

    @Override
    public synchronized void close () {
        csvWriter.close();
    }

    /** Empty for null, so that unknown values are distinguishable from zero. */
    static String format (Double value) {
        return value == null ? "" : Double.toString(value);
    }

    static String format (double value) {
        return Double.toString(value);
    }

}
