package com.conveyal.proximity.results;

import com.conveyal.proximity.aggregate.RegionResult;
import com.conveyal.proximity.aggregate.ScopeResult;
import com.conveyal.proximity.classify.CellRecord;
import com.conveyal.proximity.grid.BlockGrid;
import com.conveyal.proximity.pipeline.RunReport;
import com.conveyal.proximity.pipeline.ScopeOutcome;
import com.conveyal.proximity.pipeline.ScopeSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Lays out the files of one run under an output directory:
 * <pre>
 * report.json           run report with region and continent results and the audit
 * thresholds.csv        cumulative-threshold rows of every scope, region and the continent
 * scopes/{id}.json      one result per completed scope, readable by ScopeResultReader
 * cells/{id}.csv        cell records of each scope, if enabled
 * blocks/{id}.json      block aggregated grid of each scope, if enabled
 * </pre>
 * Scope files are written by the worker that produced them, as soon as the scope is done.
 */
public class ResultWriter implements ScopeSink {

    private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);

    public interface Config {
        File outputDirectory ();
        boolean writeCellDetail ();
    }

    private final File outputDirectory;
    private final File scopeDirectory;
    private final File cellDirectory;
    private final File blockDirectory;
    private final boolean writeCellDetail;

    public ResultWriter (Config config) {
        this.outputDirectory = config.outputDirectory();
        this.writeCellDetail = config.writeCellDetail();
        this.scopeDirectory = new File(outputDirectory, "scopes");
        this.cellDirectory = new File(outputDirectory, "cells");
        this.blockDirectory = new File(outputDirectory, "blocks");
        mkdirs(scopeDirectory);
        if (writeCellDetail) {
            mkdirs(cellDirectory);
        }
    }

    @Override
    public void emit (ScopeResult result, List<CellRecord> cells, BlockGrid blocks) {
        String baseName = fileName(result.id);
        try {
            ResultJsonWriter.writeScope(result, new File(scopeDirectory, baseName + ".json"));
            if (writeCellDetail) {
                try (CellDetailCsvWriter writer = new CellDetailCsvWriter(new File(cellDirectory, baseName + ".csv"))) {
                    writer.write(cells);
                }
            }
            if (blocks != null) {
                mkdirs(blockDirectory);
                BlockGridJsonWriter.write(result.id, blocks, new File(blockDirectory, baseName + ".json"));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write results for scope " + result.id, e);
        }
    }

    /** Write the run-level files once all scopes are done. */
    public void writeReport (RunReport report) throws IOException {
        ResultJsonWriter.writeReport(report, new File(outputDirectory, "report.json"));
        try (ThresholdCsvWriter writer = new ThresholdCsvWriter(new File(outputDirectory, "thresholds.csv"))) {
            for (ScopeOutcome outcome : report.outcomes) {
                if (outcome.isCompleted()) {
                    writer.write(ThresholdCsvWriter.Level.SCOPE, outcome.result);
                }
            }
            for (RegionResult region : report.regions.values()) {
                writer.write(ThresholdCsvWriter.Level.REGION, region);
            }
            if (report.continent != null) {
                writer.write(ThresholdCsvWriter.Level.CONTINENT, report.continent);
            }
        }
        LOG.info("Wrote run report to {}", outputDirectory);
    }

    /** Scope names can contain spaces, apostrophes and accented letters. Keep letters, digits, dots and dashes. */
    static String fileName (String scopeId) {
        return scopeId.replaceAll("[^\\p{L}\\p{N}._-]+", "_");
    }

    private static void mkdirs (File directory) {
        if (!directory.mkdirs() && !directory.isDirectory()) {
            throw new UncheckedIOException(new IOException("Could not create output directory " + directory));
        }
    }

}
