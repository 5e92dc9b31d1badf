package com.conveyal.proximity;

import com.conveyal.proximity.aggregate.RegionRollup;
import com.conveyal.proximity.aggregate.ScopeResult;
import com.conveyal.proximity.boundary.BoundaryResolver;
import com.conveyal.proximity.boundary.RegionDefinitions;
import com.conveyal.proximity.boundary.Scope;
import com.conveyal.proximity.features.FeatureSet;
import com.conveyal.proximity.features.GeoJsonFeatureReader;
import com.conveyal.proximity.grid.Grid;
import com.conveyal.proximity.grid.GridReader;
import com.conveyal.proximity.pipeline.ProximityPipeline;
import com.conveyal.proximity.pipeline.RunReport;
import com.conveyal.proximity.pipeline.ScopeOutcome;
import com.conveyal.proximity.results.ResultWriter;
import com.conveyal.proximity.results.ScopeResultReader;
import com.conveyal.proximity.util.ExceptionUtils;
import com.conveyal.proximity.util.JsonUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Entry point for running an analysis from the command line.
 * <pre>
 * ProximityMain config.properties
 * ProximityMain --rollup scope-result-directory output.json [regions.json]
 * </pre>
 * The second form regroups scope results written by an earlier run into regions, without recomputing them.
 */
public abstract class ProximityMain {

    private static final Logger LOG = LoggerFactory.getLogger(ProximityMain.class);

    public static void main (String... args) {
        // The worker pool is shut down by the pipeline, but make sure a failure anywhere ends the JVM with an error.
        try {
            if (args.length >= 3 && "--rollup".equals(args[0])) {
                rollup(new File(args[1]), new File(args[2]), args.length > 3 ? new File(args[3]) : null);
            } else if (args.length == 1) {
                analyze(AnalysisConfig.fromFile(args[0]));
            } else {
                LOG.error("Usage: ProximityMain config.properties | ProximityMain --rollup scope-dir output.json [regions.json]");
                System.exit(2);
            }
        } catch (Throwable throwable) {
            LOG.error("Analysis failed, shutting down JVM.\n{}", ExceptionUtils.stackTraceString(throwable));
            System.exit(1);
        }
    }

    static RunReport analyze (AnalysisConfig config) throws IOException {
        LOG.info("Loading population raster {}", config.populationRaster());
        Grid population = GridReader.load(config.populationRaster(), config);
        LOG.info("Loading features {}", config.features());
        FeatureSet features = new GeoJsonFeatureReader().read(config.features());
        RegionDefinitions regions = config.regions() == null
                ? RegionDefinitions.bundled()
                : RegionDefinitions.fromFile(config.regions());

        BoundaryResolver boundaryResolver = new BoundaryResolver(config, regions);
        List<Scope> scopes;
        if (config.boundaries() == null) {
            scopes = Collections.singletonList(boundaryResolver.wholeGrid(config.scopeName()));
        } else {
            FeatureSet boundaries = new GeoJsonFeatureReader().read(config.boundaries());
            scopes = boundaryResolver.resolve(boundaries, population.geometry);
        }

        ResultWriter resultWriter = new ResultWriter(config);
        RunReport report = new ProximityPipeline(config).run(population, features, scopes, regions, resultWriter);
        resultWriter.writeReport(report);
        LOG.info("{} scopes completed, {} without overlap, {} need review, {} failed.",
                report.count(ScopeOutcome.Status.COMPLETED), report.count(ScopeOutcome.Status.SKIPPED_NO_OVERLAP),
                report.count(ScopeOutcome.Status.NEEDS_REVIEW), report.count(ScopeOutcome.Status.FAILED));
        if (!report.audit.isClean()) {
            LOG.warn("The rollup audit lists scopes or region members that did not contribute, see report.json.");
        }
        return report;
    }

    static RegionRollup.Rollup rollup (File scopeDirectory, File output, File regionsFile) throws IOException {
        List<ScopeResult> results = ScopeResultReader.readDirectory(scopeDirectory);
        RegionDefinitions regions = regionsFile == null
                ? RegionDefinitions.bundled()
                : RegionDefinitions.fromFile(regionsFile);
        RegionRollup.Rollup rollup = new RegionRollup(regions).rollup(results, Collections.emptyMap());
        JsonUtilities.objectMapper.writeValue(output, rollup);
        LOG.info("Rolled up {} scope results into {} regions, written to {}.", results.size(), rollup.regions.size(),
                output);
        return rollup;
    }

}
