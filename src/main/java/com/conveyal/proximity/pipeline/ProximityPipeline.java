package com.conveyal.proximity.pipeline;

import com.conveyal.proximity.aggregate.RegionRollup;
import com.conveyal.proximity.aggregate.ScopeAccumulator;
import com.conveyal.proximity.aggregate.ScopeResult;
import com.conveyal.proximity.boundary.RegionDefinitions;
import com.conveyal.proximity.boundary.Scope;
import com.conveyal.proximity.classify.CellClassifier;
import com.conveyal.proximity.error.CrsException;
import com.conveyal.proximity.features.FeatureIndex;
import com.conveyal.proximity.features.FeatureSet;
import com.conveyal.proximity.grid.Grid;
import com.conveyal.proximity.util.ExceptionUtils;
import com.conveyal.proximity.util.LambdaCounter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Runs the analysis of every scope of one population grid against one feature set, then rolls the scope results up
 * into regions and the continent.
 *
 * Scopes are analyzed concurrently on a fixed pool of worker threads, one ScopeAnalysis task per scope. A worker
 * owns everything it derives for its scope and hands back an immutable ScopeOutcome, so the workers share no
 * mutable state. Rollup is the only reduction over scopes and happens here on the calling thread once every
 * outcome is in. A scope that fails is recorded in its outcome and left out of the rollup without stopping its
 * siblings. A configuration error or reconciliation failure in any worker stops the whole run.
 */
public class ProximityPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ProximityPipeline.class);

    public interface Config extends CellClassifier.Config, ScopeAccumulator.Config {
        int threads ();
        /** Null for no class filter. */
        String featureClassAttribute ();
        List<String> featureClasses ();
        boolean clipFeaturesToBoundary ();
        boolean scaleLongitudeByLatitude ();
        /** Null unless block aggregated grids are wanted. */
        Integer blockAggregationFactor ();
    }

    private final Config config;

    public ProximityPipeline (Config config) {
        checkArgument(config.threads() > 0, "Number of worker threads must be positive.");
        this.config = config;
    }

    /**
     * @param population the whole population grid, shared read-only by all scopes.
     * @param features road or facility features in any CRS. They are filtered by class and reprojected into the
     *                 grid's CRS once, before any scope is analyzed. If that reprojection fails every scope is
     *                 recorded as failed at the load stage.
     * @param sink receives the products of each completed scope.
     */
    public RunReport run (Grid population, FeatureSet features, List<Scope> scopes, RegionDefinitions regions,
                          ScopeSink sink) {
        checkArgument(!scopes.isEmpty(), "No scopes to analyze.");
        FeatureSet selected;
        try {
            selected = features
                    .filterByClass(config.featureClassAttribute(), config.featureClasses())
                    .reproject(population.geometry.crs);
        } catch (CrsException e) {
            // Every scope measures against the same features, so none of them can proceed.
            LOG.error("Features could not be brought into {}: {}", population.geometry.crs,
                    ExceptionUtils.shortCauseString(e));
            List<ScopeOutcome> outcomes = new ArrayList<>(scopes.size());
            for (Scope scope : scopes) {
                outcomes.add(ScopeOutcome.stopped(scope.id, scope.region, ScopeOutcome.Status.FAILED, Stage.LOAD, e));
            }
            return report(outcomes, regions);
        }
        FeatureIndex featureIndex = new FeatureIndex(selected);
        LOG.info("Analyzing {} scopes of {} against {} features with {} threads.", scopes.size(), population.name,
                selected.size(), config.threads());

        return report(analyzeAll(population, featureIndex, scopes, sink), regions);
    }

    private RunReport report (List<ScopeOutcome> outcomes, RegionDefinitions regions) {
        List<ScopeResult> results = new ArrayList<>();
        Map<String, String> excluded = new LinkedHashMap<>();
        for (ScopeOutcome outcome : outcomes) {
            if (outcome.isCompleted()) {
                results.add(outcome.result);
            } else {
                excluded.put(outcome.scopeId, outcome.exclusionReason());
            }
        }
        RegionRollup.Rollup rollup = new RegionRollup(regions).rollup(results, excluded);
        RunReport report = new RunReport(config.classificationPolicy().name(), rollup.continent, rollup.regions,
                outcomes, rollup.audit);
        LOG.info("Completed {} of {} scopes.", results.size(), outcomes.size());
        return report;
    }

    private List<ScopeOutcome> analyzeAll (Grid population, FeatureIndex featureIndex, List<Scope> scopes,
                                           ScopeSink sink) {
        ExecutorService executor = Executors.newFixedThreadPool(config.threads(),
                new ThreadFactoryBuilder().setNameFormat("scope-worker-%d").build());
        try {
            List<Future<ScopeOutcome>> futures = new ArrayList<>(scopes.size());
            for (Scope scope : scopes) {
                futures.add(executor.submit(new ScopeAnalysis(scope, population, featureIndex, config, sink)));
            }
            LambdaCounter counter = new LambdaCounter(LOG, scopes.size(), 10, "Analyzed {} of {} scopes.");
            List<ScopeOutcome> outcomes = new ArrayList<>(scopes.size());
            for (Future<ScopeOutcome> future : futures) {
                outcomes.add(future.get());
                counter.increment();
            }
            counter.done();
            return outcomes;
        } catch (ExecutionException e) {
            // ScopeAnalysis only lets errors through that must end the run.
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RuntimeException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for scope analyses.", e);
        } finally {
            executor.shutdownNow();
        }
    }

}
