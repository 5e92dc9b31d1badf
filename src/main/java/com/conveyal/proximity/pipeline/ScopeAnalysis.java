package com.conveyal.proximity.pipeline;

import com.conveyal.proximity.aggregate.Reconciliation;
import com.conveyal.proximity.aggregate.ScopeAccumulator;
import com.conveyal.proximity.aggregate.ScopeProfile;
import com.conveyal.proximity.aggregate.ScopeResult;
import com.conveyal.proximity.boundary.BoundaryResolver;
import com.conveyal.proximity.boundary.Scope;
import com.conveyal.proximity.classify.CellClassifier;
import com.conveyal.proximity.classify.CellRecord;
import com.conveyal.proximity.classify.FacilityCounter;
import com.conveyal.proximity.distance.DistanceField;
import com.conveyal.proximity.distance.EuclideanDistanceTransform;
import com.conveyal.proximity.error.ConfigurationException;
import com.conveyal.proximity.error.NoOverlapException;
import com.conveyal.proximity.error.NoReferenceFeaturesException;
import com.conveyal.proximity.error.ReconciliationException;
import com.conveyal.proximity.error.ScopeException;
import com.conveyal.proximity.features.FeatureIndex;
import com.conveyal.proximity.features.FeatureSet;
import com.conveyal.proximity.grid.BlockAggregator;
import com.conveyal.proximity.grid.BlockGrid;
import com.conveyal.proximity.grid.Grid;
import com.conveyal.proximity.rasterize.FeatureRasterizer;
import com.conveyal.proximity.rasterize.OccupancyGrid;
import com.conveyal.proximity.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Analysis of a single scope, run on a worker thread. The stages run strictly in order and every intermediate
 * product (scope grid, occupancy, distances, cell records) belongs to this task alone. The inputs it shares with
 * other tasks (the population grid, the feature index and the components) are only read.
 *
 * Errors caused by the scope's own data end the task with a non-completed outcome. Configuration errors and
 * broken aggregate invariants propagate, and end the whole run.
 */
public class ScopeAnalysis implements Callable<ScopeOutcome> {

    private static final Logger LOG = LoggerFactory.getLogger(ScopeAnalysis.class);

    /** Boundary overlap ratio below which part of the scope is probably missing from the raster. */
    private static final double LOW_OVERLAP = 0.9;

    private final Scope scope;
    private final Grid population;
    private final FeatureIndex featureIndex;
    private final ProximityPipeline.Config config;
    private final FeatureRasterizer rasterizer;
    private final EuclideanDistanceTransform distanceTransform;
    private final CellClassifier classifier;
    private final FacilityCounter facilityCounter;
    private final ScopeAccumulator accumulator;
    private final BlockAggregator blockAggregator;
    private final ScopeSink sink;

    private Stage stage;

    ScopeAnalysis (Scope scope, Grid population, FeatureIndex featureIndex, ProximityPipeline.Config config,
                   ScopeSink sink) {
        this.scope = scope;
        this.population = population;
        this.featureIndex = featureIndex;
        this.config = config;
        this.sink = sink;
        this.rasterizer = new FeatureRasterizer();
        this.distanceTransform = new EuclideanDistanceTransform();
        this.classifier = new CellClassifier(config);
        this.facilityCounter = new FacilityCounter(config.classificationPolicy());
        this.accumulator = new ScopeAccumulator(config);
        this.blockAggregator = new BlockAggregator(config.classificationPolicy());
    }

    @Override
    public ScopeOutcome call () {
        try {
            return analyze();
        } catch (NoOverlapException e) {
            LOG.warn("Skipping scope {}: {}", scope.id, ExceptionUtils.shortCauseString(e));
            ScopeResult zero = accumulator.accumulate(scope.id, scope.region, Collections.emptyList());
            return ScopeOutcome.noOverlap(zero, e);
        } catch (NoReferenceFeaturesException e) {
            LOG.warn("Scope {} needs review: {}", scope.id, ExceptionUtils.shortCauseString(e));
            return ScopeOutcome.stopped(scope.id, scope.region, ScopeOutcome.Status.NEEDS_REVIEW, stage, e);
        } catch (ScopeException e) {
            LOG.error("Scope {} failed at stage {}: {}", scope.id, stage, ExceptionUtils.shortCauseString(e));
            return ScopeOutcome.stopped(scope.id, scope.region, ScopeOutcome.Status.FAILED, stage, e);
        } catch (ReconciliationException | ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.error("Unexpected error in scope {} at stage {}: {}", scope.id, stage, ExceptionUtils.stackTraceString(e));
            return ScopeOutcome.stopped(scope.id, scope.region, ScopeOutcome.Status.FAILED, stage, e);
        }
    }

    private ScopeOutcome analyze () {
        stage = Stage.LOAD;
        Grid scopeGrid = BoundaryResolver.scopeGrid(population, scope);
        FeatureSet features = featureIndex.query(scopeGrid.geometry.worldEnvelope());
        if (config.clipFeaturesToBoundary() && scope.boundary != null) {
            features = features.clip(scope.boundary);
        }
        LOG.debug("Scope {}: {} x {} cells, {} features.", scope.id, scopeGrid.width(), scopeGrid.height(),
                features.size());

        stage = Stage.RASTERIZE;
        OccupancyGrid occupancy = rasterizer.rasterize(features, scopeGrid.geometry);

        stage = Stage.DISTANCE;
        double cellSizeKmX = scopeGrid.geometry.cellSizeKmX(config.scaleLongitudeByLatitude());
        double cellSizeKmY = scopeGrid.geometry.cellSizeKmY();
        DistanceField distances = distanceTransform.computeDistances(occupancy, cellSizeKmX, cellSizeKmY);

        stage = Stage.CLASSIFY;
        List<CellRecord> cells = classifier.classify(scopeGrid, distances, scope.id, scope.region);

        stage = Stage.AGGREGATE;
        ScopeResult result = accumulator.accumulate(scope.id, scope.region, cells);
        Reconciliation.check(result);
        ScopeProfile profile = new ScopeProfile(BoundaryResolver.overlapRatio(population.geometry, scope),
                scopeGrid.validCellCount(), cells, facilityCounter.count(features, scopeGrid, scope.boundary));
        result = result.withProfile(profile);
        if (profile.overlapRatio != null && profile.overlapRatio < LOW_OVERLAP) {
            LOG.warn("Only {}% of the boundary of scope {} lies within the raster.",
                    Math.round(profile.overlapRatio * 100), scope.id);
        }
        BlockGrid blocks = null;
        Integer factor = config.blockAggregationFactor();
        if (factor != null) {
            if (scopeGrid.width() >= factor && scopeGrid.height() >= factor) {
                blocks = blockAggregator.aggregate(scopeGrid, factor);
            } else {
                LOG.warn("Scope {} is smaller than one block of {} cells, no block grid produced.", scope.id, factor);
            }
        }

        stage = Stage.EMIT;
        sink.emit(result, cells, blocks);
        LOG.info("Finished scope {}: population {}.", scope.id, result.population);
        return ScopeOutcome.completed(result);
    }

}
