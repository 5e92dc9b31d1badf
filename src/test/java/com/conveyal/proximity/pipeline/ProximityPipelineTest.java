package com.conveyal.proximity.pipeline;

import com.conveyal.proximity.AnalysisConfig;
import com.conveyal.proximity.TestData;
import com.conveyal.proximity.aggregate.RegionResult;
import com.conveyal.proximity.aggregate.ScopeProfile;
import com.conveyal.proximity.aggregate.ScopeResult;
import com.conveyal.proximity.boundary.RegionDefinitions;
import com.conveyal.proximity.boundary.Scope;
import com.conveyal.proximity.classify.CellRecord;
import com.conveyal.proximity.error.ReconciliationException;
import com.conveyal.proximity.features.FeatureSet;
import com.conveyal.proximity.grid.BlockGrid;
import com.conveyal.proximity.grid.Grid;
import com.conveyal.proximity.util.GeometryUtils;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProximityPipelineTest {

    private static final double DELTA = 1e-6;

    private final Grid population = TestData.signedPopulation();

    private final FeatureSet roads = TestData.features(TestData.roadAt(0, 0));

    /** The whole signed grid as one scope, with a single road in its upper left cell. */
    @Test
    void wholeGridScenario () {
        ProximityPipeline pipeline = new ProximityPipeline(TestData.config("sign"));
        RunReport report = pipeline.run(population, roads, List.of(new Scope("all", null, null)),
                RegionDefinitions.empty(), ScopeSink.NONE);

        assertEquals("sign", report.policy);
        assertEquals(1, report.count(ScopeOutcome.Status.COMPLETED));
        ScopeResult all = report.outcomes.get(0).result;
        assertEquals(8, all.cells);
        assertEquals(400, all.population.urbanPersons(), DELTA);
        assertEquals(200, all.population.ruralPersons(), DELTA);
        assertEquals(300, all.bands.get("0-1km").population.urbanPersons(), DELTA);
        assertEquals(0, all.bands.get("0-1km").population.ruralPersons(), DELTA);
        assertEquals(100, all.bands.get("1-2km").population.urbanPersons(), DELTA);
        assertEquals(50, all.bands.get("1-2km").population.ruralPersons(), DELTA);
        assertEquals(150, all.bands.get("2-5km").population.ruralPersons(), DELTA);
        assertEquals(0.75, all.threshold(1).coverage.urban, DELTA);
        assertEquals(0, all.threshold(1).coverage.rural, DELTA);
        assertEquals(100, all.noAccess(1).urbanPersons(), DELTA);
        assertEquals(200, all.noAccess(1).ruralPersons(), DELTA);
        assertEquals(50, all.threshold(2).reachable.ruralPersons(), DELTA);
        assertEquals(150, all.threshold(3).reachable.ruralPersons(), DELTA);
        assertEquals(200, all.threshold(4).reachable.ruralPersons(), DELTA);
        assertEquals(0.853553, all.accessGap.urbanMeanKm, DELTA);
        assertEquals((2 + 3 + Math.sqrt(5) + Math.sqrt(10)) / 4, all.accessGap.ruralMeanKm, DELTA);

        ScopeProfile profile = all.profile;
        assertNull(profile.overlapRatio);
        assertEquals(16, profile.validCells);
        assertEquals(4, profile.urban.cells);
        assertEquals(100, profile.urban.mean, DELTA);
        assertEquals(0, profile.urban.std, DELTA);
        assertEquals(50, profile.rural.min, DELTA);
        assertEquals(1, profile.facilities.urban);
        assertEquals(1, profile.facilities.total);

        RegionResult continent = report.continent;
        assertEquals(all.population, continent.population);
        assertTrue(report.regions.isEmpty());
        assertEquals(List.of("all"), report.audit.unmappedScopes);
    }

    /** One scope completes, one has no roads, one lies outside the grid. The others are unaffected. */
    @Test
    void partialFailure () {
        Scope a = new Scope("A", TestData.cellBox(0, 0, 3, 1), "R");
        Scope b = new Scope("B", TestData.cellBox(0, 2, 1, 3), "R");
        Scope c = new Scope("C", GeometryUtils.toGeometry(new Envelope(0, 1000, 0, 1000)), null);
        RegionDefinitions regions = new RegionDefinitions(Map.of("R", List.of("A", "B", "D")));
        RunReport report = new ProximityPipeline(TestData.config("sign"))
                .run(population, roads, List.of(a, b, c), regions, ScopeSink.NONE);

        ScopeOutcome outcomeA = report.outcomes.get(0);
        assertEquals(ScopeOutcome.Status.COMPLETED, outcomeA.status);
        assertNull(outcomeA.stage);
        assertEquals(400, outcomeA.result.population.urbanPersons(), DELTA);
        assertEquals(0, outcomeA.result.population.ruralPersons(), DELTA);

        ScopeOutcome outcomeB = report.outcomes.get(1);
        assertEquals(ScopeOutcome.Status.NEEDS_REVIEW, outcomeB.status);
        assertEquals(Stage.DISTANCE, outcomeB.stage);
        assertEquals("NoReferenceFeaturesException", outcomeB.errorType);
        assertNull(outcomeB.result);

        ScopeOutcome outcomeC = report.outcomes.get(2);
        assertEquals(ScopeOutcome.Status.SKIPPED_NO_OVERLAP, outcomeC.status);
        assertEquals(Stage.LOAD, outcomeC.stage);
        assertEquals(0, outcomeC.result.population.total());

        RegionResult r = report.regions.get("R");
        assertEquals(List.of("A"), r.members);
        assertEquals(400, r.population.totalPersons(), DELTA);
        assertEquals(Map.of("R", List.of("D")), report.audit.missingMembers);
        assertEquals(2, report.audit.excludedScopes.size());
        assertTrue(report.audit.excludedScopes.get("B").startsWith("NEEDS_REVIEW at DISTANCE"));
        assertTrue(report.audit.excludedScopes.get("C").startsWith("SKIPPED_NO_OVERLAP at LOAD"));
        assertTrue(report.audit.unmappedScopes.isEmpty());
    }

    @Test
    void failureWhileEmittingIsContained () {
        ScopeSink sink = (result, cells, blocks) -> {
            if (result.id.equals("A")) {
                throw new IllegalStateException("disk full");
            }
        };
        Scope a = new Scope("A", TestData.cellBox(0, 0, 1, 1), null);
        Scope b = new Scope("B", TestData.cellBox(0, 0, 1, 3), null);
        RunReport report = new ProximityPipeline(TestData.config("sign"))
                .run(population, roads, List.of(a, b), RegionDefinitions.empty(), sink);
        ScopeOutcome failed = report.outcomes.get(0);
        assertEquals(ScopeOutcome.Status.FAILED, failed.status);
        assertEquals(Stage.EMIT, failed.stage);
        assertEquals("IllegalStateException", failed.errorType);
        assertEquals(ScopeOutcome.Status.COMPLETED, report.outcomes.get(1).status);
        assertEquals(List.of("B"), report.continent.members);
    }

    @Test
    void reconciliationFailureEndsRun () {
        ScopeSink sink = (result, cells, blocks) -> {
            throw new ReconciliationException(result.id, List.of("broken"));
        };
        ProximityPipeline pipeline = new ProximityPipeline(TestData.config("sign"));
        List<Scope> scopes = List.of(new Scope("all", null, null));
        assertThrows(ReconciliationException.class,
                () -> pipeline.run(population, roads, scopes, RegionDefinitions.empty(), sink));
    }

    @Test
    void sinkReceivesCellsAndBlocks () {
        Properties properties = TestData.properties("sign");
        properties.setProperty("block-aggregation-factor", "2");
        AnalysisConfig config = AnalysisConfig.fromProperties(properties);
        Map<String, List<CellRecord>> cellsByScope = new ConcurrentHashMap<>();
        Map<String, BlockGrid> blocksByScope = new ConcurrentHashMap<>();
        ScopeSink sink = (result, cells, blocks) -> {
            cellsByScope.put(result.id, cells);
            if (blocks != null) {
                blocksByScope.put(result.id, blocks);
            }
        };
        Scope whole = new Scope("all", null, null);
        Scope narrow = new Scope("narrow", TestData.cellBox(0, 0, 3, 0), null);
        new ProximityPipeline(config).run(population, roads, List.of(whole, narrow), RegionDefinitions.empty(), sink);

        assertEquals(8, cellsByScope.get("all").size());
        assertEquals(2, cellsByScope.get("narrow").size());
        BlockGrid blocks = blocksByScope.get("all");
        assertNotNull(blocks);
        assertEquals(2, blocks.geometry.width);
        assertEquals(2, blocks.geometry.height);
        // A one cell wide scope is narrower than a block.
        assertNull(blocksByScope.get("narrow"));
    }

    @Test
    void featuresAreFilteredByClass () {
        Properties properties = TestData.properties("sign");
        properties.setProperty("feature-class-attribute", "highway");
        properties.setProperty("feature-classes", "motorway,trunk");
        ProximityPipeline pipeline = new ProximityPipeline(AnalysisConfig.fromProperties(properties));
        RunReport report = pipeline.run(population, roads, List.of(new Scope("all", null, null)),
                RegionDefinitions.empty(), ScopeSink.NONE);
        assertEquals(ScopeOutcome.Status.NEEDS_REVIEW, report.outcomes.get(0).status);
        assertNull(report.continent);
    }

    /** Features in a CRS that cannot be resolved fail every scope at the load stage instead of ending the run. */
    /** A scope reaching west of the raster, with one road in an urban cell and one in an empty cell. */
    @Test
    void profileOfScopeCutOffByTheRaster () {
        Scope west = new Scope("W", GeometryUtils.toGeometry(new Envelope(498_000, 502_000, 997_000, 1_000_000)), null);
        FeatureSet features = TestData.features(TestData.roadAt(0, 0), TestData.roadAt(2, 1), TestData.roadAt(0, 3));
        RunReport report = new ProximityPipeline(TestData.config("sign"))
                .run(population, features, List.of(west), RegionDefinitions.empty(), ScopeSink.NONE);

        ScopeOutcome outcome = report.outcomes.get(0);
        assertEquals(ScopeOutcome.Status.COMPLETED, outcome.status);
        ScopeProfile profile = outcome.result.profile;
        assertEquals(0.5, profile.overlapRatio, DELTA);
        assertEquals(6, profile.validCells);
        assertEquals(4, profile.urban.cells);
        assertEquals(0, profile.rural.cells);
        assertEquals(2, profile.facilities.total);
        assertEquals(1, profile.facilities.urban);
        assertEquals(1, profile.facilities.unpopulated);
        assertNull(profile.facilities.urbanRuralRatio);
    }

    @Test
    void unusableFeatureCrsFailsEveryScope () {
        FeatureSet unknownCrs = new FeatureSet("EPSG:999999", List.of(TestData.roadAt(0, 0)));
        Scope a = new Scope("A", TestData.cellBox(0, 0, 1, 1), "R");
        Scope b = new Scope("B", TestData.cellBox(0, 2, 1, 3), "R");
        RegionDefinitions regions = new RegionDefinitions(Map.of("R", List.of("A", "B")));
        RunReport report = new ProximityPipeline(TestData.config("sign"))
                .run(population, unknownCrs, List.of(a, b), regions, ScopeSink.NONE);

        assertEquals(2, report.count(ScopeOutcome.Status.FAILED));
        for (ScopeOutcome outcome : report.outcomes) {
            assertEquals(Stage.LOAD, outcome.stage);
            assertEquals("CrsException", outcome.errorType);
            assertNull(outcome.result);
        }
        assertNull(report.continent);
        assertTrue(report.regions.isEmpty());
        assertTrue(report.audit.excludedScopes.get("A").startsWith("FAILED at LOAD"));
        assertTrue(report.audit.excludedScopes.get("B").startsWith("FAILED at LOAD"));
    }

}
