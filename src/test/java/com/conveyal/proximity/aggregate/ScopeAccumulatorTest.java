package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.classify.CellRecord;
import com.conveyal.proximity.classify.UrbanRural;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.conveyal.proximity.aggregate.AggregateTestData.record;
import static com.conveyal.proximity.aggregate.AggregateTestData.scenario;
import static com.conveyal.proximity.aggregate.AggregateTestData.scenarioResult;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScopeAccumulatorTest {

    private static final double DELTA = 1e-9;

    @Test
    void totalsAndBands () {
        ScopeResult result = scenarioResult("A");
        assertEquals(8, result.cells);
        assertEquals(600, result.population.totalPersons(), DELTA);
        assertEquals(400, result.population.urbanPersons(), DELTA);
        assertEquals(200, result.population.ruralPersons(), DELTA);

        assertEquals(8, result.bands.size());
        BandRow near = result.bands.get("0-1km");
        assertEquals(300, near.population.urbanPersons(), DELTA);
        assertEquals(0, near.population.ruralPersons(), DELTA);
        assertEquals(3, near.cells);
        assertEquals(0.5, near.shareOfTotal.total, DELTA);
        BandRow second = result.bands.get("1-2km");
        assertEquals(100, second.population.urbanPersons(), DELTA);
        assertEquals(50, second.population.ruralPersons(), DELTA);
        assertEquals(1, second.urbanCells);
        assertEquals(1, second.ruralCells);
        BandRow third = result.bands.get("2-5km");
        assertEquals(150, third.population.ruralPersons(), DELTA);
        assertEquals(3, third.cells);
        assertEquals(0, result.bands.get(">100km").cells);
        assertNull(result.bands.get(">100km").upperKm);
    }

    @Test
    void cumulativeThresholds () {
        ScopeResult result = scenarioResult("A");
        assertEquals(List.of("1", "2", "3", "4", "5"), new ArrayList<>(result.thresholds.keySet()));

        ThresholdRow one = result.threshold(1);
        assertEquals(300, one.reachable.urbanPersons(), DELTA);
        assertEquals(0, one.reachable.ruralPersons(), DELTA);
        assertEquals(0.75, one.coverage.urban, DELTA);
        assertEquals(0, one.coverage.rural, DELTA);
        assertEquals(0.5, one.shareOfTotal.total, DELTA);
        assertEquals(100, result.noAccess(1).urbanPersons(), DELTA);
        assertEquals(200, result.noAccess(1).ruralPersons(), DELTA);

        assertEquals(400, result.threshold(2).reachable.urbanPersons(), DELTA);
        assertEquals(50, result.threshold(2).reachable.ruralPersons(), DELTA);
        assertEquals(150, result.threshold(3).reachable.ruralPersons(), DELTA);
        assertEquals(200, result.threshold(4).reachable.ruralPersons(), DELTA);
        assertEquals(0, result.noAccess(5).totalPersons(), DELTA);
        assertTrue(Reconciliation.violations(result).isEmpty());
    }

    @Test
    void accessGap () {
        AccessGap gap = scenarioResult("A").accessGap;
        assertEquals(0.853553, gap.urbanMeanKm, 1e-6);
        assertEquals((2 + 3 + Math.sqrt(5) + Math.sqrt(10)) / 4, gap.ruralMeanKm, 1e-9);
        assertEquals(gap.ruralMeanKm - gap.urbanMeanKm, gap.meanGapKm, DELTA);
        assertEquals(2, gap.coverage.size());
        assertEquals(1, gap.coverage.get(0).thresholdKm);
        assertEquals(0.75, gap.coverage.get(0).gap, DELTA);
        assertEquals(5, gap.coverage.get(1).thresholdKm);
        assertEquals(0, gap.coverage.get(1).gap, DELTA);
    }

    /** Sums in fixed point do not depend on the order in which cells are added. */
    @Test
    void orderIndependence () {
        List<CellRecord> records = new ArrayList<>(scenario("A"));
        records.add(record("A", UrbanRural.RURAL, 0.1, 7));
        records.add(record("A", UrbanRural.RURAL, 0.2, 7));
        records.add(record("A", UrbanRural.RURAL, 0.3, 7));
        ScopeAccumulator accumulator = new ScopeAccumulator(AggregateTestData.config());
        ScopeResult forward = accumulator.accumulate("A", null, records);
        Collections.reverse(records);
        ScopeResult reverse = accumulator.accumulate("A", null, records);
        assertEquals(forward.population, reverse.population);
        assertEquals(forward.bands.get("5-10km").population, reverse.bands.get("5-10km").population);
        assertEquals(200.6, forward.population.ruralPersons(), DELTA);
    }

    @Test
    void emptyScope () {
        ScopeResult result = new ScopeAccumulator(AggregateTestData.config()).accumulate("empty", "R", List.of());
        assertEquals(0, result.cells);
        assertEquals(0, result.population.total());
        assertEquals("R", result.region);
        assertNull(result.accessGap.urbanMeanKm);
        assertNull(result.threshold(1).coverage.urban);
        assertNull(result.bands.get("0-1km").shareOfTotal.total);
        assertTrue(Reconciliation.violations(result).isEmpty());
    }

}
