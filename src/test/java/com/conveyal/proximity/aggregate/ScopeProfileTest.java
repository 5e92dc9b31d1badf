package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.classify.CellRecord;
import com.conveyal.proximity.classify.FacilityDistribution;
import com.conveyal.proximity.classify.UrbanRural;
import org.apache.commons.math3.util.FastMath;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.conveyal.proximity.aggregate.AggregateTestData.record;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class ScopeProfileTest {

    @Test
    void densityStatsOfOneClass () {
        List<CellRecord> records = List.of(
            record("A", UrbanRural.URBAN, 10, 0),
            record("A", UrbanRural.URBAN, 20, 1),
            record("A", UrbanRural.URBAN, 30, 2),
            record("A", UrbanRural.RURAL, 1000, 3)
        );
        DensityStats urban = DensityStats.of(records, UrbanRural.URBAN);
        assertEquals(3, urban.cells);
        assertEquals(20, urban.mean, 1e-9);
        assertEquals(10, urban.min);
        assertEquals(30, urban.max);
        // Population standard deviation, dividing by the number of cells.
        assertEquals(FastMath.sqrt(200.0 / 3), urban.std, 1e-9);
    }

    @Test
    void emptyClassHasOnlyACount () {
        DensityStats rural = DensityStats.of(List.of(record("A", UrbanRural.URBAN, 10, 0)), UrbanRural.RURAL);
        assertEquals(0, rural.cells);
        assertNull(rural.mean);
        assertNull(rural.min);
        assertNull(rural.max);
        assertNull(rural.std);
    }

    @Test
    void profileOfReferenceScenario () {
        FacilityDistribution facilities = new FacilityDistribution(1, 0, 0, 0);
        ScopeProfile profile = new ScopeProfile(0.75, 16, AggregateTestData.scenario("A"), facilities);
        assertEquals(0.75, profile.overlapRatio);
        assertEquals(16, profile.validCells);
        assertEquals(4, profile.urban.cells);
        assertEquals(100, profile.urban.mean);
        assertEquals(0, profile.urban.std, 1e-12);
        assertEquals(4, profile.rural.cells);
        assertEquals(50, profile.rural.max);
        assertSame(facilities, profile.facilities);
    }

}
