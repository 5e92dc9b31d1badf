package com.conveyal.proximity.boundary;

import com.conveyal.proximity.TestData;
import com.conveyal.proximity.error.NoOverlapException;
import com.conveyal.proximity.features.Feature;
import com.conveyal.proximity.features.FeatureSet;
import com.conveyal.proximity.grid.Grid;
import com.conveyal.proximity.grid.GridGeometry;
import com.conveyal.proximity.util.GeometryUtils;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundaryResolverTest {

    private static final RegionDefinitions REGIONS = new RegionDefinitions(Map.of("R", List.of("A")));

    private static Feature boundary (String name, Geometry geometry) {
        Map<String, Object> attributes = new HashMap<>();
        if (name != null) {
            attributes.put("name", name);
        }
        return new Feature(geometry, attributes);
    }

    private static BoundaryResolver resolver () {
        return new BoundaryResolver(() -> "name", REGIONS);
    }

    @Test
    void featuresAreGroupedByName () {
        FeatureSet boundaries = TestData.features(
            boundary("A", TestData.cellBox(0, 0, 0, 0)),
            boundary("B", TestData.cellBox(2, 0, 3, 3)),
            boundary("A", TestData.cellBox(0, 3, 0, 3)),
            boundary(null, TestData.cellBox(1, 1, 1, 1)),
            boundary("P", GeometryUtils.geometryFactory.createPoint(new Coordinate(TestData.WEST, TestData.NORTH)))
        );
        List<Scope> scopes = resolver().resolve(boundaries, TestData.geometry(4, 4));
        assertEquals(2, scopes.size());
        Scope a = scopes.get(0);
        assertEquals("A", a.id);
        assertEquals("R", a.region);
        assertEquals(2, a.boundary.getNumGeometries());
        assertEquals(2 * 980 * 980, a.boundary.getArea(), 1e-6);
        Scope b = scopes.get(1);
        assertEquals("B", b.id);
        assertNull(b.region);
        assertEquals("B", b.toString());
        assertEquals("A (R)", a.toString());
    }

    @Test
    void scopeGridIsCroppedAndMasked () {
        Grid grid = TestData.signedPopulation();
        FeatureSet boundaries = TestData.features(
            boundary("A", TestData.cellBox(0, 0, 0, 0)),
            boundary("A", TestData.cellBox(0, 3, 0, 3))
        );
        Scope a = resolver().resolve(boundaries, grid.geometry).get(0);
        Grid masked = BoundaryResolver.scopeGrid(grid, a);
        assertEquals("A", masked.name);
        assertEquals(4, masked.width());
        assertEquals(1, masked.height());
        assertEquals(2, masked.validCellCount());
        assertEquals(100, masked.getValue(0, 0));
        assertTrue(masked.isNoData(0, 1));
        assertEquals(-50, masked.getValue(0, 3));
    }

    @Test
    void wholeGridScope () {
        Grid grid = TestData.signedPopulation();
        Scope all = resolver().wholeGrid("A");
        assertNull(all.boundary);
        assertEquals("R", all.region);
        assertSame(grid, BoundaryResolver.scopeGrid(grid, all));
    }

    @Test
    void boundaryOutsideGrid () {
        Geometry far = GeometryUtils.toGeometry(new Envelope(0, 1000, 0, 1000));
        Scope scope = new Scope("far", far, null);
        assertThrows(NoOverlapException.class, () -> BoundaryResolver.scopeGrid(TestData.signedPopulation(), scope));
    }

    @Test
    void overlapRatioIsTheShareOfTheBoundaryInsideTheRaster () {
        GridGeometry grid = TestData.signedPopulation().geometry;
        assertNull(BoundaryResolver.overlapRatio(grid, resolver().wholeGrid("A")));
        assertEquals(1.0, BoundaryResolver.overlapRatio(grid, new Scope("in", TestData.cellBox(0, 0, 1, 1), null)), 1e-12);
        // Two of the four kilometers of width lie west of the raster.
        Geometry straddling = GeometryUtils.toGeometry(new Envelope(498_000, 502_000, 997_000, 1_000_000));
        assertEquals(0.5, BoundaryResolver.overlapRatio(grid, new Scope("half", straddling, null)), 1e-12);
        Geometry far = GeometryUtils.toGeometry(new Envelope(0, 1000, 0, 1000));
        assertEquals(0.0, BoundaryResolver.overlapRatio(grid, new Scope("far", far, null)));
    }

}
