package com.conveyal.proximity.classify;

import com.conveyal.proximity.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DistanceBandsTest {

    private final DistanceBands bands = new DistanceBands(DistanceBands.DEFAULT_BREAKPOINTS);

    @Test
    void defaultLabels () {
        assertEquals(8, bands.bandCount());
        assertEquals("0-1km", bands.label(0));
        assertEquals("1-2km", bands.label(1));
        assertEquals("50-100km", bands.label(6));
        assertEquals(">100km", bands.label(7));
        assertEquals(0, bands.lowerKm(0));
        assertEquals(100, bands.lowerKm(7));
        assertEquals(Double.POSITIVE_INFINITY, bands.upperKm(7));
        assertEquals("2.5-10km", new DistanceBands(2.5, 10).label(1));
    }

    /** The first band includes both of its ends, every later band only its upper end. */
    @ParameterizedTest
    @CsvSource({
        "0, 0-1km",
        "0.5, 0-1km",
        "1, 0-1km",
        "1.0000001, 1-2km",
        "1.4142, 1-2km",
        "2, 1-2km",
        "4.99, 2-5km",
        "100, 50-100km",
        "100.5, >100km",
        "12345, >100km"
    })
    void bandOfDistance (double km, String label) {
        assertEquals(label, bands.label(bands.bandOf(km)));
    }

    @Test
    void breakpointsMustAscend () {
        assertThrows(ConfigurationException.class, () -> new DistanceBands(1, 5, 2));
        assertThrows(ConfigurationException.class, () -> new DistanceBands(1, 1));
        assertThrows(ConfigurationException.class, () -> new DistanceBands(0, 1));
        assertThrows(ConfigurationException.class, () -> new DistanceBands());
        assertThrows(ConfigurationException.class, () -> new DistanceBands(1, Double.POSITIVE_INFINITY));
    }

    @Test
    void kilometerFormatting () {
        assertEquals("1", DistanceBands.formatKm(1.0));
        assertEquals("2.5", DistanceBands.formatKm(2.5));
        assertEquals("100", DistanceBands.formatKm(100));
        assertEquals(0, DistanceBands.indexOf(new double[] {1, 2}, 0));
        assertEquals(1, DistanceBands.indexOf(new double[] {1, 2}, 2));
        assertEquals(2, DistanceBands.indexOf(new double[] {1, 2}, 2.1));
    }

}
