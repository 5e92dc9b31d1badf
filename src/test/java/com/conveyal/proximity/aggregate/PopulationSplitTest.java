package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.classify.UrbanRural;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PopulationSplitTest {

    @Test
    void knownArithmetic () {
        PopulationSplit a = PopulationSplit.known(Population.toFixed(10.5), Population.toFixed(2));
        PopulationSplit b = PopulationSplit.known(Population.toFixed(0.5), Population.toFixed(1));
        PopulationSplit sum = a.plus(b);
        assertTrue(sum.splitKnown());
        assertEquals(14, sum.totalPersons());
        assertEquals(11, sum.urbanPersons());
        assertEquals(Population.toFixed(3), sum.get(UrbanRural.RURAL));
        assertEquals(a, sum.minus(b));
    }

    @Test
    void unknownSplitIsContagious () {
        PopulationSplit known = PopulationSplit.known(Population.toFixed(10), Population.toFixed(5));
        PopulationSplit totalOnly = PopulationSplit.totalOnly(Population.toFixed(20));
        PopulationSplit difference = totalOnly.minus(known);
        assertFalse(difference.splitKnown());
        assertEquals(5, difference.totalPersons());
        assertNull(difference.urbanPersons());
        assertNull(difference.ruralPersons());
        assertThrows(IllegalStateException.class, difference::urban);
        assertFalse(known.plus(totalOnly).splitKnown());
    }

    @Test
    void sharesOfUnknownSplit () {
        PopulationSplit whole = PopulationSplit.totalOnly(Population.toFixed(200));
        PopulationSplit part = PopulationSplit.totalOnly(Population.toFixed(50));
        Shares coverage = Shares.ofClass(part, whole);
        assertEquals(0.25, coverage.total);
        assertNull(coverage.urban);
        assertNull(coverage.rural);
        Shares none = Shares.ofTotal(part, PopulationSplit.ZERO);
        assertNull(none.total);
    }

    @Test
    void fixedPointRounding () {
        assertEquals(1_000_000, Population.toFixed(1));
        assertEquals(1, Population.toFixed(0.0000006));
        assertEquals(0.000001, Population.toPersons(1));
    }

}
