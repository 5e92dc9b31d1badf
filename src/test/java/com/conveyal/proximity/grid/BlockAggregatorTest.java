package com.conveyal.proximity.grid;

import com.conveyal.proximity.TestData;
import com.conveyal.proximity.classify.SignPolicy;
import com.conveyal.proximity.classify.ThresholdPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BlockAggregatorTest {

    @Test
    void signedGridInTwoByTwoBlocks () {
        BlockGrid blocks = new BlockAggregator(new SignPolicy()).aggregate(TestData.signedPopulation(), 2);
        assertEquals(2, blocks.geometry.width);
        assertEquals(2, blocks.geometry.height);
        assertEquals(400, blocks.urbanPopulation(0, 0));
        assertEquals(4, blocks.urbanCells(0, 0));
        assertEquals(0, blocks.ruralCells(0, 0));
        assertEquals(200, blocks.ruralPopulation(0, 1));
        assertEquals(4, blocks.ruralCells(0, 1));
        // Zero population is data, so the lower blocks hold data but no people.
        assertTrue(blocks.hasData(1, 0));
        assertEquals(0, blocks.urbanPopulation(1, 0) + blocks.ruralPopulation(1, 0));
        assertEquals(TestData.geometry(4, 4).coordOf(0, 0).x + 500, blocks.center(0, 0).x, 1e-9);
    }

    @Test
    void trailingCellsAreDroppedAndEmptyBlocksHaveNoData () {
        double n = TestData.NO_DATA;
        Grid grid = TestData.grid(new double[][] {
            {400, 100, 5, 1000, 9},
            {299, 300, 5, 1000, 9},
            {n, n, 10, 10, 9},
            {n, n, 10, 10, 9},
            {1, 1, 1, 1, 1}
        });
        BlockGrid blocks = new BlockAggregator(new ThresholdPolicy(300)).aggregate(grid, 2);
        assertEquals(2, blocks.geometry.width);
        assertEquals(2, blocks.geometry.height);
        assertEquals(700, blocks.urbanPopulation(0, 0));
        assertEquals(2, blocks.urbanCells(0, 0));
        assertEquals(399, blocks.ruralPopulation(0, 0));
        assertEquals(2000, blocks.urbanPopulation(0, 1));
        assertEquals(10, blocks.ruralPopulation(0, 1));
        assertFalse(blocks.hasData(1, 0));
        assertEquals(40, blocks.ruralPopulation(1, 1));
        assertThrows(IllegalArgumentException.class, () -> new BlockAggregator(new SignPolicy()).aggregate(grid, 1));
    }

}
