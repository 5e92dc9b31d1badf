package com.conveyal.proximity.grid;

import com.conveyal.proximity.classify.ClassificationPolicy;
import com.conveyal.proximity.classify.UrbanRural;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Aggregates a population grid into blocks of factor x factor cells, for instance 100 m cells into 10 km blocks,
 * classifying every fine cell with the run's classification policy. Rows and columns at the right and bottom edges
 * that do not make up a whole block are dropped.
 */
public class BlockAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(BlockAggregator.class);

    private final ClassificationPolicy policy;

    public BlockAggregator (ClassificationPolicy policy) {
        this.policy = policy;
    }

    public BlockGrid aggregate (Grid grid, int factor) {
        checkArgument(factor > 1, "Aggregation factor must be greater than one.");
        GridGeometry coarse = grid.geometry.coarsen(factor);
        int n = coarse.cellCount();
        double[] urbanPopulation = new double[n];
        double[] ruralPopulation = new double[n];
        int[] urbanCells = new int[n];
        int[] ruralCells = new int[n];
        boolean[] hasData = new boolean[n];
        for (int row = 0; row < coarse.height * factor; row++) {
            for (int col = 0; col < coarse.width * factor; col++) {
                double value = grid.getValue(row, col);
                if (grid.isNoData(value)) continue;
                int block = coarse.index(row / factor, col / factor);
                hasData[block] = true;
                if (!policy.isPopulated(value)) continue;
                if (policy.classify(value) == UrbanRural.URBAN) {
                    urbanPopulation[block] += policy.magnitude(value);
                    urbanCells[block]++;
                } else {
                    ruralPopulation[block] += policy.magnitude(value);
                    ruralCells[block]++;
                }
            }
        }
        LOG.debug("Aggregated {} into {} blocks of {}x{} cells.", grid.name, n, factor, factor);
        return new BlockGrid(coarse, factor, urbanPopulation, ruralPopulation, urbanCells, ruralCells, hasData);
    }

}
