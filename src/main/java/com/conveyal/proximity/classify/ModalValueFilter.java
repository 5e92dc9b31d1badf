package com.conveyal.proximity.classify;

import com.conveyal.proximity.grid.Grid;
import gnu.trove.iterator.TDoubleIntIterator;
import gnu.trove.map.TDoubleIntMap;
import gnu.trove.map.hash.TDoubleIntHashMap;

/**
 * Some population rasters fill whole areas with one repeated placeholder value (a uniform background density spread
 * over uninhabited land). When enabled, the most frequent populated value in a scope is treated as an artifact and
 * those cells are left out of classification.
 */
public class ModalValueFilter {

    /**
     * @return the most frequent value among populated cells, the smallest of them in case of a tie, or NaN if no cell
     *         is populated.
     */
    public static double modalValue (Grid grid, ClassificationPolicy policy) {
        TDoubleIntMap counts = new TDoubleIntHashMap();
        for (int row = 0; row < grid.height(); row++) {
            for (int col = 0; col < grid.width(); col++) {
                double value = grid.getValue(row, col);
                if (!grid.isNoData(value) && policy.isPopulated(value)) {
                    counts.adjustOrPutValue(value, 1, 1);
                }
            }
        }
        double mode = Double.NaN;
        int best = 0;
        for (TDoubleIntIterator it = counts.iterator(); it.hasNext(); ) {
            it.advance();
            if (it.value() > best || (it.value() == best && it.key() < mode)) {
                mode = it.key();
                best = it.value();
            }
        }
        return mode;
    }

}
