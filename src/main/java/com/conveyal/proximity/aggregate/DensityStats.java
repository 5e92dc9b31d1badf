package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.classify.CellRecord;
import com.conveyal.proximity.classify.UrbanRural;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.util.FastMath;

import java.util.Collection;

/**
 * Distribution of the population per cell over the populated cells of one class. The standard deviation is that of
 * the cells themselves (the population, not a sample, standard deviation). All but the cell count are null when the
 * class has no cells.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"cells", "mean", "min", "max", "std"})
public class DensityStats {

    public final long cells;

    public final Double mean;

    public final Double min;

    public final Double max;

    public final Double std;

    private DensityStats (SummaryStatistics statistics) {
        this.cells = statistics.getN();
        boolean empty = cells == 0;
        this.mean = empty ? null : statistics.getMean();
        this.min = empty ? null : statistics.getMin();
        this.max = empty ? null : statistics.getMax();
        this.std = empty ? null : FastMath.sqrt(statistics.getPopulationVariance());
    }

    public static DensityStats of (Collection<CellRecord> records, UrbanRural urbanRural) {
        SummaryStatistics statistics = new SummaryStatistics();
        for (CellRecord record : records) {
            if (record.urbanRural == urbanRural) {
                statistics.addValue(record.population);
            }
        }
        return new DensityStats(statistics);
    }

}
