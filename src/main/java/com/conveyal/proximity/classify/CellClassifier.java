package com.conveyal.proximity.classify;

import com.conveyal.proximity.distance.DistanceField;
import com.conveyal.proximity.grid.Grid;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Turns a population grid and its distance field into one CellRecord per populated cell. No-data cells and cells
 * the policy does not consider populated produce no record. Rows are classified in parallel but records come out in
 * row-major order.
 */
public class CellClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(CellClassifier.class);

    public interface Config {
        ClassificationPolicy classificationPolicy ();
        DistanceBands distanceBands ();
        boolean dropModalValue ();
    }

    private final ClassificationPolicy policy;

    private final DistanceBands bands;

    private final boolean dropModalValue;

    public CellClassifier (Config config) {
        this.policy = config.classificationPolicy();
        this.bands = config.distanceBands();
        this.dropModalValue = config.dropModalValue();
    }

    public List<CellRecord> classify (Grid population, DistanceField distances, String scopeId, String regionId) {
        checkArgument(population.geometry.equals(distances.geometry),
                "Distance field is not congruent with population grid %s.", population.name);
        final double modal = dropModalValue ? ModalValueFilter.modalValue(population, policy) : Double.NaN;
        AtomicInteger negative = new AtomicInteger();
        AtomicInteger dropped = new AtomicInteger();
        List<CellRecord> records = IntStream.range(0, population.height()).parallel()
            .mapToObj(row -> {
                List<CellRecord> rowRecords = new ArrayList<>();
                for (int col = 0; col < population.width(); col++) {
                    double value = population.getValue(row, col);
                    if (population.isNoData(value)) continue;
                    if (!policy.isPopulated(value)) {
                        if (value < 0) negative.incrementAndGet();
                        continue;
                    }
                    if (value == modal) {
                        dropped.incrementAndGet();
                        continue;
                    }
                    double km = distances.getKm(row, col);
                    int band = bands.bandOf(km);
                    Coordinate center = population.geometry.coordOf(row, col);
                    rowRecords.add(new CellRecord(scopeId, regionId, row, col, center.x, center.y, value,
                            policy.magnitude(value), policy.classify(value), km, band, bands.label(band)));
                }
                return rowRecords;
            })
            .flatMap(List::stream)
            .collect(Collectors.toList());
        if (negative.get() > 0) {
            LOG.warn("{}: {} cells with negative values are not population under the {} policy and were ignored.",
                    scopeId, negative.get(), policy.name());
        }
        if (dropped.get() > 0) {
            LOG.info("{}: dropped {} cells holding the modal value {}.", scopeId, dropped.get(), modal);
        }
        LOG.debug("{}: classified {} populated cells.", scopeId, records.size());
        return records;
    }

}
