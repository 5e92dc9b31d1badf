package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.classify.CellRecord;
import com.conveyal.proximity.classify.DistanceBands;
import com.conveyal.proximity.classify.UrbanRural;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reduces the cell records of one scope to a ScopeResult. Every record is counted once in exactly one band and in
 * the cumulative count of every threshold at or beyond its distance. Cumulative counts are built by bucketing each
 * record at the first threshold that reaches it and taking prefix sums, so they are non-decreasing by construction.
 */
public class ScopeAccumulator {

    public interface Config {
        DistanceBands distanceBands ();
        double[] cumulativeThresholds ();
        double[] gapThresholds ();
    }

    private final DistanceBands bands;

    private final double[] thresholds;

    private final double[] gapThresholds;

    public ScopeAccumulator (Config config) {
        this.bands = config.distanceBands();
        this.thresholds = config.cumulativeThresholds().clone();
        this.gapThresholds = config.gapThresholds().clone();
        DistanceBands.checkAscending(thresholds, "Cumulative thresholds");
    }

    public ScopeResult accumulate (String scopeId, String regionId, Collection<CellRecord> records) {
        int bandCount = bands.bandCount();
        long[] urbanByBand = new long[bandCount];
        long[] ruralByBand = new long[bandCount];
        int[] urbanCells = new int[bandCount];
        int[] ruralCells = new int[bandCount];
        // One extra bucket for records beyond the last threshold.
        long[] urbanFirstReached = new long[thresholds.length + 1];
        long[] ruralFirstReached = new long[thresholds.length + 1];
        double urbanPersonKm = 0;
        double ruralPersonKm = 0;

        for (CellRecord record : records) {
            long fixed = Population.toFixed(record.population);
            int band = bands.bandOf(record.distanceKm);
            int bucket = DistanceBands.indexOf(thresholds, record.distanceKm);
            if (record.urbanRural == UrbanRural.URBAN) {
                urbanByBand[band] += fixed;
                urbanCells[band]++;
                urbanFirstReached[bucket] += fixed;
                urbanPersonKm += record.population * record.distanceKm;
            } else {
                ruralByBand[band] += fixed;
                ruralCells[band]++;
                ruralFirstReached[bucket] += fixed;
                ruralPersonKm += record.population * record.distanceKm;
            }
        }

        long urbanTotal = 0;
        long ruralTotal = 0;
        for (int b = 0; b < bandCount; b++) {
            urbanTotal += urbanByBand[b];
            ruralTotal += ruralByBand[b];
        }
        PopulationSplit totals = PopulationSplit.known(urbanTotal, ruralTotal);

        List<BandRow> bandRows = new ArrayList<>(bandCount);
        for (int b = 0; b < bandCount; b++) {
            bandRows.add(new BandRow(bands.label(b), bands.lowerKm(b), bands.upperKm(b),
                    PopulationSplit.known(urbanByBand[b], ruralByBand[b]), urbanCells[b] + ruralCells[b],
                    urbanCells[b], ruralCells[b], totals));
        }

        List<ThresholdRow> thresholdRows = new ArrayList<>(thresholds.length);
        long urbanReachable = 0;
        long ruralReachable = 0;
        for (int t = 0; t < thresholds.length; t++) {
            urbanReachable += urbanFirstReached[t];
            ruralReachable += ruralFirstReached[t];
            thresholdRows.add(new ThresholdRow(thresholds[t], PopulationSplit.known(urbanReachable, ruralReachable), totals));
        }

        Double urbanMean = urbanTotal == 0 ? null : urbanPersonKm / Population.toPersons(urbanTotal);
        Double ruralMean = ruralTotal == 0 ? null : ruralPersonKm / Population.toPersons(ruralTotal);
        ScopeResult partial = new ScopeResult(scopeId, regionId, records.size(), totals, thresholdRows, bandRows, null);
        AccessGap gap = AccessGap.of(urbanMean, ruralMean, partial.thresholds, gapThresholds);
        return new ScopeResult(scopeId, regionId, records.size(), totals, thresholdRows, bandRows, gap);
    }

}
