package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.boundary.RegionDefinitions;
import com.conveyal.proximity.classify.DistanceBands;
import com.conveyal.proximity.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sums per-scope results into region and continent results. This is the single reducer of a run: it is called once
 * on the thread that started the run, after every scope has finished, and only reads the immutable scope results.
 *
 * A scope's region is looked up in the region definitions rather than taken from the scope result, so that results
 * read back from an earlier run can be regrouped under new definitions.
 */
public class RegionRollup {

    private static final Logger LOG = LoggerFactory.getLogger(RegionRollup.class);

    public static final String CONTINENT_ID = "continent";

    private final RegionDefinitions definitions;

    public RegionRollup (RegionDefinitions definitions) {
        this.definitions = definitions;
    }

    /** Region and continent results along with the audit of what did not contribute to them. */
    public static class Rollup {
        /** Null when no scope produced a result. */
        public final RegionResult continent;
        public final Map<String, RegionResult> regions;
        public final AuditReport audit;

        Rollup (RegionResult continent, Map<String, RegionResult> regions, AuditReport audit) {
            this.continent = continent;
            this.regions = regions;
            this.audit = audit;
        }
    }

    /**
     * @param results scope results to roll up.
     * @param excluded scopes that failed or were skipped, with the reason, to be listed in the audit.
     */
    public Rollup rollup (Collection<ScopeResult> results, Map<String, String> excluded) {
        Map<String, ScopeResult> byId = new LinkedHashMap<>();
        for (ScopeResult result : results) {
            if (byId.put(result.id, result) != null) {
                throw new IllegalArgumentException("More than one result for scope " + result.id);
            }
        }
        List<String> unmapped = new ArrayList<>();
        for (String id : byId.keySet()) {
            if (definitions.regionOf(id) == null) {
                unmapped.add(id);
            }
        }
        Map<String, RegionResult> regions = new LinkedHashMap<>();
        Map<String, List<String>> missing = new LinkedHashMap<>();
        List<String> emptyRegions = new ArrayList<>();
        for (String region : definitions.regions()) {
            List<ScopeResult> members = new ArrayList<>();
            List<String> absent = new ArrayList<>();
            for (String member : definitions.membersOf(region)) {
                ScopeResult result = byId.get(member);
                if (result != null) {
                    members.add(result);
                } else if (!excluded.containsKey(member)) {
                    absent.add(member);
                }
            }
            if (!absent.isEmpty()) {
                missing.put(region, absent);
            }
            if (members.isEmpty()) {
                emptyRegions.add(region);
                LOG.warn("No results for any member of region {}.", region);
                continue;
            }
            RegionResult regionResult = sum(region, members);
            Reconciliation.check(regionResult);
            regions.put(region, regionResult);
        }
        RegionResult continent = null;
        if (!byId.isEmpty()) {
            continent = sum(CONTINENT_ID, byId.values());
            Reconciliation.check(continent);
        }
        if (!unmapped.isEmpty()) {
            LOG.warn("Scopes not assigned to any region: {}", unmapped);
        }
        if (!missing.isEmpty()) {
            LOG.warn("Region members without results: {}", missing);
        }
        AuditReport audit = new AuditReport(unmapped, missing, new TreeMap<>(excluded), emptyRegions);
        return new Rollup(continent, regions, audit);
    }

    /**
     * Sum the tables of several scope results. All of them must have been computed with the same thresholds and
     * bands. Mean distances are combined weighting by class population, and are unknown if any member with people
     * in that class lacks them.
     */
    public static RegionResult sum (String id, Collection<ScopeResult> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Cannot sum an empty set of results for " + id);
        }
        ScopeResult first = members.iterator().next();
        PopulationSplit total = PopulationSplit.ZERO;
        int cells = 0;
        Map<String, PopulationSplit> reachable = new LinkedHashMap<>();
        Map<String, PopulationSplit> bandPopulation = new LinkedHashMap<>();
        Map<String, Integer> bandCells = new LinkedHashMap<>();
        Map<String, Integer> urbanCells = new LinkedHashMap<>();
        Map<String, Integer> ruralCells = new LinkedHashMap<>();
        for (String key : first.thresholds.keySet()) {
            reachable.put(key, PopulationSplit.ZERO);
        }
        for (String label : first.bands.keySet()) {
            bandPopulation.put(label, PopulationSplit.ZERO);
            bandCells.put(label, 0);
            urbanCells.put(label, 0);
            ruralCells.put(label, 0);
        }
        MeanSum urbanMean = new MeanSum();
        MeanSum ruralMean = new MeanSum();
        List<String> memberIds = new ArrayList<>();
        for (ScopeResult member : members) {
            if (!member.thresholds.keySet().equals(first.thresholds.keySet()) ||
                    !member.bands.keySet().equals(first.bands.keySet())) {
                throw new ConfigurationException(String.format(
                        "Results for %s and %s were computed with different thresholds or bands.", first.id, member.id));
            }
            memberIds.add(member.id);
            total = total.plus(member.population);
            cells += member.cells;
            for (ThresholdRow row : member.thresholds.values()) {
                String key = DistanceBands.formatKm(row.thresholdKm);
                reachable.put(key, reachable.get(key).plus(row.reachable));
            }
            for (BandRow row : member.bands.values()) {
                bandPopulation.put(row.label, bandPopulation.get(row.label).plus(row.population));
                bandCells.put(row.label, bandCells.get(row.label) + row.cells);
                urbanCells.put(row.label, addOrNull(urbanCells.get(row.label), row.urbanCells));
                ruralCells.put(row.label, addOrNull(ruralCells.get(row.label), row.ruralCells));
            }
            if (member.population.splitKnown()) {
                urbanMean.add(member.accessGap == null ? null : member.accessGap.urbanMeanKm, member.population.urban());
                ruralMean.add(member.accessGap == null ? null : member.accessGap.ruralMeanKm, member.population.rural());
            } else {
                urbanMean.unknown = true;
                ruralMean.unknown = true;
            }
        }
        List<ThresholdRow> thresholdRows = new ArrayList<>();
        for (ThresholdRow row : first.thresholds.values()) {
            String key = DistanceBands.formatKm(row.thresholdKm);
            thresholdRows.add(new ThresholdRow(row.thresholdKm, reachable.get(key), total));
        }
        List<BandRow> bandRows = new ArrayList<>();
        for (BandRow row : first.bands.values()) {
            bandRows.add(new BandRow(row.label, row.lowerKm, row.upperKmOrInfinity(), bandPopulation.get(row.label),
                    bandCells.get(row.label), urbanCells.get(row.label), ruralCells.get(row.label), total));
        }
        ScopeResult partial = new ScopeResult(id, null, cells, total, thresholdRows, bandRows, null);
        double[] gapThresholds = first.accessGap == null ? new double[0] : first.accessGap.gapThresholds();
        AccessGap gap = AccessGap.of(urbanMean.mean(), ruralMean.mean(), partial.thresholds, gapThresholds);
        ScopeResult sum = new ScopeResult(id, null, cells, total, thresholdRows, bandRows, gap);
        return new RegionResult(sum, memberIds);
    }

    private static Integer addOrNull (Integer a, Integer b) {
        return (a == null || b == null) ? null : a + b;
    }

    /** Population-weighted mean of means. */
    private static class MeanSum {
        double weightedKm = 0;
        long weight = 0;
        boolean unknown = false;

        void add (Double meanKm, long population) {
            if (population == 0) return;
            if (meanKm == null) {
                unknown = true;
                return;
            }
            weightedKm += meanKm * Population.toPersons(population);
            weight += population;
        }

        Double mean () {
            if (unknown || weight == 0) return null;
            return weightedKm / Population.toPersons(weight);
        }
    }

}
