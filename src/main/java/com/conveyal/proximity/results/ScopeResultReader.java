package com.conveyal.proximity.results;

import com.conveyal.proximity.aggregate.AccessGap;
import com.conveyal.proximity.aggregate.BandRow;
import com.conveyal.proximity.aggregate.Population;
import com.conveyal.proximity.aggregate.PopulationSplit;
import com.conveyal.proximity.aggregate.ScopeResult;
import com.conveyal.proximity.aggregate.ThresholdRow;
import com.conveyal.proximity.error.FormatException;
import com.conveyal.proximity.util.JsonUtilities;
import com.fasterxml.jackson.databind.JsonNode;
import gnu.trove.list.TDoubleList;
import gnu.trove.list.array.TDoubleArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads back scope results written by an earlier run, so that they can be regrouped into regions without
 * recomputing distances. Files that record only a total population (no urban and rural parts) are accepted: the
 * split is then unknown and stays unknown through the rollup, instead of being taken as zero.
 */
public abstract class ScopeResultReader {

    private static final Logger LOG = LoggerFactory.getLogger(ScopeResultReader.class);

    public static ScopeResult read (File file) {
        JsonNode root;
        try {
            root = JsonUtilities.lenientObjectMapper.readTree(file);
        } catch (IOException e) {
            throw new FormatException("Could not parse scope result " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new FormatException("Scope result is not a JSON object: " + file);
        }
        return fromJson(root, file.getName());
    }

    /** Read every .json file in the directory, in file name order. */
    public static List<ScopeResult> readDirectory (File directory) {
        File[] files = directory.listFiles((dir, name) -> name.endsWith(".json"));
        if (files == null) {
            throw new FormatException("Not a directory: " + directory);
        }
        Arrays.sort(files);
        List<ScopeResult> results = new ArrayList<>(files.length);
        for (File file : files) {
            results.add(read(file));
        }
        LOG.info("Read {} scope results from {}.", results.size(), directory);
        return results;
    }

    static ScopeResult fromJson (JsonNode root, String source) {
        String id = required(root, "id", source).asText();
        String region = root.hasNonNull("region") ? root.get("region").asText() : null;
        PopulationSplit total = split(required(root, "population", source), source);
        int cells = root.path("cells").asInt(0);

        List<ThresholdRow> thresholds = new ArrayList<>();
        for (JsonNode row : root.path("thresholds")) {
            double km = required(row, "thresholdKm", source).asDouble();
            thresholds.add(new ThresholdRow(km, split(required(row, "reachable", source), source), total));
        }
        List<BandRow> bands = new ArrayList<>();
        for (JsonNode row : root.path("bands")) {
            double upper = row.hasNonNull("upperKm") ? row.get("upperKm").asDouble() : Double.POSITIVE_INFINITY;
            bands.add(new BandRow(required(row, "label", source).asText(), row.path("lowerKm").asDouble(0), upper,
                    split(required(row, "population", source), source), row.path("cells").asInt(0),
                    optionalInt(row, "urbanCells"), optionalInt(row, "ruralCells"), total));
        }
        AccessGap gap = null;
        JsonNode gapNode = root.path("accessGap");
        if (gapNode.isObject()) {
            TDoubleList gapThresholds = new TDoubleArrayList();
            for (JsonNode coverage : gapNode.path("coverage")) {
                gapThresholds.add(required(coverage, "thresholdKm", source).asDouble());
            }
            ScopeResult partial = new ScopeResult(id, region, cells, total, thresholds, bands, null);
            gap = AccessGap.of(optionalDouble(gapNode, "urbanMeanKm"), optionalDouble(gapNode, "ruralMeanKm"),
                    partial.thresholds, gapThresholds.toArray());
        }
        if (!total.splitKnown()) {
            LOG.info("Result {} has no urban and rural totals, its split will be unreported.", id);
        }
        return new ScopeResult(id, region, cells, total, thresholds, bands, gap);
    }

    private static PopulationSplit split (JsonNode node, String source) {
        if (node.isNumber()) {
            return PopulationSplit.totalOnly(Population.toFixed(node.asDouble()));
        }
        if (node.hasNonNull("urban") && node.hasNonNull("rural")) {
            return PopulationSplit.known(Population.toFixed(node.get("urban").asDouble()),
                    Population.toFixed(node.get("rural").asDouble()));
        }
        return PopulationSplit.totalOnly(Population.toFixed(required(node, "total", source).asDouble()));
    }

    private static JsonNode required (JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new FormatException(String.format("Scope result %s is missing field %s.", source, field));
        }
        return value;
    }

    private static Integer optionalInt (JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asInt() : null;
    }

    private static Double optionalDouble (JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asDouble() : null;
    }

}
