package com.conveyal.proximity.features;

import com.conveyal.proximity.error.FormatException;
import com.conveyal.proximity.grid.Crs;
import com.conveyal.proximity.util.GeometryUtils;
import com.conveyal.proximity.util.JsonUtilities;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a GeoJSON FeatureCollection (or a single Feature) into a FeatureSet.
 *
 * RFC 7946 GeoJSON is always in WGS84 longitude and latitude, which is what we assume when no CRS is given. Older
 * files written by QGIS and ogr2ogr carry a "crs" member naming another CRS, and since raster inputs are often
 * projected we honor it rather than rejecting the file. Features without a geometry are skipped with a warning.
 */
public class GeoJsonFeatureReader {

    private static final Logger LOG = LoggerFactory.getLogger(GeoJsonFeatureReader.class);

    private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() { };

    public FeatureSet read (File file) {
        try {
            return read(JsonUtilities.lenientObjectMapper.readTree(file), file.getName());
        } catch (IOException e) {
            throw new FormatException("Could not parse GeoJSON file " + file, e);
        }
    }

    public FeatureSet read (InputStream inputStream, String name) {
        try {
            return read(JsonUtilities.lenientObjectMapper.readTree(inputStream), name);
        } catch (IOException e) {
            throw new FormatException("Could not parse GeoJSON " + name, e);
        }
    }

    private FeatureSet read (JsonNode root, String name) {
        if (root == null || !root.isObject()) {
            throw new FormatException("GeoJSON " + name + " is not a JSON object.");
        }
        String type = root.path("type").asText();
        List<JsonNode> featureNodes = new ArrayList<>();
        if ("FeatureCollection".equals(type)) {
            root.path("features").forEach(featureNodes::add);
        } else if ("Feature".equals(type)) {
            featureNodes.add(root);
        } else {
            throw new FormatException("GeoJSON " + name + " must be a FeatureCollection or Feature, not " + type);
        }
        String crs = crs(root);
        GeoJsonReader geometryReader = new GeoJsonReader(GeometryUtils.geometryFactory);
        List<Feature> features = new ArrayList<>(featureNodes.size());
        int skipped = 0;
        for (int i = 0; i < featureNodes.size(); i++) {
            JsonNode featureNode = featureNodes.get(i);
            JsonNode geometryNode = featureNode.get("geometry");
            if (geometryNode == null || geometryNode.isNull()) {
                skipped++;
                continue;
            }
            Geometry geometry;
            try {
                geometry = geometryReader.read(geometryNode.toString());
            } catch (ParseException | RuntimeException e) {
                throw new FormatException(String.format("Invalid geometry in feature %d of %s", i, name), e);
            }
            Map<String, Object> properties = new HashMap<>();
            JsonNode propertiesNode = featureNode.get("properties");
            if (propertiesNode != null && propertiesNode.isObject()) {
                properties = JsonUtilities.lenientObjectMapper.convertValue(propertiesNode, PROPERTIES_TYPE);
            }
            features.add(new Feature(geometry, properties));
        }
        if (skipped > 0) {
            LOG.warn("Skipped {} features without geometry in {}.", skipped, name);
        }
        LOG.info("Read {} features in {} from {}.", features.size(), crs, name);
        return new FeatureSet(crs, features);
    }

    /** The obsolete named crs member, e.g. {"type": "name", "properties": {"name": "EPSG:32633"}}. */
    private static String crs (JsonNode root) {
        JsonNode crsName = root.path("crs").path("properties").path("name");
        if (crsName.isTextual()) {
            return Crs.normalize(crsName.asText());
        }
        return Crs.WGS84;
    }

}
