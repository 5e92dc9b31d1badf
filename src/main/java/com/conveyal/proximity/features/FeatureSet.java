package com.conveyal.proximity.features;

import com.conveyal.proximity.grid.Crs;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * An ordered, read-only collection of features that all share one coordinate reference system. Filtering,
 * reprojection and clipping return new FeatureSets and leave this one untouched.
 */
public class FeatureSet implements Iterable<Feature> {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureSet.class);

    /** Normalized CRS code of every geometry in this set. */
    public final String crs;

    private final List<Feature> features;

    public FeatureSet (String crs, List<Feature> features) {
        this.crs = Crs.normalize(crs);
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
    }

    public int size () {
        return features.size();
    }

    public boolean isEmpty () {
        return features.isEmpty();
    }

    public Feature get (int i) {
        return features.get(i);
    }

    public List<Feature> features () {
        return features;
    }

    @Override
    public Iterator<Feature> iterator () {
        return features.iterator();
    }

    public FeatureSet filter (Predicate<Feature> predicate) {
        return new FeatureSet(crs, features.stream().filter(predicate).collect(Collectors.toList()));
    }

    /**
     * Keep only features whose class attribute is one of the given classes, e.g. only primary and secondary roads.
     * Comparison ignores case and numeric formatting. With no attribute or no classes every feature is kept.
     */
    public FeatureSet filterByClass (String attribute, Collection<String> classes) {
        if (attribute == null || classes == null || classes.isEmpty()) {
            return this;
        }
        Set<String> keys = classes.stream().map(Feature::classKey).collect(Collectors.toSet());
        FeatureSet filtered = filter(f -> keys.contains(Feature.classKey(f.attributes.get(attribute))));
        LOG.info("Kept {} of {} features with {} in {}.", filtered.size(), size(), attribute, classes);
        return filtered;
    }

    /** Reproject every geometry to the target CRS. Returns this set if it is already in that CRS. */
    public FeatureSet reproject (String targetCrs) {
        if (Crs.same(crs, targetCrs)) {
            return this;
        }
        List<Feature> reprojected = new ArrayList<>(features.size());
        for (Feature feature : features) {
            reprojected.add(feature.withGeometry(Crs.reproject(feature.geometry, crs, targetCrs)));
        }
        LOG.info("Reprojected {} features from {} to {}.", size(), crs, targetCrs);
        return new FeatureSet(targetCrs, reprojected);
    }

    /**
     * Intersect every feature with the polygon, dropping features that fall entirely outside it. The polygon must
     * be in this set's CRS.
     */
    public FeatureSet clip (Geometry polygon) {
        PreparedGeometry prepared = PreparedGeometryFactory.prepare(polygon);
        List<Feature> clipped = new ArrayList<>();
        for (Feature feature : features) {
            if (prepared.containsProperly(feature.geometry)) {
                clipped.add(feature);
            } else if (prepared.intersects(feature.geometry)) {
                Geometry intersection = feature.geometry.intersection(polygon);
                if (!intersection.isEmpty()) {
                    clipped.add(feature.withGeometry(intersection));
                }
            }
        }
        return new FeatureSet(crs, clipped);
    }

    /** @return the bounding box of all geometries, which is null (empty) for an empty set. */
    public Envelope envelope () {
        Envelope envelope = new Envelope();
        for (Feature feature : features) {
            envelope.expandToInclude(feature.geometry.getEnvelopeInternal());
        }
        return envelope;
    }

}
