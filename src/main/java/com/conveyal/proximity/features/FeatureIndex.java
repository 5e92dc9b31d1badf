package com.conveyal.proximity.features;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.List;

/**
 * Spatial index over a continental FeatureSet, so that each scope only rasterizes the features near it. The tree is
 * built eagerly, after which concurrent queries from several scope workers are safe.
 */
public class FeatureIndex {

    private final FeatureSet featureSet;

    private final STRtree tree = new STRtree();

    public FeatureIndex (FeatureSet featureSet) {
        this.featureSet = featureSet;
        for (int i = 0; i < featureSet.size(); i++) {
            tree.insert(featureSet.get(i).geometry.getEnvelopeInternal(), i);
        }
        tree.build();
    }

    /** @return the features whose bounding boxes intersect the envelope, in the set's CRS and original order. */
    public FeatureSet query (Envelope envelope) {
        List<Integer> indexes = new ArrayList<>();
        for (Object item : tree.query(envelope)) {
            indexes.add((Integer) item);
        }
        // The tree returns hits in no particular order.
        indexes.sort(null);
        List<Feature> hits = new ArrayList<>(indexes.size());
        for (int i : indexes) {
            hits.add(featureSet.get(i));
        }
        return new FeatureSet(featureSet.crs, hits);
    }

}
