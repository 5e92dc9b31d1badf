package com.conveyal.proximity.features;

import org.locationtech.jts.geom.Geometry;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/** One vector geometry and its attributes, e.g. a road segment with its class or a country with its name. */
public class Feature {

    public final Geometry geometry;

    public final Map<String, Object> attributes;

    public Feature (Geometry geometry, Map<String, Object> attributes) {
        this.geometry = checkNotNull(geometry);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** Same attributes, different geometry. */
    public Feature withGeometry (Geometry newGeometry) {
        return new Feature(newGeometry, attributes);
    }

    /**
     * @return the attribute as text, or null if it is absent. Numbers are written without a trailing fractional
     *         zero so that a class stored as 1.0 in one file and 1 in another compares equal.
     */
    public String attributeAsString (String name) {
        return asString(attributes.get(name));
    }

    static String asString (Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            if (!Double.isFinite(((Number) value).doubleValue())) {
                return value.toString();
            }
        }
        if (value instanceof Number) {
            BigDecimal decimal = new BigDecimal(value.toString()).stripTrailingZeros();
            return decimal.scale() < 0 ? decimal.setScale(0).toPlainString() : decimal.toPlainString();
        }
        return value.toString().trim();
    }

    /** Form used to compare class values: as text, lower case. */
    static String classKey (Object value) {
        String text = asString(value);
        return text == null ? null : text.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString () {
        return geometry.getGeometryType() + " " + attributes;
    }

}
