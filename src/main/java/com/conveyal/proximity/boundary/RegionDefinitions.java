package com.conveyal.proximity.boundary;

import com.conveyal.proximity.error.ConfigurationException;
import com.conveyal.proximity.util.JsonUtilities;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assignment of countries to regions, read from a JSON object mapping each region name to a list of country names.
 * A country may belong to at most one region. Names must match the scope identifiers exactly.
 */
public class RegionDefinitions {

    public static final String BUNDLED_AFRICA = "/regions/africa.json";

    private static final TypeReference<LinkedHashMap<String, List<String>>> DEFINITIONS_TYPE = new TypeReference<>() { };

    private final Map<String, List<String>> membersByRegion;

    private final Map<String, String> regionByMember;

    public RegionDefinitions (Map<String, List<String>> membersByRegion) {
        Map<String, List<String>> members = new LinkedHashMap<>();
        Map<String, String> regions = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : membersByRegion.entrySet()) {
            String region = entry.getKey().trim();
            List<String> list = new ArrayList<>();
            for (String member : entry.getValue()) {
                String name = member.trim();
                String previous = regions.put(name, region);
                if (previous != null) {
                    throw new ConfigurationException(String.format(
                            "%s is assigned to both %s and %s in the region definitions.", name, previous, region));
                }
                list.add(name);
            }
            members.put(region, Collections.unmodifiableList(list));
        }
        this.membersByRegion = Collections.unmodifiableMap(members);
        this.regionByMember = Collections.unmodifiableMap(regions);
    }

    public static RegionDefinitions empty () {
        return new RegionDefinitions(Map.of());
    }

    public static RegionDefinitions fromFile (File file) {
        try {
            return new RegionDefinitions(JsonUtilities.lenientObjectMapper.readValue(file, DEFINITIONS_TYPE));
        } catch (IOException e) {
            throw new ConfigurationException("Could not read region definitions from " + file, e);
        }
    }

    /** The five African regions shipped with the application. */
    public static RegionDefinitions bundled () {
        try (InputStream stream = RegionDefinitions.class.getResourceAsStream(BUNDLED_AFRICA)) {
            if (stream == null) {
                throw new ConfigurationException("Bundled region definitions are missing: " + BUNDLED_AFRICA);
            }
            return new RegionDefinitions(JsonUtilities.lenientObjectMapper.readValue(stream, DEFINITIONS_TYPE));
        } catch (IOException e) {
            throw new ConfigurationException("Could not read bundled region definitions.", e);
        }
    }

    /** @return the region of the country, or null if it is not assigned to any region. */
    public String regionOf (String member) {
        return regionByMember.get(member);
    }

    public List<String> membersOf (String region) {
        return membersByRegion.getOrDefault(region, List.of());
    }

    /** Region names in the order they were defined. */
    public Set<String> regions () {
        return membersByRegion.keySet();
    }

}
