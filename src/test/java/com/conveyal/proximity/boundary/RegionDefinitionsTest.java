package com.conveyal.proximity.boundary;

import com.conveyal.proximity.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegionDefinitionsTest {

    @Test
    void bundledAfricanRegions () {
        RegionDefinitions regions = RegionDefinitions.bundled();
        assertEquals(List.of("North Africa", "West Africa", "Central Africa", "East Africa", "Southern Africa"),
                new ArrayList<>(regions.regions()));
        assertEquals("West Africa", regions.regionOf("Nigeria"));
        assertEquals("East Africa", regions.regionOf("Kenya"));
        assertEquals("Southern Africa", regions.regionOf("Madagascar"));
        assertNull(regions.regionOf("France"));
        assertTrue(regions.membersOf("Central Africa").contains("Democratic Republic of the Congo"));
    }

    @Test
    void memberInTwoRegions () {
        Map<String, List<String>> definitions = Map.of("R1", List.of("A", "B"), "R2", List.of(" B "));
        assertThrows(ConfigurationException.class, () -> new RegionDefinitions(definitions));
    }

    @Test
    void readFromFile (@TempDir File directory) throws IOException {
        File file = new File(directory, "regions.json");
        Files.write(file.toPath(), "{\"R\": [\"A\", \"B \"], \"S\": []}".getBytes(StandardCharsets.UTF_8));
        RegionDefinitions regions = RegionDefinitions.fromFile(file);
        assertEquals(List.of("A", "B"), regions.membersOf("R"));
        assertEquals("R", regions.regionOf("B"));
        assertEquals(List.of(), regions.membersOf("S"));
        assertEquals(List.of(), regions.membersOf("T"));

        File broken = new File(directory, "broken.json");
        Files.write(broken.toPath(), "[1, 2".getBytes(StandardCharsets.UTF_8));
        assertThrows(ConfigurationException.class, () -> RegionDefinitions.fromFile(broken));
        assertThrows(ConfigurationException.class, () -> RegionDefinitions.fromFile(new File(directory, "none.json")));
    }

}
