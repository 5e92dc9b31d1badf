package com.conveyal.proximity.grid;

import com.conveyal.proximity.error.CrsException;
import com.conveyal.proximity.error.FormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AsciiGridReaderTest {

    private static final String GRID =
            "ncols 3\n" +
            "nrows 2\n" +
            "xllcorner 10.0\n" +
            "yllcorner 5.0\n" +
            "cellsize 0.5\n" +
            "NODATA_value -9999\n" +
            "1 2 3\n" +
            "4 -9999 6\n";

    @TempDir
    Path tempDir;

    static GridReader.Config config (Double noDataValue, String rasterCrs) {
        return new GridReader.Config() {
            @Override public Double noDataValue () { return noDataValue; }
            @Override public String rasterCrs () { return rasterCrs; }
            @Override public String rasterBand () { return null; }
        };
    }

    private File write (String name, String content) throws IOException {
        Path path = tempDir.resolve(name);
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path.toFile();
    }

    @Test
    void readGridWithProjectionFile () throws IOException {
        File asc = write("population.asc", GRID);
        write("population.prj", "GEOGCS[\"GCS_WGS_1984\",DATUM[\"D_WGS_1984\",SPHEROID[\"WGS_1984\",6378137,298.257223563]]," +
                "PRIMEM[\"Greenwich\",0],UNIT[\"Degree\",0.017453292519943295]]");
        Grid grid = GridReader.load(asc, config(null, null));
        assertEquals("population", grid.name);
        assertEquals(3, grid.width());
        assertEquals(2, grid.height());
        assertEquals("EPSG:4326", grid.geometry.crs);
        assertEquals(1, grid.getValue(0, 0));
        assertEquals(6, grid.getValue(1, 2));
        assertTrue(grid.isNoData(1, 1));
        assertFalse(grid.isNoData(1, 0));
        // Top row is the northern one, lower left corner at (10, 5).
        assertEquals(10.25, grid.geometry.coordOf(0, 0).x, 1e-12);
        assertEquals(5.75, grid.geometry.coordOf(0, 0).y, 1e-12);
        assertEquals(5.25, grid.geometry.coordOf(1, 0).y, 1e-12);
    }

    @Test
    void authorityCodeInProjectionFileAndNoDataOverride () throws IOException {
        File asc = write("utm.asc", GRID);
        write("utm.prj", "EPSG:32633\n");
        Grid grid = GridReader.load(asc, config(1.0, null));
        assertEquals("EPSG:32633", grid.geometry.crs);
        assertTrue(grid.isNoData(0, 0));
        assertEquals(-9999, grid.getValue(1, 1));
        assertFalse(grid.isNoData(1, 1));
    }

    @Test
    void configuredCrsIsUsedWithoutProjectionFile () throws IOException {
        File asc = write("bare.asc", GRID);
        assertThrows(CrsException.class, () -> GridReader.load(asc, config(null, null)));
        Grid grid = GridReader.load(asc, config(null, "EPSG:4326"));
        assertTrue(grid.geometry.geographic);
    }

    @Test
    void malformedGrids () throws IOException {
        File shortGrid = write("short.asc", GRID.replace("4 -9999 6\n", "4 -9999\n"));
        assertThrows(FormatException.class, () -> GridReader.load(shortGrid, config(null, "EPSG:4326")));
        File noRows = write("norows.asc", GRID.replace("nrows 2\n", ""));
        assertThrows(FormatException.class, () -> GridReader.load(noRows, config(null, "EPSG:4326")));
        File text = write("text.asc", GRID.replace("6\n", "six\n"));
        assertThrows(FormatException.class, () -> GridReader.load(text, config(null, "EPSG:4326")));
        assertThrows(FormatException.class, () -> GridReader.load(new File(tempDir.toFile(), "missing.asc"),
                config(null, "EPSG:4326")));
        File unknown = write("grid.xyz", GRID);
        assertThrows(FormatException.class, () -> GridReader.load(unknown, config(null, "EPSG:4326")));
    }

    /** Rows starting with NaN in any spelling are data, not header lines. */
    @Test
    void dataRowsMayStartWithNaN () throws IOException {
        File asc = write("gaps.asc", GRID.replace("1 2 3\n", "NaN 2 3\n").replace("4 -9999 6\n", "nan -9999 6\n"));
        Grid grid = GridReader.load(asc, config(null, "EPSG:4326"));
        assertEquals(3, grid.width());
        assertEquals(2, grid.height());
        assertTrue(grid.isNoData(0, 0));
        assertTrue(grid.isNoData(1, 0));
        assertEquals(2, grid.getValue(0, 1));
        assertEquals(3, grid.validCellCount());
    }

    @Test
    void oversizedHeaderIsRejected () throws IOException {
        File huge = write("huge.asc", GRID.replace("ncols 3\n", "ncols 100000\n").replace("nrows 2\n", "nrows 100000\n"));
        assertThrows(FormatException.class, () -> GridReader.load(huge, config(null, "EPSG:4326")));
    }

}
