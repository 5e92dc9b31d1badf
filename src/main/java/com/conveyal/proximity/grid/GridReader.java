package com.conveyal.proximity.grid;

import com.conveyal.proximity.error.FormatException;

import java.io.File;
import java.util.Locale;

/**
 * Loads a single band of a raster file into a Grid. Subclasses handle one file format each. Readers are stateless
 * and can be shared between threads.
 */
public abstract class GridReader {

    /** Options that affect how rasters are interpreted. Each may be null. */
    public interface Config {
        /** Sentinel overriding (or supplying) the raster's own no-data value. */
        Double noDataValue ();
        /** CRS code used when the raster does not declare one. */
        String rasterCrs ();
        /** One-based band number or band name. Required for rasters with more than one band. */
        String rasterBand ();
    }

    /**
     * @throws FormatException if the file cannot be parsed as a raster with a single band or the selected band.
     * @throws com.conveyal.proximity.error.CrsException if no coordinate reference system can be determined.
     */
    public abstract Grid read (File file, Config config);

    /** Choose a reader based on the file extension. */
    public static GridReader forFile (File file) {
        String name = file.getName().toLowerCase(Locale.ROOT);
        if (name.endsWith(".tif") || name.endsWith(".tiff")) {
            return new GeoTiffGridReader();
        } else if (name.endsWith(".asc")) {
            return new AsciiGridReader();
        }
        throw new FormatException("Raster format not recognized from file name: " + file.getName());
    }

    public static Grid load (File file, Config config) {
        if (!file.isFile()) {
            throw new FormatException("Raster file does not exist: " + file);
        }
        return forFile(file).read(file, config);
    }

    /** Name used for grids loaded from a file. */
    protected static String baseName (File file) {
        String name = file.getName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

}
