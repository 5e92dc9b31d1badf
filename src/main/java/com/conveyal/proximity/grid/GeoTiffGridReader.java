package com.conveyal.proximity.grid;

import com.conveyal.proximity.error.CrsException;
import com.conveyal.proximity.error.FormatException;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads one band of a GeoTIFF. Georeferencing is taken from the GeoTIFF tags: either ModelTransformation, or
 * ModelPixelScale with a ModelTiepoint for unrotated rasters. The CRS comes from the geographic or projected EPSG
 * code in the GeoKey directory. GDAL's nodata and metadata tags supply the no-data sentinel and band names.
 */
public class GeoTiffGridReader extends GridReader {

    private static final Logger LOG = LoggerFactory.getLogger(GeoTiffGridReader.class);

    // TIFF tag numbers
    static final int MODEL_PIXEL_SCALE = 33550;
    static final int MODEL_TIEPOINT = 33922;
    static final int MODEL_TRANSFORMATION = 34264;
    static final int GEO_KEY_DIRECTORY = 34735;
    static final int GDAL_METADATA = 42112;
    static final int GDAL_NODATA = 42113;

    // GeoKey numbers and values
    static final int RASTER_TYPE_KEY = 1025;
    static final int GEOGRAPHIC_TYPE_KEY = 2048;
    static final int PROJECTED_CS_TYPE_KEY = 3072;
    static final int RASTER_PIXEL_IS_POINT = 2;
    static final int USER_DEFINED = 32767;

    private static final Pattern BAND_DESCRIPTION = Pattern.compile(
            "<Item\\s+name=\"DESCRIPTION\"\\s+sample=\"(\\d+)\"[^>]*>([^<]*)</Item>");

    @Override
    public Grid read (File file, Config config) {
        TIFFImage image;
        try {
            image = TiffReader.readTiff(file);
        } catch (IOException | RuntimeException e) {
            throw new FormatException("Could not read GeoTIFF " + file, e);
        }
        FileDirectory directory = image.getFileDirectory();
        Map<Integer, Object> tags = new HashMap<>();
        for (FileDirectoryEntry entry : directory.getEntries()) {
            tags.put(entry.getFieldTag().getId(), entry.getValues());
        }
        int width = directory.getImageWidth().intValue();
        int height = directory.getImageHeight().intValue();
        int cellCount = GridGeometry.cellCount(width, height);
        Map<Integer, Integer> geoKeys = geoKeys(tags.get(GEO_KEY_DIRECTORY));

        AffineTransform transform = transform(tags, geoKeys, file);
        String crs = crs(geoKeys);
        if (crs == null) {
            crs = config.rasterCrs();
        }
        if (crs == null) {
            throw new CrsException("GeoTIFF " + file.getName() + " does not declare an EPSG coordinate reference " +
                    "system. Set raster-crs to supply one.");
        }

        Rasters rasters;
        try {
            rasters = directory.readRasters();
        } catch (RuntimeException e) {
            throw new FormatException("Could not decode pixels of GeoTIFF " + file, e);
        }
        int band = selectBand(config.rasterBand(), rasters.getSamplesPerPixel(), bandNames(tags.get(GDAL_METADATA)));

        double noData = Double.NaN;
        if (config.noDataValue() != null) {
            noData = config.noDataValue();
        } else if (tags.containsKey(GDAL_NODATA)) {
            noData = parseNoData(tags.get(GDAL_NODATA));
        }

        double[] values = new double[cellCount];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                values[y * width + x] = rasters.getPixelSample(band, x, y).doubleValue();
            }
        }
        GridGeometry geometry = new GridGeometry(width, height, transform, crs);
        LOG.info("Read band {} of GeoTIFF {}: {}", band + 1, file.getName(), geometry);
        return new Grid(baseName(file), geometry, values, noData);
    }

    /** Build the GDAL-style pixel to world transform from whichever georeferencing tags are present. */
    static AffineTransform transform (Map<Integer, Object> tags, Map<Integer, Integer> geoKeys, File file) {
        AffineTransform transform;
        double[] matrix = doubles(tags.get(MODEL_TRANSFORMATION));
        double[] scale = doubles(tags.get(MODEL_PIXEL_SCALE));
        double[] tiepoint = doubles(tags.get(MODEL_TIEPOINT));
        if (matrix != null && matrix.length == 16) {
            // Row-major 4x4 matrix. Only the 2D part is used.
            transform = new AffineTransform(matrix[0], matrix[4], matrix[1], matrix[5], matrix[3], matrix[7]);
        } else if (scale != null && scale.length >= 2 && tiepoint != null && tiepoint.length >= 6) {
            double sx = scale[0];
            double sy = scale[1];
            double originX = tiepoint[3] - tiepoint[0] * sx;
            double originY = tiepoint[4] + tiepoint[1] * sy;
            transform = new AffineTransform(sx, 0, 0, -sy, originX, originY);
        } else {
            throw new FormatException("GeoTIFF " + file.getName() + " has no georeferencing tags.");
        }
        Integer rasterType = geoKeys.get(RASTER_TYPE_KEY);
        if (rasterType != null && rasterType == RASTER_PIXEL_IS_POINT) {
            // Model coordinates refer to pixel centers, shift so that they refer to corners.
            transform.translate(-0.5, -0.5);
        }
        return transform;
    }

    /** @return the EPSG code of the raster, or null if it has none or a user-defined one. */
    static String crs (Map<Integer, Integer> geoKeys) {
        Integer projected = geoKeys.get(PROJECTED_CS_TYPE_KEY);
        if (projected != null && projected != USER_DEFINED && projected > 0) {
            return "EPSG:" + projected;
        }
        Integer geographic = geoKeys.get(GEOGRAPHIC_TYPE_KEY);
        if (geographic != null && geographic != USER_DEFINED && geographic > 0) {
            return "EPSG:" + geographic;
        }
        return null;
    }

    /**
     * Parse the GeoKey directory: a header of four shorts (version, revision, minor revision, key count) followed
     * by four shorts per key. Only keys whose value is stored inline are returned.
     */
    static Map<Integer, Integer> geoKeys (Object directoryValues) {
        Map<Integer, Integer> keys = new HashMap<>();
        double[] shorts = doubles(directoryValues);
        if (shorts == null || shorts.length < 4) {
            return keys;
        }
        int keyCount = (int) shorts[3];
        for (int k = 0, i = 4; k < keyCount && i + 3 < shorts.length; k++, i += 4) {
            int keyId = (int) shorts[i];
            int location = (int) shorts[i + 1];
            if (location == 0) {
                keys.put(keyId, (int) shorts[i + 3]);
            }
        }
        return keys;
    }

    /**
     * @param requested one-based band number or a band name from the GDAL metadata, or null.
     * @return the zero-based index of the band to read.
     */
    static int selectBand (String requested, int bandCount, Map<String, Integer> bandNames) {
        if (requested == null) {
            if (bandCount > 1) {
                throw new FormatException(String.format("Raster has %d bands, set raster-band to choose one of %s.",
                        bandCount, bandNames.keySet()));
            }
            return 0;
        }
        if (bandNames.containsKey(requested)) {
            return bandNames.get(requested);
        }
        int band;
        try {
            band = Integer.parseInt(requested) - 1;
        } catch (NumberFormatException e) {
            throw new FormatException("Raster has no band named " + requested + ", only " + bandNames.keySet());
        }
        if (band < 0 || band >= bandCount) {
            throw new FormatException(String.format("Band %s requested but raster has %d bands.", requested, bandCount));
        }
        return band;
    }

    /** Band descriptions written by GDAL into its metadata tag, keyed on name. */
    static Map<String, Integer> bandNames (Object metadata) {
        Map<String, Integer> names = new HashMap<>();
        String xml = string(metadata);
        if (xml != null) {
            Matcher matcher = BAND_DESCRIPTION.matcher(xml);
            while (matcher.find()) {
                names.put(matcher.group(2).trim(), Integer.parseInt(matcher.group(1)));
            }
        }
        return names;
    }

    private static double parseNoData (Object value) {
        String text = string(value);
        if (text == null) {
            throw new FormatException("GeoTIFF nodata tag is not text.");
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new FormatException("GeoTIFF nodata tag could not be parsed: " + text, e);
        }
    }

    /** Tag values come back as a single Number for one value and a List for several. */
    static double[] doubles (Object value) {
        if (value == null) {
            return null;
        }
        List<Object> items = new ArrayList<>();
        if (value instanceof List) {
            items.addAll((List<?>) value);
        } else {
            items.add(value);
        }
        double[] result = new double[items.size()];
        for (int i = 0; i < result.length; i++) {
            Object item = items.get(i);
            if (!(item instanceof Number)) {
                return null;
            }
            result[i] = ((Number) item).doubleValue();
        }
        return result;
    }

    private static String string (Object value) {
        if (value instanceof String) {
            return ((String) value).replace("\u0000", "");
        }
        if (value instanceof List) {
            StringBuilder builder = new StringBuilder();
            for (Object item : (List<?>) value) {
                if (!(item instanceof String)) {
                    return null;
                }
                builder.append(item);
            }
            return builder.toString().replace("\u0000", "");
        }
        return null;
    }

}
