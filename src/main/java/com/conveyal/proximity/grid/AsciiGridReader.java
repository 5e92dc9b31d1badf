package com.conveyal.proximity.grid;

import com.conveyal.proximity.error.CrsException;
import com.conveyal.proximity.error.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads ESRI ASCII grids (.asc). The header gives the grid size, the lower left corner or cell center and the cell
 * size. The CRS comes from a .prj file next to the grid if there is one.
 */
public class AsciiGridReader extends GridReader {

    private static final Logger LOG = LoggerFactory.getLogger(AsciiGridReader.class);

    private static final Set<String> HEADER_KEYS = Set.of("ncols", "nrows", "xllcorner", "yllcorner", "xllcenter",
            "yllcenter", "cellsize", "dx", "dy", "nodata_value");

    private static final Pattern EPSG_CODE = Pattern.compile("EPSG[\"',:\\s]+(\\d+)", Pattern.CASE_INSENSITIVE);

    @Override
    public Grid read (File file, Config config) {
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.US_ASCII)) {
            Map<String, String> header = new HashMap<>();
            String line;
            String firstDataLine = null;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) continue;
                String[] parts = trimmed.split("\\s+");
                String key = parts[0].toLowerCase(Locale.ROOT);
                if (!HEADER_KEYS.contains(key)) {
                    // Data starts at the first line without a header key, which may begin with NaN.
                    firstDataLine = trimmed;
                    break;
                }
                if (parts.length != 2) {
                    throw new FormatException("Malformed ASCII grid header line: " + trimmed);
                }
                header.put(key, parts[1]);
            }
            int ncols = (int) headerValue(header, "ncols");
            int nrows = (int) headerValue(header, "nrows");
            double cellWidth;
            double cellHeight;
            if (header.containsKey("cellsize")) {
                cellWidth = cellHeight = headerValue(header, "cellsize");
            } else {
                cellWidth = headerValue(header, "dx");
                cellHeight = headerValue(header, "dy");
            }
            double west;
            double south;
            if (header.containsKey("xllcenter")) {
                west = headerValue(header, "xllcenter") - cellWidth / 2;
                south = headerValue(header, "yllcenter") - cellHeight / 2;
            } else {
                west = headerValue(header, "xllcorner");
                south = headerValue(header, "yllcorner");
            }
            double noData = Double.NaN;
            if (config.noDataValue() != null) {
                noData = config.noDataValue();
            } else if (header.containsKey("nodata_value")) {
                noData = headerValue(header, "nodata_value");
            }

            double[] values = new double[GridGeometry.cellCount(ncols, nrows)];
            int i = 0;
            line = firstDataLine;
            while (line != null) {
                for (String token : line.trim().split("\\s+")) {
                    if (token.isEmpty()) continue;
                    if (i >= values.length) {
                        throw new FormatException("ASCII grid " + file + " has more values than ncols x nrows.");
                    }
                    values[i++] = parseValue(token);
                }
                line = reader.readLine();
            }
            if (i != values.length) {
                throw new FormatException(String.format("ASCII grid %s has %d values, expected %d.",
                        file, i, values.length));
            }
            String crs = readCrs(file, config);
            double north = south + nrows * cellHeight;
            GridGeometry geometry = GridGeometry.northUp(west, north, cellWidth, cellHeight, ncols, nrows, crs);
            LOG.info("Read ASCII grid {}: {}", file.getName(), geometry);
            return new Grid(baseName(file), geometry, values, noData);
        } catch (IOException | NumberFormatException e) {
            throw new FormatException("Could not read ASCII grid " + file, e);
        }
    }

    /** Like Double.parseDouble, but also accepts the lower case nan written by some tools. */
    static double parseValue (String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        if (lower.equals("nan") || lower.equals("-nan") || lower.equals("+nan")) {
            return Double.NaN;
        }
        return Double.parseDouble(token);
    }

    private static double headerValue (Map<String, String> header, String key) {
        String value = header.get(key);
        if (value == null) {
            throw new FormatException("ASCII grid header is missing " + key);
        }
        return Double.parseDouble(value);
    }

    /**
     * The .prj sidecar may hold an authority code or WKT. Only WKT naming an EPSG authority on the outermost
     * definition, or plain WGS84 geographic coordinates, is understood.
     */
    private static String readCrs (File file, Config config) throws IOException {
        File prj = new File(file.getParentFile(), baseName(file) + ".prj");
        if (prj.isFile()) {
            String text = Files.readString(prj.toPath(), StandardCharsets.UTF_8).trim();
            String upper = text.toUpperCase(Locale.ROOT);
            if (upper.matches("[A-Z]+:\\d+")) {
                return text;
            }
            if (upper.startsWith("GEOGCS") && (upper.contains("WGS_1984") || upper.contains("WGS 84") || upper.contains("WGS84"))) {
                return Crs.WGS84;
            }
            // The authority of the outermost definition is the last one in the WKT.
            Matcher matcher = EPSG_CODE.matcher(text);
            String code = null;
            while (matcher.find()) {
                code = "EPSG:" + matcher.group(1);
            }
            if (code != null) {
                return code;
            }
            LOG.warn("Projection file {} was not understood.", prj.getName());
        }
        if (config.rasterCrs() != null) {
            return config.rasterCrs();
        }
        throw new CrsException("No coordinate reference system found for " + file.getName() +
                ". Provide a .prj file or set raster-crs.");
    }

}
