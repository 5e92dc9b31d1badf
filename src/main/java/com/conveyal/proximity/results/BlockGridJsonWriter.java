package com.conveyal.proximity.results;

import com.conveyal.proximity.grid.BlockGrid;
import com.conveyal.proximity.util.JsonUtilities;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.locationtech.jts.geom.Coordinate;

import java.awt.geom.AffineTransform;
import java.io.File;
import java.io.IOException;

/**
 * Writes a block aggregated grid as JSON: metadata describing the grid (CRS, block size, GDAL style geotransform)
 * followed by one entry per block holding data, with the coordinates of the block center.
 */
public abstract class BlockGridJsonWriter {

    public static ObjectNode toJson (String scopeId, BlockGrid blocks) {
        ObjectNode root = JsonUtilities.objectMapper.createObjectNode();
        root.put("scope", scopeId);
        root.put("crs", blocks.geometry.crs);
        root.put("factor", blocks.factor);
        root.put("width", blocks.geometry.width);
        root.put("height", blocks.geometry.height);
        AffineTransform t = blocks.geometry.pixelToWorld();
        ArrayNode geoTransform = root.putArray("geoTransform");
        geoTransform.add(t.getTranslateX()).add(t.getScaleX()).add(t.getShearX())
                .add(t.getTranslateY()).add(t.getShearY()).add(t.getScaleY());
        ArrayNode cells = root.putArray("blocks");
        for (int row = 0; row < blocks.geometry.height; row++) {
            for (int col = 0; col < blocks.geometry.width; col++) {
                if (!blocks.hasData(row, col)) continue;
                Coordinate center = blocks.center(row, col);
                ObjectNode cell = cells.addObject();
                cell.put("row", row);
                cell.put("col", col);
                cell.put("x", center.x);
                cell.put("y", center.y);
                cell.put("urbanPopulation", blocks.urbanPopulation(row, col));
                cell.put("ruralPopulation", blocks.ruralPopulation(row, col));
                cell.put("urbanCells", blocks.urbanCells(row, col));
                cell.put("ruralCells", blocks.ruralCells(row, col));
            }
        }
        return root;
    }

    public static void write (String scopeId, BlockGrid blocks, File file) throws IOException {
        JsonUtilities.objectMapper.writeValue(file, toJson(scopeId, blocks));
    }

}
