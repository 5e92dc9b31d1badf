package com.conveyal.proximity.results;

import com.conveyal.proximity.aggregate.ScopeResult;
import com.conveyal.proximity.pipeline.RunReport;
import com.conveyal.proximity.util.JsonUtilities;

import java.io.File;
import java.io.IOException;

/** Writes scope results and run reports as indented JSON. */
public abstract class ResultJsonWriter {

    public static void writeScope (ScopeResult result, File file) throws IOException {
        JsonUtilities.objectMapper.writeValue(file, result);
    }

    public static void writeReport (RunReport report, File file) throws IOException {
        JsonUtilities.objectMapper.writeValue(file, report);
    }

}
