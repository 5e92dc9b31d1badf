package com.conveyal.proximity;

import com.conveyal.proximity.boundary.BoundaryResolver;
import com.conveyal.proximity.classify.ClassificationPolicy;
import com.conveyal.proximity.classify.DistanceBands;
import com.conveyal.proximity.error.ConfigurationException;
import com.conveyal.proximity.grid.GridReader;
import com.conveyal.proximity.pipeline.ProximityPipeline;
import com.conveyal.proximity.results.ResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.stream.IntStream;

/** Loads the options of one analysis run and exposes them to the components through their Config interfaces. */
public class AnalysisConfig extends ConfigBase implements
        GridReader.Config,
        BoundaryResolver.Config,
        ProximityPipeline.Config,
        ResultWriter.Config
{

    // CONSTANTS AND STATIC FIELDS

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfig.class);

    public static final double[] DEFAULT_CUMULATIVE_THRESHOLDS =
            IntStream.rangeClosed(1, 100).asDoubleStream().toArray();

    public static final double[] DEFAULT_GAP_THRESHOLDS = {1, 5};

    public static final String DEFAULT_SCOPE_NAME = "all";

    // INSTANCE FIELDS

    // Inputs
    private final File populationRaster;
    private final String rasterBand;
    private final Double noDataValue;
    private final String rasterCrs;
    private final File features;
    private final String featureClassAttribute;
    private final List<String> featureClasses;
    // Null if the whole raster is one scope.
    private final File boundaries;
    private final String boundaryNameAttribute;
    private final String scopeName;
    // Null to use the bundled region definitions.
    private final File regions;

    // Analysis
    private final ClassificationPolicy classificationPolicy;
    private final DistanceBands distanceBands;
    private final double[] cumulativeThresholds;
    private final double[] gapThresholds;
    private final boolean dropModalValue;
    private final boolean clipFeaturesToBoundary;
    private final boolean scaleLongitudeByLatitude;
    private final Integer blockAggregationFactor;
    private final int threads;

    // Output
    private final File outputDirectory;
    private final boolean writeCellDetail;

    // CONSTRUCTORS

    private AnalysisConfig (String filename) {
        this(propsFromFile(filename));
    }

    protected AnalysisConfig (Properties properties) {
        super(properties);
        populationRaster = fileProp("population-raster");
        rasterBand = optionalStrProp("raster-band");
        noDataValue = optionalDoubleProp("no-data-value");
        rasterCrs = optionalStrProp("raster-crs");
        features = fileProp("features");
        featureClassAttribute = optionalStrProp("feature-class-attribute");
        featureClasses = Collections.unmodifiableList(stringListProp("feature-classes"));
        boundaries = hasProp("boundaries") ? fileProp("boundaries") : null;
        boundaryNameAttribute = strProp("boundary-name-attribute", "name");
        scopeName = strProp("scope-name", DEFAULT_SCOPE_NAME);
        regions = hasProp("regions") ? fileProp("regions") : null;

        String policyName = strProp("classification-policy");
        Double densityThreshold = optionalDoubleProp("density-threshold");
        double[] breakpoints = doubleListProp("distance-bands", DistanceBands.DEFAULT_BREAKPOINTS);
        cumulativeThresholds = doubleListProp("cumulative-thresholds", DEFAULT_CUMULATIVE_THRESHOLDS);
        gapThresholds = doubleListProp("gap-thresholds", DEFAULT_GAP_THRESHOLDS);
        dropModalValue = boolProp("drop-modal-value", false);
        clipFeaturesToBoundary = boolProp("clip-features-to-boundary", false);
        scaleLongitudeByLatitude = boolProp("scale-longitude-by-latitude", false);
        int factor = intProp("block-aggregation-factor", 0);
        threads = intProp("threads", Runtime.getRuntime().availableProcessors());

        outputDirectory = fileProp("output-directory");
        writeCellDetail = boolProp("write-cell-detail", false);
        throwIfErrors();

        // Options that are individually well formed but do not fit together.
        classificationPolicy = ClassificationPolicy.forName(policyName, densityThreshold);
        distanceBands = new DistanceBands(breakpoints);
        DistanceBands.checkAscending(cumulativeThresholds, "Cumulative thresholds");
        for (double km : gapThresholds) {
            if (Arrays.binarySearch(cumulativeThresholds, km) < 0) {
                throw new ConfigurationException("Gap threshold " + DistanceBands.formatKm(km) +
                        " km is not one of the cumulative thresholds.");
            }
        }
        if (!featureClasses.isEmpty() && featureClassAttribute == null) {
            throw new ConfigurationException("feature-classes was given without feature-class-attribute.");
        }
        if (hasProp("block-aggregation-factor") && factor < 2) {
            throw new ConfigurationException("block-aggregation-factor must be at least 2, was " + factor);
        }
        blockAggregationFactor = factor >= 2 ? factor : null;
        if (threads < 1) {
            throw new ConfigurationException("threads must be positive, was " + threads);
        }
        LOG.info("Classification policy {}, distance bands {}, {} cumulative thresholds.",
                classificationPolicy.name(), Arrays.toString(breakpoints), cumulativeThresholds.length);
    }

    private File fileProp (String key) {
        String path = strProp(key);
        return path == null ? null : new File(path);
    }

    // INTERFACE IMPLEMENTATIONS
    // Note that one method can implement several Config interfaces at once.

    @Override public Double               noDataValue()              { return noDataValue; }
    @Override public String               rasterCrs()                { return rasterCrs; }
    @Override public String               rasterBand()               { return rasterBand; }
    @Override public String               boundaryNameAttribute()    { return boundaryNameAttribute; }
    @Override public ClassificationPolicy classificationPolicy()     { return classificationPolicy; }
    @Override public DistanceBands        distanceBands()            { return distanceBands; }
    @Override public boolean              dropModalValue()           { return dropModalValue; }
    @Override public double[]             cumulativeThresholds()     { return cumulativeThresholds.clone(); }
    @Override public double[]             gapThresholds()            { return gapThresholds.clone(); }
    @Override public int                  threads()                  { return threads; }
    @Override public String               featureClassAttribute()    { return featureClassAttribute; }
    @Override public List<String>         featureClasses()           { return featureClasses; }
    @Override public boolean              clipFeaturesToBoundary()   { return clipFeaturesToBoundary; }
    @Override public boolean              scaleLongitudeByLatitude() { return scaleLongitudeByLatitude; }
    @Override public Integer              blockAggregationFactor()   { return blockAggregationFactor; }
    @Override public File                 outputDirectory()          { return outputDirectory; }
    @Override public boolean              writeCellDetail()          { return writeCellDetail; }

    // Input locations, read by ProximityMain.

    public File populationRaster () { return populationRaster; }
    public File features ()         { return features; }
    /** Null if the whole raster is a single scope. */
    public File boundaries ()       { return boundaries; }
    public String scopeName ()      { return scopeName; }
    /** Null to use the bundled region definitions. */
    public File regions ()          { return regions; }

    // STATIC FACTORY METHODS
    // Always use these to construct AnalysisConfig objects for readability.

    public static AnalysisConfig fromFile (String filename) {
        return new AnalysisConfig(filename);
    }

    public static AnalysisConfig fromProperties (Properties properties) {
        return new AnalysisConfig(properties);
    }

}
