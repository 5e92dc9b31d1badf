package com.conveyal.proximity.pipeline;

/** Steps of the analysis of one scope, always run in this order. */
public enum Stage {
    LOAD, RASTERIZE, DISTANCE, CLASSIFY, AGGREGATE, EMIT
}
