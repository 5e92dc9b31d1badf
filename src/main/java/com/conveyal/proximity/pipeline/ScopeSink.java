package com.conveyal.proximity.pipeline;

import com.conveyal.proximity.aggregate.ScopeResult;
import com.conveyal.proximity.classify.CellRecord;
import com.conveyal.proximity.grid.BlockGrid;

import java.util.List;

/**
 * Receives the products of each completed scope in the emit stage. Called from worker threads, once per scope, so
 * implementations must be threadsafe.
 */
public interface ScopeSink {

    /**
     * @param blocks null unless block aggregation is enabled.
     */
    void emit (ScopeResult result, List<CellRecord> cells, BlockGrid blocks);

    ScopeSink NONE = (result, cells, blocks) -> { };

}
