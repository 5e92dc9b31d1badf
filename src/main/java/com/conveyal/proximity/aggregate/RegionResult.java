package com.conveyal.proximity.aggregate;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A ScopeResult summed over several scopes, listing the scopes that contributed to it. */
@JsonPropertyOrder({"id", "members", "cells", "population", "thresholds", "bands", "accessGap"})
public class RegionResult extends ScopeResult {

    public final List<String> members;

    public RegionResult (ScopeResult sum, List<String> members) {
        super(sum.id, null, sum.cells, sum.population, new ArrayList<>(sum.thresholds.values()),
                new ArrayList<>(sum.bands.values()), sum.accessGap);
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
    }

}
