package com.conveyal.proximity.pipeline;

import com.conveyal.proximity.aggregate.AuditReport;
import com.conveyal.proximity.aggregate.RegionResult;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Everything one run produced above the level of individual scopes, and what became of each scope. */
@JsonPropertyOrder({"policy", "continent", "regions", "outcomes", "audit"})
public class RunReport {

    /** Name of the classification policy the run used. */
    public final String policy;

    /** Null if no scope completed. */
    public final RegionResult continent;

    public final Map<String, RegionResult> regions;

    /** One per scope, in the order the scopes were given. */
    public final List<ScopeOutcome> outcomes;

    public final AuditReport audit;

    public RunReport (String policy, RegionResult continent, Map<String, RegionResult> regions,
                      List<ScopeOutcome> outcomes, AuditReport audit) {
        this.policy = policy;
        this.continent = continent;
        this.regions = Collections.unmodifiableMap(regions);
        this.outcomes = Collections.unmodifiableList(outcomes);
        this.audit = audit;
    }

    public long count (ScopeOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status == status).count();
    }

}
