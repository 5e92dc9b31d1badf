package com.conveyal.proximity.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everything the region rollup could not account for. Nothing is dropped from the rollup silently: each scope or
 * region member that did not contribute to a region total is listed here.
 */
@JsonPropertyOrder({"unmappedScopes", "missingMembers", "excludedScopes", "emptyRegions"})
public class AuditReport {

    /** Scopes with results that are not assigned to any region. They count toward the continent total only. */
    public final List<String> unmappedScopes;

    /** For each region, configured members for which there was no scope at all. */
    public final Map<String, List<String>> missingMembers;

    /** Scopes that were analyzed but produced no usable result, with the reason. Excluded from every rollup. */
    public final Map<String, String> excludedScopes;

    /** Regions none of whose members produced a result. */
    public final List<String> emptyRegions;

    public AuditReport (List<String> unmappedScopes, Map<String, List<String>> missingMembers,
                        Map<String, String> excludedScopes, List<String> emptyRegions) {
        this.unmappedScopes = Collections.unmodifiableList(unmappedScopes);
        this.missingMembers = Collections.unmodifiableMap(missingMembers);
        this.excludedScopes = Collections.unmodifiableMap(excludedScopes);
        this.emptyRegions = Collections.unmodifiableList(emptyRegions);
    }

    @JsonIgnore
    public boolean isClean () {
        return unmappedScopes.isEmpty() && missingMembers.isEmpty() && excludedScopes.isEmpty() && emptyRegions.isEmpty();
    }

}
