package com.conveyal.proximity.aggregate;

import com.conveyal.proximity.classify.UrbanRural;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkState;

/**
 * A population total and, when it is known, its urban and rural parts. The split can be unknown for results read
 * back from files that only recorded totals. An unknown split stays unknown through every sum and difference it
 * takes part in, and is left out of output rather than being reported as zero.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"total", "urban", "rural"})
public final class PopulationSplit {

    public static final PopulationSplit ZERO = known(0, 0);

    // Fixed point, see Population.
    private final long total;
    private final long urban;
    private final long rural;
    private final boolean splitKnown;

    private PopulationSplit (long total, long urban, long rural, boolean splitKnown) {
        this.total = total;
        this.urban = urban;
        this.rural = rural;
        this.splitKnown = splitKnown;
    }

    /** Both parts known. The total is their sum. Arguments are fixed point. */
    public static PopulationSplit known (long urban, long rural) {
        return new PopulationSplit(urban + rural, urban, rural, true);
    }

    /** Only the total is known. Argument is fixed point. */
    public static PopulationSplit totalOnly (long total) {
        return new PopulationSplit(total, 0, 0, false);
    }

    public long total () {
        return total;
    }

    public boolean splitKnown () {
        return splitKnown;
    }

    public long urban () {
        checkState(splitKnown, "Urban population is not known.");
        return urban;
    }

    public long rural () {
        checkState(splitKnown, "Rural population is not known.");
        return rural;
    }

    public long get (UrbanRural urbanRural) {
        return urbanRural == UrbanRural.URBAN ? urban() : rural();
    }

    public PopulationSplit plus (PopulationSplit other) {
        if (splitKnown && other.splitKnown) {
            return known(urban + other.urban, rural + other.rural);
        }
        return totalOnly(total + other.total);
    }

    public PopulationSplit minus (PopulationSplit other) {
        if (splitKnown && other.splitKnown) {
            return known(urban - other.urban, rural - other.rural);
        }
        return totalOnly(total - other.total);
    }

    @JsonProperty("total")
    public double totalPersons () {
        return Population.toPersons(total);
    }

    @JsonProperty("urban")
    public Double urbanPersons () {
        return splitKnown ? Population.toPersons(urban) : null;
    }

    @JsonProperty("rural")
    public Double ruralPersons () {
        return splitKnown ? Population.toPersons(rural) : null;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (!(other instanceof PopulationSplit)) return false;
        PopulationSplit that = (PopulationSplit) other;
        return total == that.total && urban == that.urban && rural == that.rural && splitKnown == that.splitKnown;
    }

    @Override
    public int hashCode () {
        return Objects.hash(total, urban, rural, splitKnown);
    }

    @Override
    public String toString () {
        if (splitKnown) {
            return String.format("%.1f (urban %.1f, rural %.1f)", totalPersons(), urbanPersons(), ruralPersons());
        }
        return String.format("%.1f (split unknown)", totalPersons());
    }

}
