package com.bubblelevel.core.timing;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of one window of inter-sample arrival deltas. All temporal values are
 * in milliseconds.
 *
 * @param count        number of deltas in the window
 * @param meanMillis   arithmetic mean delta
 * @param stdDevMillis population standard deviation
 * @param minMillis    smallest delta
 * @param maxMillis    largest delta
 */
public record JitterStats(
    @JsonProperty("count")        int    count,
    @JsonProperty("meanMillis")   double meanMillis,
    @JsonProperty("stdDevMillis") double stdDevMillis,
    @JsonProperty("minMillis")    long   minMillis,
    @JsonProperty("maxMillis")    long   maxMillis
) {}
