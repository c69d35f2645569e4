/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.tripwire.circuitbreaker;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.SortedMap;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import io.tripwire.common.annotation.Nullable;

/**
 * An immutable snapshot of all buckets of a {@link RollingWindowStats}.
 *
 * @see RollingWindowStats#snapshot()
 */
@JsonPropertyOrder({ "invocations", "successes", "failures", "timeouts",
                     "latencyMean", "percentiles", "latencySamples", "circuitOpen" })
public final class AggregateStats {

    private final long invocations;
    private final long successes;
    private final long failures;
    private final long timeouts;
    private final List<Long> latencySamples;
    private final double latencyMean;
    private final SortedMap<Double, Long> percentiles;
    private final boolean circuitOpen;

    AggregateStats(long invocations, long successes, long failures, long timeouts,
                   List<Long> latencySamples, double latencyMean,
                   SortedMap<Double, Long> percentiles, boolean circuitOpen) {
        this.invocations = invocations;
        this.successes = successes;
        this.failures = failures;
        this.timeouts = timeouts;
        this.latencySamples = ImmutableList.copyOf(requireNonNull(latencySamples, "latencySamples"));
        this.latencyMean = latencyMean;
        this.percentiles = ImmutableSortedMap.copyOfSorted(requireNonNull(percentiles, "percentiles"));
        this.circuitOpen = circuitOpen;
    }

    /**
     * Returns the number of invocations seen within the window, including the rejected ones.
     */
    @JsonProperty
    public long invocations() {
        return invocations;
    }

    /**
     * Returns the number of successful calls within the window.
     */
    @JsonProperty
    public long successes() {
        return successes;
    }

    /**
     * Returns the number of failed calls within the window. Timed-out calls are included.
     */
    @JsonProperty
    public long failures() {
        return failures;
    }

    /**
     * Returns the number of timed-out calls within the window.
     */
    @JsonProperty
    public long timeouts() {
        return timeouts;
    }

    /**
     * Returns all latency samples within the window in ascending order, in milliseconds.
     */
    @JsonProperty
    public List<Long> latencySamples() {
        return latencySamples;
    }

    /**
     * Returns the arithmetic mean of {@link #latencySamples()}, or {@code 0} if there are no samples.
     */
    @JsonProperty
    public double latencyMean() {
        return latencyMean;
    }

    /**
     * Returns the nearest-rank latency percentiles keyed by percentile ({@code 0.0} to {@code 1.0}).
     * Every value is {@code 0} if percentiles are disabled.
     */
    @JsonProperty
    public SortedMap<Double, Long> percentiles() {
        return percentiles;
    }

    /**
     * Returns the latency at the specified percentile.
     *
     * @throws IllegalArgumentException if the percentile was not configured
     */
    public long percentile(double percentile) {
        final Long value = percentiles.get(percentile);
        if (value == null) {
            throw new IllegalArgumentException(
                    "percentile: " + percentile + " (expected: one of " + percentiles.keySet() + ')');
        }
        return value;
    }

    /**
     * Returns whether the circuit was marked open in the current bucket.
     */
    @JsonProperty
    public boolean circuitOpen() {
        return circuitOpen;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateStats)) {
            return false;
        }
        final AggregateStats that = (AggregateStats) o;
        return invocations == that.invocations &&
               successes == that.successes &&
               failures == that.failures &&
               timeouts == that.timeouts &&
               Double.compare(latencyMean, that.latencyMean) == 0 &&
               circuitOpen == that.circuitOpen &&
               latencySamples.equals(that.latencySamples) &&
               percentiles.equals(that.percentiles);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(invocations, successes, failures, timeouts,
                                latencySamples, latencyMean, percentiles, circuitOpen);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("invocations", invocations)
                          .add("successes", successes)
                          .add("failures", failures)
                          .add("timeouts", timeouts)
                          .add("latencyMean", latencyMean)
                          .add("percentiles", percentiles)
                          .add("circuitOpen", circuitOpen)
                          .toString();
    }
}
