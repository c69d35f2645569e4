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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

import io.tripwire.common.CommonPools;
import io.tripwire.common.annotation.Nullable;

/**
 * Builds a {@link RollingWindowStats} instance using builder pattern.
 */
public final class RollingWindowStatsBuilder {

    static final int DEFAULT_BUCKET_COUNT = 10;
    static final long DEFAULT_WINDOW_DURATION_MILLIS = 10_000;
    static final List<Double> DEFAULT_PERCENTILES =
            ImmutableList.of(0.0, 0.25, 0.5, 0.75, 0.9, 0.95, 0.99, 0.995, 1.0);

    private int bucketCount = DEFAULT_BUCKET_COUNT;

    private Duration windowDuration = Duration.ofMillis(DEFAULT_WINDOW_DURATION_MILLIS);

    private boolean percentilesEnabled = true;

    private List<Double> percentiles = DEFAULT_PERCENTILES;

    @Nullable
    private RotationTrigger rotationTrigger;

    RollingWindowStatsBuilder() {}

    /**
     * Sets the number of buckets the window is divided into.
     * Defaults to {@value #DEFAULT_BUCKET_COUNT} if unspecified.
     */
    public RollingWindowStatsBuilder bucketCount(int bucketCount) {
        checkArgument(bucketCount > 0, "bucketCount: %s (expected: > 0)", bucketCount);
        this.bucketCount = bucketCount;
        return this;
    }

    /**
     * Sets the time span of the window.
     * Defaults to {@value #DEFAULT_WINDOW_DURATION_MILLIS} milliseconds if unspecified.
     */
    public RollingWindowStatsBuilder windowDuration(Duration windowDuration) {
        requireNonNull(windowDuration, "windowDuration");
        checkArgument(!windowDuration.isNegative() && !windowDuration.isZero(),
                      "windowDuration: %s (expected: > 0)", windowDuration);
        this.windowDuration = windowDuration;
        return this;
    }

    /**
     * Sets the time span of the window in milliseconds.
     * Defaults to {@value #DEFAULT_WINDOW_DURATION_MILLIS} milliseconds if unspecified.
     */
    public RollingWindowStatsBuilder windowDurationMillis(long windowDurationMillis) {
        return windowDuration(Duration.ofMillis(windowDurationMillis));
    }

    /**
     * Sets whether the latency percentiles are calculated. If disabled, every percentile is reported as
     * {@code 0} while the raw latency samples are still kept. Enabled by default.
     */
    public RollingWindowStatsBuilder percentilesEnabled(boolean percentilesEnabled) {
        this.percentilesEnabled = percentilesEnabled;
        return this;
    }

    /**
     * Sets the percentiles to report, each between {@code 0.0} and {@code 1.0} inclusive.
     * Defaults to {@code 0.0, 0.25, 0.5, 0.75, 0.9, 0.95, 0.99, 0.995, 1.0}.
     */
    public RollingWindowStatsBuilder percentiles(double... percentiles) {
        requireNonNull(percentiles, "percentiles");
        return percentiles(Doubles.asList(percentiles));
    }

    /**
     * Sets the percentiles to report, each between {@code 0.0} and {@code 1.0} inclusive.
     * Defaults to {@code 0.0, 0.25, 0.5, 0.75, 0.9, 0.95, 0.99, 0.995, 1.0}.
     */
    public RollingWindowStatsBuilder percentiles(Iterable<Double> percentiles) {
        requireNonNull(percentiles, "percentiles");
        final List<Double> copy = ImmutableList.copyOf(percentiles);
        for (double p : copy) {
            checkArgument(p >= 0 && p <= 1, "percentile: %s (expected: >= 0 and <= 1)", p);
        }
        this.percentiles = copy;
        return this;
    }

    /**
     * Sets the {@link RotationTrigger} which rotates the buckets. If unspecified, the buckets are rotated by
     * a periodic task on {@link CommonPools#scheduler()}.
     */
    public RollingWindowStatsBuilder rotationTrigger(RotationTrigger rotationTrigger) {
        this.rotationTrigger = requireNonNull(rotationTrigger, "rotationTrigger");
        return this;
    }

    /**
     * Returns a newly-created {@link RollingWindowStats} based on the properties of this builder.
     * The bucket rotation starts immediately.
     */
    public RollingWindowStats build() {
        if (windowDuration.dividedBy(bucketCount).toMillis() < 1) {
            throw new IllegalStateException(
                    "windowDuration: " + windowDuration + ", bucketCount: " + bucketCount +
                    " (expected: windowDuration / bucketCount >= 1ms)");
        }
        final RotationTrigger rotationTrigger =
                this.rotationTrigger != null ? this.rotationTrigger
                                             : RotationTrigger.ofScheduler(CommonPools.scheduler());
        return new RollingWindowStats(bucketCount, windowDuration, percentilesEnabled, percentiles,
                                      rotationTrigger);
    }
}
