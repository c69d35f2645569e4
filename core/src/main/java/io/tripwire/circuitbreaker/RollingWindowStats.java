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

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import io.tripwire.circuitbreaker.RotationTrigger.Subscription;
import io.tripwire.common.annotation.Nullable;

/**
 * Accumulates the counts and the latencies of calls within a rolling time window. The window is divided into
 * a fixed number of {@link Bucket}s; every {@code windowDuration / bucketCount}, the oldest bucket is
 * dropped and an empty one becomes the current bucket. All increments land in the current bucket.
 *
 * <p>This class is thread-safe.
 */
public final class RollingWindowStats {

    /**
     * Returns a new {@link RollingWindowStatsBuilder}.
     */
    public static RollingWindowStatsBuilder builder() {
        return new RollingWindowStatsBuilder();
    }

    /**
     * Returns the latency at the specified percentile using the nearest-rank method.
     *
     * @param sortedSamples the samples in ascending order
     */
    static long percentile(double percentile, List<Long> sortedSamples) {
        final int size = sortedSamples.size();
        if (size == 0) {
            return 0;
        }
        if (percentile <= 0) {
            return sortedSamples.get(0);
        }
        if (percentile >= 1) {
            return sortedSamples.get(size - 1);
        }
        final int index = (int) Math.ceil(percentile * size) - 1;
        return sortedSamples.get(Math.max(index, 0));
    }

    private final int bucketCount;
    private final Duration windowDuration;
    private final boolean percentilesEnabled;
    private final List<Double> percentiles;

    /**
     * The buckets of the window. The current bucket is the first element.
     */
    private final Deque<Bucket> buckets;

    @Nullable
    private Subscription rotation;

    RollingWindowStats(int bucketCount, Duration windowDuration, boolean percentilesEnabled,
                       List<Double> percentiles, RotationTrigger rotationTrigger) {
        this.bucketCount = bucketCount;
        this.windowDuration = requireNonNull(windowDuration, "windowDuration");
        this.percentilesEnabled = percentilesEnabled;
        this.percentiles = ImmutableList.copyOf(requireNonNull(percentiles, "percentiles"));
        requireNonNull(rotationTrigger, "rotationTrigger");

        buckets = new ArrayDeque<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            buckets.add(new Bucket());
        }

        final Subscription subscription = rotationTrigger.subscribe(bucketDuration(), this::rotate);
        synchronized (this) {
            rotation = subscription;
        }
    }

    /**
     * Returns the number of buckets in the window.
     */
    public int bucketCount() {
        return bucketCount;
    }

    /**
     * Returns the time span of the whole window.
     */
    public Duration windowDuration() {
        return windowDuration;
    }

    /**
     * Returns the time span of one bucket.
     */
    public Duration bucketDuration() {
        return windowDuration.dividedBy(bucketCount);
    }

    /**
     * Returns whether the latency percentiles are calculated by {@link #snapshot()}.
     */
    public boolean percentilesEnabled() {
        return percentilesEnabled;
    }

    /**
     * Increments the specified counter of the current bucket.
     */
    public synchronized void increment(StatsCounter counter) {
        requireNonNull(counter, "counter");
        buckets.getFirst().increment(counter);
    }

    /**
     * Increments the specified counter of the current bucket and records the latency sample.
     */
    public synchronized void increment(StatsCounter counter, long latencyMillis) {
        requireNonNull(counter, "counter");
        final Bucket current = buckets.getFirst();
        current.increment(counter);
        current.addLatencySample(latencyMillis);
    }

    /**
     * Marks the current bucket as having the circuit open.
     */
    public synchronized void markOpen() {
        buckets.getFirst().setBreakerOpen(true);
    }

    /**
     * Marks the current bucket as having the circuit closed.
     */
    public synchronized void markClose() {
        buckets.getFirst().setBreakerOpen(false);
    }

    /**
     * Drops the oldest bucket and installs a new current bucket. Does nothing after {@link #shutdown()}.
     */
    synchronized void rotate() {
        if (rotation == null) {
            return;
        }
        buckets.removeLast();
        buckets.addFirst(new Bucket());
    }

    /**
     * Sums up all buckets of the window.
     */
    public synchronized AggregateStats snapshot() {
        long invocations = 0;
        long successes = 0;
        long failures = 0;
        long timeouts = 0;
        final List<Long> samples = new ArrayList<>();
        for (Bucket bucket : buckets) {
            invocations += bucket.invocations();
            successes += bucket.successes();
            failures += bucket.failures();
            timeouts += bucket.timeouts();
            samples.addAll(bucket.latencySamples());
        }
        Collections.sort(samples);

        double latencyMean = 0;
        if (!samples.isEmpty()) {
            long sum = 0;
            for (long sample : samples) {
                sum += sample;
            }
            latencyMean = (double) sum / samples.size();
        }

        final SortedMap<Double, Long> percentileValues = new TreeMap<>();
        for (Double p : percentiles) {
            percentileValues.put(p, percentilesEnabled ? percentile(p, samples) : 0L);
        }

        return new AggregateStats(invocations, successes, failures, timeouts, samples, latencyMean,
                                  percentileValues, buckets.getFirst().isBreakerOpen());
    }

    /**
     * Stops rotating the buckets. The statistics collected so far are kept and the current bucket still
     * accepts increments. Calling this method more than once has no effect.
     */
    public void shutdown() {
        final Subscription rotation;
        synchronized (this) {
            rotation = this.rotation;
            this.rotation = null;
        }
        if (rotation != null) {
            rotation.cancel();
        }
    }

    /**
     * Returns whether {@link #shutdown()} has been called.
     */
    public synchronized boolean isShutdown() {
        return rotation == null;
    }

    @VisibleForTesting
    synchronized List<Bucket> buckets() {
        return ImmutableList.copyOf(buckets);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("bucketCount", bucketCount)
                          .add("windowDuration", windowDuration)
                          .add("percentilesEnabled", percentilesEnabled)
                          .toString();
    }
}
