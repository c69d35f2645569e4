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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

import io.tripwire.common.CommonPools;
import io.tripwire.common.annotation.Nullable;

/**
 * Builds a {@link CircuitBreaker} instance using builder pattern.
 */
public final class CircuitBreakerBuilder {

    private static final double DEFAULT_ERROR_THRESHOLD_PERCENTAGE = 50;
    private static final long DEFAULT_VOLUME_THRESHOLD = 0;
    private static final long DEFAULT_RESET_TIMEOUT_MILLIS = 30_000;

    @Nullable
    private final String name;

    private double errorThresholdPercentage = DEFAULT_ERROR_THRESHOLD_PERCENTAGE;

    private long volumeThreshold = DEFAULT_VOLUME_THRESHOLD;

    private Duration resetTimeout = Duration.ofMillis(DEFAULT_RESET_TIMEOUT_MILLIS);

    private Duration windowDuration = Duration.ofMillis(RollingWindowStatsBuilder.DEFAULT_WINDOW_DURATION_MILLIS);

    private int bucketCount = RollingWindowStatsBuilder.DEFAULT_BUCKET_COUNT;

    private boolean percentilesEnabled = true;

    private List<Double> percentiles = RollingWindowStatsBuilder.DEFAULT_PERCENTILES;

    private boolean allowWarmUp;

    private ScheduledExecutorService scheduler = CommonPools.scheduler();

    @Nullable
    private RotationTrigger rotationTrigger;

    private List<CircuitBreakerListener> listeners = Collections.emptyList();

    CircuitBreakerBuilder(String name) {
        requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name: <empty> (expected: a non-empty string)");
        }
        this.name = name;
    }

    CircuitBreakerBuilder() {
        name = null;
    }

    /**
     * Sets the error percentage above which the circuit opens.
     * Defaults to {@value #DEFAULT_ERROR_THRESHOLD_PERCENTAGE} if unspecified.
     *
     * @param errorThresholdPercentage the percentage between 0 and 100 (both inclusive)
     */
    public CircuitBreakerBuilder errorThresholdPercentage(double errorThresholdPercentage) {
        if (errorThresholdPercentage < 0 || 100 < errorThresholdPercentage) {
            throw new IllegalArgumentException(
                    "errorThresholdPercentage: " + errorThresholdPercentage + " (expected: >= 0 and <= 100)");
        }
        this.errorThresholdPercentage = errorThresholdPercentage;
        return this;
    }

    /**
     * Sets the minimum number of invocations within the window before the error rate can open the circuit.
     * Defaults to {@value #DEFAULT_VOLUME_THRESHOLD} if unspecified.
     */
    public CircuitBreakerBuilder volumeThreshold(long volumeThreshold) {
        if (volumeThreshold < 0) {
            throw new IllegalArgumentException(
                    "volumeThreshold: " + volumeThreshold + " (expected: >= 0)");
        }
        this.volumeThreshold = volumeThreshold;
        return this;
    }

    /**
     * Sets the duration of OPEN state, after which the circuit becomes HALF_OPEN.
     * Defaults to {@value #DEFAULT_RESET_TIMEOUT_MILLIS} milliseconds if unspecified.
     */
    public CircuitBreakerBuilder resetTimeout(Duration resetTimeout) {
        requireNonNull(resetTimeout, "resetTimeout");
        if (resetTimeout.isNegative() || resetTimeout.isZero()) {
            throw new IllegalArgumentException("resetTimeout: " + resetTimeout + " (expected: > 0)");
        }
        this.resetTimeout = resetTimeout;
        return this;
    }

    /**
     * Sets the duration of OPEN state in milliseconds.
     * Defaults to {@value #DEFAULT_RESET_TIMEOUT_MILLIS} milliseconds if unspecified.
     */
    public CircuitBreakerBuilder resetTimeoutMillis(long resetTimeoutMillis) {
        return resetTimeout(Duration.ofMillis(resetTimeoutMillis));
    }

    /**
     * Sets the time span of the rolling window. It is also the length of the warm-up period.
     * Defaults to 10 seconds if unspecified.
     */
    public CircuitBreakerBuilder windowDuration(Duration windowDuration) {
        requireNonNull(windowDuration, "windowDuration");
        if (windowDuration.isNegative() || windowDuration.isZero()) {
            throw new IllegalArgumentException("windowDuration: " + windowDuration + " (expected: > 0)");
        }
        this.windowDuration = windowDuration;
        return this;
    }

    /**
     * Sets the time span of the rolling window in milliseconds.
     * Defaults to 10 seconds if unspecified.
     */
    public CircuitBreakerBuilder windowDurationMillis(long windowDurationMillis) {
        return windowDuration(Duration.ofMillis(windowDurationMillis));
    }

    /**
     * Sets the number of buckets the rolling window is divided into.
     * Defaults to 10 if unspecified.
     */
    public CircuitBreakerBuilder bucketCount(int bucketCount) {
        if (bucketCount <= 0) {
            throw new IllegalArgumentException("bucketCount: " + bucketCount + " (expected: > 0)");
        }
        this.bucketCount = bucketCount;
        return this;
    }

    /**
     * Sets whether the latency percentiles are calculated. Enabled by default.
     */
    public CircuitBreakerBuilder percentilesEnabled(boolean percentilesEnabled) {
        this.percentilesEnabled = percentilesEnabled;
        return this;
    }

    /**
     * Sets the latency percentiles to report, each between {@code 0.0} and {@code 1.0} inclusive.
     */
    public CircuitBreakerBuilder percentiles(double... percentiles) {
        requireNonNull(percentiles, "percentiles");
        for (double p : percentiles) {
            if (p < 0 || 1 < p) {
                throw new IllegalArgumentException("percentile: " + p + " (expected: >= 0 and <= 1)");
            }
        }
        this.percentiles = ImmutableList.copyOf(Doubles.asList(percentiles));
        return this;
    }

    /**
     * Sets whether failures are ignored for the first window duration after the circuit breaker is
     * created, so that a failing first call does not open the circuit at once. Disabled by default.
     */
    public CircuitBreakerBuilder allowWarmUp(boolean allowWarmUp) {
        this.allowWarmUp = allowWarmUp;
        return this;
    }

    /**
     * Sets the {@link ScheduledExecutorService} which runs the reset and warm-up timers, and the bucket
     * rotation unless {@link #rotationTrigger(RotationTrigger)} is specified.
     * Defaults to {@link CommonPools#scheduler()}.
     */
    public CircuitBreakerBuilder scheduler(ScheduledExecutorService scheduler) {
        this.scheduler = requireNonNull(scheduler, "scheduler");
        return this;
    }

    /**
     * Sets the {@link RotationTrigger} which rotates the buckets of the rolling window, e.g. a
     * {@link SharedRotationTrigger} shared by many circuit breakers.
     */
    public CircuitBreakerBuilder rotationTrigger(RotationTrigger rotationTrigger) {
        this.rotationTrigger = requireNonNull(rotationTrigger, "rotationTrigger");
        return this;
    }

    /**
     * Adds a {@link CircuitBreakerListener}.
     */
    public CircuitBreakerBuilder listener(CircuitBreakerListener listener) {
        requireNonNull(listener, "listener");
        if (listeners.isEmpty()) {
            listeners = new ArrayList<>(3);
        }
        listeners.add(listener);
        return this;
    }

    /**
     * Returns a newly-created {@link CircuitBreaker} based on the properties of this builder.
     */
    public CircuitBreaker build() {
        if (windowDuration.dividedBy(bucketCount).toMillis() < 1) {
            throw new IllegalStateException(
                    "windowDuration: " + windowDuration + ", bucketCount: " + bucketCount +
                    " (expected: windowDuration / bucketCount >= 1ms)");
        }
        final RotationTrigger rotationTrigger =
                this.rotationTrigger != null ? this.rotationTrigger : RotationTrigger.ofScheduler(scheduler);
        return new CircuitStateMachine(
                new CircuitBreakerConfig(name, errorThresholdPercentage, volumeThreshold, resetTimeout,
                                         windowDuration, bucketCount, percentilesEnabled, percentiles,
                                         allowWarmUp, scheduler, rotationTrigger,
                                         ImmutableList.copyOf(listeners)));
    }
}
