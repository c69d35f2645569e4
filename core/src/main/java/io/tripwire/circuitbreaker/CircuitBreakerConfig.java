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

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import com.google.common.base.MoreObjects;

import io.tripwire.common.annotation.Nullable;

/**
 * Stores configurations of circuit breaker.
 */
final class CircuitBreakerConfig {

    @Nullable
    private final String name;

    private final double errorThresholdPercentage;

    private final long volumeThreshold;

    private final Duration resetTimeout;

    private final Duration windowDuration;

    private final int bucketCount;

    private final boolean percentilesEnabled;

    private final List<Double> percentiles;

    private final boolean allowWarmUp;

    private final ScheduledExecutorService scheduler;

    private final RotationTrigger rotationTrigger;

    private final List<CircuitBreakerListener> listeners;

    CircuitBreakerConfig(@Nullable String name,
                         double errorThresholdPercentage, long volumeThreshold, Duration resetTimeout,
                         Duration windowDuration, int bucketCount,
                         boolean percentilesEnabled, List<Double> percentiles, boolean allowWarmUp,
                         ScheduledExecutorService scheduler, RotationTrigger rotationTrigger,
                         List<CircuitBreakerListener> listeners) {
        this.name = name;
        this.errorThresholdPercentage = errorThresholdPercentage;
        this.volumeThreshold = volumeThreshold;
        this.resetTimeout = resetTimeout;
        this.windowDuration = windowDuration;
        this.bucketCount = bucketCount;
        this.percentilesEnabled = percentilesEnabled;
        this.percentiles = percentiles;
        this.allowWarmUp = allowWarmUp;
        this.scheduler = scheduler;
        this.rotationTrigger = rotationTrigger;
        this.listeners = listeners;
    }

    @Nullable
    String name() {
        return name;
    }

    double errorThresholdPercentage() {
        return errorThresholdPercentage;
    }

    long volumeThreshold() {
        return volumeThreshold;
    }

    Duration resetTimeout() {
        return resetTimeout;
    }

    Duration windowDuration() {
        return windowDuration;
    }

    int bucketCount() {
        return bucketCount;
    }

    boolean percentilesEnabled() {
        return percentilesEnabled;
    }

    List<Double> percentiles() {
        return percentiles;
    }

    boolean allowWarmUp() {
        return allowWarmUp;
    }

    ScheduledExecutorService scheduler() {
        return scheduler;
    }

    RotationTrigger rotationTrigger() {
        return rotationTrigger;
    }

    List<CircuitBreakerListener> listeners() {
        return listeners;
    }

    @Override
    public String toString() {
        return MoreObjects
                .toStringHelper(this)
                .add("name", name)
                .add("errorThresholdPercentage", errorThresholdPercentage)
                .add("volumeThreshold", volumeThreshold)
                .add("resetTimeout", resetTimeout)
                .add("windowDuration", windowDuration)
                .add("bucketCount", bucketCount)
                .add("percentilesEnabled", percentilesEnabled)
                .add("allowWarmUp", allowWarmUp)
                .toString();
    }
}
