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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * A {@link CircuitBreakerListener} which exports the status of {@link CircuitBreaker}s to
 * {@link MeterRegistry}.
 *
 * @see CircuitBreakerListener#metricCollecting(MeterRegistry)
 * @see CircuitBreakerListener#metricCollecting(MeterRegistry, String)
 */
final class MetricCollectingCircuitBreakerListener implements CircuitBreakerListener {

    static final String DEFAULT_METER_NAME = "tripwire.circuit.breaker";

    private final MeterRegistry registry;
    private final String name;
    private final ConcurrentMap<String, CircuitBreakerMetrics> metrics = new ConcurrentHashMap<>();

    /**
     * Creates a new instance with the specified {@link Meter} name.
     */
    MetricCollectingCircuitBreakerListener(MeterRegistry registry, String name) {
        this.registry = requireNonNull(registry, "registry");
        this.name = requireNonNull(name, "name");
    }

    @Override
    public void onStateChanged(String circuitBreakerName, CircuitState state) {
        metricsOf(circuitBreakerName).onStateChanged(state);
    }

    @Override
    public void onRequestRejected(String circuitBreakerName) {
        metricsOf(circuitBreakerName).onRequestRejected();
    }

    @Override
    public void onSuccess(String circuitBreakerName, long latencyMillis) {
        metricsOf(circuitBreakerName).onSuccess();
    }

    @Override
    public void onFailure(String circuitBreakerName, long latencyMillis) {
        metricsOf(circuitBreakerName).onFailure();
    }

    @Override
    public void onTimeout(String circuitBreakerName, long latencyMillis) {
        metricsOf(circuitBreakerName).onTimeout();
    }

    private CircuitBreakerMetrics metricsOf(String circuitBreakerName) {
        return metrics.computeIfAbsent(circuitBreakerName,
                                       cbName -> new CircuitBreakerMetrics(registry, name, cbName));
    }
}
