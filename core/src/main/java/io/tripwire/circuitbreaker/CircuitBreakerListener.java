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

import static io.tripwire.circuitbreaker.MetricCollectingCircuitBreakerListener.DEFAULT_METER_NAME;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * The listener interface for receiving {@link CircuitBreaker} events. A listener is the sink of the
 * structured events a breaker emits; any exception it raises is logged and ignored.
 */
public interface CircuitBreakerListener {

    /**
     * Returns a new {@link CircuitBreakerListener} that collects metric with the specified
     * {@link MeterRegistry}.
     */
    static CircuitBreakerListener metricCollecting(MeterRegistry registry) {
        return metricCollecting(registry, DEFAULT_METER_NAME);
    }

    /**
     * Returns a new {@link CircuitBreakerListener} that collects metric with the specified
     * {@link MeterRegistry} and {@link Meter} name.
     */
    static CircuitBreakerListener metricCollecting(MeterRegistry registry, String name) {
        return new MetricCollectingCircuitBreakerListener(registry, name);
    }

    /**
     * Returns a new {@link CircuitBreakerListener} that logs every event with the {@link Logger} named after
     * {@link CircuitBreakerListener}.
     */
    static CircuitBreakerListener logging() {
        return logging(LoggerFactory.getLogger(CircuitBreakerListener.class));
    }

    /**
     * Returns a new {@link CircuitBreakerListener} that logs every event with the specified {@link Logger}.
     */
    static CircuitBreakerListener logging(Logger logger) {
        return new LoggingCircuitBreakerListener(logger);
    }

    /**
     * Invoked when the circuit breaker is initialized.
     */
    default void onInitialized(String circuitBreakerName, CircuitState initialState) throws Exception {
        onStateChanged(circuitBreakerName, initialState);
    }

    /**
     * Invoked when the circuit state is changed. {@link CircuitState#HALF_OPEN} means a probe is granted.
     */
    void onStateChanged(String circuitBreakerName, CircuitState state) throws Exception;

    /**
     * Invoked when the circuit breaker rejects a request.
     */
    void onRequestRejected(String circuitBreakerName) throws Exception;

    /**
     * Invoked when a success is recorded.
     *
     * @param latencyMillis the latency of the call, or {@code -1} if unknown
     */
    default void onSuccess(String circuitBreakerName, long latencyMillis) throws Exception {}

    /**
     * Invoked when a failure is recorded, including a timeout.
     *
     * @param latencyMillis the latency of the call, or {@code -1} if unknown
     */
    default void onFailure(String circuitBreakerName, long latencyMillis) throws Exception {}

    /**
     * Invoked when a call did not complete before its deadline. {@link #onFailure(String, long)} follows.
     */
    default void onTimeout(String circuitBreakerName, long latencyMillis) throws Exception {}
}
