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

/**
 * A <a href="https://martinfowler.com/bliki/CircuitBreaker.html">circuit breaker</a>, which tracks the
 * outcomes of calls in a rolling window and short-circuits further calls for a while once the failure rate
 * crosses a threshold.
 *
 * <p>The recording methods never throw; they only update the statistics and, when required, the
 * {@link CircuitState}.
 */
public interface CircuitBreaker {

    /**
     * Returns a new {@link CircuitBreakerBuilder}.
     */
    static CircuitBreakerBuilder builder() {
        return new CircuitBreakerBuilder();
    }

    /**
     * Returns a new {@link CircuitBreakerBuilder} that has the specified name.
     *
     * @param name the name of the circuit breaker.
     */
    static CircuitBreakerBuilder builder(String name) {
        return new CircuitBreakerBuilder(name);
    }

    /**
     * Creates a new {@link CircuitBreaker} that has the specified name and the default configurations.
     *
     * @param name the name of the circuit breaker
     */
    static CircuitBreaker of(String name) {
        return builder(name).build();
    }

    /**
     * Creates a new {@link CircuitBreaker} that has a default name and the default configurations.
     */
    static CircuitBreaker ofDefaultName() {
        return builder().build();
    }

    /**
     * Returns the name of the circuit breaker.
     */
    String name();

    /**
     * Returns the current {@link CircuitState}.
     */
    CircuitState circuitState();

    /**
     * Returns a snapshot of the statistics of the rolling window.
     */
    AggregateStats stats();

    /**
     * Returns whether the warm-up period is in progress, during which failures never open the circuit.
     */
    boolean isWarmingUp();

    /**
     * Counts an invocation, whether it will be admitted or not, and returns the {@link CircuitState}
     * observed at that moment.
     */
    CircuitState recordInvocation();

    /**
     * Reports that an invocation was rejected because the circuit is open.
     */
    void recordRejection();

    /**
     * Reports a remote invocation success.
     */
    default void recordSuccess() {
        recordSuccess(-1);
    }

    /**
     * Reports a remote invocation success with its latency.
     *
     * @param latencyMillis the latency in milliseconds, or a negative value if unknown
     */
    void recordSuccess(long latencyMillis);

    /**
     * Reports a remote invocation failure.
     */
    default void recordFailure() {
        recordFailure(-1);
    }

    /**
     * Reports a remote invocation failure with its latency.
     *
     * @param latencyMillis the latency in milliseconds, or a negative value if unknown
     */
    void recordFailure(long latencyMillis);

    /**
     * Reports that a remote invocation did not complete within its deadline. A timeout is counted both as
     * a timeout and as a failure.
     *
     * @param latencyMillis the time elapsed until the deadline, in milliseconds
     */
    void recordTimeout(long latencyMillis);

    /**
     * Opens the circuit, unless it is open already.
     */
    void open();

    /**
     * Closes the circuit, unless it is closed already.
     */
    void close();

    /**
     * Shuts down this circuit breaker. All timers are cancelled, the rolling window stops rotating and
     * no further state transition occurs. Calling this method more than once has no effect.
     */
    void shutdown();
}
