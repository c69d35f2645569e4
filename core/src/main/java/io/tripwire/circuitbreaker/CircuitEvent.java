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
 * The events which may change the {@link CircuitState} of a circuit breaker.
 *
 * @see CircuitTransitions#apply(CircuitState, CircuitEvent)
 */
public enum CircuitEvent {
    /**
     * A call succeeded.
     */
    SUCCESS,
    /**
     * A call failed, but the failure did not pass the open guard (warm-up, volume threshold or
     * error rate).
     */
    FAILURE,
    /**
     * A call failed and the failure rate of the window exceeded the threshold.
     */
    FAILURE_OVER_THRESHOLD,
    /**
     * The reset timeout of an open circuit elapsed.
     */
    RESET_TIMEOUT,
    /**
     * The circuit was opened explicitly.
     */
    OPEN_REQUESTED,
    /**
     * The circuit was closed explicitly.
     */
    CLOSE_REQUESTED,
    /**
     * The circuit breaker was shut down.
     */
    SHUTDOWN_REQUESTED,
}
