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
 * Defines the states of <a href="https://martinfowler.com/bliki/CircuitBreaker.html">circuit breaker</a>.
 */
public enum CircuitState {
    /**
     * Initial state. All requests are sent to the remote service.
     */
    CLOSED,
    /**
     * The circuit is tripped. All requests fail immediately without calling the remote service,
     * until the reset timeout elapses.
     */
    OPEN,
    /**
     * The reset timeout has elapsed and requests are let through to probe the remote service.
     * The next success closes the circuit and the next failure opens it again.
     */
    HALF_OPEN,
    /**
     * The circuit breaker has been shut down. No state transition occurs from this state and
     * requests are not guarded anymore.
     */
    SHUTDOWN,
}
