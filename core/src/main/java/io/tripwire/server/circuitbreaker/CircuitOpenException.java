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
package io.tripwire.server.circuitbreaker;

import static java.util.Objects.requireNonNull;

import io.tripwire.circuitbreaker.CircuitBreaker;

/**
 * An exception indicating that a request has been rejected by a circuit breaker without being forwarded,
 * i.e. the protected service is unavailable.
 */
public final class CircuitOpenException extends RuntimeException {

    private static final long serialVersionUID = 4212957263413726853L;

    private final transient CircuitBreaker circuitBreaker;

    /**
     * Creates a new instance with the specified {@link CircuitBreaker}.
     */
    public CircuitOpenException(CircuitBreaker circuitBreaker) {
        super("Service Unavailable (circuit breaker: " +
              requireNonNull(circuitBreaker, "circuitBreaker").name() + ')');
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * Returns the {@link CircuitBreaker} that rejected the request.
     */
    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public Throwable fillInStackTrace() {
        // Rejections are frequent while the circuit is open and the stack trace tells nothing.
        return this;
    }
}
