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

import org.slf4j.Logger;

/**
 * A {@link CircuitBreakerListener} which logs the events of a {@link CircuitBreaker}.
 *
 * @see CircuitBreakerListener#logging(Logger)
 */
final class LoggingCircuitBreakerListener implements CircuitBreakerListener {

    private final Logger logger;

    LoggingCircuitBreakerListener(Logger logger) {
        this.logger = requireNonNull(logger, "logger");
    }

    @Override
    public void onInitialized(String circuitBreakerName, CircuitState initialState) {
        logger.debug("[{}] Circuit breaker initialized: {}", circuitBreakerName, initialState);
    }

    @Override
    public void onStateChanged(String circuitBreakerName, CircuitState state) {
        switch (state) {
            case OPEN:
                logger.warn("[{}] Circuit breaker opened", circuitBreakerName);
                break;
            case HALF_OPEN:
                logger.info("[{}] Circuit breaker reset timeout: moving to half-open", circuitBreakerName);
                break;
            case CLOSED:
                logger.info("[{}] Circuit breaker closed", circuitBreakerName);
                break;
            case SHUTDOWN:
                logger.info("[{}] Circuit breaker shut down", circuitBreakerName);
                break;
            default:
                throw new Error("unknown circuit state: " + state);
        }
    }

    @Override
    public void onRequestRejected(String circuitBreakerName) {
        logger.warn("[{}] Circuit is open; request rejected", circuitBreakerName);
    }

    @Override
    public void onSuccess(String circuitBreakerName, long latencyMillis) {
        logger.debug("[{}] Request succeeded: latency={}ms", circuitBreakerName, latencyMillis);
    }

    @Override
    public void onFailure(String circuitBreakerName, long latencyMillis) {
        logger.warn("[{}] Circuit breaker failure: latency={}ms", circuitBreakerName, latencyMillis);
    }

    @Override
    public void onTimeout(String circuitBreakerName, long latencyMillis) {
        logger.warn("[{}] Request timed out: latency={}ms", circuitBreakerName, latencyMillis);
    }
}
