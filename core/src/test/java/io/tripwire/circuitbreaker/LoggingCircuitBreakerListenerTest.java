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

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import io.tripwire.testing.ManualScheduledExecutorService;

class LoggingCircuitBreakerListenerTest {

    @Test
    void logsTransitionsAndOutcomes() {
        final Logger logger = mock(Logger.class);
        final CircuitBreaker circuitBreaker =
                CircuitBreaker.builder("logged")
                              .scheduler(new ManualScheduledExecutorService())
                              .listener(CircuitBreakerListener.logging(logger))
                              .build();
        verify(logger).debug("[{}] Circuit breaker initialized: {}", "logged", CircuitState.CLOSED);

        circuitBreaker.recordInvocation();
        circuitBreaker.recordSuccess(5);
        verify(logger).debug("[{}] Request succeeded: latency={}ms", "logged", 5L);

        circuitBreaker.recordInvocation();
        circuitBreaker.recordTimeout(40);
        verify(logger).warn("[{}] Request timed out: latency={}ms", "logged", 40L);
        verify(logger).warn("[{}] Circuit breaker failure: latency={}ms", "logged", 40L);
        verify(logger, never()).warn("[{}] Circuit breaker opened", "logged");

        circuitBreaker.recordInvocation();
        circuitBreaker.recordFailure(5);
        verify(logger).warn("[{}] Circuit breaker opened", "logged");

        circuitBreaker.recordRejection();
        verify(logger).warn("[{}] Circuit is open; request rejected", "logged");

        circuitBreaker.close();
        verify(logger).info("[{}] Circuit breaker closed", "logged");
    }
}
