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

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.tripwire.testing.ManualScheduledExecutorService;

class MetricCollectingCircuitBreakerListenerTest {

    private final MeterRegistry registry = new SimpleMeterRegistry();

    private double gauge(String circuitBreakerName) {
        return registry.get("tripwire.circuit.breaker.state").tag("name", circuitBreakerName).gauge().value();
    }

    private double counter(String meterName, String circuitBreakerName, String... tags) {
        return registry.get(meterName).tag("name", circuitBreakerName).tags(tags).counter().count();
    }

    @Test
    void stateAndRequests() {
        final ManualScheduledExecutorService scheduler = new ManualScheduledExecutorService();
        final CircuitBreaker circuitBreaker =
                CircuitBreaker.builder("foo")
                              .volumeThreshold(3)
                              .resetTimeoutMillis(1000)
                              .scheduler(scheduler)
                              .listener(CircuitBreakerListener.metricCollecting(registry))
                              .build();

        assertThat(gauge("foo")).isEqualTo(1.0);
        assertThat(counter("tripwire.circuit.breaker.transitions", "foo", "state", "CLOSED")).isEqualTo(1.0);

        circuitBreaker.recordInvocation();
        circuitBreaker.recordSuccess(10);
        circuitBreaker.recordInvocation();
        circuitBreaker.recordFailure(10);
        circuitBreaker.recordInvocation();
        circuitBreaker.recordTimeout(20);
        assertThat(gauge("foo")).isEqualTo(0.0);
        assertThat(counter("tripwire.circuit.breaker.requests", "foo", "result", "success")).isEqualTo(1.0);
        assertThat(counter("tripwire.circuit.breaker.requests", "foo", "result", "failure")).isEqualTo(2.0);
        assertThat(counter("tripwire.circuit.breaker.requests", "foo", "result", "timeout")).isEqualTo(1.0);
        assertThat(counter("tripwire.circuit.breaker.transitions", "foo", "state", "OPEN")).isEqualTo(1.0);

        circuitBreaker.recordRejection();
        assertThat(counter("tripwire.circuit.breaker.rejected.requests", "foo")).isEqualTo(1.0);

        scheduler.advance(Duration.ofSeconds(1));
        assertThat(gauge("foo")).isEqualTo(0.5);

        circuitBreaker.shutdown();
        assertThat(gauge("foo")).isEqualTo(-1.0);
        assertThat(counter("tripwire.circuit.breaker.transitions", "foo", "state", "SHUTDOWN")).isEqualTo(1.0);
    }

    @Test
    void customMeterNameAndSharedListener() {
        final ManualScheduledExecutorService scheduler = new ManualScheduledExecutorService();
        final CircuitBreakerListener listener = CircuitBreakerListener.metricCollecting(registry, "my.cb");
        final CircuitBreaker a = CircuitBreaker.builder("a").scheduler(scheduler).listener(listener).build();
        final CircuitBreaker b = CircuitBreaker.builder("b").scheduler(scheduler).listener(listener).build();

        a.open();
        assertThat(registry.get("my.cb.state").tag("name", "a").gauge().value()).isEqualTo(0.0);
        assertThat(registry.get("my.cb.state").tag("name", "b").gauge().value()).isEqualTo(1.0);
        assertThat(b.circuitState()).isEqualTo(CircuitState.CLOSED);
    }
}
