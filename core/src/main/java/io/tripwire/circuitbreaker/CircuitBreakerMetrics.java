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

import static io.tripwire.circuitbreaker.CircuitState.CLOSED;
import static io.tripwire.circuitbreaker.CircuitState.HALF_OPEN;
import static io.tripwire.circuitbreaker.CircuitState.OPEN;
import static io.tripwire.circuitbreaker.CircuitState.SHUTDOWN;
import static java.util.Objects.requireNonNull;

import com.google.common.util.concurrent.AtomicDouble;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Provides {@link CircuitBreaker} stats.
 */
final class CircuitBreakerMetrics {

    private final AtomicDouble state = new AtomicDouble(1);
    private final Counter transitionsToClosed;
    private final Counter transitionsToOpen;
    private final Counter transitionsToHalfOpen;
    private final Counter transitionsToShutdown;
    private final Counter rejectedRequests;
    private final Counter successes;
    private final Counter failures;
    private final Counter timeouts;

    CircuitBreakerMetrics(MeterRegistry parent, String meterName, String circuitBreakerName) {
        requireNonNull(parent, "parent");
        requireNonNull(meterName, "meterName");
        requireNonNull(circuitBreakerName, "circuitBreakerName");
        final Tags tags = Tags.of("name", circuitBreakerName);

        parent.gauge(meterName + ".state", tags, state, AtomicDouble::get);

        final String transitions = meterName + ".transitions";
        transitionsToClosed = parent.counter(transitions, tags.and("state", CLOSED.name()));
        transitionsToOpen = parent.counter(transitions, tags.and("state", OPEN.name()));
        transitionsToHalfOpen = parent.counter(transitions, tags.and("state", HALF_OPEN.name()));
        transitionsToShutdown = parent.counter(transitions, tags.and("state", SHUTDOWN.name()));
        rejectedRequests = parent.counter(meterName + ".rejected.requests", tags);

        final String requests = meterName + ".requests";
        successes = parent.counter(requests, tags.and("result", "success"));
        failures = parent.counter(requests, tags.and("result", "failure"));
        timeouts = parent.counter(requests, tags.and("result", "timeout"));
    }

    void onStateChanged(CircuitState state) {
        switch (state) {
            case CLOSED:
                this.state.set(1);
                transitionsToClosed.increment();
                break;
            case OPEN:
                this.state.set(0);
                transitionsToOpen.increment();
                break;
            case HALF_OPEN:
                this.state.set(0.5);
                transitionsToHalfOpen.increment();
                break;
            case SHUTDOWN:
                this.state.set(-1);
                transitionsToShutdown.increment();
                break;
            default:
                throw new Error("unknown circuit state: " + state);
        }
    }

    void onRequestRejected() {
        rejectedRequests.increment();
    }

    void onSuccess() {
        successes.increment();
    }

    void onFailure() {
        failures.increment();
    }

    void onTimeout() {
        timeouts.increment();
    }
}
