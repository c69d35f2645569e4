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

/**
 * Failure detection based on the
 * <a href="https://martinfowler.com/bliki/CircuitBreaker.html">circuit breaker pattern</a>.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CircuitBreaker circuitBreaker =
 *     CircuitBreaker.builder("payments")
 *                   .errorThresholdPercentage(50)
 *                   .volumeThreshold(20)
 *                   .resetTimeoutMillis(30000)
 *                   .listener(CircuitBreakerListener.logging())
 *                   .build();
 * }</pre>
 *
 * <h2>Sharing a rotation timer</h2>
 * Every circuit breaker rotates the buckets of its rolling window on its own timer by default. When a process
 * has many breakers, let them share one {@link io.tripwire.circuitbreaker.SharedRotationTrigger}:
 * <pre>{@code
 * SharedRotationTrigger trigger = RotationTrigger.shared(scheduler, Duration.ofSeconds(1));
 * CircuitBreaker a = CircuitBreaker.builder("a").rotationTrigger(trigger).build();
 * CircuitBreaker b = CircuitBreaker.builder("b").rotationTrigger(trigger).build();
 * }</pre>
 */
@NonNullByDefault
package io.tripwire.circuitbreaker;

import io.tripwire.common.annotation.NonNullByDefault;
