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

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;

import io.tripwire.circuitbreaker.CircuitBreaker;
import io.tripwire.common.CommonPools;
import io.tripwire.common.annotation.Nullable;

/**
 * Builds an {@link InvocationGuard} instance using builder pattern.
 *
 * @param <R> the type of the result of a guarded call
 */
public final class InvocationGuardBuilder<R> {

    private static final long DEFAULT_TIMEOUT_MILLIS = 10_000;

    private final CircuitBreaker circuitBreaker;

    private ErrorPredicate<? super R> errorPredicate;

    private long timeoutMillis = DEFAULT_TIMEOUT_MILLIS;

    private boolean logOnly;

    private boolean enabled = true;

    @Nullable
    private Supplier<? extends R> rejectionResult;

    private ScheduledExecutorService scheduler = CommonPools.scheduler();

    private Ticker ticker = Ticker.systemTicker();

    InvocationGuardBuilder(CircuitBreaker circuitBreaker, ErrorPredicate<? super R> defaultErrorPredicate) {
        this.circuitBreaker = requireNonNull(circuitBreaker, "circuitBreaker");
        errorPredicate = requireNonNull(defaultErrorPredicate, "defaultErrorPredicate");
    }

    /**
     * Sets the {@link ErrorPredicate} which classifies the result of a completed call, e.g. to not count
     * {@code 404 Not Found} as a failure. By default, a result with a {@code 4xx} or {@code 5xx} status is
     * a failure.
     */
    public InvocationGuardBuilder<R> errorPredicate(ErrorPredicate<? super R> errorPredicate) {
        this.errorPredicate = requireNonNull(errorPredicate, "errorPredicate");
        return this;
    }

    /**
     * Sets the time a call may take before it is recorded as a timeout. The call itself is not cancelled.
     * Defaults to {@value #DEFAULT_TIMEOUT_MILLIS} milliseconds if unspecified.
     */
    public InvocationGuardBuilder<R> timeout(Duration timeout) {
        requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout: " + timeout + " (expected: > 0)");
        }
        final long timeoutMillis = timeout.toMillis();
        if (timeoutMillis == 0) {
            throw new IllegalArgumentException("timeout: " + timeout + " (expected: >= 1ms)");
        }
        this.timeoutMillis = timeoutMillis;
        return this;
    }

    /**
     * Sets the time a call may take before it is recorded as a timeout, in milliseconds.
     * Defaults to {@value #DEFAULT_TIMEOUT_MILLIS} milliseconds if unspecified.
     */
    public InvocationGuardBuilder<R> timeoutMillis(long timeoutMillis) {
        return timeout(Duration.ofMillis(timeoutMillis));
    }

    /**
     * Disables the timeout, so that a call is recorded only when it completes.
     */
    public InvocationGuardBuilder<R> timeoutDisabled() {
        timeoutMillis = 0;
        return this;
    }

    /**
     * Sets whether an open circuit only logs instead of rejecting calls. Calls are still counted.
     * Disabled by default.
     */
    public InvocationGuardBuilder<R> logOnly(boolean logOnly) {
        this.logOnly = logOnly;
        return this;
    }

    /**
     * Sets whether the guard is enabled. A disabled guard forwards every call without recording anything.
     * Enabled by default.
     */
    public InvocationGuardBuilder<R> enabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    /**
     * Sets the {@link Supplier} of the result returned for a rejected call, e.g. a
     * {@code 503 Service Unavailable} response. If unspecified, a rejected call fails with a
     * {@link CircuitOpenException}.
     */
    public InvocationGuardBuilder<R> rejectionResult(Supplier<? extends R> rejectionResult) {
        this.rejectionResult = requireNonNull(rejectionResult, "rejectionResult");
        return this;
    }

    /**
     * Sets the {@link ScheduledExecutorService} which runs the timeout timers.
     * Defaults to {@link CommonPools#scheduler()}.
     */
    public InvocationGuardBuilder<R> scheduler(ScheduledExecutorService scheduler) {
        this.scheduler = requireNonNull(scheduler, "scheduler");
        return this;
    }

    @VisibleForTesting
    InvocationGuardBuilder<R> ticker(Ticker ticker) {
        this.ticker = requireNonNull(ticker, "ticker");
        return this;
    }

    /**
     * Returns a newly-created {@link InvocationGuard} based on the properties of this builder.
     */
    public InvocationGuard<R> build() {
        return new InvocationGuard<>(circuitBreaker, errorPredicate, timeoutMillis, logOnly, enabled,
                                     rejectionResult, scheduler, ticker);
    }
}
