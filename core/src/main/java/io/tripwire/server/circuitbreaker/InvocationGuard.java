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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Ticker;

import io.tripwire.circuitbreaker.CircuitBreaker;
import io.tripwire.circuitbreaker.CircuitState;
import io.tripwire.common.HttpStatus;
import io.tripwire.common.annotation.Nullable;

/**
 * Guards the calls to a downstream service with a {@link CircuitBreaker}. Each call is counted, rejected
 * while the circuit is open, watched by a deadline timer, and its outcome is reported to the
 * {@link CircuitBreaker} once.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * InvocationGuard<MyResponse> guard =
 *     InvocationGuard.builder(circuitBreaker, MyResponse::status)
 *                    .timeoutMillis(5000)
 *                    .rejectionResult(() -> MyResponse.of(HttpStatus.SERVICE_UNAVAILABLE))
 *                    .build();
 *
 * CompletableFuture<MyResponse> response = guard.execute(() -> handler.handle(request));
 * }</pre>
 *
 * @param <R> the type of the result of a guarded call
 */
public final class InvocationGuard<R> {

    private static final Logger logger = LoggerFactory.getLogger(InvocationGuard.class);

    /**
     * Returns a new {@link InvocationGuardBuilder} whose results are classified by the {@link HttpStatus}
     * extracted with the specified {@link Function}.
     */
    public static <R> InvocationGuardBuilder<R> builder(CircuitBreaker circuitBreaker,
                                                        Function<? super R, HttpStatus> statusFunction) {
        return new InvocationGuardBuilder<>(circuitBreaker, ErrorPredicate.ofStatus(statusFunction));
    }

    /**
     * Returns a new {@link InvocationGuardBuilder} for the calls which complete with an {@link HttpStatus}.
     */
    public static InvocationGuardBuilder<HttpStatus> builder(CircuitBreaker circuitBreaker) {
        return builder(circuitBreaker, Function.identity());
    }

    private final CircuitBreaker circuitBreaker;
    private final ErrorPredicate<? super R> errorPredicate;
    private final long timeoutMillis;
    private final boolean logOnly;
    private final boolean enabled;
    @Nullable
    private final Supplier<? extends R> rejectionResult;
    private final ScheduledExecutorService scheduler;
    private final Ticker ticker;

    InvocationGuard(CircuitBreaker circuitBreaker, ErrorPredicate<? super R> errorPredicate,
                    long timeoutMillis, boolean logOnly, boolean enabled,
                    @Nullable Supplier<? extends R> rejectionResult,
                    ScheduledExecutorService scheduler, Ticker ticker) {
        this.circuitBreaker = requireNonNull(circuitBreaker, "circuitBreaker");
        this.errorPredicate = requireNonNull(errorPredicate, "errorPredicate");
        this.timeoutMillis = timeoutMillis;
        this.logOnly = logOnly;
        this.enabled = enabled;
        this.rejectionResult = rejectionResult;
        this.scheduler = requireNonNull(scheduler, "scheduler");
        this.ticker = requireNonNull(ticker, "ticker");
    }

    /**
     * Returns the {@link CircuitBreaker} of this guard.
     */
    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    /**
     * Invokes the specified downstream call unless the circuit is open. The returned future completes with
     * the outcome of the downstream call, or with the rejection result if the call was rejected. A rejected
     * call without a rejection result fails with a {@link CircuitOpenException}.
     *
     * <p>A timeout does not affect the returned future; the downstream call is not cancelled.
     */
    public CompletableFuture<R> execute(Supplier<? extends CompletionStage<? extends R>> downstream) {
        requireNonNull(downstream, "downstream");
        if (!enabled) {
            return forward(downstream, null);
        }

        final CircuitState state = circuitBreaker.recordInvocation();
        if (state == CircuitState.OPEN) {
            if (!logOnly) {
                circuitBreaker.recordRejection();
                return reject();
            }
            logger.debug("[{}] Circuit is open; forwarding the request in log-only mode",
                         circuitBreaker.name());
        } else if (state == CircuitState.SHUTDOWN) {
            logger.debug("[{}] Circuit breaker is shut down; forwarding the request",
                         circuitBreaker.name());
        }

        final Invocation invocation = new Invocation(ticker.read());
        invocation.startDeadlineTimer();
        return forward(downstream, invocation);
    }

    private CompletableFuture<R> forward(Supplier<? extends CompletionStage<? extends R>> downstream,
                                         @Nullable Invocation invocation) {
        final CompletableFuture<R> result = new CompletableFuture<>();
        final CompletionStage<? extends R> stage;
        try {
            stage = requireNonNull(downstream.get(), "downstream.get() returned null");
        } catch (Throwable cause) {
            if (invocation != null) {
                invocation.onAbruptTermination(cause);
            }
            result.completeExceptionally(cause);
            return result;
        }

        stage.whenComplete((value, cause) -> {
            if (cause != null) {
                if (invocation != null) {
                    invocation.onAbruptTermination(cause);
                }
                result.completeExceptionally(cause);
            } else {
                if (invocation != null) {
                    invocation.onCompleted(value);
                }
                result.complete(value);
            }
        });
        return result;
    }

    private CompletableFuture<R> reject() {
        final CompletableFuture<R> result = new CompletableFuture<>();
        if (rejectionResult != null) {
            try {
                result.complete(rejectionResult.get());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        } else {
            result.completeExceptionally(new CircuitOpenException(circuitBreaker));
        }
        return result;
    }

    /**
     * The bookkeeping of a single forwarded call. Exactly one of the deadline, the completion and the
     * abrupt termination is reported to the {@link CircuitBreaker}.
     */
    private final class Invocation {

        private final long startNanos;
        private final AtomicBoolean settled = new AtomicBoolean();
        @Nullable
        private volatile ScheduledFuture<?> deadlineTimer;

        Invocation(long startNanos) {
            this.startNanos = startNanos;
        }

        void startDeadlineTimer() {
            if (timeoutMillis <= 0) {
                return;
            }
            try {
                deadlineTimer = scheduler.schedule(this::onDeadline, timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                logger.warn("[{}] Failed to schedule the timeout of a request", circuitBreaker.name(), e);
            }
        }

        private void onDeadline() {
            if (!settled.compareAndSet(false, true)) {
                return;
            }
            final long latencyMillis = elapsedMillis();
            logger.debug("[{}] Request timed out: latency={}ms", circuitBreaker.name(), latencyMillis);
            circuitBreaker.recordTimeout(latencyMillis);
        }

        void onCompleted(@Nullable R value) {
            if (!settle()) {
                return;
            }
            final long latencyMillis = elapsedMillis();
            boolean isError;
            try {
                isError = errorPredicate.isError(value);
            } catch (Throwable t) {
                logger.warn("[{}] Unexpected exception from the error predicate; recording a failure:",
                            circuitBreaker.name(), t);
                isError = true;
            }
            if (isError) {
                circuitBreaker.recordFailure(latencyMillis);
            } else {
                circuitBreaker.recordSuccess(latencyMillis);
            }
        }

        void onAbruptTermination(Throwable cause) {
            if (!settle()) {
                return;
            }
            final long latencyMillis = elapsedMillis();
            logger.debug("[{}] Request closed prematurely: latency={}ms, cause={}",
                         circuitBreaker.name(), latencyMillis, cause.toString());
            circuitBreaker.recordFailure(latencyMillis);
        }

        private boolean settle() {
            if (!settled.compareAndSet(false, true)) {
                return false;
            }
            final ScheduledFuture<?> deadlineTimer = this.deadlineTimer;
            if (deadlineTimer != null) {
                deadlineTimer.cancel(false);
            }
            return true;
        }

        private long elapsedMillis() {
            return TimeUnit.NANOSECONDS.toMillis(ticker.read() - startNanos);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("circuitBreaker", circuitBreaker.name())
                          .add("timeoutMillis", timeoutMillis)
                          .add("logOnly", logOnly)
                          .add("enabled", enabled)
                          .toString();
    }
}
