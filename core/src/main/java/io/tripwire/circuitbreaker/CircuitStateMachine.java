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

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;

import io.tripwire.circuitbreaker.CircuitTransitions.Effect;
import io.tripwire.circuitbreaker.CircuitTransitions.Transition;
import io.tripwire.common.annotation.Nullable;

/**
 * The default {@link CircuitBreaker} implementation. It owns a {@link RollingWindowStats}, the reset timer
 * and the warm-up timer, and changes its {@link CircuitState} according to {@link CircuitTransitions}.
 *
 * <p>Every mutation, including the timer callbacks, happens while holding a single lock, so the outcomes
 * are applied one after another in the order they are observed. The lock is always acquired before the
 * monitor of the {@link RollingWindowStats}.
 */
final class CircuitStateMachine implements CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitStateMachine.class);

    private static final AtomicLong seqNo = new AtomicLong(0);

    private final String name;

    private final CircuitBreakerConfig config;

    private final RollingWindowStats stats;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock.
    private CircuitState state = CircuitState.CLOSED;

    @Nullable
    private ScheduledFuture<?> resetTimer;

    /**
     * Incremented whenever the reset timer is started or cancelled, so that a timer which fires
     * after it has been superseded is ignored.
     */
    private long resetTimerGeneration;

    @Nullable
    private ScheduledFuture<?> warmUpTimer;

    private boolean warmUpActive;

    CircuitStateMachine(CircuitBreakerConfig config) {
        this.config = requireNonNull(config, "config");
        final String name = config.name();
        this.name = name != null ? name : "circuit-breaker-" + seqNo.getAndIncrement();
        stats = RollingWindowStats.builder()
                                  .bucketCount(config.bucketCount())
                                  .windowDuration(config.windowDuration())
                                  .percentilesEnabled(config.percentilesEnabled())
                                  .percentiles(config.percentiles())
                                  .rotationTrigger(lockingRotationTrigger(config.rotationTrigger()))
                                  .build();

        lock.lock();
        try {
            if (config.allowWarmUp()) {
                warmUpActive = true;
                warmUpTimer = config.scheduler().schedule(this::onWarmUpTimeout,
                                                          config.windowDuration().toNanos(),
                                                          TimeUnit.NANOSECONDS);
            }
            logStateTransition(CircuitState.CLOSED, null);
            notifyInitialized();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a {@link RotationTrigger} which rotates the window while holding {@link #lock}, so that a rotation
     * never lands between an increment and the decision which reads it.
     */
    private RotationTrigger lockingRotationTrigger(RotationTrigger delegate) {
        return (bucketDuration, rotation) -> delegate.subscribe(bucketDuration, () -> {
            lock.lock();
            try {
                rotation.run();
            } finally {
                lock.unlock();
            }
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CircuitState circuitState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AggregateStats stats() {
        lock.lock();
        try {
            return stats.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isWarmingUp() {
        lock.lock();
        try {
            return warmUpActive;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitState recordInvocation() {
        lock.lock();
        try {
            stats.increment(StatsCounter.INVOCATIONS);
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordRejection() {
        lock.lock();
        try {
            notifyRequestRejected();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess(long latencyMillis) {
        lock.lock();
        try {
            increment(StatsCounter.SUCCESSES, latencyMillis);
            notifySuccess(latencyMillis);
            apply(CircuitEvent.SUCCESS, null);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(long latencyMillis) {
        lock.lock();
        try {
            increment(StatsCounter.FAILURES, latencyMillis);
            onFailure(latencyMillis, false);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordTimeout(long latencyMillis) {
        lock.lock();
        try {
            // The latency sample is kept once, in the timeout count.
            increment(StatsCounter.TIMEOUTS, latencyMillis);
            stats.increment(StatsCounter.FAILURES);
            onFailure(latencyMillis, true);
        } finally {
            lock.unlock();
        }
    }

    private void increment(StatsCounter counter, long latencyMillis) {
        if (latencyMillis >= 0) {
            stats.increment(counter, latencyMillis);
        } else {
            stats.increment(counter);
        }
    }

    private void onFailure(long latencyMillis, boolean timedOut) {
        // Decided before the listeners run, so that the failure which has just been counted is part of it.
        CircuitEvent event = null;
        AggregateStats snapshot = null;
        // Warm-up absorbs every failure, including the one of a trial request in HALF_OPEN.
        if (!warmUpActive) {
            if (state != CircuitState.CLOSED) {
                // HALF_OPEN reopens on any failure. OPEN and SHUTDOWN ignore failures.
                event = CircuitEvent.FAILURE;
            } else {
                snapshot = stats.snapshot();
                if (snapshot.invocations() >= config.volumeThreshold()) {
                    final double errorRate = (double) snapshot.failures() / snapshot.invocations() * 100;
                    if (errorRate > config.errorThresholdPercentage()) {
                        event = CircuitEvent.FAILURE_OVER_THRESHOLD;
                    }
                }
            }
        }

        if (timedOut) {
            notifyTimeout(latencyMillis);
        }
        notifyFailure(latencyMillis);
        if (event != null) {
            apply(event, snapshot);
        }
    }

    @Override
    public void open() {
        lock.lock();
        try {
            apply(CircuitEvent.OPEN_REQUESTED, null);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            apply(CircuitEvent.CLOSE_REQUESTED, null);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void shutdown() {
        lock.lock();
        try {
            apply(CircuitEvent.SHUTDOWN_REQUESTED, null);
        } finally {
            lock.unlock();
        }
    }

    private void onResetTimeout(long generation) {
        lock.lock();
        try {
            if (generation != resetTimerGeneration) {
                return;
            }
            resetTimer = null;
            apply(CircuitEvent.RESET_TIMEOUT, null);
        } finally {
            lock.unlock();
        }
    }

    private void onWarmUpTimeout() {
        lock.lock();
        try {
            warmUpTimer = null;
            if (warmUpActive) {
                warmUpActive = false;
                logger.debug("name:{} warm-up finished", name);
            }
        } finally {
            lock.unlock();
        }
    }

    private Transition apply(CircuitEvent event, @Nullable AggregateStats snapshot) {
        final Transition transition = CircuitTransitions.apply(state, event);
        state = transition.to();

        for (Effect effect : transition.effects()) {
            switch (effect) {
                case START_RESET_TIMER:
                    startResetTimer();
                    break;
                case CANCEL_RESET_TIMER:
                    cancelResetTimer();
                    break;
                case MARK_WINDOW_OPEN:
                    stats.markOpen();
                    break;
                case MARK_WINDOW_CLOSED:
                    stats.markClose();
                    break;
                case CANCEL_WARM_UP_TIMER:
                    cancelWarmUpTimer();
                    break;
                case STOP_ROTATION:
                    stats.shutdown();
                    break;
                default:
                    throw new Error("unknown effect: " + effect);
            }
        }

        if (transition.isStateChanged()) {
            logStateTransition(transition.to(), snapshot);
            notifyStateChanged(transition.to());
        }
        return transition;
    }

    private void startResetTimer() {
        cancelResetTimer();
        final long generation = resetTimerGeneration;
        try {
            resetTimer = config.scheduler().schedule(() -> onResetTimeout(generation),
                                                     config.resetTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("name:{} failed to schedule the reset timer; the circuit stays open until closed " +
                        "explicitly", name, e);
        }
    }

    private void cancelResetTimer() {
        resetTimerGeneration++;
        if (resetTimer != null) {
            resetTimer.cancel(false);
            resetTimer = null;
        }
    }

    private void cancelWarmUpTimer() {
        if (warmUpTimer != null) {
            warmUpTimer.cancel(false);
            warmUpTimer = null;
        }
    }

    private void logStateTransition(CircuitState circuitState, @Nullable AggregateStats snapshot) {
        if (circuitState == CircuitState.OPEN ? logger.isWarnEnabled() : logger.isInfoEnabled()) {
            final int capacity = name.length() + circuitState.name().length() + 32;
            final StringBuilder builder = new StringBuilder(capacity);
            builder.append("name:");
            builder.append(name);
            builder.append(" state:");
            builder.append(circuitState.name());
            if (snapshot != null) {
                builder.append(" fail:");
                builder.append(snapshot.failures());
                builder.append(" total:");
                builder.append(snapshot.invocations());
            }
            if (circuitState == CircuitState.OPEN) {
                logger.warn(builder.toString());
            } else {
                logger.info(builder.toString());
            }
        }
    }

    private void notifyInitialized() {
        config.listeners().forEach(listener -> {
            try {
                listener.onInitialized(name, CircuitState.CLOSED);
            } catch (Throwable t) {
                logger.warn("An error occurred when notifying an Initialized event", t);
            }
        });
    }

    private void notifyStateChanged(CircuitState circuitState) {
        config.listeners().forEach(listener -> {
            try {
                listener.onStateChanged(name, circuitState);
            } catch (Throwable t) {
                logger.warn("An error occurred when notifying a StateChanged event", t);
            }
        });
    }

    private void notifyRequestRejected() {
        config.listeners().forEach(listener -> {
            try {
                listener.onRequestRejected(name);
            } catch (Throwable t) {
                logger.warn("An error occurred when notifying a RequestRejected event", t);
            }
        });
    }

    private void notifySuccess(long latencyMillis) {
        config.listeners().forEach(listener -> {
            try {
                listener.onSuccess(name, latencyMillis);
            } catch (Throwable t) {
                logger.warn("An error occurred when notifying a Success event", t);
            }
        });
    }

    private void notifyFailure(long latencyMillis) {
        config.listeners().forEach(listener -> {
            try {
                listener.onFailure(name, latencyMillis);
            } catch (Throwable t) {
                logger.warn("An error occurred when notifying a Failure event", t);
            }
        });
    }

    private void notifyTimeout(long latencyMillis) {
        config.listeners().forEach(listener -> {
            try {
                listener.onTimeout(name, latencyMillis);
            } catch (Throwable t) {
                logger.warn("An error occurred when notifying a Timeout event", t);
            }
        });
    }

    @VisibleForTesting
    RollingWindowStats rollingWindowStats() {
        return stats;
    }

    @VisibleForTesting
    CircuitBreakerConfig config() {
        return config;
    }

    @VisibleForTesting
    boolean hasPendingResetTimer() {
        lock.lock();
        try {
            return resetTimer != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("name", name)
                          .add("config", config)
                          .toString();
    }
}
