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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;

import io.tripwire.common.annotation.Nullable;

/**
 * A {@link RotationTrigger} which rotates all of its subscribers at once, so that many
 * {@link RollingWindowStats} can share one timer. The rotation is fired either by calling {@link #rotate()}
 * or by the periodic task started with {@link RotationTrigger#shared(ScheduledExecutorService, Duration)}.
 * The bucket duration requested by each subscriber is ignored.
 */
public final class SharedRotationTrigger implements RotationTrigger, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SharedRotationTrigger.class);

    private final Set<Runnable> subscribers = new CopyOnWriteArraySet<>();

    @Nullable
    private ScheduledFuture<?> periodicTask;

    SharedRotationTrigger() {}

    synchronized void start(ScheduledExecutorService scheduler, Duration period) {
        requireNonNull(scheduler, "scheduler");
        requireNonNull(period, "period");
        checkArgument(!period.isNegative() && !period.isZero(), "period: %s (expected: > 0)", period);
        checkState(periodicTask == null, "started already");
        final long periodNanos = period.toNanos();
        periodicTask = scheduler.scheduleAtFixedRate(this::rotate, periodNanos, periodNanos,
                                                     TimeUnit.NANOSECONDS);
    }

    @Override
    public Subscription subscribe(Duration bucketDuration, Runnable rotation) {
        requireNonNull(rotation, "rotation");
        // Wrap so that the same task can be subscribed more than once.
        final Runnable subscriber = rotation::run;
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    /**
     * Rotates the buckets of all subscribers.
     */
    public void rotate() {
        for (Runnable subscriber : subscribers) {
            try {
                subscriber.run();
            } catch (Throwable t) {
                logger.warn("Unexpected exception while rotating buckets:", t);
            }
        }
    }

    /**
     * Returns the number of current subscribers.
     */
    public int numSubscribers() {
        return subscribers.size();
    }

    /**
     * Stops the periodic task, if any. The subscribers can still be rotated with {@link #rotate()}.
     */
    @Override
    public synchronized void close() {
        if (periodicTask != null) {
            periodicTask.cancel(false);
            periodicTask = null;
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("subscribers", subscribers.size())
                          .toString();
    }
}
