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

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;

/**
 * A {@link RotationTrigger} which schedules a fixed-rate task per subscriber.
 */
final class ScheduledRotationTrigger implements RotationTrigger {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledRotationTrigger.class);

    private final ScheduledExecutorService scheduler;

    ScheduledRotationTrigger(ScheduledExecutorService scheduler) {
        this.scheduler = requireNonNull(scheduler, "scheduler");
    }

    @Override
    public Subscription subscribe(Duration bucketDuration, Runnable rotation) {
        requireNonNull(bucketDuration, "bucketDuration");
        requireNonNull(rotation, "rotation");
        final long periodNanos = bucketDuration.toNanos();
        final ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            try {
                rotation.run();
            } catch (Throwable t) {
                // An exception would suppress all subsequent executions of the periodic task.
                logger.warn("Unexpected exception while rotating buckets:", t);
            }
        }, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("scheduler", scheduler)
                          .toString();
    }
}
