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

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Drives the bucket rotation of {@link RollingWindowStats}. A window subscribes to a trigger when it is
 * created and cancels its {@link Subscription} when it is shut down.
 *
 * <p>By default, every window owns a periodic task on a {@link ScheduledExecutorService}. When many
 * breakers live in the same process, a {@link SharedRotationTrigger} lets all of them rotate from one timer.
 */
@FunctionalInterface
public interface RotationTrigger {

    /**
     * Returns a {@link RotationTrigger} which schedules one fixed-rate task per subscriber on the specified
     * {@link ScheduledExecutorService}.
     */
    static RotationTrigger ofScheduler(ScheduledExecutorService scheduler) {
        return new ScheduledRotationTrigger(scheduler);
    }

    /**
     * Returns a new {@link SharedRotationTrigger} which rotates its subscribers only when
     * {@link SharedRotationTrigger#rotate()} is called.
     */
    static SharedRotationTrigger shared() {
        return new SharedRotationTrigger();
    }

    /**
     * Returns a new {@link SharedRotationTrigger} which rotates all its subscribers every {@code period}
     * using a single task on the specified {@link ScheduledExecutorService}.
     */
    static SharedRotationTrigger shared(ScheduledExecutorService scheduler, Duration period) {
        final SharedRotationTrigger trigger = new SharedRotationTrigger();
        trigger.start(scheduler, period);
        return trigger;
    }

    /**
     * Subscribes the specified {@code rotation} task.
     *
     * @param bucketDuration the time span of one bucket, i.e. the interval the subscriber expects
     *                       to be rotated at. A shared trigger may ignore it.
     * @param rotation the task which rotates the buckets of the subscriber once
     */
    Subscription subscribe(Duration bucketDuration, Runnable rotation);

    /**
     * A handle returned by {@link #subscribe(Duration, Runnable)}.
     */
    @FunctionalInterface
    interface Subscription {
        /**
         * Stops triggering the rotation task. Calling this method more than once has no effect.
         */
        void cancel();
    }
}
