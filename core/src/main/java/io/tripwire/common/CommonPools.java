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
package io.tripwire.common;

import java.util.concurrent.ScheduledExecutorService;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;

/**
 * Provides the common shared scheduler which is used when not overridden.
 */
public final class CommonPools {

    // A single daemon thread runs every bucket rotation, reset, warm-up and deadline timer
    // of the breakers which were not given their own scheduler.
    private static final EventExecutor SCHEDULER =
            new DefaultEventExecutor(new DefaultThreadFactory("tripwire-common-scheduler", true));

    /**
     * Returns the common {@link ScheduledExecutorService} which is used when
     * {@code CircuitBreakerBuilder.scheduler(ScheduledExecutorService)} or
     * {@code InvocationGuardBuilder.scheduler(ScheduledExecutorService)} is not specified.
     */
    public static ScheduledExecutorService scheduler() {
        return SCHEDULER;
    }

    private CommonPools() {}
}
