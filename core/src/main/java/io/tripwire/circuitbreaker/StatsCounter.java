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

/**
 * The counters kept by each {@link Bucket} of a {@link RollingWindowStats}.
 */
public enum StatsCounter {
    /**
     * The number of calls seen by the guard, including the rejected ones.
     */
    INVOCATIONS,
    /**
     * The number of calls which completed successfully.
     */
    SUCCESSES,
    /**
     * The number of calls which failed, including the timed-out ones.
     */
    FAILURES,
    /**
     * The number of calls which did not complete before their deadline.
     */
    TIMEOUTS
}
