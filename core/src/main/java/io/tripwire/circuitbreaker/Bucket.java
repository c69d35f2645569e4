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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.MoreObjects;

/**
 * Holds the counts and the latency samples observed within one slice of a {@link RollingWindowStats}.
 * Not thread-safe; guarded by the owning {@link RollingWindowStats}.
 */
final class Bucket {

    private long invocations;
    private long successes;
    private long failures;
    private long timeouts;
    private final List<Long> latencySamples = new ArrayList<>();
    private boolean breakerOpen;

    void increment(StatsCounter counter) {
        switch (counter) {
            case INVOCATIONS:
                invocations++;
                break;
            case SUCCESSES:
                successes++;
                break;
            case FAILURES:
                failures++;
                break;
            case TIMEOUTS:
                timeouts++;
                break;
            default:
                throw new Error("unknown counter: " + counter);
        }
    }

    void addLatencySample(long latencyMillis) {
        latencySamples.add(latencyMillis);
    }

    long invocations() {
        return invocations;
    }

    long successes() {
        return successes;
    }

    long failures() {
        return failures;
    }

    long timeouts() {
        return timeouts;
    }

    List<Long> latencySamples() {
        return latencySamples;
    }

    boolean isBreakerOpen() {
        return breakerOpen;
    }

    void setBreakerOpen(boolean breakerOpen) {
        this.breakerOpen = breakerOpen;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("invocations", invocations)
                          .add("successes", successes)
                          .add("failures", failures)
                          .add("timeouts", timeouts)
                          .add("latencySamples", latencySamples.size())
                          .add("breakerOpen", breakerOpen)
                          .toString();
    }
}
