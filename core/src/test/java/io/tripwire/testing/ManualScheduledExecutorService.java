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
package io.tripwire.testing;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.Delayed;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.google.common.testing.FakeTicker;

import io.tripwire.common.annotation.Nullable;

/**
 * A {@link ScheduledExecutorService} which runs its tasks only when the virtual clock is moved forward with
 * {@link #advance(Duration)}. The tasks run on the calling thread in the order of their deadlines.
 */
public final class ManualScheduledExecutorService extends AbstractExecutorService
        implements ScheduledExecutorService {

    private final FakeTicker ticker = new FakeTicker();
    private final PriorityQueue<ManualTask<?>> tasks = new PriorityQueue<>();
    private long seqNo;
    private boolean shutdown;

    /**
     * Returns the virtual clock of this executor.
     */
    public FakeTicker ticker() {
        return ticker;
    }

    /**
     * Moves the virtual clock forward, running every task whose deadline is reached.
     */
    public void advance(Duration duration) {
        requireNonNull(duration, "duration");
        final long target = ticker.read() + duration.toNanos();
        for (;;) {
            final ManualTask<?> task;
            synchronized (this) {
                task = tasks.peek();
                if (task == null || task.deadlineNanos > target) {
                    break;
                }
                tasks.poll();
            }
            final long now = ticker.read();
            if (task.deadlineNanos > now) {
                ticker.advance(task.deadlineNanos - now);
            }
            task.run();
        }
        final long now = ticker.read();
        if (target > now) {
            ticker.advance(target - now);
        }
    }

    /**
     * Returns the number of tasks which are neither run nor cancelled yet.
     */
    public synchronized int numPendingTasks() {
        return tasks.size();
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
        return enqueue(Executors.callable(command, null), delay, 0, unit);
    }

    @Override
    public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
        return enqueue(callable, delay, 0, unit);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period,
                                                  TimeUnit unit) {
        return enqueue(Executors.callable(command, null), initialDelay, period, unit);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay,
                                                     TimeUnit unit) {
        return enqueue(Executors.callable(command, null), initialDelay, delay, unit);
    }

    @Override
    public void execute(Runnable command) {
        schedule(command, 0, TimeUnit.NANOSECONDS);
    }

    private synchronized <V> ScheduledFuture<V> enqueue(Callable<V> callable, long delay, long period,
                                                        TimeUnit unit) {
        requireNonNull(callable, "callable");
        requireNonNull(unit, "unit");
        if (shutdown) {
            throw new RejectedExecutionException("shut down");
        }
        final ManualTask<V> task = new ManualTask<>(callable,
                                                    ticker.read() + unit.toNanos(Math.max(delay, 0)),
                                                    unit.toNanos(period), seqNo++);
        tasks.add(task);
        return task;
    }

    private synchronized void requeue(ManualTask<?> task) {
        if (!shutdown) {
            tasks.add(task);
        }
    }

    private synchronized void remove(ManualTask<?> task) {
        tasks.remove(task);
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
    }

    @Override
    public synchronized List<Runnable> shutdownNow() {
        shutdown = true;
        final List<Runnable> pending = new ArrayList<>(tasks);
        tasks.clear();
        return pending;
    }

    @Override
    public synchronized boolean isShutdown() {
        return shutdown;
    }

    @Override
    public synchronized boolean isTerminated() {
        return shutdown;
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        return isTerminated();
    }

    private final class ManualTask<V> extends FutureTask<V> implements ScheduledFuture<V> {

        private long deadlineNanos;
        private final long periodNanos;
        private final long seqNo;

        ManualTask(Callable<V> callable, long deadlineNanos, long periodNanos, long seqNo) {
            super(callable);
            this.deadlineNanos = deadlineNanos;
            this.periodNanos = periodNanos;
            this.seqNo = seqNo;
        }

        @Override
        public void run() {
            if (periodNanos <= 0) {
                super.run();
                return;
            }
            if (runAndReset()) {
                deadlineNanos += periodNanos;
                requeue(this);
            }
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            final boolean cancelled = super.cancel(mayInterruptIfRunning);
            if (cancelled) {
                remove(this);
            }
            return cancelled;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(deadlineNanos - ticker.read(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed o) {
            if (o == this) {
                return 0;
            }
            if (o instanceof ManualTask) {
                final ManualTask<?> that = (ManualTask<?>) o;
                final int res = Long.compare(deadlineNanos, that.deadlineNanos);
                return res != 0 ? res : Long.compare(seqNo, that.seqNo);
            }
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), o.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean equals(@Nullable Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }
    }
}
