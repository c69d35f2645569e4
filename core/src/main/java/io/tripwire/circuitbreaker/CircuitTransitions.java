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

import java.util.EnumSet;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.Sets;

import io.tripwire.common.annotation.Nullable;

/**
 * The transition table of a circuit breaker. {@link #apply(CircuitState, CircuitEvent)} is a pure function
 * that tells the next {@link CircuitState} and the {@link Effect}s to perform for an event.
 *
 * <pre>{@code
 * CLOSED    --FAILURE_OVER_THRESHOLD-->  OPEN       start reset timer, mark window open
 * HALF_OPEN --FAILURE(_OVER_THRESHOLD)-> OPEN       start reset timer, mark window open
 * OPEN      --RESET_TIMEOUT-->           HALF_OPEN
 * HALF_OPEN --SUCCESS-->                 CLOSED     cancel reset timer, mark window closed
 * (not OPEN, not SHUTDOWN)   --OPEN_REQUESTED-->  OPEN    start reset timer, mark window open
 * (not CLOSED, not SHUTDOWN) --CLOSE_REQUESTED--> CLOSED  cancel reset timer, mark window closed
 * (any)     --SHUTDOWN_REQUESTED-->      SHUTDOWN   cancel reset timer, cancel warm-up timer, stop rotation
 * }</pre>
 * Any other combination leaves the state unchanged without effects.
 */
public final class CircuitTransitions {

    /**
     * A side effect of a transition.
     */
    public enum Effect {
        START_RESET_TIMER,
        CANCEL_RESET_TIMER,
        MARK_WINDOW_OPEN,
        MARK_WINDOW_CLOSED,
        CANCEL_WARM_UP_TIMER,
        STOP_ROTATION,
    }

    private static final Set<Effect> TO_OPEN =
            Sets.immutableEnumSet(Effect.START_RESET_TIMER, Effect.MARK_WINDOW_OPEN);
    private static final Set<Effect> TO_CLOSED =
            Sets.immutableEnumSet(Effect.CANCEL_RESET_TIMER, Effect.MARK_WINDOW_CLOSED);
    private static final Set<Effect> TO_SHUTDOWN =
            Sets.immutableEnumSet(Effect.CANCEL_RESET_TIMER, Effect.CANCEL_WARM_UP_TIMER,
                                  Effect.STOP_ROTATION);
    private static final Set<Effect> NONE = Sets.immutableEnumSet(EnumSet.noneOf(Effect.class));

    /**
     * Returns the {@link Transition} for the specified {@link CircuitEvent} observed in the specified
     * {@link CircuitState}.
     */
    public static Transition apply(CircuitState state, CircuitEvent event) {
        requireNonNull(state, "state");
        requireNonNull(event, "event");

        if (event == CircuitEvent.SHUTDOWN_REQUESTED) {
            // Repeating the cleanup is harmless, so a redundant shutdown reports the same effects.
            return new Transition(state, CircuitState.SHUTDOWN, TO_SHUTDOWN);
        }

        switch (state) {
            case CLOSED:
                switch (event) {
                    case FAILURE_OVER_THRESHOLD:
                    case OPEN_REQUESTED:
                        return new Transition(state, CircuitState.OPEN, TO_OPEN);
                    default:
                        return unchanged(state);
                }
            case OPEN:
                switch (event) {
                    case RESET_TIMEOUT:
                        return new Transition(state, CircuitState.HALF_OPEN, NONE);
                    case CLOSE_REQUESTED:
                        return new Transition(state, CircuitState.CLOSED, TO_CLOSED);
                    default:
                        return unchanged(state);
                }
            case HALF_OPEN:
                switch (event) {
                    case SUCCESS:
                    case CLOSE_REQUESTED:
                        return new Transition(state, CircuitState.CLOSED, TO_CLOSED);
                    case FAILURE:
                    case FAILURE_OVER_THRESHOLD:
                    case OPEN_REQUESTED:
                        return new Transition(state, CircuitState.OPEN, TO_OPEN);
                    default:
                        return unchanged(state);
                }
            case SHUTDOWN:
                return unchanged(state);
            default:
                throw new Error("unknown circuit state: " + state);
        }
    }

    private static Transition unchanged(CircuitState state) {
        return new Transition(state, state, NONE);
    }

    /**
     * The result of {@link CircuitTransitions#apply(CircuitState, CircuitEvent)}.
     */
    public static final class Transition {

        private final CircuitState from;
        private final CircuitState to;
        private final Set<Effect> effects;

        Transition(CircuitState from, CircuitState to, Set<Effect> effects) {
            this.from = from;
            this.to = to;
            this.effects = effects;
        }

        /**
         * Returns the state the event was observed in.
         */
        public CircuitState from() {
            return from;
        }

        /**
         * Returns the next state.
         */
        public CircuitState to() {
            return to;
        }

        /**
         * Returns the side effects to perform, in no particular order.
         */
        public Set<Effect> effects() {
            return effects;
        }

        /**
         * Returns whether the state changes.
         */
        public boolean isStateChanged() {
            return from != to;
        }

        /**
         * Returns whether the specified {@link Effect} has to be performed.
         */
        public boolean has(Effect effect) {
            return effects.contains(effect);
        }

        @Override
        public boolean equals(@Nullable Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Transition)) {
                return false;
            }
            final Transition that = (Transition) o;
            return from == that.from && to == that.to && effects.equals(that.effects);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(from, to, effects);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                              .add("from", from)
                              .add("to", to)
                              .add("effects", effects)
                              .toString();
        }
    }

    private CircuitTransitions() {}
}
