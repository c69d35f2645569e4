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

import static io.tripwire.circuitbreaker.CircuitTransitions.Effect.CANCEL_RESET_TIMER;
import static io.tripwire.circuitbreaker.CircuitTransitions.Effect.CANCEL_WARM_UP_TIMER;
import static io.tripwire.circuitbreaker.CircuitTransitions.Effect.MARK_WINDOW_CLOSED;
import static io.tripwire.circuitbreaker.CircuitTransitions.Effect.MARK_WINDOW_OPEN;
import static io.tripwire.circuitbreaker.CircuitTransitions.Effect.START_RESET_TIMER;
import static io.tripwire.circuitbreaker.CircuitTransitions.Effect.STOP_ROTATION;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import io.tripwire.circuitbreaker.CircuitTransitions.Transition;

class CircuitTransitionsTest {

    @ParameterizedTest
    @CsvSource({
            "CLOSED,    FAILURE_OVER_THRESHOLD, OPEN",
            "CLOSED,    OPEN_REQUESTED,         OPEN",
            "OPEN,      RESET_TIMEOUT,          HALF_OPEN",
            "OPEN,      CLOSE_REQUESTED,        CLOSED",
            "HALF_OPEN, SUCCESS,                CLOSED",
            "HALF_OPEN, CLOSE_REQUESTED,        CLOSED",
            "HALF_OPEN, FAILURE,                OPEN",
            "HALF_OPEN, FAILURE_OVER_THRESHOLD, OPEN",
            "HALF_OPEN, OPEN_REQUESTED,         OPEN",
    })
    void stateChanges(CircuitState from, CircuitEvent event, CircuitState to) {
        final Transition transition = CircuitTransitions.apply(from, event);
        assertThat(transition.from()).isEqualTo(from);
        assertThat(transition.to()).isEqualTo(to);
        assertThat(transition.isStateChanged()).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
            "CLOSED,    SUCCESS",
            "CLOSED,    FAILURE",
            "CLOSED,    RESET_TIMEOUT",
            "CLOSED,    CLOSE_REQUESTED",
            "OPEN,      SUCCESS",
            "OPEN,      FAILURE",
            "OPEN,      FAILURE_OVER_THRESHOLD",
            "OPEN,      OPEN_REQUESTED",
            "HALF_OPEN, RESET_TIMEOUT",
    })
    void unchanged(CircuitState state, CircuitEvent event) {
        final Transition transition = CircuitTransitions.apply(state, event);
        assertThat(transition.to()).isEqualTo(state);
        assertThat(transition.isStateChanged()).isFalse();
        assertThat(transition.effects()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = CircuitEvent.class, mode = EnumSource.Mode.EXCLUDE, names = "SHUTDOWN_REQUESTED")
    void shutdownIsTerminal(CircuitEvent event) {
        final Transition transition = CircuitTransitions.apply(CircuitState.SHUTDOWN, event);
        assertThat(transition.to()).isEqualTo(CircuitState.SHUTDOWN);
        assertThat(transition.effects()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(CircuitState.class)
    void shutdownFromAnyState(CircuitState state) {
        final Transition transition = CircuitTransitions.apply(state, CircuitEvent.SHUTDOWN_REQUESTED);
        assertThat(transition.to()).isEqualTo(CircuitState.SHUTDOWN);
        assertThat(transition.effects()).containsExactlyInAnyOrder(
                CANCEL_RESET_TIMER, CANCEL_WARM_UP_TIMER, STOP_ROTATION);
        assertThat(transition.isStateChanged()).isEqualTo(state != CircuitState.SHUTDOWN);
    }

    @Test
    void openingStartsResetTimer() {
        assertThat(CircuitTransitions.apply(CircuitState.CLOSED, CircuitEvent.FAILURE_OVER_THRESHOLD)
                                     .effects())
                .containsExactlyInAnyOrder(START_RESET_TIMER, MARK_WINDOW_OPEN);
        assertThat(CircuitTransitions.apply(CircuitState.HALF_OPEN, CircuitEvent.FAILURE).effects())
                .containsExactlyInAnyOrder(START_RESET_TIMER, MARK_WINDOW_OPEN);
    }

    @Test
    void closingCancelsResetTimer() {
        assertThat(CircuitTransitions.apply(CircuitState.OPEN, CircuitEvent.CLOSE_REQUESTED).effects())
                .containsExactlyInAnyOrder(CANCEL_RESET_TIMER, MARK_WINDOW_CLOSED);
        assertThat(CircuitTransitions.apply(CircuitState.HALF_OPEN, CircuitEvent.SUCCESS).effects())
                .containsExactlyInAnyOrder(CANCEL_RESET_TIMER, MARK_WINDOW_CLOSED);
    }

    @Test
    void halfOpenHasNoEffects() {
        final Transition transition = CircuitTransitions.apply(CircuitState.OPEN, CircuitEvent.RESET_TIMEOUT);
        assertThat(transition.effects()).isEmpty();
        assertThat(transition.has(START_RESET_TIMER)).isFalse();
    }

    @Test
    void equality() {
        assertThat(CircuitTransitions.apply(CircuitState.CLOSED, CircuitEvent.OPEN_REQUESTED))
                .isEqualTo(CircuitTransitions.apply(CircuitState.CLOSED, CircuitEvent.FAILURE_OVER_THRESHOLD));
        assertThat(CircuitTransitions.apply(CircuitState.CLOSED, CircuitEvent.OPEN_REQUESTED))
                .isNotEqualTo(CircuitTransitions.apply(CircuitState.HALF_OPEN, CircuitEvent.OPEN_REQUESTED));
    }
}
