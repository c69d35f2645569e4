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
package io.tripwire.server.circuitbreaker;

import static java.util.Objects.requireNonNull;

import java.util.function.Function;

import io.tripwire.common.HttpStatus;
import io.tripwire.common.annotation.Nullable;

/**
 * Decides whether the result of a completed call is a failure from the circuit breaker's point of view.
 * An exceptionally completed call is always a failure and is not passed to this predicate.
 */
@FunctionalInterface
public interface ErrorPredicate<R> {

    /**
     * Returns an {@link ErrorPredicate} which treats a result whose {@link HttpStatus} is {@code 400} or
     * above as a failure.
     *
     * @param statusFunction extracts the {@link HttpStatus} from a result
     */
    static <R> ErrorPredicate<R> ofStatus(Function<? super R, HttpStatus> statusFunction) {
        requireNonNull(statusFunction, "statusFunction");
        return result -> statusFunction.apply(result).isError();
    }

    /**
     * Returns whether the specified result has to be recorded as a failure.
     */
    boolean isError(@Nullable R result);
}
