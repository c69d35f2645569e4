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

import static com.google.common.base.Preconditions.checkArgument;

import io.tripwire.common.annotation.Nullable;

/**
 * The status code a guarded call completed with. Only the code is kept because the circuit breaker
 * classifies a result by its status class alone.
 */
public final class HttpStatus {

    private static final HttpStatus[] cache = newCache(600);

    public static final HttpStatus OK = valueOf(200);
    public static final HttpStatus NOT_FOUND = valueOf(404);
    public static final HttpStatus INTERNAL_SERVER_ERROR = valueOf(500);
    public static final HttpStatus BAD_GATEWAY = valueOf(502);
    public static final HttpStatus SERVICE_UNAVAILABLE = valueOf(503);
    public static final HttpStatus GATEWAY_TIMEOUT = valueOf(504);

    private static HttpStatus[] newCache(int size) {
        final HttpStatus[] statuses = new HttpStatus[size];
        for (int i = 0; i < size; i++) {
            statuses[i] = new HttpStatus(i);
        }
        return statuses;
    }

    /**
     * Returns the {@link HttpStatus} of the specified {@code code}. The codes below {@code 600} are cached.
     *
     * @throws IllegalArgumentException if {@code code} is negative
     */
    public static HttpStatus valueOf(int code) {
        checkArgument(code >= 0, "code: %s (expected: >= 0)", code);
        return code < cache.length ? cache[code] : new HttpStatus(code);
    }

    private final int code;

    private HttpStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Returns {@code true} if the code is in the {@code 4xx} range.
     */
    public boolean isClientError() {
        return code / 100 == 4;
    }

    /**
     * Returns {@code true} if the code is in the {@code 5xx} range.
     */
    public boolean isServerError() {
        return code / 100 == 5;
    }

    /**
     * Returns {@code true} if the code is {@code 400} or above, including the codes outside the
     * standard classes.
     */
    public boolean isError() {
        return code >= 400;
    }

    @Override
    public int hashCode() {
        return code;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return obj instanceof HttpStatus && code == ((HttpStatus) obj).code;
    }

    @Override
    public String toString() {
        return String.valueOf(code);
    }
}
