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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.google.common.testing.EqualsTester;

class HttpStatusTest {

    @Test
    void commonCodesAreCached() {
        assertThat(HttpStatus.valueOf(200)).isSameAs(HttpStatus.OK);
        assertThat(HttpStatus.valueOf(503)).isSameAs(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(HttpStatus.valueOf(418)).isSameAs(HttpStatus.valueOf(418));
        assertThat(HttpStatus.GATEWAY_TIMEOUT.code()).isEqualTo(504);
        assertThat(HttpStatus.NOT_FOUND).hasToString("404");
    }

    @ParameterizedTest
    @CsvSource({
            "200,  false, false, false",
            "304,  false, false, false",
            "400,  true,  false, true",
            "499,  true,  false, true",
            "500,  false, true,  true",
            "503,  false, true,  true",
            "600,  false, false, true",
            "1200, false, false, true",
    })
    void classification(int code, boolean clientError, boolean serverError, boolean error) {
        final HttpStatus status = HttpStatus.valueOf(code);
        assertThat(status.code()).isEqualTo(code);
        assertThat(status.isClientError()).isEqualTo(clientError);
        assertThat(status.isServerError()).isEqualTo(serverError);
        assertThat(status.isError()).isEqualTo(error);
    }

    @Test
    void equality() {
        new EqualsTester()
                .addEqualityGroup(HttpStatus.valueOf(1200), HttpStatus.valueOf(1200))
                .addEqualityGroup(HttpStatus.INTERNAL_SERVER_ERROR, HttpStatus.valueOf(500))
                .addEqualityGroup(HttpStatus.OK)
                .testEquals();
    }

    @Test
    void negativeCode() {
        assertThatThrownBy(() -> HttpStatus.valueOf(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected: >= 0");
    }
}
