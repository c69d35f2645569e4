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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.testing.EqualsTester;

class AggregateStatsTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private static AggregateStats stats(long invocations, boolean circuitOpen) {
        return new AggregateStats(invocations, 2, 1, 0, ImmutableList.of(10L, 30L), 20.0,
                                  ImmutableSortedMap.of(0.5, 10L, 1.0, 30L), circuitOpen);
    }

    @Test
    void percentileLookup() {
        final AggregateStats stats = stats(3, false);
        assertThat(stats.percentile(0.5)).isEqualTo(10);
        assertThat(stats.percentile(1.0)).isEqualTo(30);
        assertThat(stats.percentiles()).containsKeys(0.5, 1.0);
    }

    @Test
    void isImmutable() {
        final TreeMap<Double, Long> percentiles = new TreeMap<>();
        percentiles.put(0.5, 1L);
        final List<Long> samples = Lists.newArrayList(1L);
        final AggregateStats stats = new AggregateStats(1, 1, 0, 0, samples, 1.0, percentiles, false);

        samples.add(2L);
        percentiles.put(1.0, 2L);
        assertThat(stats.latencySamples()).containsExactly(1L);
        assertThat(stats.percentiles()).containsOnlyKeys(0.5);
    }

    @Test
    void equality() {
        new EqualsTester()
                .addEqualityGroup(stats(3, false), stats(3, false))
                .addEqualityGroup(stats(4, false))
                .addEqualityGroup(stats(3, true))
                .testEquals();
    }

    @Test
    void json() {
        final JsonNode json = mapper.valueToTree(stats(3, true));
        assertThat(json.get("invocations").asLong()).isEqualTo(3);
        assertThat(json.get("successes").asLong()).isEqualTo(2);
        assertThat(json.get("failures").asLong()).isEqualTo(1);
        assertThat(json.get("timeouts").asLong()).isZero();
        assertThat(json.get("latencyMean").asDouble()).isEqualTo(20.0);
        assertThat(json.get("percentiles").get("0.5").asLong()).isEqualTo(10);
        assertThat(json.get("latencySamples").size()).isEqualTo(2);
        assertThat(json.get("circuitOpen").asBoolean()).isTrue();
        assertThat(ImmutableList.copyOf(json.fieldNames()))
                .containsExactly("invocations", "successes", "failures", "timeouts",
                                 "latencyMean", "percentiles", "latencySamples", "circuitOpen");
    }
}
