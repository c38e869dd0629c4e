/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.tessera.transform;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link PartitionTransforms}. */
class PartitionTransformsTest {

    @Test
    void testFromString() {
        assertThat(PartitionTransforms.fromString("day")).isSameAs(PartitionTransforms.days());
        assertThat(PartitionTransforms.fromString("days")).isSameAs(PartitionTransforms.days());
        assertThat(PartitionTransforms.fromString("Month")).isSameAs(PartitionTransforms.months());
        assertThat(PartitionTransforms.fromString("YEARS")).isSameAs(PartitionTransforms.years());
        assertThat(PartitionTransforms.fromString(" hour ")).isSameAs(PartitionTransforms.hours());
        assertThat(PartitionTransforms.fromString("bucket[16]"))
                .isEqualTo(PartitionTransforms.bucket(16));
        assertThat(PartitionTransforms.fromString("TRUNCATE[4]"))
                .isEqualTo(PartitionTransforms.truncate(4));
    }

    @Test
    void testCanonicalNames() {
        assertThat(PartitionTransforms.days()).hasToString("day");
        assertThat(PartitionTransforms.months()).hasToString("month");
        assertThat(PartitionTransforms.years()).hasToString("year");
        assertThat(PartitionTransforms.hours()).hasToString("hour");
        assertThat(PartitionTransforms.bucket(16)).hasToString("bucket[16]");
        assertThat(PartitionTransforms.truncate(3)).hasToString("truncate[3]");
    }

    @ParameterizedTest
    @ValueSource(strings = {"day", "month", "year", "hour", "bucket[7]", "truncate[10]"})
    void testToStringRoundTrip(String name) {
        PartitionTransform transform = PartitionTransforms.fromString(name);
        assertThat(transform.toString()).isEqualTo(name);
        assertThat(PartitionTransforms.fromString(transform.toString())).isEqualTo(transform);
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "",
                "identity",
                "bucket",
                "bucket[]",
                "bucket[x]",
                "bucket[0]",
                "truncate[-1]",
                "minute",
                "bucket[99999999999]"
            })
    void testInvalidStrings(String name) {
        assertThatThrownBy(() -> PartitionTransforms.fromString(name))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEquality() {
        assertThat(PartitionTransforms.bucket(4)).isNotEqualTo(PartitionTransforms.bucket(5));
        assertThat(PartitionTransforms.bucket(4)).isNotEqualTo(PartitionTransforms.truncate(4));
        assertThat(PartitionTransforms.truncate(4).hashCode())
                .isEqualTo(PartitionTransforms.truncate(4).hashCode());
    }
}
