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

import org.apache.tessera.data.columnar.ColumnVectors;
import org.apache.tessera.data.columnar.TypedColumn;
import org.apache.tessera.options.Options;
import org.apache.tessera.transform.TransformOptions.OffsetMode;
import org.apache.tessera.types.DataType;
import org.apache.tessera.types.DataTypes;
import org.apache.tessera.types.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link TemporalTransform}. */
class TemporalTransformTest {

    private static final long MICROS_PER_HOUR = 3_600_000_000L;

    private static final Options UTC =
            new Options().set(TransformOptions.TIMESTAMP_OFFSET_MODE, OffsetMode.UTC);

    private static Stream<Arguments> sameInstantInEveryUnit() {
        return Stream.of(
                Arguments.of(TimeUnit.NANOSECOND, 1512151975038194111L),
                Arguments.of(TimeUnit.MICROSECOND, 1512151975038194L),
                Arguments.of(TimeUnit.MILLISECOND, 1512151975038L),
                Arguments.of(TimeUnit.SECOND, 1512151975L));
    }

    @ParameterizedTest
    @MethodSource("sameInstantInEveryUnit")
    void testTimestampUnits(TimeUnit unit, long value) {
        TypedColumn column = ColumnVectors.fromValues(DataTypes.TIMESTAMP(unit), value, null);

        assertThat(PartitionTransforms.days().apply(column).toList()).containsExactly(17501, null);
        assertThat(PartitionTransforms.months().apply(column).toList()).containsExactly(575, null);
        assertThat(PartitionTransforms.years().apply(column).toList()).containsExactly(47, null);
        assertThat(PartitionTransforms.hours().apply(column).toList())
                .containsExactly(420042, null);
    }

    @Test
    void testDaysOnDates() {
        TypedColumn dates = ColumnVectors.fromValues(DataTypes.DATE(), -1, 17501, null, 0);
        TypedColumn days = PartitionTransforms.days().apply(dates);
        assertThat(days.type()).isEqualTo(DataTypes.DATE());
        assertThat(days.toList()).containsExactly(-1, 17501, null, 0);
    }

    @Test
    void testDaysBeforeEpoch() {
        TypedColumn micros = ColumnVectors.fromValues(DataTypes.TIMESTAMP(), -1L, 0L);
        assertThat(PartitionTransforms.days().apply(micros).toList()).containsExactly(-1, 0);

        TypedColumn nanos =
                ColumnVectors.fromValues(DataTypes.TIMESTAMP(TimeUnit.NANOSECOND), -1L);
        assertThat(PartitionTransforms.days().apply(nanos).toList()).containsExactly(-1);
    }

    @Test
    void testMonthsOnDates() {
        TypedColumn dates = ColumnVectors.fromValues(DataTypes.DATE(), -1, 0, -13, 17501);
        TypedColumn months = PartitionTransforms.months().apply(dates);
        assertThat(months.type()).isEqualTo(DataTypes.INT());
        assertThat(months.toList()).containsExactly(-1, 0, -1, 575);
    }

    @Test
    void testYearsOnDates() {
        TypedColumn dates =
                ColumnVectors.fromValues(DataTypes.DATE(), -364, -366, 364, 366, 17501);
        assertThat(PartitionTransforms.years().apply(dates).toList())
                .containsExactly(-1, -2, 0, 1, 47);
    }

    @Test
    void testHoursTruncateTowardZero() {
        TypedColumn column = ColumnVectors.fromValues(DataTypes.TIMESTAMP(), -1L);
        assertThat(PartitionTransforms.hours().apply(column).toList()).containsExactly(0);

        TypedColumn offsets =
                ColumnVectors.fromValues(
                        DataTypes.TIMESTAMP(TimeUnit.MICROSECOND, "-08:00"),
                        -MICROS_PER_HOUR + 1,
                        -MICROS_PER_HOUR,
                        MICROS_PER_HOUR - 1,
                        MICROS_PER_HOUR + 1);
        assertThat(PartitionTransforms.hours().apply(offsets, UTC).toList())
                .containsExactly(0, -1, 0, 1);
    }

    @Test
    void testDefaultOffsetModeIsLocal() {
        assertThat(TransformOptions.TIMESTAMP_OFFSET_MODE.defaultValue())
                .isEqualTo(OffsetMode.LOCAL);
        TypedColumn east =
                ColumnVectors.fromValues(DataTypes.TIMESTAMP(TimeUnit.MICROSECOND, "+09:00"), 0L);
        assertThat(PartitionTransforms.hours().apply(east).toList()).containsExactly(9);
        assertThat(PartitionTransforms.hours().apply(east, UTC).toList()).containsExactly(0);
    }

    @Test
    void testUtcOffsetModeIgnoresOffset() {
        TypedColumn west =
                ColumnVectors.fromValues(DataTypes.TIMESTAMP(TimeUnit.MICROSECOND, "-08:00"), -1L);
        assertThat(PartitionTransforms.days().apply(west, UTC).toList()).containsExactly(-1);

        TypedColumn farWest =
                ColumnVectors.fromValues(
                        DataTypes.TIMESTAMP(TimeUnit.MICROSECOND, "-12:00"),
                        -13 * MICROS_PER_HOUR,
                        (-24 * 31 + 11) * MICROS_PER_HOUR);
        assertThat(PartitionTransforms.days().apply(farWest, UTC).getValue(0)).isEqualTo(-1);
        assertThat(PartitionTransforms.months().apply(farWest, UTC).getValue(1)).isEqualTo(-1);
    }

    @Test
    void testLocalOffsetModeShiftsToWallClock() {
        TypedColumn west =
                ColumnVectors.fromValues(DataTypes.TIMESTAMP(TimeUnit.MICROSECOND, "-08:00"), 0L);
        assertThat(PartitionTransforms.days().apply(west).toList()).containsExactly(-1);
        assertThat(PartitionTransforms.days().apply(west, UTC).toList()).containsExactly(0);

        TypedColumn east =
                ColumnVectors.fromValues(
                        DataTypes.TIMESTAMP(TimeUnit.MILLISECOND, "+08:00"), -3_600_000L);
        assertThat(PartitionTransforms.days().apply(east).toList()).containsExactly(0);
        assertThat(PartitionTransforms.days().apply(east, UTC).toList()).containsExactly(-1);

        TypedColumn india =
                ColumnVectors.fromValues(DataTypes.TIMESTAMP(TimeUnit.SECOND, "+05:30"), 0L);
        assertThat(PartitionTransforms.hours().apply(india).toList()).containsExactly(5);

        TypedColumn farWest =
                ColumnVectors.fromValues(
                        DataTypes.TIMESTAMP(TimeUnit.MICROSECOND, "-12:00"),
                        (-24 * 31 + 11) * MICROS_PER_HOUR);
        assertThat(PartitionTransforms.months().apply(farWest).toList()).containsExactly(-2);
    }

    @Test
    void testOffsetModeFromStringOptions() {
        TypedColumn west =
                ColumnVectors.fromValues(DataTypes.TIMESTAMP(TimeUnit.MICROSECOND, "-08:00"), 0L);
        Options options = new Options();
        options.setString("timestamp.offset-mode", "utc");
        assertThat(PartitionTransforms.days().apply(west, options).toList()).containsExactly(0);

        options.setString("timestamp.offset-mode", "wall-clock");
        assertThatThrownBy(() -> PartitionTransforms.days().apply(west, options))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timestamp.offset-mode");
    }

    @Test
    void testResultTypes() {
        DataType date = DataTypes.DATE().notNull();
        DataType timestamp = DataTypes.TIMESTAMP(TimeUnit.SECOND, "+01:00");
        assertThat(PartitionTransforms.days().getResultType(date))
                .isEqualTo(DataTypes.DATE().notNull());
        assertThat(PartitionTransforms.months().getResultType(timestamp))
                .isEqualTo(DataTypes.INT());
        assertThat(PartitionTransforms.hours().canTransform(timestamp)).isTrue();
        assertThat(PartitionTransforms.hours().canTransform(date)).isFalse();
        assertThat(PartitionTransforms.years().canTransform(DataTypes.TIME())).isFalse();
    }

    @Test
    void testUnsupportedTypes() {
        TypedColumn dates = ColumnVectors.fromValues(DataTypes.DATE(), 1);
        assertThatThrownBy(() -> PartitionTransforms.hours().apply(dates))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessage("Cannot apply hour to DATE");

        TypedColumn strings = ColumnVectors.fromValues(DataTypes.STRING(), "2017-12-01");
        assertThatThrownBy(() -> PartitionTransforms.days().apply(strings))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessage("Cannot apply day to STRING");

        TypedColumn ints = ColumnVectors.fromValues(DataTypes.BIGINT(), 1L);
        assertThatThrownBy(() -> PartitionTransforms.months().apply(ints))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testOverflow() {
        TypedColumn seconds =
                ColumnVectors.fromValues(DataTypes.TIMESTAMP(TimeUnit.SECOND), Long.MAX_VALUE);
        assertThatThrownBy(() -> PartitionTransforms.days().apply(seconds))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("day")
                .hasMessageContaining("TIMESTAMP(s)")
                .hasMessageContaining(String.valueOf(Long.MAX_VALUE));

        TypedColumn micros = ColumnVectors.fromValues(DataTypes.TIMESTAMP(), Long.MAX_VALUE);
        assertThatThrownBy(() -> PartitionTransforms.hours().apply(micros))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("hour");
        assertThat(PartitionTransforms.days().apply(micros).toList()).containsExactly(106751991);
    }

    @Test
    void testInputIsNotModified() {
        TypedColumn column = ColumnVectors.fromValues(DataTypes.TIMESTAMP(), -1L, null, 7L);
        PartitionTransforms.days().apply(column);
        assertThat(column.toList()).containsExactly(-1L, null, 7L);
    }

    @Test
    void testEmptyColumn() {
        TypedColumn column = ColumnVectors.fromValues(DataTypes.DATE());
        TypedColumn result = PartitionTransforms.years().apply(column);
        assertThat(result.size()).isZero();
        assertThat(result.type()).isEqualTo(DataTypes.INT());
    }

    @Test
    void testSerializationKeepsSingletons() throws Exception {
        PartitionTransform[] transforms = {
            PartitionTransforms.days(),
            PartitionTransforms.months(),
            PartitionTransforms.years(),
            PartitionTransforms.hours()
        };
        for (PartitionTransform transform : transforms) {
            assertThat(roundTrip(transform)).isSameAs(transform);
        }
    }

    private static Object roundTrip(Object value) throws IOException, ClassNotFoundException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        }
        try (ObjectInputStream in =
                new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            return in.readObject();
        }
    }
}
