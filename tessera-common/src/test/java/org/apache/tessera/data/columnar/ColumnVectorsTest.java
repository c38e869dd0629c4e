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

package org.apache.tessera.data.columnar;

import org.apache.tessera.data.Decimal;
import org.apache.tessera.data.columnar.heap.HeapBytesVector;
import org.apache.tessera.data.columnar.heap.HeapIntVector;
import org.apache.tessera.data.columnar.heap.HeapLongVector;
import org.apache.tessera.data.columnar.writable.WritableColumnVector;
import org.apache.tessera.types.DataTypes;
import org.apache.tessera.types.TimeUnit;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ColumnVectors} and the heap vectors. */
class ColumnVectorsTest {

    @Test
    void testCreateWritable() {
        assertThat(ColumnVectors.createWritable(DataTypes.DATE(), 4))
                .isInstanceOf(HeapIntVector.class);
        assertThat(ColumnVectors.createWritable(DataTypes.TIMESTAMP(TimeUnit.SECOND), 4))
                .isInstanceOf(HeapLongVector.class);
        assertThat(ColumnVectors.createWritable(DataTypes.STRING(), 4))
                .isInstanceOf(HeapBytesVector.class);
        assertThatThrownBy(() -> ColumnVectors.createWritable(DataTypes.INT(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFromValuesKeepsNulls() {
        TypedColumn column = ColumnVectors.fromValues(DataTypes.INT(), 1, null, -3);
        assertThat(column.size()).isEqualTo(3);
        assertThat(column.isNullAt(1)).isTrue();
        assertThat(column.toList()).containsExactly(1, null, -3);
    }

    @Test
    void testUnsignedValues() {
        assertThat(ColumnVectors.fromValues(DataTypes.UTINYINT(), 200, 0).toList())
                .containsExactly((short) 200, (short) 0);
        assertThat(ColumnVectors.fromValues(DataTypes.USMALLINT(), 65535).toList())
                .containsExactly(65535);
        assertThat(ColumnVectors.fromValues(DataTypes.UINT(), 4294967295L).toList())
                .containsExactly(4294967295L);
        assertThat(ColumnVectors.fromValues(DataTypes.UBIGINT(), -1L).toList())
                .containsExactly(new BigInteger("18446744073709551615"));
    }

    @Test
    void testTemporalValues() {
        TypedColumn dates =
                ColumnVectors.fromValues(DataTypes.DATE(), LocalDate.of(2017, 12, 1), -1);
        assertThat(dates.toList()).containsExactly(17501, -1);

        TypedColumn times = ColumnVectors.fromValues(DataTypes.TIME(), LocalTime.of(22, 31, 8));
        assertThat(times.toList()).containsExactly(81068000000L);
    }

    @Test
    void testDecimalValues() {
        TypedColumn column =
                ColumnVectors.fromValues(
                        DataTypes.DECIMAL(9, 2),
                        new BigDecimal("12.3"),
                        Decimal.fromUnscaledLong(5, 3, 2));
        assertThat(column.toList())
                .containsExactly(
                        Decimal.fromUnscaledLong(1230, 9, 2), Decimal.fromUnscaledLong(5, 9, 2));

        assertThatThrownBy(
                        () ->
                                ColumnVectors.fromValues(
                                        DataTypes.DECIMAL(3, 2), new BigDecimal("12.3")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testBytesVectorGrows() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            builder.append("value-").append(i);
        }
        String longValue = builder.toString();
        TypedColumn column =
                ColumnVectors.fromValues(DataTypes.STRING(), longValue, null, "", "日本語");
        assertThat(column.toList()).containsExactly(longValue, null, "", "日本語");

        BytesColumnVector.Bytes bytes = ((BytesColumnVector) column.vector()).getBytes(3);
        assertThat(bytes.getBytes()).isEqualTo("日本語".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testAppendAndReset() {
        WritableColumnVector vector = ColumnVectors.createWritable(DataTypes.BIGINT(), 1);
        HeapLongVector longs = (HeapLongVector) vector;
        longs.appendLong(1L);
        longs.appendNull();
        longs.appendLong(3L);
        assertThat(longs.getElementsAppended()).isEqualTo(3);
        assertThat(longs.getCapacity()).isGreaterThanOrEqualTo(3);
        assertThat(new TypedColumn(DataTypes.BIGINT(), longs, 3).toList())
                .containsExactly(1L, null, 3L);

        longs.reset();
        assertThat(longs.getElementsAppended()).isZero();
        assertThat(longs.isNullAt(1)).isFalse();
    }

    @Test
    void testNullFlagsArePerRow() {
        WritableColumnVector vector = ColumnVectors.createWritable(DataTypes.BIGINT(), 8);
        HeapLongVector longs = (HeapLongVector) vector;
        for (int i = 0; i < 8; i++) {
            assertThat(longs.isNullAt(i)).isFalse();
        }

        longs.setNullAt(2);
        longs.setNullAt(5);
        longs.setLong(3, 7L);

        for (int i = 0; i < 8; i++) {
            assertThat(longs.isNullAt(i)).as("row %s", i).isEqualTo(i == 2 || i == 5);
        }
        assertThat(longs.getLong(3)).isEqualTo(7L);
    }

    @Test
    void testColumnEquality() {
        assertThat(ColumnVectors.fromValues(DataTypes.BYTES(), new byte[] {1, 2}, null))
                .isEqualTo(ColumnVectors.fromValues(DataTypes.BYTES(), new byte[] {1, 2}, null))
                .isNotEqualTo(ColumnVectors.fromValues(DataTypes.BYTES(), new byte[] {1}, null));
        assertThat(ColumnVectors.fromValues(DataTypes.INT(), 1))
                .isNotEqualTo(ColumnVectors.fromValues(DataTypes.UINT(), 1));
    }

    @Test
    void testSizeMustFitVector() {
        assertThatThrownBy(() -> new TypedColumn(DataTypes.INT(), new HeapIntVector(2), 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
