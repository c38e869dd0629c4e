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

import org.apache.tessera.data.Decimal;
import org.apache.tessera.data.columnar.ColumnVectors;
import org.apache.tessera.data.columnar.TypedColumn;
import org.apache.tessera.types.DataType;
import org.apache.tessera.types.DataTypes;
import org.apache.tessera.types.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link BucketTransform} and {@link BucketHash}. */
class BucketTransformTest {

    private static final long TS_MICROS = 1510871468000000L;

    @Test
    void testReferenceHashes() {
        assertThat(BucketHash.hashLong(34L)).isEqualTo(2017239379);
        assertThat(BucketHash.hashDecimal(Decimal.fromUnscaledLong(1420, 4, 2)))
                .isEqualTo(-500754589);
        assertThat(BucketHash.hashDate((int) LocalDate.of(2017, 11, 16).toEpochDay()))
                .isEqualTo(-653330422);
        assertThat(BucketHash.hashTime(LocalTime.of(22, 31, 8).toNanoOfDay() / 1000))
                .isEqualTo(-662762989);
        assertThat(BucketHash.hashTimestamp(TS_MICROS, TimeUnit.MICROSECOND))
                .isEqualTo(-2047944441);
        assertThat(BucketHash.hashTimestamp(TS_MICROS + 1, TimeUnit.MICROSECOND))
                .isEqualTo(-1207196810);
        assertThat(BucketHash.hashTimestamp(TS_MICROS * 1000, TimeUnit.NANOSECOND))
                .isEqualTo(-2047944441);
        assertThat(BucketHash.hashTimestamp(TS_MICROS / 1000_000, TimeUnit.SECOND))
                .isEqualTo(-2047944441);
        assertThat(BucketHash.hashString("iceberg")).isEqualTo(1210000089);
        assertThat(BucketHash.hashBytes(new byte[] {0, 1, 2, 3})).isEqualTo(-188683207);
    }

    @Test
    void testReferenceBuckets() {
        PartitionTransform bucket = PartitionTransforms.bucket(Integer.MAX_VALUE);

        assertThat(bucket.apply(ColumnVectors.fromValues(DataTypes.INT(), 34)).toList())
                .containsExactly(2017239379);
        assertThat(bucket.apply(ColumnVectors.fromValues(DataTypes.BIGINT(), 34L)).toList())
                .containsExactly(2017239379);
        assertThat(
                        bucket.apply(
                                        ColumnVectors.fromValues(
                                                DataTypes.DECIMAL(9, 2), new BigDecimal("14.20")))
                                .toList())
                .containsExactly(1646729059);
        assertThat(
                        bucket.apply(
                                        ColumnVectors.fromValues(
                                                DataTypes.DATE(), LocalDate.of(2017, 11, 16)))
                                .toList())
                .containsExactly(1494153226);
        assertThat(
                        bucket.apply(
                                        ColumnVectors.fromValues(
                                                DataTypes.TIME(), LocalTime.of(22, 31, 8)))
                                .toList())
                .containsExactly(1484720659);
        assertThat(
                        bucket.apply(
                                        ColumnVectors.fromValues(
                                                DataTypes.TIMESTAMP(), TS_MICROS, TS_MICROS + 1))
                                .toList())
                .containsExactly(99539207, 940286838);
        assertThat(bucket.apply(ColumnVectors.fromValues(DataTypes.STRING(), "iceberg")).toList())
                .containsExactly(1210000089);
        assertThat(
                        bucket.apply(
                                        ColumnVectors.fromValues(
                                                DataTypes.BYTES(), new byte[] {0, 1, 2, 3}))
                                .toList())
                .containsExactly(1958800441);
    }

    @Test
    void testTimestampOffsetIsIgnored() {
        PartitionTransform bucket = PartitionTransforms.bucket(Integer.MAX_VALUE);
        TypedColumn west =
                ColumnVectors.fromValues(
                        DataTypes.TIMESTAMP(TimeUnit.NANOSECOND, "-08:00"), TS_MICROS * 1000);
        assertThat(bucket.apply(west).toList()).containsExactly(99539207);
    }

    @Test
    void testIntegerWidthsHashAlike() {
        PartitionTransform bucket = PartitionTransforms.bucket(Integer.MAX_VALUE);
        List<DataType> types =
                Arrays.asList(
                        DataTypes.TINYINT(),
                        DataTypes.SMALLINT(),
                        DataTypes.INT(),
                        DataTypes.BIGINT(),
                        DataTypes.UTINYINT(),
                        DataTypes.USMALLINT(),
                        DataTypes.UINT(),
                        DataTypes.UBIGINT());
        for (DataType type : types) {
            assertThat(bucket.apply(ColumnVectors.fromValues(type, 34)).toList())
                    .as("bucket of 34 as %s", type)
                    .containsExactly(2017239379);
        }
    }

    @Test
    void testUnsignedValuesAreZeroExtended() {
        PartitionTransform bucket = PartitionTransforms.bucket(Integer.MAX_VALUE);
        assertThat(bucket.apply(ColumnVectors.fromValues(DataTypes.UTINYINT(), 200)).toList())
                .containsExactly(BucketTransform.bucket(845973527, Integer.MAX_VALUE));
        assertThat(bucket.apply(ColumnVectors.fromValues(DataTypes.UINT(), 4294967295L)).toList())
                .containsExactly(BucketTransform.bucket(689913327, Integer.MAX_VALUE));
        assertThat(bucket.apply(ColumnVectors.fromValues(DataTypes.TINYINT(), -1)).toList())
                .containsExactly(BucketTransform.bucket(1651860712, Integer.MAX_VALUE));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4, 9})
    void testBucketsAreConsistentAndInRange(int numBuckets) {
        PartitionTransform bucket = PartitionTransforms.bucket(numBuckets);
        List<TypedColumn> columns =
                Arrays.asList(
                        ColumnVectors.fromValues(DataTypes.STRING(), "a", null, "日本語", "a"),
                        ColumnVectors.fromValues(DataTypes.INT(), 5, null, -5, 5),
                        ColumnVectors.fromValues(DataTypes.DATE(), 17501, null, -1, 17501),
                        ColumnVectors.fromValues(
                                DataTypes.TIMESTAMP(TimeUnit.MILLISECOND),
                                1512151975038L,
                                null,
                                -1L,
                                1512151975038L),
                        ColumnVectors.fromValues(
                                DataTypes.DECIMAL(9, 2),
                                new BigDecimal("12.34"),
                                null,
                                new BigDecimal("-0.05"),
                                new BigDecimal("12.34")));

        for (TypedColumn column : columns) {
            TypedColumn buckets = bucket.apply(column);
            assertThat(buckets.type()).isEqualTo(DataTypes.INT());
            assertThat(buckets.size()).isEqualTo(column.size());
            assertThat(buckets.isNullAt(1)).isTrue();
            for (int i : new int[] {0, 2, 3}) {
                assertThat((Integer) buckets.getValue(i)).isBetween(0, numBuckets - 1);
            }
            assertThat(buckets.getValue(3)).isEqualTo(buckets.getValue(0));
        }
    }

    @Test
    void testStringsHashByUtf8Bytes() {
        TypedColumn strings = ColumnVectors.fromValues(DataTypes.STRING(), "日本語");
        TypedColumn bytes =
                ColumnVectors.fromValues(
                        DataTypes.BYTES(), "日本語".getBytes(StandardCharsets.UTF_8));
        PartitionTransform bucket = PartitionTransforms.bucket(Integer.MAX_VALUE);
        assertThat(bucket.apply(strings)).isEqualTo(bucket.apply(bytes));
        assertThat(bucket.apply(strings).toList())
                .containsExactly(BucketTransform.bucket(-1515949417, Integer.MAX_VALUE));
    }

    @Test
    void testInvalidNumBuckets() {
        assertThatThrownBy(() -> PartitionTransforms.bucket(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("0");
        assertThatThrownBy(() -> PartitionTransforms.bucket(-3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testUnsupportedBoolean() {
        PartitionTransform bucket = PartitionTransforms.bucket(4);
        assertThat(bucket.canTransform(DataTypes.BOOLEAN())).isFalse();
        assertThatThrownBy(
                        () -> bucket.apply(ColumnVectors.fromValues(DataTypes.BOOLEAN(), true)))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessage("Cannot apply bucket[4] to BOOLEAN");
    }

    @Test
    void testTimestampOverflow() {
        TypedColumn seconds =
                ColumnVectors.fromValues(DataTypes.TIMESTAMP(TimeUnit.SECOND), Long.MIN_VALUE);
        assertThatThrownBy(() -> PartitionTransforms.bucket(4).apply(seconds))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("bucket[4]")
                .hasMessageContaining("TIMESTAMP(s)");
    }

    @Test
    void testLargestBucketCountKeepsMaskedHash() {
        for (int hash : new int[] {0, 1, -2, 2017239379, -2047944441, Integer.MIN_VALUE}) {
            assertThat(BucketTransform.bucket(hash, Integer.MAX_VALUE))
                    .isEqualTo(hash & Integer.MAX_VALUE);
        }
        assertThat(BucketTransform.bucket(Integer.MAX_VALUE, Integer.MAX_VALUE)).isZero();
    }

    @Test
    void testBucketOfNegativeHash() {
        assertThat(BucketTransform.bucket(-1, 16)).isEqualTo(15);
        assertThat(BucketTransform.bucket(Integer.MIN_VALUE, 16)).isEqualTo(0);
    }
}
