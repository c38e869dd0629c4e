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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link TruncateTransform}. */
class TruncateTransformTest {

    private static final PartitionTransform TRUNCATE_10 = PartitionTransforms.truncate(10);

    @Test
    void testTruncateInt() {
        TypedColumn ints =
                ColumnVectors.fromValues(DataTypes.INT(), 0, 1, 5, 9, 10, 11, -1, -5, -10, -11);
        TypedColumn result = TRUNCATE_10.apply(ints);
        assertThat(result.type()).isEqualTo(DataTypes.INT());
        assertThat(result.toList())
                .containsExactly(0, 0, 0, 0, 10, 10, -10, -10, -10, -20);
    }

    @Test
    void testTruncateAllSignedWidths() {
        List<DataType> types =
                Arrays.asList(
                        DataTypes.TINYINT(),
                        DataTypes.SMALLINT(),
                        DataTypes.INT(),
                        DataTypes.BIGINT());
        for (DataType type : types) {
            TypedColumn result = TRUNCATE_10.apply(ColumnVectors.fromValues(type, 34, null, -1));
            assertThat(result.type()).isEqualTo(type);
            assertThat(result.isNullAt(1)).isTrue();
            assertThat(((Number) result.getValue(0)).longValue()).as("%s", type).isEqualTo(30L);
            assertThat(((Number) result.getValue(2)).longValue()).as("%s", type).isEqualTo(-10L);
        }
    }

    @Test
    void testTruncateUnsigned() {
        assertThat(
                        TRUNCATE_10
                                .apply(ColumnVectors.fromValues(DataTypes.UTINYINT(), 255, 9))
                                .toList())
                .containsExactly((short) 250, (short) 0);
        assertThat(
                        TRUNCATE_10
                                .apply(ColumnVectors.fromValues(DataTypes.USMALLINT(), 65535))
                                .toList())
                .containsExactly(65530);
        assertThat(
                        TRUNCATE_10
                                .apply(ColumnVectors.fromValues(DataTypes.UINT(), 4294967295L))
                                .toList())
                .containsExactly(4294967290L);
        assertThat(
                        TRUNCATE_10
                                .apply(ColumnVectors.fromValues(DataTypes.UBIGINT(), -1L))
                                .toList())
                .containsExactly(new BigInteger("18446744073709551610"));
    }

    @Test
    void testSignedOverflow() {
        assertThatThrownBy(
                        () ->
                                TRUNCATE_10.apply(
                                        ColumnVectors.fromValues(DataTypes.TINYINT(), -128)))
                .isInstanceOf(ArithmeticException.class)
                .hasMessage(
                        "Cannot apply truncate[10] to TINYINT value -128: "
                                + "result is out of range");
        assertThatThrownBy(
                        () ->
                                TRUNCATE_10.apply(
                                        ColumnVectors.fromValues(
                                                DataTypes.BIGINT(), Long.MIN_VALUE)))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("BIGINT");
        assertThat(TruncateTransform.truncateLong(Long.MIN_VALUE, 2)).isEqualTo(Long.MIN_VALUE);
    }

    @Test
    void testTruncateDecimal() {
        TypedColumn decimals =
                ColumnVectors.fromValues(
                        DataTypes.DECIMAL(9, 2),
                        new BigDecimal("12.34"),
                        new BigDecimal("12.30"),
                        new BigDecimal("12.29"),
                        new BigDecimal("0.05"),
                        new BigDecimal("-0.05"),
                        null);
        TypedColumn result = TRUNCATE_10.apply(decimals);
        assertThat(result.type()).isEqualTo(DataTypes.DECIMAL(9, 2));
        assertThat(result.isNullAt(5)).isTrue();
        List<String> values =
                result.toList().subList(0, 5).stream()
                        .map(Object::toString)
                        .collect(Collectors.toList());
        assertThat(values).containsExactly("12.30", "12.30", "12.20", "0.00", "-0.10");
    }

    @Test
    void testTruncateWideDecimal() {
        BigDecimal value = new BigDecimal("12345678901234567890.12");
        TypedColumn result =
                PartitionTransforms.truncate(100)
                        .apply(ColumnVectors.fromValues(DataTypes.DECIMAL(38, 2), value));
        assertThat(((Decimal) result.getValue(0)).toBigDecimal())
                .isEqualTo(new BigDecimal("12345678901234567890.00"));
    }

    @Test
    void testDecimalPrecisionOverflow() {
        TypedColumn decimals =
                ColumnVectors.fromValues(DataTypes.DECIMAL(2, 0), new BigDecimal("-95"));
        assertThatThrownBy(() -> TRUNCATE_10.apply(decimals))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("DECIMAL(2, 0) value -95");
    }

    @Test
    void testTruncateStrings() {
        TypedColumn strings =
                ColumnVectors.fromValues(
                        DataTypes.STRING(), "abcdefg", "abc", "", null, "日本語テキスト", "a😀b😀c");
        TypedColumn result = PartitionTransforms.truncate(5).apply(strings);
        assertThat(result.type()).isEqualTo(DataTypes.STRING());
        assertThat(result.toList())
                .containsExactly("abcde", "abc", "", null, "日本語テキ", "a😀b😀c");
        assertThat(PartitionTransforms.truncate(2).apply(strings).toList())
                .containsExactly("ab", "ab", "", null, "日本", "a😀");
    }

    @Test
    void testTruncateBinary() {
        TypedColumn bytes =
                ColumnVectors.fromValues(
                        DataTypes.BYTES(), new byte[] {1, 2, 3, 4, 5}, new byte[] {1}, null);
        TypedColumn result = PartitionTransforms.truncate(3).apply(bytes);
        assertThat(result.getValue(0)).isEqualTo(new byte[] {1, 2, 3});
        assertThat(result.getValue(1)).isEqualTo(new byte[] {1});
        assertThat(result.isNullAt(2)).isTrue();
    }

    @Test
    void testIdempotent() {
        TypedColumn ints = ColumnVectors.fromValues(DataTypes.INT(), 7, -7, 123, -123);
        TypedColumn once = TRUNCATE_10.apply(ints);
        assertThat(TRUNCATE_10.apply(once)).isEqualTo(once);

        TypedColumn strings = ColumnVectors.fromValues(DataTypes.STRING(), "abcdefgh", "ü日本");
        TypedColumn truncated = PartitionTransforms.truncate(2).apply(strings);
        assertThat(PartitionTransforms.truncate(2).apply(truncated)).isEqualTo(truncated);
    }

    @Test
    void testUtf8PrefixLength() {
        byte[] data = "aü日😀".getBytes(StandardCharsets.UTF_8);
        assertThat(TruncateTransform.utf8PrefixLength(data, 0, data.length, 1)).isEqualTo(1);
        assertThat(TruncateTransform.utf8PrefixLength(data, 0, data.length, 2)).isEqualTo(3);
        assertThat(TruncateTransform.utf8PrefixLength(data, 0, data.length, 3)).isEqualTo(6);
        assertThat(TruncateTransform.utf8PrefixLength(data, 0, data.length, 4)).isEqualTo(10);
        assertThat(TruncateTransform.utf8PrefixLength(data, 0, data.length, 9)).isEqualTo(10);
        assertThat(TruncateTransform.utf8PrefixLength(data, 1, 2, 5)).isEqualTo(2);
    }

    @Test
    void testUnsupportedTypes() {
        List<DataType> types =
                Arrays.asList(
                        DataTypes.BOOLEAN(),
                        DataTypes.DATE(),
                        DataTypes.TIME(),
                        DataTypes.TIMESTAMP());
        for (DataType type : types) {
            assertThat(TRUNCATE_10.canTransform(type)).isFalse();
            assertThatThrownBy(() -> TRUNCATE_10.getResultType(type))
                    .isInstanceOf(UnsupportedOperationException.class)
                    .hasMessageStartingWith("Cannot apply truncate[10] to ");
        }
    }

    @Test
    void testInvalidWidth() {
        assertThatThrownBy(() -> PartitionTransforms.truncate(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("width");
    }
}
