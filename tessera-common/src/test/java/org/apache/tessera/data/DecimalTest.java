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

package org.apache.tessera.data;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Decimal}. */
class DecimalTest {

    @Test
    void testCompactDecimal() {
        Decimal decimal = Decimal.fromUnscaledLong(1420, 4, 2);
        assertThat(decimal).isNotNull();
        assertThat(decimal.isCompact()).isTrue();
        assertThat(decimal.toUnscaledLong()).isEqualTo(1420L);
        assertThat(decimal.toBigDecimal()).isEqualByComparingTo("14.20");
        assertThat(decimal.toString()).isEqualTo("14.20");
        assertThat(decimal.toUnscaledBytes()).containsExactly(0x05, (byte) 0x8C);
    }

    @Test
    void testWideDecimal() {
        BigInteger unscaled = new BigInteger("-123456789012345678901234567890");
        Decimal decimal = Decimal.fromUnscaledBigInteger(unscaled, 38, 10);
        assertThat(decimal).isNotNull();
        assertThat(decimal.isCompact()).isFalse();
        assertThat(decimal.toUnscaledBigInteger()).isEqualTo(unscaled);
        assertThat(decimal.toUnscaledBytes()).isEqualTo(unscaled.toByteArray());
    }

    @Test
    void testPrecisionOverflowReturnsNull() {
        assertThat(Decimal.fromUnscaledLong(100000, 5, 2)).isNull();
        assertThat(Decimal.fromUnscaledLong(-99999, 5, 2)).isNotNull();
        assertThat(Decimal.fromBigDecimal(new BigDecimal("1000.00"), 5, 2)).isNull();
    }

    @Test
    void testScaleMustMatch() {
        assertThatThrownBy(() -> Decimal.fromBigDecimal(new BigDecimal("1.5"), 5, 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Decimal.fromUnscaledLong(1, 5, 6))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEqualityIgnoresTrailingZeros() {
        Decimal left = Decimal.fromBigDecimal(new BigDecimal("1.50"), 5, 2);
        Decimal right = Decimal.fromBigDecimal(new BigDecimal("1.500"), 10, 3);
        assertThat(left).isEqualTo(right).hasSameHashCodeAs(right);
        assertThat(left.compareTo(Decimal.zero(5, 2))).isPositive();
    }
}
