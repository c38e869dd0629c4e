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

import org.apache.tessera.annotation.Public;
import org.apache.tessera.types.DecimalType;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;

import static org.apache.tessera.types.DecimalType.MAX_COMPACT_PRECISION;
import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 定点十进制数的内部表示:未缩放整数值 + 精度 + 标度,数值等于 {@code unscaled * 10^-scale}。
 *
 * <h2>存储格式</h2>
 *
 * <ul>
 *   <li>紧凑格式:精度不超过 {@link DecimalType#MAX_COMPACT_PRECISION} 时,未缩放值直接存放在
 *       {@code long} 中
 *   <li>非紧凑格式:未缩放值存放在 {@link BigInteger} 中
 * </ul>
 *
 * <p>截断、哈希等分区变换只操作未缩放值,标度保持不变,所以这里以未缩放值为中心提供访问方法。
 */
@Public
public final class Decimal implements Comparable<Decimal>, Serializable {

    private static final long serialVersionUID = 1L;

    final int precision;
    final int scale;

    /** 紧凑格式下的未缩放值,非紧凑格式下未定义。 */
    final long longVal;

    /** 非紧凑格式下的未缩放值,紧凑格式下作为缓存。 */
    @Nullable BigInteger unscaledVal;

    Decimal(int precision, int scale, long longVal, @Nullable BigInteger unscaledVal) {
        this.precision = precision;
        this.scale = scale;
        this.longVal = longVal;
        this.unscaledVal = unscaledVal;
    }

    public int precision() {
        return precision;
    }

    public int scale() {
        return scale;
    }

    public boolean isCompact() {
        return isCompact(precision);
    }

    public BigInteger toUnscaledBigInteger() {
        BigInteger unscaled = unscaledVal;
        if (unscaled == null) {
            unscaledVal = unscaled = BigInteger.valueOf(longVal);
        }
        return unscaled;
    }

    public long toUnscaledLong() {
        if (isCompact()) {
            return longVal;
        }
        return toUnscaledBigInteger().longValueExact();
    }

    /** 未缩放值的大端补码最小字节表示,与 {@link BigInteger#toByteArray()} 一致。 */
    public byte[] toUnscaledBytes() {
        return toUnscaledBigInteger().toByteArray();
    }

    public BigDecimal toBigDecimal() {
        return new BigDecimal(toUnscaledBigInteger(), scale);
    }

    public Decimal copy() {
        return new Decimal(precision, scale, longVal, unscaledVal);
    }

    @Override
    public int hashCode() {
        return toBigDecimal().stripTrailingZeros().hashCode();
    }

    @Override
    public int compareTo(@Nonnull Decimal that) {
        if (this.isCompact() && that.isCompact() && this.scale == that.scale) {
            return Long.compare(this.longVal, that.longVal);
        }
        return this.toBigDecimal().compareTo(that.toBigDecimal());
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof Decimal)) {
            return false;
        }
        Decimal that = (Decimal) o;
        return this.compareTo(that) == 0;
    }

    @Override
    public String toString() {
        return toBigDecimal().toPlainString();
    }

    // ------------------------------------------------------------------------------------------
    // Constructor Utilities
    // ------------------------------------------------------------------------------------------

    /**
     * 由未缩放值创建 {@link Decimal}。
     *
     * @return 未缩放值的位数超过 {@code precision} 时返回 {@code null}
     */
    public static @Nullable Decimal fromUnscaledBigInteger(
            BigInteger unscaled, int precision, int scale) {
        checkPrecisionAndScale(precision, scale);
        if (digits(unscaled) > precision) {
            return null;
        }
        if (isCompact(precision)) {
            return new Decimal(precision, scale, unscaled.longValue(), unscaled);
        }
        return new Decimal(precision, scale, -1, unscaled);
    }

    /**
     * 由未缩放 long 值创建 {@link Decimal}。
     *
     * @return 未缩放值的位数超过 {@code precision} 时返回 {@code null}
     */
    public static @Nullable Decimal fromUnscaledLong(long unscaled, int precision, int scale) {
        return fromUnscaledBigInteger(BigInteger.valueOf(unscaled), precision, scale);
    }

    /**
     * 由 {@link BigDecimal} 创建 {@link Decimal},标度必须与 {@code scale} 相同。
     *
     * @return 位数超过 {@code precision} 时返回 {@code null}
     */
    public static @Nullable Decimal fromBigDecimal(BigDecimal bd, int precision, int scale) {
        checkArgument(
                bd.scale() == scale,
                "Scale of %s does not match the declared scale %s.",
                bd.toPlainString(),
                scale);
        return fromUnscaledBigInteger(bd.unscaledValue(), precision, scale);
    }

    public static Decimal zero(int precision, int scale) {
        checkPrecisionAndScale(precision, scale);
        return new Decimal(precision, scale, 0, BigInteger.ZERO);
    }

    // ------------------------------------------------------------------------------------------
    // Utilities
    // ------------------------------------------------------------------------------------------

    public static boolean isCompact(int precision) {
        return precision <= MAX_COMPACT_PRECISION;
    }

    /** 未缩放值的十进制位数,不含符号;0 视为 1 位。 */
    static int digits(BigInteger unscaled) {
        if (unscaled.signum() == 0) {
            return 1;
        }
        return unscaled.abs().toString().length();
    }

    private static void checkPrecisionAndScale(int precision, int scale) {
        checkArgument(
                precision >= DecimalType.MIN_PRECISION && precision <= DecimalType.MAX_PRECISION,
                "Decimal precision must be between %s and %s (both inclusive).",
                DecimalType.MIN_PRECISION,
                DecimalType.MAX_PRECISION);
        checkArgument(
                scale >= DecimalType.MIN_SCALE && scale <= precision,
                "Decimal scale must be between %s and the precision %s (both inclusive).",
                DecimalType.MIN_SCALE,
                precision);
    }
}
