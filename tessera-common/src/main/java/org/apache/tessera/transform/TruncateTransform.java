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
import org.apache.tessera.data.columnar.ByteColumnVector;
import org.apache.tessera.data.columnar.BytesColumnVector;
import org.apache.tessera.data.columnar.DecimalColumnVector;
import org.apache.tessera.data.columnar.IntColumnVector;
import org.apache.tessera.data.columnar.LongColumnVector;
import org.apache.tessera.data.columnar.ShortColumnVector;
import org.apache.tessera.data.columnar.TypedColumn;
import org.apache.tessera.data.columnar.writable.WritableByteVector;
import org.apache.tessera.data.columnar.writable.WritableBytesVector;
import org.apache.tessera.data.columnar.writable.WritableColumnVector;
import org.apache.tessera.data.columnar.writable.WritableDecimalVector;
import org.apache.tessera.data.columnar.writable.WritableIntVector;
import org.apache.tessera.data.columnar.writable.WritableLongVector;
import org.apache.tessera.data.columnar.writable.WritableShortVector;
import org.apache.tessera.options.Options;
import org.apache.tessera.types.BigIntType;
import org.apache.tessera.types.DataType;
import org.apache.tessera.types.DataTypeDefaultVisitor;
import org.apache.tessera.types.DataTypeRoot;
import org.apache.tessera.types.DecimalType;
import org.apache.tessera.types.IntType;
import org.apache.tessera.types.SmallIntType;
import org.apache.tessera.types.TinyIntType;
import org.apache.tessera.types.UBigIntType;
import org.apache.tessera.types.UIntType;
import org.apache.tessera.types.USmallIntType;
import org.apache.tessera.types.UTinyIntType;
import org.apache.tessera.types.VarBinaryType;
import org.apache.tessera.types.VarCharType;

import java.math.BigInteger;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 截断变换:把值映射为不大于它的、按宽度 {@code width} 对齐的值,结果类型与输入相同。
 *
 * <h2>各类型的语义</h2>
 *
 * <ul>
 *   <li>有符号整数:{@code v - floorMod(v, width)},负数向负无穷对齐,例如宽度 10 时 -1 得到 -10
 *   <li>无符号整数:按无符号算术计算 {@code v - v % width}
 *   <li>DECIMAL:对未缩放值做同样的向下对齐,标度不变,例如 DECIMAL(9, 2) 宽度 10 时 12.29 得到 12.20
 *   <li>STRING:保留前 {@code width} 个码点
 *   <li>BYTES:保留前 {@code width} 个字节
 * </ul>
 *
 * <p>结果超出类型范围(例如 TINYINT -128 宽度 10 得到 -130)时抛出 {@link ArithmeticException}。
 * 不支持 BOOLEAN、DATE、TIME 和 TIMESTAMP。
 */
public class TruncateTransform extends AbstractPartitionTransform {

    private static final long serialVersionUID = 1L;

    private final int width;

    TruncateTransform(int width) {
        checkArgument(width >= 1, "Truncate width must be at least 1, but is %s.", width);
        this.width = width;
    }

    public int width() {
        return width;
    }

    @Override
    public boolean canTransform(DataType sourceType) {
        return !sourceType.isAnyOf(
                DataTypeRoot.BOOLEAN,
                DataTypeRoot.DATE,
                DataTypeRoot.TIME_WITHOUT_TIME_ZONE,
                DataTypeRoot.TIMESTAMP);
    }

    @Override
    protected DataType resultType(DataType sourceType) {
        return sourceType;
    }

    @Override
    protected RowKernel createKernel(
            TypedColumn input, WritableColumnVector output, Options options) {
        return input.type().accept(new KernelFactory(input, output));
    }

    // ------------------------------------------------------------------------------------------
    // Scalar truncation
    // ------------------------------------------------------------------------------------------

    /** @throws ArithmeticException 结果小于 {@link Long#MIN_VALUE} */
    public static long truncateLong(long value, int width) {
        return Math.subtractExact(value, Math.floorMod(value, (long) width));
    }

    public static long truncateUnsignedLong(long value, int width) {
        return value - Long.remainderUnsigned(value, width);
    }

    public static BigInteger truncateUnscaled(BigInteger unscaled, int width) {
        return unscaled.subtract(unscaled.mod(BigInteger.valueOf(width)));
    }

    /**
     * 返回 UTF-8 字节序列中前 {@code codePoints} 个码点所占的字节数。
     *
     * <p>按首字节判断码点长度;非法的首字节按单字节计,结果不会超过 {@code len}。
     */
    public static int utf8PrefixLength(byte[] data, int offset, int len, int codePoints) {
        int end = offset + len;
        int pos = offset;
        for (int count = 0; count < codePoints && pos < end; count++) {
            pos += utf8CharLength(data[pos]);
        }
        return Math.min(pos, end) - offset;
    }

    private static int utf8CharLength(byte lead) {
        if ((lead & 0x80) == 0) {
            return 1;
        } else if ((lead & 0xE0) == 0xC0) {
            return 2;
        } else if ((lead & 0xF0) == 0xE0) {
            return 3;
        } else if ((lead & 0xF8) == 0xF0) {
            return 4;
        }
        return 1;
    }

    // ------------------------------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return width == ((TruncateTransform) o).width;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(width);
    }

    @Override
    public String toString() {
        return "truncate[" + width + "]";
    }

    private class KernelFactory extends DataTypeDefaultVisitor<RowKernel> {

        private final TypedColumn input;
        private final WritableColumnVector output;

        private KernelFactory(TypedColumn input, WritableColumnVector output) {
            this.input = input;
            this.output = output;
        }

        private long truncateSigned(DataType type, long value, long min, long max) {
            long result;
            try {
                result = truncateLong(value, width);
            } catch (ArithmeticException e) {
                throw overflow(type, value, e);
            }
            if (result < min || result > max) {
                throw overflow(type, value);
            }
            return result;
        }

        @Override
        public RowKernel visit(TinyIntType tinyIntType) {
            ByteColumnVector in = (ByteColumnVector) input.vector();
            WritableByteVector out = (WritableByteVector) output;
            return row ->
                    out.setByte(
                            row,
                            (byte)
                                    truncateSigned(
                                            tinyIntType,
                                            in.getByte(row),
                                            Byte.MIN_VALUE,
                                            Byte.MAX_VALUE));
        }

        @Override
        public RowKernel visit(SmallIntType smallIntType) {
            ShortColumnVector in = (ShortColumnVector) input.vector();
            WritableShortVector out = (WritableShortVector) output;
            return row ->
                    out.setShort(
                            row,
                            (short)
                                    truncateSigned(
                                            smallIntType,
                                            in.getShort(row),
                                            Short.MIN_VALUE,
                                            Short.MAX_VALUE));
        }

        @Override
        public RowKernel visit(IntType intType) {
            IntColumnVector in = (IntColumnVector) input.vector();
            WritableIntVector out = (WritableIntVector) output;
            return row ->
                    out.setInt(
                            row,
                            (int)
                                    truncateSigned(
                                            intType,
                                            in.getInt(row),
                                            Integer.MIN_VALUE,
                                            Integer.MAX_VALUE));
        }

        @Override
        public RowKernel visit(BigIntType bigIntType) {
            LongColumnVector in = (LongColumnVector) input.vector();
            WritableLongVector out = (WritableLongVector) output;
            return row ->
                    out.setLong(
                            row,
                            truncateSigned(
                                    bigIntType, in.getLong(row), Long.MIN_VALUE, Long.MAX_VALUE));
        }

        @Override
        public RowKernel visit(UTinyIntType uTinyIntType) {
            ByteColumnVector in = (ByteColumnVector) input.vector();
            WritableByteVector out = (WritableByteVector) output;
            return row -> {
                int value = in.getByte(row) & 0xFF;
                out.setByte(row, (byte) (value - value % width));
            };
        }

        @Override
        public RowKernel visit(USmallIntType uSmallIntType) {
            ShortColumnVector in = (ShortColumnVector) input.vector();
            WritableShortVector out = (WritableShortVector) output;
            return row -> {
                int value = in.getShort(row) & 0xFFFF;
                out.setShort(row, (short) (value - value % width));
            };
        }

        @Override
        public RowKernel visit(UIntType uIntType) {
            IntColumnVector in = (IntColumnVector) input.vector();
            WritableIntVector out = (WritableIntVector) output;
            return row -> {
                long value = in.getInt(row) & 0xFFFFFFFFL;
                out.setInt(row, (int) (value - value % width));
            };
        }

        @Override
        public RowKernel visit(UBigIntType uBigIntType) {
            LongColumnVector in = (LongColumnVector) input.vector();
            WritableLongVector out = (WritableLongVector) output;
            return row -> out.setLong(row, truncateUnsignedLong(in.getLong(row), width));
        }

        @Override
        public RowKernel visit(DecimalType decimalType) {
            DecimalColumnVector in = (DecimalColumnVector) input.vector();
            WritableDecimalVector out = (WritableDecimalVector) output;
            int precision = decimalType.getPrecision();
            int scale = decimalType.getScale();
            return row -> {
                Decimal value = in.getDecimal(row, precision, scale);
                Decimal result =
                        Decimal.fromUnscaledBigInteger(
                                truncateUnscaled(value.toUnscaledBigInteger(), width),
                                precision,
                                scale);
                if (result == null) {
                    throw overflow(decimalType, value);
                }
                out.setDecimal(row, result);
            };
        }

        @Override
        public RowKernel visit(VarCharType varCharType) {
            return new PrefixKernel(
                    (BytesColumnVector) input.vector(),
                    (WritableBytesVector) output,
                    input.size(),
                    (data, offset, len) -> utf8PrefixLength(data, offset, len, width));
        }

        @Override
        public RowKernel visit(VarBinaryType varBinaryType) {
            return new PrefixKernel(
                    (BytesColumnVector) input.vector(),
                    (WritableBytesVector) output,
                    input.size(),
                    (data, offset, len) -> Math.min(len, width));
        }

        @Override
        protected RowKernel defaultMethod(DataType dataType) {
            throw unsupportedType(dataType);
        }
    }
}
