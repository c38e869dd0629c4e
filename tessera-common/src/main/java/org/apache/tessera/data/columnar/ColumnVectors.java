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
import org.apache.tessera.data.columnar.heap.HeapBooleanVector;
import org.apache.tessera.data.columnar.heap.HeapByteVector;
import org.apache.tessera.data.columnar.heap.HeapBytesVector;
import org.apache.tessera.data.columnar.heap.HeapDecimalVector;
import org.apache.tessera.data.columnar.heap.HeapIntVector;
import org.apache.tessera.data.columnar.heap.HeapLongVector;
import org.apache.tessera.data.columnar.heap.HeapShortVector;
import org.apache.tessera.data.columnar.writable.WritableBooleanVector;
import org.apache.tessera.data.columnar.writable.WritableByteVector;
import org.apache.tessera.data.columnar.writable.WritableBytesVector;
import org.apache.tessera.data.columnar.writable.WritableColumnVector;
import org.apache.tessera.data.columnar.writable.WritableDecimalVector;
import org.apache.tessera.data.columnar.writable.WritableIntVector;
import org.apache.tessera.data.columnar.writable.WritableLongVector;
import org.apache.tessera.data.columnar.writable.WritableShortVector;
import org.apache.tessera.types.BigIntType;
import org.apache.tessera.types.BooleanType;
import org.apache.tessera.types.DataType;
import org.apache.tessera.types.DataTypeVisitor;
import org.apache.tessera.types.DateType;
import org.apache.tessera.types.DecimalType;
import org.apache.tessera.types.IntType;
import org.apache.tessera.types.SmallIntType;
import org.apache.tessera.types.TimeType;
import org.apache.tessera.types.TimestampType;
import org.apache.tessera.types.TinyIntType;
import org.apache.tessera.types.UBigIntType;
import org.apache.tessera.types.UIntType;
import org.apache.tessera.types.USmallIntType;
import org.apache.tessera.types.UTinyIntType;
import org.apache.tessera.types.VarBinaryType;
import org.apache.tessera.types.VarCharType;

import javax.annotation.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 列向量工具:按逻辑类型分配可写向量,以及在 Java 对象和列值之间转换。
 *
 * <h2>对象形式</h2>
 *
 * <ul>
 *   <li>BOOLEAN:{@link Boolean}
 *   <li>TINYINT / SMALLINT / INT / BIGINT:{@link Byte} / {@link Short} / {@link Integer} /
 *       {@link Long};写入时接受任意 {@link Number} 并截取到物理宽度
 *   <li>无符号整数读出为能容纳其取值的最小类型:{@link Short} / {@link Integer} / {@link Long} /
 *       {@link BigInteger};写入时接受任意 {@link Number},按位模式存放
 *   <li>DECIMAL:{@link Decimal},写入时也接受 {@link BigDecimal}(标度必须能无损调整)
 *   <li>DATE:自 1970-01-01 起的天数 {@link Integer},写入时也接受 {@link LocalDate}
 *   <li>TIME:一天内的微秒数 {@link Long},写入时也接受 {@link LocalTime}
 *   <li>TIMESTAMP:以类型单位计的原始值 {@link Long}
 *   <li>STRING:{@link String};BYTES:{@code byte[]}
 * </ul>
 */
public class ColumnVectors {

    private ColumnVectors() {}

    /** 为 {@code type} 分配容量为 {@code capacity} 的堆内可写向量。 */
    public static WritableColumnVector createWritable(DataType type, int capacity) {
        checkArgument(capacity >= 0, "Capacity must not be negative, but is %s.", capacity);
        return type.accept(new VectorAllocator(capacity));
    }

    public static TypedColumn fromValues(DataType type, Object... values) {
        return fromValues(type, Arrays.asList(values));
    }

    /** 按顺序把 {@code values}(允许 {@code null})写成一列。 */
    public static TypedColumn fromValues(DataType type, List<?> values) {
        WritableColumnVector vector = createWritable(type, values.size());
        ValueWriter writer = type.accept(ValueWriterFactory.INSTANCE);
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (value == null) {
                vector.setNullAt(i);
            } else {
                writer.write(vector, i, value);
            }
        }
        return new TypedColumn(type, vector, values.size());
    }

    @Nullable
    public static Object getValue(TypedColumn column, int i) {
        if (column.isNullAt(i)) {
            return null;
        }
        return column.type().accept(ValueReaderFactory.INSTANCE).read(column.vector(), i);
    }

    // ------------------------------------------------------------------------------------------

    private interface ValueWriter {
        void write(WritableColumnVector vector, int row, Object value);
    }

    private interface ValueReader {
        Object read(ColumnVector vector, int row);
    }

    private static class VectorAllocator implements DataTypeVisitor<WritableColumnVector> {

        private final int capacity;

        private VectorAllocator(int capacity) {
            this.capacity = capacity;
        }

        @Override
        public WritableColumnVector visit(BooleanType booleanType) {
            return new HeapBooleanVector(capacity);
        }

        @Override
        public WritableColumnVector visit(VarCharType varCharType) {
            return new HeapBytesVector(capacity);
        }

        @Override
        public WritableColumnVector visit(VarBinaryType varBinaryType) {
            return new HeapBytesVector(capacity);
        }

        @Override
        public WritableColumnVector visit(DecimalType decimalType) {
            return new HeapDecimalVector(capacity);
        }

        @Override
        public WritableColumnVector visit(TinyIntType tinyIntType) {
            return new HeapByteVector(capacity);
        }

        @Override
        public WritableColumnVector visit(SmallIntType smallIntType) {
            return new HeapShortVector(capacity);
        }

        @Override
        public WritableColumnVector visit(IntType intType) {
            return new HeapIntVector(capacity);
        }

        @Override
        public WritableColumnVector visit(BigIntType bigIntType) {
            return new HeapLongVector(capacity);
        }

        @Override
        public WritableColumnVector visit(UTinyIntType uTinyIntType) {
            return new HeapByteVector(capacity);
        }

        @Override
        public WritableColumnVector visit(USmallIntType uSmallIntType) {
            return new HeapShortVector(capacity);
        }

        @Override
        public WritableColumnVector visit(UIntType uIntType) {
            return new HeapIntVector(capacity);
        }

        @Override
        public WritableColumnVector visit(UBigIntType uBigIntType) {
            return new HeapLongVector(capacity);
        }

        @Override
        public WritableColumnVector visit(DateType dateType) {
            return new HeapIntVector(capacity);
        }

        @Override
        public WritableColumnVector visit(TimeType timeType) {
            return new HeapLongVector(capacity);
        }

        @Override
        public WritableColumnVector visit(TimestampType timestampType) {
            return new HeapLongVector(capacity);
        }
    }

    private static class ValueWriterFactory implements DataTypeVisitor<ValueWriter> {

        private static final ValueWriterFactory INSTANCE = new ValueWriterFactory();

        @Override
        public ValueWriter visit(BooleanType booleanType) {
            return (v, i, o) -> ((WritableBooleanVector) v).setBoolean(i, (Boolean) o);
        }

        @Override
        public ValueWriter visit(VarCharType varCharType) {
            return (v, i, o) -> {
                byte[] bytes = ((String) o).getBytes(StandardCharsets.UTF_8);
                ((WritableBytesVector) v).putByteArray(i, bytes, 0, bytes.length);
            };
        }

        @Override
        public ValueWriter visit(VarBinaryType varBinaryType) {
            return (v, i, o) -> {
                byte[] bytes = (byte[]) o;
                ((WritableBytesVector) v).putByteArray(i, bytes, 0, bytes.length);
            };
        }

        @Override
        public ValueWriter visit(DecimalType decimalType) {
            int precision = decimalType.getPrecision();
            int scale = decimalType.getScale();
            return (v, i, o) -> {
                BigDecimal bd =
                        o instanceof Decimal ? ((Decimal) o).toBigDecimal() : (BigDecimal) o;
                Decimal decimal =
                        Decimal.fromBigDecimal(
                                bd.setScale(scale, RoundingMode.UNNECESSARY), precision, scale);
                checkArgument(
                        decimal != null,
                        "Value %s does not fit into %s.",
                        bd.toPlainString(),
                        decimalType.asSQLString());
                ((WritableDecimalVector) v).setDecimal(i, decimal);
            };
        }

        @Override
        public ValueWriter visit(TinyIntType tinyIntType) {
            return (v, i, o) -> ((WritableByteVector) v).setByte(i, ((Number) o).byteValue());
        }

        @Override
        public ValueWriter visit(SmallIntType smallIntType) {
            return (v, i, o) -> ((WritableShortVector) v).setShort(i, ((Number) o).shortValue());
        }

        @Override
        public ValueWriter visit(IntType intType) {
            return (v, i, o) -> ((WritableIntVector) v).setInt(i, ((Number) o).intValue());
        }

        @Override
        public ValueWriter visit(BigIntType bigIntType) {
            return (v, i, o) -> ((WritableLongVector) v).setLong(i, ((Number) o).longValue());
        }

        @Override
        public ValueWriter visit(UTinyIntType uTinyIntType) {
            return (v, i, o) -> ((WritableByteVector) v).setByte(i, ((Number) o).byteValue());
        }

        @Override
        public ValueWriter visit(USmallIntType uSmallIntType) {
            return (v, i, o) -> ((WritableShortVector) v).setShort(i, ((Number) o).shortValue());
        }

        @Override
        public ValueWriter visit(UIntType uIntType) {
            return (v, i, o) -> ((WritableIntVector) v).setInt(i, ((Number) o).intValue());
        }

        @Override
        public ValueWriter visit(UBigIntType uBigIntType) {
            return (v, i, o) -> ((WritableLongVector) v).setLong(i, ((Number) o).longValue());
        }

        @Override
        public ValueWriter visit(DateType dateType) {
            return (v, i, o) -> {
                int days =
                        o instanceof LocalDate
                                ? Math.toIntExact(((LocalDate) o).toEpochDay())
                                : ((Number) o).intValue();
                ((WritableIntVector) v).setInt(i, days);
            };
        }

        @Override
        public ValueWriter visit(TimeType timeType) {
            return (v, i, o) -> {
                long micros =
                        o instanceof LocalTime
                                ? ((LocalTime) o).toNanoOfDay() / 1000
                                : ((Number) o).longValue();
                ((WritableLongVector) v).setLong(i, micros);
            };
        }

        @Override
        public ValueWriter visit(TimestampType timestampType) {
            return (v, i, o) -> ((WritableLongVector) v).setLong(i, ((Number) o).longValue());
        }
    }

    private static class ValueReaderFactory implements DataTypeVisitor<ValueReader> {

        private static final ValueReaderFactory INSTANCE = new ValueReaderFactory();

        private static final BigInteger TWO_64 = BigInteger.ONE.shiftLeft(64);

        @Override
        public ValueReader visit(BooleanType booleanType) {
            return (v, i) -> ((BooleanColumnVector) v).getBoolean(i);
        }

        @Override
        public ValueReader visit(VarCharType varCharType) {
            return (v, i) -> ((BytesColumnVector) v).getBytes(i).toUtf8String();
        }

        @Override
        public ValueReader visit(VarBinaryType varBinaryType) {
            return (v, i) -> {
                BytesColumnVector.Bytes bytes = ((BytesColumnVector) v).getBytes(i);
                return Arrays.copyOfRange(bytes.data, bytes.offset, bytes.offset + bytes.len);
            };
        }

        @Override
        public ValueReader visit(DecimalType decimalType) {
            return (v, i) ->
                    ((DecimalColumnVector) v)
                            .getDecimal(i, decimalType.getPrecision(), decimalType.getScale());
        }

        @Override
        public ValueReader visit(TinyIntType tinyIntType) {
            return (v, i) -> ((ByteColumnVector) v).getByte(i);
        }

        @Override
        public ValueReader visit(SmallIntType smallIntType) {
            return (v, i) -> ((ShortColumnVector) v).getShort(i);
        }

        @Override
        public ValueReader visit(IntType intType) {
            return (v, i) -> ((IntColumnVector) v).getInt(i);
        }

        @Override
        public ValueReader visit(BigIntType bigIntType) {
            return (v, i) -> ((LongColumnVector) v).getLong(i);
        }

        @Override
        public ValueReader visit(UTinyIntType uTinyIntType) {
            return (v, i) -> (short) (((ByteColumnVector) v).getByte(i) & 0xFF);
        }

        @Override
        public ValueReader visit(USmallIntType uSmallIntType) {
            return (v, i) -> ((ShortColumnVector) v).getShort(i) & 0xFFFF;
        }

        @Override
        public ValueReader visit(UIntType uIntType) {
            return (v, i) -> ((IntColumnVector) v).getInt(i) & 0xFFFFFFFFL;
        }

        @Override
        public ValueReader visit(UBigIntType uBigIntType) {
            return (v, i) -> {
                long bits = ((LongColumnVector) v).getLong(i);
                BigInteger value = BigInteger.valueOf(bits);
                return bits >= 0 ? value : value.add(TWO_64);
            };
        }

        @Override
        public ValueReader visit(DateType dateType) {
            return (v, i) -> ((IntColumnVector) v).getInt(i);
        }

        @Override
        public ValueReader visit(TimeType timeType) {
            return (v, i) -> ((LongColumnVector) v).getLong(i);
        }

        @Override
        public ValueReader visit(TimestampType timestampType) {
            return (v, i) -> ((LongColumnVector) v).getLong(i);
        }
    }
}
