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
import org.apache.tessera.data.columnar.ColumnVector;
import org.apache.tessera.data.columnar.DecimalColumnVector;
import org.apache.tessera.data.columnar.IntColumnVector;
import org.apache.tessera.data.columnar.LongColumnVector;
import org.apache.tessera.data.columnar.ShortColumnVector;
import org.apache.tessera.types.BigIntType;
import org.apache.tessera.types.BooleanType;
import org.apache.tessera.types.DataType;
import org.apache.tessera.types.DataTypeVisitor;
import org.apache.tessera.types.DateType;
import org.apache.tessera.types.DecimalType;
import org.apache.tessera.types.IntType;
import org.apache.tessera.types.SmallIntType;
import org.apache.tessera.types.TimeType;
import org.apache.tessera.types.TimeUnit;
import org.apache.tessera.types.TimestampType;
import org.apache.tessera.types.TinyIntType;
import org.apache.tessera.types.UBigIntType;
import org.apache.tessera.types.UIntType;
import org.apache.tessera.types.USmallIntType;
import org.apache.tessera.types.UTinyIntType;
import org.apache.tessera.types.VarBinaryType;
import org.apache.tessera.types.VarCharType;
import org.apache.tessera.utils.MurmurHashUtils;

import java.nio.charset.StandardCharsets;

/**
 * 分桶使用的 32 位哈希,对每种类型先转换为规范字节编码,再求 {@link MurmurHashUtils} 哈希。
 *
 * <h2>规范编码</h2>
 *
 * <ul>
 *   <li>8/16/32/64 位整数:扩展为 64 位后的 8 字节小端序;有符号类型做符号扩展,无符号类型做零
 *       扩展,因此逻辑值相同的 INT 与 BIGINT 得到相同的哈希
 *   <li>DECIMAL:未缩放值的大端补码最小字节表示
 *   <li>DATE:天数扩展为 64 位后的 8 字节小端序
 *   <li>TIME:一天内的微秒数,8 字节小端序
 *   <li>TIMESTAMP:UTC 微秒数,8 字节小端序;忽略固定偏移,纳秒向负无穷取整
 *   <li>STRING:UTF-8 字节;BYTES:原始字节
 * </ul>
 *
 * <p>BOOLEAN 不支持分桶。
 */
public class BucketHash implements DataTypeVisitor<BucketHash.RowHasher> {

    /** 对列中一个非空行求哈希。 */
    @FunctionalInterface
    public interface RowHasher {
        int hash(int row);
    }

    private final ColumnVector vector;

    private BucketHash(ColumnVector vector) {
        this.vector = vector;
    }

    /**
     * 为 {@code type} 类型的列创建逐行哈希函数。
     *
     * @throws UnsupportedOperationException {@code type} 不支持分桶
     */
    public static RowHasher hasher(DataType type, ColumnVector vector) {
        return type.accept(new BucketHash(vector));
    }

    // ------------------------------------------------------------------------------------------
    // Scalar hashes
    // ------------------------------------------------------------------------------------------

    public static int hashLong(long value) {
        return MurmurHashUtils.hashLong(value);
    }

    public static int hashDecimal(Decimal value) {
        return MurmurHashUtils.hashBytes(value.toUnscaledBytes());
    }

    public static int hashDate(int epochDay) {
        return MurmurHashUtils.hashLong(epochDay);
    }

    public static int hashTime(long microsOfDay) {
        return MurmurHashUtils.hashLong(microsOfDay);
    }

    /** @throws ArithmeticException 换算为微秒时超出 long 范围 */
    public static int hashTimestamp(long value, TimeUnit unit) {
        return MurmurHashUtils.hashLong(unit.toMicros(value));
    }

    public static int hashString(String value) {
        return MurmurHashUtils.hashBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    public static int hashBytes(byte[] value) {
        return MurmurHashUtils.hashBytes(value);
    }

    // ------------------------------------------------------------------------------------------

    @Override
    public RowHasher visit(BooleanType booleanType) {
        throw new UnsupportedOperationException("Cannot hash " + booleanType.asSQLString());
    }

    @Override
    public RowHasher visit(VarCharType varCharType) {
        return this::hashBytesAt;
    }

    @Override
    public RowHasher visit(VarBinaryType varBinaryType) {
        return this::hashBytesAt;
    }

    private int hashBytesAt(int row) {
        BytesColumnVector.Bytes bytes = ((BytesColumnVector) vector).getBytes(row);
        return MurmurHashUtils.hashBytes(bytes.data, bytes.offset, bytes.len);
    }

    @Override
    public RowHasher visit(DecimalType decimalType) {
        DecimalColumnVector decimals = (DecimalColumnVector) vector;
        int precision = decimalType.getPrecision();
        int scale = decimalType.getScale();
        return row -> hashDecimal(decimals.getDecimal(row, precision, scale));
    }

    @Override
    public RowHasher visit(TinyIntType tinyIntType) {
        ByteColumnVector bytes = (ByteColumnVector) vector;
        return row -> hashLong(bytes.getByte(row));
    }

    @Override
    public RowHasher visit(SmallIntType smallIntType) {
        ShortColumnVector shorts = (ShortColumnVector) vector;
        return row -> hashLong(shorts.getShort(row));
    }

    @Override
    public RowHasher visit(IntType intType) {
        IntColumnVector ints = (IntColumnVector) vector;
        return row -> hashLong(ints.getInt(row));
    }

    @Override
    public RowHasher visit(BigIntType bigIntType) {
        LongColumnVector longs = (LongColumnVector) vector;
        return row -> hashLong(longs.getLong(row));
    }

    @Override
    public RowHasher visit(UTinyIntType uTinyIntType) {
        ByteColumnVector bytes = (ByteColumnVector) vector;
        return row -> hashLong(bytes.getByte(row) & 0xFFL);
    }

    @Override
    public RowHasher visit(USmallIntType uSmallIntType) {
        ShortColumnVector shorts = (ShortColumnVector) vector;
        return row -> hashLong(shorts.getShort(row) & 0xFFFFL);
    }

    @Override
    public RowHasher visit(UIntType uIntType) {
        IntColumnVector ints = (IntColumnVector) vector;
        return row -> hashLong(ints.getInt(row) & 0xFFFFFFFFL);
    }

    @Override
    public RowHasher visit(UBigIntType uBigIntType) {
        LongColumnVector longs = (LongColumnVector) vector;
        return row -> hashLong(longs.getLong(row));
    }

    @Override
    public RowHasher visit(DateType dateType) {
        IntColumnVector days = (IntColumnVector) vector;
        return row -> hashDate(days.getInt(row));
    }

    @Override
    public RowHasher visit(TimeType timeType) {
        LongColumnVector micros = (LongColumnVector) vector;
        return row -> hashTime(micros.getLong(row));
    }

    @Override
    public RowHasher visit(TimestampType timestampType) {
        LongColumnVector values = (LongColumnVector) vector;
        TimeUnit unit = timestampType.getUnit();
        return row -> hashTimestamp(values.getLong(row), unit);
    }
}
