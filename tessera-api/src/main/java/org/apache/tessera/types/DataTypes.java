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

package org.apache.tessera.types;

import org.apache.tessera.annotation.Public;

/**
 * 用于创建 {@link DataType} 的工厂方法集合。
 *
 * <pre>{@code
 * DataType id = DataTypes.BIGINT();
 * DataType price = DataTypes.DECIMAL(10, 2);
 * DataType eventTime = DataTypes.TIMESTAMP(TimeUnit.MILLISECOND, "+08:00");
 * }</pre>
 */
@Public
public class DataTypes {

    public static BooleanType BOOLEAN() {
        return new BooleanType();
    }

    public static TinyIntType TINYINT() {
        return new TinyIntType();
    }

    public static SmallIntType SMALLINT() {
        return new SmallIntType();
    }

    public static IntType INT() {
        return new IntType();
    }

    public static BigIntType BIGINT() {
        return new BigIntType();
    }

    public static UTinyIntType UTINYINT() {
        return new UTinyIntType();
    }

    public static USmallIntType USMALLINT() {
        return new USmallIntType();
    }

    public static UIntType UINT() {
        return new UIntType();
    }

    public static UBigIntType UBIGINT() {
        return new UBigIntType();
    }

    public static DecimalType DECIMAL(int precision, int scale) {
        return new DecimalType(precision, scale);
    }

    public static DateType DATE() {
        return new DateType();
    }

    public static TimeType TIME() {
        return new TimeType();
    }

    /** 微秒单位、没有 UTC 偏移的时间戳。 */
    public static TimestampType TIMESTAMP() {
        return new TimestampType();
    }

    public static TimestampType TIMESTAMP(TimeUnit unit) {
        return new TimestampType(unit);
    }

    public static TimestampType TIMESTAMP(TimeUnit unit, String offset) {
        return new TimestampType(unit, offset);
    }

    public static VarCharType STRING() {
        return new VarCharType();
    }

    public static VarBinaryType BYTES() {
        return new VarBinaryType();
    }

    private DataTypes() {}
}
