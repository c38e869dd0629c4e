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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 数据类型的根分类,不包含类型参数(如精度、时间单位、UTC 偏移)。
 *
 * <p>每个根属于一个或多个 {@link DataTypeFamily}。分区变换通过 {@link DataTypeVisitor} 做穷举分派,
 * 类型根只用于快速的族判断和错误消息。
 */
@Public
public enum DataTypeRoot {
    /** 变长 UTF-8 字符串。 */
    VARCHAR(DataTypeFamily.PREDEFINED, DataTypeFamily.CHARACTER_STRING),

    /** 布尔类型。 */
    BOOLEAN(DataTypeFamily.PREDEFINED),

    /** 变长二进制类型。 */
    VARBINARY(DataTypeFamily.PREDEFINED, DataTypeFamily.BINARY_STRING),

    /** 定点数类型,例如 DECIMAL(10,2)。 */
    DECIMAL(DataTypeFamily.PREDEFINED, DataTypeFamily.NUMERIC, DataTypeFamily.EXACT_NUMERIC),

    /** 1 字节有符号整数,范围 -128 到 127。 */
    TINYINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 2 字节有符号整数,范围 -32,768 到 32,767。 */
    SMALLINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 4 字节有符号整数。 */
    INTEGER(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 8 字节有符号整数。 */
    BIGINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 1 字节无符号整数,范围 0 到 255。 */
    UTINYINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 2 字节无符号整数,范围 0 到 65,535。 */
    USMALLINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 4 字节无符号整数,范围 0 到 4,294,967,295。 */
    UINTEGER(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 8 字节无符号整数,范围 0 到 2^64 - 1。 */
    UBIGINT(
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    /** 日期类型,1970-01-01 起的有符号天数。 */
    DATE(DataTypeFamily.PREDEFINED, DataTypeFamily.DATETIME),

    /** 不带时区的时间类型,当天零点起的微秒数。 */
    TIME_WITHOUT_TIME_ZONE(DataTypeFamily.PREDEFINED, DataTypeFamily.DATETIME, DataTypeFamily.TIME),

    /**
     * 时间戳类型。
     *
     * <p>存储纪元起的 UTC 时刻(单位由 {@link TimeUnit} 决定),可选地附带一个固定 UTC 偏移。
     */
    TIMESTAMP(DataTypeFamily.PREDEFINED, DataTypeFamily.DATETIME, DataTypeFamily.TIMESTAMP);

    /** 该类型根所属的类型族集合,不可变 */
    private final Set<DataTypeFamily> families;

    DataTypeRoot(DataTypeFamily firstFamily, DataTypeFamily... otherFamilies) {
        this.families = Collections.unmodifiableSet(EnumSet.of(firstFamily, otherFamilies));
    }

    public Set<DataTypeFamily> getFamilies() {
        return families;
    }
}
