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
 * 数据类型族的枚举,用于将 {@link DataTypeRoot} 分类到各个类别中。
 *
 * <p>类型族层次结构:
 * <pre>
 * PREDEFINED (预定义类型)
 * ├── CHARACTER_STRING (字符串类型): VARCHAR
 * ├── BINARY_STRING (二进制类型): VARBINARY
 * ├── NUMERIC (数值类型)
 * │   ├── INTEGER_NUMERIC (整数类型): TINYINT .. BIGINT, UTINYINT .. UBIGINT
 * │   ├── UNSIGNED_NUMERIC (无符号整数类型): UTINYINT .. UBIGINT
 * │   └── EXACT_NUMERIC (精确数值类型): INTEGER_NUMERIC + DECIMAL
 * ├── DATETIME (日期时间类型)
 * │   ├── TIME: TIME_WITHOUT_TIME_ZONE
 * │   └── TIMESTAMP: TIMESTAMP
 * └── (其他): BOOLEAN
 * </pre>
 *
 * @see DataTypeRoot 数据类型根枚举
 */
@Public
public enum DataTypeFamily {
    /** 预定义类型族,包含所有基本类型。 */
    PREDEFINED,

    /** 字符串类型族,包含 VARCHAR 类型。 */
    CHARACTER_STRING,

    /** 二进制字符串类型族,包含 VARBINARY 类型。 */
    BINARY_STRING,

    /** 数值类型族,包含所有整数和 DECIMAL 类型。 */
    NUMERIC,

    /** 整数数值类型族,包含有符号和无符号的 8/16/32/64 位整数。 */
    INTEGER_NUMERIC,

    /** 无符号整数类型族。 */
    UNSIGNED_NUMERIC,

    /** 精确数值类型族,包含整数类型和 DECIMAL 类型。 */
    EXACT_NUMERIC,

    /** 日期时间类型族,包含 DATE、TIME 和 TIMESTAMP。 */
    DATETIME,

    /** 时间类型族,包含 TIME_WITHOUT_TIME_ZONE。 */
    TIME,

    /** 时间戳类型族,包含 TIMESTAMP。 */
    TIMESTAMP
}
