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
 * 时间戳的存储单位。
 *
 * <p>{@link #toMicros(long)} 把该单位下的原始值换算为纪元起的微秒数:
 * <ul>
 *   <li>秒和毫秒按精确乘法换算,超出 long 范围时抛出 {@link ArithmeticException}
 *   <li>纳秒按向负无穷取整的除法换算,因此纪元前的纳秒值落在前一个微秒上
 * </ul>
 */
@Public
public enum TimeUnit {
    SECOND("s", 1_000_000L),
    MILLISECOND("ms", 1_000L),
    MICROSECOND("us", 1L),
    NANOSECOND("ns", 1L);

    private static final long NANOS_PER_MICRO = 1_000L;

    private final String shortName;

    private final long microsPerUnit;

    TimeUnit(String shortName, long microsPerUnit) {
        this.shortName = shortName;
        this.microsPerUnit = microsPerUnit;
    }

    public String shortName() {
        return shortName;
    }

    public long toMicros(long value) {
        if (this == NANOSECOND) {
            return Math.floorDiv(value, NANOS_PER_MICRO);
        }
        return Math.multiplyExact(value, microsPerUnit);
    }

    /** 按短名称({@code s}、{@code ms}、{@code us}、{@code ns})或枚举名查找时间单位。 */
    public static TimeUnit fromString(String name) {
        for (TimeUnit unit : values()) {
            if (unit.shortName.equalsIgnoreCase(name) || unit.name().equalsIgnoreCase(name)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown time unit: " + name);
    }
}
