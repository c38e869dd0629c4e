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
import org.apache.tessera.utils.Preconditions;

import javax.annotation.Nullable;

import java.time.DateTimeException;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * 时间戳数据类型,值为纪元(1970-01-01T00:00:00Z)起的有符号 64 位计数。
 *
 * <p>类型参数:
 * <ul>
 *   <li><b>时间单位</b>: 秒、毫秒、微秒或纳秒,决定原始值的含义
 *   <li><b>固定 UTC 偏移</b>: 可选,例如 {@code "-08:00"}。存储的值始终是 UTC 时刻,偏移只决定
 *       本地挂钟时间;不是带夏令时规则的命名时区
 * </ul>
 *
 * <p>没有偏移的时间戳按朴素时间(等同 UTC)解释。
 *
 * @see TimeUnit
 */
@Public
public class TimestampType extends DataType {

    private static final long serialVersionUID = 1L;

    public static final TimeUnit DEFAULT_UNIT = TimeUnit.MICROSECOND;

    private static final String FORMAT = "TIMESTAMP(%s)";

    private static final String FORMAT_WITH_OFFSET = "TIMESTAMP(%s, %s)";

    private static final long MICROS_PER_SECOND = 1_000_000L;

    private final TimeUnit unit;

    @Nullable private final String offset;

    /** 偏移量换算得到的秒数,没有偏移时为 0。 */
    private final int offsetSeconds;

    public TimestampType(boolean isNullable, TimeUnit unit, @Nullable String offset) {
        super(isNullable, DataTypeRoot.TIMESTAMP);
        this.unit = Preconditions.checkNotNull(unit, "Time unit must not be null.");
        this.offset = offset;
        this.offsetSeconds = offset == null ? 0 : parseOffsetSeconds(offset);
    }

    public TimestampType(TimeUnit unit, @Nullable String offset) {
        this(true, unit, offset);
    }

    public TimestampType(TimeUnit unit) {
        this(unit, null);
    }

    public TimestampType() {
        this(DEFAULT_UNIT);
    }

    public TimeUnit getUnit() {
        return unit;
    }

    /** 返回固定 UTC 偏移的原始字符串,没有偏移时返回 {@code null}。 */
    @Nullable
    public String getOffset() {
        return offset;
    }

    public boolean hasOffset() {
        return offset != null;
    }

    /** 返回 UTC 偏移对应的微秒数,本地时刻 = UTC 时刻 + 该值。 */
    public long getOffsetMicros() {
        return offsetSeconds * MICROS_PER_SECOND;
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public DataType copy(boolean isNullable) {
        return new TimestampType(isNullable, unit, offset);
    }

    @Override
    public String asSQLString() {
        if (offset == null) {
            return withNullability(FORMAT, unit.shortName());
        }
        return withNullability(FORMAT_WITH_OFFSET, unit.shortName(), offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        if (!super.equals(o)) {
            return false;
        }
        TimestampType that = (TimestampType) o;
        return unit == that.unit && Objects.equals(offset, that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), unit, offset);
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    private static int parseOffsetSeconds(String offset) {
        try {
            return ZoneOffset.of(offset).getTotalSeconds();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Timestamp offset '%s' is not a fixed UTC offset such as '+08:00'.",
                            offset),
                    e);
        }
    }
}
