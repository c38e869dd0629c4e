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

import org.apache.tessera.data.columnar.IntColumnVector;
import org.apache.tessera.data.columnar.LongColumnVector;
import org.apache.tessera.data.columnar.TypedColumn;
import org.apache.tessera.data.columnar.writable.WritableColumnVector;
import org.apache.tessera.data.columnar.writable.WritableIntVector;
import org.apache.tessera.options.Options;
import org.apache.tessera.transform.TransformOptions.OffsetMode;
import org.apache.tessera.types.DataType;
import org.apache.tessera.types.DataTypeDefaultVisitor;
import org.apache.tessera.types.DataTypeRoot;
import org.apache.tessera.types.DataTypes;
import org.apache.tessera.types.DateType;
import org.apache.tessera.types.TimeUnit;
import org.apache.tessera.types.TimestampType;
import org.apache.tessera.utils.DateTimeUtils;

import java.io.InvalidObjectException;
import java.io.ObjectStreamException;

/**
 * 时间分区变换:把日期或时间戳映射为自 1970-01-01 起的天、月、年或小时序号。
 *
 * <h2>计算步骤</h2>
 *
 * <ol>
 *   <li>时间戳按类型单位换算为 UTC 微秒;纳秒向负无穷取整,秒和毫秒溢出时报错
 *   <li>时间戳带固定偏移且 {@link TransformOptions#TIMESTAMP_OFFSET_MODE} 为 {@code LOCAL} 时,
 *       加上偏移得到本地时刻;日期直接视为本地零点
 *   <li>天:向负无穷取整的天数,结果类型 DATE
 *   <li>月:{@code (year - 1970) * 12 + (month - 1)},结果类型 INT
 *   <li>年:{@code year - 1970},结果类型 INT
 *   <li>小时:微秒数除以一小时的微秒数后向零取整,结果类型 INT;只接受时间戳
 * </ol>
 *
 * <p>小时向零取整而其余粒度向负无穷取整,1970 年之前的时刻在两种粒度下的边界因此不同。这与现有
 * 数据的分区值保持一致,不能修改。
 */
public class TemporalTransform extends AbstractPartitionTransform {

    private static final long serialVersionUID = 1L;

    static final TemporalTransform DAY = new TemporalTransform(Granularity.DAY);
    static final TemporalTransform MONTH = new TemporalTransform(Granularity.MONTH);
    static final TemporalTransform YEAR = new TemporalTransform(Granularity.YEAR);
    static final TemporalTransform HOUR = new TemporalTransform(Granularity.HOUR);

    /** 时间粒度,名称即变换的规范字符串。 */
    public enum Granularity {
        DAY("day"),
        MONTH("month"),
        YEAR("year"),
        HOUR("hour");

        private final String name;

        Granularity(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private final Granularity granularity;

    private TemporalTransform(Granularity granularity) {
        this.granularity = granularity;
    }

    public Granularity granularity() {
        return granularity;
    }

    @Override
    public boolean canTransform(DataType sourceType) {
        if (granularity == Granularity.HOUR) {
            return sourceType.is(DataTypeRoot.TIMESTAMP);
        }
        return sourceType.isAnyOf(DataTypeRoot.DATE, DataTypeRoot.TIMESTAMP);
    }

    @Override
    protected DataType resultType(DataType sourceType) {
        return granularity == Granularity.DAY ? DataTypes.DATE() : DataTypes.INT();
    }

    @Override
    protected RowKernel createKernel(
            TypedColumn input, WritableColumnVector output, Options options) {
        OffsetMode offsetMode = options.get(TransformOptions.TIMESTAMP_OFFSET_MODE);
        return input.type()
                .accept(new KernelFactory(input, (WritableIntVector) output, offsetMode));
    }

    /** 对已经换算为本地时刻的微秒数求分区值。 */
    private long fromMicros(long micros) {
        switch (granularity) {
            case DAY:
                return DateTimeUtils.microsToEpochDay(micros);
            case MONTH:
                return DateTimeUtils.epochDayToEpochMonth(DateTimeUtils.microsToEpochDay(micros));
            case YEAR:
                return DateTimeUtils.epochDayToEpochYear(DateTimeUtils.microsToEpochDay(micros));
            case HOUR:
                return DateTimeUtils.microsToEpochHourTruncated(micros);
            default:
                throw new UnsupportedOperationException("Unsupported granularity: " + granularity);
        }
    }

    private long fromEpochDay(int epochDay) {
        switch (granularity) {
            case DAY:
                return epochDay;
            case MONTH:
                return DateTimeUtils.epochDayToEpochMonth(epochDay);
            case YEAR:
                return DateTimeUtils.epochDayToEpochYear(epochDay);
            default:
                throw new UnsupportedOperationException("Unsupported granularity: " + granularity);
        }
    }

    private int toIntExact(long result, DataType type, Object value) {
        if (result < Integer.MIN_VALUE || result > Integer.MAX_VALUE) {
            throw overflow(type, value);
        }
        return (int) result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return granularity == ((TemporalTransform) o).granularity;
    }

    @Override
    public int hashCode() {
        return granularity.hashCode();
    }

    @Override
    public String toString() {
        return granularity.toString();
    }

    private Object readResolve() throws ObjectStreamException {
        if (granularity == null) {
            throw new InvalidObjectException("Missing granularity");
        }
        switch (granularity) {
            case DAY:
                return DAY;
            case MONTH:
                return MONTH;
            case YEAR:
                return YEAR;
            case HOUR:
                return HOUR;
            default:
                throw new InvalidObjectException("Unsupported granularity: " + granularity);
        }
    }

    // ------------------------------------------------------------------------------------------

    private class KernelFactory extends DataTypeDefaultVisitor<RowKernel> {

        private final TypedColumn input;
        private final WritableIntVector output;
        private final OffsetMode offsetMode;

        private KernelFactory(TypedColumn input, WritableIntVector output, OffsetMode offsetMode) {
            this.input = input;
            this.output = output;
            this.offsetMode = offsetMode;
        }

        @Override
        public RowKernel visit(DateType dateType) {
            IntColumnVector days = (IntColumnVector) input.vector();
            return row -> {
                int epochDay = days.getInt(row);
                output.setInt(row, toIntExact(fromEpochDay(epochDay), dateType, epochDay));
            };
        }

        @Override
        public RowKernel visit(TimestampType timestampType) {
            LongColumnVector values = (LongColumnVector) input.vector();
            TimeUnit unit = timestampType.getUnit();
            long offsetMicros =
                    offsetMode == OffsetMode.LOCAL ? timestampType.getOffsetMicros() : 0L;
            return row -> {
                long raw = values.getLong(row);
                long local;
                try {
                    local = Math.addExact(unit.toMicros(raw), offsetMicros);
                } catch (ArithmeticException e) {
                    throw overflow(timestampType, raw, e);
                }
                output.setInt(row, toIntExact(fromMicros(local), timestampType, raw));
            };
        }

        @Override
        protected RowKernel defaultMethod(DataType dataType) {
            throw unsupportedType(dataType);
        }
    }
}
