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

package org.apache.tessera.utils;

import java.time.LocalDate;

/**
 * 以 1970-01-01T00:00:00 为原点的日期时间换算。天、月、年向负无穷取整,小时向零取整。
 *
 * <p>输入是已经确定的时刻,不处理偏移;带偏移时间戳按本地还是 UTC 时刻计算由
 * {@code timestamp.offset-mode} 决定,默认本地时刻。
 */
public class DateTimeUtils {

    public static final int EPOCH_YEAR = 1970;

    public static final long MICROS_PER_SECOND = 1_000_000L;

    public static final long MICROS_PER_HOUR = 3_600L * MICROS_PER_SECOND;

    public static final long MICROS_PER_DAY = 24L * MICROS_PER_HOUR;

    private DateTimeUtils() {}

    /** 微秒时刻所在的天,1969-12-31T23:59:59.999999 属于第 -1 天。 */
    public static long microsToEpochDay(long micros) {
        return Math.floorDiv(micros, MICROS_PER_DAY);
    }

    /** 自 1970-01 起的月数,使用前推格里历。 */
    public static long epochDayToEpochMonth(long epochDay) {
        LocalDate date = LocalDate.ofEpochDay(epochDay);
        return (date.getYear() - (long) EPOCH_YEAR) * 12 + date.getMonthValue() - 1;
    }

    public static long epochDayToEpochYear(long epochDay) {
        return LocalDate.ofEpochDay(epochDay).getYear() - (long) EPOCH_YEAR;
    }

    /** 自原点起的小时数,向零取整。 */
    public static long microsToEpochHourTruncated(long micros) {
        return micros / MICROS_PER_HOUR;
    }
}
