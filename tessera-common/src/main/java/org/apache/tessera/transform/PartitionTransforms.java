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

import org.apache.tessera.annotation.Public;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * {@link PartitionTransform} 的工厂方法和字符串解析。
 *
 * <pre>{@code
 * PartitionTransform day = PartitionTransforms.days();
 * PartitionTransform bucket = PartitionTransforms.bucket(16);
 * PartitionTransform parsed = PartitionTransforms.fromString("truncate[10]");
 * }</pre>
 */
@Public
public class PartitionTransforms {

    private static final Pattern HAS_WIDTH = Pattern.compile("(\\w+)\\[(\\d+)\\]");

    private PartitionTransforms() {}

    /**
     * 解析变换的字符串形式,不区分大小写。
     *
     * <p>接受 {@code day}、{@code days}、{@code month}、{@code months}、{@code year}、
     * {@code years}、{@code hour}、{@code hours}、{@code bucket[N]} 和 {@code truncate[W]}。
     *
     * @throws IllegalArgumentException 无法识别的字符串,或参数不合法
     */
    public static PartitionTransform fromString(String transform) {
        checkNotNull(transform, "transform must not be null");
        String normalized = transform.trim().toLowerCase(Locale.ROOT);

        Matcher widthMatcher = HAS_WIDTH.matcher(normalized);
        if (widthMatcher.matches()) {
            String name = widthMatcher.group(1);
            int parameter = parseParameter(transform, widthMatcher.group(2));
            if (name.equals("bucket")) {
                return bucket(parameter);
            } else if (name.equals("truncate")) {
                return truncate(parameter);
            }
        }

        switch (normalized) {
            case "day":
            case "days":
                return days();
            case "month":
            case "months":
                return months();
            case "year":
            case "years":
                return years();
            case "hour":
            case "hours":
                return hours();
            default:
                throw new IllegalArgumentException(
                        String.format("Unsupported transform: %s", transform));
        }
    }

    private static int parseParameter(String transform, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Transform parameter of %s is out of range.", transform), e);
        }
    }

    /** 日期或时间戳所在的天,结果类型 DATE。 */
    public static PartitionTransform days() {
        return TemporalTransform.DAY;
    }

    /** 日期或时间戳自 1970-01 起的月数。 */
    public static PartitionTransform months() {
        return TemporalTransform.MONTH;
    }

    /** 日期或时间戳自 1970 起的年数。 */
    public static PartitionTransform years() {
        return TemporalTransform.YEAR;
    }

    /**
     * 时间戳自纪元起的小时数,向零取整。
     *
     * <p>带固定偏移的时间戳默认按本地时刻分区({@link TransformOptions.OffsetMode#LOCAL})。既有数据
     * 按 UTC 时刻分区时,需要把 {@link TransformOptions#TIMESTAMP_OFFSET_MODE} 设为
     * {@link TransformOptions.OffsetMode#UTC},否则同一时刻会落在不同的小时分区。
     */
    public static PartitionTransform hours() {
        return TemporalTransform.HOUR;
    }

    /**
     * 哈希分桶,桶号在 {@code [0, numBuckets)} 中。
     *
     * <p>桶数最大为 {@link Integer#MAX_VALUE}。桶号由去掉符号位的 31 位哈希取模得到,更大的桶数
     * 不会带来更多的桶:除去哈希恰为 {@code Integer.MAX_VALUE} 的情况,它们与
     * {@code bucket(Integer.MAX_VALUE)} 的结果相同。
     *
     * @throws IllegalArgumentException {@code numBuckets < 1}
     */
    public static PartitionTransform bucket(int numBuckets) {
        return new BucketTransform(numBuckets);
    }

    public static PartitionTransform truncate(int width) {
        return new TruncateTransform(width);
    }
}
