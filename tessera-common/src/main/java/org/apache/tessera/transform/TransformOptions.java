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

import org.apache.tessera.options.ConfigOption;

import static org.apache.tessera.options.ConfigOptions.key;

/** 分区变换的配置项。 */
public class TransformOptions {

    public static final ConfigOption<Integer> PARALLELISM =
            key("transform.parallelism")
                    .intType()
                    .defaultValue(Runtime.getRuntime().availableProcessors())
                    .withDescription(
                            "Number of worker threads used to evaluate a transform over large "
                                    + "columns. Defaults to the number of available processors.");

    public static final ConfigOption<Integer> PARALLEL_MIN_ROWS =
            key("transform.parallel.min-rows")
                    .intType()
                    .defaultValue(65536)
                    .withDescription(
                            "Columns with fewer rows than this are evaluated on the calling "
                                    + "thread.");

    public static final ConfigOption<OffsetMode> TIMESTAMP_OFFSET_MODE =
            key("timestamp.offset-mode")
                    .enumType(OffsetMode.class)
                    .defaultValue(OffsetMode.LOCAL)
                    .withDescription(
                            "Whether temporal transforms bucket timestamps with a fixed UTC offset "
                                    + "by their local wall-clock time (LOCAL) or by the UTC "
                                    + "instant (UTC).");

    /**
     * 带固定偏移的时间戳在时间类变换中的取值方式。
     *
     * <p>默认 {@link #LOCAL}。与按 UTC 时刻计算分区值的写入端共用数据时使用 {@link #UTC}。分桶
     * 变换不受影响,总是对 UTC 时刻哈希。
     */
    public enum OffsetMode {
        /** 本地时刻 = UTC 时刻 + 偏移。 */
        LOCAL,
        /** 忽略偏移,直接使用 UTC 时刻。 */
        UTC
    }

    private TransformOptions() {}
}
