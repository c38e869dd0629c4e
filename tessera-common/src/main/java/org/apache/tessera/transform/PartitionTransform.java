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
import org.apache.tessera.data.columnar.TypedColumn;
import org.apache.tessera.options.Options;
import org.apache.tessera.types.DataType;

import java.io.Serializable;

/**
 * 分区变换:把一列值映射为基数更小的分区键列。
 *
 * <h2>约定</h2>
 *
 * <ul>
 *   <li>输出列与输入列行数相同,空值位置相同
 *   <li>输出类型只由输入类型决定,见 {@link #getResultType(DataType)}
 *   <li>输入列不会被修改;变换没有跨行状态,实例可以在线程间共享
 *   <li>要么返回完整的输出列,要么抛出异常,不返回部分结果
 * </ul>
 *
 * <h2>异常</h2>
 *
 * <ul>
 *   <li>{@link UnsupportedOperationException}:输入的逻辑类型不被该变换支持
 *   <li>{@link ArithmeticException}:单位换算或结果超出结果类型的范围
 *   <li>{@link IllegalArgumentException}:配置项取值非法
 * </ul>
 *
 * <p>{@link #toString()} 返回规范字符串形式,可以由 {@link PartitionTransforms#fromString(String)}
 * 解析回等价的变换。
 */
@Public
public interface PartitionTransform extends Serializable {

    /** 是否能作用于 {@code sourceType} 类型的列。 */
    boolean canTransform(DataType sourceType);

    /**
     * 作用于 {@code sourceType} 时的结果类型,可空性与输入相同。
     *
     * @throws UnsupportedOperationException {@link #canTransform(DataType)} 为 false 时
     */
    DataType getResultType(DataType sourceType);

    /** 使用默认配置执行变换。 */
    default TypedColumn apply(TypedColumn column) {
        return apply(column, new Options());
    }

    TypedColumn apply(TypedColumn column, Options options);
}
