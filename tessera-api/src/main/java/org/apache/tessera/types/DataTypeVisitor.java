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
 * {@link DataType} 的访问者模式定义。
 *
 * <p>访问者把一个数据类型转换为 {@code R} 类型的实例。类型集合是封闭的,每个具体类型在这里都有
 * 一个 {@code visit} 方法;分区变换为每个类型返回一个逐元素的标量函数,或对不支持的类型抛出异常。
 *
 * <pre>{@code
 * class UnitExtractor extends DataTypeDefaultVisitor<TimeUnit> {
 *     @Override
 *     public TimeUnit visit(TimestampType timestampType) {
 *         return timestampType.getUnit();
 *     }
 *
 *     @Override
 *     protected TimeUnit defaultMethod(DataType dataType) {
 *         throw new UnsupportedOperationException("No time unit for " + dataType);
 *     }
 * }
 * }</pre>
 *
 * @param <R> 访问结果的类型
 */
@Public
public interface DataTypeVisitor<R> {

    R visit(BooleanType booleanType);

    R visit(VarCharType varCharType);

    R visit(VarBinaryType varBinaryType);

    R visit(DecimalType decimalType);

    R visit(TinyIntType tinyIntType);

    R visit(SmallIntType smallIntType);

    R visit(IntType intType);

    R visit(BigIntType bigIntType);

    R visit(UTinyIntType uTinyIntType);

    R visit(USmallIntType uSmallIntType);

    R visit(UIntType uIntType);

    R visit(UBigIntType uBigIntType);

    R visit(DateType dateType);

    R visit(TimeType timeType);

    R visit(TimestampType timestampType);
}
