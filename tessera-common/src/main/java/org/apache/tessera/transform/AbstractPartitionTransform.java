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

import org.apache.tessera.data.columnar.ColumnVectors;
import org.apache.tessera.data.columnar.TypedColumn;
import org.apache.tessera.data.columnar.writable.WritableColumnVector;
import org.apache.tessera.options.Options;
import org.apache.tessera.types.DataType;

/**
 * {@link PartitionTransform} 的公共执行流程:检查输入类型,分配输出向量,由子类按类型构造
 * {@link RowKernel},再交给 {@link TransformExecutor} 按行区间执行。
 */
public abstract class AbstractPartitionTransform implements PartitionTransform {

    private static final long serialVersionUID = 1L;

    @Override
    public DataType getResultType(DataType sourceType) {
        if (!canTransform(sourceType)) {
            throw unsupportedType(sourceType);
        }
        return resultType(sourceType).copy(sourceType.isNullable());
    }

    @Override
    public final TypedColumn apply(TypedColumn column, Options options) {
        DataType resultType = getResultType(column.type());
        WritableColumnVector output = ColumnVectors.createWritable(resultType, column.size());
        RowKernel kernel = createKernel(column, output, options);
        new TransformExecutor(options).execute(toString(), column, output, kernel);
        return new TypedColumn(resultType, output, column.size());
    }

    /** 只对 {@link #canTransform(DataType)} 为 true 的类型调用。 */
    protected abstract DataType resultType(DataType sourceType);

    /** 构造把输入列的非空行写入 {@code output} 的逐行逻辑。 */
    protected abstract RowKernel createKernel(
            TypedColumn input, WritableColumnVector output, Options options);

    protected UnsupportedOperationException unsupportedType(DataType type) {
        return new UnsupportedOperationException(
                String.format("Cannot apply %s to %s", this, type.asSQLString()));
    }

    protected ArithmeticException overflow(DataType type, Object value) {
        return new ArithmeticException(
                String.format(
                        "Cannot apply %s to %s value %s: result is out of range",
                        this, type.asSQLString(), value));
    }

    protected ArithmeticException overflow(DataType type, Object value, ArithmeticException cause) {
        ArithmeticException e = overflow(type, value);
        e.initCause(cause);
        return e;
    }
}
