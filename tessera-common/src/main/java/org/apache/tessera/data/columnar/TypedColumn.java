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

package org.apache.tessera.data.columnar;

import org.apache.tessera.annotation.Public;
import org.apache.tessera.types.DataType;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * 带逻辑类型的列:{@link DataType} + {@link ColumnVector} + 行数。
 *
 * <p>分区变换的输入和输出都是 {@code TypedColumn}。变换从不修改输入列,每次调用都分配新的
 * 输出向量;列本身不提供修改方法,但它不复制底层向量,创建后调用方不应再写入该向量。
 *
 * <pre>{@code
 * TypedColumn ts = ColumnVectors.fromValues(DataTypes.TIMESTAMP(TimeUnit.MILLISECOND),
 *         1512151975038L, null);
 * TypedColumn days = PartitionTransforms.days().apply(ts);
 * }</pre>
 */
@Public
public final class TypedColumn {

    private final DataType type;
    private final ColumnVector vector;
    private final int size;

    public TypedColumn(DataType type, ColumnVector vector, int size) {
        this.type = checkNotNull(type, "type must not be null");
        this.vector = checkNotNull(vector, "vector must not be null");
        checkArgument(
                size >= 0 && size <= vector.getCapacity(),
                "Column size %s is out of the vector capacity %s.",
                size,
                vector.getCapacity());
        this.size = size;
    }

    public DataType type() {
        return type;
    }

    public ColumnVector vector() {
        return vector;
    }

    public int size() {
        return size;
    }

    public boolean isNullAt(int i) {
        return vector.isNullAt(i);
    }

    /**
     * 以 Java 对象返回第 {@code i} 个值,空值返回 {@code null}。对象形式见
     * {@link ColumnVectors#fromValues(DataType, Object...)}。
     */
    @Nullable
    public Object getValue(int i) {
        return ColumnVectors.getValue(this, i);
    }

    public List<Object> toList() {
        List<Object> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(getValue(i));
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TypedColumn that = (TypedColumn) o;
        return size == that.size && type.equals(that.type) && valuesEqual(that);
    }

    private boolean valuesEqual(TypedColumn that) {
        for (int i = 0; i < size; i++) {
            Object left = getValue(i);
            Object right = that.getValue(i);
            if (left instanceof byte[] && right instanceof byte[]) {
                if (!Arrays.equals((byte[]) left, (byte[]) right)) {
                    return false;
                }
            } else if (!Objects.equals(left, right)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, size);
    }

    @Override
    public String toString() {
        return type.asSQLString() + toList();
    }
}
