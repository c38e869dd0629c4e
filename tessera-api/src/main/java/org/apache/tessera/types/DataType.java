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

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * 描述 Tessera 中列的逻辑数据类型。
 *
 * <p>每个数据类型都包含以下核心信息:
 * <ul>
 *     <li>类型根(typeRoot): 类型的基本分类,如 INTEGER、VARCHAR、TIMESTAMP 等</li>
 *     <li>可空性(isNullable): 该类型的值是否允许为 null</li>
 *     <li>类型参数: 特定类型的额外参数,如 DECIMAL(10,2) 的精度和标度、TIMESTAMP 的时间单位和偏移</li>
 * </ul>
 *
 * <p>类型集合是封闭的:所有具体类型都在 {@link DataTypeVisitor} 中有一个 {@code visit} 方法。
 * 分区变换以访问者的形式实现,新增一个类型而未在变换中处理时会在编译期暴露出来。
 *
 * <p>使用示例:
 * <pre>{@code
 * DataType date = DataTypes.DATE();
 * DataType ts = DataTypes.TIMESTAMP(TimeUnit.NANOSECOND, "-08:00");
 * DataType dec = DataTypes.DECIMAL(10, 2).notNull();
 * }</pre>
 *
 * @see DataTypes 用于创建各种数据类型的工厂类
 * @see DataTypeVisitor 数据类型访问者接口
 */
@Public
public abstract class DataType implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 标识该类型的值是否可以为 null */
    private final boolean isNullable;

    /** 该类型的根分类 */
    private final DataTypeRoot typeRoot;

    public DataType(boolean isNullable, DataTypeRoot typeRoot) {
        this.isNullable = isNullable;
        this.typeRoot = Preconditions.checkNotNull(typeRoot);
    }

    /** 返回该类型的值是否可以为 {@code null}。 */
    public boolean isNullable() {
        return isNullable;
    }

    /**
     * 返回该类型的根分类。
     *
     * <p>参数化的类型 {@code DECIMAL(12,3)} 拥有其根类型 {@code DECIMAL} 的所有特征。
     */
    public DataTypeRoot getTypeRoot() {
        return typeRoot;
    }

    public boolean is(DataTypeRoot typeRoot) {
        return this.typeRoot == typeRoot;
    }

    public boolean isAnyOf(DataTypeRoot... typeRoots) {
        return Arrays.stream(typeRoots).anyMatch(tr -> this.typeRoot == tr);
    }

    public boolean isAnyOf(DataTypeFamily... typeFamilies) {
        return Arrays.stream(typeFamilies).anyMatch(tf -> this.typeRoot.getFamilies().contains(tf));
    }

    public boolean is(DataTypeFamily family) {
        return typeRoot.getFamilies().contains(family);
    }

    /**
     * 返回该类型单个值的默认大小(字节数),用于输出向量的容量估算。
     *
     * <p>变长类型返回的是估算值。
     */
    public abstract int defaultSize();

    /**
     * 返回该类型的拷贝,可以指定不同的可空性。
     *
     * @param isNullable 复制后类型的目标可空性
     * @return 具有指定可空性的新类型实例
     */
    public abstract DataType copy(boolean isNullable);

    public final DataType copy() {
        return copy(isNullable);
    }

    public DataType notNull() {
        return copy(false);
    }

    public DataType nullable() {
        return copy(true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataType that = (DataType) o;
        return isNullable == that.isNullable && typeRoot == that.typeRoot;
    }

    /** 比较两个数据类型是否相等,忽略可空性属性。 */
    public boolean equalsIgnoreNullable(DataType o) {
        return Objects.equals(this.copy(true), o.copy(true));
    }

    @Override
    public int hashCode() {
        return Objects.hash(isNullable, typeRoot);
    }

    /**
     * 返回该类型的 SQL 风格字符串表示形式,不可空类型带有 {@code NOT NULL} 后缀。
     *
     * <p>示例输出:
     * <pre>
     * INT NOT NULL
     * DECIMAL(10, 2)
     * TIMESTAMP(us, -08:00)
     * </pre>
     */
    public abstract String asSQLString();

    protected String withNullability(String format, Object... params) {
        if (!isNullable) {
            return String.format(format + " NOT NULL", params);
        }
        return String.format(format, params);
    }

    @Override
    public String toString() {
        return asSQLString();
    }

    /**
     * 接受一个数据类型访问者的访问。
     *
     * @param visitor 数据类型访问者
     * @param <R> 访问者返回的结果类型
     * @return 访问者处理该类型后的返回值
     */
    public abstract <R> R accept(DataTypeVisitor<R> visitor);
}
