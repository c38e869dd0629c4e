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

package org.apache.tessera.data.columnar.writable;

import org.apache.tessera.data.columnar.ColumnVector;

/**
 * 可写列向量,分区变换用它构建输出列。
 *
 * <p>两种写入方式:按下标写入({@code setXxx(rowId, value)} / {@link #setNullAt(int)}),用于
 * 多个线程写互不相交的下标;顺序追加({@code appendXxx}),用于逐行构建输入列。
 */
public interface WritableColumnVector extends ColumnVector {

    /** 清空所有值和空值标记,容量不变。 */
    void reset();

    void setNullAt(int rowId);

    default void appendNull() {
        int elementsAppended = getElementsAppended();
        reserve(elementsAppended + 1);
        setNullAt(elementsAppended);
        addElementsAppended(1);
    }

    /** 保证向量至少能容纳 {@code requiredCapacity} 个元素。 */
    void reserve(int requiredCapacity);

    int getElementsAppended();

    void addElementsAppended(int num);
}
