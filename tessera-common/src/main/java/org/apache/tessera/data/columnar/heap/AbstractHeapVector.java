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

package org.apache.tessera.data.columnar.heap;

import org.apache.tessera.data.columnar.writable.AbstractWritableVector;

import java.util.Arrays;

/**
 * 堆内列向量的基类,用 {@code boolean[]} 记录每个元素是否为空。
 *
 * <p>不同下标的 {@link #setNullAt(int)} 可以由多个线程并发调用;调用方需要在所有写入完成后
 * 建立 happens-before 关系(例如等待 fork-join 任务结束)再读取。
 */
public abstract class AbstractHeapVector extends AbstractWritableVector {

    private static final long serialVersionUID = 1L;

    protected boolean[] isNull;

    public AbstractHeapVector(int capacity) {
        super(capacity);
        isNull = new boolean[capacity];
    }

    @Override
    public void reset() {
        super.reset();
        if (isNull.length != capacity) {
            isNull = new boolean[capacity];
        } else {
            Arrays.fill(isNull, false);
        }
    }

    @Override
    public void setNullAt(int i) {
        isNull[i] = true;
        noNulls = false;
    }

    @Override
    public boolean isNullAt(int i) {
        return !noNulls && isNull[i];
    }

    @Override
    protected void reserveInternal(int newCapacity) {
        if (isNull.length < newCapacity) {
            isNull = Arrays.copyOf(isNull, newCapacity);
        }
        reserveForHeapVector(newCapacity);
    }

    abstract void reserveForHeapVector(int newCapacity);
}
