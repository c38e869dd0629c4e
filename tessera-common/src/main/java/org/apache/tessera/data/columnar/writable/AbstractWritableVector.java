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

import java.io.Serializable;

/** {@link WritableColumnVector} 的公共实现:空值状态、追加计数和容量扩展。 */
public abstract class AbstractWritableVector implements WritableColumnVector, Serializable {

    private static final long serialVersionUID = 1L;

    protected boolean noNulls = true;

    protected int elementsAppended;

    protected int capacity;

    public AbstractWritableVector(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public int getElementsAppended() {
        return elementsAppended;
    }

    @Override
    public final void addElementsAppended(int num) {
        elementsAppended += num;
    }

    @Override
    public int getCapacity() {
        return this.capacity;
    }

    @Override
    public void reset() {
        noNulls = true;
        elementsAppended = 0;
    }

    @Override
    public void reserve(int requiredCapacity) {
        if (requiredCapacity < 0) {
            throw new IllegalArgumentException("Invalid capacity: " + requiredCapacity);
        } else if (requiredCapacity > capacity) {
            int newCapacity = (int) Math.min(Integer.MAX_VALUE, requiredCapacity * 2L);
            try {
                reserveInternal(newCapacity);
            } catch (OutOfMemoryError outOfMemoryError) {
                throw new RuntimeException(
                        "Failed to allocate memory for vector", outOfMemoryError);
            }
            capacity = newCapacity;
        }
    }

    protected abstract void reserveInternal(int newCapacity);
}
