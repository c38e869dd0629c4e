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

import org.apache.tessera.data.Decimal;
import org.apache.tessera.data.columnar.writable.WritableDecimalVector;

import java.util.Arrays;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/** 堆内定点十进制向量,每个元素保存一个 {@link Decimal} 引用。 */
public class HeapDecimalVector extends AbstractHeapVector implements WritableDecimalVector {

    private static final long serialVersionUID = 1L;

    public Decimal[] vector;

    public HeapDecimalVector(int len) {
        super(len);
        vector = new Decimal[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public Decimal getDecimal(int i, int precision, int scale) {
        Decimal value = vector[i];
        checkArgument(
                value.precision() == precision && value.scale() == scale,
                "Decimal %s at row %s does not have the requested precision %s and scale %s.",
                value,
                i,
                precision,
                scale);
        return value;
    }

    @Override
    public void setDecimal(int i, Decimal value) {
        vector[i] = value;
    }

    @Override
    public void reset() {
        super.reset();
        if (vector.length != capacity) {
            vector = new Decimal[capacity];
        } else {
            Arrays.fill(vector, null);
        }
    }
}
