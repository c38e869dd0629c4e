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

import org.apache.tessera.data.columnar.writable.WritableBytesVector;

import java.util.Arrays;

/**
 * 堆内变长字节向量。
 *
 * <p>所有元素的字节连续存放在 {@link #buffer} 中,第 i 个元素位于
 * {@code buffer[start[i], start[i] + length[i])}。写入只能顺序进行。
 */
public class HeapBytesVector extends AbstractHeapVector implements WritableBytesVector {

    private static final long serialVersionUID = 1L;

    private static final int DEFAULT_BYTES_PER_ELEMENT = 16;

    public int[] start;

    public int[] length;

    public byte[] buffer;

    private int bytesAppended;

    public HeapBytesVector(int capacity) {
        super(capacity);
        buffer = new byte[capacity * DEFAULT_BYTES_PER_ELEMENT];
        start = new int[capacity];
        length = new int[capacity];
    }

    @Override
    public void reset() {
        super.reset();
        if (start.length != capacity) {
            start = new int[capacity];
        } else {
            Arrays.fill(start, 0);
        }

        if (length.length != capacity) {
            length = new int[capacity];
        } else {
            Arrays.fill(length, 0);
        }

        // buffer is kept to avoid reallocation
        this.bytesAppended = 0;
    }

    @Override
    public void putByteArray(int elementNum, byte[] sourceBuf, int start, int length) {
        reserveBytes(bytesAppended + length);
        System.arraycopy(sourceBuf, start, buffer, bytesAppended, length);
        this.start[elementNum] = bytesAppended;
        this.length[elementNum] = length;
        bytesAppended += length;
    }

    private void reserveBytes(int newCapacity) {
        if (newCapacity < 0) {
            throw new UnsupportedOperationException(
                    "Byte buffer of vector exceeds " + Integer.MAX_VALUE + " bytes");
        }
        if (newCapacity > buffer.length) {
            int newBytesCapacity = (int) Math.min(Integer.MAX_VALUE, newCapacity * 2L);
            buffer = Arrays.copyOf(buffer, newBytesCapacity);
        }
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (start.length < newCapacity) {
            start = Arrays.copyOf(start, newCapacity);
            length = Arrays.copyOf(length, newCapacity);
        }
    }

    @Override
    public Bytes getBytes(int i) {
        return new Bytes(buffer, start[i], length[i]);
    }
}
