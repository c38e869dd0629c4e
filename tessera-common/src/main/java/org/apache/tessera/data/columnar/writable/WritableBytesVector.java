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

import org.apache.tessera.data.columnar.BytesColumnVector;

/**
 * 可写变长字节向量。
 *
 * <p>字节按写入顺序追加到同一个缓冲区,因此 {@link #putByteArray} 不能并发调用。
 */
public interface WritableBytesVector extends WritableColumnVector, BytesColumnVector {

    /**
     * 把 {@code value} 中 {@code [start, start + length)} 的字节作为第 {@code rowId} 个元素。
     */
    void putByteArray(int rowId, byte[] value, int start, int length);

    default void appendByteArray(byte[] value, int start, int length) {
        reserve(getElementsAppended() + 1);
        putByteArray(getElementsAppended(), value, start, length);
        addElementsAppended(1);
    }
}
