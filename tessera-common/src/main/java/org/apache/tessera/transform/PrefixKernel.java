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

import org.apache.tessera.data.columnar.BytesColumnVector;
import org.apache.tessera.data.columnar.writable.WritableBytesVector;

/**
 * 输出为输入字节前缀的 {@link RowKernel}。
 *
 * <p>变长输出向量只能顺序追加:并行阶段只计算每行前缀的长度,字节在 {@link #finish(int)} 中
 * 一次性顺序复制。
 */
class PrefixKernel implements RowKernel {

    /** 计算一个值需要保留的前缀字节数。 */
    @FunctionalInterface
    interface PrefixLength {
        int of(byte[] data, int offset, int len);
    }

    private final BytesColumnVector input;
    private final WritableBytesVector output;
    private final PrefixLength prefixLength;
    private final int[] lengths;

    PrefixKernel(
            BytesColumnVector input,
            WritableBytesVector output,
            int size,
            PrefixLength prefixLength) {
        this.input = input;
        this.output = output;
        this.prefixLength = prefixLength;
        this.lengths = new int[size];
    }

    @Override
    public void compute(int row) {
        BytesColumnVector.Bytes bytes = input.getBytes(row);
        lengths[row] = prefixLength.of(bytes.data, bytes.offset, bytes.len);
    }

    @Override
    public void finish(int size) {
        for (int row = 0; row < size; row++) {
            if (!input.isNullAt(row)) {
                BytesColumnVector.Bytes bytes = input.getBytes(row);
                output.putByteArray(row, bytes.data, bytes.offset, lengths[row]);
            }
        }
    }
}
